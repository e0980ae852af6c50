package com.factorbot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void getters_shouldFallBackToBuiltInDefaults() {
        Config config = Config.of(Map.of());

        assertEquals(4, config.getInt("run.threads"));
        assertEquals(0.99, config.getDouble("quality.pb.cap_percentile"), 1e-12);
        assertTrue(config.getBoolean("run.include_run_date"));
        assertEquals("systematic_equity", config.getString("db.schema"));
        assertEquals("default", config.sourceOf("run.threads"));
        assertTrue(config.getList("run.symbols").isEmpty());
    }

    @Test
    void withOverrides_shouldWinOverLocalFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("config.properties"),
                "run.threads=2\nrun.symbols=aapl; msft ,\nrun.backfill_years=3\n", StandardCharsets.UTF_8);

        Config config = Config.load(dir).withOverrides(Map.of("run.threads", "8", "run.frequency", " "));

        assertEquals(8, config.getInt("run.threads"));
        assertEquals("override", config.sourceOf("run.threads"));
        assertEquals(3, config.getInt("run.backfill_years"));
        assertEquals("local", config.sourceOf("run.backfill_years"));
        assertEquals(List.of("aapl", "msft"), config.getList("run.symbols"));
        assertEquals("monthly", config.getString("run.frequency"));
    }

    @Test
    void getInt_shouldUseFallbackForUnparseableValue() {
        Config config = Config.of(Map.of("writer.batch_size", "lots"));

        assertEquals(500, config.getInt("writer.batch_size"));
        assertFalse(config.getBoolean("no.such.key"));
        assertThrows(IllegalArgumentException.class, () -> config.requireString("no.such.key"));
    }

    @Test
    void engineSettings_shouldReadThresholdsAndKeepHardAboveSoft() {
        EngineSettings defaults = EngineSettings.defaults();
        EngineSettings tuned = EngineSettings.from(Config.of(Map.of(
                "quality.financial.soft_days", "300",
                "quality.financial.hard_days", "200",
                "quality.pb.cap_percentile", "1.5",
                "writer.batch_size", "0"
        )));

        assertEquals(270, defaults.financialSoftDays);
        assertEquals(365, defaults.financialHardDays);
        assertEquals(3, defaults.priceFallbackTradingDays);
        assertEquals(30, defaults.sentimentWindowDays);
        assertEquals(300, tuned.financialHardDays);
        assertEquals(1.0, tuned.capPercentile, 1e-12);
        assertEquals(1, tuned.writerBatchSize);
    }
}
