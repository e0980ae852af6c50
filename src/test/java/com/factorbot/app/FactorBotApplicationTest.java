package com.factorbot.app;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactorBotApplicationTest {

    @Test
    void run_shouldReturnZeroForHelp() {
        assertEquals(FactorBotApplication.EXIT_OK, new FactorBotApplication().run(new String[]{"--help"}));
    }

    @Test
    void run_shouldReturnUsageErrorForBadArguments() {
        FactorBotApplication app = new FactorBotApplication();

        assertEquals(FactorBotApplication.EXIT_USAGE, app.run(new String[]{"--run-date", "31/12/2023", "--dry-run", "--input", "x"}));
        assertEquals(FactorBotApplication.EXIT_USAGE, app.run(new String[]{"--dry-run"}));
        assertEquals(FactorBotApplication.EXIT_USAGE, app.run(new String[]{"--factors", "alpha_42", "--dry-run", "--input", "x"}));
        assertEquals(FactorBotApplication.EXIT_USAGE, app.run(new String[]{"--frequency", "hourly", "--dry-run", "--input", "x"}));
        assertEquals(FactorBotApplication.EXIT_USAGE, app.run(new String[]{"--no-such-option"}));
    }

    @Test
    void run_shouldWriteReportForDryRun(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("atomics.jsonl");
        Files.writeString(input, String.join("\n",
                "{\"entity_id\":\"ACME\",\"observation_date\":\"2023-03-31\",\"metric_name\":\"total_debt\",\"value\":120,\"metric_frequency\":\"quarterly\"}",
                "{\"entity_id\":\"ACME\",\"observation_date\":\"2023-03-31\",\"metric_name\":\"book_value\",\"value\":100,\"metric_frequency\":\"quarterly\"}",
                "",
                "{\"entity_id\":\"ACME\",\"observation_date\":\"2023-03-31\""
        ), StandardCharsets.UTF_8);
        Path report = dir.resolve("out/report.json");

        int exit = new FactorBotApplication().run(new String[]{
                "--dry-run",
                "--input", input.toString(),
                "--run-date", "2023-12-29",
                "--backfill-years", "1",
                "--factors", "debt_to_equity",
                "--report", report.toString()
        });

        assertEquals(FactorBotApplication.EXIT_OK, exit);
        JSONObject json = new JSONObject(Files.readString(report, StandardCharsets.UTF_8));
        assertEquals("success", json.getString("status"));
        assertEquals(4, json.getInt("rows_written"));
        assertEquals(2, json.getJSONObject("normalize").getInt("normalized_records"));
        assertEquals(1, json.getJSONObject("quality").getJSONObject("flag_counts").getInt("financial_stale"));
    }

    @Test
    void readJsonLines_shouldSkipBlankAndInvalidLines(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("atomics.jsonl");
        Files.writeString(input, "{\"a\":1}\n\nnot json\n[1,2]\n{\"b\":2}\n", StandardCharsets.UTF_8);

        List<JSONObject> records = FactorBotApplication.readJsonLines(input);

        assertEquals(2, records.size());
        assertTrue(records.get(1).has("b"));
    }
}
