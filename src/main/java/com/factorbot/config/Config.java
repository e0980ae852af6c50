package com.factorbot.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, then classpath
 * {@code config.properties}, then {@code config.properties} in the working
 * directory, then explicit overrides.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties localProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.localProps.load(in);
                config.props.putAll(config.localProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Defaults only, plus the given values. Used by tests and embedded callers.
     */
    public static Config of(Map<String, String> values) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        return config.withOverrides(values);
    }

    /**
     * Applies explicit overrides (for example from the command line) on top of
     * every other layer. Blank values are ignored.
     */
    public Config withOverrides(Map<String, String> overrides) {
        if (overrides == null) {
            return this;
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().trim();
            String value = entry.getValue() == null ? "" : entry.getValue().trim();
            if (key.isEmpty() || value.isEmpty()) {
                continue;
            }
            overrideProps.setProperty(key, value);
            props.setProperty(key, value);
        }
        return this;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    /**
     * Which layer supplied the effective value: override, local, resource or default.
     */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(localProps.getProperty(key)).isEmpty()) {
            return "local";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("db.url", "jdbc:postgresql://localhost:5432/factorbot");
        defaults.put("db.user", "factorbot");
        defaults.put("db.pass", "factorbot");
        defaults.put("db.schema", "systematic_equity");

        defaults.put("run.threads", "4");
        defaults.put("run.backfill_years", "5");
        defaults.put("run.frequency", "monthly");
        defaults.put("run.include_run_date", "true");

        defaults.put("align.price.fallback_trading_days", "3");
        defaults.put("align.price.stale_after_trading_days", "1");
        defaults.put("align.fundamental.max_lookback_days", "730");
        defaults.put("align.data_padding_days", "370");

        defaults.put("quality.financial.soft_days", "270");
        defaults.put("quality.financial.hard_days", "365");
        defaults.put("quality.pb.cap_percentile", "0.99");
        defaults.put("quality.pb.min_sample", "50");
        defaults.put("quality.pb.fixed_cap", "100.0");

        defaults.put("rolling.sentiment.window_days", "30");
        defaults.put("rolling.momentum.window", "20");
        defaults.put("rolling.volatility.window", "20");
        defaults.put("dividend.ttm_days", "365");

        defaults.put("writer.batch_size", "500");

        return Collections.unmodifiableMap(defaults);
    }
}
