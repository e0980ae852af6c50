package com.factorbot.app;

import com.factorbot.audit.AuditRecorder;
import com.factorbot.audit.AuditStore;
import com.factorbot.audit.InMemoryAuditStore;
import com.factorbot.config.Config;
import com.factorbot.config.EngineSettings;
import com.factorbot.db.AtomicObservationDao;
import com.factorbot.db.Database;
import com.factorbot.db.MigrationRunner;
import com.factorbot.db.PostgresAuditStore;
import com.factorbot.db.PostgresFactorStore;
import com.factorbot.factor.FactorRuleRegistry;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.RunContext;
import com.factorbot.runner.FactorRunOutcome;
import com.factorbot.runner.FactorRunner;
import com.factorbot.writer.FactorStore;
import com.factorbot.writer.InMemoryFactorStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point. Exit codes: 0 success, 1 failed run, 2 usage error.
 */
public final class FactorBotApplication {
    private static final Logger LOG = LogManager.getLogger(FactorBotApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exit = new FactorBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("factorbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("factorbot", options);
            return EXIT_OK;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir).withOverrides(cliOverrides(cmd));

        RunContext context;
        FactorRuleRegistry registry;
        try {
            context = buildContext(cmd, config);
            registry = FactorRuleRegistry.defaults().select(config.getList("run.factors"));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        boolean dryRun = cmd.hasOption("dry-run");
        String input = cmd.getOptionValue("input");
        if (dryRun && input == null) {
            System.err.println("ERROR: --dry-run needs --input, there is no store to load atomics from.");
            return EXIT_USAGE;
        }
        if (cmd.hasOption("ingest") && (dryRun || input == null)) {
            System.err.println("ERROR: --ingest needs --input and a database (not --dry-run).");
            return EXIT_USAGE;
        }

        EngineSettings settings = EngineSettings.from(config);
        try {
            FactorRunOutcome outcome;
            if (dryRun) {
                FactorRunner runner = new FactorRunner(settings, registry, new InMemoryFactorStore(),
                        new AuditRecorder(new InMemoryAuditStore()));
                outcome = runner.run(context, readJsonLines(workingDir.resolve(input)));
            } else {
                Database database = new Database(
                        firstNonBlank(System.getenv("FACTORBOT_DB_URL"), config.getString("db.url")),
                        firstNonBlank(System.getenv("FACTORBOT_DB_USER"), config.getString("db.user")),
                        firstNonBlank(System.getenv("FACTORBOT_DB_PASS"), config.getString("db.pass")),
                        config.getString("db.schema")
                );
                LOG.info("db url={} schema={}", database.maskedJdbcUrl(), database.schema());
                new MigrationRunner().run(database);
                FactorStore store = new PostgresFactorStore(database);
                AuditStore auditStore = new PostgresAuditStore(database);
                AtomicObservationDao atomics = new AtomicObservationDao(database);
                FactorRunner runner = new FactorRunner(settings, registry, store, new AuditRecorder(auditStore));
                if (cmd.hasOption("ingest")) {
                    runner.withAtomicSink(atomics::ingest);
                }
                if (input != null) {
                    outcome = runner.run(context, readJsonLines(workingDir.resolve(input)));
                } else {
                    outcome = runner.runFromSource(context, ctx -> atomics.load(
                            ctx.universe,
                            ctx.dataStart(settings.dataPaddingDays),
                            ctx.runDate
                    ));
                }
            }
            String reportPath = cmd.getOptionValue("report");
            if (reportPath != null) {
                writeReport(workingDir.resolve(reportPath), outcome);
            }
            System.out.println("run_id=" + outcome.audit.runId
                    + " status=" + outcome.status().label()
                    + " rows_written=" + outcome.rowsWritten()
                    + " " + outcome.report.summary());
            return outcome.succeeded() ? EXIT_OK : EXIT_FAILED;
        } catch (IOException e) {
            LOG.error("failed to read input or write report: {}", e.getMessage(), e);
            return EXIT_FAILED;
        } catch (SQLException e) {
            LOG.error("database unavailable: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    static RunContext buildContext(CommandLine cmd, Config config) {
        String rawDate = cmd.getOptionValue("run-date");
        LocalDate runDate = rawDate == null || rawDate.isBlank() ? LocalDate.now() : LocalDate.parse(rawDate.trim());
        String rawFrequency = config.getString("run.frequency", "monthly");
        MetricFrequency frequency = MetricFrequency.fromLabel(rawFrequency);
        if (frequency == MetricFrequency.UNKNOWN) {
            throw new IllegalArgumentException("unsupported frequency: " + rawFrequency);
        }
        int backfillYears = config.getInt("run.backfill_years", 5);
        if (backfillYears < 1) {
            throw new IllegalArgumentException("backfill years must be at least 1: " + backfillYears);
        }
        return new RunContext(null, runDate, frequency, backfillYears, config.getList("run.symbols"));
    }

    static Map<String, String> cliOverrides(CommandLine cmd) {
        Map<String, String> overrides = new LinkedHashMap<>();
        putIfPresent(overrides, "run.backfill_years", cmd.getOptionValue("backfill-years"));
        putIfPresent(overrides, "run.frequency", cmd.getOptionValue("frequency"));
        putIfPresent(overrides, "run.threads", cmd.getOptionValue("threads"));
        putIfPresent(overrides, "run.symbols", cmd.getOptionValue("symbols"));
        putIfPresent(overrides, "run.factors", cmd.getOptionValue("factors"));
        return overrides;
    }

    /**
     * One JSON object per non-blank line. Lines that are not JSON objects are skipped with a warning.
     */
    static List<JSONObject> readJsonLines(Path path) throws IOException {
        List<JSONObject> out = new ArrayList<>();
        int lineNo = 0;
        int skipped = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                out.add(new JSONObject(trimmed));
            } catch (JSONException e) {
                skipped++;
                LOG.warn("input {} line {} is not a JSON object: {}", path.getFileName(), lineNo, e.getMessage());
            }
        }
        LOG.info("stage=read input={} records={} skipped_lines={}", path, out.size(), skipped);
        return out;
    }

    private static void writeReport(Path path, FactorRunOutcome outcome) throws IOException {
        JSONObject root = outcome.report.toJson();
        root.put("run_id", outcome.audit.runId);
        root.put("status", outcome.status().label());
        root.put("rows_written", outcome.rowsWritten());
        root.put("error", outcome.audit.errorMessage);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, root.toString(2), StandardCharsets.UTF_8);
        LOG.info("quality report written to {}", path);
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("run-date").hasArg().argName("yyyy-MM-dd").desc("as-of date of the run (default today)").build());
        options.addOption(Option.builder().longOpt("backfill-years").hasArg().argName("n").desc("years of history to produce").build());
        options.addOption(Option.builder().longOpt("frequency").hasArg().argName("tag").desc("run frequency tag, e.g. monthly").build());
        options.addOption(Option.builder().longOpt("input").hasArg().argName("path").desc("JSON-lines file of atomic observations").build());
        options.addOption(Option.builder().longOpt("symbols").hasArg().argName("A,B").desc("restrict the run to these entities").build());
        options.addOption(Option.builder().longOpt("factors").hasArg().argName("a,b").desc("restrict the run to these factors").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("worker threads for per-entity tasks").build());
        options.addOption(Option.builder().longOpt("report").hasArg().argName("path").desc("write the quality report as JSON").build());
        options.addOption(Option.builder().longOpt("ingest").desc("persist normalized atomics before transforming").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("use in-memory stores instead of the database").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.trim().isEmpty()) {
            target.put(key, value.trim());
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
