package io.ledger.core;

import io.ledger.core.csv.CsvAccountSink;
import io.ledger.core.csv.CsvTransactionSource;
import io.ledger.core.engine.EngineConfig;
import io.ledger.core.engine.LedgerEngine;
import io.ledger.core.engine.LedgerReplayer;
import io.ledger.core.engine.ReplaySummary;
import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.protocol.AccountSink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        EngineConfig config = options.toConfig();
        configureLogging(config.logLevel);

        Path input = options.input().toAbsolutePath().normalize();
        if (!Files.isReadable(input)) {
            System.err.println("Error: cannot read " + input);
            System.exit(2);
        }

        LedgerMetrics metrics = new LedgerMetrics();
        LedgerEngine engine = LedgerEngine.inMemory();
        ReplaySummary summary = run(input, engine, metrics, config);
        LOG.info("Processed " + input + ": " + summary + ", " + engine.ledger().accountCount() + " accounts");

        if (config.printMetrics) {
            System.err.print("=== Metrics ===\n" + metrics.scrape());
        }
    }

    static ReplaySummary run(Path input, LedgerEngine engine, LedgerMetrics metrics, EngineConfig config) throws IOException {
        ReplaySummary summary;
        try (CsvTransactionSource source = CsvTransactionSource.open(input, config.scale)) {
            summary = LedgerReplayer.replay(source, engine, metrics);
        }

        if (config.output != null) {
            Path parent = config.output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(config.output, StandardCharsets.UTF_8)) {
                writeAccounts(new CsvAccountSink(out, config.scale), engine);
            }
        } else {
            Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            writeAccounts(new CsvAccountSink(out, config.scale), engine);
        }
        return summary;
    }

    private static void writeAccounts(AccountSink sink, LedgerEngine engine) throws IOException {
        sink.write(engine.snapshot());
    }

    static void configureLogging(Level level) {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path input,
            Path output,
            int scale,
            Level logLevel,
            boolean printMetrics
    ) {
        static CliOptions parse(String[] args) {
            EngineConfig defaults = EngineConfig.defaults();
            Path input = null;
            Path output = envPath("LEDGER_OUTPUT", null);
            int scale = defaults.scale;
            Level logLevel = defaults.logLevel;
            boolean printMetrics = false;
            boolean showHelp = false;
            String error = null;

            String scaleEnv = System.getenv("LEDGER_SCALE");
            if (scaleEnv != null && !scaleEnv.isBlank()) {
                try {
                    scale = parseScale(scaleEnv, "LEDGER_SCALE");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }
            String levelEnv = System.getenv("LEDGER_LOG_LEVEL");
            if (levelEnv != null && !levelEnv.isBlank()) {
                try {
                    logLevel = parseLevel(levelEnv, "LEDGER_LOG_LEVEL");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--output=")) {
                        output = Path.of(arg.substring("--output=".length()));
                    } else if (arg.startsWith("--scale=")) {
                        try {
                            scale = parseScale(arg.substring("--scale=".length()), "--scale");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--log-level=")) {
                        try {
                            logLevel = parseLevel(arg.substring("--log-level=".length()), "--log-level");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--metrics")) {
                        printMetrics = true;
                    } else if (!arg.startsWith("--")) {
                        if (input == null) {
                            input = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unexpected argument: " + arg;
                        }
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (input == null && !showHelp) {
                showHelp = true;
                error = "Missing input file";
            }

            return new CliOptions(
                    showHelp,
                    error,
                    input,
                    output,
                    scale,
                    logLevel,
                    printMetrics
            );
        }

        EngineConfig toConfig() {
            return new EngineConfig(scale, logLevel, output, printMetrics);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: java-ledger [options] <transactions.csv>

Replays the transactions in the CSV file and prints the final accounts as CSV.

Options:
  --help, -h                 Show this help message and exit
  --output=<path>            Write the accounts CSV to a file instead of stdout
  --scale=<n>                Decimal places for amounts (default 4, max 18)
  --log-level=<level>        java.util.logging level for diagnostics on stderr (default WARNING)
  --metrics                  Print counters to stderr after the run

Environment overrides:
  LEDGER_OUTPUT              Default for --output
  LEDGER_SCALE               Default for --scale
  LEDGER_LOG_LEVEL           Default for --log-level
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parseScale(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed < 0 || parsed > EngineConfig.MAX_SCALE) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static Level parseLevel(String value, String flag) {
            try {
                return Level.parse(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
