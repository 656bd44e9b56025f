package org.carball.probe.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.ModelProbe;
import org.carball.probe.config.ConfigurationLoader;
import org.carball.probe.config.OutputFormat;
import org.carball.probe.config.ProbeConfig;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.engine.ConnectionLostException;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.profile.ProfileReport;
import org.carball.probe.model.profile.TimingSummary;
import org.carball.probe.output.ProbeReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;

@Slf4j
public class ModelProbeCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            Tabular Model Query & Profiling Probe v%s       ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 3 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 3 && !isHelpRequested(args) ? 1 : 0);
        }

        try {
            ProbeConfig config = parseArgs(args);
            ProbeSettings settings = new ConfigurationLoader().loadConfiguration(config.getSettingsFile(), args);
            config.setSettings(settings);
            if (config.getRuns() <= 0) {
                config.setRuns(settings.getDefaultRuns());
            }

            System.out.println("\n🔍 Connecting to model...");
            System.out.println("   Command: " + config.getCommand());
            if (config.getModelFile() != null) {
                System.out.println("   Model definition: " + config.getModelFile());
            }
            if (config.getTraceFile() != null) {
                System.out.println("   Trace file: " + config.getTraceFile());
            }
            System.out.println();

            try (ModelProbe probe = ModelProbe.connect(config.getConnectionString(), config.getModelFile(),
                    config.getTraceFile(), settings)) {

                ProbeReport report;
                if ("profile".equals(config.getCommand())) {
                    System.out.print("⏱️ Profiling query (" + config.getRuns() + " runs)... ");
                    ProfileReport profile = probe.profileQuery(config.getQuery(), config.getRuns(),
                            config.isClearCacheFirst(), settings.getEventTimeoutSeconds());
                    System.out.println("✓");
                    printProfileSummary(profile);
                    report = ProbeReport.forProfile(profile);
                } else {
                    System.out.print("📊 Executing query... ");
                    QueryResult result = probe.executeQuery(config.getQuery(), config.getMaxRows(),
                            config.isBypassCache());
                    System.out.println(result.isSuccess() ? "✓" : "✗");
                    printQuerySummary(result);
                    report = ProbeReport.forQuery(result);
                }

                if (config.getOutputFile() != null) {
                    System.out.print("📝 Writing results... ");
                    outputResults(report, config);
                    System.out.println("✓");
                } else if (config.isVerbose()) {
                    System.out.println(report.toJson());
                }
            }

            System.out.println("\n✅ Done!");

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (ConnectionLostException e) {
            System.err.println("\n❌ Connection lost: " + e.getMessage());
            log.debug("Connection error details", e);
            System.exit(1);
        } catch (IOException | UncheckedIOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar model-probe.jar <query|profile> <connection-string> <query> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  query               Execute a DAX or DMV query (cached)");
        System.out.println("  profile             Run a query several times and break down its timings");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --model-file        Model definition JSON used when introspection is blocked");
        System.out.println("  --trace-file        JSON-lines file written by an engine trace collector");
        System.out.println("  --runs              Profiling runs (default: 3)");
        System.out.println("  --no-clear-cache    Do not clear caches before the first profiling run");
        System.out.println("  --max-rows          Row limit for the query (default: engine default)");
        System.out.println("  --bypass-cache      Skip the result cache");
        System.out.println("  --output, -o        Write the report to this file");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --settings          YAML file with probe settings");
        System.out.println("  --verbose, -v       Print the JSON report to stdout");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar model-probe.jar query \"jdbc:olap:...\" \"INFO.TABLES()\" --model-file model.bim");
        System.out.println("  java -jar model-probe.jar profile \"jdbc:olap:...\" \"EVALUATE Sales\" --trace-file trace.jsonl");
    }

    static ProbeConfig parseArgs(String[] args) {
        ProbeConfig config = new ProbeConfig();
        String command = args[0].toLowerCase(Locale.ROOT);
        if (!command.equals("query") && !command.equals("profile")) {
            throw new IllegalArgumentException("Unknown command: " + args[0] + ". Use: query or profile");
        }
        config.setCommand(command);
        config.setConnectionString(args[1]);
        config.setQuery(args[2]);

        for (int i = 3; i < args.length; i++) {
            switch (args[i]) {
                case "--model-file":
                    config.setModelFile(Paths.get(requireValue(args, i++, "Model definition file")));
                    break;
                case "--trace-file":
                    config.setTraceFile(Paths.get(requireValue(args, i++, "Trace file")));
                    break;
                case "--runs":
                    config.setRuns(parsePositive(requireValue(args, i++, "Run count"), "--runs"));
                    break;
                case "--no-clear-cache":
                    config.setClearCacheFirst(false);
                    break;
                case "--max-rows":
                    config.setMaxRows(parsePositive(requireValue(args, i++, "Row limit"), "--max-rows"));
                    break;
                case "--bypass-cache":
                    config.setBypassCache(true);
                    break;
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file"));
                    break;
                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;
                case "--settings":
                    config.setSettingsFile(Paths.get(requireValue(args, i++, "Settings file")));
                    break;
                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;
                default:
                    if (args[i].startsWith("--settings.")) {
                        // Value is applied by ConfigurationLoader
                        String option = args[i];
                        requireValue(args, i++, option);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String description) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(description + " not specified");
        }
        return args[index + 1];
    }

    private static int parsePositive(String value, String option) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1) {
                throw new IllegalArgumentException(option + " must be at least 1");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    private static void validateConfig(ProbeConfig config) {
        if (config.getQuery() == null || config.getQuery().isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }
        if (config.getModelFile() != null && !Files.exists(config.getModelFile())) {
            throw new IllegalArgumentException("Model definition file not found: " + config.getModelFile());
        }
        if (config.getTraceFile() != null && !Files.exists(config.getTraceFile())) {
            throw new IllegalArgumentException("Trace file not found: " + config.getTraceFile());
        }
        if (config.getSettingsFile() != null && !Files.exists(config.getSettingsFile())) {
            throw new IllegalArgumentException("Settings file not found: " + config.getSettingsFile());
        }
        if (config.getOutputFile() != null) {
            Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
    }

    private static void outputResults(ProbeReport report, ProbeConfig config) throws IOException {
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }
        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void printQuerySummary(QueryResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 QUERY SUMMARY");
        System.out.println("=".repeat(60));
        if (result.isSuccess()) {
            System.out.println("Rows: " + result.getRowCount() + (result.isTruncated() ? " (truncated)" : ""));
            System.out.println("Source: " + result.getSource().getWireName());
            System.out.printf("Elapsed: %.2f ms%n", result.getElapsedMs());
        } else {
            System.out.println("Error (" + result.getErrorKind() + "): " + result.getError());
            result.getSuggestions().forEach(s -> System.out.println("  💡 " + s));
        }
    }

    private static void printProfileSummary(ProfileReport profile) {
        TimingSummary summary = profile.getSummary();
        System.out.println("\n" + "=".repeat(60));
        System.out.println("⏱️ PROFILE SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println("Runs: " + profile.getRuns().size());
        if (summary.getWall() != null) {
            System.out.printf("Wall clock: mean %.2f ms (min %.2f, max %.2f)%n",
                    summary.getWall().mean(), summary.getWall().min(), summary.getWall().max());
        }
        if (summary.isMetricsAvailable()) {
            if (summary.getStorageEngine() != null) {
                System.out.printf("Storage engine: mean %.2f ms%n", summary.getStorageEngine().mean());
            }
            if (summary.getFormulaEngine() != null) {
                System.out.printf("Formula engine: mean %.2f ms%n", summary.getFormulaEngine().mean());
            }
        } else {
            System.out.println("\n💡 Engine breakdown unavailable; timings are wall-clock only.");
        }
    }
}
