package org.carball.iolatency.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.analyzer.DiskLatencyReporter;
import org.carball.iolatency.analyzer.FileIoProfiler;
import org.carball.iolatency.analyzer.LatencyClassifier;
import org.carball.iolatency.config.*;
import org.carball.iolatency.model.snapshot.*;
import org.carball.iolatency.output.FileProfileReport;
import org.carball.iolatency.output.LatencyReport;
import org.carball.iolatency.source.*;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
public class DiskLatencyCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION_ERROR = 1;
    static final int EXIT_SOURCE_FAILURE = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          SQL Server Disk Latency Analyzer v%s               ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final List<String> COMMANDS = List.of("report", "collect", "export", "profile");

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_CONFIGURATION_ERROR : EXIT_OK;
        }

        try {
            AnalyzerConfig config = parseArgs(args, env);
            if (config.isVerbose()) {
                ((Logger) LoggerFactory.getLogger("org.carball.iolatency")).setLevel(Level.DEBUG);
            }

            switch (config.getCommand()) {
                case "report" -> runReport(args, config);
                case "collect" -> runCollect(config);
                case "export" -> runExport(args, config);
                case "profile" -> runProfile(config);
                default -> throw new IllegalArgumentException("Unknown command: " + config.getCommand());
            }
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_CONFIGURATION_ERROR;
        } catch (CounterSourceException e) {
            System.err.println("\n❌ Counter source error: " + e.getMessage());
            log.debug("Counter source error details", e);
            return EXIT_SOURCE_FAILURE;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_SOURCE_FAILURE;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar disk-latency-analyzer.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  report              Disk latency per snapshot interval, database and file type");
        System.out.println("  collect             Append the current file counters to dbo.reportDiskLatency");
        System.out.println("  export              Write stored snapshots to a JSON export file");
        System.out.println("  profile             Per-file I/O profile of the live counters with latency status");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --mode              historical|current (default: historical)");
        System.out.println("  --hours             Hours to look back in historical mode (default: 24)");
        System.out.println("  --database          Only report this database");
        System.out.println("  --file-type         data|log|all (default: all)");
        System.out.println("  --connection        JDBC URL of the archive database (or set IOLAT_CONNECTION env var)");
        System.out.println("  --snapshot-file     JSON snapshot export to read instead of the database");
        System.out.println("  --output, -o        Output file (default: print to console)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: markdown)");
        System.out.println("  --thresholds        YAML file with latency thresholds (profile status, report summary)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  # Last 48 hours of data file latency for one database");
        System.out.println("  java -jar disk-latency-analyzer.jar report --hours 48 --database Sales --file-type data");
        System.out.println();
        System.out.println("  # Latency since engine start, straight from the live counters");
        System.out.println("  java -jar disk-latency-analyzer.jar report --mode current");
        System.out.println();
        System.out.println("  # Report from an exported snapshot file");
        System.out.println("  java -jar disk-latency-analyzer.jar report --snapshot-file snapshots.json -o report.md");
    }

    static AnalyzerConfig parseArgs(String[] args, Map<String, String> env) {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setCommand(args[0].toLowerCase());
        if (!COMMANDS.contains(config.getCommand())) {
            throw new IllegalArgumentException("Unknown command: " + args[0] + ". Use one of " + COMMANDS);
        }

        config.setOutputFormat(OutputFormat.MARKDOWN);
        config.setConnectionString(env.get("IOLAT_CONNECTION"));
        config.setVerbose(false);
        config.setSettings(new ConfigurationLoader(env).loadSettings(args));

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--connection":
                    config.setConnectionString(requireValue(args, i++, "Connection string not specified"));
                    break;

                case "--snapshot-file":
                    config.setSnapshotFile(requireValue(args, i++, "Snapshot export file not specified"));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--thresholds":
                    config.setThresholdsFile(requireValue(args, i++, "Threshold file not specified"));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                case "--mode":
                case "--hours":
                case "--database":
                case "--file-type":
                    // Request values, read by buildRequest()
                    String requestOption = args[i];
                    requireValue(args, i++, "Value not specified for " + requestOption);
                    break;

                default:
                    if (args[i].startsWith("--settings.")) {
                        // Read by ConfigurationLoader
                        String settingsOption = args[i];
                        requireValue(args, i++, "Value not specified for " + settingsOption);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (config.getOutputFormat() == OutputFormat.BOTH && config.getOutputFile() == null) {
            throw new IllegalArgumentException("Output format 'both' requires --output");
        }
        if (config.getOutputFile() != null) {
            Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }

        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static String optionValue(String[] args, String option) {
        for (int i = 1; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    static ReportRequest buildRequest(String[] args) {
        String mode = optionValue(args, "--mode");
        String hours = optionValue(args, "--hours");

        Integer lookbackHours = null;
        if (hours != null) {
            try {
                lookbackHours = Integer.parseInt(hours.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number of hours: " + hours);
            }
        }

        return ReportRequest.builder()
                .mode(mode != null ? AnalysisMode.fromName(mode) : AnalysisMode.HISTORICAL)
                .lookbackHours(lookbackHours)
                .databaseName(optionValue(args, "--database"))
                .roleFilter(RoleFilter.fromName(optionValue(args, "--file-type")))
                .build();
    }

    static CounterSource openCounterSource(AnalyzerConfig config) throws CounterSourceException {
        return openCounterSource(config, config.getSettings());
    }

    static CounterSource openCounterSource(AnalyzerConfig config, AnalyzerSettings settings)
            throws CounterSourceException {
        if (config.getSnapshotFile() != null) {
            return new SnapshotFileSource(config.getSnapshotFile());
        }
        if (config.getConnectionString() != null) {
            return new JdbcCounterSource(config.getConnectionString(), settings);
        }
        return null;
    }

    /**
     * The file profile covers every database, system databases included.
     */
    static AnalyzerSettings profileSettings(AnalyzerSettings settings) {
        return settings.toBuilder().includeSystemDatabases(true).build();
    }

    static LocalDateTime currentTime(CounterSource source) throws CounterSourceException {
        LocalDateTime sourceTime = source.readCurrentTime();
        return sourceTime != null ? sourceTime : LocalDateTime.now();
    }

    static long countAboveThresholds(List<AggregatedMetric> rows, LatencyClassifier classifier) {
        return rows.stream()
                .filter(r -> classifier.classify(r) != PerformanceStatus.OK)
                .count();
    }

    private static void runReport(String[] args, AnalyzerConfig config) throws CounterSourceException, IOException {
        ReportRequest request = buildRequest(args);
        DiskLatencyReporter reporter = new DiskLatencyReporter(openCounterSource(config), config.getSettings());

        System.out.println("\n🔍 Building " + request.getMode().name().toLowerCase() + " disk latency report...");
        LatencyReportResult result = reporter.report(request);

        LatencyReport report = new LatencyReport(result);
        writeOutput(config, report.toJson(), report.toMarkdown());
        printSummary(result, new LatencyClassifier(LatencyThresholds.load(config.getThresholdsFile())));
    }

    private static void runCollect(AnalyzerConfig config) throws CounterSourceException {
        if (config.getConnectionString() == null) {
            throw new IllegalArgumentException("collect requires --connection or the IOLAT_CONNECTION env var");
        }

        System.out.print("\n📥 Capturing file counters... ");
        CaptureReceipt receipt = new SnapshotCollector(config.getConnectionString(), config.getSettings()).collect();
        System.out.println("✓");
        System.out.printf("   Records inserted: %,d%n", receipt.rowsInserted());
        System.out.printf("   Snapshot time: %s%n", receipt.capturedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    }

    private static void runExport(String[] args, AnalyzerConfig config) throws CounterSourceException, IOException {
        if (config.getOutputFile() == null) {
            throw new IllegalArgumentException("export requires --output");
        }
        CounterSource source = openCounterSource(config);
        if (source == null) {
            throw new IllegalArgumentException("export requires --connection or --snapshot-file");
        }

        ReportRequest request = buildRequest(args);
        int hours = request.getLookbackHours() != null ? request.getLookbackHours()
                : config.getSettings().getDefaultLookbackHours();
        if (hours <= 0) {
            throw new IllegalArgumentException("Lookback hours must be a positive number: " + hours);
        }

        LocalDateTime to = currentTime(source);
        System.out.print("\n📤 Exporting snapshots... ");
        SnapshotWindow window = source.readWindow(to.minusHours(hours), to);
        new SnapshotJsonExporter().exportToJson(window, source.readCurrent(), source.readEngineStartTime(),
                config.getOutputFile(), databaseLabel(config));
        System.out.println("✓");
        System.out.println("   Output file: " + config.getOutputFile());
    }

    private static void runProfile(AnalyzerConfig config) throws CounterSourceException, IOException {
        CounterSource source = openCounterSource(config, profileSettings(config.getSettings()));
        if (source == null) {
            throw new IllegalArgumentException("profile requires --connection or --snapshot-file");
        }

        LatencyThresholds thresholds = LatencyThresholds.load(config.getThresholdsFile());
        log.info("Using {}", thresholds.getDescription());

        FileIoProfiler profiler = new FileIoProfiler(new LatencyClassifier(thresholds));
        List<FileIoProfile> profiles = profiler.profile(source.readCurrent(), source.readEngineStartTime(),
                currentTime(source));

        FileProfileReport report = new FileProfileReport(profiles);
        writeOutput(config, report.toJson(), report.toMarkdown());
    }

    private static String databaseLabel(AnalyzerConfig config) {
        if (config.getSnapshotFile() != null) {
            return Paths.get(config.getSnapshotFile()).getFileName().toString();
        }
        String url = config.getConnectionString();
        int start = url.toLowerCase().indexOf("databasename=");
        if (start < 0) {
            return "unknown";
        }
        int end = url.indexOf(';', start);
        return url.substring(start + "databaseName=".length(), end < 0 ? url.length() : end);
    }

    private static void writeOutput(AnalyzerConfig config, String json, String markdown) throws IOException {
        if (config.getOutputFile() == null) {
            System.out.println();
            System.out.println(config.getOutputFormat() == OutputFormat.JSON ? json : markdown);
            return;
        }

        String baseFileName = removeFileExtension(config.getOutputFile());
        switch (config.getOutputFormat()) {
            case JSON -> Files.writeString(Paths.get(config.getOutputFile()), json);
            case MARKDOWN -> Files.writeString(Paths.get(config.getOutputFile()), markdown);
            case BOTH -> {
                Files.writeString(Paths.get(baseFileName + ".json"), json);
                Files.writeString(Paths.get(baseFileName + ".md"), markdown);
            }
        }
        System.out.println("   Output written to: " + (config.getOutputFormat() == OutputFormat.BOTH
                ? baseFileName + ".json, " + baseFileName + ".md" : config.getOutputFile()));
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void printSummary(LatencyReportResult result, LatencyClassifier classifier) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 REPORT SUMMARY");
        System.out.println("=".repeat(60));

        List<AggregatedMetric> rows = result.rows();
        long activeRows = rows.stream().filter(r -> r.getTotalReads() + r.getTotalWrites() > 0).count();
        long databases = rows.stream().map(AggregatedMetric::getDatabaseName).distinct().count();

        System.out.println("\nRows: " + rows.size() + " (" + activeRows + " with I/O)");
        System.out.println("Databases: " + databases);
        System.out.println("Rows above latency thresholds: " + countAboveThresholds(rows, classifier));
        if (result.mode() == AnalysisMode.CURRENT) {
            System.out.println("Counters: cumulative since engine start");
        }

        rows.stream()
                .filter(r -> r.getTotalReads() + r.getTotalWrites() > 0)
                .max((a, b) -> Long.compare(a.getAvgTotalLatencyMs(), b.getAvgTotalLatencyMs()))
                .ifPresent(worst -> System.out.printf("Highest average latency: %d ms (%s, %s)%n",
                        worst.getAvgTotalLatencyMs(), worst.getDatabaseName(), worst.getFileRole().getDisplayName()));

        if (rows.isEmpty()) {
            System.out.println("\n💡 No snapshot data matched the request.");
        }
    }
}
