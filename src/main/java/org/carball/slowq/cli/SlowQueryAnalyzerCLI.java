package org.carball.slowq.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.analyzer.QueryDiagnostician;
import org.carball.slowq.config.AnalyzerConfig;
import org.carball.slowq.config.ConfigurationLoader;
import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.config.OutputFormat;
import org.carball.slowq.config.ThresholdProfile;
import org.carball.slowq.model.analysis.DiagnosticResult;
import org.carball.slowq.model.analysis.DigestDiagnosis;
import org.carball.slowq.model.analysis.Severity;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.SlowLogEntry;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.schema.DatabaseSchema;
import org.carball.slowq.model.schema.Table;
import org.carball.slowq.output.DiagnosticReport;
import org.carball.slowq.parser.SchemaParser;
import org.carball.slowq.parser.SlowLogParser;
import org.carball.slowq.source.PerformanceSchemaConnector;
import org.carball.slowq.source.SnapshotFileConnector;
import org.carball.slowq.source.SnapshotJsonExporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
public class SlowQueryAnalyzerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            MySQL Slow Query Diagnostics (slowq) v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;
    private static final String DEFAULT_OUTPUT = "slowq-report.json";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one analysis and returns the process exit code.
     */
    public static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        try {
            AnalyzerConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Source: " + describeSource(config));
            if (config.getDdlFile() != null) {
                System.out.println("   Schema DDL: " + config.getDdlFile());
            }
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println("   Thresholds: " + config.getThresholds().getConfigurationSummary());
            System.out.println();

            QueryDiagnostician diagnostician = new QueryDiagnostician(config.getThresholds());
            DiagnosticResult result;

            if (config.getExplainFile() != null) {
                System.out.print("🧭 Analyzing EXPLAIN ANALYZE plan... ");
                result = diagnostician.diagnosePlan(Files.readString(config.getExplainFile()));
                System.out.println("✓");
            } else {
                // Step 1: Collect the snapshot
                System.out.print("📥 Collecting statement statistics... ");
                DiagnosticSnapshot snapshot = loadSnapshot(config);
                System.out.println("✓");

                // Step 2: Merge table definitions
                if (config.getDdlFile() != null) {
                    System.out.print("📐 Parsing schema DDL... ");
                    mergeSchema(snapshot, SchemaParser.parseDDL(config.getDdlFile()));
                    System.out.println("✓");
                }

                if (config.isVerbose()) {
                    printSnapshotDetails(snapshot);
                }

                // Step 3: Export the raw snapshot if requested
                if (config.getExportFile() != null) {
                    System.out.print("💾 Exporting snapshot... ");
                    new SnapshotJsonExporter().export(snapshot, config.getExportFile());
                    System.out.println("✓");
                }

                // Step 4: Diagnose
                System.out.print("🩺 Diagnosing digests... ");
                result = diagnostician.diagnose(snapshot);
                System.out.println("✓");
            }

            // Step 5: Output results
            System.out.print("📝 Writing results... ");
            outputResults(result, config);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Analysis complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }
            if (config.getExportFile() != null) {
                System.out.println("   Snapshot: " + config.getExportFile());
            }
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (SQLException e) {
            System.err.println("\n❌ Database error: " + e.getMessage() + " (SQLState " + e.getSQLState() + ")");
            log.debug("Database error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar slowq.jar <source> [options]");
        System.out.println();
        System.out.println("Sources (exactly one):");
        System.out.println("  --jdbc-url <url>         Live MySQL server, e.g. jdbc:mysql://localhost:3306/");
        System.out.println("  --snapshot-file <file>   JSON snapshot exported earlier with --export");
        System.out.println("  --slow-log <file>        MySQL slow query log");
        System.out.println("  --explain-file <file>    Single EXPLAIN ANALYZE output to analyze on its own");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --user <name>            Database user (live source)");
        System.out.println("  --password <secret>      Database password (or set SLOWQ_PASSWORD env var)");
        System.out.println("  --schema <name>          Only analyze statements of this schema");
        System.out.println("  --ddl <file>             CREATE TABLE / CREATE INDEX script for index checks");
        System.out.println("  --top <n>                Number of digests to diagnose (default: 20)");
        System.out.println("  --explain                Run EXPLAIN ANALYZE for captured SELECT samples (live source)");
        System.out.println("  --reset-digests          Truncate digest statistics after capture (live source)");
        System.out.println("  --export <file>          Write the collected snapshot as JSON");
        System.out.println("  --output, -o <file>      Report file (default: " + DEFAULT_OUTPUT + ")");
        System.out.println("  --format, -f <fmt>       Output format: json|markdown|both (default: json)");
        System.out.println("  --profile <name>         Threshold profile: " + ThresholdProfile.getAvailableProfiles());
        System.out.println("  --thresholds <file>      YAML file with custom thresholds");
        System.out.println("  --thresholds.<key> <n>   Override a single threshold");
        System.out.println("  --verbose, -v            Enable verbose output");
        System.out.println("  --help, -h               Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Diagnose a live server and keep the snapshot");
        System.out.println("  java -jar slowq.jar --jdbc-url jdbc:mysql://db:3306/ --user ops --schema shop --explain --export snap.json");
        System.out.println();
        System.out.println("  # Re-analyze a snapshot offline with stricter thresholds");
        System.out.println("  java -jar slowq.jar --snapshot-file snap.json --profile strict -f both");
        System.out.println();
        System.out.println("  # Analyze a slow query log with table definitions");
        System.out.println("  java -jar slowq.jar --slow-log mysql-slow.log --ddl schema.sql -f markdown");
        System.out.println();
        System.out.println(ThresholdProfile.getProfileHelp());
        System.out.println(ConfigurationLoader.getThresholdHelp());
    }

    static AnalyzerConfig parseArgs(String[] args) {
        AnalyzerConfig config = new AnalyzerConfig();

        // Set defaults
        config.setOutputFile(DEFAULT_OUTPUT);
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        String profileName = null;
        Path thresholdFile = null;
        Integer top = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (ConfigurationLoader.isThresholdArgument(arg)) {
                // Value is applied by ConfigurationLoader
                requireValue(args, i, "Value for " + arg);
                i++;
                continue;
            }

            switch (arg) {
                case "--jdbc-url":
                    config.setJdbcUrl(requireValue(args, i++, "JDBC URL"));
                    break;

                case "--snapshot-file":
                    config.setSnapshotFile(Paths.get(requireValue(args, i++, "Snapshot file")));
                    break;

                case "--slow-log":
                    config.setSlowLogFile(Paths.get(requireValue(args, i++, "Slow log file")));
                    break;

                case "--explain-file":
                    config.setExplainFile(Paths.get(requireValue(args, i++, "EXPLAIN file")));
                    break;

                case "--user":
                    config.setUser(requireValue(args, i++, "User"));
                    break;

                case "--password":
                    config.setPassword(requireValue(args, i++, "Password"));
                    break;

                case "--schema":
                    config.setSchemaFilter(requireValue(args, i++, "Schema"));
                    break;

                case "--ddl":
                    config.setDdlFile(Paths.get(requireValue(args, i++, "DDL file")));
                    break;

                case "--top":
                    String value = requireValue(args, i++, "Digest count");
                    try {
                        top = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid digest count: " + value);
                    }
                    if (top <= 0) {
                        throw new IllegalArgumentException("Digest count must be positive: " + value);
                    }
                    break;

                case "--explain":
                    config.setRunExplain(true);
                    break;

                case "--reset-digests":
                    config.setResetDigests(true);
                    break;

                case "--export":
                    config.setExportFile(Paths.get(requireValue(args, i++, "Export file")));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--profile":
                    profileName = requireValue(args, i++, "Profile name");
                    break;

                case "--thresholds":
                    thresholdFile = Paths.get(requireValue(args, i++, "Threshold config file"));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        DiagnosticThresholds thresholds = new ConfigurationLoader()
                .loadConfigurationWithProfile(profileName, args, thresholdFile);
        if (top != null) {
            thresholds = thresholds.toBuilder().topDigests(top).build();
        }
        config.setThresholds(thresholds);

        if (config.getPassword() == null) {
            config.setPassword(System.getenv("SLOWQ_PASSWORD"));
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        validateConfig(config);

        return config;
    }

    private static String requireValue(String[] args, int index, String what) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index + 1];
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

    private static void validateConfig(AnalyzerConfig config) {
        long sources = Stream.of(config.getJdbcUrl(), config.getSnapshotFile(), config.getSlowLogFile())
                .filter(Objects::nonNull)
                .count();

        if (config.getExplainFile() != null) {
            if (sources > 0) {
                throw new IllegalArgumentException("--explain-file cannot be combined with another source");
            }
            requireFile(config.getExplainFile(), "EXPLAIN file");
        } else if (sources == 0) {
            throw new IllegalArgumentException("A source is required: --jdbc-url, --snapshot-file or --slow-log");
        } else if (sources > 1) {
            throw new IllegalArgumentException("Only one source may be given: --jdbc-url, --snapshot-file or --slow-log");
        }

        if (config.getJdbcUrl() != null && !config.getJdbcUrl().startsWith("jdbc:mysql:")) {
            throw new IllegalArgumentException("JDBC URL must start with jdbc:mysql: " + config.getJdbcUrl());
        }
        if (!config.isLiveSource() && (config.isRunExplain() || config.isResetDigests())) {
            throw new IllegalArgumentException("--explain and --reset-digests require --jdbc-url");
        }

        if (config.getSnapshotFile() != null) {
            requireFile(config.getSnapshotFile(), "Snapshot file");
        }
        if (config.getSlowLogFile() != null) {
            requireFile(config.getSlowLogFile(), "Slow log file");
        }
        if (config.getDdlFile() != null) {
            requireFile(config.getDdlFile(), "DDL file");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
        if (config.getExportFile() != null) {
            Path exportDir = config.getExportFile().getParent();
            if (exportDir != null && !Files.exists(exportDir)) {
                throw new IllegalArgumentException("Export directory does not exist: " + exportDir);
            }
        }
    }

    private static void requireFile(Path path, String what) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException(what + " not found: " + path);
        }
    }

    private static String describeSource(AnalyzerConfig config) {
        if (config.getExplainFile() != null) {
            return "EXPLAIN file " + config.getExplainFile();
        } else if (config.isLiveSource()) {
            return "performance_schema at " + config.getJdbcUrl()
                    + (config.getSchemaFilter() != null ? " (schema " + config.getSchemaFilter() + ")" : "");
        } else if (config.getSnapshotFile() != null) {
            return "snapshot file " + config.getSnapshotFile();
        }
        return "slow query log " + config.getSlowLogFile();
    }

    private static DiagnosticSnapshot loadSnapshot(AnalyzerConfig config) throws IOException, SQLException {
        int limit = config.getThresholds().getTopDigests();

        if (config.isLiveSource()) {
            PerformanceSchemaConnector connector =
                    new PerformanceSchemaConnector(config.getJdbcUrl(), config.getUser(), config.getPassword());
            DiagnosticSnapshot snapshot = connector.captureSnapshot(config.getSchemaFilter(), limit, config.isRunExplain());
            if (config.isResetDigests()) {
                connector.resetDigestStatistics();
            }
            return snapshot;
        }

        if (config.getSnapshotFile() != null) {
            DiagnosticSnapshot snapshot = new SnapshotFileConnector(config.getSnapshotFile()).toSnapshot();
            snapshot.setDigests(filterBySchema(snapshot.getDigests(), config.getSchemaFilter()));
            return snapshot;
        }

        List<SlowLogEntry> entries = SlowLogParser.parse(config.getSlowLogFile());
        List<DigestStatement> digests = filterBySchema(SlowLogParser.aggregate(entries), config.getSchemaFilter());
        if (digests.isEmpty()) {
            log.warn("No statements found in slow query log {}", config.getSlowLogFile());
        }

        SnapshotMetadata metadata = new SnapshotMetadata(
                "unknown",
                LocalDateTime.now(),
                config.getSchemaFilter(),
                false,
                digests.size(),
                SnapshotMetadata.SOURCE_SLOW_LOG);

        return DiagnosticSnapshot.builder()
                .metadata(metadata)
                .digests(digests)
                .build();
    }

    private static List<DigestStatement> filterBySchema(List<DigestStatement> digests, String schema) {
        if (schema == null) {
            return digests;
        }
        return digests.stream()
                .filter(d -> d.schemaName() == null || schema.equalsIgnoreCase(d.schemaName()))
                .collect(Collectors.toList());
    }

    /**
     * Tables from the DDL script fill in whatever the snapshot did not capture.
     */
    static void mergeSchema(DiagnosticSnapshot snapshot, DatabaseSchema ddlSchema) {
        DatabaseSchema target = snapshot.getSchema();
        for (Table table : ddlSchema.getTables()) {
            Table existing = target.findTable(table.getName());
            if (existing == null) {
                target.addTable(table);
            } else if (existing.getIndexes().isEmpty()) {
                table.getIndexes().forEach(existing::addIndex);
            }
        }
        log.debug("Schema now has {} tables after DDL merge", target.getTables().size());
    }

    private static void printSnapshotDetails(DiagnosticSnapshot snapshot) {
        System.out.println("     - Digests: " + snapshot.getDigests().size());
        System.out.println("     - Index usage rows: " + snapshot.getIndexUsage().size());
        System.out.println("     - Tables with definitions: " + snapshot.getSchema().getTables().size());
        System.out.println("     - EXPLAIN plans: " + snapshot.getExplainPlans().size());
        long executions = snapshot.getDigests().stream().mapToLong(DigestStatement::execCount).sum();
        System.out.println("     - Total executions: " + String.format("%,d", executions));
    }

    private static void outputResults(DiagnosticResult result, AnalyzerConfig config) throws IOException {
        DiagnosticReport report = new DiagnosticReport(result);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(DiagnosticResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 DIAGNOSTIC SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nDigests diagnosed: " + result.getDiagnoses().size());
        System.out.println("Index findings: " + result.getIndexFindings().size());

        Map<Severity, Long> counts = result.countBySeverity();
        System.out.println("\nSeverity breakdown:");
        System.out.println("  🔴 Critical: " + counts.getOrDefault(Severity.CRITICAL, 0L));
        System.out.println("  🟠 High: " + counts.getOrDefault(Severity.HIGH, 0L));
        System.out.println("  🟡 Medium: " + counts.getOrDefault(Severity.MEDIUM, 0L));
        System.out.println("  🟢 Low/Info: " + (counts.getOrDefault(Severity.LOW, 0L) + counts.getOrDefault(Severity.INFO, 0L)));

        System.out.println("\n🎯 Top Digests:");
        System.out.println("-".repeat(60));

        result.getDiagnoses().stream()
                .limit(3)
                .forEach(diagnosis -> {
                    DigestStatement statement = diagnosis.getStatement();
                    System.out.printf("%-8s score %3d  %,.1f ms total%n",
                            diagnosis.getSeverity(), diagnosis.getScore(), statement.totalLatencyMs());
                    System.out.printf("  └─ %s%n", abbreviate(statement.digestText()));
                    firstFindingTitle(diagnosis).ifPresent(title -> System.out.printf("  └─ %s%n", title));
                    System.out.println();
                });

        if (result.getDiagnoses().isEmpty()) {
            System.out.println("\n💡 No statement digests met the analysis criteria.");
        }
    }

    private static Optional<String> firstFindingTitle(DigestDiagnosis diagnosis) {
        return diagnosis.getFindings().stream()
                .findFirst()
                .map(f -> f.getType().getTitle() + ": " + f.getMessage());
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ");
        return flat.length() > 70 ? flat.substring(0, 70) + "..." : flat;
    }
}
