package org.carball.slowq.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

@Slf4j
public class ConfigurationLoader {

    private static final String CLI_PREFIX = "--thresholds.";
    private static final String ENV_PREFIX = "SLOWQ_";

    private static final Map<String, BiConsumer<DiagnosticThresholds.DiagnosticThresholdsBuilder, String>> SETTERS =
            new LinkedHashMap<>();

    static {
        SETTERS.put("slow-query-ms", (b, v) -> b.slowQueryMs(Double.parseDouble(v)));
        SETTERS.put("hot-share", (b, v) -> b.hotDigestSharePercent(Double.parseDouble(v)));
        SETTERS.put("lock-share", (b, v) -> b.lockLatencySharePercent(Double.parseDouble(v)));
        SETTERS.put("rows-examined-ratio", (b, v) -> b.rowsExaminedRatio(Double.parseDouble(v)));
        SETTERS.put("scan-rows", (b, v) -> b.fullScanRowThreshold(Long.parseLong(v)));
        SETTERS.put("misestimate-factor", (b, v) -> b.misestimateFactor(Double.parseDouble(v)));
        SETTERS.put("misestimate-min-rows", (b, v) -> b.misestimateMinRows(Long.parseLong(v)));
        SETTERS.put("nested-loops", (b, v) -> b.nestedLoopThreshold(Long.parseLong(v)));
        SETTERS.put("expensive-node-share", (b, v) -> b.expensiveNodeSharePercent(Double.parseDouble(v)));
        SETTERS.put("min-executions", (b, v) -> b.minExecutions(Long.parseLong(v)));
        SETTERS.put("top", (b, v) -> b.topDigests(Integer.parseInt(v)));
        SETTERS.put("medium-score", (b, v) -> b.mediumSeverityScore(Integer.parseInt(v)));
        SETTERS.put("high-score", (b, v) -> b.highSeverityScore(Integer.parseInt(v)));
        SETTERS.put("critical-score", (b, v) -> b.criticalSeverityScore(Integer.parseInt(v)));
    }

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public DiagnosticThresholds loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        DiagnosticThresholds.DiagnosticThresholdsBuilder builder = DiagnosticThresholds.builder();
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        DiagnosticThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public DiagnosticThresholds loadProfile(String profileName) {
        try {
            ThresholdProfile profile = ThresholdProfile.fromName(profileName);
            DiagnosticThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads the profile (or defaults when null), then overlays YAML file, env vars and CLI arguments.
     */
    public DiagnosticThresholds loadConfigurationWithProfile(String profileName, String[] args, Path yamlFile) {
        DiagnosticThresholds base = profileName != null ? loadProfile(profileName) : DiagnosticThresholds.defaults();
        DiagnosticThresholds.DiagnosticThresholdsBuilder builder = base.toBuilder();

        if (yamlFile != null) {
            applyYamlFile(builder, yamlFile);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        DiagnosticThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded with profile '{}': {}", thresholds.getProfileName(),
                thresholds.getConfigurationSummary());
        return thresholds;
    }

    private void applyYamlFile(DiagnosticThresholds.DiagnosticThresholdsBuilder builder, Path yamlFile) {
        if (!Files.exists(yamlFile)) {
            log.warn("Threshold config file not found: {}, ignoring", yamlFile);
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            JsonNode root = mapper.readTree(yamlFile.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Threshold config file {} is not a mapping, ignoring", yamlFile);
                return;
            }

            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey().replace('_', '-');
                apply(builder, key, field.getValue().asText(), "YAML " + yamlFile);
            }
            log.info("Loaded threshold configuration from: {}", yamlFile);
        } catch (IOException e) {
            log.error("Failed to load threshold config from {}: {}, ignoring", yamlFile, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(DiagnosticThresholds.DiagnosticThresholdsBuilder builder) {
        for (String key : SETTERS.keySet()) {
            String envName = ENV_PREFIX + key.toUpperCase().replace('-', '_');
            if (environment.containsKey(envName)) {
                apply(builder, key, environment.get(envName), envName);
            }
        }
    }

    private void applyCLIArguments(DiagnosticThresholds.DiagnosticThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (arg.startsWith(CLI_PREFIX)) {
                apply(builder, arg.substring(CLI_PREFIX.length()), args[i + 1], arg);
            }
        }
    }

    private void apply(DiagnosticThresholds.DiagnosticThresholdsBuilder builder, String key, String value, String source) {
        BiConsumer<DiagnosticThresholds.DiagnosticThresholdsBuilder, String> setter = SETTERS.get(key);
        if (setter == null) {
            log.warn("Unknown threshold '{}' from {}", key, source);
            return;
        }
        try {
            setter.accept(builder, value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns true when the argument is a threshold override handled by this loader.
     */
    public static boolean isThresholdArgument(String arg) {
        return arg.startsWith(CLI_PREFIX);
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        StringBuilder help = new StringBuilder("Threshold Configuration Options:\n\n");
        for (String key : SETTERS.keySet()) {
            help.append(String.format("  %-40s %s%n",
                    CLI_PREFIX + key + " <num>",
                    "env " + ENV_PREFIX + key.toUpperCase().replace('-', '_')));
        }
        help.append("""

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file (--thresholds <file>)
              4. Profile defaults or built-in defaults
            """);
        return help.toString();
    }
}
