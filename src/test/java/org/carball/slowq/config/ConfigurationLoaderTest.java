package org.carball.slowq.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        DiagnosticThresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(1000.0);
        assertThat(thresholds.getFullScanRowThreshold()).isEqualTo(1000);
        assertThat(thresholds.getTopDigests()).isEqualTo(20);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldLoadSpecificProfile() {
        // When
        DiagnosticThresholds thresholds = loader.loadProfile("strict");

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(200.0);
        assertThat(thresholds.getFullScanRowThreshold()).isEqualTo(100);
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        // When/Then
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown threshold profile: nonexistent");
    }

    @Test
    void shouldApplyProfileWithOverrides() {
        // Given
        String[] args = {
                "--thresholds.slow-query-ms", "250"
        };

        // When
        DiagnosticThresholds thresholds = loader.loadConfigurationWithProfile("reporting", args, null);

        // Then - CLI > env vars > profile > defaults
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(250.0); // CLI override
        assertThat(thresholds.getRowsExaminedRatio()).isEqualTo(10_000.0); // From reporting profile
        assertThat(thresholds.getHotDigestSharePercent()).isEqualTo(25.0);
        assertThat(thresholds.getProfileName()).isEqualTo("reporting");
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "--thresholds.slow-query-ms", "500",
                "--thresholds.hot-share", "15.5",
                "--thresholds.scan-rows", "5000",
                "--thresholds.misestimate-factor", "20",
                "--thresholds.nested-loops", "200",
                "--thresholds.top", "5",
                "--thresholds.medium-score", "20",
                "--thresholds.high-score", "50",
                "--thresholds.critical-score", "80"
        };

        // When
        DiagnosticThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(500.0);
        assertThat(thresholds.getHotDigestSharePercent()).isEqualTo(15.5);
        assertThat(thresholds.getFullScanRowThreshold()).isEqualTo(5000);
        assertThat(thresholds.getMisestimateFactor()).isEqualTo(20.0);
        assertThat(thresholds.getNestedLoopThreshold()).isEqualTo(200);
        assertThat(thresholds.getTopDigests()).isEqualTo(5);
        assertThat(thresholds.getMediumSeverityScore()).isEqualTo(20);
        assertThat(thresholds.getHighSeverityScore()).isEqualTo(50);
        assertThat(thresholds.getCriticalSeverityScore()).isEqualTo(80);
    }

    @Test
    void shouldApplyEnvironmentVariablesBelowCLIArguments() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "SLOWQ_SLOW_QUERY_MS", "300",
                "SLOWQ_SCAN_ROWS", "50000"));
        String[] args = {"--thresholds.scan-rows", "2000"};

        // When
        DiagnosticThresholds thresholds = envLoader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(300.0);
        assertThat(thresholds.getFullScanRowThreshold()).isEqualTo(2000);
    }

    @Test
    void shouldLoadYamlFileBetweenProfileAndEnvironment() throws IOException {
        // Given
        Path yaml = tempDir.resolve("thresholds.yml");
        Files.writeString(yaml, """
                slow_query_ms: 750
                rows_examined_ratio: 40
                top: 8
                """);
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("SLOWQ_TOP", "12"));

        // When
        DiagnosticThresholds thresholds = envLoader.loadConfigurationWithProfile("lenient", new String[0], yaml);

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(750.0);
        assertThat(thresholds.getRowsExaminedRatio()).isEqualTo(40.0);
        assertThat(thresholds.getTopDigests()).isEqualTo(12);
        assertThat(thresholds.getProfileName()).isEqualTo("lenient");
    }

    @Test
    void shouldIgnoreMissingYamlFile() {
        // When
        DiagnosticThresholds thresholds = loader.loadConfigurationWithProfile(
                null, new String[0], tempDir.resolve("missing.yml"));

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(1000.0);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldIgnoreInvalidNumbersAndUnknownKeys() {
        // Given
        String[] args = {
                "--thresholds.slow-query-ms", "fast",
                "--thresholds.no-such-key", "10"
        };

        // When
        DiagnosticThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(1000.0);
    }

    @Test
    void shouldRecognizeThresholdArguments() {
        assertThat(ConfigurationLoader.isThresholdArgument("--thresholds.top")).isTrue();
        assertThat(ConfigurationLoader.isThresholdArgument("--thresholds")).isFalse();
        assertThat(ConfigurationLoader.isThresholdArgument("--top")).isFalse();
    }

    @Test
    void shouldDescribeEveryThresholdInHelp() {
        // When
        String help = ConfigurationLoader.getThresholdHelp();

        // Then
        assertThat(help).contains("--thresholds.slow-query-ms");
        assertThat(help).contains("SLOWQ_SLOW_QUERY_MS");
        assertThat(help).contains("--thresholds.critical-score");
        assertThat(help).contains("Priority Order");
    }
}
