package org.carball.slowq.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ThresholdProfileTest {

    @Test
    void balancedProfileShouldMatchDefaults() {
        // When
        DiagnosticThresholds balanced = ThresholdProfile.BALANCED.buildThresholds();
        DiagnosticThresholds defaults = DiagnosticThresholds.defaults();

        // Then
        assertThat(balanced.getSlowQueryMs()).isEqualTo(defaults.getSlowQueryMs());
        assertThat(balanced.getFullScanRowThreshold()).isEqualTo(defaults.getFullScanRowThreshold());
        assertThat(balanced.getNestedLoopThreshold()).isEqualTo(defaults.getNestedLoopThreshold());
        assertThat(balanced.getMediumSeverityScore()).isEqualTo(defaults.getMediumSeverityScore());
        assertThat(balanced.getHighSeverityScore()).isEqualTo(defaults.getHighSeverityScore());
        assertThat(balanced.getCriticalSeverityScore()).isEqualTo(defaults.getCriticalSeverityScore());
        assertThat(balanced.getProfileName()).isEqualTo("balanced");
    }

    @Test
    void strictProfileShouldTightenLatencyAndScanLimits() {
        // When
        DiagnosticThresholds strict = ThresholdProfile.STRICT.buildThresholds();

        // Then
        assertThat(strict.getSlowQueryMs()).isEqualTo(200.0);
        assertThat(strict.getFullScanRowThreshold()).isEqualTo(100);
        assertThat(strict.getNestedLoopThreshold()).isEqualTo(100);
        assertThat(strict.getMediumSeverityScore()).isEqualTo(20);
    }

    @Test
    void oltpProfileShouldLowerRowsExaminedRatio() {
        // When
        DiagnosticThresholds oltp = ThresholdProfile.OLTP.buildThresholds();

        // Then
        assertThat(oltp.getRowsExaminedRatio()).isEqualTo(10.0);
        assertThat(oltp.getLockLatencySharePercent()).isEqualTo(10.0);
        assertThat(oltp.getSlowQueryMs()).isEqualTo(100.0);
    }

    @Test
    void reportingProfileShouldTolerateLargeScans() {
        // When
        DiagnosticThresholds reporting = ThresholdProfile.REPORTING.buildThresholds();

        // Then
        assertThat(reporting.getFullScanRowThreshold()).isEqualTo(100_000);
        assertThat(reporting.getSlowQueryMs()).isEqualTo(10_000.0);
        assertThat(reporting.getRowsExaminedRatio()).isEqualTo(10_000.0);
    }

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(ThresholdProfile.fromName("OLTP")).isEqualTo(ThresholdProfile.OLTP);
        assertThat(ThresholdProfile.fromName("Lenient")).isEqualTo(ThresholdProfile.LENIENT);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> ThresholdProfile.fromName("turbo"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Available profiles: strict, balanced, lenient, oltp, reporting");
    }

    @Test
    void shouldListEveryProfileInHelp() {
        // When
        String help = ThresholdProfile.getProfileHelp();

        // Then
        for (ThresholdProfile profile : ThresholdProfile.values()) {
            assertThat(help).contains(profile.getName());
            assertThat(help).contains(profile.getDescription());
        }
    }
}
