package org.carball.slowq.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class DiagnosticThresholds {

    // Digest latency
    @Builder.Default
    private double slowQueryMs = 1000.0;

    @Builder.Default
    private double hotDigestSharePercent = 10.0;

    @Builder.Default
    private double lockLatencySharePercent = 20.0;

    // Row amplification
    @Builder.Default
    private double rowsExaminedRatio = 100.0;

    @Builder.Default
    private long fullScanRowThreshold = 1000;

    // EXPLAIN ANALYZE
    @Builder.Default
    private double misestimateFactor = 10.0;

    @Builder.Default
    private long misestimateMinRows = 100;

    @Builder.Default
    private long nestedLoopThreshold = 1000;

    @Builder.Default
    private double expensiveNodeSharePercent = 50.0;

    // Digest selection
    @Builder.Default
    private long minExecutions = 1;

    @Builder.Default
    private int topDigests = 20;

    // Severity cut-offs
    @Builder.Default
    private int mediumSeverityScore = 30;

    @Builder.Default
    private int highSeverityScore = 60;

    @Builder.Default
    private int criticalSeverityScore = 90;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced thresholds";

    /**
     * Creates default thresholds suitable for a mixed OLTP workload.
     */
    public static DiagnosticThresholds defaults() {
        return DiagnosticThresholds.builder()
                .profileName("default")
                .profileDescription("Default balanced thresholds")
                .build();
    }

    /**
     * Validates the threshold configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (slowQueryMs <= 0) {
            log.warn("Slow query threshold ({} ms) should be positive", slowQueryMs);
        }

        if (hotDigestSharePercent <= 0 || hotDigestSharePercent > 100) {
            log.warn("Hot digest share ({}%) should be within (0, 100]", hotDigestSharePercent);
        }

        if (lockLatencySharePercent <= 0 || lockLatencySharePercent > 100) {
            log.warn("Lock latency share ({}%) should be within (0, 100]", lockLatencySharePercent);
        }

        if (expensiveNodeSharePercent <= 0 || expensiveNodeSharePercent > 100) {
            log.warn("Expensive plan node share ({}%) should be within (0, 100]", expensiveNodeSharePercent);
        }

        if (misestimateFactor <= 1.0) {
            log.warn("Row misestimate factor ({}) should be greater than 1.0", misestimateFactor);
        }

        if (rowsExaminedRatio <= 1.0) {
            log.warn("Rows examined ratio ({}) should be greater than 1.0", rowsExaminedRatio);
        }

        if (topDigests <= 0) {
            log.warn("Top digest count ({}) should be positive", topDigests);
        }

        if (criticalSeverityScore <= highSeverityScore) {
            log.warn("Critical severity score ({}) should be greater than high severity score ({})",
                    criticalSeverityScore, highSeverityScore);
        }

        if (highSeverityScore <= mediumSeverityScore) {
            log.warn("High severity score ({}) should be greater than medium severity score ({})",
                    highSeverityScore, mediumSeverityScore);
        }

        log.debug("Using thresholds - Slow: {} ms, Hot share: {}%, Scan rows: {}, Profile: {}",
                slowQueryMs, hotDigestSharePercent, fullScanRowThreshold, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Slow query: %.0f ms | Hot share: %.1f%% | Scan rows: %d | Top: %d",
                profileName, slowQueryMs, hotDigestSharePercent, fullScanRowThreshold, topDigests);
    }
}
