package org.carball.slowq.config;

import lombok.Getter;

@Getter
public enum ThresholdProfile {

    STRICT("strict", "Tight latency budgets - flag anything that is not index driven",
            0.2, 0.1, 20, 45, 75),

    BALANCED("balanced", "Balanced approach - default settings for most servers",
            1.0, 1.0, 30, 60, 90),

    LENIENT("lenient", "Only surface the worst offenders",
            3.0, 10.0, 40, 70, 100),

    OLTP("oltp", "Short transactional statements where every scan hurts",
            0.1, 0.1, 25, 50, 80) {
        @Override
        public DiagnosticThresholds buildThresholds() {
            DiagnosticThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .rowsExaminedRatio(10.0) // Point lookups should examine what they send
                    .lockLatencySharePercent(10.0)
                    .build();
        }
    },

    REPORTING("reporting", "Analytical workloads where large scans are expected",
            10.0, 100.0, 40, 70, 100) {
        @Override
        public DiagnosticThresholds buildThresholds() {
            DiagnosticThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .rowsExaminedRatio(10_000.0)
                    .hotDigestSharePercent(25.0)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double latencyMultiplier;
    private final double scanMultiplier;
    private final int mediumScore;
    private final int highScore;
    private final int criticalScore;

    ThresholdProfile(String name, String description,
                     double latencyMultiplier, double scanMultiplier,
                     int mediumScore, int highScore, int criticalScore) {
        this.name = name;
        this.description = description;
        this.latencyMultiplier = latencyMultiplier;
        this.scanMultiplier = scanMultiplier;
        this.mediumScore = mediumScore;
        this.highScore = highScore;
        this.criticalScore = criticalScore;
    }

    /**
     * Creates DiagnosticThresholds based on this profile's settings.
     */
    public DiagnosticThresholds buildThresholds() {
        // Base values that profiles multiply against
        double baseSlowQueryMs = 1000.0;
        long baseFullScanRows = 1000;
        long baseNestedLoops = 1000;

        return DiagnosticThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .slowQueryMs(baseSlowQueryMs * latencyMultiplier)
                .fullScanRowThreshold((long) (baseFullScanRows * scanMultiplier))
                .nestedLoopThreshold((long) (baseNestedLoops * scanMultiplier))
                .mediumSeverityScore(mediumScore)
                .highSeverityScore(highScore)
                .criticalSeverityScore(criticalScore)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static ThresholdProfile fromName(String name) {
        for (ThresholdProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown threshold profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    /**
     * Returns a comma-separated list of available profile names.
     */
    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ThresholdProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Threshold Profiles:\n\n");
        for (ThresholdProfile profile : values()) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
        return help.toString();
    }
}
