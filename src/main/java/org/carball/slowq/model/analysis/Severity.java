package org.carball.slowq.model.analysis;

import org.carball.slowq.config.DiagnosticThresholds;

public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps a digest score onto a severity using the configured cut-offs.
     */
    public static Severity fromScore(int score, DiagnosticThresholds thresholds) {
        if (score >= thresholds.getCriticalSeverityScore()) {
            return CRITICAL;
        } else if (score >= thresholds.getHighSeverityScore()) {
            return HIGH;
        } else if (score >= thresholds.getMediumSeverityScore()) {
            return MEDIUM;
        } else if (score > 0) {
            return LOW;
        }
        return INFO;
    }
}
