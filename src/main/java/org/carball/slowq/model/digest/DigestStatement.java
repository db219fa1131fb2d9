package org.carball.slowq.model.digest;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Aggregated statistics for one statement digest, as reported by
 * performance_schema.events_statements_summary_by_digest. Latencies are in milliseconds.
 */
@Builder(toBuilder = true)
public record DigestStatement(
        String digest,
        String schemaName,
        String digestText,
        String querySampleText,
        long execCount,
        double totalLatencyMs,
        double avgLatencyMs,
        double maxLatencyMs,
        double p95LatencyMs,
        double lockLatencyMs,
        long rowsSent,
        long rowsExamined,
        long rowsAffected,
        long noIndexUsedCount,
        long noGoodIndexUsedCount,
        long tmpTables,
        long tmpDiskTables,
        long sortMergePasses,
        long errors,
        LocalDateTime firstSeen,
        LocalDateTime lastSeen
) {

    /**
     * performance_schema keeps one row per (schema, digest), so the same statement shape run
     * against two schemas is two workload entries.
     */
    public String key() {
        return keyOf(schemaName, digest);
    }

    public static String keyOf(String schemaName, String digest) {
        return schemaName == null ? digest : schemaName + "/" + digest;
    }

    public double rowsExaminedPerRowSent() {
        return (double) rowsExamined / Math.max(rowsSent, 1);
    }

    public double fullScanRate() {
        return execCount > 0 ? (double) noIndexUsedCount / execCount : 0.0;
    }

    /**
     * Sample text if it is complete, otherwise the normalized digest text.
     */
    public String bestText() {
        return hasCompleteSample() ? querySampleText : digestText;
    }

    /**
     * False when the server cut the sample off at performance_schema_max_sql_text_length.
     */
    public boolean hasCompleteSample() {
        return querySampleText != null
                && !querySampleText.isBlank()
                && !querySampleText.endsWith("...");
    }
}
