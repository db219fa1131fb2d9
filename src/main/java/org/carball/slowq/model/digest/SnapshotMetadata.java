package org.carball.slowq.model.digest;

import java.time.LocalDateTime;

/**
 * Where a snapshot came from. The workload totals cover every digest on the server, not just the
 * captured ones; zero means they are unknown.
 */
public record SnapshotMetadata(
        String serverVersion,
        LocalDateTime capturedAt,
        String schemaName,
        boolean performanceSchemaEnabled,
        int totalDigests,
        String source,
        long workloadExecutions,
        double workloadLatencyMs
) {

    public static final String SOURCE_PERFORMANCE_SCHEMA = "performance_schema";
    public static final String SOURCE_SLOW_LOG = "slow_log";
    public static final String SOURCE_EXPLAIN = "explain";

    public SnapshotMetadata(String serverVersion, LocalDateTime capturedAt, String schemaName,
                            boolean performanceSchemaEnabled, int totalDigests, String source) {
        this(serverVersion, capturedAt, schemaName, performanceSchemaEnabled, totalDigests, source, 0L, 0.0);
    }
}
