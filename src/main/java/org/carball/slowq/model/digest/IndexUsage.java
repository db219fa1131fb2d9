package org.carball.slowq.model.digest;

/**
 * I/O counters from performance_schema.table_io_waits_summary_by_index_usage.
 * A null index name stands for rows read without any index. {@code unique} is null when the
 * index definition was not available at capture time.
 */
public record IndexUsage(
        String schemaName,
        String tableName,
        String indexName,
        long countStar,
        long countRead,
        long countWrite,
        double latencyMs,
        Boolean unique
) {

    public IndexUsage(String schemaName, String tableName, String indexName,
                      long countStar, long countRead, long countWrite, double latencyMs) {
        this(schemaName, tableName, indexName, countStar, countRead, countWrite, latencyMs, null);
    }

    public boolean isFullScan() {
        return indexName == null;
    }

    public boolean isPrimary() {
        return "PRIMARY".equalsIgnoreCase(indexName);
    }
}
