package org.carball.slowq.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.digest.WorkloadTotals;
import org.carball.slowq.model.schema.DatabaseSchema;
import org.carball.slowq.model.schema.Index;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads statement digests, index statistics and index definitions from a live MySQL 8 server.
 */
@Slf4j
public class PerformanceSchemaConnector {

    // performance_schema timers are BIGINT UNSIGNED picoseconds, read as double so they cannot overflow
    private static final double PS_PER_MS = 1_000_000_000.0;

    private static final String DIGEST_COLUMNS = """
        SELECT DIGEST, SCHEMA_NAME, DIGEST_TEXT, QUERY_SAMPLE_TEXT,
               COUNT_STAR, SUM_TIMER_WAIT, AVG_TIMER_WAIT, MAX_TIMER_WAIT, QUANTILE_95,
               SUM_LOCK_TIME, SUM_ROWS_SENT, SUM_ROWS_EXAMINED, SUM_ROWS_AFFECTED,
               SUM_NO_INDEX_USED, SUM_NO_GOOD_INDEX_USED,
               SUM_CREATED_TMP_TABLES, SUM_CREATED_TMP_DISK_TABLES, SUM_SORT_MERGE_PASSES,
               SUM_ERRORS, FIRST_SEEN, LAST_SEEN
        FROM performance_schema.events_statements_summary_by_digest
        WHERE DIGEST_TEXT IS NOT NULL
          AND (SCHEMA_NAME IS NULL OR SCHEMA_NAME NOT IN ('mysql', 'sys', 'performance_schema', 'information_schema'))
          AND (? IS NULL OR SCHEMA_NAME = ?)
        """;

    private static final String TOP_DIGESTS_BY_LATENCY = DIGEST_COLUMNS + """
        ORDER BY SUM_TIMER_WAIT DESC
        LIMIT ?
        """;

    private static final String FULL_SCAN_DIGESTS = DIGEST_COLUMNS + """
          AND SUM_NO_INDEX_USED > 0
        ORDER BY SUM_NO_INDEX_USED DESC, SUM_TIMER_WAIT DESC
        LIMIT ?
        """;

    private static final String WORKLOAD_TOTALS = """
        SELECT COUNT(*) AS DIGESTS, SUM(COUNT_STAR) AS EXECUTIONS, SUM(SUM_TIMER_WAIT) AS LATENCY
        FROM performance_schema.events_statements_summary_by_digest
        WHERE DIGEST_TEXT IS NOT NULL
          AND (SCHEMA_NAME IS NULL OR SCHEMA_NAME NOT IN ('mysql', 'sys', 'performance_schema', 'information_schema'))
          AND (? IS NULL OR SCHEMA_NAME = ?)
        """;

    private static final String INDEX_USAGE = """
        SELECT OBJECT_SCHEMA, OBJECT_NAME, INDEX_NAME,
               COUNT_STAR, COUNT_READ, COUNT_WRITE, SUM_TIMER_WAIT
        FROM performance_schema.table_io_waits_summary_by_index_usage
        WHERE OBJECT_SCHEMA NOT IN ('mysql', 'sys', 'performance_schema', 'information_schema')
          AND (? IS NULL OR OBJECT_SCHEMA = ?)
        ORDER BY OBJECT_SCHEMA, OBJECT_NAME, INDEX_NAME
        """;

    private static final String UNUSED_INDEXES = """
        SELECT object_schema, object_name, index_name
        FROM sys.schema_unused_indexes
        WHERE (? IS NULL OR object_schema = ?)
        ORDER BY object_schema, object_name, index_name
        """;

    private static final String INDEX_DEFINITIONS = """
        SELECT TABLE_NAME, INDEX_NAME, NON_UNIQUE, SEQ_IN_INDEX, COLUMN_NAME
        FROM information_schema.STATISTICS
        WHERE TABLE_SCHEMA = ?
        ORDER BY TABLE_NAME, INDEX_NAME, SEQ_IN_INDEX
        """;

    private static final String INDEX_UNIQUENESS = """
        SELECT TABLE_SCHEMA, TABLE_NAME, INDEX_NAME, MIN(NON_UNIQUE) AS NON_UNIQUE
        FROM information_schema.STATISTICS
        WHERE TABLE_SCHEMA NOT IN ('mysql', 'sys', 'performance_schema', 'information_schema')
          AND (? IS NULL OR TABLE_SCHEMA = ?)
        GROUP BY TABLE_SCHEMA, TABLE_NAME, INDEX_NAME
        """;

    private static final String DIGEST_CONSUMER = """
        SELECT ENABLED
        FROM performance_schema.setup_consumers
        WHERE NAME = 'statements_digest'
        """;

    private final String jdbcUrl;
    private final String user;
    private final String password;

    public PerformanceSchemaConnector(String jdbcUrl, String user, String password) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    /**
     * Checks the performance_schema system variable.
     */
    public boolean isPerformanceSchemaEnabled() throws SQLException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT @@performance_schema");
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() && rs.getInt(1) == 1;
        }
    }

    /**
     * Checks that the statements_digest consumer is collecting.
     */
    public boolean isDigestCollectionEnabled() throws SQLException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(DIGEST_CONSUMER);
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() && "YES".equalsIgnoreCase(rs.getString(1));
        }
    }

    public String getServerVersion() throws SQLException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT VERSION()");
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() ? rs.getString(1) : "unknown";
        }
    }

    /**
     * Digests ordered by total latency, highest first.
     */
    public List<DigestStatement> getTopDigestsByLatency(String schema, int limit) throws SQLException {
        return queryDigests(TOP_DIGESTS_BY_LATENCY, schema, limit);
    }

    /**
     * Digests that ran at least once without using an index.
     */
    public List<DigestStatement> getFullScanDigests(String schema, int limit) throws SQLException {
        return queryDigests(FULL_SCAN_DIGESTS, schema, limit);
    }

    /**
     * Digest count, executions and latency over the whole digest table, for latency shares that do
     * not depend on how many digests were captured.
     */
    public WorkloadTotals getWorkloadTotals(String schema) throws SQLException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(WORKLOAD_TOTALS)) {

            bindSchema(stmt, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return new WorkloadTotals(0, 0, 0.0);
                }
                return new WorkloadTotals(
                        rs.getLong("DIGESTS"),
                        rs.getLong("EXECUTIONS"),
                        rs.getDouble("LATENCY") / PS_PER_MS);
            }
        }
    }

    /**
     * Index I/O rows, each tagged with whether the index is unique.
     */
    public List<IndexUsage> getIndexUsage(String schema) throws SQLException {
        return getIndexUsage(schema, getIndexUniqueness(schema));
    }

    /**
     * Uniqueness of every index in the selected schemas, keyed by lower-cased "schema.table.index".
     */
    public Map<String, Boolean> getIndexUniqueness(String schema) throws SQLException {
        Map<String, Boolean> uniqueness = new HashMap<>();

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(INDEX_UNIQUENESS)) {

            bindSchema(stmt, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    uniqueness.put(qualifiedIndex(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME"),
                            rs.getString("INDEX_NAME")), rs.getInt("NON_UNIQUE") == 0);
                }
            }
        }
        return uniqueness;
    }

    private List<IndexUsage> getIndexUsage(String schema, Map<String, Boolean> uniqueness) throws SQLException {
        List<IndexUsage> results = new ArrayList<>();

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(INDEX_USAGE)) {

            bindSchema(stmt, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String objectSchema = rs.getString("OBJECT_SCHEMA");
                    String tableName = rs.getString("OBJECT_NAME");
                    String indexName = rs.getString("INDEX_NAME");
                    results.add(new IndexUsage(
                            objectSchema,
                            tableName,
                            indexName,
                            rs.getLong("COUNT_STAR"),
                            rs.getLong("COUNT_READ"),
                            rs.getLong("COUNT_WRITE"),
                            rs.getDouble("SUM_TIMER_WAIT") / PS_PER_MS,
                            indexName != null ? uniqueness.get(qualifiedIndex(objectSchema, tableName, indexName)) : null
                    ));
                }
            }
        }

        log.debug("Loaded {} index usage rows", results.size());
        return results;
    }

    /**
     * Indexes listed by sys.schema_unused_indexes, as "schema.table.index".
     */
    public List<String> getUnusedIndexes(String schema) throws SQLException {
        List<String> results = new ArrayList<>();

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(UNUSED_INDEXES)) {

            bindSchema(stmt, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(rs.getString(1) + "." + rs.getString(2) + "." + rs.getString(3));
                }
            }
        }

        return results;
    }

    /**
     * Reads index definitions for one schema from information_schema.STATISTICS.
     */
    public DatabaseSchema getIndexDefinitions(String schema) throws SQLException {
        DatabaseSchema databaseSchema = new DatabaseSchema();
        Map<String, Index> indexes = new LinkedHashMap<>();

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(INDEX_DEFINITIONS)) {

            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String tableName = rs.getString("TABLE_NAME");
                    String indexName = rs.getString("INDEX_NAME");
                    String key = tableName + "." + indexName;

                    Index index = indexes.get(key);
                    if (index == null) {
                        index = Index.builder()
                                .name(indexName)
                                .columns(new ArrayList<>())
                                .unique(rs.getInt("NON_UNIQUE") == 0)
                                .primary(Index.PRIMARY.equals(indexName))
                                .build();
                        indexes.put(key, index);
                        databaseSchema.getOrCreateTable(tableName).addIndex(index);
                    }
                    String column = rs.getString("COLUMN_NAME");
                    if (column != null) {
                        // Functional key parts have no column name
                        index.getColumns().add(column);
                    }
                }
            }
        }

        log.debug("Loaded {} index definitions for schema {}", indexes.size(), schema);
        return databaseSchema;
    }

    /**
     * Runs EXPLAIN ANALYZE. Only SELECT statements are accepted because the statement is executed.
     */
    public String explainAnalyze(String sql) throws SQLException {
        if (!isSelect(sql)) {
            throw new IllegalArgumentException("EXPLAIN ANALYZE is only run for SELECT statements");
        }

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("EXPLAIN ANALYZE " + sql);
             ResultSet rs = stmt.executeQuery()) {

            StringBuilder plan = new StringBuilder();
            while (rs.next()) {
                plan.append(rs.getString(1)).append('\n');
            }
            return plan.toString();
        }
    }

    /**
     * Clears the digest summary so that a fresh measurement window starts.
     */
    public void resetDigestStatistics() throws SQLException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                     "TRUNCATE TABLE performance_schema.events_statements_summary_by_digest")) {
            stmt.executeUpdate();
        }
        log.info("Reset performance_schema statement digest statistics");
    }

    /**
     * Captures digests, index statistics and definitions, and optionally EXPLAIN ANALYZE plans.
     */
    public DiagnosticSnapshot captureSnapshot(String schema, int limit, boolean runExplain) throws SQLException {
        boolean enabled = isPerformanceSchemaEnabled();
        if (!enabled) {
            log.warn("performance_schema is disabled; digest tables will be empty");
        } else if (!isDigestCollectionEnabled()) {
            log.warn("statements_digest consumer is disabled; digest statistics may be stale");
        }

        List<DigestStatement> digests = new ArrayList<>(getTopDigestsByLatency(schema, limit));
        for (DigestStatement fullScan : getFullScanDigests(schema, limit)) {
            if (digests.stream().noneMatch(d -> sameDigest(d, fullScan))) {
                digests.add(fullScan);
            }
        }

        DatabaseSchema databaseSchema = schema != null ? getIndexDefinitions(schema) : new DatabaseSchema();
        Map<String, Boolean> uniqueness = getIndexUniqueness(schema);

        List<String> unusedIndexes = new ArrayList<>();
        try {
            unusedIndexes.addAll(getUnusedIndexes(schema));
            // sys.schema_unused_indexes lists unique indexes too; they enforce constraints
            unusedIndexes.removeIf(name -> Boolean.TRUE.equals(uniqueness.get(name.toLowerCase(Locale.ROOT))));
        } catch (SQLException e) {
            log.warn("Could not read sys.schema_unused_indexes: {}", e.getMessage());
        }

        Map<String, String> plans = new LinkedHashMap<>();
        if (runExplain) {
            for (DigestStatement digest : digests) {
                if (!digest.hasCompleteSample() || !isSelect(digest.querySampleText())) {
                    continue;
                }
                try {
                    plans.put(digest.key(), explainAnalyze(digest.querySampleText()));
                } catch (SQLException e) {
                    log.warn("EXPLAIN ANALYZE failed for digest {}: {}", digest.digest(), e.getMessage());
                }
            }
            log.info("Captured {} EXPLAIN ANALYZE plans", plans.size());
        }

        WorkloadTotals totals = getWorkloadTotals(schema);
        log.info("Captured {} of {} digests", digests.size(), totals.digestCount());

        SnapshotMetadata metadata = new SnapshotMetadata(
                getServerVersion(),
                LocalDateTime.now(),
                schema,
                enabled,
                digests.size(),
                SnapshotMetadata.SOURCE_PERFORMANCE_SCHEMA,
                totals.executions(),
                totals.latencyMs());

        return DiagnosticSnapshot.builder()
                .metadata(metadata)
                .digests(digests)
                .indexUsage(getIndexUsage(schema, uniqueness))
                .schema(databaseSchema)
                .unusedIndexes(unusedIndexes)
                .explainPlans(plans)
                .build();
    }

    private List<DigestStatement> queryDigests(String query, String schema, int limit) throws SQLException {
        List<DigestStatement> results = new ArrayList<>();

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(query)) {

            bindSchema(stmt, schema);
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapDigest(rs));
                }
            }
        }

        log.debug("Loaded {} digests", results.size());
        return results;
    }

    static DigestStatement mapDigest(ResultSet rs) throws SQLException {
        return DigestStatement.builder()
                .digest(rs.getString("DIGEST"))
                .schemaName(rs.getString("SCHEMA_NAME"))
                .digestText(rs.getString("DIGEST_TEXT"))
                .querySampleText(rs.getString("QUERY_SAMPLE_TEXT"))
                .execCount(rs.getLong("COUNT_STAR"))
                .totalLatencyMs(rs.getDouble("SUM_TIMER_WAIT") / PS_PER_MS)
                .avgLatencyMs(rs.getDouble("AVG_TIMER_WAIT") / PS_PER_MS)
                .maxLatencyMs(rs.getDouble("MAX_TIMER_WAIT") / PS_PER_MS)
                .p95LatencyMs(rs.getDouble("QUANTILE_95") / PS_PER_MS)
                .lockLatencyMs(rs.getDouble("SUM_LOCK_TIME") / PS_PER_MS)
                .rowsSent(rs.getLong("SUM_ROWS_SENT"))
                .rowsExamined(rs.getLong("SUM_ROWS_EXAMINED"))
                .rowsAffected(rs.getLong("SUM_ROWS_AFFECTED"))
                .noIndexUsedCount(rs.getLong("SUM_NO_INDEX_USED"))
                .noGoodIndexUsedCount(rs.getLong("SUM_NO_GOOD_INDEX_USED"))
                .tmpTables(rs.getLong("SUM_CREATED_TMP_TABLES"))
                .tmpDiskTables(rs.getLong("SUM_CREATED_TMP_DISK_TABLES"))
                .sortMergePasses(rs.getLong("SUM_SORT_MERGE_PASSES"))
                .errors(rs.getLong("SUM_ERRORS"))
                .firstSeen(toLocalDateTime(rs.getTimestamp("FIRST_SEEN")))
                .lastSeen(toLocalDateTime(rs.getTimestamp("LAST_SEEN")))
                .build();
    }

    private static void bindSchema(PreparedStatement stmt, String schema) throws SQLException {
        stmt.setString(1, schema);
        stmt.setString(2, schema);
    }

    private static String qualifiedIndex(String schemaName, String tableName, String indexName) {
        return (schemaName + "." + tableName + "." + indexName).toLowerCase(Locale.ROOT);
    }

    private static boolean sameDigest(DigestStatement a, DigestStatement b) {
        return a.digest().equals(b.digest()) && Objects.equals(a.schemaName(), b.schemaName());
    }

    static boolean isSelect(String sql) {
        if (sql == null) {
            return false;
        }
        String trimmed = sql.stripLeading().toUpperCase(Locale.ROOT);
        return trimmed.startsWith("SELECT") || trimmed.startsWith("(SELECT");
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, user, password);
    }
}
