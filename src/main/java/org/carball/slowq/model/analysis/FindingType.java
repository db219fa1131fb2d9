package org.carball.slowq.model.analysis;

import lombok.Getter;

@Getter
public enum FindingType {

    // Digest statistics
    HOT_DIGEST("Hot digest", Severity.MEDIUM),
    SLOW_AVERAGE_LATENCY("Slow average latency", Severity.HIGH),
    HIGH_ROWS_EXAMINED_RATIO("Rows examined far exceed rows sent", Severity.MEDIUM),
    NO_INDEX_USED("Executions without any index", Severity.HIGH),
    NO_GOOD_INDEX_USED("No good index found", Severity.MEDIUM),
    TEMP_TABLES_ON_DISK("Temporary tables spilled to disk", Severity.MEDIUM),
    LOCK_CONTENTION("Lock wait dominates latency", Severity.MEDIUM),
    SORT_MERGE_PASSES("Sort merge passes", Severity.LOW),
    STATEMENT_ERRORS("Statement errors", Severity.LOW),

    // EXPLAIN ANALYZE
    FULL_TABLE_SCAN("Full table scan", Severity.HIGH),
    ROW_ESTIMATE_MISMATCH("Row estimate mismatch", Severity.MEDIUM),
    EXPENSIVE_PLAN_NODE("Expensive plan node", Severity.MEDIUM),
    NESTED_LOOP_AMPLIFICATION("Nested loop amplification", Severity.HIGH),
    FILESORT("Filesort over many rows", Severity.LOW),
    TEMPORARY_TABLE("Temporary table", Severity.LOW),
    EXPLAIN_UNPARSEABLE("EXPLAIN output could not be parsed", Severity.LOW),

    // Index health
    UNUSED_INDEX("Unused index", Severity.LOW),
    REDUNDANT_INDEX("Redundant index", Severity.LOW),
    FULL_SCAN_TABLE("Table read without indexes", Severity.MEDIUM),
    MISSING_INDEX("Missing index", Severity.MEDIUM),

    // Statement text
    LEADING_WILDCARD_LIKE("Leading wildcard LIKE", Severity.MEDIUM),
    FUNCTION_ON_COLUMN("Function applied to filtered column", Severity.MEDIUM),
    SELECT_STAR("SELECT *", Severity.INFO),
    ORDER_BY_RAND("ORDER BY RAND()", Severity.MEDIUM),
    UNBOUNDED_ORDER_BY("ORDER BY without LIMIT", Severity.LOW);

    private final String title;
    private final Severity defaultSeverity;

    FindingType(String title, Severity defaultSeverity) {
        this.title = title;
        this.defaultSeverity = defaultSeverity;
    }
}
