package org.carball.slowq.model.plan;

/**
 * How an EXPLAIN ANALYZE node reads or shapes its rows.
 */
public enum AccessType {
    TABLE_SCAN,
    INDEX_SCAN,
    INDEX_RANGE_SCAN,
    INDEX_LOOKUP,
    UNIQUE_LOOKUP,
    COVERING_INDEX,
    FULLTEXT,
    FILTER,
    SORT,
    AGGREGATE,
    JOIN,
    TEMPORARY,
    LIMIT,
    OTHER;

    public boolean isScan() {
        return this == TABLE_SCAN || this == INDEX_SCAN;
    }

    public boolean readsTable() {
        return switch (this) {
            case TABLE_SCAN, INDEX_SCAN, INDEX_RANGE_SCAN, INDEX_LOOKUP,
                 UNIQUE_LOOKUP, COVERING_INDEX, FULLTEXT -> true;
            default -> false;
        };
    }
}
