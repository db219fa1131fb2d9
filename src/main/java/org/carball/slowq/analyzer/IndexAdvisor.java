package org.carball.slowq.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.model.analysis.Finding;
import org.carball.slowq.model.analysis.FindingType;
import org.carball.slowq.model.analysis.IndexSuggestion;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.StatementProfile;
import org.carball.slowq.model.schema.DatabaseSchema;
import org.carball.slowq.model.schema.Index;
import org.carball.slowq.model.schema.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Index health checks over usage statistics and definitions, plus per-statement index suggestions.
 */
@Slf4j
public class IndexAdvisor {

    // Wider covering indexes cost more on writes than they save on reads
    private static final int MAX_COVERING_COLUMNS = 6;

    private final DiagnosticThresholds thresholds;

    public IndexAdvisor(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Indexes with no recorded I/O. Primary keys and unique indexes are kept since they enforce constraints.
     * Uniqueness comes from the usage row when it was captured, otherwise from the schema definitions.
     */
    public List<Finding> findUnusedIndexes(List<IndexUsage> usage, DatabaseSchema schema) {
        List<Finding> findings = new ArrayList<>();

        for (IndexUsage row : usage) {
            if (row.isFullScan() || row.isPrimary() || row.countStar() > 0) {
                continue;
            }
            Boolean unique = row.unique() != null
                    ? row.unique()
                    : definedUniqueness(schema, row.tableName(), row.indexName());
            if (Boolean.TRUE.equals(unique)) {
                continue;
            }
            findings.add(unusedIndexFinding(row.schemaName(), row.tableName(), row.indexName(), unique != null));
        }

        log.debug("Found {} unused indexes", findings.size());
        return findings;
    }

    /**
     * Same check fed by sys.schema_unused_indexes names ("schema.table.index").
     */
    public List<Finding> findSysUnusedIndexes(List<String> unusedIndexes, DatabaseSchema schema) {
        List<Finding> findings = new ArrayList<>();

        for (String qualified : unusedIndexes) {
            String[] parts = qualified.split("\\.", 3);
            if (parts.length != 3) {
                log.warn("Ignoring malformed unused index name: {}", qualified);
                continue;
            }
            if (parts[2].equalsIgnoreCase(Index.PRIMARY)) {
                continue;
            }
            Boolean unique = definedUniqueness(schema, parts[1], parts[2]);
            if (Boolean.TRUE.equals(unique)) {
                continue;
            }
            findings.add(unusedIndexFinding(parts[0], parts[1], parts[2], unique != null));
        }
        return findings;
    }

    /**
     * Indexes that are a left prefix of, or identical to, another index on the same table.
     */
    public List<Finding> findRedundantIndexes(DatabaseSchema schema) {
        List<Finding> findings = new ArrayList<>();

        for (Table table : schema.getTables()) {
            List<Index> indexes = table.getIndexes();
            List<Index> reported = new ArrayList<>();

            for (int i = 0; i < indexes.size(); i++) {
                for (int j = 0; j < indexes.size(); j++) {
                    if (i == j) {
                        continue;
                    }
                    Index candidate = indexes.get(i);
                    Index other = indexes.get(j);
                    if (reported.contains(candidate) || reported.contains(other)
                            || !isRedundant(candidate, other, i > j)) {
                        continue;
                    }

                    reported.add(candidate);
                    findings.add(Finding.of(FindingType.REDUNDANT_INDEX, table.getName() + "." + candidate.getName(),
                                    String.format("Index %s (%s) is covered by %s (%s)",
                                            candidate.getName(), String.join(", ", candidate.getColumns()),
                                            other.getName(), String.join(", ", other.getColumns())),
                                    String.format("ALTER TABLE %s DROP INDEX %s;", table.getName(), candidate.getName()))
                            .withEvidence("covered_by", other.getName()));
                }
            }
        }

        log.debug("Found {} redundant indexes", findings.size());
        return findings;
    }

    /**
     * Tables with many rows read without any index.
     */
    public List<Finding> findFullScanTables(List<IndexUsage> usage) {
        List<Finding> findings = new ArrayList<>();

        for (IndexUsage row : usage) {
            if (row.isFullScan() && row.countRead() >= thresholds.getFullScanRowThreshold()) {
                findings.add(Finding.of(FindingType.FULL_SCAN_TABLE, row.schemaName() + "." + row.tableName(),
                                String.format("%,d rows were read from %s without an index", row.countRead(), row.tableName()),
                                "Find the statements scanning this table in sys.statements_with_full_table_scans")
                        .withEvidence("count_read", row.countRead())
                        .withEvidence("latency_ms", row.latencyMs()));
            }
        }
        return findings;
    }

    /**
     * Suggests an index for a single-table statement: equality columns, then one range column or the
     * ORDER BY columns, then the remaining referenced columns when the index can cover the statement.
     */
    public Optional<IndexSuggestion> suggestIndex(StatementProfile profile, DatabaseSchema schema) {
        if (profile == null || !profile.isSingleTable() || "INSERT".equals(profile.getOperation())) {
            return Optional.empty();
        }

        List<String> key = new ArrayList<>();
        for (String column : profile.getEqualityColumns()) {
            addUsable(key, column, profile);
        }
        if (!profile.getRangeColumns().isEmpty()) {
            profile.getRangeColumns().stream()
                    .filter(c -> isUsable(c, profile) && !containsIgnoreCase(key, c))
                    .findFirst()
                    .ifPresent(key::add);
        } else {
            for (String column : profile.getOrderByColumns()) {
                addUsable(key, column, profile);
            }
        }

        if (key.isEmpty()) {
            return Optional.empty();
        }

        String tableName = profile.getTables().get(0);
        Table table = schema != null ? schema.findTable(tableName) : null;
        if (table != null && table.getIndexes().stream().anyMatch(index -> leadsWith(index, key))) {
            log.debug("Existing index on {} already leads with {}", tableName, key);
            return Optional.empty();
        }

        List<String> columns = new ArrayList<>(key);
        boolean covering = false;
        if (profile.isSelect() && !profile.isSelectStar() && !profile.getSelectedColumns().isEmpty()) {
            List<String> extended = new ArrayList<>(key);
            for (String column : profile.referencedColumns()) {
                if (!containsIgnoreCase(extended, column)) {
                    extended.add(column);
                }
            }
            if (extended.size() <= MAX_COVERING_COLUMNS && profile.getFunctionColumns().isEmpty()) {
                columns = extended;
                covering = true;
            }
        }

        return Optional.of(IndexSuggestion.of(tableName, columns, covering));
    }

    /**
     * True when every column the statement reads is in the index.
     */
    public boolean isCovering(StatementProfile profile, Index index) {
        if (profile.isSelectStar()) {
            return false;
        }
        List<String> needed = profile.referencedColumns();
        return !needed.isEmpty() && needed.stream().allMatch(index::containsColumn);
    }

    /**
     * Statement-text patterns that keep MySQL from using an index well.
     */
    public List<Finding> findStatementIssues(StatementProfile profile) {
        List<Finding> findings = new ArrayList<>();
        String subject = profile.getTables().isEmpty() ? profile.getOperation() : String.join(", ", profile.getTables());

        for (String column : profile.getLeadingWildcardColumns()) {
            findings.add(Finding.of(FindingType.LEADING_WILDCARD_LIKE, subject,
                            "LIKE pattern on " + column + " starts with a wildcard, so no B-tree index can be used",
                            "Use a FULLTEXT index or store a reversed copy of the column for suffix searches")
                    .withEvidence("column", column));
        }

        for (String column : profile.getFunctionColumns()) {
            findings.add(Finding.of(FindingType.FUNCTION_ON_COLUMN, subject,
                            "Column " + column + " is wrapped in a function in the filter",
                            "Rewrite the predicate as a range on the bare column or add a functional index")
                    .withEvidence("column", column));
        }

        if (profile.isSelect() && profile.isSelectStar()) {
            findings.add(Finding.of(FindingType.SELECT_STAR, subject,
                    "SELECT * reads every column, which rules out covering indexes",
                    "List only the columns the application needs"));
        }

        if (profile.isOrderByRand()) {
            findings.add(Finding.of(FindingType.ORDER_BY_RAND, subject,
                    "ORDER BY RAND() sorts the whole result to pick rows",
                    "Pick random keys in the application or use a random offset on an indexed column"));
        } else if (profile.isSelect() && !profile.getOrderByColumns().isEmpty() && !profile.isHasLimit()) {
            findings.add(Finding.of(FindingType.UNBOUNDED_ORDER_BY, subject,
                    "ORDER BY without LIMIT sorts and returns the full result",
                    "Add LIMIT or paginate with a keyset predicate"));
        }

        return findings;
    }

    private boolean isRedundant(Index candidate, Index other, boolean candidateIsLater) {
        if (candidate.isPrimary()) {
            return false;
        }
        if (candidate.hasSameColumns(other)) {
            if (candidate.isUnique() && !other.isUnique()) {
                return false;
            }
            if (!candidate.isUnique() && other.isUnique()) {
                return true;
            }
            // Both unique or both plain: keep the first declared
            return candidateIsLater || other.isPrimary();
        }
        return !candidate.isUnique()
                && candidate.getColumns().size() < other.getColumns().size()
                && candidate.isLeftPrefixOf(other);
    }

    /**
     * Null when the schema has no definition for the index.
     */
    private static Boolean definedUniqueness(DatabaseSchema schema, String tableName, String indexName) {
        if (schema == null) {
            return null;
        }
        Table table = schema.findTable(tableName);
        Index index = table != null ? table.findIndex(indexName) : null;
        if (index == null) {
            return null;
        }
        return index.isUnique() || index.isPrimary();
    }

    private static Finding unusedIndexFinding(String schemaName, String tableName, String indexName,
                                              boolean knownNonUnique) {
        String recommendation = knownNonUnique
                ? String.format("Confirm over a full business cycle, then ALTER TABLE %s DROP INDEX %s;", tableName, indexName)
                : String.format("Check SHOW INDEX FROM %s.%s: if %s is not UNIQUE and stays unused over a full "
                        + "business cycle, it can be dropped", schemaName, tableName, indexName);
        return Finding.of(FindingType.UNUSED_INDEX, schemaName + "." + tableName + "." + indexName,
                        String.format("Index %s on %s has not been used since statistics were reset", indexName, tableName),
                        recommendation)
                .withEvidence("table", tableName)
                .withEvidence("uniqueness_known", knownNonUnique);
    }

    private static boolean leadsWith(Index index, List<String> prefix) {
        if (index.getColumns().size() < prefix.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!index.getColumns().get(i).equalsIgnoreCase(prefix.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static void addUsable(List<String> key, String column, StatementProfile profile) {
        if (isUsable(column, profile) && !containsIgnoreCase(key, column)) {
            key.add(column);
        }
    }

    private static boolean isUsable(String column, StatementProfile profile) {
        return !containsIgnoreCase(profile.getLeadingWildcardColumns(), column)
                && !containsIgnoreCase(profile.getFunctionColumns(), column);
    }

    private static boolean containsIgnoreCase(List<String> values, String value) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(value));
    }
}
