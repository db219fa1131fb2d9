package org.carball.slowq.model.digest;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape of a single SQL statement as far as index selection is concerned.
 */
@Data
@Builder
public class StatementProfile {
    private String operation;

    @Builder.Default
    private List<String> tables = new ArrayList<>();

    private boolean selectStar;

    @Builder.Default
    private List<String> selectedColumns = new ArrayList<>();

    @Builder.Default
    private List<String> equalityColumns = new ArrayList<>();

    @Builder.Default
    private List<String> rangeColumns = new ArrayList<>();

    @Builder.Default
    private List<String> orderByColumns = new ArrayList<>();

    @Builder.Default
    private List<String> joinColumns = new ArrayList<>();

    @Builder.Default
    private List<String> leadingWildcardColumns = new ArrayList<>();

    @Builder.Default
    private List<String> functionColumns = new ArrayList<>();

    private boolean orderByRand;
    private boolean hasLimit;
    private boolean hasGroupBy;
    private int joinCount;
    private int subqueryCount;
    private boolean parsed;

    public boolean isSelect() {
        return "SELECT".equals(operation);
    }

    public boolean isSingleTable() {
        return tables.size() == 1 && joinCount == 0;
    }

    /**
     * Every column the statement needs from its table, in first-seen order.
     */
    public List<String> referencedColumns() {
        List<String> all = new ArrayList<>();
        for (List<String> group : List.of(equalityColumns, rangeColumns, orderByColumns, selectedColumns)) {
            for (String column : group) {
                if (all.stream().noneMatch(c -> c.equalsIgnoreCase(column))) {
                    all.add(column);
                }
            }
        }
        return all;
    }
}
