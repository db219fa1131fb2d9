package org.carball.slowq.model.schema;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class Index {
    public static final String PRIMARY = "PRIMARY";

    private String name;
    private List<String> columns;
    private boolean unique;
    private boolean primary;

    /**
     * True when this index's columns form a left prefix of the other index's columns.
     */
    public boolean isLeftPrefixOf(Index other) {
        if (columns.size() > other.getColumns().size()) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).equalsIgnoreCase(other.getColumns().get(i))) {
                return false;
            }
        }
        return true;
    }

    public boolean hasSameColumns(Index other) {
        return columns.size() == other.getColumns().size() && isLeftPrefixOf(other);
    }

    public boolean containsColumn(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }
}
