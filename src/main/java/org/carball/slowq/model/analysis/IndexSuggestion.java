package org.carball.slowq.model.analysis;

import java.util.List;

public record IndexSuggestion(
        String table,
        List<String> columns,
        boolean covering,
        String ddl
) {

    public static IndexSuggestion of(String table, List<String> columns, boolean covering) {
        String name = "idx_" + table + "_" + String.join("_", columns);
        if (name.length() > 64) {
            // MySQL identifier limit
            name = name.substring(0, 64);
        }
        String ddl = String.format("CREATE INDEX %s ON %s (%s);", name, table, String.join(", ", columns));
        return new IndexSuggestion(table, List.copyOf(columns), covering, ddl);
    }
}
