package org.carball.slowq.model.schema;

import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@RequiredArgsConstructor
public class Table {
    private final String name;
    private List<Column> columns = new ArrayList<>();
    private List<Index> indexes = new ArrayList<>();

    public void addColumn(Column column) {
        columns.add(column);
    }

    public void addIndex(Index index) {
        indexes.add(index);
    }

    public Column findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst()
                .orElse(null);
    }

    public Index findIndex(String indexName) {
        return indexes.stream()
                .filter(i -> i.getName().equalsIgnoreCase(indexName))
                .findFirst()
                .orElse(null);
    }

    public Index getPrimaryKey() {
        return indexes.stream()
                .filter(Index::isPrimary)
                .findFirst()
                .orElse(null);
    }
}
