package org.carball.slowq.model.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DatabaseSchema {
    private List<Table> tables = new ArrayList<>();

    public void addTable(Table table) {
        tables.add(table);
    }

    public Table findTable(String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
    }

    public Table getOrCreateTable(String name) {
        Table table = findTable(name);
        if (table == null) {
            table = new Table(name);
            addTable(table);
        }
        return table;
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }
}
