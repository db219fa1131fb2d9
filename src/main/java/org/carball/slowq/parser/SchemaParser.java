package org.carball.slowq.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.ForeignKeyIndex;
import org.carball.slowq.model.schema.Column;
import org.carball.slowq.model.schema.DatabaseSchema;
import org.carball.slowq.model.schema.Index;
import org.carball.slowq.model.schema.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds a {@link DatabaseSchema} from MySQL DDL such as mysqldump --no-data output.
 */
@Slf4j
public class SchemaParser {

    private static final Pattern CONDITIONAL_COMMENT = Pattern.compile("/\\*!.*?\\*/;?", Pattern.DOTALL);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("(?m)^\\s*(?:--|#).*$");
    private static final Pattern TABLE_OPTIONS = Pattern.compile(
            "\\)\\s*(?:ENGINE|DEFAULT|CHARSET|CHARACTER|COLLATE|AUTO_INCREMENT|ROW_FORMAT|COMMENT|STATS_\\w+|KEY_BLOCK_SIZE)\\b[^()]*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SKIPPED_STATEMENT = Pattern.compile(
            "^(?:DROP|LOCK|UNLOCK|INSERT|SET|USE)\\b.*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private SchemaParser() {
        // Utility class - prevent instantiation
    }

    public static DatabaseSchema parseDDL(Path ddlFile) throws IOException {
        String content = Files.readString(ddlFile);
        return parseDDL(content);
    }

    public static DatabaseSchema parseDDL(String ddlContent) {
        DatabaseSchema schema = new DatabaseSchema();

        try {
            String processedDDL = preprocessDDL(ddlContent);
            if (processedDDL.isBlank()) {
                return schema;
            }

            Statements statements = CCJSqlParserUtil.parseStatements(processedDDL);

            // Tables first so that standalone CREATE INDEX can find them
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    Table table = convertTable(createTable);
                    schema.addTable(table);
                    log.debug("Parsed table: {} ({} indexes)", table.getName(), table.getIndexes().size());
                }
            }

            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateIndex createIndex) {
                    processCreateIndex(createIndex, schema);
                } else if (!(statement instanceof CreateTable)) {
                    log.debug("Ignoring DDL statement: {}", statement.getClass().getSimpleName());
                }
            }

        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        return schema;
    }

    private static String preprocessDDL(String ddlContent) {
        String processed = CONDITIONAL_COMMENT.matcher(ddlContent).replaceAll("");
        processed = BLOCK_COMMENT.matcher(processed).replaceAll("");
        processed = LINE_COMMENT.matcher(processed).replaceAll("");

        List<String> kept = new ArrayList<>();
        for (String statement : splitStatements(processed)) {
            String trimmed = statement.trim();
            if (trimmed.isEmpty() || SKIPPED_STATEMENT.matcher(trimmed).matches()) {
                continue;
            }
            // JSqlParser does not know every MySQL table option
            kept.add(TABLE_OPTIONS.matcher(trimmed).replaceAll(")") + ";");
        }
        return String.join("\n", kept);
    }

    /**
     * Splits on semicolons that are outside quoted strings and identifiers.
     */
    private static List<String> splitStatements(String ddl) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;

        for (int i = 0; i < ddl.length(); i++) {
            char c = ddl.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < ddl.length()) {
                    current.append(ddl.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                current.append(c);
            } else if (c == ';') {
                statements.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        statements.add(current.toString());
        return statements;
    }

    private static Table convertTable(CreateTable createTable) {
        String tableName = cleanIdentifier(createTable.getTable().getName());
        Table table = new Table(tableName);

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                Column column = convertColumn(colDef);
                table.addColumn(column);

                if (column.isPrimaryKey()) {
                    table.addIndex(Index.builder()
                            .name(Index.PRIMARY)
                            .columns(List.of(column.getName()))
                            .unique(true)
                            .primary(true)
                            .build());
                } else if (hasSpec(colDef, "UNIQUE")) {
                    // MySQL names an inline unique key after its column
                    table.addIndex(Index.builder()
                            .name(column.getName())
                            .columns(List.of(column.getName()))
                            .unique(true)
                            .build());
                }
            }
        }

        if (createTable.getIndexes() != null) {
            List<ForeignKeyIndex> foreignKeys = new ArrayList<>();
            for (net.sf.jsqlparser.statement.create.table.Index index : createTable.getIndexes()) {
                if (index instanceof ForeignKeyIndex fkIndex) {
                    foreignKeys.add(fkIndex);
                } else {
                    processIndex(index, table);
                }
            }
            // InnoDB adds an index for a foreign key unless one already leads with its columns
            foreignKeys.forEach(fk -> processForeignKey(fk, table));
        }

        return table;
    }

    private static Column convertColumn(ColumnDefinition colDef) {
        Column.ColumnBuilder builder = Column.builder()
                .name(cleanIdentifier(colDef.getColumnName()))
                .dataType(colDef.getColDataType().getDataType())
                .nullable(true);

        if (colDef.getColumnSpecs() != null) {
            List<String> specs = colDef.getColumnSpecs();
            for (int i = 0; i < specs.size(); i++) {
                String upperSpec = specs.get(i).toUpperCase(Locale.ROOT);
                String nextSpec = i + 1 < specs.size() ? specs.get(i + 1).toUpperCase(Locale.ROOT) : "";

                if (upperSpec.equals("NOT NULL") || (upperSpec.equals("NOT") && nextSpec.equals("NULL"))) {
                    builder.nullable(false);
                } else if (upperSpec.equals("PRIMARY") || upperSpec.contains("PRIMARY KEY")) {
                    builder.primaryKey(true).nullable(false);
                } else if (upperSpec.equals("AUTO_INCREMENT")) {
                    builder.autoIncrement(true);
                } else if (upperSpec.equals("DEFAULT") && i + 1 < specs.size()) {
                    builder.defaultValue(specs.get(i + 1));
                }
            }
        }

        return builder.build();
    }

    private static boolean hasSpec(ColumnDefinition colDef, String spec) {
        return colDef.getColumnSpecs() != null
                && colDef.getColumnSpecs().stream().anyMatch(s -> s.equalsIgnoreCase(spec));
    }

    static void processIndex(net.sf.jsqlparser.statement.create.table.Index index, Table table) {
        List<String> indexColumns = cleanColumns(index.getColumnsNames());
        String type = index.getType() != null ? index.getType().toUpperCase(Locale.ROOT) : "";

        if (indexColumns.isEmpty()) {
            // Functional key parts only: nothing to compare by column
            log.warn("Skipping {} {} on {} without plain columns", type.isEmpty() ? "index" : type,
                    index.getName() != null ? cleanIdentifier(index.getName()) : "(unnamed)", table.getName());
            return;
        }

        if (type.contains("PRIMARY")) {
            table.addIndex(Index.builder()
                    .name(Index.PRIMARY)
                    .columns(indexColumns)
                    .unique(true)
                    .primary(true)
                    .build());
            indexColumns.forEach(name -> {
                Column column = table.findColumn(name);
                if (column != null) {
                    column.setPrimaryKey(true);
                    column.setNullable(false);
                }
            });
            return;
        }

        String name = index.getName() != null ? cleanIdentifier(index.getName()) : indexColumns.get(0);
        table.addIndex(Index.builder()
                .name(name)
                .columns(indexColumns)
                .unique(type.contains("UNIQUE"))
                .build());
    }

    private static void processForeignKey(ForeignKeyIndex fkIndex, Table table) {
        List<String> columns = cleanColumns(fkIndex.getColumnsNames());
        if (columns.isEmpty()) {
            return;
        }

        boolean covered = table.getIndexes().stream()
                .anyMatch(existing -> existing.getColumns().size() >= columns.size()
                        && Index.builder().columns(columns).build().isLeftPrefixOf(existing));
        if (!covered) {
            String name = fkIndex.getName() != null ? cleanIdentifier(fkIndex.getName()) : columns.get(0);
            table.addIndex(Index.builder().name(name).columns(columns).build());
            log.debug("Added implicit foreign key index {} on {}", name, table.getName());
        }
    }

    private static void processCreateIndex(CreateIndex createIndex, DatabaseSchema schema) {
        String tableName = cleanIdentifier(createIndex.getTable().getName());
        net.sf.jsqlparser.statement.create.table.Index index = createIndex.getIndex();
        String type = index.getType() != null ? index.getType().toUpperCase(Locale.ROOT) : "";

        Table table = schema.getOrCreateTable(tableName);
        table.addIndex(Index.builder()
                .name(cleanIdentifier(index.getName()))
                .columns(cleanColumns(index.getColumnsNames()))
                .unique(type.contains("UNIQUE"))
                .build());
        log.debug("Parsed index {} on {}", index.getName(), tableName);
    }

    private static List<String> cleanColumns(List<String> columns) {
        if (columns == null) {
            return new ArrayList<>();
        }
        return columns.stream()
                .map(SchemaParser::cleanIdentifier)
                .map(c -> c.replaceAll("\\s*\\(\\d+\\)$", ""))
                .collect(Collectors.toList());
    }

    private static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;
        return identifier.replaceAll("[`\"]", "").trim();
    }
}
