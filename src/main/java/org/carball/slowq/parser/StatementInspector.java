package org.carball.slowq.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectExpressionItem;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SubSelect;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.carball.slowq.model.digest.StatementProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the index-relevant shape of a statement: filtered, sorted, joined and selected columns.
 */
@Slf4j
public class StatementInspector {

    private static final Pattern OPERATION_PATTERN = Pattern.compile(
            "^\\s*(SELECT|INSERT|UPDATE|DELETE|REPLACE|WITH|CALL|SET|SHOW)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "(?:FROM|JOIN|UPDATE|INTO)\\s+`?(?:\\w+`?\\s*\\.\\s*`?)?(\\w+)`?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SUBQUERY_PATTERN = Pattern.compile("\\(\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern JOIN_PATTERN = Pattern.compile("\\bJOIN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT_STAR_PATTERN = Pattern.compile("^\\s*SELECT\\s+(?:\\w+\\.)?\\*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDER_BY_RAND_PATTERN = Pattern.compile("ORDER\\s+BY\\s+RAND\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT_PATTERN = Pattern.compile("\\bLIMIT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUP_BY_PATTERN = Pattern.compile("\\bGROUP\\s+BY\\b", Pattern.CASE_INSENSITIVE);

    private StatementInspector() {
        // Utility class - prevent instantiation
    }

    /**
     * Inspects a statement. Text that JSqlParser cannot handle is profiled with regular expressions.
     */
    public static StatementProfile inspect(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Statement text is empty");
        }

        if (!sql.trim().endsWith("...")) {
            try {
                Statement statement = CCJSqlParserUtil.parse(prepareForParser(sql));
                return inspectParsed(statement, sql);
            } catch (JSQLParserException | RuntimeException e) {
                log.debug("JSqlParser could not parse statement, using regex fallback: {}", e.getMessage());
            }
        } else {
            log.debug("Statement text is truncated, using regex fallback");
        }

        return inspectWithRegex(sql);
    }

    /**
     * Rewrites performance_schema digest text into something JSqlParser accepts.
     */
    static String prepareForParser(String sql) {
        String prepared = sql.trim();
        if (prepared.endsWith(";")) {
            prepared = prepared.substring(0, prepared.length() - 1);
        }
        return prepared
                .replace("(...)", "(?)")
                .replaceAll("`\\s*\\.\\s*`", "`.`")
                .replaceAll("\\s+", " ");
    }

    private static StatementProfile inspectParsed(Statement statement, String originalSql) {
        StatementProfile.StatementProfileBuilder builder = StatementProfile.builder()
                .parsed(true)
                .subqueryCount(countMatches(SUBQUERY_PATTERN, originalSql))
                .tables(findTables(statement, originalSql));

        ColumnCollector where = new ColumnCollector();

        if (statement instanceof Select select) {
            builder.operation("SELECT");
            if (select.getSelectBody() instanceof PlainSelect plainSelect) {
                inspectPlainSelect(plainSelect, builder, where);
            } else {
                // UNION and friends: only the outer shape is known
                builder.hasLimit(LIMIT_PATTERN.matcher(originalSql).find());
            }
        } else if (statement instanceof Update update) {
            builder.operation("UPDATE");
            accept(update.getWhere(), where);
            builder.joinCount(inspectJoins(update.getJoins(), where));
            builder.hasLimit(update.getLimit() != null);
            inspectOrderBy(update.getOrderByElements(), builder);
        } else if (statement instanceof Delete delete) {
            builder.operation("DELETE");
            accept(delete.getWhere(), where);
            builder.joinCount(inspectJoins(delete.getJoins(), where));
            builder.hasLimit(delete.getLimit() != null);
            inspectOrderBy(delete.getOrderByElements(), builder);
        } else if (statement instanceof Insert) {
            builder.operation("INSERT");
        } else {
            builder.operation(extractOperation(originalSql));
        }

        return builder
                .equalityColumns(where.equality)
                .rangeColumns(where.range)
                .joinColumns(where.join)
                .leadingWildcardColumns(where.leadingWildcard)
                .functionColumns(where.functions)
                .build();
    }

    private static void inspectPlainSelect(PlainSelect plainSelect,
                                           StatementProfile.StatementProfileBuilder builder,
                                           ColumnCollector where) {
        boolean selectStar = false;
        List<String> selected = new ArrayList<>();

        for (SelectItem item : plainSelect.getSelectItems()) {
            if (item instanceof AllColumns || item instanceof AllTableColumns) {
                selectStar = true;
            } else if (item instanceof SelectExpressionItem expressionItem
                    && expressionItem.getExpression() instanceof Column column) {
                addUnique(selected, columnName(column));
            }
        }

        accept(plainSelect.getWhere(), where);
        accept(plainSelect.getHaving(), where);

        builder.selectStar(selectStar)
                .selectedColumns(selected)
                .joinCount(inspectJoins(plainSelect.getJoins(), where))
                .hasLimit(plainSelect.getLimit() != null || plainSelect.getFetch() != null)
                .hasGroupBy(plainSelect.getGroupBy() != null);

        inspectOrderBy(plainSelect.getOrderByElements(), builder);
    }

    private static int inspectJoins(List<Join> joins, ColumnCollector where) {
        if (joins == null) {
            return 0;
        }
        for (Join join : joins) {
            accept(join.getOnExpression(), where);
        }
        return joins.size();
    }

    private static void inspectOrderBy(List<OrderByElement> orderBy, StatementProfile.StatementProfileBuilder builder) {
        List<String> columns = new ArrayList<>();
        boolean rand = false;

        if (orderBy != null) {
            for (OrderByElement element : orderBy) {
                Expression expression = element.getExpression();
                if (expression instanceof Column column) {
                    addUnique(columns, columnName(column));
                } else if (expression instanceof Function function
                        && function.getName() != null
                        && function.getName().equalsIgnoreCase("RAND")) {
                    rand = true;
                }
            }
        }

        builder.orderByColumns(columns).orderByRand(rand);
    }

    private static List<String> findTables(Statement statement, String originalSql) {
        try {
            List<String> tables = new ArrayList<>();
            for (String table : new TablesNamesFinder().getTableList(statement)) {
                addUnique(tables, cleanTableName(table));
            }
            return tables;
        } catch (UnsupportedOperationException e) {
            log.debug("TablesNamesFinder does not support statement, using regex: {}", e.getMessage());
            return extractTables(originalSql);
        }
    }

    private static StatementProfile inspectWithRegex(String sql) {
        return StatementProfile.builder()
                .parsed(false)
                .operation(extractOperation(sql))
                .tables(extractTables(sql))
                .selectStar(SELECT_STAR_PATTERN.matcher(sql).find())
                .orderByRand(ORDER_BY_RAND_PATTERN.matcher(sql).find())
                .hasLimit(LIMIT_PATTERN.matcher(sql).find())
                .hasGroupBy(GROUP_BY_PATTERN.matcher(sql).find())
                .joinCount(countMatches(JOIN_PATTERN, sql))
                .subqueryCount(countMatches(SUBQUERY_PATTERN, sql))
                .build();
    }

    private static String extractOperation(String sql) {
        Matcher matcher = OPERATION_PATTERN.matcher(sql);
        return matcher.find() ? matcher.group(1).toUpperCase() : "OTHER";
    }

    private static List<String> extractTables(String sql) {
        List<String> tables = new ArrayList<>();
        Matcher matcher = TABLE_PATTERN.matcher(sql);
        while (matcher.find()) {
            String table = matcher.group(1);
            if (!table.equalsIgnoreCase("SELECT") && !table.equalsIgnoreCase("DUAL")) {
                addUnique(tables, table);
            }
        }
        return tables;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static void accept(Expression expression, ColumnCollector collector) {
        if (expression != null) {
            expression.accept(collector);
        }
    }

    private static void addUnique(List<String> values, String value) {
        if (value != null && values.stream().noneMatch(v -> v.equalsIgnoreCase(value))) {
            values.add(value);
        }
    }

    private static String columnName(Column column) {
        return column.getColumnName().replace("`", "");
    }

    private static String cleanTableName(String table) {
        String cleaned = table.replace("`", "");
        int dot = cleaned.lastIndexOf('.');
        return dot >= 0 ? cleaned.substring(dot + 1) : cleaned;
    }

    /**
     * Sorts the columns of a WHERE or ON expression by how they are compared. Comparisons under an OR
     * are not index key candidates: one composite index cannot serve both sides of a disjunction.
     */
    private static class ColumnCollector extends ExpressionVisitorAdapter {
        private final List<String> equality = new ArrayList<>();
        private final List<String> range = new ArrayList<>();
        private final List<String> join = new ArrayList<>();
        private final List<String> leadingWildcard = new ArrayList<>();
        private final List<String> functions = new ArrayList<>();
        private int orDepth;

        @Override
        public void visit(OrExpression expr) {
            orDepth++;
            try {
                super.visit(expr);
            } finally {
                orDepth--;
            }
        }

        @Override
        public void visit(EqualsTo expr) {
            if (expr.getLeftExpression() instanceof Column left && expr.getRightExpression() instanceof Column right) {
                addUnique(join, columnName(left));
                addUnique(join, columnName(right));
            } else {
                comparison(expr, equality);
            }
        }

        @Override
        public void visit(GreaterThan expr) {
            comparison(expr, range);
        }

        @Override
        public void visit(GreaterThanEquals expr) {
            comparison(expr, range);
        }

        @Override
        public void visit(MinorThan expr) {
            comparison(expr, range);
        }

        @Override
        public void visit(MinorThanEquals expr) {
            comparison(expr, range);
        }

        @Override
        public void visit(Between expr) {
            operand(expr.getLeftExpression(), range);
        }

        @Override
        public void visit(InExpression expr) {
            operand(expr.getLeftExpression(), equality);
        }

        @Override
        public void visit(IsNullExpression expr) {
            if (!expr.isNot()) {
                operand(expr.getLeftExpression(), equality);
            }
        }

        @Override
        public void visit(LikeExpression expr) {
            if (expr.getRightExpression() instanceof StringValue pattern
                    && (pattern.getValue().startsWith("%") || pattern.getValue().startsWith("_"))) {
                operand(expr.getLeftExpression(), leadingWildcard);
            } else if (!expr.isNot()) {
                operand(expr.getLeftExpression(), range);
            }
        }

        @Override
        public void visit(Function function) {
            functionColumns(function);
        }

        @Override
        public void visit(SubSelect subSelect) {
            // Inner query blocks are profiled separately by MySQL
        }

        private void comparison(BinaryExpression expr, List<String> target) {
            if (expr.getLeftExpression() instanceof Column) {
                operand(expr.getLeftExpression(), target);
                operand(expr.getRightExpression(), null);
            } else if (expr.getRightExpression() instanceof Column) {
                operand(expr.getRightExpression(), target);
                operand(expr.getLeftExpression(), null);
            } else {
                operand(expr.getLeftExpression(), null);
                operand(expr.getRightExpression(), null);
            }
        }

        private void operand(Expression expression, List<String> target) {
            if (expression instanceof Column column) {
                boolean keyCandidate = target == equality || target == range;
                if (target != null && !(keyCandidate && orDepth > 0)) {
                    addUnique(target, columnName(column));
                }
            } else if (expression instanceof Function function) {
                functionColumns(function);
            }
        }

        private void functionColumns(Function function) {
            ExpressionList parameters = function.getParameters();
            if (parameters == null || parameters.getExpressions() == null) {
                return;
            }
            for (Expression parameter : parameters.getExpressions()) {
                if (parameter instanceof Column column) {
                    addUnique(functions, columnName(column));
                } else if (parameter instanceof Function nested) {
                    functionColumns(nested);
                }
            }
        }
    }
}
