package org.carball.slowq.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.model.plan.AccessType;
import org.carball.slowq.model.plan.ExplainNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the TREE output of EXPLAIN ANALYZE (or EXPLAIN FORMAT=TREE) into a node hierarchy.
 */
@Slf4j
public class ExplainAnalyzeParser {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?)";
    private static final int INDENT_WIDTH = 4;

    private static final Pattern COST_PATTERN = Pattern.compile(
            "\\(cost=" + NUMBER + "(?:\\.\\." + NUMBER + ")?\\s+rows=" + NUMBER + "\\)");

    private static final Pattern ROWS_ONLY_PATTERN = Pattern.compile(
            "\\(rows=" + NUMBER + "\\)");

    private static final Pattern ACTUAL_PATTERN = Pattern.compile(
            "\\(actual time=" + NUMBER + "\\.\\." + NUMBER + "\\s+rows=" + NUMBER + "\\s+loops=" + NUMBER + "\\)");

    private static final Pattern NEVER_EXECUTED_PATTERN = Pattern.compile("\\(never executed\\)");

    private static final Pattern TABLE_PATTERN = Pattern.compile("\\bon\\s+([`\\w.$<>]+)");
    private static final Pattern INDEX_PATTERN = Pattern.compile("\\busing\\s+([`\\w$]+)");

    private ExplainAnalyzeParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses EXPLAIN ANALYZE text and returns the root node.
     */
    public static ExplainNode parse(String explainText) {
        if (explainText == null || explainText.isBlank()) {
            throw new IllegalArgumentException("EXPLAIN output is empty");
        }

        List<RawLine> lines = collectLines(explainText);
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("EXPLAIN output contains no plan nodes ('->' lines)");
        }

        ExplainNode root = null;
        Deque<ExplainNode> stack = new ArrayDeque<>();

        for (RawLine line : lines) {
            ExplainNode node = toNode(line);

            while (!stack.isEmpty() && stack.peek().getDepth() >= node.getDepth()) {
                stack.pop();
            }

            if (stack.isEmpty()) {
                if (root == null) {
                    root = node;
                } else {
                    log.debug("Second top-level plan node '{}' attached under root", node.getOperation());
                    root.addChild(node);
                }
            } else {
                stack.peek().addChild(node);
            }
            stack.push(node);
        }

        log.debug("Parsed EXPLAIN tree with {} nodes", root.flatten().size());
        return root;
    }

    private static List<RawLine> collectLines(String explainText) {
        String text = explainText.replace("\\n", "\n").replace("\r", "");
        List<RawLine> lines = new ArrayList<>();

        for (String rawLine : text.split("\n")) {
            String line = stripClientFrame(rawLine);
            if (line == null || line.isBlank()) {
                continue;
            }

            int arrow = line.indexOf("->");
            boolean startsNode = arrow >= 0 && line.substring(0, arrow).isBlank();

            if (startsNode) {
                int depth = arrow / INDENT_WIDTH;
                lines.add(new RawLine(depth, line.substring(arrow + 2).trim()));
            } else if (!lines.isEmpty()) {
                // Wrapped operation text belongs to the previous node
                lines.get(lines.size() - 1).text.append(' ').append(line.trim());
            } else {
                log.debug("Ignoring text before first plan node: {}", line.trim());
            }
        }
        return lines;
    }

    private static String stripClientFrame(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("+-") || trimmed.startsWith("***")
                || trimmed.matches("\\|\\s*EXPLAIN\\s*\\|")
                || trimmed.matches("\\d+ rows? in set.*")) {
            return null;
        }

        String stripped = line;
        if (stripped.startsWith("| ")) {
            stripped = stripped.substring(2);
        } else if (stripped.startsWith("|")) {
            stripped = stripped.substring(1);
        }
        if (stripped.startsWith("EXPLAIN: ")) {
            stripped = stripped.substring("EXPLAIN: ".length());
        }
        return stripped.replaceFirst("\\s*\\|\\s*$", "");
    }

    private static ExplainNode toNode(RawLine line) {
        String text = line.text.toString();
        ExplainNode.ExplainNodeBuilder builder = ExplainNode.builder().depth(line.depth);

        int operationEnd = text.length();
        Matcher cost = COST_PATTERN.matcher(text);
        if (cost.find()) {
            builder.costLow(Double.parseDouble(cost.group(1)));
            builder.costHigh(cost.group(2) != null ? Double.parseDouble(cost.group(2)) : Double.parseDouble(cost.group(1)));
            builder.estimatedRows(Double.parseDouble(cost.group(3)));
            operationEnd = Math.min(operationEnd, cost.start());
        } else {
            Matcher rowsOnly = ROWS_ONLY_PATTERN.matcher(text);
            if (rowsOnly.find()) {
                builder.estimatedRows(Double.parseDouble(rowsOnly.group(1)));
                operationEnd = Math.min(operationEnd, rowsOnly.start());
            }
        }

        Matcher actual = ACTUAL_PATTERN.matcher(text);
        if (actual.find()) {
            builder.actualFirstRowMs(Double.parseDouble(actual.group(1)));
            builder.actualLastRowMs(Double.parseDouble(actual.group(2)));
            builder.actualRows(Double.parseDouble(actual.group(3)));
            builder.loops((long) Double.parseDouble(actual.group(4)));
            operationEnd = Math.min(operationEnd, actual.start());
        }

        Matcher never = NEVER_EXECUTED_PATTERN.matcher(text);
        if (never.find()) {
            builder.neverExecuted(true);
            operationEnd = Math.min(operationEnd, never.start());
        }

        String operation = text.substring(0, operationEnd).trim();
        AccessType accessType = classify(operation);
        builder.operation(operation).accessType(accessType);

        if (accessType.readsTable() || accessType == AccessType.TEMPORARY) {
            Matcher table = TABLE_PATTERN.matcher(operation);
            if (table.find()) {
                builder.table(cleanIdentifier(table.group(1)));
            }
            Matcher index = INDEX_PATTERN.matcher(operation);
            if (index.find()) {
                builder.index(cleanIdentifier(index.group(1)));
            }
        }

        return builder.build();
    }

    /**
     * Classifies a plan node by its operation text.
     */
    static AccessType classify(String operation) {
        String op = operation.toLowerCase();

        if (op.contains("<temporary>") || op.startsWith("materialize") || op.startsWith("temporary table")) {
            return AccessType.TEMPORARY;
        } else if (op.startsWith("table scan")) {
            return AccessType.TABLE_SCAN;
        } else if (op.startsWith("single-row")) {
            return AccessType.UNIQUE_LOOKUP;
        } else if (op.startsWith("covering index")) {
            return AccessType.COVERING_INDEX;
        } else if (op.startsWith("index range scan") || op.startsWith("index skip scan")
                || op.startsWith("multi-range index")) {
            return AccessType.INDEX_RANGE_SCAN;
        } else if (op.startsWith("index scan")) {
            return AccessType.INDEX_SCAN;
        } else if (op.startsWith("index lookup")) {
            return AccessType.INDEX_LOOKUP;
        } else if (op.startsWith("full-text")) {
            return AccessType.FULLTEXT;
        } else if (op.startsWith("filter")) {
            return AccessType.FILTER;
        } else if (op.startsWith("sort")) {
            return AccessType.SORT;
        } else if (op.contains("aggregate")) {
            return AccessType.AGGREGATE;
        } else if (op.contains("join") || op.startsWith("nested loop")) {
            return AccessType.JOIN;
        } else if (op.startsWith("limit")) {
            return AccessType.LIMIT;
        }
        return AccessType.OTHER;
    }

    private static String cleanIdentifier(String identifier) {
        return identifier.replace("`", "");
    }

    private static final class RawLine {
        private final int depth;
        private final StringBuilder text;

        private RawLine(int depth, String text) {
            this.depth = depth;
            this.text = new StringBuilder(text);
        }
    }
}
