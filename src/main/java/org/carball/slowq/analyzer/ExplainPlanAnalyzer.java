package org.carball.slowq.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.model.analysis.Finding;
import org.carball.slowq.model.analysis.FindingType;
import org.carball.slowq.model.plan.AccessType;
import org.carball.slowq.model.plan.ExplainNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Looks for the expensive shapes in an EXPLAIN ANALYZE tree: scans, misestimates, loops, sorts.
 */
@Slf4j
public class ExplainPlanAnalyzer {

    private final DiagnosticThresholds thresholds;

    public ExplainPlanAnalyzer(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<Finding> analyze(ExplainNode root) {
        List<Finding> findings = new ArrayList<>();
        List<ExplainNode> nodes = root.flatten();

        for (ExplainNode node : nodes) {
            if (node.isNeverExecuted()) {
                continue;
            }
            checkFullTableScan(node, findings);
            checkRowEstimate(node, findings);
            checkNestedLoop(node, findings);
            checkFilesort(node, findings);
            checkTemporaryTable(node, findings);
        }
        checkExpensiveNode(root, nodes, findings);

        log.debug("Plan analysis produced {} findings over {} nodes", findings.size(), nodes.size());
        return findings;
    }

    /**
     * The node with the largest self time, if the plan carries measured timings.
     */
    public Optional<ExplainNode> hottestNode(ExplainNode root) {
        return root.flatten().stream()
                .filter(ExplainNode::hasActuals)
                .max(Comparator.comparingDouble(ExplainNode::selfTimeMs));
    }

    private void checkFullTableScan(ExplainNode node, List<Finding> findings) {
        if (node.getAccessType() != AccessType.TABLE_SCAN) {
            return;
        }
        double rows = node.effectiveRows();
        if (rows >= thresholds.getFullScanRowThreshold()) {
            findings.add(Finding.of(FindingType.FULL_TABLE_SCAN, subject(node),
                            String.format("Table scan on %s reads %.0f rows", subject(node), rows),
                            "Add an index on the columns this table is filtered or joined by")
                    .withEvidence("rows", rows)
                    .withEvidence("measured", node.hasActuals()));
        }
    }

    private void checkRowEstimate(ExplainNode node, List<Finding> findings) {
        if (!node.hasActuals() || node.getEstimatedRows() == null) {
            return;
        }
        double actual = node.getActualRows();
        double estimated = node.getEstimatedRows();
        double larger = Math.max(actual, estimated);
        double smaller = Math.max(Math.min(actual, estimated), 1.0);

        if (larger >= thresholds.getMisestimateMinRows() && larger / smaller >= thresholds.getMisestimateFactor()) {
            findings.add(Finding.of(FindingType.ROW_ESTIMATE_MISMATCH, subject(node),
                            String.format("Optimizer estimated %.0f rows but %.0f were produced (x%.1f)",
                                    estimated, actual, larger / smaller),
                            "Run ANALYZE TABLE or add a histogram (ANALYZE TABLE ... UPDATE HISTOGRAM ON ...)")
                    .withEvidence("operation", node.getOperation())
                    .withEvidence("estimated_rows", estimated)
                    .withEvidence("actual_rows", actual));
        }
    }

    private void checkNestedLoop(ExplainNode node, List<Finding> findings) {
        if (!isFullScan(node) || node.getLoops() == null) {
            return;
        }
        if (node.getLoops() >= thresholds.getNestedLoopThreshold()) {
            findings.add(Finding.of(FindingType.NESTED_LOOP_AMPLIFICATION, subject(node),
                            String.format("%s is repeated %d times inside a nested loop (%.0f rows in total)",
                                    node.getOperation(), node.getLoops(), node.totalActualRows()),
                            "Index the inner table's join column so each loop becomes a lookup")
                    .withEvidence("loops", node.getLoops())
                    .withEvidence("total_rows", node.totalActualRows()));
        }
    }

    private void checkFilesort(ExplainNode node, List<Finding> findings) {
        if (node.getAccessType() != AccessType.SORT) {
            return;
        }
        double rows = node.effectiveRows();
        if (rows >= thresholds.getFullScanRowThreshold()) {
            findings.add(Finding.of(FindingType.FILESORT, subject(node),
                            String.format("Sorts %.0f rows: %s", rows, node.getOperation()),
                            "An index whose column order matches ORDER BY avoids the sort")
                    .withEvidence("rows", rows));
        }
    }

    private void checkTemporaryTable(ExplainNode node, List<Finding> findings) {
        boolean temporary = node.getAccessType() == AccessType.TEMPORARY
                || node.getOperation().toLowerCase().contains("temporary table");
        if (temporary) {
            findings.add(Finding.of(FindingType.TEMPORARY_TABLE, subject(node),
                            "Plan materializes an intermediate result: " + node.getOperation(),
                            "Check whether GROUP BY, DISTINCT or a derived table can be served by an index")
                    .withEvidence("rows", node.effectiveRows()));
        }
    }

    private void checkExpensiveNode(ExplainNode root, List<ExplainNode> nodes, List<Finding> findings) {
        double total = root.totalTimeMs();
        if (nodes.size() < 2 || total <= 0) {
            return;
        }

        hottestNode(root).ifPresent(hottest -> {
            double share = hottest.selfTimeMs() / total * 100.0;
            if (share >= thresholds.getExpensiveNodeSharePercent()) {
                findings.add(Finding.of(FindingType.EXPENSIVE_PLAN_NODE, subject(hottest),
                                String.format("%.0f%% of execution time is spent in: %s", share, hottest.getOperation()),
                                "Focus tuning on this step of the plan")
                        .withEvidence("self_time_ms", hottest.selfTimeMs())
                        .withEvidence("total_time_ms", total));
            }
        });
    }

    // "Covering index scan" reads the whole index just like "Index scan"
    private static boolean isFullScan(ExplainNode node) {
        return node.getAccessType().isScan()
                || (node.getAccessType() == AccessType.COVERING_INDEX
                    && node.getOperation().toLowerCase().startsWith("covering index scan"));
    }

    private static String subject(ExplainNode node) {
        return node.getTable() != null ? node.getTable() : node.getOperation();
    }
}
