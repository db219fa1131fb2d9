package org.carball.slowq.model.plan;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One iterator of an EXPLAIN ANALYZE tree. Actual timings are per loop, as MySQL prints them.
 */
@Data
@Builder
public class ExplainNode {
    private String operation;
    private AccessType accessType;
    private String table;
    private String index;
    private int depth;

    // Optimizer estimates
    private Double costLow;
    private Double costHigh;
    private Double estimatedRows;

    // Measured values, absent for plain FORMAT=TREE output
    private Double actualFirstRowMs;
    private Double actualLastRowMs;
    private Double actualRows;
    private Long loops;
    private boolean neverExecuted;

    @Builder.Default
    private List<ExplainNode> children = new ArrayList<>();

    public void addChild(ExplainNode child) {
        children.add(child);
    }

    public boolean hasActuals() {
        return actualRows != null;
    }

    public long loopCount() {
        return loops != null ? loops : (neverExecuted ? 0 : 1);
    }

    /**
     * Rows produced across all loops.
     */
    public double totalActualRows() {
        return actualRows != null ? actualRows * loopCount() : 0.0;
    }

    public double totalTimeMs() {
        return actualLastRowMs != null ? actualLastRowMs * loopCount() : 0.0;
    }

    public double selfTimeMs() {
        double childTime = children.stream()
                .mapToDouble(ExplainNode::totalTimeMs)
                .sum();
        return Math.max(0.0, totalTimeMs() - childTime);
    }

    /**
     * Rows the node handled: measured when available, otherwise the optimizer estimate.
     */
    public double effectiveRows() {
        if (hasActuals()) {
            return totalActualRows();
        }
        return estimatedRows != null ? estimatedRows : 0.0;
    }

    /**
     * This node followed by all of its descendants, depth first.
     */
    public List<ExplainNode> flatten() {
        List<ExplainNode> nodes = new ArrayList<>();
        collect(this, nodes);
        return nodes;
    }

    private static void collect(ExplainNode node, List<ExplainNode> nodes) {
        nodes.add(node);
        for (ExplainNode child : node.getChildren()) {
            collect(child, nodes);
        }
    }
}
