package org.carball.slowq.model.analysis;

public record WorkloadMetrics(
        int digestCount,
        long totalExecutions,
        double totalLatencyMs,
        double totalLockLatencyMs,
        long totalRowsExamined,
        long totalRowsSent,
        int slowDigests,
        int fullScanDigests,
        double readWriteRatio
) {

    public static WorkloadMetrics empty() {
        return new WorkloadMetrics(0, 0, 0.0, 0.0, 0, 0, 0, 0, 0.0);
    }
}
