package org.carball.slowq.model.analysis;

import org.carball.slowq.model.digest.DigestStatement;

import java.util.List;
import java.util.Map;

public record WorkloadAnalysis(
        WorkloadMetrics metrics,
        Map<String, Long> operationBreakdown,
        Map<String, Double> latencySharePercent,
        List<DigestStatement> topDigests
) {

    /**
     * Share of total workload latency spent in the given digest, in percent.
     */
    public double shareOf(DigestStatement digest) {
        return shareOf(digest.key());
    }

    /**
     * Share keyed by {@link DigestStatement#key()}.
     */
    public double shareOf(String digestKey) {
        return latencySharePercent.getOrDefault(digestKey, 0.0);
    }
}
