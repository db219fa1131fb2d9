package org.carball.slowq.model.digest;

/**
 * Server-wide digest totals, independent of how many digests a capture keeps.
 */
public record WorkloadTotals(long digestCount, long executions, double latencyMs) {
}
