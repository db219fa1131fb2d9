package org.carball.slowq.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.model.analysis.WorkloadAnalysis;
import org.carball.slowq.model.analysis.WorkloadMetrics;
import org.carball.slowq.model.digest.DigestStatement;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Summarizes a set of digests: totals, operation mix and where the latency goes.
 */
@Slf4j
public class WorkloadAnalyzer {

    private static final Pattern OPERATION_PATTERN = Pattern.compile(
            "^\\s*\\(?\\s*(SELECT|INSERT|UPDATE|DELETE|REPLACE|WITH|CALL|COMMIT|BEGIN|SET|SHOW)\\b",
            Pattern.CASE_INSENSITIVE);

    // Statement keyword that follows the CTE list of a WITH statement
    private static final Pattern CTE_BODY_PATTERN = Pattern.compile(
            "\\b(SELECT|INSERT|UPDATE|DELETE|REPLACE)\\b", Pattern.CASE_INSENSITIVE);

    private static final Set<String> WRITE_OPERATIONS = Set.of("INSERT", "UPDATE", "DELETE", "REPLACE");

    private WorkloadAnalyzer() {
        // Utility class - prevent instantiation
    }

    public static WorkloadAnalysis analyze(List<DigestStatement> digests, DiagnosticThresholds thresholds) {
        return analyze(digests, thresholds, 0L, 0.0);
    }

    /**
     * Analyzes a captured slice of a larger workload. When the server-wide totals are known (non-zero),
     * they become the workload totals and the denominator of every latency share.
     */
    public static WorkloadAnalysis analyze(List<DigestStatement> digests, DiagnosticThresholds thresholds,
                                           long workloadExecutions, double workloadLatencyMs) {
        List<DigestStatement> eligible = digests.stream()
                .filter(d -> d.execCount() >= thresholds.getMinExecutions())
                .collect(Collectors.toList());

        if (eligible.isEmpty()) {
            log.info("No digests with at least {} executions", thresholds.getMinExecutions());
            return new WorkloadAnalysis(WorkloadMetrics.empty(), Map.of(), Map.of(), List.of());
        }

        double capturedLatency = eligible.stream().mapToDouble(DigestStatement::totalLatencyMs).sum();
        long capturedExecutions = eligible.stream().mapToLong(DigestStatement::execCount).sum();
        double totalLatency = Math.max(capturedLatency, workloadLatencyMs);
        long totalExecutions = Math.max(capturedExecutions, workloadExecutions);
        if (totalLatency > capturedLatency) {
            log.debug("Captured digests cover {} of {} ms workload latency", capturedLatency, totalLatency);
        }

        Map<String, Long> operations = new LinkedHashMap<>();
        Map<String, Double> shares = new LinkedHashMap<>();
        for (DigestStatement digest : eligible) {
            operations.merge(operationOf(digest.digestText()), digest.execCount(), Long::sum);
            double share = totalLatency > 0 ? digest.totalLatencyMs() / totalLatency * 100.0 : 0.0;
            shares.merge(digest.key(), share, Double::sum);
        }

        long reads = operations.getOrDefault("SELECT", 0L) + operations.getOrDefault("WITH", 0L);
        long writes = operations.entrySet().stream()
                .filter(e -> WRITE_OPERATIONS.contains(e.getKey()))
                .mapToLong(Map.Entry::getValue)
                .sum();

        WorkloadMetrics metrics = new WorkloadMetrics(
                eligible.size(),
                totalExecutions,
                totalLatency,
                eligible.stream().mapToDouble(DigestStatement::lockLatencyMs).sum(),
                eligible.stream().mapToLong(DigestStatement::rowsExamined).sum(),
                eligible.stream().mapToLong(DigestStatement::rowsSent).sum(),
                (int) eligible.stream().filter(d -> d.avgLatencyMs() >= thresholds.getSlowQueryMs()).count(),
                (int) eligible.stream().filter(d -> d.noIndexUsedCount() > 0).count(),
                (double) reads / Math.max(writes, 1)
        );

        List<DigestStatement> top = eligible.stream()
                .sorted(Comparator.comparingDouble(DigestStatement::totalLatencyMs).reversed())
                .limit(Math.max(thresholds.getTopDigests(), 0))
                .collect(Collectors.toList());

        log.info("Workload: {} digests, {} executions, {} slow, {} with full scans",
                metrics.digestCount(), metrics.totalExecutions(), metrics.slowDigests(), metrics.fullScanDigests());

        return new WorkloadAnalysis(metrics, operations, shares, top);
    }

    static String operationOf(String statement) {
        if (statement == null) {
            return "OTHER";
        }
        Matcher matcher = OPERATION_PATTERN.matcher(statement);
        if (!matcher.find()) {
            return "OTHER";
        }
        String operation = matcher.group(1).toUpperCase();
        return "WITH".equals(operation) ? cteOperation(statement.substring(matcher.end())) : operation;
    }

    /**
     * A WITH statement is a read unless the statement after its CTE list writes.
     */
    private static String cteOperation(String afterWith) {
        StringBuilder topLevel = new StringBuilder();
        int depth = 0;
        for (char c : afterWith.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(depth - 1, 0);
            } else if (depth == 0) {
                topLevel.append(c);
            }
        }

        Matcher body = CTE_BODY_PATTERN.matcher(topLevel);
        if (body.find()) {
            String operation = body.group(1).toUpperCase();
            if (WRITE_OPERATIONS.contains(operation)) {
                return operation;
            }
        }
        return "WITH";
    }
}
