package org.carball.slowq.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.model.analysis.DiagnosticResult;
import org.carball.slowq.model.analysis.DigestDiagnosis;
import org.carball.slowq.model.analysis.Finding;
import org.carball.slowq.model.analysis.IndexSuggestion;
import org.carball.slowq.model.analysis.Severity;
import org.carball.slowq.model.analysis.WorkloadMetrics;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.plan.ExplainNode;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class DiagnosticReport {

    private static final int SQL_PREVIEW_LENGTH = 200;

    private final DiagnosticResult result;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public DiagnosticReport(DiagnosticResult result) {
        this.result = result;
        this.timestamp = result.getGeneratedAt() != null ? result.getGeneratedAt() : LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new UncheckedIOException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        SnapshotMetadata metadata = result.getMetadata();
        WorkloadMetrics metrics = result.getWorkload().metrics();

        // Header
        md.append("# MySQL Slow Query Diagnostic Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (metadata != null) {
            md.append("**Source:** ").append(metadata.source()).append("  \n");
            md.append("**Server Version:** ").append(metadata.serverVersion()).append("  \n");
            if (metadata.schemaName() != null) {
                md.append("**Schema:** ").append(metadata.schemaName()).append("  \n");
            }
        }
        md.append("**Thresholds:** ").append(result.getThresholdSummary()).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Digests Analyzed | ").append(metrics.digestCount()).append(" |\n");
        md.append("| Total Executions | ").append(String.format("%,d", metrics.totalExecutions())).append(" |\n");
        md.append("| Total Latency | ").append(formatMs(metrics.totalLatencyMs())).append(" |\n");
        md.append("| Lock Latency | ").append(formatMs(metrics.totalLockLatencyMs())).append(" |\n");
        md.append("| Rows Examined / Sent | ").append(String.format("%,d / %,d", metrics.totalRowsExamined(), metrics.totalRowsSent())).append(" |\n");
        md.append("| Slow Digests | ").append(metrics.slowDigests()).append(" |\n");
        md.append("| Digests With Full Scans | ").append(metrics.fullScanDigests()).append(" |\n");
        md.append("| Read/Write Ratio | ").append(String.format("%.2f", metrics.readWriteRatio())).append(" |\n\n");

        Map<Severity, Long> severityCounts = result.countBySeverity();
        if (!severityCounts.isEmpty()) {
            md.append("| Severity | Digests |\n");
            md.append("|----------|---------|\n");
            for (Severity severity : reversed(Severity.values())) {
                if (severityCounts.containsKey(severity)) {
                    md.append("| ").append(severity).append(" | ").append(severityCounts.get(severity)).append(" |\n");
                }
            }
            md.append("\n");
        }

        // Severity guide
        md.append("### Severity Guide\n\n");
        md.append("| Severity | Meaning |\n");
        md.append("|----------|---------|\n");
        md.append("| 🔴 **CRITICAL** | Dominates the workload and fails several checks - fix first |\n");
        md.append("| 🟠 **HIGH** | Slow or scanning on a hot path |\n");
        md.append("| 🟡 **MEDIUM** | Worth fixing during regular tuning |\n");
        md.append("| 🟢 **LOW** | Minor inefficiency |\n");
        md.append("| ⚪ **INFO** | No threshold crossed |\n\n");

        // Top digests
        md.append("## Top Digests\n\n");
        if (result.getDiagnoses().isEmpty()) {
            md.append("**No statement digests met the analysis criteria.**\n\n");
        } else {
            md.append("| # | Severity | Score | Executions | Total | Avg | P95 | Share | Statement |\n");
            md.append("|---|----------|-------|------------|-------|-----|-----|-------|-----------|\n");
            int rank = 1;
            for (DigestDiagnosis diagnosis : result.getDiagnoses()) {
                DigestStatement statement = diagnosis.getStatement();
                md.append("| ").append(rank++)
                        .append(" | ").append(diagnosis.getSeverity())
                        .append(" | ").append(diagnosis.getScore())
                        .append(" | ").append(String.format("%,d", statement.execCount()))
                        .append(" | ").append(formatMs(statement.totalLatencyMs()))
                        .append(" | ").append(formatMs(statement.avgLatencyMs()))
                        .append(" | ").append(formatMs(statement.p95LatencyMs()))
                        .append(" | ").append(String.format("%.1f%%", diagnosis.getLatencySharePercent()))
                        .append(" | `").append(escapeCell(preview(statement.digestText(), 80))).append("` |\n");
            }
            md.append("\n");
        }

        // Findings per digest
        md.append("## Digest Findings\n\n");
        int number = 1;
        for (DigestDiagnosis diagnosis : result.getDiagnoses()) {
            DigestStatement statement = diagnosis.getStatement();
            md.append("### ").append(number++).append(". ").append(diagnosis.getSeverity())
                    .append(" (score ").append(diagnosis.getScore()).append(")\n\n");
            md.append("- **Digest:** `").append(statement.digest()).append("`\n");
            if (statement.schemaName() != null) {
                md.append("- **Schema:** ").append(statement.schemaName()).append("\n");
            }
            md.append("- **Rows Examined per Row Sent:** ").append(String.format("%.1f", statement.rowsExaminedPerRowSent())).append("\n");
            hottestStep(diagnosis).ifPresent(step -> md.append("- **Hottest Plan Step:** ").append(step).append("\n"));
            md.append("\n```sql\n").append(preview(statement.bestText(), SQL_PREVIEW_LENGTH * 5)).append("\n```\n\n");

            if (diagnosis.getFindings().isEmpty()) {
                md.append("No issues found.\n\n");
            }
            for (Finding finding : diagnosis.getFindings()) {
                appendFinding(md, finding);
            }

            IndexSuggestion suggestion = diagnosis.getIndexSuggestion();
            if (suggestion != null) {
                md.append("**Suggested index").append(suggestion.covering() ? " (covering)" : "").append(":**\n\n");
                md.append("```sql\n").append(suggestion.ddl()).append("\n```\n\n");
            }
        }

        // Index health
        md.append("## Index Health\n\n");
        if (result.getIndexFindings().isEmpty()) {
            md.append("No unused, redundant or unindexed-scan findings.\n\n");
        } else {
            md.append("| Severity | Finding | Subject | Recommendation |\n");
            md.append("|----------|---------|---------|----------------|\n");
            for (Finding finding : result.getIndexFindings()) {
                md.append("| ").append(finding.getSeverity())
                        .append(" | ").append(finding.getType().getTitle())
                        .append(" | ").append(escapeCell(finding.getSubject()))
                        .append(" | `").append(escapeCell(finding.getRecommendation())).append("` |\n");
            }
            md.append("\n");
        }

        // Next Steps
        md.append("## Next Steps\n\n");
        md.append("1. **Start at the top:** Work through CRITICAL and HIGH digests in the order listed\n");
        md.append("2. **Confirm with EXPLAIN ANALYZE:** Re-run the plan for each candidate fix on a replica\n");
        md.append("3. **Apply indexes carefully:** Use online DDL and check write latency afterwards\n");
        md.append("4. **Drop unused indexes last:** Confirm they stay unused over a full business cycle\n");
        md.append("5. **Measure again:** Reset digest statistics and capture a new snapshot after changes\n\n");

        // Footer
        md.append("---\n\n");
        md.append("*Generated by slowq*\n");

        return md.toString();
    }

    private void appendFinding(StringBuilder md, Finding finding) {
        md.append("- **").append(finding.getSeverity()).append(" - ").append(finding.getType().getTitle()).append(":** ")
                .append(finding.getMessage()).append("\n");
        if (finding.getRecommendation() != null) {
            md.append("  - *Recommendation:* ").append(finding.getRecommendation()).append("\n");
        }
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        SnapshotMetadata metadata = result.getMetadata();

        report.setReportMetadata(new ReportMetadata(
                timestamp,
                metadata != null ? metadata.source() : null,
                metadata != null ? metadata.serverVersion() : null,
                metadata != null ? metadata.schemaName() : null,
                metadata != null ? metadata.capturedAt() : null,
                result.getThresholdSummary()
        ));

        WorkloadSummary summary = new WorkloadSummary();
        summary.setMetrics(result.getWorkload().metrics());
        summary.setOperationBreakdown(result.getWorkload().operationBreakdown());
        summary.setSeverityCounts(result.countBySeverity());
        report.setWorkload(summary);

        List<DiagnosisEntry> entries = new ArrayList<>();
        int rank = 1;
        for (DigestDiagnosis diagnosis : result.getDiagnoses()) {
            DigestStatement statement = diagnosis.getStatement();
            DiagnosisEntry entry = new DiagnosisEntry();
            entry.setRank(rank++);
            entry.setDigest(statement.digest());
            entry.setSchemaName(statement.schemaName());
            entry.setDigestText(statement.digestText());
            entry.setSeverity(diagnosis.getSeverity());
            entry.setScore(diagnosis.getScore());
            entry.setLatencySharePercent(round(diagnosis.getLatencySharePercent()));
            entry.setExecCount(statement.execCount());
            entry.setTotalLatencyMs(round(statement.totalLatencyMs()));
            entry.setAvgLatencyMs(round(statement.avgLatencyMs()));
            entry.setP95LatencyMs(round(statement.p95LatencyMs()));
            entry.setRowsExaminedPerRowSent(round(statement.rowsExaminedPerRowSent()));
            entry.setTables(diagnosis.getProfile() != null ? diagnosis.getProfile().getTables() : null);
            entry.setFindings(diagnosis.getFindings());
            entry.setIndexSuggestion(diagnosis.getIndexSuggestion());
            entry.setHottestPlanStep(hottestStep(diagnosis).orElse(null));
            entries.add(entry);
        }
        report.setDiagnoses(entries);
        report.setIndexFindings(result.getIndexFindings());

        return report;
    }

    private static Optional<String> hottestStep(DigestDiagnosis diagnosis) {
        ExplainNode plan = diagnosis.getPlan();
        if (plan == null) {
            return Optional.empty();
        }
        return plan.flatten().stream()
                .filter(ExplainNode::hasActuals)
                .max((a, b) -> Double.compare(a.selfTimeMs(), b.selfTimeMs()))
                .map(node -> String.format("%s (%.2f ms self time)", node.getOperation(), node.selfTimeMs()));
    }

    private static List<Severity> reversed(Severity[] values) {
        List<Severity> list = new ArrayList<>(List.of(values));
        Collections.reverse(list);
        return list;
    }

    private static String formatMs(double ms) {
        if (ms >= 60_000) {
            return String.format("%.1f min", ms / 60_000);
        } else if (ms >= 1000) {
            return String.format("%.2f s", ms / 1000);
        }
        return String.format("%.2f ms", ms);
    }

    private static String preview(String sql, int max) {
        if (sql == null) {
            return "";
        }
        String flat = sql.replaceAll("\\s+", " ").trim();
        return flat.length() > max ? flat.substring(0, max) + "..." : flat;
    }

    private static String escapeCell(String value) {
        return value == null ? "" : value.replace("|", "\\|");
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata reportMetadata;
        private WorkloadSummary workload;
        private List<DiagnosisEntry> diagnoses;
        private List<Finding> indexFindings;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime generatedAt;
        private String source;
        private String serverVersion;
        private String schemaName;
        private LocalDateTime capturedAt;
        private String thresholds;
    }

    @lombok.Data
    private static class WorkloadSummary {
        private WorkloadMetrics metrics;
        private Map<String, Long> operationBreakdown;
        private Map<Severity, Long> severityCounts;
    }

    @lombok.Data
    private static class DiagnosisEntry {
        private int rank;
        private String digest;
        private String schemaName;
        private String digestText;
        private Severity severity;
        private int score;
        private double latencySharePercent;
        private long execCount;
        private double totalLatencyMs;
        private double avgLatencyMs;
        private double p95LatencyMs;
        private double rowsExaminedPerRowSent;
        private List<String> tables;
        private List<Finding> findings;
        private IndexSuggestion indexSuggestion;
        private String hottestPlanStep;
    }
}
