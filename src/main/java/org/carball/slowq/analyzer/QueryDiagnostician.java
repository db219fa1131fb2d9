package org.carball.slowq.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.model.analysis.DiagnosticResult;
import org.carball.slowq.model.analysis.DigestDiagnosis;
import org.carball.slowq.model.analysis.DigestScore;
import org.carball.slowq.model.analysis.Finding;
import org.carball.slowq.model.analysis.FindingType;
import org.carball.slowq.model.analysis.IndexSuggestion;
import org.carball.slowq.model.analysis.Severity;
import org.carball.slowq.model.analysis.WorkloadAnalysis;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.digest.StatementProfile;
import org.carball.slowq.model.plan.ExplainNode;
import org.carball.slowq.parser.ExplainAnalyzeParser;
import org.carball.slowq.parser.StatementInspector;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ties the analyzers together: ranks digests, explains what is wrong with each, and checks index health.
 */
@Slf4j
public class QueryDiagnostician {

    private final DiagnosticThresholds thresholds;
    private final SeverityScorer scorer;
    private final ExplainPlanAnalyzer planAnalyzer;
    private final IndexAdvisor indexAdvisor;

    public QueryDiagnostician() {
        this(DiagnosticThresholds.defaults());
    }

    public QueryDiagnostician(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
        this.scorer = new SeverityScorer();
        this.planAnalyzer = new ExplainPlanAnalyzer(thresholds);
        this.indexAdvisor = new IndexAdvisor(thresholds);
        log.debug("Initialized QueryDiagnostician with thresholds: {}", thresholds.getConfigurationSummary());
    }

    public DiagnosticResult diagnose(DiagnosticSnapshot snapshot) {
        SnapshotMetadata metadata = snapshot.getMetadata();
        WorkloadAnalysis workload = metadata != null
                ? WorkloadAnalyzer.analyze(snapshot.getDigests(), thresholds,
                        metadata.workloadExecutions(), metadata.workloadLatencyMs())
                : WorkloadAnalyzer.analyze(snapshot.getDigests(), thresholds);

        List<DigestDiagnosis> diagnoses = new ArrayList<>();
        for (DigestStatement digest : workload.topDigests()) {
            diagnoses.add(diagnoseDigest(digest, workload.shareOf(digest), snapshot));
        }

        diagnoses.sort(Comparator.comparingInt(DigestDiagnosis::getScore).reversed()
                .thenComparing(d -> d.getStatement().totalLatencyMs(), Comparator.reverseOrder()));

        List<Finding> indexFindings = new ArrayList<>();
        if (!snapshot.getIndexUsage().isEmpty()) {
            indexFindings.addAll(indexAdvisor.findUnusedIndexes(snapshot.getIndexUsage(), snapshot.getSchema()));
        } else {
            indexFindings.addAll(indexAdvisor.findSysUnusedIndexes(snapshot.getUnusedIndexes(), snapshot.getSchema()));
        }
        indexFindings.addAll(indexAdvisor.findRedundantIndexes(snapshot.getSchema()));
        indexFindings.addAll(indexAdvisor.findFullScanTables(snapshot.getIndexUsage()));

        log.info("Diagnosed {} digests, {} index findings", diagnoses.size(), indexFindings.size());

        return DiagnosticResult.builder()
                .metadata(snapshot.getMetadata())
                .generatedAt(LocalDateTime.now())
                .thresholdSummary(thresholds.getConfigurationSummary())
                .workload(workload)
                .diagnoses(diagnoses)
                .indexFindings(indexFindings)
                .build();
    }

    /**
     * Analyzes a single EXPLAIN ANALYZE output with no digest statistics behind it.
     */
    public DiagnosticResult diagnosePlan(String explainText) {
        ExplainNode root = ExplainAnalyzeParser.parse(explainText);
        List<Finding> findings = planAnalyzer.analyze(root);

        Severity severity = findings.stream()
                .map(Finding::getSeverity)
                .max(Comparator.naturalOrder())
                .orElse(Severity.INFO);

        DigestStatement statement = DigestStatement.builder()
                .digest("explain")
                .digestText(root.getOperation())
                .execCount(1)
                .totalLatencyMs(root.totalTimeMs())
                .avgLatencyMs(root.totalTimeMs())
                .maxLatencyMs(root.totalTimeMs())
                .build();

        DigestDiagnosis diagnosis = DigestDiagnosis.builder()
                .statement(statement)
                .score(0)
                .severity(severity)
                .latencySharePercent(100.0)
                .findings(findings)
                .plan(root)
                .build();

        return DiagnosticResult.builder()
                .metadata(new SnapshotMetadata("unknown", LocalDateTime.now(), null, false, 1, SnapshotMetadata.SOURCE_EXPLAIN))
                .generatedAt(LocalDateTime.now())
                .thresholdSummary(thresholds.getConfigurationSummary())
                .workload(WorkloadAnalyzer.analyze(List.of(statement), thresholds))
                .diagnoses(new ArrayList<>(List.of(diagnosis)))
                .build();
    }

    private DigestDiagnosis diagnoseDigest(DigestStatement digest, double share, DiagnosticSnapshot snapshot) {
        StatementProfile profile = StatementInspector.inspect(digest.bestText());
        DigestScore score = scorer.score(digest, share, thresholds);

        List<Finding> findings = new ArrayList<>(score.findings());
        findings.addAll(indexAdvisor.findStatementIssues(profile));

        ExplainNode plan = null;
        String planText = snapshot.getExplainPlans().get(digest.key());
        if (planText != null) {
            try {
                plan = ExplainAnalyzeParser.parse(planText);
                findings.addAll(planAnalyzer.analyze(plan));
            } catch (IllegalArgumentException e) {
                log.warn("Could not parse EXPLAIN output for digest {}: {}", digest.digest(), e.getMessage());
                findings.add(Finding.of(FindingType.EXPLAIN_UNPARSEABLE, digest.digest(),
                        "EXPLAIN output could not be parsed: " + e.getMessage(),
                        "Capture the plan again with EXPLAIN ANALYZE (TREE format)"));
            }
        }

        IndexSuggestion suggestion = null;
        if (needsIndexHelp(digest, findings)) {
            Optional<IndexSuggestion> suggested = indexAdvisor.suggestIndex(profile, snapshot.getSchema());
            if (suggested.isPresent()) {
                suggestion = suggested.get();
                findings.add(Finding.of(FindingType.MISSING_INDEX, suggestion.table(),
                                String.format("No index on %s leads with (%s)", suggestion.table(),
                                        String.join(", ", suggestion.columns())),
                                suggestion.ddl())
                        .withEvidence("covering", suggestion.covering()));
            }
        }

        return DigestDiagnosis.builder()
                .statement(digest)
                .profile(profile)
                .score(score.score())
                .severity(score.severity())
                .latencySharePercent(share)
                .findings(findings)
                .indexSuggestion(suggestion)
                .plan(plan)
                .build();
    }

    private boolean needsIndexHelp(DigestStatement digest, List<Finding> findings) {
        return digest.noIndexUsedCount() > 0
                || digest.noGoodIndexUsedCount() > 0
                || (digest.rowsExamined() > 0 && digest.rowsExaminedPerRowSent() >= thresholds.getRowsExaminedRatio())
                || findings.stream().anyMatch(f -> f.getType() == FindingType.FULL_TABLE_SCAN
                        || f.getType() == FindingType.FILESORT);
    }
}
