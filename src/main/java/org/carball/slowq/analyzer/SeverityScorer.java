package org.carball.slowq.analyzer;

import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.model.analysis.DigestScore;
import org.carball.slowq.model.analysis.Finding;
import org.carball.slowq.model.analysis.FindingType;
import org.carball.slowq.model.analysis.Severity;
import org.carball.slowq.model.digest.DigestStatement;

import java.util.ArrayList;
import java.util.List;

public class SeverityScorer {

    static final int HOT_DIGEST_WEIGHT = 30;
    static final int SLOW_LATENCY_WEIGHT = 25;
    static final int ROWS_EXAMINED_WEIGHT = 20;
    static final int NO_INDEX_WEIGHT = 20;
    static final int NO_GOOD_INDEX_WEIGHT = 10;
    static final int TMP_DISK_WEIGHT = 10;
    static final int LOCK_SHARE_WEIGHT = 10;
    static final int SORT_MERGE_WEIGHT = 5;
    static final int ERRORS_WEIGHT = 5;

    /**
     * Scores one digest against the thresholds and explains each contributing factor.
     */
    public DigestScore score(DigestStatement digest, double latencySharePercent, DiagnosticThresholds thresholds) {
        int score = 0;
        List<Finding> findings = new ArrayList<>();
        String subject = digest.digest();

        // Factor 1: share of total workload latency
        if (latencySharePercent >= thresholds.getHotDigestSharePercent()) {
            score += HOT_DIGEST_WEIGHT;
            findings.add(Finding.of(FindingType.HOT_DIGEST, subject,
                            String.format("Digest accounts for %.1f%% of total statement latency", latencySharePercent),
                            "Optimizing this statement gives the largest overall gain")
                    .withEvidence("latency_share_percent", round(latencySharePercent)));
        }

        // Factor 2: average latency
        if (digest.avgLatencyMs() >= thresholds.getSlowQueryMs()) {
            score += SLOW_LATENCY_WEIGHT;
            findings.add(Finding.of(FindingType.SLOW_AVERAGE_LATENCY, subject,
                            String.format("Average latency %.1f ms exceeds %.0f ms", digest.avgLatencyMs(), thresholds.getSlowQueryMs()),
                            "Run EXPLAIN ANALYZE on a sample to see where the time goes")
                    .withEvidence("avg_latency_ms", round(digest.avgLatencyMs()))
                    .withEvidence("p95_latency_ms", round(digest.p95LatencyMs())));
        }

        // Factor 3: rows examined per row returned
        double ratio = digest.rowsExaminedPerRowSent();
        if (digest.rowsExamined() > 0 && ratio >= thresholds.getRowsExaminedRatio()) {
            score += ROWS_EXAMINED_WEIGHT;
            findings.add(Finding.of(FindingType.HIGH_ROWS_EXAMINED_RATIO, subject,
                            String.format("Examines %.0f rows for every row sent", ratio),
                            "Add an index that matches the WHERE clause so fewer rows are read")
                    .withEvidence("rows_examined", digest.rowsExamined())
                    .withEvidence("rows_sent", digest.rowsSent()));
        }

        // Factor 4: executions without any index
        if (digest.noIndexUsedCount() > 0) {
            score += NO_INDEX_WEIGHT;
            findings.add(Finding.of(FindingType.NO_INDEX_USED, subject,
                            String.format("%d of %d executions used no index (%.0f%%)",
                                    digest.noIndexUsedCount(), digest.execCount(), digest.fullScanRate() * 100),
                            "Index the filtered columns or check that they are not wrapped in functions")
                    .withEvidence("no_index_used_count", digest.noIndexUsedCount()));
        }

        // Factor 5: the optimizer found no good index
        if (digest.noGoodIndexUsedCount() > 0) {
            score += NO_GOOD_INDEX_WEIGHT;
            findings.add(Finding.of(FindingType.NO_GOOD_INDEX_USED, subject,
                            String.format("%d executions found no good index", digest.noGoodIndexUsedCount()),
                            "Review column order of existing indexes against the statement's predicates")
                    .withEvidence("no_good_index_used_count", digest.noGoodIndexUsedCount()));
        }

        // Factor 6: temporary tables written to disk
        if (digest.tmpDiskTables() > 0) {
            score += TMP_DISK_WEIGHT;
            findings.add(Finding.of(FindingType.TEMP_TABLES_ON_DISK, subject,
                            String.format("%d of %d temporary tables were created on disk", digest.tmpDiskTables(), digest.tmpTables()),
                            "Index the GROUP BY / ORDER BY columns or raise tmp_table_size if the result is legitimately large")
                    .withEvidence("tmp_disk_tables", digest.tmpDiskTables()));
        }

        // Factor 7: lock wait share of latency
        double lockShare = digest.totalLatencyMs() > 0 ? digest.lockLatencyMs() / digest.totalLatencyMs() * 100.0 : 0.0;
        if (lockShare >= thresholds.getLockLatencySharePercent()) {
            score += LOCK_SHARE_WEIGHT;
            findings.add(Finding.of(FindingType.LOCK_CONTENTION, subject,
                            String.format("%.1f%% of latency is lock wait", lockShare),
                            "Shorten the transactions touching these rows or check sys.innodb_lock_waits")
                    .withEvidence("lock_latency_ms", round(digest.lockLatencyMs())));
        }

        // Factor 8: sort spilled into merge passes
        if (digest.sortMergePasses() > 0) {
            score += SORT_MERGE_WEIGHT;
            findings.add(Finding.of(FindingType.SORT_MERGE_PASSES, subject,
                    String.format("%d sort merge passes", digest.sortMergePasses()),
                    "Provide an index in ORDER BY order or raise sort_buffer_size"));
        }

        // Factor 9: failing executions
        if (digest.errors() > 0) {
            score += ERRORS_WEIGHT;
            findings.add(Finding.of(FindingType.STATEMENT_ERRORS, subject,
                    String.format("%d executions ended in an error", digest.errors()),
                    "Check the application log for the failing statement"));
        }

        return new DigestScore(score, Severity.fromScore(score, thresholds), findings);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
