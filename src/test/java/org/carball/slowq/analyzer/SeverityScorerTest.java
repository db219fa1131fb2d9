package org.carball.slowq.analyzer;

import org.carball.slowq.config.DiagnosticThresholds;
import org.carball.slowq.model.analysis.DigestScore;
import org.carball.slowq.model.analysis.Finding;
import org.carball.slowq.model.analysis.FindingType;
import org.carball.slowq.model.analysis.Severity;
import org.carball.slowq.model.digest.DigestStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityScorerTest {

    private SeverityScorer scorer;
    private DiagnosticThresholds thresholds;

    @BeforeEach
    void setUp() {
        scorer = new SeverityScorer();
        thresholds = DiagnosticThresholds.defaults();
    }

    private static DigestStatement.DigestStatementBuilder healthy() {
        return DigestStatement.builder()
                .digest("d1")
                .digestText("SELECT * FROM orders WHERE id = ?")
                .execCount(10)
                .totalLatencyMs(50)
                .avgLatencyMs(5)
                .p95LatencyMs(8)
                .rowsExamined(10)
                .rowsSent(10);
    }

    @Test
    void shouldScoreHealthyDigestAsInfo() {
        // When
        DigestScore score = scorer.score(healthy().build(), 2.0, thresholds);

        // Then
        assertThat(score.score()).isZero();
        assertThat(score.severity()).isEqualTo(Severity.INFO);
        assertThat(score.findings()).isEmpty();
    }

    @Test
    void shouldCombineFactorsIntoCriticalScore() {
        // Given
        DigestStatement digest = healthy()
                .avgLatencyMs(1500)
                .p95LatencyMs(2400)
                .rowsExamined(100_000)
                .rowsSent(10)
                .noIndexUsedCount(5)
                .build();

        // When
        DigestScore score = scorer.score(digest, 40.0, thresholds);

        // Then
        assertThat(score.score()).isEqualTo(SeverityScorer.HOT_DIGEST_WEIGHT
                + SeverityScorer.SLOW_LATENCY_WEIGHT
                + SeverityScorer.ROWS_EXAMINED_WEIGHT
                + SeverityScorer.NO_INDEX_WEIGHT);
        assertThat(score.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(score.findings())
                .extracting(Finding::getType)
                .containsExactly(FindingType.HOT_DIGEST, FindingType.SLOW_AVERAGE_LATENCY,
                        FindingType.HIGH_ROWS_EXAMINED_RATIO, FindingType.NO_INDEX_USED);
        assertThat(score.findings().get(3).getMessage()).isEqualTo("5 of 10 executions used no index (50%)");
        assertThat(score.findings().get(1).getEvidence()).containsEntry("p95_latency_ms", 2400.0);
    }

    @Test
    void shouldCountShareAtThreshold() {
        // When
        DigestScore score = scorer.score(healthy().build(), 10.0, thresholds);

        // Then
        assertThat(score.score()).isEqualTo(SeverityScorer.HOT_DIGEST_WEIGHT);
        assertThat(score.severity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void shouldFlagLockContention() {
        // Given
        DigestStatement digest = healthy().totalLatencyMs(1000).lockLatencyMs(300).build();

        // When
        DigestScore score = scorer.score(digest, 1.0, thresholds);

        // Then
        assertThat(score.findings()).extracting(Finding::getType).containsExactly(FindingType.LOCK_CONTENTION);
        assertThat(score.findings().get(0).getMessage()).isEqualTo("30.0% of latency is lock wait");
        assertThat(score.severity()).isEqualTo(Severity.LOW);
    }

    @Test
    void shouldNotRateRatioWhenNothingExamined() {
        // Given - writes report rows_sent = 0 and rows_examined = 0
        DigestStatement digest = healthy().rowsExamined(0).rowsSent(0).build();

        // When
        DigestScore score = scorer.score(digest, 1.0, thresholds);

        // Then
        assertThat(score.findings()).isEmpty();
    }

    @Test
    void shouldScoreSpillsAndErrors() {
        // Given
        DigestStatement digest = healthy()
                .tmpTables(4)
                .tmpDiskTables(2)
                .sortMergePasses(3)
                .errors(1)
                .noGoodIndexUsedCount(7)
                .build();

        // When
        DigestScore score = scorer.score(digest, 1.0, thresholds);

        // Then
        assertThat(score.score()).isEqualTo(SeverityScorer.NO_GOOD_INDEX_WEIGHT
                + SeverityScorer.TMP_DISK_WEIGHT
                + SeverityScorer.SORT_MERGE_WEIGHT
                + SeverityScorer.ERRORS_WEIGHT);
        assertThat(score.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(score.findings())
                .extracting(Finding::getType)
                .containsExactly(FindingType.NO_GOOD_INDEX_USED, FindingType.TEMP_TABLES_ON_DISK,
                        FindingType.SORT_MERGE_PASSES, FindingType.STATEMENT_ERRORS);
    }

    @Test
    void shouldHonorCustomSeverityCutoffs() {
        // Given
        DiagnosticThresholds strict = DiagnosticThresholds.builder()
                .mediumSeverityScore(10)
                .highSeverityScore(20)
                .criticalSeverityScore(30)
                .build();

        // When
        DigestScore score = scorer.score(healthy().build(), 50.0, strict);

        // Then
        assertThat(score.severity()).isEqualTo(Severity.CRITICAL);
    }
}
