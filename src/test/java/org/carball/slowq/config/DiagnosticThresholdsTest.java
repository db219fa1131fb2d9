package org.carball.slowq.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DiagnosticThresholdsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(DiagnosticThresholds.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(null);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultThresholds() {
        // When
        DiagnosticThresholds thresholds = DiagnosticThresholds.defaults();

        // Then
        assertThat(thresholds.getSlowQueryMs()).isEqualTo(1000.0);
        assertThat(thresholds.getHotDigestSharePercent()).isEqualTo(10.0);
        assertThat(thresholds.getLockLatencySharePercent()).isEqualTo(20.0);
        assertThat(thresholds.getRowsExaminedRatio()).isEqualTo(100.0);
        assertThat(thresholds.getFullScanRowThreshold()).isEqualTo(1000);
        assertThat(thresholds.getMisestimateFactor()).isEqualTo(10.0);
        assertThat(thresholds.getMisestimateMinRows()).isEqualTo(100);
        assertThat(thresholds.getNestedLoopThreshold()).isEqualTo(1000);
        assertThat(thresholds.getExpensiveNodeSharePercent()).isEqualTo(50.0);
        assertThat(thresholds.getMinExecutions()).isEqualTo(1);
        assertThat(thresholds.getTopDigests()).isEqualTo(20);
        assertThat(thresholds.getMediumSeverityScore()).isEqualTo(30);
        assertThat(thresholds.getHighSeverityScore()).isEqualTo(60);
        assertThat(thresholds.getCriticalSeverityScore()).isEqualTo(90);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldValidateValidThresholds() {
        // When
        DiagnosticThresholds.defaults().validate();

        // Then - only the DEBUG summary
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnWhenSeverityScoresAreOutOfOrder() {
        // Given
        DiagnosticThresholds thresholds = DiagnosticThresholds.builder()
                .highSeverityScore(95)
                .criticalSeverityScore(90)
                .build();

        // When
        thresholds.validate();

        // Then
        List<ILoggingEvent> logs = logAppender.list;
        assertThat(logs).hasSize(2);
        assertThat(logs.stream().anyMatch(log ->
                log.getLevel() == Level.WARN &&
                log.getFormattedMessage().contains("Critical severity score (90) should be greater than high severity score (95)")))
                .isTrue();
    }

    @Test
    void shouldWarnWhenSharesAreOutOfRange() {
        // Given
        DiagnosticThresholds thresholds = DiagnosticThresholds.builder()
                .hotDigestSharePercent(150)
                .expensiveNodeSharePercent(0)
                .build();

        // When
        thresholds.validate();

        // Then
        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(log -> log.getLevel() == Level.WARN)
                .toList();
        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0).getFormattedMessage()).contains("Hot digest share (150.0%)");
        assertThat(warnings.get(1).getFormattedMessage()).contains("Expensive plan node share (0.0%)");
    }

    @Test
    void shouldWarnWhenMisestimateFactorTooLow() {
        // Given
        DiagnosticThresholds thresholds = DiagnosticThresholds.builder()
                .misestimateFactor(1.0)
                .build();

        // When
        thresholds.validate();

        // Then
        assertThat(logAppender.list.stream().anyMatch(log ->
                log.getLevel() == Level.WARN &&
                log.getFormattedMessage().contains("Row misestimate factor (1.0) should be greater than 1.0")))
                .isTrue();
    }

    @Test
    void shouldDescribeConfiguration() {
        // When
        String summary = DiagnosticThresholds.defaults().getConfigurationSummary();

        // Then
        assertThat(summary).isEqualTo("Profile: default | Slow query: 1000 ms | Hot share: 10.0% | Scan rows: 1000 | Top: 20");
    }
}
