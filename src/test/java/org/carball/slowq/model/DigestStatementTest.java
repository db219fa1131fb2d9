package org.carball.slowq.model;

import org.carball.slowq.model.analysis.IndexSuggestion;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.schema.Index;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DigestStatementTest {

    @Test
    void shouldPreferCompleteSampleText() {
        // Given
        DigestStatement complete = DigestStatement.builder()
                .digestText("SELECT * FROM `t` WHERE `a` = ?")
                .querySampleText("SELECT * FROM t WHERE a = 1")
                .build();
        DigestStatement truncated = complete.toBuilder()
                .querySampleText("SELECT * FROM t WHERE a IN (1, 2, 3, 4, ...")
                .build();
        DigestStatement missing = complete.toBuilder().querySampleText("  ").build();

        // Then
        assertThat(complete.bestText()).isEqualTo("SELECT * FROM t WHERE a = 1");
        assertThat(truncated.hasCompleteSample()).isFalse();
        assertThat(truncated.bestText()).isEqualTo("SELECT * FROM `t` WHERE `a` = ?");
        assertThat(missing.bestText()).isEqualTo("SELECT * FROM `t` WHERE `a` = ?");
    }

    @Test
    void shouldComputeRatios() {
        // Given
        DigestStatement digest = DigestStatement.builder()
                .execCount(8)
                .noIndexUsedCount(2)
                .rowsExamined(500)
                .rowsSent(0)
                .build();

        // Then - rows sent is clamped to one so writes still get a ratio
        assertThat(digest.rowsExaminedPerRowSent()).isEqualTo(500.0);
        assertThat(digest.fullScanRate()).isEqualTo(0.25);
        assertThat(DigestStatement.builder().build().fullScanRate()).isZero();
    }

    @Test
    void shouldCompareIndexPrefixesIgnoringCase() {
        // Given
        Index narrow = Index.builder().name("a").columns(List.of("Customer_ID")).build();
        Index wide = Index.builder().name("b").columns(List.of("customer_id", "created_at")).build();

        // Then
        assertThat(narrow.isLeftPrefixOf(wide)).isTrue();
        assertThat(wide.isLeftPrefixOf(narrow)).isFalse();
        assertThat(narrow.hasSameColumns(wide)).isFalse();
        assertThat(wide.containsColumn("CREATED_AT")).isTrue();
    }

    @Test
    void shouldTruncateSuggestedIndexNameToIdentifierLimit() {
        // When
        IndexSuggestion suggestion = IndexSuggestion.of("customer_subscriptions",
                List.of("billing_country_code", "subscription_status", "renewal_date"), false);

        // Then
        String name = suggestion.ddl().substring("CREATE INDEX ".length(), suggestion.ddl().indexOf(" ON "));
        assertThat(name).hasSize(64).startsWith("idx_customer_subscriptions_billing_country_code");
        assertThat(suggestion.ddl())
                .endsWith(" ON customer_subscriptions (billing_country_code, subscription_status, renewal_date);");
    }
}
