package org.carball.slowq.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.slowq.analyzer.QueryDiagnostician;
import org.carball.slowq.model.analysis.DiagnosticResult;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticReportTest {

    private static final String PLAN = """
            -> Filter: (orders.status = 'new')  (cost=1005.00 rows=1000) (actual time=0.100..20.000 rows=400 loops=1)
                -> Table scan on orders  (cost=1005.00 rows=10000) (actual time=0.050..18.000 rows=10000 loops=1)
            """;

    private DiagnosticResult result;

    @BeforeEach
    void setUp() {
        DigestStatement scan = DigestStatement.builder()
                .digest("d-status")
                .schemaName("shop")
                .digestText("SELECT `id` FROM `orders` WHERE `status` = ?")
                .querySampleText("SELECT id FROM orders WHERE status = 'new'")
                .execCount(400)
                .totalLatencyMs(8000)
                .avgLatencyMs(20)
                .p95LatencyMs(35)
                .rowsExamined(4_000_000)
                .rowsSent(16_000)
                .noIndexUsedCount(400)
                .build();
        DigestStatement lookup = DigestStatement.builder()
                .digest("d-pk")
                .schemaName("shop")
                .digestText("SELECT `total` FROM `orders` WHERE `id` = ?")
                .execCount(9000)
                .totalLatencyMs(2000)
                .avgLatencyMs(0.22)
                .rowsExamined(9000)
                .rowsSent(9000)
                .build();

        DiagnosticSnapshot snapshot = DiagnosticSnapshot.builder()
                .metadata(new SnapshotMetadata("8.0.36", LocalDateTime.of(2024, 3, 1, 12, 0), "shop", true, 2,
                        SnapshotMetadata.SOURCE_PERFORMANCE_SCHEMA))
                .digests(new ArrayList<>(List.of(scan, lookup)))
                .indexUsage(new ArrayList<>(List.of(new IndexUsage("shop", "orders", "idx_legacy", 0, 0, 0, 0.0))))
                .explainPlans(Map.of("shop/d-status", PLAN))
                .build();

        result = new QueryDiagnostician().diagnose(snapshot);
        result.setGeneratedAt(LocalDateTime.of(2024, 3, 1, 12, 30));
    }

    @Test
    void shouldRenderMarkdownSections() {
        // When
        String markdown = new DiagnosticReport(result).toMarkdown();

        // Then
        assertThat(markdown).startsWith("# MySQL Slow Query Diagnostic Report");
        assertThat(markdown).contains("**Generated:** 2024-03-01T12:30:00");
        assertThat(markdown).contains("**Server Version:** 8.0.36");
        assertThat(markdown).contains("**Schema:** shop");
        assertThat(markdown).contains("## Summary", "## Top Digests", "## Digest Findings", "## Index Health", "## Next Steps");
        assertThat(markdown).contains("| Digests Analyzed | 2 |");
        assertThat(markdown).contains("- **Digest:** `d-status`");
        assertThat(markdown).contains("SELECT id FROM orders WHERE status = 'new'");
        assertThat(markdown).contains("- **Hottest Plan Step:** Table scan on orders (18.00 ms self time)");
        assertThat(markdown).contains("**Suggested index (covering):**");
        assertThat(markdown).contains("CREATE INDEX idx_orders_status_id ON orders (status, id);");
        assertThat(markdown).contains("| LOW | Unused index | shop.orders.idx_legacy |");
        assertThat(markdown).endsWith("*Generated by slowq*\n");
    }

    @Test
    void shouldListCleanDigestWithoutFindings() {
        // When
        String markdown = new DiagnosticReport(result).toMarkdown();

        // Then - the primary key lookup crosses only the hot digest threshold
        assertThat(markdown).contains("- **Digest:** `d-pk`");
        assertThat(markdown).contains("Digest accounts for 20.0% of total statement latency");
    }

    @Test
    void shouldRenderEmptyResult() {
        // Given
        DiagnosticSnapshot empty = DiagnosticSnapshot.builder()
                .metadata(new SnapshotMetadata("unknown", LocalDateTime.now(), null, false, 0, SnapshotMetadata.SOURCE_SLOW_LOG))
                .build();
        DiagnosticResult emptyResult = new QueryDiagnostician().diagnose(empty);

        // When
        String markdown = new DiagnosticReport(emptyResult).toMarkdown();

        // Then
        assertThat(markdown).contains("**Source:** slow_log");
        assertThat(markdown).doesNotContain("**Schema:**");
        assertThat(markdown).contains("**No statement digests met the analysis criteria.**");
        assertThat(markdown).contains("No unused, redundant or unindexed-scan findings.");
    }

    @Test
    void shouldRenderJson() throws Exception {
        // When
        String json = new DiagnosticReport(result).toJson();

        // Then
        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.at("/reportMetadata/serverVersion").asText()).isEqualTo("8.0.36");
        assertThat(root.at("/reportMetadata/generatedAt").asText()).isEqualTo("2024-03-01T12:30:00");
        assertThat(root.at("/workload/metrics/digestCount").asInt()).isEqualTo(2);
        assertThat(root.at("/workload/operationBreakdown/SELECT").asLong()).isEqualTo(9400);

        JsonNode first = root.get("diagnoses").get(0);
        assertThat(first.get("rank").asInt()).isEqualTo(1);
        assertThat(first.get("digest").asText()).isEqualTo("d-status");
        assertThat(first.get("severity").asText()).isEqualTo("HIGH");
        assertThat(first.get("latencySharePercent").asDouble()).isEqualTo(80.0);
        assertThat(first.get("tables").get(0).asText()).isEqualTo("orders");
        assertThat(first.at("/indexSuggestion/ddl").asText())
                .isEqualTo("CREATE INDEX idx_orders_status_id ON orders (status, id);");
        assertThat(first.get("findings").get(0).get("type").asText()).isEqualTo("HOT_DIGEST");

        assertThat(root.get("indexFindings")).hasSize(1);
    }

    @Test
    void shouldOmitNullFieldsFromJson() throws Exception {
        // When
        JsonNode root = new ObjectMapper().readTree(new DiagnosticReport(result).toJson());

        // Then
        JsonNode second = root.get("diagnoses").get(1);
        assertThat(second.has("indexSuggestion")).isFalse();
        assertThat(second.has("hottestPlanStep")).isFalse();
    }
}
