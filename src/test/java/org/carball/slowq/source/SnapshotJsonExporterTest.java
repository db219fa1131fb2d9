package org.carball.slowq.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.schema.DatabaseSchema;
import org.carball.slowq.model.schema.Index;
import org.carball.slowq.model.schema.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotJsonExporterTest {

    @TempDir
    Path tempDir;

    private static DiagnosticSnapshot createSnapshot() {
        Table orders = new Table("orders");
        orders.addIndex(Index.builder().name("PRIMARY").columns(List.of("id")).unique(true).primary(true).build());
        orders.addIndex(Index.builder().name("idx_status").columns(List.of("status")).build());
        DatabaseSchema schema = new DatabaseSchema();
        schema.addTable(orders);

        DigestStatement digest = DigestStatement.builder()
                .digest("a1b2")
                .schemaName("shop")
                .digestText("SELECT * FROM `orders` WHERE `status` = ?")
                .querySampleText("SELECT * FROM orders WHERE status = 'new'")
                .execCount(40)
                .totalLatencyMs(1200.0)
                .avgLatencyMs(30.0)
                .rowsSent(400)
                .rowsExamined(80000)
                .noIndexUsedCount(40)
                .firstSeen(LocalDateTime.of(2024, 3, 1, 9, 0))
                .build();

        Map<String, String> plans = new LinkedHashMap<>();
        plans.put("shop/a1b2", "-> Table scan on orders  (cost=100.0 rows=2000)");

        return DiagnosticSnapshot.builder()
                .metadata(new SnapshotMetadata("8.0.36", LocalDateTime.of(2024, 3, 1, 12, 0), "shop", true, 1,
                        SnapshotMetadata.SOURCE_PERFORMANCE_SCHEMA))
                .digests(new ArrayList<>(List.of(digest)))
                .indexUsage(new ArrayList<>(List.of(new IndexUsage("shop", "orders", null, 80000, 80000, 0, 22.5))))
                .unusedIndexes(new ArrayList<>(List.of("shop.orders.idx_status")))
                .schema(schema)
                .explainPlans(plans)
                .build();
    }

    @Test
    void shouldWriteSnapshotThatFileConnectorReadsBack() throws IOException {
        // Given
        DiagnosticSnapshot original = createSnapshot();
        Path output = tempDir.resolve("export.json");

        // When
        new SnapshotJsonExporter().export(original, output);
        DiagnosticSnapshot reloaded = new SnapshotFileConnector(output).toSnapshot();

        // Then
        assertThat(reloaded.getMetadata()).isEqualTo(original.getMetadata());
        assertThat(reloaded.getDigests()).containsExactlyElementsOf(original.getDigests());
        assertThat(reloaded.getIndexUsage()).containsExactlyElementsOf(original.getIndexUsage());
        assertThat(reloaded.getUnusedIndexes()).containsExactly("shop.orders.idx_status");
        assertThat(reloaded.getSchema().findTable("orders").getIndexes())
                .extracting(Index::getName)
                .containsExactly("PRIMARY", "idx_status");
        assertThat(reloaded.getExplainPlans()).isEqualTo(original.getExplainPlans());
    }

    @Test
    void shouldWriteSummarySection() throws IOException {
        // Given
        Path output = tempDir.resolve("export.json");

        // When
        new SnapshotJsonExporter().export(createSnapshot(), output);

        // Then
        JsonNode summary = new ObjectMapper().readTree(output.toFile()).get("summary");
        assertThat(summary.get("total_executions").asLong()).isEqualTo(40);
        assertThat(summary.get("total_latency_ms").asDouble()).isEqualTo(1200.0);
        assertThat(summary.get("full_scan_digests").asLong()).isEqualTo(1);
        assertThat(summary.get("explain_plans").asInt()).isEqualTo(1);
    }

    @Test
    void shouldWriteTimestampsAsIsoText() throws IOException {
        // Given
        Path output = tempDir.resolve("export.json");

        // When
        new SnapshotJsonExporter().export(createSnapshot(), output);

        // Then
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertThat(root.get("snapshot_metadata").get("captured_at").asText()).isEqualTo("2024-03-01T12:00:00");
        assertThat(root.get("digests").get(0).get("first_seen").asText()).isEqualTo("2024-03-01T09:00:00");
    }
}
