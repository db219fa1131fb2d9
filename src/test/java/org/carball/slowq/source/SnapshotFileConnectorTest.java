package org.carball.slowq.source;

import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.schema.Index;
import org.carball.slowq.model.schema.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SnapshotFileConnectorTest {

    @TempDir
    Path tempDir;

    private Path validSnapshotFile;

    @BeforeEach
    void setUp() throws IOException {
        validSnapshotFile = tempDir.resolve("snapshot.json");
        Files.writeString(validSnapshotFile, """
            {
              "snapshot_metadata": {
                "server_version": "8.0.36",
                "captured_at": "2024-03-01T12:00:00",
                "schema_name": "shop",
                "performance_schema_enabled": true,
                "total_digests": 2
              },
              "digests": [
                {
                  "digest": "a1b2",
                  "schema_name": "shop",
                  "digest_text": "SELECT * FROM `orders` WHERE `customer_id` = ?",
                  "query_sample_text": "SELECT * FROM orders WHERE customer_id = 17",
                  "exec_count": 1500,
                  "total_latency_ms": 4500.5,
                  "avg_latency_ms": 3.0,
                  "rows_sent": 1500,
                  "rows_examined": 150000,
                  "no_index_used_count": 1500,
                  "first_seen": "2024-02-28T08:00:00",
                  "last_seen": "2024-03-01T11:59:00"
                },
                {
                  "digest": "c3d4",
                  "digest_text": "COMMIT"
                }
              ],
              "index_usage": [
                {"schema": "shop", "table": "orders", "index": "idx_status", "count_star": 0, "count_read": 0, "count_write": 0, "latency_ms": 0.0},
                {"schema": "shop", "table": "orders", "index": null, "count_star": 90000, "count_read": 90000, "count_write": 0, "latency_ms": 35.2}
              ],
              "unused_indexes": ["shop.orders.idx_status"],
              "index_definitions": [
                {"schema": "shop", "table": "orders", "index": "PRIMARY", "columns": ["id"], "unique": true, "primary": true},
                {"schema": "shop", "table": "orders", "index": "idx_customer_created", "columns": ["customer_id", "created_at"], "unique": false, "primary": false}
              ],
              "explain_plans": [
                {"digest": "a1b2", "plan": "-> Table scan on orders  (cost=100.0 rows=1000)"}
              ]
            }
            """);
    }

    @Test
    void shouldReadMetadata() throws IOException {
        // When
        SnapshotMetadata metadata = new SnapshotFileConnector(validSnapshotFile).getMetadata();

        // Then
        assertThat(metadata.serverVersion()).isEqualTo("8.0.36");
        assertThat(metadata.capturedAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 12, 0));
        assertThat(metadata.schemaName()).isEqualTo("shop");
        assertThat(metadata.performanceSchemaEnabled()).isTrue();
        assertThat(metadata.totalDigests()).isEqualTo(2);
        assertThat(metadata.source()).isEqualTo(SnapshotMetadata.SOURCE_PERFORMANCE_SCHEMA);
    }

    @Test
    void shouldReadDigestsWithDefaultsForMissingCounters() throws IOException {
        // When
        List<DigestStatement> digests = new SnapshotFileConnector(validSnapshotFile).getDigests();

        // Then
        assertThat(digests).hasSize(2);

        DigestStatement orders = digests.get(0);
        assertThat(orders.digest()).isEqualTo("a1b2");
        assertThat(orders.execCount()).isEqualTo(1500);
        assertThat(orders.totalLatencyMs()).isEqualTo(4500.5);
        assertThat(orders.rowsExaminedPerRowSent()).isEqualTo(100.0);
        assertThat(orders.noIndexUsedCount()).isEqualTo(1500);
        assertThat(orders.firstSeen()).isEqualTo(LocalDateTime.of(2024, 2, 28, 8, 0));
        assertThat(orders.bestText()).isEqualTo("SELECT * FROM orders WHERE customer_id = 17");

        DigestStatement commit = digests.get(1);
        assertThat(commit.schemaName()).isNull();
        assertThat(commit.execCount()).isZero();
        assertThat(commit.lastSeen()).isNull();
        assertThat(commit.bestText()).isEqualTo("COMMIT");
    }

    @Test
    void shouldReadIndexSections() throws IOException {
        // When
        SnapshotFileConnector connector = new SnapshotFileConnector(validSnapshotFile);

        // Then
        List<IndexUsage> usage = connector.getIndexUsage();
        assertThat(usage).hasSize(2);
        assertThat(usage.get(0).indexName()).isEqualTo("idx_status");
        assertThat(usage.get(1).isFullScan()).isTrue();
        assertThat(usage.get(1).countRead()).isEqualTo(90000);

        assertThat(connector.getUnusedIndexes()).containsExactly("shop.orders.idx_status");

        Table orders = connector.getSchema().findTable("orders");
        assertThat(orders).isNotNull();
        assertThat(orders.getPrimaryKey().getColumns()).containsExactly("id");
        Index composite = orders.findIndex("idx_customer_created");
        assertThat(composite.getColumns()).containsExactly("customer_id", "created_at");
        assertThat(composite.isUnique()).isFalse();

        assertThat(connector.getExplainPlans()).containsOnlyKeys("shop/a1b2");
    }

    @Test
    void shouldBuildSnapshot() throws IOException {
        // When
        DiagnosticSnapshot snapshot = new SnapshotFileConnector(validSnapshotFile).toSnapshot();

        // Then
        assertThat(snapshot.getDigests()).hasSize(2);
        assertThat(snapshot.getIndexUsage()).hasSize(2);
        assertThat(snapshot.getSchema().getTables()).hasSize(1);
        assertThat(snapshot.getExplainPlans()).hasSize(1);
    }

    @Test
    void shouldTreatOptionalSectionsAsEmpty() throws IOException {
        // Given
        Path minimal = tempDir.resolve("minimal.json");
        Files.writeString(minimal, """
            {
              "snapshot_metadata": {
                "server_version": "8.4.0",
                "captured_at": null,
                "performance_schema_enabled": false
              },
              "digests": []
            }
            """);

        // When
        SnapshotFileConnector connector = new SnapshotFileConnector(minimal);

        // Then
        assertThat(connector.getMetadata().capturedAt()).isNull();
        assertThat(connector.getMetadata().totalDigests()).isZero();
        assertThat(connector.getIndexUsage()).isEmpty();
        assertThat(connector.getUnusedIndexes()).isEmpty();
        assertThat(connector.getSchema().isEmpty()).isTrue();
        assertThat(connector.getExplainPlans()).isEmpty();
    }

    @Test
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> new SnapshotFileConnector(tempDir.resolve("missing.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Snapshot file not found");
    }

    @Test
    void shouldRejectMalformedJson() throws IOException {
        // Given
        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{ not json");

        // When / Then
        assertThatThrownBy(() -> new SnapshotFileConnector(invalid)).isInstanceOf(IOException.class);
    }

    @Test
    void shouldRejectMissingMetadata() throws IOException {
        // Given
        Path noMetadata = tempDir.resolve("no-metadata.json");
        Files.writeString(noMetadata, """
            { "digests": [] }
            """);

        // When / Then
        assertThatThrownBy(() -> new SnapshotFileConnector(noMetadata))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Missing snapshot_metadata section in snapshot file");
    }

    @Test
    void shouldRejectMissingRequiredField() throws IOException {
        // Given
        Path incomplete = tempDir.resolve("incomplete.json");
        Files.writeString(incomplete, """
            {
              "snapshot_metadata": { "server_version": "8.0.36", "captured_at": "2024-03-01T12:00:00" },
              "digests": []
            }
            """);

        // When / Then
        assertThatThrownBy(() -> new SnapshotFileConnector(incomplete))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Missing required metadata field: performance_schema_enabled");
    }

    @Test
    void shouldRejectDigestWithoutText() throws IOException {
        // Given
        Path badDigest = tempDir.resolve("bad-digest.json");
        Files.writeString(badDigest, """
            {
              "snapshot_metadata": { "server_version": "8.0.36", "captured_at": null, "performance_schema_enabled": true },
              "digests": [ { "digest": "x" } ]
            }
            """);

        // When / Then
        assertThatThrownBy(() -> new SnapshotFileConnector(badDigest))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Digest entry without digest or digest_text");
    }

    @Test
    void shouldRejectInvalidTimestamp() throws IOException {
        // Given
        Path badTime = tempDir.resolve("bad-time.json");
        Files.writeString(badTime, """
            {
              "snapshot_metadata": { "server_version": "8.0.36", "captured_at": "yesterday", "performance_schema_enabled": true },
              "digests": []
            }
            """);
        SnapshotFileConnector connector = new SnapshotFileConnector(badTime);

        // When / Then
        assertThatThrownBy(connector::getMetadata)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Invalid timestamp in snapshot file: yesterday");
    }

    @Test
    void shouldKeyPlansAndUsageBySchema() throws IOException {
        // Given - one statement shape captured in two tenant schemas
        Path tenants = tempDir.resolve("tenants.json");
        Files.writeString(tenants, """
            {
              "snapshot_metadata": {
                "server_version": "8.0.36",
                "captured_at": "2024-03-01T12:00:00",
                "performance_schema_enabled": true,
                "workload_executions": 250000,
                "workload_latency_ms": 98765.5
              },
              "digests": [
                {"digest": "abc", "schema_name": "tenant_a", "digest_text": "SELECT * FROM orders WHERE id = ?"},
                {"digest": "abc", "schema_name": "tenant_b", "digest_text": "SELECT * FROM orders WHERE id = ?"}
              ],
              "index_usage": [
                {"schema": "tenant_a", "table": "customers", "index": "uq_email", "count_star": 0, "unique": true},
                {"schema": "tenant_a", "table": "orders", "index": "idx_status", "count_star": 0}
              ],
              "explain_plans": [
                {"digest": "abc", "schema_name": "tenant_b", "plan": "-> Table scan on orders  (cost=10.0 rows=100)"},
                {"digest": "abc", "plan": "-> Table scan on orders  (cost=10.0 rows=100)"}
              ]
            }
            """);

        // When
        SnapshotFileConnector connector = new SnapshotFileConnector(tenants);

        // Then
        assertThat(connector.getExplainPlans()).containsOnlyKeys("tenant_b/abc");
        assertThat(connector.getMetadata().workloadExecutions()).isEqualTo(250000);
        assertThat(connector.getMetadata().workloadLatencyMs()).isEqualTo(98765.5);
        assertThat(connector.getIndexUsage()).extracting(IndexUsage::unique).containsExactly(true, null);
    }
}
