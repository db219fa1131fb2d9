package org.carball.slowq.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.schema.Index;
import org.carball.slowq.model.schema.Table;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a diagnostic snapshot in the JSON format read by {@link SnapshotFileConnector}.
 */
@Slf4j
public class SnapshotJsonExporter {

    private final ObjectMapper objectMapper;

    public SnapshotJsonExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void export(DiagnosticSnapshot snapshot, Path outputPath) throws IOException {
        Map<String, Object> exportData = new LinkedHashMap<>();

        exportData.put("snapshot_metadata", metadata(snapshot));
        exportData.put("digests", snapshot.getDigests().stream().map(SnapshotJsonExporter::digest).toList());
        exportData.put("index_usage", snapshot.getIndexUsage().stream().map(SnapshotJsonExporter::usage).toList());
        exportData.put("unused_indexes", snapshot.getUnusedIndexes());
        exportData.put("index_definitions", indexDefinitions(snapshot));
        exportData.put("explain_plans", explainPlans(snapshot));
        exportData.put("summary", createSummary(snapshot));

        objectMapper.writeValue(outputPath.toFile(), exportData);
        log.info("Exported snapshot with {} digests to {}", snapshot.getDigests().size(), outputPath);
    }

    private static Map<String, Object> metadata(DiagnosticSnapshot snapshot) {
        SnapshotMetadata source = snapshot.getMetadata();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("server_version", source != null ? source.serverVersion() : "unknown");
        metadata.put("captured_at", source != null ? source.capturedAt() : null);
        metadata.put("schema_name", source != null ? source.schemaName() : null);
        metadata.put("performance_schema_enabled", source != null && source.performanceSchemaEnabled());
        metadata.put("total_digests", snapshot.getDigests().size());
        metadata.put("source", source != null ? source.source() : null);
        metadata.put("workload_executions", source != null ? source.workloadExecutions() : 0L);
        metadata.put("workload_latency_ms", source != null ? source.workloadLatencyMs() : 0.0);
        return metadata;
    }

    private static Map<String, Object> digest(DigestStatement d) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("digest", d.digest());
        node.put("schema_name", d.schemaName());
        node.put("digest_text", d.digestText());
        node.put("query_sample_text", d.querySampleText());
        node.put("exec_count", d.execCount());
        node.put("total_latency_ms", d.totalLatencyMs());
        node.put("avg_latency_ms", d.avgLatencyMs());
        node.put("max_latency_ms", d.maxLatencyMs());
        node.put("p95_latency_ms", d.p95LatencyMs());
        node.put("lock_latency_ms", d.lockLatencyMs());
        node.put("rows_sent", d.rowsSent());
        node.put("rows_examined", d.rowsExamined());
        node.put("rows_affected", d.rowsAffected());
        node.put("no_index_used_count", d.noIndexUsedCount());
        node.put("no_good_index_used_count", d.noGoodIndexUsedCount());
        node.put("tmp_tables", d.tmpTables());
        node.put("tmp_disk_tables", d.tmpDiskTables());
        node.put("sort_merge_passes", d.sortMergePasses());
        node.put("errors", d.errors());
        node.put("first_seen", d.firstSeen());
        node.put("last_seen", d.lastSeen());
        return node;
    }

    private static Map<String, Object> usage(IndexUsage u) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("schema", u.schemaName());
        node.put("table", u.tableName());
        node.put("index", u.indexName());
        node.put("count_star", u.countStar());
        node.put("count_read", u.countRead());
        node.put("count_write", u.countWrite());
        node.put("latency_ms", u.latencyMs());
        node.put("unique", u.unique());
        return node;
    }

    private static List<Map<String, Object>> indexDefinitions(DiagnosticSnapshot snapshot) {
        String schemaName = snapshot.getMetadata() != null ? snapshot.getMetadata().schemaName() : null;
        List<Map<String, Object>> definitions = new ArrayList<>();

        for (Table table : snapshot.getSchema().getTables()) {
            for (Index index : table.getIndexes()) {
                Map<String, Object> node = new LinkedHashMap<>();
                node.put("schema", schemaName);
                node.put("table", table.getName());
                node.put("index", index.getName());
                node.put("columns", index.getColumns());
                node.put("unique", index.isUnique());
                node.put("primary", index.isPrimary());
                definitions.add(node);
            }
        }
        return definitions;
    }

    private static List<Map<String, Object>> explainPlans(DiagnosticSnapshot snapshot) {
        List<Map<String, Object>> plans = new ArrayList<>();
        snapshot.getExplainPlans().forEach((key, plan) -> {
            // Keys are "schema/digest"; digests are hex and never contain '/'
            int slash = key.lastIndexOf('/');
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("digest", slash >= 0 ? key.substring(slash + 1) : key);
            node.put("schema_name", slash >= 0 ? key.substring(0, slash) : null);
            node.put("plan", plan);
            plans.add(node);
        });
        return plans;
    }

    /**
     * Creates summary statistics from the captured digests.
     */
    private Map<String, Object> createSummary(DiagnosticSnapshot snapshot) {
        Map<String, Object> summary = new LinkedHashMap<>();
        List<DigestStatement> digests = snapshot.getDigests();

        long totalExecutions = digests.stream()
                .mapToLong(DigestStatement::execCount)
                .sum();

        double totalLatency = digests.stream()
                .mapToDouble(DigestStatement::totalLatencyMs)
                .sum();

        long fullScanDigests = digests.stream()
                .filter(d -> d.noIndexUsedCount() > 0)
                .count();

        summary.put("total_executions", totalExecutions);
        summary.put("total_latency_ms", Math.round(totalLatency * 100.0) / 100.0);
        summary.put("full_scan_digests", fullScanDigests);
        summary.put("explain_plans", snapshot.getExplainPlans().size());
        return summary;
    }
}
