package org.carball.slowq.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.slowq.model.digest.DiagnosticSnapshot;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.IndexUsage;
import org.carball.slowq.model.digest.SnapshotMetadata;
import org.carball.slowq.model.schema.DatabaseSchema;
import org.carball.slowq.model.schema.Index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a diagnostic snapshot from an exported JSON file instead of connecting to the server.
 */
@Slf4j
public class SnapshotFileConnector {

    private static final String[] REQUIRED_METADATA = {"server_version", "captured_at", "performance_schema_enabled"};

    private final JsonNode exportData;

    public SnapshotFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Snapshot file not found: " + path);
        }

        ObjectMapper objectMapper = new ObjectMapper();
        exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
        log.debug("Loaded snapshot file {}", path);
    }

    public SnapshotMetadata getMetadata() {
        JsonNode metadata = exportData.get("snapshot_metadata");
        JsonNode digests = exportData.get("digests");

        return new SnapshotMetadata(
                metadata.get("server_version").asText(),
                parseTime(metadata.get("captured_at")),
                text(metadata, "schema_name"),
                metadata.get("performance_schema_enabled").asBoolean(),
                metadata.has("total_digests") ? metadata.get("total_digests").asInt() : digests.size(),
                metadata.has("source") ? metadata.get("source").asText() : SnapshotMetadata.SOURCE_PERFORMANCE_SCHEMA,
                metadata.path("workload_executions").asLong(),
                metadata.path("workload_latency_ms").asDouble()
        );
    }

    public List<DigestStatement> getDigests() {
        List<DigestStatement> results = new ArrayList<>();
        for (JsonNode node : exportData.get("digests")) {
            results.add(parseDigest(node));
        }
        return results;
    }

    public List<IndexUsage> getIndexUsage() {
        List<IndexUsage> results = new ArrayList<>();
        JsonNode usage = exportData.get("index_usage");

        if (usage != null && usage.isArray()) {
            for (JsonNode node : usage) {
                results.add(new IndexUsage(
                        text(node, "schema"),
                        text(node, "table"),
                        text(node, "index"),
                        node.path("count_star").asLong(),
                        node.path("count_read").asLong(),
                        node.path("count_write").asLong(),
                        node.path("latency_ms").asDouble(),
                        node.hasNonNull("unique") ? node.get("unique").asBoolean() : null
                ));
            }
        }
        return results;
    }

    public List<String> getUnusedIndexes() {
        List<String> results = new ArrayList<>();
        JsonNode unused = exportData.get("unused_indexes");
        if (unused != null && unused.isArray()) {
            unused.forEach(node -> results.add(node.asText()));
        }
        return results;
    }

    /**
     * Rebuilds index definitions from the index_definitions section.
     */
    public DatabaseSchema getSchema() {
        DatabaseSchema schema = new DatabaseSchema();
        JsonNode definitions = exportData.get("index_definitions");

        if (definitions != null && definitions.isArray()) {
            for (JsonNode node : definitions) {
                List<String> columns = new ArrayList<>();
                node.path("columns").forEach(c -> columns.add(c.asText()));

                schema.getOrCreateTable(text(node, "table")).addIndex(Index.builder()
                        .name(text(node, "index"))
                        .columns(columns)
                        .unique(node.path("unique").asBoolean())
                        .primary(node.path("primary").asBoolean())
                        .build());
            }
        }
        return schema;
    }

    /**
     * EXPLAIN ANALYZE text keyed by {@link DigestStatement#key()}. A plan without schema_name is
     * matched to its digest when only one captured digest has that id.
     */
    public Map<String, String> getExplainPlans() {
        Map<String, String> plans = new LinkedHashMap<>();
        JsonNode explainPlans = exportData.get("explain_plans");

        if (explainPlans != null && explainPlans.isArray()) {
            List<DigestStatement> digests = getDigests();
            for (JsonNode node : explainPlans) {
                String digest = text(node, "digest");
                String schemaName = text(node, "schema_name");
                if (schemaName == null) {
                    List<DigestStatement> matches = digests.stream()
                            .filter(d -> d.digest().equals(digest))
                            .toList();
                    if (matches.size() == 1) {
                        schemaName = matches.get(0).schemaName();
                    } else if (matches.size() > 1) {
                        log.warn("Plan for digest {} has no schema_name and matches {} digests; ignoring it",
                                digest, matches.size());
                        continue;
                    }
                }
                plans.put(DigestStatement.keyOf(schemaName, digest), text(node, "plan"));
            }
        }
        return plans;
    }

    public DiagnosticSnapshot toSnapshot() {
        return DiagnosticSnapshot.builder()
                .metadata(getMetadata())
                .digests(getDigests())
                .indexUsage(getIndexUsage())
                .unusedIndexes(getUnusedIndexes())
                .schema(getSchema())
                .explainPlans(getExplainPlans())
                .build();
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in snapshot file");
        }

        JsonNode metadata = exportData.get("snapshot_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing snapshot_metadata section in snapshot file");
        }

        JsonNode digests = exportData.get("digests");
        if (digests == null || !digests.isArray()) {
            throw new IllegalStateException("Missing or invalid digests section in snapshot file");
        }

        for (String field : REQUIRED_METADATA) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }

        for (JsonNode digest : digests) {
            if (!digest.hasNonNull("digest") || !digest.hasNonNull("digest_text")) {
                throw new IllegalStateException("Digest entry without digest or digest_text: " + digest);
            }
        }
    }

    private DigestStatement parseDigest(JsonNode node) {
        return DigestStatement.builder()
                .digest(node.get("digest").asText())
                .schemaName(text(node, "schema_name"))
                .digestText(node.get("digest_text").asText())
                .querySampleText(text(node, "query_sample_text"))
                .execCount(node.path("exec_count").asLong())
                .totalLatencyMs(node.path("total_latency_ms").asDouble())
                .avgLatencyMs(node.path("avg_latency_ms").asDouble())
                .maxLatencyMs(node.path("max_latency_ms").asDouble())
                .p95LatencyMs(node.path("p95_latency_ms").asDouble())
                .lockLatencyMs(node.path("lock_latency_ms").asDouble())
                .rowsSent(node.path("rows_sent").asLong())
                .rowsExamined(node.path("rows_examined").asLong())
                .rowsAffected(node.path("rows_affected").asLong())
                .noIndexUsedCount(node.path("no_index_used_count").asLong())
                .noGoodIndexUsedCount(node.path("no_good_index_used_count").asLong())
                .tmpTables(node.path("tmp_tables").asLong())
                .tmpDiskTables(node.path("tmp_disk_tables").asLong())
                .sortMergePasses(node.path("sort_merge_passes").asLong())
                .errors(node.path("errors").asLong())
                .firstSeen(parseTime(node.get("first_seen")))
                .lastSeen(parseTime(node.get("last_seen")))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static LocalDateTime parseTime(JsonNode value) {
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid timestamp in snapshot file: " + value.asText(), e);
        }
    }
}
