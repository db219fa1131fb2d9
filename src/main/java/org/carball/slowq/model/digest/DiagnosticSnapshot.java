package org.carball.slowq.model.digest;

import lombok.Builder;
import lombok.Data;
import org.carball.slowq.model.schema.DatabaseSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything captured from one server (or file) that a diagnosis runs against.
 */
@Data
@Builder
public class DiagnosticSnapshot {
    private SnapshotMetadata metadata;

    @Builder.Default
    private List<DigestStatement> digests = new ArrayList<>();

    @Builder.Default
    private List<IndexUsage> indexUsage = new ArrayList<>();

    // "schema.table.index" names reported by sys.schema_unused_indexes
    @Builder.Default
    private List<String> unusedIndexes = new ArrayList<>();

    @Builder.Default
    private DatabaseSchema schema = new DatabaseSchema();

    // EXPLAIN ANALYZE text keyed by DigestStatement.key()
    @Builder.Default
    private Map<String, String> explainPlans = new LinkedHashMap<>();
}
