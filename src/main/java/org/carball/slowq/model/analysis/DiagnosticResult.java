package org.carball.slowq.model.analysis;

import lombok.Builder;
import lombok.Data;
import org.carball.slowq.model.digest.SnapshotMetadata;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class DiagnosticResult {
    private SnapshotMetadata metadata;
    private LocalDateTime generatedAt;
    private String thresholdSummary;
    private WorkloadAnalysis workload;

    @Builder.Default
    private List<DigestDiagnosis> diagnoses = new ArrayList<>();

    @Builder.Default
    private List<Finding> indexFindings = new ArrayList<>();

    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (DigestDiagnosis diagnosis : diagnoses) {
            counts.merge(diagnosis.getSeverity(), 1L, Long::sum);
        }
        return counts;
    }

    public List<Finding> allFindings() {
        List<Finding> all = new ArrayList<>();
        diagnoses.forEach(d -> all.addAll(d.getFindings()));
        all.addAll(indexFindings);
        return all;
    }
}
