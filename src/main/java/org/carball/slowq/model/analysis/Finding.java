package org.carball.slowq.model.analysis;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class Finding {
    private FindingType type;
    private Severity severity;
    private String subject;
    private String message;
    private String recommendation;

    @Builder.Default
    private Map<String, Object> evidence = new LinkedHashMap<>();

    /**
     * Creates a finding carrying the type's default severity.
     */
    public static Finding of(FindingType type, String subject, String message, String recommendation) {
        return Finding.builder()
                .type(type)
                .severity(type.getDefaultSeverity())
                .subject(subject)
                .message(message)
                .recommendation(recommendation)
                .build();
    }

    public Finding withEvidence(String key, Object value) {
        evidence.put(key, value);
        return this;
    }
}
