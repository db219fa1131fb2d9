package org.carball.slowq.model.analysis;

import lombok.Builder;
import lombok.Data;
import org.carball.slowq.model.digest.DigestStatement;
import org.carball.slowq.model.digest.StatementProfile;
import org.carball.slowq.model.plan.ExplainNode;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class DigestDiagnosis {
    private DigestStatement statement;
    private StatementProfile profile;
    private int score;
    private Severity severity;
    private double latencySharePercent;

    @Builder.Default
    private List<Finding> findings = new ArrayList<>();

    private IndexSuggestion indexSuggestion;
    private ExplainNode plan;
}
