package org.carball.slowq.model.analysis;

import java.util.List;

public record DigestScore(
        int score,
        Severity severity,
        List<Finding> findings
) {}
