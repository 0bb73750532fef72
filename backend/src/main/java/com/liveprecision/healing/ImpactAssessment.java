package com.liveprecision.healing;

import com.liveprecision.domain.Severity;

import java.util.List;

public record ImpactAssessment(
        int score,
        Severity priority,
        String userImpact,
        List<String> affectedComponents,
        String estimatedDowntime
) {

    public ImpactAssessment {
        affectedComponents = List.copyOf(affectedComponents);
    }
}
