package org.nowstart.diversion.data.dto;

import java.util.List;

public record RiskPack(
        DecisionResult baseResult,
        List<StressResult> stressResults,
        double worstCasePnlImpactUsd,
        List<String> scenariosCausingFlip
) {

    public RiskPack {
        stressResults = List.copyOf(stressResults);
        scenariosCausingFlip = List.copyOf(scenariosCausingFlip);
    }
}
