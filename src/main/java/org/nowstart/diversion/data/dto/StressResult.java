package org.nowstart.diversion.data.dto;

import org.nowstart.diversion.data.type.Decision;

public record StressResult(
        AppliedShock scenario,
        double baseDeltaNetbackAdjUsd,
        double stressedDeltaNetbackAdjUsd,
        double pnlImpactUsd,
        boolean decisionChange,
        Decision baseDecision,
        Decision stressedDecision
) {
}
