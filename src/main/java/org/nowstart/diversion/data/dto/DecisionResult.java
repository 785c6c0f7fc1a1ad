package org.nowstart.diversion.data.dto;

import java.util.List;
import org.nowstart.diversion.data.type.Decision;

public record DecisionResult(
        double deltaNetbackRawUsd,
        double deltaNetbackAdjUsd,
        double basisHaircutPct,
        double opsBufferUsd,
        double decisionBufferUsd,
        Decision decision,
        double hedgeEnergyMmbtu,
        int lotsA,
        int lotsB,
        List<HedgeLeg> hedgeLegs
) {

    public DecisionResult {
        hedgeLegs = hedgeLegs == null ? List.of() : List.copyOf(hedgeLegs);
    }

    public boolean divert() {
        return decision == Decision.DIVERT;
    }
}
