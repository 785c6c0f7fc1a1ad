package org.nowstart.diversion.data.dto;

import org.nowstart.diversion.data.type.StressScenario;

public record AppliedShock(
        StressScenario scenario,
        double spreadShockUsd,
        double freightShockUsdDay,
        double euaShockUsd
) {

    public String name() {
        return scenario.displayName();
    }
}
