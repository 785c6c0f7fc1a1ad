package org.nowstart.diversion.data.type;

import org.nowstart.diversion.data.dto.AppliedShock;
import org.nowstart.diversion.data.dto.StressShocks;

public enum StressScenario {
    SPREAD_COLLAPSE("Spread Collapse", -1, 0, 0),
    SPREAD_WIDEN("Spread Widen", 1, 0, 0),
    FREIGHT_SPIKE("Freight Spike", 0, 1, 0),
    FREIGHT_DROP("Freight Drop", 0, -1, 0),
    EUA_SPIKE("EUA Spike", 0, 0, 1),
    COMBINED_ADVERSE("Combined Adverse", -1, 1, 1);

    private final String displayName;
    private final int spreadSign;
    private final int freightSign;
    private final int euaSign;

    StressScenario(String displayName, int spreadSign, int freightSign, int euaSign) {
        this.displayName = displayName;
        this.spreadSign = spreadSign;
        this.freightSign = freightSign;
        this.euaSign = euaSign;
    }

    public String displayName() {
        return displayName;
    }

    public AppliedShock apply(StressShocks shocks) {
        return new AppliedShock(
                this,
                spreadSign * shocks.spreadShockUsd(),
                freightSign * shocks.freightShockUsdDay(),
                euaSign * shocks.euaShockUsd()
        );
    }
}
