package org.nowstart.diversion.data.dto;

import java.time.LocalDate;
import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.type.Decision;

public record DecisionObservation(
        LocalDate date,
        Decision decision,
        double deltaNetbackRawUsd,
        double deltaNetbackAdjUsd,
        double netbackAUsd,
        double netbackBUsd
) {

    public DecisionObservation {
        if (date == null) {
            throw new InvalidConfigException("observation date is required");
        }
    }

    public boolean triggered() {
        return decision == Decision.DIVERT;
    }
}
