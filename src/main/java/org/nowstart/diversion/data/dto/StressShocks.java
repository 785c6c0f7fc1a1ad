package org.nowstart.diversion.data.dto;

import org.nowstart.diversion.data.exception.InvalidConfigException;

public record StressShocks(
        double spreadShockUsd,
        double freightShockUsdDay,
        double euaShockUsd
) {

    public StressShocks {
        validateMagnitude("spreadShockUsd", spreadShockUsd);
        validateMagnitude("freightShockUsdDay", freightShockUsdDay);
        validateMagnitude("euaShockUsd", euaShockUsd);
    }

    private static void validateMagnitude(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidConfigException(field + " must be >= 0, got " + value);
        }
    }
}
