package org.nowstart.diversion.data.dto;

import java.time.LocalDate;

public record EquityPoint(
        LocalDate date,
        double pnlUsd,
        double cumulativePnlUsd,
        double drawdownUsd
) {
}
