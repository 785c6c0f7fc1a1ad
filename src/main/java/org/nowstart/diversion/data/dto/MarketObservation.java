package org.nowstart.diversion.data.dto;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public record MarketObservation(
        @NotNull(message = "date is required")
        LocalDate date,
        double priceAUsdMmbtu,
        double priceBUsdMmbtu,
        double freightRateUsdDay,
        double fuelPriceUsdT,
        double euaPriceUsdT
) {
}
