package org.nowstart.diversion.data.dto;

public record VoyageRates(
        double freightRateUsdDay,
        double fuelPriceUsdT,
        double euaPriceUsdT
) {
}
