package org.nowstart.diversion.data.dto;

import java.util.Map;

public record MarketSnapshot(
        String asOf,
        double priceAUsdMmbtu,
        double priceBUsdMmbtu,
        double freightRateUsdDay,
        double fuelPriceUsdT,
        double euaPriceUsdT,
        Map<String, String> provenance
) {

    public MarketSnapshot {
        provenance = provenance == null ? Map.of() : Map.copyOf(provenance);
    }
}
