package org.nowstart.diversion.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.nowstart.diversion.data.type.FuelType;

public record TradeRequest(
        @NotBlank(message = "loadPort is required")
        String loadPort,
        @NotBlank(message = "marketAPort is required")
        String marketAPort,
        @NotBlank(message = "marketBPort is required")
        String marketBPort,
        @NotBlank(message = "vesselClass is required")
        String vesselClass,
        @Positive(message = "cargoCapacityM3 must be positive")
        double cargoCapacityM3,
        double priceAUsdMmbtu,
        double priceBUsdMmbtu,
        double freightRateUsdDay,
        double fuelPriceUsdT,
        double euaPriceUsdT,
        FuelType fuelType
) {

    public TradeRequest {
        fuelType = fuelType == null ? FuelType.VLSFO : fuelType;
    }

    public VoyageRates rates() {
        return new VoyageRates(freightRateUsdDay, fuelPriceUsdT, euaPriceUsdT);
    }

    public TradeRequest withShock(AppliedShock shock) {
        return new TradeRequest(
                loadPort,
                marketAPort,
                marketBPort,
                vesselClass,
                cargoCapacityM3,
                priceAUsdMmbtu,
                priceBUsdMmbtu + shock.spreadShockUsd(),
                freightRateUsdDay + shock.freightShockUsdDay(),
                fuelPriceUsdT,
                euaPriceUsdT + shock.euaShockUsd(),
                fuelType
        );
    }

    public TradeRequest withMarket(MarketObservation observation) {
        return new TradeRequest(
                loadPort,
                marketAPort,
                marketBPort,
                vesselClass,
                cargoCapacityM3,
                observation.priceAUsdMmbtu(),
                observation.priceBUsdMmbtu(),
                observation.freightRateUsdDay(),
                observation.fuelPriceUsdT(),
                observation.euaPriceUsdT(),
                fuelType
        );
    }
}
