package org.nowstart.diversion.data.dto;

import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.type.FuelType;

public record CarbonParams(
        double euaPriceUsdPerT,
        double co2FactorVlsfoTco2PerTFuel,
        double co2FactorLngTco2PerTFuel
) {

    public CarbonParams {
        if (!Double.isFinite(co2FactorVlsfoTco2PerTFuel) || co2FactorVlsfoTco2PerTFuel < 0.0
                || !Double.isFinite(co2FactorLngTco2PerTFuel) || co2FactorLngTco2PerTFuel < 0.0) {
            throw new InvalidConfigException("CO2 factors must be finite and >= 0");
        }
    }

    public double co2Factor(FuelType fuelType) {
        return fuelType == FuelType.LNG ? co2FactorLngTco2PerTFuel : co2FactorVlsfoTco2PerTFuel;
    }
}
