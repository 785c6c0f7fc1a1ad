package org.nowstart.diversion.data.dto;

import jakarta.validation.constraints.NotBlank;
import org.nowstart.diversion.data.exception.InvalidConfigException;

public record Vessel(
        @NotBlank String vesselClass,
        double cargoCapacityM3,
        double ladenSpeedKn,
        double ballastSpeedKn,
        double boilOffPctPerDay,
        double fuelConsumptionTpdLaden,
        double fuelConsumptionTpdBallast
) {

    public Vessel {
        if (vesselClass == null || vesselClass.isBlank()) {
            throw new InvalidConfigException("vesselClass is required");
        }
        if (!Double.isFinite(cargoCapacityM3) || cargoCapacityM3 <= 0.0) {
            throw new InvalidConfigException("cargoCapacityM3 must be > 0 for vessel " + vesselClass);
        }
        if (!Double.isFinite(ladenSpeedKn) || ladenSpeedKn <= 0.0) {
            throw new InvalidConfigException("ladenSpeedKn must be > 0 for vessel " + vesselClass);
        }
        if (!Double.isFinite(boilOffPctPerDay) || boilOffPctPerDay < 0.0 || boilOffPctPerDay >= 100.0) {
            throw new InvalidConfigException("boilOffPctPerDay must be in [0, 100) for vessel " + vesselClass);
        }
        if (!Double.isFinite(fuelConsumptionTpdLaden) || fuelConsumptionTpdLaden < 0.0) {
            throw new InvalidConfigException("fuelConsumptionTpdLaden must be >= 0 for vessel " + vesselClass);
        }
    }

    public Vessel withCargoCapacity(double capacityM3) {
        return new Vessel(
                vesselClass,
                capacityM3,
                ladenSpeedKn,
                ballastSpeedKn,
                boilOffPctPerDay,
                fuelConsumptionTpdLaden,
                fuelConsumptionTpdBallast
        );
    }
}
