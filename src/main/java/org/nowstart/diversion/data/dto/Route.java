package org.nowstart.diversion.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.nowstart.diversion.data.exception.InvalidConfigException;

public record Route(
        @NotBlank String loadPort,
        @NotBlank String dischargePort,
        @PositiveOrZero double distanceNm
) {

    public Route {
        if (loadPort == null || loadPort.isBlank() || dischargePort == null || dischargePort.isBlank()) {
            throw new InvalidConfigException("route ports are required");
        }
        if (!Double.isFinite(distanceNm) || distanceNm < 0.0) {
            throw new InvalidConfigException("distanceNm must be >= 0 for route " + loadPort + "->" + dischargePort);
        }
    }

    public boolean connects(String load, String discharge) {
        return loadPort.equals(load) && dischargePort.equals(discharge);
    }
}
