package org.nowstart.diversion.data.dto;

public record VoyageDetails(
        double distanceNm,
        double voyageDays,
        double boilOffM3,
        double deliveredCargoM3,
        double deliveredEnergyMmbtu,
        double fuelConsumedTonnes,
        double fuelCostUsd,
        double timeCharterCostUsd,
        double carbonCostUsd,
        double totalVoyageCostUsd
) {
}
