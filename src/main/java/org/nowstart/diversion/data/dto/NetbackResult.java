package org.nowstart.diversion.data.dto;

public record NetbackResult(
        String destination,
        double priceUsdMmbtu,
        double deliveredEnergyMmbtu,
        double revenueUsd,
        // excludes carbon; carbonCostUsd is reported separately
        double voyageCostUsd,
        double carbonCostUsd,
        double netbackUsd,
        VoyageDetails voyage
) {
}
