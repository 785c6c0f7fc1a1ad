package org.nowstart.diversion.service;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.CarbonParams;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.Route;
import org.nowstart.diversion.data.dto.Vessel;
import org.nowstart.diversion.data.dto.VoyageDetails;
import org.nowstart.diversion.data.dto.VoyageRates;
import org.nowstart.diversion.data.type.FuelType;
import org.springframework.stereotype.Service;

/**
 * Laden-leg voyage physics and cost. The ballast return is not modeled.
 *
 * <p>Delivered cargo is not clamped: a vessel too slow for the route yields negative delivered
 * energy, which is surfaced unchanged so the bad input stays visible downstream.
 */
@Slf4j
@Service
public class VoyageModelService {

    public static final double LNG_DENSITY_T_PER_M3 = 0.45;
    public static final double ENERGY_CONTENT_MMBTU_PER_T = 52.0;
    public static final double HOURS_PER_DAY = 24.0;

    public VoyageDetails computeVoyage(
            ReferenceData referenceData,
            String loadPort,
            String dischargePort,
            String vesselClass,
            double cargoCapacityM3,
            VoyageRates rates,
            FuelType fuelType
    ) {
        Route route = referenceData.route(loadPort, dischargePort);
        Vessel vessel = referenceData.vessel(vesselClass).withCargoCapacity(cargoCapacityM3);
        return computeVoyage(route, vessel, rates, fuelType, referenceData.carbonParams());
    }

    public VoyageDetails computeVoyage(
            Route route,
            Vessel vessel,
            VoyageRates rates,
            FuelType fuelType,
            CarbonParams carbonParams
    ) {
        double distanceNm = route.distanceNm();
        double voyageDays = distanceNm / (vessel.ladenSpeedKn() * HOURS_PER_DAY);

        double boilOffM3 = vessel.cargoCapacityM3() * (vessel.boilOffPctPerDay() / 100.0) * voyageDays;
        double deliveredCargoM3 = vessel.cargoCapacityM3() - boilOffM3;
        double deliveredEnergyMmbtu = deliveredCargoM3 * LNG_DENSITY_T_PER_M3 * ENERGY_CONTENT_MMBTU_PER_T;

        double fuelConsumedTonnes = vessel.fuelConsumptionTpdLaden() * voyageDays;
        double fuelCostUsd = fuelConsumedTonnes * rates.fuelPriceUsdT();
        double timeCharterCostUsd = rates.freightRateUsdDay() * voyageDays;

        FuelType resolvedFuel = fuelType == null ? FuelType.VLSFO : fuelType;
        double carbonEmissionsTco2 = fuelConsumedTonnes * carbonParams.co2Factor(resolvedFuel);
        double carbonCostUsd = carbonEmissionsTco2 * rates.euaPriceUsdT();

        double totalVoyageCostUsd = fuelCostUsd + timeCharterCostUsd + carbonCostUsd;

        if (deliveredCargoM3 < 0.0) {
            log.warn("Boil-off exceeds cargo. route={}->{}, vessel={}, voyageDays={}, deliveredCargoM3={}",
                    route.loadPort(), route.dischargePort(), vessel.vesselClass(), voyageDays, deliveredCargoM3);
        }

        return new VoyageDetails(
                distanceNm,
                voyageDays,
                boilOffM3,
                deliveredCargoM3,
                deliveredEnergyMmbtu,
                fuelConsumedTonnes,
                fuelCostUsd,
                timeCharterCostUsd,
                carbonCostUsd,
                totalVoyageCostUsd
        );
    }
}
