package org.nowstart.diversion.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.NetbackComparison;
import org.nowstart.diversion.data.dto.NetbackResult;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.nowstart.diversion.data.dto.VoyageDetails;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class NetbackCalculatorService {

    private final VoyageModelService voyageModelService;

    public NetbackResult computeNetback(String destination, double priceUsdMmbtu, VoyageDetails voyage) {
        double revenueUsd = priceUsdMmbtu * voyage.deliveredEnergyMmbtu();
        double netbackUsd = revenueUsd - voyage.totalVoyageCostUsd();

        return new NetbackResult(
                destination,
                priceUsdMmbtu,
                voyage.deliveredEnergyMmbtu(),
                revenueUsd,
                voyage.totalVoyageCostUsd() - voyage.carbonCostUsd(),
                voyage.carbonCostUsd(),
                netbackUsd,
                voyage
        );
    }

    /**
     * Runs both legs with the same vessel, fuel and carbon inputs. Result order is (market A, market B).
     */
    public NetbackComparison compare(ReferenceData referenceData, TradeRequest request) {
        VoyageDetails voyageA = voyageModelService.computeVoyage(
                referenceData,
                request.loadPort(),
                request.marketAPort(),
                request.vesselClass(),
                request.cargoCapacityM3(),
                request.rates(),
                request.fuelType()
        );
        NetbackResult marketA = computeNetback(request.marketAPort(), request.priceAUsdMmbtu(), voyageA);

        VoyageDetails voyageB = voyageModelService.computeVoyage(
                referenceData,
                request.loadPort(),
                request.marketBPort(),
                request.vesselClass(),
                request.cargoCapacityM3(),
                request.rates(),
                request.fuelType()
        );
        NetbackResult marketB = computeNetback(request.marketBPort(), request.priceBUsdMmbtu(), voyageB);

        log.debug("Netbacks computed. load={}, {}={}, {}={}",
                request.loadPort(), marketA.destination(), marketA.netbackUsd(), marketB.destination(), marketB.netbackUsd());
        return new NetbackComparison(marketA, marketB);
    }
}
