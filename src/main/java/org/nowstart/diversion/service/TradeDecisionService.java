package org.nowstart.diversion.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.DecisionParams;
import org.nowstart.diversion.data.dto.DecisionResult;
import org.nowstart.diversion.data.dto.NetbackComparison;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.RiskPack;
import org.nowstart.diversion.data.dto.StressShocks;
import org.nowstart.diversion.data.dto.TradePack;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeDecisionService {

    private final NetbackCalculatorService netbackCalculatorService;
    private final DecisionEngineService decisionEngineService;
    private final RiskAnalyzerService riskAnalyzerService;

    public TradePack runTradeDecision(ReferenceData referenceData, TradeRequest request, DecisionParams params) {
        NetbackComparison comparison = netbackCalculatorService.compare(referenceData, request);
        DecisionResult decision = decisionEngineService.decide(comparison, params);

        log.info("Trade decision evaluated. load={}, a={}, b={}, decision={}, deltaRaw={}, deltaAdj={}, hedgeEnergy={}",
                request.loadPort(),
                request.marketAPort(),
                request.marketBPort(),
                decision.decision(),
                decision.deltaNetbackRawUsd(),
                decision.deltaNetbackAdjUsd(),
                decision.hedgeEnergyMmbtu());

        return new TradePack(
                request,
                params,
                comparison.marketA(),
                comparison.marketB(),
                decision,
                decision.hedgeLegs()
        );
    }

    public RiskPack runStressTest(
            ReferenceData referenceData,
            TradeRequest request,
            DecisionParams params,
            StressShocks shocks
    ) {
        TradePack base = runTradeDecision(referenceData, request, params);
        return riskAnalyzerService.runStressTest(base.decision(), referenceData, request, params, shocks);
    }
}
