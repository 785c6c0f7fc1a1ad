package org.nowstart.diversion.service;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.AppliedShock;
import org.nowstart.diversion.data.dto.DecisionParams;
import org.nowstart.diversion.data.dto.DecisionResult;
import org.nowstart.diversion.data.dto.NetbackComparison;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.RiskPack;
import org.nowstart.diversion.data.dto.StressResult;
import org.nowstart.diversion.data.dto.StressShocks;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.type.StressScenario;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RiskAnalyzerService {

    private final NetbackCalculatorService netbackCalculatorService;
    private final DecisionEngineService decisionEngineService;

    public List<AppliedShock> createScenarios(StressShocks shocks) {
        List<AppliedShock> scenarios = new ArrayList<>(StressScenario.values().length);
        for (StressScenario scenario : StressScenario.values()) {
            scenarios.add(scenario.apply(shocks));
        }
        return scenarios;
    }

    /**
     * Re-runs both netbacks and the decision rule under every scenario, using the same decision
     * parameters as the base case. Shocks are additive: spread on the market B price, freight on the
     * charter rate, EUA on the carbon price.
     */
    public RiskPack runStressTest(
            DecisionResult baseResult,
            ReferenceData referenceData,
            TradeRequest request,
            DecisionParams params,
            StressShocks shocks
    ) {
        if (baseResult == null || shocks == null) {
            throw new InvalidConfigException("base result and stress shocks are required");
        }

        List<StressResult> stressResults = createScenarios(shocks).stream()
                .map(shock -> stress(baseResult, referenceData, request, params, shock))
                .toList();

        double worstCasePnlImpact = stressResults.stream()
                .mapToDouble(StressResult::pnlImpactUsd)
                .min()
                .orElse(0.0);
        List<String> scenariosCausingFlip = stressResults.stream()
                .filter(StressResult::decisionChange)
                .map(result -> result.scenario().name())
                .toList();

        log.info("Stress test completed. baseDecision={}, worstCasePnlImpact={}, flips={}",
                baseResult.decision(), worstCasePnlImpact, scenariosCausingFlip);
        return new RiskPack(baseResult, stressResults, worstCasePnlImpact, scenariosCausingFlip);
    }

    private StressResult stress(
            DecisionResult baseResult,
            ReferenceData referenceData,
            TradeRequest request,
            DecisionParams params,
            AppliedShock shock
    ) {
        NetbackComparison stressed = netbackCalculatorService.compare(referenceData, request.withShock(shock));
        DecisionResult stressedResult = decisionEngineService.decide(stressed, params);

        double baseDeltaAdj = baseResult.deltaNetbackAdjUsd();
        double stressedDeltaAdj = stressedResult.deltaNetbackAdjUsd();
        return new StressResult(
                shock,
                baseDeltaAdj,
                stressedDeltaAdj,
                stressedDeltaAdj - baseDeltaAdj,
                stressedResult.decision() != baseResult.decision(),
                baseResult.decision(),
                stressedResult.decision()
        );
    }
}
