package org.nowstart.diversion.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.diversion.data.dto.BacktestRequest;
import org.nowstart.diversion.data.dto.BacktestResult;
import org.nowstart.diversion.data.dto.MarketSnapshot;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.RiskPack;
import org.nowstart.diversion.data.dto.TradePack;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.nowstart.diversion.data.property.DecisionProperties;
import org.nowstart.diversion.service.HistoricalReplayService;
import org.nowstart.diversion.service.MarketSnapshotService;
import org.nowstart.diversion.service.TradeDecisionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/diversion")
@Tag(name = "Diversion", description = "Cargo diversion decision, stress test and backtest API")
public class DiversionController {

    private final TradeDecisionService tradeDecisionService;
    private final HistoricalReplayService historicalReplayService;
    private final MarketSnapshotService marketSnapshotService;
    private final ReferenceData referenceData;
    private final DecisionProperties decisionProperties;

    public DiversionController(
            TradeDecisionService tradeDecisionService,
            HistoricalReplayService historicalReplayService,
            MarketSnapshotService marketSnapshotService,
            ReferenceData referenceData,
            DecisionProperties decisionProperties
    ) {
        this.tradeDecisionService = tradeDecisionService;
        this.historicalReplayService = historicalReplayService;
        this.marketSnapshotService = marketSnapshotService;
        this.referenceData = referenceData;
        this.decisionProperties = decisionProperties;
    }

    @GetMapping("/market-snapshot")
    @Operation(summary = "Proxy market snapshot", description = "Returns the configured proxy prices with provenance.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot returned")
    })
    public MarketSnapshot getMarketSnapshot(@RequestParam(value = "asOf", required = false) String asOf) {
        return marketSnapshotService.snapshot(asOf);
    }

    @GetMapping("/decision/latest")
    @Operation(summary = "Decision on the proxy snapshot", description = "Evaluates the configured default voyage against the proxy snapshot.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision evaluated"),
            @ApiResponse(responseCode = "404", description = "Route or vessel class not found")
    })
    public TradePack getLatestDecision() {
        MarketSnapshot snapshot = marketSnapshotService.snapshot(null);
        return tradeDecisionService.runTradeDecision(
                referenceData,
                marketSnapshotService.defaultRequest(snapshot),
                decisionProperties.toDecisionParams()
        );
    }

    @PostMapping("/decision")
    @Operation(summary = "Evaluate diversion", description = "Computes both netbacks, the DIVERT/KEEP decision and hedge legs.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision evaluated"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "404", description = "Route or vessel class not found")
    })
    public TradePack evaluateDecision(@RequestBody @Valid TradeRequest request) {
        return tradeDecisionService.runTradeDecision(referenceData, request, decisionProperties.toDecisionParams());
    }

    @PostMapping("/stress")
    @Operation(summary = "Stress test", description = "Runs the fixed stress scenarios against the request.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Stress test completed"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "404", description = "Route or vessel class not found")
    })
    public RiskPack stressTest(@RequestBody @Valid TradeRequest request) {
        return tradeDecisionService.runStressTest(
                referenceData,
                request,
                decisionProperties.toDecisionParams(),
                decisionProperties.toStressShocks()
        );
    }

    @PostMapping("/backtest")
    @Operation(summary = "Backtest", description = "Replays the decision rule over a price history and aggregates performance.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Backtest completed"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "404", description = "Route or vessel class not found")
    })
    public BacktestResult backtest(@RequestBody @Valid BacktestRequest request) {
        return historicalReplayService.replayAndBacktest(
                referenceData,
                request.voyage(),
                request.history(),
                decisionProperties.toDecisionParams(),
                decisionProperties.replayParallelism()
        );
    }
}
