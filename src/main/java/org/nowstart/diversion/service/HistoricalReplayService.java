package org.nowstart.diversion.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.BacktestResult;
import org.nowstart.diversion.data.dto.DecisionObservation;
import org.nowstart.diversion.data.dto.DecisionParams;
import org.nowstart.diversion.data.dto.MarketObservation;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.TradePack;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.springframework.stereotype.Service;

/**
 * Replays the decision pipeline over historical market rows. Rows are independent, so they may be
 * evaluated in parallel; output keeps chronological order for the backtest's cumulative pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalReplayService {

    private final TradeDecisionService tradeDecisionService;
    private final BacktestService backtestService;

    public List<DecisionObservation> replay(
            ReferenceData referenceData,
            TradeRequest voyage,
            List<MarketObservation> history,
            DecisionParams params,
            int parallelism
    ) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }

        List<MarketObservation> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(MarketObservation::date));

        List<DecisionObservation> observations;
        if (parallelism <= 1) {
            observations = sorted.stream()
                    .map(row -> evaluate(referenceData, voyage, row, params))
                    .toList();
        } else {
            observations = evaluateInParallel(referenceData, voyage, sorted, params, parallelism);
        }

        log.info("Historical replay completed. rows={}, from={}, to={}, parallelism={}",
                observations.size(),
                sorted.get(0).date(),
                sorted.get(sorted.size() - 1).date(),
                parallelism);
        return observations;
    }

    public BacktestResult replayAndBacktest(
            ReferenceData referenceData,
            TradeRequest voyage,
            List<MarketObservation> history,
            DecisionParams params,
            int parallelism
    ) {
        return backtestService.runBacktest(replay(referenceData, voyage, history, params, parallelism));
    }

    private List<DecisionObservation> evaluateInParallel(
            ReferenceData referenceData,
            TradeRequest voyage,
            List<MarketObservation> sorted,
            DecisionParams params,
            int parallelism
    ) {
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> sorted.parallelStream()
                    .map(row -> evaluate(referenceData, voyage, row, params))
                    .toList()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Historical replay interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Historical replay failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private DecisionObservation evaluate(
            ReferenceData referenceData,
            TradeRequest voyage,
            MarketObservation row,
            DecisionParams params
    ) {
        TradePack pack = tradeDecisionService.runTradeDecision(referenceData, voyage.withMarket(row), params);
        return new DecisionObservation(
                row.date(),
                pack.decision().decision(),
                pack.decision().deltaNetbackRawUsd(),
                pack.decision().deltaNetbackAdjUsd(),
                pack.marketA().netbackUsd(),
                pack.marketB().netbackUsd()
        );
    }
}
