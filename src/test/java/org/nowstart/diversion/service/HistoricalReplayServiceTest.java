package org.nowstart.diversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.diversion.data.dto.BacktestResult;
import org.nowstart.diversion.data.dto.DecisionObservation;
import org.nowstart.diversion.data.dto.MarketObservation;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.nowstart.diversion.data.exception.ReferenceDataNotFoundException;
import org.nowstart.diversion.data.type.Decision;
import org.nowstart.diversion.data.type.FuelType;

class HistoricalReplayServiceTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 3);

    private final HistoricalReplayService service = new HistoricalReplayService(
            ReferenceFixtures.tradeDecisionService(),
            new BacktestService()
    );

    @Test
    void replay_returnsChronologicalObservations() {
        List<MarketObservation> history = List.of(
                row(2, 35.0, 38.5),
                row(0, 35.0, 35.2),
                row(1, 36.0, 40.0)
        );

        List<DecisionObservation> observations = service.replay(
                ReferenceFixtures.referenceData(),
                ReferenceFixtures.goldenRequest(),
                history,
                ReferenceFixtures.defaultParams(),
                1
        );

        assertThat(observations).extracting(DecisionObservation::date)
                .containsExactly(START, START.plusDays(1), START.plusDays(2));
        assertThat(observations).extracting(DecisionObservation::decision)
                .containsExactly(Decision.KEEP, Decision.DIVERT, Decision.DIVERT);
        assertThat(observations).allSatisfy(observation ->
                assertThat(observation.deltaNetbackRawUsd())
                        .isEqualTo(observation.netbackBUsd() - observation.netbackAUsd()));
    }

    @Test
    void replay_parallelMatchesSequential() {
        List<MarketObservation> history = new ArrayList<>();
        for (int day = 0; day < 40; day++) {
            history.add(row(day, 34.0 + (day % 5) * 0.3, 35.0 + (day % 7) * 0.6));
        }

        List<DecisionObservation> sequential = service.replay(
                ReferenceFixtures.referenceData(), ReferenceFixtures.goldenRequest(), history, ReferenceFixtures.defaultParams(), 1);
        List<DecisionObservation> parallel = service.replay(
                ReferenceFixtures.referenceData(), ReferenceFixtures.goldenRequest(), history, ReferenceFixtures.defaultParams(), 4);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void replay_propagatesLookupFailureFromWorkers() {
        TradeRequest voyage = new TradeRequest(
                ReferenceFixtures.LOAD, ReferenceFixtures.EUROPE, ReferenceFixtures.ASIA, "MEGI",
                ReferenceFixtures.CAPACITY_M3, 0.0, 0.0, 0.0, 0.0, 0.0, FuelType.VLSFO);
        List<MarketObservation> history = List.of(row(0, 35.0, 38.0), row(1, 35.0, 38.0));

        assertThatThrownBy(() -> service.replay(
                ReferenceFixtures.referenceData(), voyage, history, ReferenceFixtures.defaultParams(), 2))
                .isInstanceOf(ReferenceDataNotFoundException.class)
                .hasMessageContaining("MEGI");
    }

    @Test
    void replay_returnsEmptyForEmptyHistory() {
        assertThat(service.replay(
                ReferenceFixtures.referenceData(), ReferenceFixtures.goldenRequest(), List.of(), ReferenceFixtures.defaultParams(), 4))
                .isEmpty();
    }

    @Test
    void replayAndBacktest_feedsReplayIntoBacktest() {
        List<MarketObservation> history = List.of(
                row(0, 35.0, 35.2),
                row(1, 36.0, 40.0),
                row(2, 35.0, 38.5)
        );

        BacktestResult result = service.replayAndBacktest(
                ReferenceFixtures.referenceData(), ReferenceFixtures.goldenRequest(), history, ReferenceFixtures.defaultParams(), 1);

        assertThat(result.metrics().totalObservations()).isEqualTo(3);
        assertThat(result.metrics().triggeredTrades()).isEqualTo(2);
        assertThat(result.metrics().sharpeRatio()).isNull();
        assertThat(result.equityCurve().get(0).pnlUsd()).isEqualTo(0.0);
        assertThat(result.metrics().totalUpliftUsd()).isPositive();
    }

    private MarketObservation row(int day, double priceA, double priceB) {
        return new MarketObservation(START.plusDays(day), priceA, priceB, ReferenceFixtures.FREIGHT, ReferenceFixtures.FUEL, ReferenceFixtures.EUA);
    }
}
