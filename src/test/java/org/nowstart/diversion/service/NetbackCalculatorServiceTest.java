package org.nowstart.diversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.diversion.data.dto.NetbackComparison;
import org.nowstart.diversion.data.dto.NetbackResult;
import org.nowstart.diversion.data.dto.VoyageDetails;

class NetbackCalculatorServiceTest {

    private final NetbackCalculatorService service = ReferenceFixtures.netbackCalculator();

    @Test
    void computeNetback_subtractsTotalVoyageCostAndSplitsCarbon() {
        VoyageDetails voyage = new VoyageDetails(
                5000.0, 10.0, 1000.0, 173_000.0, 4_000_000.0,
                1300.0, 750_000.0, 850_000.0, 300_000.0, 1_900_000.0
        );

        NetbackResult result = service.computeNetback("Rotterdam", 10.0, voyage);

        assertThat(result.destination()).isEqualTo("Rotterdam");
        assertThat(result.revenueUsd()).isEqualTo(40_000_000.0);
        assertThat(result.netbackUsd()).isEqualTo(38_100_000.0);
        assertThat(result.voyageCostUsd()).isEqualTo(1_600_000.0);
        assertThat(result.carbonCostUsd()).isEqualTo(300_000.0);
        assertThat(result.voyage()).isSameAs(voyage);
    }

    @Test
    void compare_goldenCaseFavoursAsia() {
        NetbackComparison comparison = service.compare(
                ReferenceFixtures.referenceData(),
                ReferenceFixtures.goldenRequest()
        );
        NetbackResult europe = comparison.marketA();
        NetbackResult asia = comparison.marketB();

        assertThat(europe.destination()).isEqualTo(ReferenceFixtures.EUROPE);
        assertThat(asia.destination()).isEqualTo(ReferenceFixtures.ASIA);
        assertThat(europe.voyage().voyageDays()).isCloseTo(10.7, within(0.15));
        assertThat(asia.voyage().voyageDays()).isCloseTo(20.3, within(0.15));
        assertThat(europe.deliveredEnergyMmbtu()).isGreaterThan(asia.deliveredEnergyMmbtu());
        assertThat(asia.netbackUsd()).isGreaterThan(europe.netbackUsd());
        assertThat(asia.netbackUsd() - europe.netbackUsd()).isGreaterThan(100_000.0);
    }

    @Test
    void compare_isDeterministicForIdenticalInputs() {
        NetbackComparison first = service.compare(ReferenceFixtures.referenceData(), ReferenceFixtures.goldenRequest());
        NetbackComparison second = service.compare(ReferenceFixtures.referenceData(), ReferenceFixtures.goldenRequest());

        assertThat(second).isEqualTo(first);
    }
}
