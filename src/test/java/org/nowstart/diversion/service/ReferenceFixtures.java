package org.nowstart.diversion.service;

import java.util.List;
import org.nowstart.diversion.data.dto.CarbonParams;
import org.nowstart.diversion.data.dto.DecisionParams;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.dto.Route;
import org.nowstart.diversion.data.dto.TradeRequest;
import org.nowstart.diversion.data.dto.Vessel;
import org.nowstart.diversion.data.type.FuelType;

final class ReferenceFixtures {

    static final String LOAD = "US_Gulf";
    static final String EUROPE = "Rotterdam";
    static final String ASIA = "Tokyo";
    static final String TFDE = "TFDE";
    static final double CAPACITY_M3 = 174_000.0;
    static final double TTF = 35.69;
    static final double JKM = 38.44;
    static final double FREIGHT = 85_000.0;
    static final double FUEL = 583.0;
    static final double EUA = 74.40;
    static final double CO2_FACTOR = 3.114;

    private ReferenceFixtures() {
    }

    static Vessel tfde() {
        return new Vessel(TFDE, CAPACITY_M3, 19.5, 19.5, 0.10, 130.0, 130.0);
    }

    static ReferenceData referenceData() {
        return new ReferenceData(
                List.of(
                        new Route(LOAD, EUROPE, 5000.0),
                        new Route(LOAD, ASIA, 9500.0)
                ),
                List.of(tfde()),
                new CarbonParams(EUA, CO2_FACTOR, CO2_FACTOR)
        );
    }

    static TradeRequest goldenRequest() {
        return new TradeRequest(LOAD, EUROPE, ASIA, TFDE, CAPACITY_M3, TTF, JKM, FREIGHT, FUEL, EUA, FuelType.VLSFO);
    }

    static DecisionParams defaultParams() {
        return DecisionParams.of(0.05, 150_000.0, 250_000.0);
    }

    static NetbackCalculatorService netbackCalculator() {
        return new NetbackCalculatorService(new VoyageModelService());
    }

    static RiskAnalyzerService riskAnalyzer() {
        return new RiskAnalyzerService(netbackCalculator(), new DecisionEngineService());
    }

    static TradeDecisionService tradeDecisionService() {
        return new TradeDecisionService(netbackCalculator(), new DecisionEngineService(), riskAnalyzer());
    }
}
