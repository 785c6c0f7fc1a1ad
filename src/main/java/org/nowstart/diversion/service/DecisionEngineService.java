package org.nowstart.diversion.service;

import java.util.List;
import org.nowstart.diversion.data.dto.DecisionParams;
import org.nowstart.diversion.data.dto.DecisionResult;
import org.nowstart.diversion.data.dto.HedgeLeg;
import org.nowstart.diversion.data.dto.NetbackComparison;
import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.type.Decision;
import org.nowstart.diversion.data.type.HedgeSide;
import org.springframework.stereotype.Service;

/**
 * Diversion rule and hedge sizing. Market B is the divert-to candidate.
 *
 * <pre>
 *   deltaRaw = netbackB - netbackA
 *   deltaAdj = deltaRaw * (1 - haircut) - opsBuffer
 *   DIVERT if deltaAdj >= decisionBuffer else KEEP
 * </pre>
 *
 * Hedge legs are only issued on DIVERT: long the B benchmark, short the A benchmark.
 */
@Service
public class DecisionEngineService {

    public DecisionResult decide(
            double netbackAUsd,
            double netbackBUsd,
            double hedgeEnergyMmbtu,
            DecisionParams params
    ) {
        if (params == null) {
            throw new InvalidConfigException("decision params are required");
        }
        if (!Double.isFinite(hedgeEnergyMmbtu)) {
            throw new InvalidConfigException("hedgeEnergyMmbtu must be finite");
        }

        double deltaRaw = netbackBUsd - netbackAUsd;
        double deltaAdj = deltaRaw * (1.0 - params.basisHaircutPct()) - params.opsBufferUsd();
        Decision decision = deltaAdj >= params.decisionBufferUsd() ? Decision.DIVERT : Decision.KEEP;

        int lotsA = lots(hedgeEnergyMmbtu, params.lotSizeA());
        int lotsB = lots(hedgeEnergyMmbtu, params.lotSizeB());

        List<HedgeLeg> hedgeLegs = decision == Decision.DIVERT
                ? List.of(
                        new HedgeLeg(HedgeSide.BUY, params.instrumentB(), lotsB),
                        new HedgeLeg(HedgeSide.SELL, params.instrumentA(), lotsA))
                : List.of();

        return new DecisionResult(
                deltaRaw,
                deltaAdj,
                params.basisHaircutPct(),
                params.opsBufferUsd(),
                params.decisionBufferUsd(),
                decision,
                hedgeEnergyMmbtu,
                lotsA,
                lotsB,
                hedgeLegs
        );
    }

    public DecisionResult decide(NetbackComparison comparison, DecisionParams params) {
        return decide(
                comparison.marketA().netbackUsd(),
                comparison.marketB().netbackUsd(),
                resolveHedgeEnergy(comparison, params),
                params
        );
    }

    public double resolveHedgeEnergy(NetbackComparison comparison, DecisionParams params) {
        if (params == null) {
            throw new InvalidConfigException("decision params are required");
        }
        double energyA = comparison.marketA().deliveredEnergyMmbtu();
        double energyB = comparison.marketB().deliveredEnergyMmbtu();
        double basisEnergy = switch (params.hedgeEnergyBasis()) {
            case STRONGER_NETBACK -> comparison.marketB().netbackUsd() > comparison.marketA().netbackUsd()
                    ? energyB
                    : energyA;
            case MAX_DELIVERED -> Math.max(energyA, energyB);
        };
        return basisEnergy * params.coveragePct();
    }

    // rounds down so the hedge never exceeds the physical volume
    private int lots(double hedgeEnergyMmbtu, double lotSizeMmbtu) {
        double lots = Math.max(0.0, Math.floor(hedgeEnergyMmbtu / lotSizeMmbtu));
        if (lots > Integer.MAX_VALUE) {
            throw new InvalidConfigException("lot count overflows for hedgeEnergyMmbtu=" + hedgeEnergyMmbtu
                    + ", lotSizeMmbtu=" + lotSizeMmbtu);
        }
        return (int) lots;
    }
}
