package org.nowstart.diversion.data.dto;

import org.nowstart.diversion.data.exception.InvalidConfigException;
import org.nowstart.diversion.data.type.HedgeEnergyBasis;

public record DecisionParams(
        double basisHaircutPct,
        double opsBufferUsd,
        double decisionBufferUsd,
        double coveragePct,
        double lotSizeA,
        double lotSizeB,
        String instrumentA,
        String instrumentB,
        HedgeEnergyBasis hedgeEnergyBasis
) {

    public static final double DEFAULT_LOT_SIZE_MMBTU = 10_000.0;
    public static final double DEFAULT_COVERAGE_PCT = 0.80;
    public static final String DEFAULT_INSTRUMENT_A = "TTF";
    public static final String DEFAULT_INSTRUMENT_B = "JKM";

    public DecisionParams {
        validateRatio("basisHaircutPct", basisHaircutPct);
        validateRatio("coveragePct", coveragePct);
        validatePositive("opsBufferUsd", opsBufferUsd);
        validatePositive("decisionBufferUsd", decisionBufferUsd);
        validatePositive("lotSizeA", lotSizeA);
        validatePositive("lotSizeB", lotSizeB);
        instrumentA = instrumentA == null || instrumentA.isBlank() ? DEFAULT_INSTRUMENT_A : instrumentA.trim();
        instrumentB = instrumentB == null || instrumentB.isBlank() ? DEFAULT_INSTRUMENT_B : instrumentB.trim();
        hedgeEnergyBasis = hedgeEnergyBasis == null ? HedgeEnergyBasis.STRONGER_NETBACK : hedgeEnergyBasis;
    }

    public static DecisionParams of(double basisHaircutPct, double opsBufferUsd, double decisionBufferUsd) {
        return new DecisionParams(
                basisHaircutPct,
                opsBufferUsd,
                decisionBufferUsd,
                DEFAULT_COVERAGE_PCT,
                DEFAULT_LOT_SIZE_MMBTU,
                DEFAULT_LOT_SIZE_MMBTU,
                DEFAULT_INSTRUMENT_A,
                DEFAULT_INSTRUMENT_B,
                HedgeEnergyBasis.STRONGER_NETBACK
        );
    }

    public DecisionParams withLotSizes(double lotSizeA, double lotSizeB) {
        return new DecisionParams(
                basisHaircutPct,
                opsBufferUsd,
                decisionBufferUsd,
                coveragePct,
                lotSizeA,
                lotSizeB,
                instrumentA,
                instrumentB,
                hedgeEnergyBasis
        );
    }

    public DecisionParams withHedgeEnergyBasis(HedgeEnergyBasis basis) {
        return new DecisionParams(
                basisHaircutPct,
                opsBufferUsd,
                decisionBufferUsd,
                coveragePct,
                lotSizeA,
                lotSizeB,
                instrumentA,
                instrumentB,
                basis
        );
    }

    private static void validateRatio(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidConfigException(field + " must be finite");
        }
        if (value < 0.0 || value > 1.0) {
            throw new InvalidConfigException(field + " must be in [0.0, 1.0], got " + value);
        }
    }

    private static void validatePositive(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidConfigException(field + " must be finite");
        }
        if (value <= 0.0) {
            throw new InvalidConfigException(field + " must be > 0, got " + value);
        }
    }
}
