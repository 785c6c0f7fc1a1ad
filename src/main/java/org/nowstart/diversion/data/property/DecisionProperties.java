package org.nowstart.diversion.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import org.nowstart.diversion.data.dto.DecisionParams;
import org.nowstart.diversion.data.dto.StressShocks;
import org.nowstart.diversion.data.type.HedgeEnergyBasis;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "diversion.decision")
public record DecisionProperties(
        // discount on raw uplift for paper/physical basis risk (0.05 = 5%)
        @NotNull @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.05") BigDecimal basisHaircutPct,
        // flat deduction for demurrage and operational friction
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("150000") BigDecimal opsBufferUsd,
        // minimum adjusted uplift before recommending DIVERT
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("250000") BigDecimal decisionBufferUsd,
        // share of delivered energy to hedge
        @NotNull @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.80") BigDecimal coveragePct,
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("10000") BigDecimal lotSizeAMmbtu,
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("10000") BigDecimal lotSizeBMmbtu,
        @NotBlank @DefaultValue("TTF") String instrumentA,
        @NotBlank @DefaultValue("JKM") String instrumentB,
        @NotNull @DefaultValue("STRONGER_NETBACK") HedgeEnergyBasis hedgeEnergyBasis,
        // stress magnitudes; scenario signs are fixed
        @NotNull @DecimalMin("0") @DefaultValue("1.0") BigDecimal stressSpreadUsd,
        @NotNull @DecimalMin("0") @DefaultValue("20000") BigDecimal stressFreightUsdPerDay,
        @NotNull @DecimalMin("0") @DefaultValue("10.0") BigDecimal stressEuaUsd,
        // worker count for historical replay; 1 runs on the caller thread
        @Positive @DefaultValue("1") int replayParallelism
) {

    public DecisionParams toDecisionParams() {
        return new DecisionParams(
                basisHaircutPct.doubleValue(),
                opsBufferUsd.doubleValue(),
                decisionBufferUsd.doubleValue(),
                coveragePct.doubleValue(),
                lotSizeAMmbtu.doubleValue(),
                lotSizeBMmbtu.doubleValue(),
                instrumentA,
                instrumentB,
                hedgeEnergyBasis
        );
    }

    public StressShocks toStressShocks() {
        return new StressShocks(
                stressSpreadUsd.doubleValue(),
                stressFreightUsdPerDay.doubleValue(),
                stressEuaUsd.doubleValue()
        );
    }
}
