package org.nowstart.diversion.data.dto;

import java.util.List;

public record BacktestResult(
        BacktestMetrics metrics,
        List<EquityPoint> equityCurve,
        List<DecisionObservation> decisionHistory
) {}
