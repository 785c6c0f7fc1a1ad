package org.nowstart.diversion.data.dto;

public record BacktestMetrics(
        int totalObservations,
        int triggeredTrades,
        double hitRate,
        double averageUpliftUsd,
        double totalUpliftUsd,
        double maxDrawdownUsd,
        // null means insufficient data, not zero
        Double sharpeRatio
) {
}
