package org.nowstart.diversion.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.BacktestMetrics;
import org.nowstart.diversion.data.dto.BacktestResult;
import org.nowstart.diversion.data.dto.DecisionObservation;
import org.nowstart.diversion.data.dto.EquityPoint;
import org.nowstart.diversion.data.exception.EmptyInputException;
import org.springframework.stereotype.Service;

/**
 * Validates the decision rule over a history of daily decisions.
 *
 * <p>Only DIVERT rows book P&L (their adjusted delta); KEEP rows contribute zero. Uplift figures are
 * therefore conditional on triggering, not an unconditional expectancy.
 */
@Slf4j
@Service
public class BacktestService {

    public static final int MIN_OBSERVATIONS_FOR_SHARPE = 5;
    public static final double TRADING_DAYS_PER_YEAR = 252.0;
    static final double ZERO_VARIANCE_TOLERANCE = 1e-12;

    public BacktestResult runBacktest(List<DecisionObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new EmptyInputException("No observations to backtest");
        }

        List<DecisionObservation> history = new ArrayList<>(observations);
        history.sort(Comparator.comparing(DecisionObservation::date));

        int n = history.size();
        double[] pnl = new double[n];
        int triggered = 0;
        double totalUplift = 0.0;
        for (int i = 0; i < n; i++) {
            DecisionObservation observation = history.get(i);
            if (observation.triggered()) {
                triggered++;
                totalUplift += observation.deltaNetbackAdjUsd();
                pnl[i] = observation.deltaNetbackAdjUsd();
            }
        }

        List<EquityPoint> equityCurve = new ArrayList<>(n);
        double cumulative = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (int i = 0; i < n; i++) {
            cumulative += pnl[i];
            peak = i == 0 ? cumulative : Math.max(peak, cumulative);
            double drawdown = peak - cumulative;
            maxDrawdown = Math.max(maxDrawdown, drawdown);
            equityCurve.add(new EquityPoint(history.get(i).date(), pnl[i], cumulative, drawdown));
        }

        BacktestMetrics metrics = new BacktestMetrics(
                n,
                triggered,
                triggered / (double) n,
                triggered > 0 ? totalUplift / triggered : 0.0,
                totalUplift,
                maxDrawdown,
                sharpeRatio(pnl)
        );

        log.info("Backtest completed. observations={}, triggered={}, hitRate={}, totalUplift={}, maxDrawdown={}, sharpe={}",
                metrics.totalObservations(),
                metrics.triggeredTrades(),
                metrics.hitRate(),
                metrics.totalUpliftUsd(),
                metrics.maxDrawdownUsd(),
                metrics.sharpeRatio());
        return new BacktestResult(metrics, List.copyOf(equityCurve), List.copyOf(history));
    }

    // annualized mean/std of daily pnl across all rows; sample std (n - 1)
    Double sharpeRatio(double[] pnl) {
        int n = pnl.length;
        if (n < MIN_OBSERVATIONS_FOR_SHARPE) {
            return null;
        }

        double sum = 0.0;
        for (double value : pnl) {
            sum += value;
        }
        double mean = sum / n;

        double squared = 0.0;
        for (double value : pnl) {
            double diff = value - mean;
            squared += diff * diff;
        }
        double std = Math.sqrt(squared / (n - 1));
        // constant pnl leaves rounding residue in std rather than an exact zero
        if (isConstant(pnl) || !Double.isFinite(std) || std <= ZERO_VARIANCE_TOLERANCE * Math.max(1.0, Math.abs(mean))) {
            return null;
        }
        return mean / std * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    private static boolean isConstant(double[] pnl) {
        for (double value : pnl) {
            if (value != pnl[0]) {
                return false;
            }
        }
        return true;
    }
}
