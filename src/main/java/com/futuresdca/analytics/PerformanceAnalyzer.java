package com.futuresdca.analytics;

import com.futuresdca.domain.model.PerformanceMeasurement;
import com.futuresdca.domain.model.PerformanceMetrics;
import com.futuresdca.domain.model.SimulationResult;
import com.futuresdca.domain.model.WeekRecord;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives return and risk metrics from a simulation ledger.
 *
 * <p>Risk metrics use time-weighted weekly returns so that new contributions do not
 * count as performance. Week 1 has no prior equity and is excluded from the return
 * series. Weeks whose time-weighted return was recorded as 0 because the prior equity
 * was not positive stay in the series as zero returns.
 *
 * <p>Calculates:
 * <ul>
 *   <li>Total return on invested capital</li>
 *   <li>CAGR from the compounded weekly returns</li>
 *   <li>Annualized volatility and Sharpe ratio (52 weeks per year, zero risk-free rate)</li>
 *   <li>Max drawdown of the equity path</li>
 *   <li>Profit factor and win rate from weekly dollar P&L rebuilt as return times prior equity</li>
 * </ul>
 *
 * <p>Everything is computed in double precision by {@link #measure}; {@link #analyze} rounds
 * that measurement to two decimals. Reads nothing but the result's records and totals.
 */
@Service
public class PerformanceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PerformanceAnalyzer.class);

    static final double WEEKS_PER_YEAR = 52.0;
    private static final double ANNUALIZATION = Math.sqrt(WEEKS_PER_YEAR);

    /**
     * Calculates performance metrics for one simulation.
     *
     * @param result a finished simulation
     * @return rounded metrics; all zero for an empty ledger
     */
    public PerformanceMetrics analyze(SimulationResult result) {
        return measure(result).toMetrics();
    }

    /** Same metrics as {@link #analyze}, unrounded. */
    public PerformanceMeasurement measure(SimulationResult result) {
        List<WeekRecord> records = result.getWeeklyRecords();
        if (records == null || records.isEmpty()) {
            return PerformanceMeasurement.zero();
        }

        double totalReturnPct = result.getTotalInvested() > 0
                ? (result.getFinalEquity() / result.getTotalInvested() - 1) * 100
                : 0.0;

        double[] returns = records.stream()
                .skip(1)
                .mapToDouble(WeekRecord::getTimeWeightedReturn)
                .toArray();

        double mean = mean(returns);
        double stdDev = populationStdDev(returns, mean);

        double volatility = 0.0;
        double sharpe = 0.0;
        if (returns.length > 1 && stdDev > 0) {
            volatility = stdDev * ANNUALIZATION * 100;
            sharpe = mean / stdDev * ANNUALIZATION;
        }

        double cagr = calculateCagr(returns);
        double maxDrawdownPct = calculateMaxDrawdown(records) * 100;

        // Profit factor and win rate from rebuilt weekly dollar P&L
        double gains = 0.0;
        double losses = 0.0;
        int positiveWeeks = 0;
        int countedWeeks = 0;
        for (int t = 1; t < records.size(); t++) {
            double weekPnl = records.get(t).getTimeWeightedReturn() * records.get(t - 1).getEquity();
            if (weekPnl > 0) {
                gains += weekPnl;
                positiveWeeks++;
            } else {
                losses += -weekPnl;
            }
            countedWeeks++;
        }
        double profitFactor = losses > 0 ? gains / losses : 0.0;
        double winRatePct = countedWeeks > 0 ? (double) positiveWeeks / countedWeeks * 100 : 0.0;

        log.debug(
                "Analyzed {} weeks: return={}%, cagr={}%, vol={}%, sharpe={}, maxDD={}%",
                records.size(),
                totalReturnPct,
                cagr,
                volatility,
                sharpe,
                maxDrawdownPct);

        return PerformanceMeasurement.builder()
                .totalReturnPct(totalReturnPct)
                .cagr(cagr)
                .volatilityAnnualized(volatility)
                .sharpeRatio(sharpe)
                .maxDrawdownPct(maxDrawdownPct)
                .profitFactor(profitFactor)
                .winRatePct(winRatePct)
                .build();
    }

    /**
     * Annualized growth of the compounded weekly returns over {@code returns.length / 52}
     * years. A compound factor at or below zero means the account was wiped out and
     * maps to -100%.
     */
    double calculateCagr(double[] returns) {
        double years = returns.length / WEEKS_PER_YEAR;
        if (years <= 0) {
            return 0.0;
        }
        double compoundFactor = 1.0;
        for (double r : returns) {
            compoundFactor *= 1.0 + r;
        }
        if (compoundFactor <= 0) {
            return -100.0;
        }
        return (Math.pow(compoundFactor, 1.0 / years) - 1.0) * 100;
    }

    /**
     * Largest peak-to-trough decline of weekly equity as a fraction of the peak.
     * The peak starts at the first week's equity; declines from a non-positive peak are ignored.
     */
    double calculateMaxDrawdown(List<WeekRecord> records) {
        double peak = records.get(0).getEquity();
        double maxDrawdown = 0.0;
        for (WeekRecord record : records) {
            double equity = record.getEquity();
            if (equity > peak) {
                peak = equity;
            }
            if (peak > 0) {
                double drawdown = (peak - equity) / peak;
                if (drawdown > maxDrawdown) {
                    maxDrawdown = drawdown;
                }
            }
        }
        return maxDrawdown;
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double populationStdDev(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / values.length);
    }
}
