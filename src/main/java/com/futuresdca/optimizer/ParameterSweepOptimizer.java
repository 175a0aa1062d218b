package com.futuresdca.optimizer;

import com.futuresdca.analytics.PerformanceAnalyzer;
import com.futuresdca.config.SweepProperties;
import com.futuresdca.domain.enums.SortKey;
import com.futuresdca.domain.model.OptimizationReport;
import com.futuresdca.domain.model.OptimizationSummary;
import com.futuresdca.domain.model.PerformanceMeasurement;
import com.futuresdca.domain.model.PricePoint;
import com.futuresdca.domain.model.SimulationConfig;
import com.futuresdca.domain.model.SimulationResult;
import com.futuresdca.domain.model.SweepCandidate;
import com.futuresdca.exception.InvalidConfigException;
import com.futuresdca.exception.NoValidCandidatesException;
import com.futuresdca.marketdata.WeeklyResampler;
import com.futuresdca.observability.SweepMetrics;
import com.futuresdca.simulation.SimulationEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Finds the best weekly contribution amount by simulating every amount of a grid.
 *
 * <p>Flow:
 * <ol>
 *   <li>Validate sweep parameters and the simulation config once; invalid input aborts
 *       the sweep before any simulation runs.</li>
 *   <li>Build the amount grid, widening the step if the grid would exceed
 *       {@link SweepProperties#getMaxGridPoints()}.</li>
 *   <li>Resample the prices to weekly once. Every candidate reads the same unmodifiable
 *       series.</li>
 *   <li>Evaluate candidates on the {@code sweepExecutor} pool. Each task writes only its own
 *       slot. A candidate that throws is logged and left out; a candidate not started
 *       before the sweep deadline is skipped.</li>
 *   <li>Rank on the calling thread after all tasks finish: by the requested objective
 *       (top N) and by dollar profit with its tie-break chain (top 5).</li>
 * </ol>
 */
@Service
public class ParameterSweepOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ParameterSweepOptimizer.class);

    private final SimulationEngine simulationEngine;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final WeeklyResampler weeklyResampler;
    private final Executor sweepExecutor;
    private final SweepProperties sweepProperties;
    private final SweepMetrics sweepMetrics;

    public ParameterSweepOptimizer(
            SimulationEngine simulationEngine,
            PerformanceAnalyzer performanceAnalyzer,
            WeeklyResampler weeklyResampler,
            @Qualifier("sweepExecutor") Executor sweepExecutor,
            SweepProperties sweepProperties,
            SweepMetrics sweepMetrics) {
        this.simulationEngine = simulationEngine;
        this.performanceAnalyzer = performanceAnalyzer;
        this.weeklyResampler = weeklyResampler;
        this.sweepExecutor = sweepExecutor;
        this.sweepProperties = sweepProperties;
        this.sweepMetrics = sweepMetrics;
    }

    public OptimizationReport optimize(
            List<PricePoint> prices,
            double amountMin,
            double amountMax,
            double stepSize,
            int topN,
            SortKey sortKey,
            boolean descending,
            SimulationConfig config) {
        return optimize(
                prices,
                SweepParameters.builder()
                        .amountMin(amountMin)
                        .amountMax(amountMax)
                        .stepSize(stepSize)
                        .topN(topN)
                        .sortKey(sortKey)
                        .descending(descending)
                        .build(),
                config);
    }

    /**
     * Runs the sweep.
     *
     * @param prices closes of any resolution; resampled to Friday weeks here
     * @param parameters grid bounds and ranking options
     * @param config simulation config shared by every candidate
     * @return both rankings plus the tested grid and a summary
     * @throws InvalidConfigException if the parameters or config are invalid
     * @throws NoValidCandidatesException if no candidate produced a result
     */
    public OptimizationReport optimize(List<PricePoint> prices, SweepParameters parameters, SimulationConfig config) {
        long startNanos = System.nanoTime();

        parameters.validate();
        config.validate();

        AmountGrid grid = AmountGrid.build(
                parameters.getAmountMin(),
                parameters.getAmountMax(),
                parameters.getStepSize(),
                sweepProperties.getMaxGridPoints());
        if (grid.isCapped()) {
            log.info(
                    "Amount grid capped at {} points: step widened from {} to {}",
                    grid.size(),
                    grid.getStepRequested(),
                    grid.getStepUsed());
        }

        List<PricePoint> weeklyPrices = weeklyResampler.toWeekly(prices);

        log.info(
                "Starting sweep: {} candidates in [{}, {}], {} weeks, sortKey={}, descending={}",
                grid.size(),
                parameters.getAmountMin(),
                parameters.getAmountMax(),
                weeklyPrices.size(),
                parameters.getSortKey().getWireName(),
                parameters.isDescending());

        List<Double> amounts = grid.getAmounts();
        int gridSize = amounts.size();
        CandidateSlot[] slots = new CandidateSlot[gridSize];
        long deadlineNanos = startNanos + sweepProperties.getTimeout().toNanos();

        List<CompletableFuture<Void>> futures = new ArrayList<>(gridSize);
        for (int i = 0; i < gridSize; i++) {
            int index = i;
            double amount = amounts.get(i);
            futures.add(CompletableFuture.runAsync(
                    () -> slots[index] = evaluateSlot(weeklyPrices, amount, config, deadlineNanos), sweepExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SweepCandidate> successes = new ArrayList<>();
        int failed = 0;
        int skipped = 0;
        RuntimeException lastFailure = null;
        for (CandidateSlot slot : slots) {
            if (slot.candidate() != null) {
                successes.add(slot.candidate());
            } else if (slot.failure() != null) {
                failed++;
                lastFailure = slot.failure();
            } else {
                skipped++;
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        sweepMetrics.recordSweep(elapsed, successes.size(), failed, skipped);

        if (skipped > 0) {
            log.warn("Sweep deadline {} reached: {} of {} candidates skipped", sweepProperties.getTimeout(), skipped, gridSize);
        }
        if (successes.isEmpty()) {
            throw new NoValidCandidatesException(gridSize, lastFailure);
        }

        List<SweepCandidate> topByObjective = SweepRankings.byObjective(
                successes, parameters.getSortKey(), parameters.isDescending(), parameters.getTopN());
        List<SweepCandidate> topByDollarProfit = SweepRankings.byDollarProfit(successes);

        OptimizationSummary summary = OptimizationSummary.builder()
                .gridSize(gridSize)
                .stepSizeRequested(grid.getStepRequested())
                .stepSizeUsed(grid.getStepUsed())
                .gridCapped(grid.isCapped())
                .candidatesSucceeded(successes.size())
                .candidatesFailed(failed)
                .candidatesSkipped(skipped)
                .deadlineReached(skipped > 0)
                .weeks(weeklyPrices.size())
                .startDate(weeklyPrices.isEmpty() ? null : weeklyPrices.get(0).date())
                .endDate(weeklyPrices.isEmpty() ? null : weeklyPrices.get(weeklyPrices.size() - 1).date())
                .sortKey(parameters.getSortKey())
                .descending(parameters.isDescending())
                .elapsedMillis(elapsed.toMillis())
                .build();

        log.info(
                "Sweep finished in {} ms: {} succeeded, {} failed, {} skipped; best by {} = {}, best by profit = {}",
                elapsed.toMillis(),
                successes.size(),
                failed,
                skipped,
                parameters.getSortKey().getWireName(),
                topByObjective.get(0).getWeeklyAmount(),
                topByDollarProfit.get(0).getWeeklyAmount());

        return OptimizationReport.builder()
                .testedGrid(amounts)
                .topByObjective(topByObjective)
                .topByDollarProfit(topByDollarProfit)
                .summary(summary)
                .build();
    }

    private CandidateSlot evaluateSlot(
            List<PricePoint> weeklyPrices, double amount, SimulationConfig config, long deadlineNanos) {
        if (System.nanoTime() > deadlineNanos) {
            return CandidateSlot.skipped();
        }
        try {
            return CandidateSlot.success(evaluate(weeklyPrices, amount, config));
        } catch (RuntimeException e) {
            log.warn("Sweep candidate {} failed: {}", amount, e.getMessage());
            return CandidateSlot.failure(e);
        }
    }

    SweepCandidate evaluate(List<PricePoint> weeklyPrices, double amount, SimulationConfig config) {
        SimulationResult result = simulationEngine.simulate(weeklyPrices, amount, config);
        PerformanceMeasurement measurement = performanceAnalyzer.measure(result);

        double profit = result.getFinalEquity() - result.getTotalInvested();
        double returnPerInvestedDollar = result.getTotalInvested() > 0 ? profit / result.getTotalInvested() : 0.0;

        log.debug("Candidate {}: profit={}, return={}%", amount, profit, measurement.getTotalReturnPct());

        return SweepCandidate.builder()
                .weeklyAmount(amount)
                .result(result)
                .metrics(measurement.toMetrics())
                .dollarProfit(BigDecimal.valueOf(profit).setScale(2, RoundingMode.HALF_UP))
                .returnPerInvestedDollar(BigDecimal.valueOf(returnPerInvestedDollar).setScale(4, RoundingMode.HALF_UP))
                .rankingKey(SweepCandidate.RankingKey.builder()
                        .totalReturnPct(measurement.getTotalReturnPct())
                        .sharpeRatio(measurement.getSharpeRatio())
                        .volatilityAnnualized(measurement.getVolatilityAnnualized())
                        .profitFactor(measurement.getProfitFactor())
                        .dollarProfit(profit)
                        .returnPerInvestedDollar(returnPerInvestedDollar)
                        .build())
                .build();
    }

    /** Outcome of one grid point: exactly one of candidate or failure is set, or neither if skipped. */
    private record CandidateSlot(SweepCandidate candidate, RuntimeException failure) {

        static CandidateSlot success(SweepCandidate candidate) {
            return new CandidateSlot(candidate, null);
        }

        static CandidateSlot failure(RuntimeException failure) {
            return new CandidateSlot(null, failure);
        }

        static CandidateSlot skipped() {
            return new CandidateSlot(null, null);
        }
    }
}
