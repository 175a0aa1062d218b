package com.futuresdca.service;

import com.futuresdca.analytics.PerformanceAnalyzer;
import com.futuresdca.api.dto.request.OptimizationRequest;
import com.futuresdca.api.dto.response.DcaPerformanceReport;
import com.futuresdca.api.dto.response.InstrumentInfoResponse;
import com.futuresdca.config.SimulationProperties;
import com.futuresdca.diagnostics.DiagnosticSelector;
import com.futuresdca.domain.model.DailyBar;
import com.futuresdca.domain.model.DateRange;
import com.futuresdca.domain.model.OptimizationReport;
import com.futuresdca.domain.model.PerformanceMetrics;
import com.futuresdca.domain.model.PricePoint;
import com.futuresdca.domain.model.SimulationConfig;
import com.futuresdca.domain.model.SimulationResult;
import com.futuresdca.exception.BusinessException;
import com.futuresdca.exception.ResourceNotFoundException;
import com.futuresdca.marketdata.PriceSeriesProvider;
import com.futuresdca.marketdata.WeeklyResampler;
import com.futuresdca.optimizer.ParameterSweepOptimizer;
import com.futuresdca.optimizer.SweepParameters;
import com.futuresdca.simulation.SimulationEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the REST layer: loads prices for the configured symbol and runs a single
 * simulation or a parameter sweep over them.
 *
 * <p>When dates are omitted the window is the 365 days ending today. A single simulation
 * resamples its prices here; a sweep hands daily prices to the optimizer, which resamples
 * once for all candidates.
 */
@Service
public class DcaSimulationService {

    private static final Logger log = LoggerFactory.getLogger(DcaSimulationService.class);

    static final int DEFAULT_LOOKBACK_DAYS = 365;

    private final PriceSeriesProvider priceSeriesProvider;
    private final WeeklyResampler weeklyResampler;
    private final SimulationEngine simulationEngine;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final DiagnosticSelector diagnosticSelector;
    private final ParameterSweepOptimizer parameterSweepOptimizer;
    private final SimulationProperties simulationProperties;

    public DcaSimulationService(
            PriceSeriesProvider priceSeriesProvider,
            WeeklyResampler weeklyResampler,
            SimulationEngine simulationEngine,
            PerformanceAnalyzer performanceAnalyzer,
            DiagnosticSelector diagnosticSelector,
            ParameterSweepOptimizer parameterSweepOptimizer,
            SimulationProperties simulationProperties) {
        this.priceSeriesProvider = priceSeriesProvider;
        this.weeklyResampler = weeklyResampler;
        this.simulationEngine = simulationEngine;
        this.performanceAnalyzer = performanceAnalyzer;
        this.diagnosticSelector = diagnosticSelector;
        this.parameterSweepOptimizer = parameterSweepOptimizer;
        this.simulationProperties = simulationProperties;
    }

    /**
     * Simulates weekly DCA at a fixed amount over the requested window.
     *
     * @throws ResourceNotFoundException if the provider has no prices in the window
     * @throws BusinessException if the start date is not before the end date
     */
    public DcaPerformanceReport calculate(BigDecimal weeklyAmount, LocalDate startDate, LocalDate endDate) {
        DateRange window = resolveWindow(startDate, endDate);
        String symbol = simulationProperties.getSymbol();
        log.info("Starting DCA calculation for {}: {}/week, {} to {}", symbol, weeklyAmount, window.startDate(), window.endDate());

        List<PricePoint> weeklyPrices = weeklyResampler.resampleDaily(loadBars(window));
        SimulationConfig config = simulationProperties.toSimulationConfig();

        SimulationResult result = simulationEngine.simulate(weeklyPrices, weeklyAmount.doubleValue(), config);
        PerformanceMetrics metrics = performanceAnalyzer.analyze(result);

        log.info(
                "DCA calculation completed for {}: {} weeks, invested={}, equity={}, return={}%",
                symbol,
                result.getTotalWeeks(),
                money(result.getTotalInvested()),
                money(result.getFinalEquity()),
                metrics.getTotalReturnPct());

        return DcaPerformanceReport.builder()
                .symbol(symbol)
                .weeklyAmount(weeklyAmount)
                .startDate(window.startDate())
                .endDate(window.endDate())
                .totalWeeks(result.getTotalWeeks())
                .totalInvested(money(result.getTotalInvested()))
                .finalEquity(money(result.getFinalEquity()))
                .totalContracts(result.getTotalContracts())
                .totalFees(money(result.getTotalFees()))
                .totalReturnPct(metrics.getTotalReturnPct())
                .metrics(metrics)
                .weeklyRecords(result.getWeeklyRecords())
                .worstWeek(diagnosticSelector.describeWorstWeek(result))
                .build();
    }

    /**
     * Sweeps weekly amounts over the requested window with the configured contract.
     */
    public OptimizationReport optimize(OptimizationRequest request) {
        DateRange window = resolveWindow(request.getStartDate(), request.getEndDate());
        List<PricePoint> dailyPrices = WeeklyResampler.toPricePoints(loadBars(window));

        SweepParameters parameters = SweepParameters.builder()
                .amountMin(request.getAmountMin().doubleValue())
                .amountMax(request.getAmountMax().doubleValue())
                .stepSize(request.getStepSize().doubleValue())
                .topN(request.getTopN())
                .sortKey(request.getSortKey())
                .descending(request.isDescending())
                .build();

        return parameterSweepOptimizer.optimize(dailyPrices, parameters, simulationProperties.toSimulationConfig());
    }

    public InstrumentInfoResponse getInstrumentInfo() {
        SimulationConfig config = simulationProperties.toSimulationConfig();
        return InstrumentInfoResponse.builder()
                .symbol(simulationProperties.getSymbol())
                .name(simulationProperties.getInstrumentName())
                .contractMultiplier(config.getContractMultiplier())
                .pointValueUsd(config.getContractMultiplier())
                .initialMarginPerContract(config.getInitialMarginPerContract())
                .maintenanceMarginPerContract(config.getMaintenanceMarginPerContract())
                .feePerContract(config.feePerContract())
                .maxContracts(config.getMaxContracts())
                .marginModel(String.format(
                        "Approx. $%,.0f initial / $%,.0f maintenance per contract (varies)",
                        config.getInitialMarginPerContract(),
                        config.getMaintenanceMarginPerContract()))
                .tradingHours(simulationProperties.getTradingHours())
                .build();
    }

    /**
     * @throws ResourceNotFoundException if the provider has no data for the symbol
     */
    public DateRange getAvailableDateRange() {
        String symbol = simulationProperties.getSymbol();
        return priceSeriesProvider
                .getAvailableRange(symbol)
                .orElseThrow(() -> new ResourceNotFoundException("Price series", symbol));
    }

    DateRange resolveWindow(LocalDate startDate, LocalDate endDate) {
        LocalDate end = endDate != null ? endDate : LocalDate.now();
        LocalDate start = startDate != null ? startDate : end.minusDays(DEFAULT_LOOKBACK_DAYS);
        if (!start.isBefore(end)) {
            throw new BusinessException(
                    "startDate must be before endDate",
                    Map.of("startDate", start.toString(), "endDate", end.toString()));
        }
        return new DateRange(start, end);
    }

    private List<DailyBar> loadBars(DateRange window) {
        String symbol = simulationProperties.getSymbol();
        List<DailyBar> bars = priceSeriesProvider.getDailyBars(symbol, window.startDate(), window.endDate());
        if (bars.isEmpty()) {
            throw new ResourceNotFoundException(
                    "Price data", String.format("%s %s..%s", symbol, window.startDate(), window.endDate()));
        }
        log.debug("Loaded {} daily bars for {}", bars.size(), symbol);
        return bars;
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
