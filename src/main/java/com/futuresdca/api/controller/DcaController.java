package com.futuresdca.api.controller;

import com.futuresdca.api.dto.request.DcaSimulationRequest;
import com.futuresdca.api.dto.request.OptimizationRequest;
import com.futuresdca.api.dto.response.DcaPerformanceReport;
import com.futuresdca.api.dto.response.EquityCurvePoint;
import com.futuresdca.api.dto.response.InstrumentInfoResponse;
import com.futuresdca.api.dto.response.MetricsResponse;
import com.futuresdca.api.dto.response.PositionsResponse;
import com.futuresdca.domain.model.DateRange;
import com.futuresdca.domain.model.OptimizationReport;
import com.futuresdca.domain.model.WorstWeekSummary;
import com.futuresdca.service.DcaSimulationService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for weekly futures DCA simulation and weekly-amount optimization.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/dca/calculate} -- full simulation report</li>
 *   <li>{@code GET /api/dca/equity} -- weekly equity curve</li>
 *   <li>{@code GET /api/dca/metrics} -- performance metrics with totals</li>
 *   <li>{@code GET /api/dca/positions} -- weekly position ledger</li>
 *   <li>{@code GET /api/dca/worst-week} -- date and return of the worst week</li>
 *   <li>{@code POST /api/dca/optimize} -- weekly-amount sweep</li>
 *   <li>{@code GET /api/dca/instrument} -- contract description</li>
 *   <li>{@code GET /api/dca/date-range} -- first and last date with price data</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/dca")
public class DcaController {

    private static final String DEFAULT_WEEKLY_AMOUNT = "1000";

    private final DcaSimulationService dcaSimulationService;

    public DcaController(DcaSimulationService dcaSimulationService) {
        this.dcaSimulationService = dcaSimulationService;
    }

    @PostMapping("/calculate")
    public DcaPerformanceReport calculate(@Valid @RequestBody DcaSimulationRequest request) {
        return dcaSimulationService.calculate(request.getWeeklyAmount(), request.getStartDate(), request.getEndDate());
    }

    @GetMapping("/equity")
    public List<EquityCurvePoint> getEquityCurve(
            @RequestParam(defaultValue = DEFAULT_WEEKLY_AMOUNT) BigDecimal weeklyAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return dcaSimulationService.calculate(weeklyAmount, startDate, endDate).getWeeklyRecords().stream()
                .map(EquityCurvePoint::from)
                .toList();
    }

    @GetMapping("/metrics")
    public MetricsResponse getMetrics(
            @RequestParam(defaultValue = DEFAULT_WEEKLY_AMOUNT) BigDecimal weeklyAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DcaPerformanceReport report = dcaSimulationService.calculate(weeklyAmount, startDate, endDate);
        return MetricsResponse.builder()
                .metrics(report.getMetrics())
                .totalInvested(report.getTotalInvested())
                .finalEquity(report.getFinalEquity())
                .totalReturnPct(report.getTotalReturnPct())
                .totalWeeks(report.getTotalWeeks())
                .build();
    }

    @GetMapping("/positions")
    public PositionsResponse getPositions(
            @RequestParam(defaultValue = DEFAULT_WEEKLY_AMOUNT) BigDecimal weeklyAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DcaPerformanceReport report = dcaSimulationService.calculate(weeklyAmount, startDate, endDate);
        return PositionsResponse.builder()
                .positions(report.getWeeklyRecords())
                .totalContracts(report.getTotalContracts())
                .totalInvested(report.getTotalInvested())
                .finalEquity(report.getFinalEquity())
                .build();
    }

    @GetMapping("/worst-week")
    public WorstWeekSummary getWorstWeek(
            @RequestParam(defaultValue = DEFAULT_WEEKLY_AMOUNT) BigDecimal weeklyAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return dcaSimulationService.calculate(weeklyAmount, startDate, endDate).getWorstWeek();
    }

    @PostMapping("/optimize")
    public OptimizationReport optimize(@Valid @RequestBody OptimizationRequest request) {
        return dcaSimulationService.optimize(request);
    }

    @GetMapping("/instrument")
    public InstrumentInfoResponse getInstrumentInfo() {
        return dcaSimulationService.getInstrumentInfo();
    }

    @GetMapping("/date-range")
    public DateRange getAvailableDateRange() {
        return dcaSimulationService.getAvailableDateRange();
    }
}
