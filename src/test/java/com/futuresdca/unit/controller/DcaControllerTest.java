package com.futuresdca.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.futuresdca.api.controller.DcaController;
import com.futuresdca.api.dto.request.OptimizationRequest;
import com.futuresdca.api.dto.response.DcaPerformanceReport;
import com.futuresdca.config.ApiResponseAdvice;
import com.futuresdca.domain.enums.SortKey;
import com.futuresdca.domain.model.OptimizationReport;
import com.futuresdca.domain.model.OptimizationSummary;
import com.futuresdca.domain.model.PerformanceMetrics;
import com.futuresdca.domain.model.WeekRecord;
import com.futuresdca.domain.model.WorstWeekSummary;
import com.futuresdca.exception.ErrorCode;
import com.futuresdca.exception.GlobalExceptionHandler;
import com.futuresdca.exception.InsufficientDataException;
import com.futuresdca.exception.InvalidConfigException;
import com.futuresdca.exception.NoValidCandidatesException;
import com.futuresdca.service.DcaSimulationService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the DcaController.
 */
@ExtendWith(MockitoExtension.class)
class DcaControllerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 29);

    private MockMvc mockMvc;

    @Mock
    private DcaSimulationService dcaSimulationService;

    @InjectMocks
    private DcaController dcaController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(dcaController)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("POST /api/dca/calculate returns the wrapped performance report")
    void calculateReturnsReport() throws Exception {
        when(dcaSimulationService.calculate(any(BigDecimal.class), eq(START), eq(END)))
                .thenReturn(sampleReport());

        mockMvc.perform(post("/api/dca/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weeklyAmount\":500,\"startDate\":\"2024-01-01\",\"endDate\":\"2024-03-29\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.symbol").value("MNQ=F"))
                .andExpect(jsonPath("$.data.totalWeeks").value(2))
                .andExpect(jsonPath("$.data.totalInvested").value(1000.00))
                .andExpect(jsonPath("$.data.metrics.sharpeRatio").value(1.25))
                .andExpect(jsonPath("$.data.weeklyRecords.length()").value(2));
    }

    @Test
    @DisplayName("POST /api/dca/calculate rejects an amount below the minimum")
    void calculateRejectsSmallAmount() throws Exception {
        mockMvc.perform(post("/api/dca/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weeklyAmount\":50}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(dcaSimulationService);
    }

    @Test
    @DisplayName("GET /api/dca/equity maps ledger rows to curve points")
    void equityReturnsCurve() throws Exception {
        when(dcaSimulationService.calculate(any(BigDecimal.class), isNull(), isNull())).thenReturn(sampleReport());

        mockMvc.perform(get("/api/dca/equity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].equity").value(1010.0))
                .andExpect(jsonPath("$.data[1].prevEquity").value(496.5))
                .andExpect(jsonPath("$.data[1].invested").value(1000.0));

        verify(dcaSimulationService).calculate(new BigDecimal("1000"), null, null);
    }

    @Test
    @DisplayName("GET /api/dca/metrics returns metrics with totals")
    void metricsReturnsTotals() throws Exception {
        when(dcaSimulationService.calculate(any(BigDecimal.class), eq(START), eq(END))).thenReturn(sampleReport());

        mockMvc.perform(get("/api/dca/metrics")
                        .param("weeklyAmount", "500")
                        .param("startDate", "2024-01-01")
                        .param("endDate", "2024-03-29"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalReturnPct").value(1.0))
                .andExpect(jsonPath("$.data.metrics.maxDrawdownPct").value(2.5))
                .andExpect(jsonPath("$.data.totalWeeks").value(2));

        verify(dcaSimulationService).calculate(new BigDecimal("500"), START, END);
    }

    @Test
    @DisplayName("GET /api/dca/positions returns the weekly ledger")
    void positionsReturnsLedger() throws Exception {
        when(dcaSimulationService.calculate(any(BigDecimal.class), isNull(), isNull())).thenReturn(sampleReport());

        mockMvc.perform(get("/api/dca/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalContracts").value(1))
                .andExpect(jsonPath("$.data.positions[0].contractsAdded").value(0))
                .andExpect(jsonPath("$.data.positions[1].totalContracts").value(1));
    }

    @Test
    @DisplayName("GET /api/dca/worst-week returns the worst week's return")
    void worstWeekReturnsSummary() throws Exception {
        when(dcaSimulationService.calculate(any(BigDecimal.class), isNull(), isNull())).thenReturn(sampleReport());

        mockMvc.perform(get("/api/dca/worst-week"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.returnPct").value(-0.7));
    }

    @Test
    @DisplayName("GET /api/dca/equity with a malformed date returns 400")
    void equityRejectsMalformedDate() throws Exception {
        mockMvc.perform(get("/api/dca/equity").param("startDate", "01/01/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(dcaSimulationService);
    }

    @Test
    @DisplayName("GET /api/dca/metrics maps insufficient data to 422")
    void metricsMapsInsufficientData() throws Exception {
        when(dcaSimulationService.calculate(any(BigDecimal.class), isNull(), isNull()))
                .thenThrow(new InsufficientDataException(1, 2));

        mockMvc.perform(get("/api/dca/metrics"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.error.details.required").value(2));
    }

    @Test
    @DisplayName("POST /api/dca/optimize returns both rankings")
    void optimizeReturnsReport() throws Exception {
        OptimizationReport report = OptimizationReport.builder()
                .testedGrid(List.of(100.0, 200.0))
                .topByObjective(List.of())
                .topByDollarProfit(List.of())
                .summary(OptimizationSummary.builder()
                        .gridSize(2)
                        .candidatesSucceeded(2)
                        .sortKey(SortKey.SHARPE_RATIO)
                        .descending(true)
                        .build())
                .build();
        when(dcaSimulationService.optimize(any(OptimizationRequest.class))).thenReturn(report);

        mockMvc.perform(post("/api/dca/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountMin\":100,\"amountMax\":200,\"stepSize\":100,\"sortKey\":\"sharpeRatio\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.testedGrid.length()").value(2))
                .andExpect(jsonPath("$.data.summary.sortKey").value("sharpeRatio"))
                .andExpect(jsonPath("$.data.summary.gridSize").value(2));
    }

    @Test
    @DisplayName("POST /api/dca/optimize rejects a missing step size")
    void optimizeRejectsMissingStep() throws Exception {
        mockMvc.perform(post("/api/dca/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountMin\":100,\"amountMax\":200}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(dcaSimulationService);
    }

    @Test
    @DisplayName("POST /api/dca/optimize maps an inverted range to INVALID_CONFIG")
    void optimizeMapsInvalidConfig() throws Exception {
        when(dcaSimulationService.optimize(any(OptimizationRequest.class)))
                .thenThrow(new InvalidConfigException("amountMax", "must be >= amountMin"));

        mockMvc.perform(post("/api/dca/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountMin\":500,\"amountMax\":200,\"stepSize\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value(ErrorCode.INVALID_CONFIG.getCode()))
                .andExpect(jsonPath("$.error.details.amountMax").value("must be >= amountMin"));
    }

    @Test
    @DisplayName("POST /api/dca/optimize maps an all-failed sweep to 422")
    void optimizeMapsNoValidCandidates() throws Exception {
        when(dcaSimulationService.optimize(any(OptimizationRequest.class)))
                .thenThrow(new NoValidCandidatesException(3, new IllegalStateException("boom")));

        mockMvc.perform(post("/api/dca/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountMin\":100,\"amountMax\":300,\"stepSize\":100}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("NO_VALID_CANDIDATES"))
                .andExpect(jsonPath("$.error.details.attempted").value(3));
    }

    private static DcaPerformanceReport sampleReport() {
        WeekRecord week1 = WeekRecord.builder()
                .weekIndex(1)
                .date(LocalDate.of(2024, 1, 5))
                .price(17000)
                .contributionAmount(500)
                .totalInvested(500)
                .equity(496.5)
                .cashBalance(496.5)
                .returnPct(-0.7)
                .build();
        WeekRecord week2 = WeekRecord.builder()
                .weekIndex(2)
                .date(LocalDate.of(2024, 1, 12))
                .price(17050)
                .contributionAmount(500)
                .contractsAdded(1)
                .totalContracts(1)
                .totalInvested(1000)
                .equity(1010)
                .equityBeforeContribution(496.5)
                .cashBalance(1010)
                .returnPct(1.0)
                .build();
        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .totalReturnPct(new BigDecimal("1.00"))
                .cagr(new BigDecimal("30.10"))
                .volatilityAnnualized(new BigDecimal("12.40"))
                .sharpeRatio(new BigDecimal("1.25"))
                .maxDrawdownPct(new BigDecimal("2.50"))
                .profitFactor(new BigDecimal("0.00"))
                .winRatePct(new BigDecimal("100.00"))
                .build();
        return DcaPerformanceReport.builder()
                .symbol("MNQ=F")
                .weeklyAmount(new BigDecimal("500"))
                .startDate(START)
                .endDate(END)
                .totalWeeks(2)
                .totalInvested(new BigDecimal("1000.00"))
                .finalEquity(new BigDecimal("1010.00"))
                .totalContracts(1)
                .totalFees(new BigDecimal("3.50"))
                .totalReturnPct(new BigDecimal("1.00"))
                .metrics(metrics)
                .weeklyRecords(List.of(week1, week2))
                .worstWeek(WorstWeekSummary.builder()
                        .date(LocalDate.of(2024, 1, 5))
                        .returnPct(new BigDecimal("-0.70"))
                        .build())
                .build();
    }
}
