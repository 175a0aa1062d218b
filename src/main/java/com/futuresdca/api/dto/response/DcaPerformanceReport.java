package com.futuresdca.api.dto.response;

import com.futuresdca.domain.model.PerformanceMetrics;
import com.futuresdca.domain.model.WeekRecord;
import com.futuresdca.domain.model.WorstWeekSummary;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Full outcome of one DCA simulation for the reporting layer: totals, metrics, the weekly
 * ledger and the worst week.
 */
@Value
@Builder
public class DcaPerformanceReport {

    String symbol;
    BigDecimal weeklyAmount;
    LocalDate startDate;
    LocalDate endDate;
    int totalWeeks;
    BigDecimal totalInvested;
    BigDecimal finalEquity;
    int totalContracts;
    BigDecimal totalFees;
    BigDecimal totalReturnPct;
    PerformanceMetrics metrics;
    List<WeekRecord> weeklyRecords;
    WorstWeekSummary worstWeek;
}
