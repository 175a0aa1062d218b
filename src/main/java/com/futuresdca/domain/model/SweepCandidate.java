package com.futuresdca.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One evaluated point of the weekly-amount grid. */
@Value
@Builder
public class SweepCandidate {

    double weeklyAmount;

    @JsonIgnoreProperties({"weeklyRecords"})
    SimulationResult result;

    PerformanceMetrics metrics;

    /** finalEquity - totalInvested, rounded to cents. */
    BigDecimal dollarProfit;

    /** dollarProfit / totalInvested, four decimals. */
    BigDecimal returnPerInvestedDollar;

    /** Unrounded values the rankings sort on. */
    @JsonIgnore
    RankingKey rankingKey;

    @Value
    @Builder
    public static class RankingKey {
        double totalReturnPct;
        double sharpeRatio;
        double volatilityAnnualized;
        double profitFactor;
        double dollarProfit;
        double returnPerInvestedDollar;
    }
}
