package com.futuresdca.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Return and risk metrics derived from a {@link SimulationResult}, rounded to two
 * decimals. Percent fields are already multiplied by 100.
 */
@Value
@Builder
public class PerformanceMetrics {

    BigDecimal totalReturnPct;
    BigDecimal cagr;
    BigDecimal volatilityAnnualized;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdownPct;
    BigDecimal profitFactor;
    BigDecimal winRatePct;
}
