package com.futuresdca.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Full-precision counterpart of {@link PerformanceMetrics}. Comparisons between runs use
 * these values; {@link #toMetrics()} is the only place they are rounded.
 */
@Value
@Builder
public class PerformanceMeasurement {

    double totalReturnPct;
    double cagr;
    double volatilityAnnualized;
    double sharpeRatio;
    double maxDrawdownPct;
    double profitFactor;
    double winRatePct;

    public static PerformanceMeasurement zero() {
        return PerformanceMeasurement.builder().build();
    }

    public PerformanceMetrics toMetrics() {
        return PerformanceMetrics.builder()
                .totalReturnPct(round(totalReturnPct))
                .cagr(round(cagr))
                .volatilityAnnualized(round(volatilityAnnualized))
                .sharpeRatio(round(sharpeRatio))
                .maxDrawdownPct(round(maxDrawdownPct))
                .profitFactor(round(profitFactor))
                .winRatePct(round(winRatePct))
                .build();
    }

    private static BigDecimal round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
