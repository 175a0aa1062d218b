package com.futuresdca.optimizer;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Weekly amounts to evaluate, from {@code min} to {@code max} inclusive.
 *
 * <p>Points are {@code min + i * step}; {@code max} is appended when the step does not
 * land on it. When that would produce more than {@code maxPoints} amounts the grid is
 * rebuilt as exactly {@code maxPoints} evenly spaced amounts, rounded to cents, with
 * both ends kept. Arithmetic is decimal so that steps like 0.1 do not drift.
 */
@Getter
public final class AmountGrid {

    private final List<Double> amounts;
    private final double stepRequested;
    private final double stepUsed;
    private final boolean capped;

    private AmountGrid(List<Double> amounts, double stepRequested, double stepUsed, boolean capped) {
        this.amounts = List.copyOf(amounts);
        this.stepRequested = stepRequested;
        this.stepUsed = stepUsed;
        this.capped = capped;
    }

    public static AmountGrid build(double min, double max, double step, int maxPoints) {
        if (maxPoints < 2) {
            throw new IllegalArgumentException("maxPoints must be >= 2, got " + maxPoints);
        }
        BigDecimal low = BigDecimal.valueOf(min);
        BigDecimal high = BigDecimal.valueOf(max);
        BigDecimal stepSize = BigDecimal.valueOf(step);
        BigDecimal span = high.subtract(low);

        BigDecimal stepsInSpan = span.divide(stepSize, 0, RoundingMode.FLOOR);
        List<Double> amounts = new ArrayList<>();
        // maxPoints or more whole steps always exceed the cap
        if (stepsInSpan.compareTo(BigDecimal.valueOf(maxPoints)) < 0) {
            long fullSteps = stepsInSpan.longValueExact();
            boolean endsOnGrid = low.add(stepSize.multiply(BigDecimal.valueOf(fullSteps))).compareTo(high) == 0;
            long points = fullSteps + 1 + (endsOnGrid ? 0 : 1);
            if (points <= maxPoints) {
                for (long i = 0; i <= fullSteps; i++) {
                    amounts.add(low.add(stepSize.multiply(BigDecimal.valueOf(i))).doubleValue());
                }
                if (!endsOnGrid) {
                    amounts.add(max);
                }
                return new AmountGrid(amounts, step, step, false);
            }
        }

        BigDecimal intervals = BigDecimal.valueOf(maxPoints - 1L);
        BigDecimal widenedStep = span.divide(intervals, MathContext.DECIMAL64);
        for (int i = 0; i < maxPoints - 1; i++) {
            BigDecimal amount = low.add(widenedStep.multiply(BigDecimal.valueOf(i)));
            amounts.add(amount.setScale(2, RoundingMode.HALF_UP).doubleValue());
        }
        amounts.add(max);
        return new AmountGrid(amounts, step, widenedStep.doubleValue(), true);
    }

    public int size() {
        return amounts.size();
    }
}
