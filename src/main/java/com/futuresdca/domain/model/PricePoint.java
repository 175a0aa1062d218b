package com.futuresdca.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One weekly close. Series of price points are ordered ascending by date, one point
 * per week, labelled with the Friday that closes the week.
 */
public record PricePoint(LocalDate date, double closePrice) {

    public PricePoint {
        Objects.requireNonNull(date, "date");
        if (!(closePrice > 0) || Double.isInfinite(closePrice)) {
            throw new IllegalArgumentException("closePrice must be positive, got " + closePrice + " on " + date);
        }
    }

    public static PricePoint of(LocalDate date, double closePrice) {
        return new PricePoint(date, closePrice);
    }
}
