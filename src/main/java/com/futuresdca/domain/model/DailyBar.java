package com.futuresdca.domain.model;

import java.time.LocalDate;

/**
 * A raw daily row from the price provider. {@code adjustedClose} is null when the
 * source has no adjusted column.
 */
public record DailyBar(LocalDate date, double close, Double adjustedClose) {

    /** The adjusted close when present, the raw close otherwise. */
    public double effectiveClose() {
        return adjustedClose != null ? adjustedClose : close;
    }
}
