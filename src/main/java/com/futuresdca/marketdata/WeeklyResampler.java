package com.futuresdca.marketdata;

import com.futuresdca.domain.model.DailyBar;
import com.futuresdca.domain.model.PricePoint;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Resamples a daily close series to weeks ending Friday.
 *
 * <p>Each bar is assigned to the Friday on or after its date, so weekend bars roll into
 * the following week. Within a week the latest close wins and the point is labelled with
 * the Friday date. Weeks without bars produce no point. Already-weekly input keyed on
 * Fridays passes through unchanged.
 */
@Component
public class WeeklyResampler {

    /**
     * Converts daily bars to weekly points, preferring the adjusted close when the
     * provider supplies one.
     */
    public List<PricePoint> resampleDaily(List<DailyBar> bars) {
        return toWeekly(toPricePoints(bars));
    }

    /** Daily bars as daily price points, adjusted close preferred. No bucketing. */
    public static List<PricePoint> toPricePoints(List<DailyBar> bars) {
        return bars.stream()
                .map(bar -> PricePoint.of(bar.date(), bar.effectiveClose()))
                .toList();
    }

    /**
     * Buckets the given points by Friday week end.
     *
     * @return an unmodifiable series ordered ascending by date
     */
    public List<PricePoint> toWeekly(List<PricePoint> points) {
        Map<LocalDate, PricePoint> weeks = new TreeMap<>();

        points.stream()
                .sorted(Comparator.comparing(PricePoint::date))
                .forEach(point -> {
                    LocalDate weekEnd = weekEnding(point.date());
                    weeks.put(weekEnd, PricePoint.of(weekEnd, point.closePrice()));
                });

        return List.copyOf(weeks.values());
    }

    static LocalDate weekEnding(LocalDate date) {
        return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
    }
}
