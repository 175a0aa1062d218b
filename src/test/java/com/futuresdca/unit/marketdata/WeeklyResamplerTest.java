package com.futuresdca.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;

import com.futuresdca.domain.model.DailyBar;
import com.futuresdca.domain.model.PricePoint;
import com.futuresdca.marketdata.WeeklyResampler;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WeeklyResampler.
 *
 * <p>Verifies: Friday bucketing, last-close-wins, weekend roll-forward, adjusted close
 * preference, and pass-through of already-weekly data.
 */
class WeeklyResamplerTest {

    private WeeklyResampler weeklyResampler;

    @BeforeEach
    void setUp() {
        weeklyResampler = new WeeklyResampler();
    }

    @Test
    void dailyBars_bucketedToFridayWithLastClose() {
        List<PricePoint> daily = List.of(
                PricePoint.of(LocalDate.of(2024, 1, 2), 100), // Tue
                PricePoint.of(LocalDate.of(2024, 1, 4), 102), // Thu
                PricePoint.of(LocalDate.of(2024, 1, 8), 104), // Mon
                PricePoint.of(LocalDate.of(2024, 1, 12), 107)); // Fri

        List<PricePoint> weekly = weeklyResampler.toWeekly(daily);

        assertThat(weekly).containsExactly(
                PricePoint.of(LocalDate.of(2024, 1, 5), 102),
                PricePoint.of(LocalDate.of(2024, 1, 12), 107));
    }

    @Test
    void unorderedInput_isSortedBeforeBucketing() {
        List<PricePoint> daily = List.of(
                PricePoint.of(LocalDate.of(2024, 1, 4), 102),
                PricePoint.of(LocalDate.of(2024, 1, 2), 100));

        assertThat(weeklyResampler.toWeekly(daily)).containsExactly(PricePoint.of(LocalDate.of(2024, 1, 5), 102));
    }

    @Test
    void weekendBar_rollsIntoFollowingWeek() {
        List<PricePoint> daily = List.of(
                PricePoint.of(LocalDate.of(2024, 1, 5), 100), // Fri
                PricePoint.of(LocalDate.of(2024, 1, 7), 99)); // Sun, futures session open

        assertThat(weeklyResampler.toWeekly(daily)).containsExactly(
                PricePoint.of(LocalDate.of(2024, 1, 5), 100),
                PricePoint.of(LocalDate.of(2024, 1, 12), 99));
    }

    @Test
    void weeksWithoutBars_produceNoPoint() {
        List<PricePoint> daily = List.of(
                PricePoint.of(LocalDate.of(2024, 1, 3), 100),
                PricePoint.of(LocalDate.of(2024, 1, 24), 110));

        assertThat(weeklyResampler.toWeekly(daily))
                .extracting(PricePoint::date)
                .containsExactly(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 26));
    }

    @Test
    void fridaySeries_passesThroughUnchanged() {
        List<PricePoint> fridays = List.of(
                PricePoint.of(LocalDate.of(2024, 1, 5), 100),
                PricePoint.of(LocalDate.of(2024, 1, 12), 101),
                PricePoint.of(LocalDate.of(2024, 1, 19), 99));

        assertThat(weeklyResampler.toWeekly(fridays)).isEqualTo(fridays);
    }

    @Test
    void resampleDaily_prefersAdjustedClose() {
        List<DailyBar> bars = List.of(
                new DailyBar(LocalDate.of(2024, 1, 4), 100, 98.5),
                new DailyBar(LocalDate.of(2024, 1, 11), 105, null));

        assertThat(weeklyResampler.resampleDaily(bars)).containsExactly(
                PricePoint.of(LocalDate.of(2024, 1, 5), 98.5),
                PricePoint.of(LocalDate.of(2024, 1, 12), 105));
    }

    @Test
    void emptyInput_emptyOutput() {
        assertThat(weeklyResampler.toWeekly(List.of())).isEmpty();
    }
}
