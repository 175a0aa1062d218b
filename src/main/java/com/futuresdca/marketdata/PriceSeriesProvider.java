package com.futuresdca.marketdata;

import com.futuresdca.domain.model.DailyBar;
import com.futuresdca.domain.model.DateRange;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only source of daily closes for a symbol. Implementations own any fetching or
 * caching; callers treat the returned list as immutable.
 */
public interface PriceSeriesProvider {

    /**
     * Returns the daily bars of {@code symbol} between the two dates, both inclusive,
     * ordered ascending by date. Returns an empty list when nothing falls in the window.
     */
    List<DailyBar> getDailyBars(String symbol, LocalDate startDate, LocalDate endDate);

    /** First and last dates with data for {@code symbol}, or empty if the symbol is unknown. */
    Optional<DateRange> getAvailableRange(String symbol);
}
