package com.futuresdca.marketdata;

import com.futuresdca.config.MarketDataProperties;
import com.futuresdca.domain.model.DailyBar;
import com.futuresdca.domain.model.DateRange;
import com.futuresdca.exception.MarketDataException;
import com.futuresdca.exception.ResourceNotFoundException;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads daily bars from {@code <directory>/<symbol>.csv} files in the vendor's daily
 * export layout: {@code Date,Open,High,Low,Close,Adj Close,Volume}.
 *
 * <p>Columns are located by header name, so column order and extra columns do not
 * matter. Only {@code Date} and {@code Close} are required. Dates may carry a time and
 * offset suffix ({@code 2024-01-05 00:00:00-05:00}); only the date part is used. Rows
 * with a missing or non-numeric close (the vendor writes {@code null} for halted days)
 * are skipped.
 *
 * <p>Characters outside {@code [A-Za-z0-9_-]} in the symbol are replaced with
 * {@code _} to form the file name, so {@code MNQ=F} maps to {@code MNQ_F.csv}.
 *
 * <p>Reads are retried on {@link MarketDataException} per the {@code marketData} retry
 * instance; a missing file is not retried.
 */
@Component
public class CsvPriceSeriesProvider implements PriceSeriesProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvPriceSeriesProvider.class);

    private final MarketDataProperties marketDataProperties;

    public CsvPriceSeriesProvider(MarketDataProperties marketDataProperties) {
        this.marketDataProperties = marketDataProperties;
    }

    @Override
    @Retry(name = "marketData")
    public List<DailyBar> getDailyBars(String symbol, LocalDate startDate, LocalDate endDate) {
        return readAll(symbol).stream()
                .filter(bar -> !bar.date().isBefore(startDate) && !bar.date().isAfter(endDate))
                .toList();
    }

    @Override
    public Optional<DateRange> getAvailableRange(String symbol) {
        if (!Files.exists(fileFor(symbol))) {
            return Optional.empty();
        }
        List<DailyBar> bars = readAll(symbol);
        if (bars.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DateRange(bars.get(0).date(), bars.get(bars.size() - 1).date()));
    }

    Path fileFor(String symbol) {
        String fileName = symbol.replaceAll("[^A-Za-z0-9_-]", "_") + ".csv";
        return Paths.get(marketDataProperties.getDirectory()).resolve(fileName);
    }

    private List<DailyBar> readAll(String symbol) {
        Path file = fileFor(symbol);
        if (!Files.exists(file)) {
            throw new ResourceNotFoundException("Price series", symbol);
        }

        List<DailyBar> bars = new ArrayList<>();
        int skipped = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                return List.of();
            }
            ColumnLayout layout = ColumnLayout.fromHeader(headerLine, file);

            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Optional<DailyBar> bar = layout.parse(line);
                if (bar.isPresent()) {
                    bars.add(bar.get());
                } else {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new MarketDataException("Failed to read price file " + file, e);
        }

        if (skipped > 0) {
            log.debug("Skipped {} unparseable rows in {}", skipped, file);
        }

        bars.sort(Comparator.comparing(DailyBar::date));
        return bars;
    }

    private record ColumnLayout(int dateColumn, int closeColumn, int adjustedCloseColumn) {

        static ColumnLayout fromHeader(String headerLine, Path file) {
            String[] headers = headerLine.split(",");
            int date = -1;
            int close = -1;
            int adjusted = -1;
            for (int i = 0; i < headers.length; i++) {
                String name = headers[i].trim().toLowerCase(Locale.ROOT);
                switch (name) {
                    case "date", "datetime" -> date = i;
                    case "close" -> close = i;
                    case "adj close", "adj_close", "adjclose" -> adjusted = i;
                    default -> {}
                }
            }
            if (date < 0 || close < 0) {
                throw new MarketDataException("Price file " + file + " needs Date and Close columns");
            }
            return new ColumnLayout(date, close, adjusted);
        }

        Optional<DailyBar> parse(String line) {
            String[] cells = line.split(",", -1);
            if (cells.length <= Math.max(dateColumn, closeColumn)) {
                return Optional.empty();
            }
            try {
                String rawDate = cells[dateColumn].trim();
                LocalDate date = LocalDate.parse(rawDate.length() > 10 ? rawDate.substring(0, 10) : rawDate);
                double close = Double.parseDouble(cells[closeColumn].trim());
                if (!(close > 0)) {
                    return Optional.empty();
                }
                Double adjustedClose = null;
                if (adjustedCloseColumn >= 0 && adjustedCloseColumn < cells.length) {
                    String rawAdjusted = cells[adjustedCloseColumn].trim();
                    if (!rawAdjusted.isEmpty()) {
                        double parsed = Double.parseDouble(rawAdjusted);
                        adjustedClose = parsed > 0 ? parsed : null;
                    }
                }
                return Optional.of(new DailyBar(date, close, adjustedClose));
            } catch (NumberFormatException | DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }
}
