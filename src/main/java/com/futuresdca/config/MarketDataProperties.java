package com.futuresdca.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Location of the daily price files read by {@link com.futuresdca.marketdata.CsvPriceSeriesProvider}.
 *
 * <p>Properties prefix: {@code futuresdca.market-data.*}
 */
@Configuration
@ConfigurationProperties(prefix = "futuresdca.market-data")
@Getter
@Setter
public class MarketDataProperties {

    /** Directory holding one {@code <symbol>.csv} file per instrument. */
    private String directory = "data/prices";
}
