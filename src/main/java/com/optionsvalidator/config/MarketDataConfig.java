package com.optionsvalidator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Location of the daily price files read by {@code CsvPriceHistoryProvider}
 * ({@code optionsvalidator.market-data.*}). One file per symbol: {@code <SYMBOL>.csv}
 * with a {@code date,open,high,low,close,volume} header.
 */
@Configuration
@ConfigurationProperties(prefix = "optionsvalidator.market-data")
@Getter
@Setter
public class MarketDataConfig {

    private String directory = "data/prices";
}
