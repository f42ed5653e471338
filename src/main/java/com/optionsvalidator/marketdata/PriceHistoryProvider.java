package com.optionsvalidator.marketdata;

import com.optionsvalidator.domain.model.DailyBar;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of daily price bars for an underlying. The backtest engine calls it once per
 * symbol per run and caches the result.
 */
@FunctionalInterface
public interface PriceHistoryProvider {

    /**
     * Returns the daily bars dated within [start, end], in any order.
     *
     * @throws com.optionsvalidator.exception.MissingMarketDataException if the symbol is unknown
     */
    List<DailyBar> fetchDailyBars(String symbol, LocalDate start, LocalDate end);
}
