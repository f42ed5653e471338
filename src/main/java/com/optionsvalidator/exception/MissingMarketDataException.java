package com.optionsvalidator.exception;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

public class MissingMarketDataException extends BaseException {

    public MissingMarketDataException(String symbol, String message) {
        super(ErrorCode.MISSING_MARKET_DATA, message, Map.of("symbol", symbol));
    }

    public MissingMarketDataException(String symbol, LocalDate date) {
        super(ErrorCode.MISSING_MARKET_DATA, "No market data for " + symbol + " on " + date, details(symbol, date));
    }

    private static Map<String, Object> details(String symbol, LocalDate date) {
        Map<String, Object> details = new HashMap<>();
        details.put("symbol", symbol);
        details.put("date", String.valueOf(date));
        return details;
    }
}
