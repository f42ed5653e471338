package com.optionsvalidator.exception;

import java.util.Map;

public class PositionAlreadyClosedException extends BaseException {

    public PositionAlreadyClosedException(String symbol, String category) {
        super(
                ErrorCode.POSITION_ALREADY_CLOSED,
                "Position " + symbol + " (" + category + ") is already closed",
                Map.of("symbol", symbol, "strategy", category));
    }
}
