package com.optionsvalidator.exception;

import java.util.Map;

/**
 * Raised when a statistical method receives fewer observations than it needs
 * (20 returns for VaR and Monte Carlo, 60 bars for a backtest evaluation).
 */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String subject, int required, int actual) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                String.format("Insufficient data for %s: need at least %d observations, got %d", subject, required, actual),
                Map.of("subject", subject, "required", required, "actual", actual));
    }
}
