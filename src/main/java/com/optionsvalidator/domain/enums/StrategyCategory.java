package com.optionsvalidator.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Named options strategy families. The label is the key used in the per-strategy
 * breakdown of backtest metrics.
 */
@Getter
@RequiredArgsConstructor
public enum StrategyCategory {
    COVERED_CALL("covered_call"),
    CASH_SECURED_PUT("cash_secured_put"),
    IRON_CONDOR("iron_condor"),
    CREDIT_SPREAD("credit_spread"),
    DEBIT_SPREAD("debit_spread"),
    STRADDLE("straddle"),
    STRANGLE("strangle"),
    CALENDAR_SPREAD("calendar_spread"),
    VERTICAL_SPREAD("vertical_spread");

    private final String label;
}
