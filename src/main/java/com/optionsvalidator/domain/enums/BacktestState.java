package com.optionsvalidator.domain.enums;

public enum BacktestState {
    CONFIGURED,
    DATA_LOADED,
    RUNNING,
    COMPLETED
}
