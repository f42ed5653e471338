package com.optionsvalidator.domain.enums;

public enum VaRMethod {
    HISTORICAL,
    PARAMETRIC,
    MONTE_CARLO
}
