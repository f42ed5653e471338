package com.optionsvalidator.backtest;

import java.time.LocalDate;

/** Portfolio value sampled on one evaluation date. */
public record EquityPoint(LocalDate date, double equity) {}
