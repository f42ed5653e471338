package com.optionsvalidator.domain.model;

import java.time.LocalDate;

/** One daily OHLCV observation for an underlying. */
public record DailyBar(LocalDate date, double open, double high, double low, double close, long volume) {}
