package com.optionsvalidator.risk;

/** Whether the risk monitor currently allows new trades, and why. */
public record TradingDecision(boolean allowed, String reason) {}
