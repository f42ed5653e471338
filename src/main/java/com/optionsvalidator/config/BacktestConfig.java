package com.optionsvalidator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for options backtests.
 *
 * <p>Binds to the {@code optionsvalidator.backtest.*} prefix in application.properties.
 * Every engine created by {@code OptionsBacktestEngineFactory} copies these values at
 * creation time, so changing them affects only engines created afterwards.
 */
@Configuration
@ConfigurationProperties(prefix = "optionsvalidator.backtest")
@Getter
@Setter
public class BacktestConfig {

    /** Starting equity in dollars. */
    private double initialCapital = 100_000.0;

    /** Annual risk-free rate used for pricing and the Sharpe/Sortino excess return. */
    private double riskFreeRate = 0.04;

    /** Commission per option contract, charged on entry and again on exit. */
    private double commissionPerContract = 0.65;

    /** Implied volatility estimate = HV30 * this multiplier. */
    private double ivMultiplier = 1.2;

    /** Volatility used when the IV estimate is not yet defined (short history). */
    private double defaultImpliedVolatility = 0.20;

    /** Minimum bars of history before the strategy is consulted for a symbol. */
    private int minHistoryBars = 60;

    /** Calendar days of history loaded ahead of the backtest start for indicator warm-up. */
    private int historyLookbackDays = 252;

    /** Calendar days of data loaded past the backtest end so late trades can be exited. */
    private int exitLookaheadDays = 90;
}
