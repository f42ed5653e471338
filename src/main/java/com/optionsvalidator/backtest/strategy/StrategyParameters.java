package com.optionsvalidator.backtest.strategy;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunables shared by the built-in premium-selling strategies. Strike offsets are
 * fractions of the underlying price (0.05 = 5% out of the money).
 */
@Getter
@Builder
@ToString
public class StrategyParameters {

    @Builder.Default
    private final int daysToExpiry = 30;

    /** Distance of the short strike(s) from spot. */
    @Builder.Default
    private final double shortStrikeOffsetPct = 0.05;

    /** Distance between the short and long strike of each spread. */
    @Builder.Default
    private final double spreadWidthPct = 0.05;

    @Builder.Default
    private final int contracts = 1;

    /** Days after entry to close; 0 holds to expiration. */
    @Builder.Default
    private final int holdDays = 0;

    /** Strikes are rounded to this increment. */
    @Builder.Default
    private final double strikeIncrement = 1.0;

    @Builder.Default
    private final double riskFreeRate = 0.04;

    /** Volatility used to price entries when the history has no IV estimate yet. */
    @Builder.Default
    private final double defaultImpliedVolatility = 0.20;

    public static StrategyParameters defaults() {
        return StrategyParameters.builder().build();
    }
}
