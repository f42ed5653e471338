package com.optionsvalidator.risk;

import lombok.Builder;
import lombok.Data;

/**
 * Limits enforced by {@link RiskMonitor}, all expressed as percentages of portfolio value.
 */
@Data
@Builder
public class RiskLimits {

    /** Maximum 95% VaR loss. Breach is a WARNING, or CRITICAL at 1.5x the limit. */
    @Builder.Default
    private double varLimitPct = 5.0;

    /** Maximum intraday loss from the day's starting value. Breach pauses trading. */
    @Builder.Default
    private double dailyLossLimitPct = 2.0;

    /** Maximum decline from peak value. Breach halts trading. */
    @Builder.Default
    private double drawdownLimitPct = 10.0;

    /** Maximum share of gross position value in one symbol. */
    @Builder.Default
    private double positionLimitPct = 25.0;

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }
}
