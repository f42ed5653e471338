package com.optionsvalidator.risk;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Snapshot of a risk monitoring session. Percentages are of portfolio value. */
@Getter
@Builder
public class RiskSummary {

    private final double portfolioValue;

    /** VaR figures in dollars (negative = loss); zero when the return history is too short. */
    private final double var95;
    private final double var99;
    private final double cvar95;
    private final double cvar99;
    private final double var95Pct;

    private final double currentDrawdownPct;
    private final double maxDrawdownLimitPct;
    private final double dailyPnlPct;
    private final double dailyLossLimitPct;
    private final double peakValue;

    private final boolean canTrade;
    private final String tradingStatus;
    private final int activeAlerts;

    @Builder.Default
    private final Instant timestamp = Instant.now();
}
