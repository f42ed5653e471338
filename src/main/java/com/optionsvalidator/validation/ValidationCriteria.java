package com.optionsvalidator.validation;

import lombok.Builder;
import lombok.Getter;

/**
 * Thresholds a strategy must meet to be considered ready for live trading.
 *
 * <p>Units: probabilities, drawdown and win rate are fractions; cost drag and VaR are
 * percentages; Sharpe ratios are annualized.
 */
@Getter
@Builder
public class ValidationCriteria {

    // ==================== Monte Carlo ====================

    @Builder.Default
    private final double minProfitProbability = 0.6;

    @Builder.Default
    private final double maxRuinProbability = 0.05;

    @Builder.Default
    private final double minMedianSharpe = 0.5;

    @Builder.Default
    private final double maxPathDependency = 0.8;

    // ==================== Costs ====================

    @Builder.Default
    private final double minCostAdjustedSharpe = 0.3;

    @Builder.Default
    private final double maxCostDragPct = 30.0;

    // ==================== Backtest ====================

    @Builder.Default
    private final double minSharpe = 1.0;

    @Builder.Default
    private final double maxDrawdown = 0.20;

    @Builder.Default
    private final double minWinRate = 0.45;

    @Builder.Default
    private final int minTrades = 50;

    // ==================== Risk ====================

    @Builder.Default
    private final double maxVar95Pct = 5.0;

    @Builder.Default
    private final double minOverallScore = 60.0;

    public static ValidationCriteria defaults() {
        return ValidationCriteria.builder().build();
    }
}
