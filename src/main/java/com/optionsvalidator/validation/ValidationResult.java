package com.optionsvalidator.validation;

import com.optionsvalidator.backtest.BacktestMetrics;
import com.optionsvalidator.montecarlo.MonteCarloResult;
import com.optionsvalidator.risk.VaRResult;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Combined verdict of the extended validation.
 *
 * <p>Returns and cost drag are percentages, total costs are dollars, the overall score is
 * 0-100. Monte Carlo and VaR results are null when those stages could not run.
 */
@Getter
@Builder
public class ValidationResult {

    private final BacktestMetrics backtestMetrics;

    // ==================== Monte Carlo ====================

    private final MonteCarloResult monteCarloResult;
    private final boolean monteCarloValid;

    @Builder.Default
    private final List<String> monteCarloFailures = List.of();

    // ==================== Risk ====================

    private final VaRResult varResult;

    // ==================== Costs ====================

    private final double grossReturn;
    private final double netReturn;
    private final double totalCosts;
    private final double costDragPct;
    private final double costAdjustedSharpe;

    // ==================== Regime ====================

    private final RegimeState regimeState;
    private final double regimeAdjustedScore;

    // ==================== Verdict ====================

    private final double backtestScore;
    private final Double monteCarloScore;
    private final double costRegimeScore;
    private final double overallScore;
    private final boolean validForLiveTrading;
    private final String summary;

    @Builder.Default
    private final List<String> failures = List.of();

    @Builder.Default
    private final List<String> recommendations = List.of();
}
