package com.optionsvalidator.config;

import com.optionsvalidator.validation.ValidationCriteria;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the default {@link ValidationCriteria} from {@code optionsvalidator.validation.*}.
 * Unset properties fall back to the criteria's built-in defaults.
 */
@Configuration
public class ValidationConfig {

    @Bean
    public ValidationCriteria validationCriteria(
            @Value("${optionsvalidator.validation.min-profit-probability:0.6}") double minProfitProbability,
            @Value("${optionsvalidator.validation.max-ruin-probability:0.05}") double maxRuinProbability,
            @Value("${optionsvalidator.validation.min-median-sharpe:0.5}") double minMedianSharpe,
            @Value("${optionsvalidator.validation.min-cost-adjusted-sharpe:0.3}") double minCostAdjustedSharpe,
            @Value("${optionsvalidator.validation.max-cost-drag-pct:30.0}") double maxCostDragPct,
            @Value("${optionsvalidator.validation.min-sharpe:1.0}") double minSharpe,
            @Value("${optionsvalidator.validation.max-drawdown:0.20}") double maxDrawdown,
            @Value("${optionsvalidator.validation.min-win-rate:0.45}") double minWinRate,
            @Value("${optionsvalidator.validation.min-trades:50}") int minTrades,
            @Value("${optionsvalidator.validation.max-var95-pct:5.0}") double maxVar95Pct,
            @Value("${optionsvalidator.validation.max-path-dependency:0.8}") double maxPathDependency,
            @Value("${optionsvalidator.validation.min-overall-score:60.0}") double minOverallScore) {
        return ValidationCriteria.builder()
                .minProfitProbability(minProfitProbability)
                .maxRuinProbability(maxRuinProbability)
                .minMedianSharpe(minMedianSharpe)
                .minCostAdjustedSharpe(minCostAdjustedSharpe)
                .maxCostDragPct(maxCostDragPct)
                .minSharpe(minSharpe)
                .maxDrawdown(maxDrawdown)
                .minWinRate(minWinRate)
                .minTrades(minTrades)
                .maxVar95Pct(maxVar95Pct)
                .maxPathDependency(maxPathDependency)
                .minOverallScore(minOverallScore)
                .build();
    }
}
