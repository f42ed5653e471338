package com.optionsvalidator.montecarlo;

import com.optionsvalidator.domain.enums.SimulationMethod;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one Monte Carlo run. Immutable.
 *
 * <p>Sharpe is annualized; total return, drawdown, VaR and expected shortfall are
 * fractions of starting capital (-0.05 = a 5% loss). Probabilities are in [0, 1].
 * A trade-based run resamples per-trade returns, so its observations are trades.
 */
@Getter
@Builder
@ToString
public class MonteCarloResult {

    /** Stress scenario name, or "base" for an unstressed run. */
    @Builder.Default
    private final String scenario = "base";

    private final SimulationMethod method;
    private final int simulations;
    private final int observations;
    private final double initialCapital;

    private final MetricDistribution sharpe;
    private final MetricDistribution totalReturn;
    private final MetricDistribution maxDrawdown;

    /** Share of trials with a negative total return. */
    private final double probabilityOfLoss;

    /** Share of trials whose max drawdown exceeded {@link #ruinThreshold}. */
    private final double probabilityOfRuin;

    private final double ruinThreshold;

    /** 5th percentile of simulated total returns. */
    private final double var95;

    /** Mean of simulated total returns at or below {@link #var95}. */
    private final double expectedShortfall95;

    /** 0 = outcome independent of return ordering, 1 = artifact of the observed sequence. */
    private final double pathDependencyScore;

    private final FinalEquityDistribution finalEquity;

    /** Share of trials that ended above twice the starting capital. */
    private final double probabilityOfDoubling;

    /** Observed per-trade profile; null when the run resampled daily returns. */
    private final TradeStatistics tradeStatistics;

    public boolean isTradeBased() {
        return tradeStatistics != null;
    }

    public double getProbabilityOfProfit() {
        return 1.0 - probabilityOfLoss;
    }

    /** Worst-case (95th percentile) simulated drawdown. */
    public double getDrawdown95Upper() {
        return maxDrawdown.getUpper95();
    }

    public double getVar95Dollars() {
        return var95 * initialCapital;
    }

    public double getExpectedShortfall95Dollars() {
        return expectedShortfall95 * initialCapital;
    }

    public double getMeanFinalEquity() {
        return initialCapital * (1.0 + totalReturn.getMean());
    }
}
