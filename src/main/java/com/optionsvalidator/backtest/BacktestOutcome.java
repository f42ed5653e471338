package com.optionsvalidator.backtest;

import com.optionsvalidator.core.stats.ReturnStatistics;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.domain.model.PriceHistory;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything a completed backtest produced: metrics, closed positions, the equity curve
 * and the price histories it ran on. Input to Monte Carlo, VaR and the extended validator.
 */
@Getter
@Builder
public class BacktestOutcome {

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final double initialCapital;
    private final BacktestMetrics metrics;
    private final List<OptionsPosition> closedPositions;
    private final List<EquityPoint> equityCurve;
    private final Map<String, PriceHistory> priceHistories;

    /** Trades the strategy proposed that could not be simulated. */
    private final int skippedTrades;

    public List<Double> equityValues() {
        return equityCurve.stream().map(EquityPoint::equity).toList();
    }

    /** Period-over-period returns of the equity curve. */
    public double[] dailyReturns() {
        return ReturnStatistics.finite(ReturnStatistics.returnsFromValues(equityValues()));
    }

    /** Sum of realized P&amp;L across closed positions (commissions already deducted). */
    public double totalPnl() {
        return closedPositions.stream().mapToDouble(OptionsPosition::getPnl).sum();
    }
}
