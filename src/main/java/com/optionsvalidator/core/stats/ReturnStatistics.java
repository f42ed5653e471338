package com.optionsvalidator.core.stats;

import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Performance statistics over daily return series, shared by the backtest metrics,
 * the Monte Carlo simulator and the VaR calculator.
 *
 * <p>Conventions:
 * <ul>
 *   <li>standard deviation is the population one (divide by n)
 *   <li>Sharpe = (mean - rf/252) / std * sqrt(252), 0 when std is 0 or n &lt; 2
 *   <li>total return compounds geometrically: prod(1 + r) - 1
 *   <li>max drawdown is measured on the cumulative-product path starting at 1.0 and
 *       reported as a positive fraction
 *   <li>percentiles interpolate linearly between order statistics (R-7)
 * </ul>
 */
public final class ReturnStatistics {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private static final double SQRT_TRADING_DAYS = Math.sqrt(TRADING_DAYS_PER_YEAR);

    private ReturnStatistics() {}

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    public static double populationStd(double[] values) {
        return values.length == 0 ? 0.0 : new StandardDeviation(false).evaluate(values);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /** Annualized Sharpe ratio of daily returns against an annual risk-free rate. */
    public static double sharpe(double[] dailyReturns, double annualRiskFreeRate) {
        if (dailyReturns.length < 2) {
            return 0.0;
        }
        double std = populationStd(dailyReturns);
        if (std <= 0) {
            return 0.0;
        }
        return (mean(dailyReturns) - annualRiskFreeRate / TRADING_DAYS_PER_YEAR) / std * SQRT_TRADING_DAYS;
    }

    public static double totalReturn(double[] dailyReturns) {
        double growth = 1.0;
        for (double r : dailyReturns) {
            growth *= 1.0 + r;
        }
        return growth - 1.0;
    }

    /** Largest peak-to-trough decline of the compounded path, as a positive fraction. */
    public static double maxDrawdown(double[] dailyReturns) {
        double equity = 1.0;
        double peak = 1.0;
        double maxDrawdown = 0.0;
        for (double r : dailyReturns) {
            equity *= 1.0 + r;
            peak = Math.max(peak, equity);
            maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak);
        }
        return maxDrawdown;
    }

    /**
     * Percentile with linear interpolation.
     *
     * @param p percentile in [0, 100]
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        if (p <= 0) {
            return StatUtils.min(values);
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, Math.min(p, 100.0));
    }

    /** Mean of all values at or below {@code threshold}; the threshold itself when none are. */
    public static double tailMean(double[] values, double threshold) {
        double[] tail = Arrays.stream(values).filter(v -> v <= threshold).toArray();
        return tail.length == 0 ? threshold : mean(tail);
    }

    /** Simple returns (E[t] - E[t-1]) / E[t-1] of a value series. */
    public static double[] returnsFromValues(List<Double> values) {
        if (values.size() < 2) {
            return new double[0];
        }
        double[] returns = new double[values.size() - 1];
        for (int i = 1; i < values.size(); i++) {
            double prev = values.get(i - 1);
            returns[i - 1] = prev != 0 ? (values.get(i) - prev) / prev : Double.NaN;
        }
        return returns;
    }

    /** Copy without NaN or infinite entries. */
    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static double[] finite(List<Double> values) {
        return values.stream()
                .filter(v -> v != null && Double.isFinite(v))
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
