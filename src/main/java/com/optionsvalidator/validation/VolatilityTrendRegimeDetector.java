package com.optionsvalidator.validation;

import com.optionsvalidator.domain.enums.MarketRegime;
import com.optionsvalidator.domain.enums.TrendRegime;
import com.optionsvalidator.domain.enums.VolatilityRegime;
import java.util.Arrays;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Regime detector combining a volatility percentile with a moving-average trend score.
 *
 * <p>Volatility: the current 20-day return volatility ranked against the last 252 days
 * (LOW below the 25th percentile, MEDIUM below the 75th, HIGH below the 95th, else EXTREME).
 *
 * <p>Trend: the average of (20-day MA - 50-day MA) / 50-day price range and the 50-day rate
 * of change, scaled by 5 and clipped to [-1, 1]. Cut-offs at +/-0.5 and +/-0.1.
 *
 * <p>EXTREME volatility in any downtrend is a CRISIS. The recommended position scale is
 * volScale x trendScale x (0.5 + 0.5 x confidence), clamped to [0.1, 1].
 */
@Component
public class VolatilityTrendRegimeDetector implements RegimeDetector {

    private static final Logger log = LoggerFactory.getLogger(VolatilityTrendRegimeDetector.class);

    static final int VOLATILITY_WINDOW = 20;
    static final int SHORT_MA_WINDOW = 20;
    static final int TREND_WINDOW = 50;
    static final int HISTORY_WINDOW = 252;

    private static final double LOW_VOL_PERCENTILE = 25.0;
    private static final double HIGH_VOL_PERCENTILE = 75.0;
    private static final double EXTREME_VOL_PERCENTILE = 95.0;

    @Override
    public RegimeState detectRegime(double[] closes) {
        double[] returns = simpleReturns(closes);
        if (returns.length < HISTORY_WINDOW) {
            log.warn("Insufficient data for regime detection: {} < {} returns", returns.length, HISTORY_WINDOW);
            return RegimeState.undetermined();
        }

        double[] rollingVol = rollingStd(returns, VOLATILITY_WINDOW);
        double volPercentile = volatilityPercentile(rollingVol);
        VolatilityRegime volRegime = classifyVolatility(volPercentile);

        double trendStrength = trendStrength(closes);
        TrendRegime trendRegime = classifyTrend(trendStrength);

        MarketRegime marketRegime = combine(volRegime, trendRegime);
        double confidence = confidence(rollingVol, closes);
        double scale = volRegime.getPositionScale() * trendRegime.getPositionScale() * (0.5 + 0.5 * confidence);

        RegimeState state = RegimeState.builder()
                .volatilityRegime(volRegime)
                .trendRegime(trendRegime)
                .marketRegime(marketRegime)
                .volatilityPercentile(volPercentile)
                .trendStrength(trendStrength)
                .confidence(confidence)
                .recommendedPositionScale(Math.max(0.1, Math.min(1.0, scale)))
                .build();
        log.debug("Detected regime: {}", state);
        return state;
    }

    // ==================== Volatility ====================

    private double volatilityPercentile(double[] rollingVol) {
        double current = rollingVol[rollingVol.length - 1];
        int from = rollingVol.length - HISTORY_WINDOW;
        int below = 0;
        for (int i = from; i < rollingVol.length; i++) {
            // NaN (window not yet full) never counts as below
            if (rollingVol[i] < current) {
                below++;
            }
        }
        return below * 100.0 / HISTORY_WINDOW;
    }

    public static VolatilityRegime classifyVolatility(double percentile) {
        if (percentile < LOW_VOL_PERCENTILE) {
            return VolatilityRegime.LOW;
        }
        if (percentile < HIGH_VOL_PERCENTILE) {
            return VolatilityRegime.MEDIUM;
        }
        if (percentile < EXTREME_VOL_PERCENTILE) {
            return VolatilityRegime.HIGH;
        }
        return VolatilityRegime.EXTREME;
    }

    // ==================== Trend ====================

    private double trendStrength(double[] closes) {
        int n = closes.length;
        double[] recent = Arrays.copyOfRange(closes, n - TREND_WINDOW, n);
        double shortMa = new Mean().evaluate(closes, n - SHORT_MA_WINDOW, SHORT_MA_WINDOW);
        double longMa = new Mean().evaluate(recent);
        double range = Arrays.stream(recent).max().orElse(0) - Arrays.stream(recent).min().orElse(0);

        double maDiff = range > 0 ? (shortMa - longMa) / range : 0.0;
        double base = recent[0];
        double roc = base != 0 ? (closes[n - 1] - base) / base : 0.0;

        double strength = (maDiff + roc) / 2 * 5;
        return Math.max(-1.0, Math.min(1.0, strength));
    }

    public static TrendRegime classifyTrend(double strength) {
        if (strength > 0.5) {
            return TrendRegime.STRONG_UPTREND;
        }
        if (strength > 0.1) {
            return TrendRegime.WEAK_UPTREND;
        }
        if (strength > -0.1) {
            return TrendRegime.RANGING;
        }
        if (strength > -0.5) {
            return TrendRegime.WEAK_DOWNTREND;
        }
        return TrendRegime.STRONG_DOWNTREND;
    }

    public static MarketRegime combine(VolatilityRegime vol, TrendRegime trend) {
        boolean highVol = vol == VolatilityRegime.HIGH || vol == VolatilityRegime.EXTREME;
        if (vol == VolatilityRegime.EXTREME && trend.isDown()) {
            return MarketRegime.CRISIS;
        }
        if (trend.isUp()) {
            return highVol ? MarketRegime.BULL_HIGH_VOL : MarketRegime.BULL_LOW_VOL;
        }
        if (trend.isDown()) {
            return highVol ? MarketRegime.BEAR_HIGH_VOL : MarketRegime.BEAR_LOW_VOL;
        }
        return highVol ? MarketRegime.RANGING_HIGH_VOL : MarketRegime.RANGING_LOW_VOL;
    }

    // ==================== Confidence ====================

    /** Mean of volatility stability (1 - coefficient of variation) and trend R-squared. */
    private double confidence(double[] rollingVol, double[] closes) {
        double[] recentVol = Arrays.copyOfRange(rollingVol, rollingVol.length - VOLATILITY_WINDOW, rollingVol.length);
        double volMean = new Mean().evaluate(recentVol);
        double volStability = volMean > 0 ? 1 - new StandardDeviation(true).evaluate(recentVol) / volMean : 0.0;

        double[] recent = Arrays.copyOfRange(closes, closes.length - TREND_WINDOW, closes.length);
        double[] x = new double[recent.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        double correlation = new PearsonsCorrelation().correlation(x, recent);
        double trendClarity = Double.isFinite(correlation) ? correlation * correlation : 0.0;

        return Math.max(0.0, Math.min(1.0, (volStability + trendClarity) / 2));
    }

    private static double[] simpleReturns(double[] closes) {
        if (closes == null || closes.length < 2) {
            return new double[0];
        }
        double[] returns = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = closes[i - 1] != 0 ? closes[i] / closes[i - 1] - 1.0 : 0.0;
        }
        return returns;
    }

    private static double[] rollingStd(double[] values, int window) {
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        StandardDeviation sd = new StandardDeviation(true);
        for (int i = window - 1; i < values.length; i++) {
            out[i] = sd.evaluate(values, i - window + 1, window);
        }
        return out;
    }
}
