package com.optionsvalidator.unit.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionsvalidator.domain.enums.MarketRegime;
import com.optionsvalidator.domain.enums.TrendRegime;
import com.optionsvalidator.domain.enums.VolatilityRegime;
import com.optionsvalidator.domain.model.PriceHistory;
import com.optionsvalidator.unit.support.SyntheticBars;
import com.optionsvalidator.validation.RegimeState;
import com.optionsvalidator.validation.VolatilityTrendRegimeDetector;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VolatilityTrendRegimeDetectorTest {

    private final VolatilityTrendRegimeDetector detector = new VolatilityTrendRegimeDetector();

    /** Steady 0.3% daily climb with alternating noise that fades over time. */
    private static double[] calmUptrend(int n) {
        double[] closes = new double[n];
        for (int i = 0; i < n; i++) {
            double noise = 0.01 * (1 - i / 400.0) * (i % 2 == 0 ? 1 : -1);
            closes[i] = 100 * Math.pow(1.003, i) * (1 + noise);
        }
        return closes;
    }

    /** Quiet flat market that sells off 0.5% a day over the last 50 days with exploding noise. */
    private static double[] crash(int n) {
        double[] closes = new double[n];
        double level = 100;
        for (int i = 0; i < n; i++) {
            int fromEnd = n - 1 - i;
            double amplitude = fromEnd < 20 ? 0.002 + 0.03 * (20 - fromEnd) / 20.0 : 0.002;
            if (fromEnd < 50) {
                level *= 0.995;
            }
            closes[i] = level * (1 + amplitude * (i % 2 == 0 ? 1 : -1));
        }
        return closes;
    }

    @Nested
    @DisplayName("End-to-end classification")
    class EndToEnd {

        @Test
        @DisplayName("Fading volatility in a steady climb is a low-volatility bull market")
        void calmBull() {
            RegimeState state = detector.detectRegime(calmUptrend(320));

            assertThat(state.getVolatilityRegime()).isEqualTo(VolatilityRegime.LOW);
            assertThat(state.getTrendRegime()).isEqualTo(TrendRegime.STRONG_UPTREND);
            assertThat(state.getMarketRegime()).isEqualTo(MarketRegime.BULL_LOW_VOL);
            assertThat(state.getVolatilityPercentile()).isLessThan(25.0);
            assertThat(state.getTrendStrength()).isGreaterThan(0.5);
            assertThat(state.getRecommendedPositionScale()).isBetween(0.5, 1.0);
            assertThat(state.getConfidence()).isBetween(0.0, 1.0);
        }

        @Test
        @DisplayName("Record volatility in a sell-off is a crisis with minimal sizing")
        void crisis() {
            RegimeState state = detector.detectRegime(crash(320));

            assertThat(state.getVolatilityRegime()).isEqualTo(VolatilityRegime.EXTREME);
            assertThat(state.getTrendRegime()).isEqualTo(TrendRegime.STRONG_DOWNTREND);
            assertThat(state.getMarketRegime()).isEqualTo(MarketRegime.CRISIS);
            assertThat(state.getRecommendedPositionScale()).isLessThan(0.1 + 1e-9);
        }

        @Test
        @DisplayName("Fewer than a year of returns is undetermined")
        void shortSeries() {
            RegimeState state = detector.detectRegime(calmUptrend(252));

            assertThat(state.getMarketRegime()).isEqualTo(MarketRegime.RANGING_LOW_VOL);
            assertThat(state.getVolatilityRegime()).isEqualTo(VolatilityRegime.MEDIUM);
            assertThat(state.getConfidence()).isZero();
            assertThat(state.getRecommendedPositionScale()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Price histories are classified on their closes")
        void fromPriceHistory() {
            PriceHistory history = PriceHistory.of(
                    "SPY", SyntheticBars.trending(LocalDate.of(2023, 1, 2), LocalDate.of(2024, 6, 28), 400, 0.001), 1.2);

            RegimeState state = detector.detectRegime(history);

            assertThat(state.getTrendRegime().isUp()).isTrue();
            assertThat(state.getRecommendedPositionScale()).isBetween(0.1, 1.0);
        }
    }

    @Nested
    @DisplayName("Thresholds")
    class Thresholds {

        @Test
        void volatilityPercentileCutoffs() {
            assertThat(VolatilityTrendRegimeDetector.classifyVolatility(24.9)).isEqualTo(VolatilityRegime.LOW);
            assertThat(VolatilityTrendRegimeDetector.classifyVolatility(25.0)).isEqualTo(VolatilityRegime.MEDIUM);
            assertThat(VolatilityTrendRegimeDetector.classifyVolatility(75.0)).isEqualTo(VolatilityRegime.HIGH);
            assertThat(VolatilityTrendRegimeDetector.classifyVolatility(95.0)).isEqualTo(VolatilityRegime.EXTREME);
        }

        @Test
        void trendCutoffs() {
            assertThat(VolatilityTrendRegimeDetector.classifyTrend(0.51)).isEqualTo(TrendRegime.STRONG_UPTREND);
            assertThat(VolatilityTrendRegimeDetector.classifyTrend(0.5)).isEqualTo(TrendRegime.WEAK_UPTREND);
            assertThat(VolatilityTrendRegimeDetector.classifyTrend(0.0)).isEqualTo(TrendRegime.RANGING);
            assertThat(VolatilityTrendRegimeDetector.classifyTrend(-0.1)).isEqualTo(TrendRegime.WEAK_DOWNTREND);
            assertThat(VolatilityTrendRegimeDetector.classifyTrend(-0.5)).isEqualTo(TrendRegime.STRONG_DOWNTREND);
        }

        @Test
        void combinedRegimes() {
            assertThat(VolatilityTrendRegimeDetector.combine(VolatilityRegime.EXTREME, TrendRegime.WEAK_DOWNTREND))
                    .isEqualTo(MarketRegime.CRISIS);
            assertThat(VolatilityTrendRegimeDetector.combine(VolatilityRegime.HIGH, TrendRegime.STRONG_DOWNTREND))
                    .isEqualTo(MarketRegime.BEAR_HIGH_VOL);
            assertThat(VolatilityTrendRegimeDetector.combine(VolatilityRegime.EXTREME, TrendRegime.RANGING))
                    .isEqualTo(MarketRegime.RANGING_HIGH_VOL);
            assertThat(VolatilityTrendRegimeDetector.combine(VolatilityRegime.MEDIUM, TrendRegime.WEAK_UPTREND))
                    .isEqualTo(MarketRegime.BULL_LOW_VOL);
            assertThat(VolatilityTrendRegimeDetector.combine(VolatilityRegime.LOW, TrendRegime.WEAK_DOWNTREND))
                    .isEqualTo(MarketRegime.BEAR_LOW_VOL);
        }
    }
}
