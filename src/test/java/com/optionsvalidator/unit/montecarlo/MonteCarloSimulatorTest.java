package com.optionsvalidator.unit.montecarlo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionsvalidator.config.MonteCarloConfig;
import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.enums.SimulationMethod;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.domain.model.OptionLeg;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.exception.InsufficientDataException;
import com.optionsvalidator.montecarlo.FinalEquityDistribution;
import com.optionsvalidator.montecarlo.MetricDistribution;
import com.optionsvalidator.montecarlo.MonteCarloResult;
import com.optionsvalidator.montecarlo.MonteCarloSimulator;
import com.optionsvalidator.montecarlo.RandomSource;
import com.optionsvalidator.montecarlo.SignificanceCheck;
import com.optionsvalidator.montecarlo.StressScenario;
import com.optionsvalidator.montecarlo.TradeStatistics;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MonteCarloSimulator. Uses a seeded generator so every assertion on a
 * simulated distribution is deterministic.
 */
class MonteCarloSimulatorTest {

    private MonteCarloConfig config;
    private MonteCarloSimulator simulator;

    @BeforeEach
    void setUp() {
        config = new MonteCarloConfig();
        config.setRiskFreeRate(0.0);
        config.setSimulations(1000);
        simulator = new MonteCarloSimulator(config, RandomSource.seeded(42));
    }

    /** 60 returns with exactly mean 0.0006 and population std 0.0094 (Sharpe about 1.01). */
    private static List<Double> standardizedReturns() {
        int n = 60;
        double[] raw = new double[n];
        for (int i = 0; i < n; i++) {
            raw[i] = Math.sin(i * 2.3) + 0.3 * Math.cos(i * 0.7);
        }
        double mean = 0;
        for (double v : raw) {
            mean += v;
        }
        mean /= n;
        double var = 0;
        for (double v : raw) {
            var += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(var / n);

        List<Double> returns = new ArrayList<>(n);
        for (double v : raw) {
            returns.add(0.0006 + 0.0094 * (v - mean) / std);
        }
        return returns;
    }

    @Nested
    @DisplayName("Resampling methods")
    class Methods {

        @Test
        @DisplayName("Shuffling preserves the compounded total return and the Sharpe ratio")
        void shufflePreservesTotals() {
            List<Double> returns = standardizedReturns();

            MonteCarloResult result = simulator.simulateFromReturns(returns, 100_000, SimulationMethod.SHUFFLE);

            MetricDistribution total = result.getTotalReturn();
            assertThat(total.getMean()).isCloseTo(total.getOriginal(), within(1e-9));
            assertThat(total.getStd()).isLessThan(1e-9);
            assertThat(result.getSharpe().getMean()).isCloseTo(result.getSharpe().getOriginal(), within(1e-9));
            assertThat(result.getPathDependencyScore()).isLessThan(1e-6);
            assertThat(result.getProbabilityOfLoss()).isIn(0.0, 1.0);
        }

        @Test
        @DisplayName("Bootstrap on a Sharpe-1 series centres the simulated Sharpe near 1 with low ruin")
        void bootstrapEndToEnd() {
            MonteCarloResult result =
                    simulator.simulateFromReturns(standardizedReturns(), 100_000, SimulationMethod.BOOTSTRAP);

            assertThat(result.getSimulations()).isEqualTo(1000);
            assertThat(result.getObservations()).isEqualTo(60);
            assertThat(result.getSharpe().getOriginal()).isCloseTo(0.0006 / 0.0094 * Math.sqrt(252), within(1e-9));
            assertThat(result.getSharpe().getMean()).isCloseTo(1.01, within(0.3));
            assertThat(result.getProbabilityOfRuin()).isLessThan(0.05);
            assertThat(result.getSharpe().getLower95()).isLessThan(result.getSharpe().getMedian());
            assertThat(result.getSharpe().getUpper95()).isGreaterThan(result.getSharpe().getMedian());
            assertThat(result.getExpectedShortfall95()).isLessThanOrEqualTo(result.getVar95());
            assertThat(result.getVar95Dollars()).isCloseTo(result.getVar95() * 100_000, within(1e-6));
        }

        @Test
        @DisplayName("Parametric sampling of a zero-variance series is constant")
        void parametricConstantSeries() {
            List<Double> flat = Collections.nCopies(30, 0.001);

            MonteCarloResult result = simulator.simulateFromReturns(flat, 10_000, SimulationMethod.PARAMETRIC);

            assertThat(result.getTotalReturn().getStd()).isCloseTo(0.0, within(1e-12));
            assertThat(result.getProbabilityOfLoss()).isZero();
            assertThat(result.getMaxDrawdown().getMean()).isZero();
        }

        @Test
        @DisplayName("A seeded source reproduces the same distribution run after run")
        void reproducible() {
            MonteCarloResult first = simulator.simulateFromReturns(standardizedReturns(), 100_000);
            MonteCarloResult second = simulator.simulateFromReturns(standardizedReturns(), 100_000);

            assertThat(second.getSharpe().getMean()).isEqualTo(first.getSharpe().getMean());
            assertThat(second.getVar95()).isEqualTo(first.getVar95());
            assertThat(first.getMethod()).isEqualTo(SimulationMethod.BOOTSTRAP);
        }
    }

    @Nested
    @DisplayName("Inputs")
    class Inputs {

        @Test
        void tooFewObservations() {
            List<Double> returns = standardizedReturns().subList(0, 10);

            assertThatThrownBy(() -> simulator.simulateFromReturns(returns, 100_000))
                    .isInstanceOf(InsufficientDataException.class);
        }

        @Test
        @DisplayName("Non-finite returns are dropped before counting observations")
        void dropsNonFinite() {
            List<Double> returns = new ArrayList<>(standardizedReturns());
            returns.add(Double.NaN);
            returns.add(Double.POSITIVE_INFINITY);

            assertThat(simulator.simulateFromReturns(returns, 100_000).getObservations()).isEqualTo(60);
        }

        @Test
        @DisplayName("Equity curves are converted to returns and start from their first value")
        void equityCurve() {
            List<Double> curve = new ArrayList<>();
            double equity = 50_000;
            curve.add(equity);
            for (double r : standardizedReturns()) {
                equity *= 1 + r;
                curve.add(equity);
            }

            MonteCarloResult result = simulator.simulateFromEquityCurve(curve, SimulationMethod.SHUFFLE);

            assertThat(result.getInitialCapital()).isEqualTo(50_000);
            assertThat(result.getObservations()).isEqualTo(60);
            assertThat(result.getTotalReturn().getOriginal()).isCloseTo(equity / 50_000 - 1, within(1e-9));
        }

        @Test
        void emptyEquityCurve() {
            assertThatThrownBy(() -> simulator.simulateFromEquityCurve(List.of(), SimulationMethod.SHUFFLE))
                    .isInstanceOf(InsufficientDataException.class);
        }
    }

    @Nested
    @DisplayName("Stress testing")
    class Stress {

        @Test
        @DisplayName("Default scenarios run in order and harsher scenarios lose more often")
        void defaultScenarios() {
            Map<String, MonteCarloResult> results = simulator.stressTestScenarios(standardizedReturns(), 100_000);

            assertThat(results.keySet())
                    .containsExactly("base", "mild", "moderate", "severe", "historical_crisis", "flash_crash");
            assertThat(results.get("flash_crash").getProbabilityOfLoss())
                    .isGreaterThan(results.get("base").getProbabilityOfLoss());
            assertThat(results.get("severe").getScenario()).isEqualTo("severe");
        }

        @Test
        @DisplayName("Scenario stress shifts the mean and scales deviations around it")
        void scenarioApply() {
            StressScenario scenario = new StressScenario("test", -0.01, 2.0);

            double[] stressed = scenario.apply(new double[] {0.01, -0.01}, 0.0);

            assertThat(stressed[0]).isCloseTo(0.01, within(1e-12));
            assertThat(stressed[1]).isCloseTo(-0.03, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Significance")
    class Significance {

        private MonteCarloResult result(double probabilityOfLoss, double probabilityOfRuin, double medianSharpe) {
            MetricDistribution sharpe = MetricDistribution.builder().median(medianSharpe).build();
            return MonteCarloResult.builder()
                    .probabilityOfLoss(probabilityOfLoss)
                    .probabilityOfRuin(probabilityOfRuin)
                    .sharpe(sharpe)
                    .build();
        }

        @Test
        void passesAllThresholds() {
            SignificanceCheck check = simulator.isStatisticallySignificant(result(0.2, 0.01, 0.9), 0.6, 0.05, 0.5);

            assertThat(check.significant()).isTrue();
            assertThat(check.failures()).isEmpty();
        }

        @Test
        void reportsEveryFailedThreshold() {
            SignificanceCheck check = simulator.isStatisticallySignificant(result(0.5, 0.10, 0.2), 0.6, 0.05, 0.5);

            assertThat(check.significant()).isFalse();
            assertThat(check.failures())
                    .containsExactly(
                            "Profit probability 50.0% < 60%", "Ruin probability 10.0% > 5%", "Median Sharpe 0.20 < 0.50");
        }
    }

    @Nested
    @DisplayName("Trade-based simulation")
    class Trades {

        private static final LocalDate ENTRY = LocalDate.of(2024, 3, 1);

        /** 95/90 bull put spread for a 120 credit, no commission: 380 at risk. */
        private OptionsPosition spread(double shortExit, double longExit) {
            OptionsPosition position = OptionsPosition.open(
                    "SPY",
                    StrategyCategory.CREDIT_SPREAD,
                    List.of(
                            OptionLeg.builder()
                                    .optionType(OptionType.PUT)
                                    .strike(95)
                                    .expiration(ENTRY.plusDays(28))
                                    .quantity(-1)
                                    .premium(2.00)
                                    .build(),
                            OptionLeg.builder()
                                    .optionType(OptionType.PUT)
                                    .strike(90)
                                    .expiration(ENTRY.plusDays(28))
                                    .quantity(1)
                                    .premium(0.80)
                                    .build()),
                    ENTRY,
                    100.0);
            position.calculatePnl(List.of(shortExit, longExit), 0.0);
            return position;
        }

        private List<OptionsPosition> trades(int winners, int losers) {
            List<OptionsPosition> trades = new ArrayList<>();
            for (int i = 0; i < winners; i++) {
                trades.add(spread(0.0, 0.0));
            }
            for (int i = 0; i < losers; i++) {
                trades.add(spread(3.0, 1.0));
            }
            return trades;
        }

        @Test
        @DisplayName("Trade statistics use P&L over capital at risk")
        void tradeStatistics() {
            MonteCarloResult result = simulator.simulateFromTrades(trades(15, 5), 100_000);

            TradeStatistics stats = result.getTradeStatistics();
            assertThat(result.isTradeBased()).isTrue();
            assertThat(result.getMethod()).isEqualTo(SimulationMethod.BOOTSTRAP);
            assertThat(result.getObservations()).isEqualTo(20);
            assertThat(stats.getNumTrades()).isEqualTo(20);
            assertThat(stats.getWinRate()).isCloseTo(0.75, within(1e-12));
            assertThat(stats.getAvgWin()).isCloseTo(120.0 / 380.0, within(1e-12));
            assertThat(stats.getAvgLoss()).isCloseTo(-80.0 / 380.0, within(1e-12));
            assertThat(stats.getProfitFactor()).isCloseTo(4.5, within(1e-9));
            assertThat(stats.getMeanReturn()).isCloseTo((15 * 120.0 - 5 * 80.0) / 380.0 / 20, within(1e-12));
        }

        @Test
        @DisplayName("Identical winners compound to one final equity and always double")
        void identicalWinners() {
            MonteCarloResult result = simulator.simulateFromTrades(trades(20, 0), 100_000);

            double expected = 100_000 * Math.pow(1 + 120.0 / 380.0, 20);
            FinalEquityDistribution equity = result.getFinalEquity();
            assertThat(equity.getPercentile5()).isCloseTo(expected, within(1e-6));
            assertThat(equity.getPercentile95()).isCloseTo(expected, within(1e-6));
            assertThat(equity.getMin()).isCloseTo(equity.getMax(), within(1e-6));
            assertThat(result.getProbabilityOfProfit()).isEqualTo(1.0);
            assertThat(result.getProbabilityOfDoubling()).isEqualTo(1.0);
            assertThat(result.getProbabilityOfRuin()).isZero();
            assertThat(result.getTradeStatistics().getProfitFactor()).isInfinite();
        }

        @Test
        @DisplayName("Position size scales each trade and the path length is configurable")
        void positionSizeAndPathLength() {
            MonteCarloResult result = simulator.simulateFromTrades(trades(20, 0), 100_000, 40, 5.0);

            double expected = 100_000 * Math.pow(1 + 0.05 * 120.0 / 380.0, 40);
            assertThat(result.getFinalEquity().getMedian()).isCloseTo(expected, within(1e-6));
            assertThat(result.getProbabilityOfDoubling()).isZero();
        }

        @Test
        @DisplayName("Final equity percentiles are ordered and losers drive the ruin rate")
        void mixedTrades() {
            MonteCarloResult result = simulator.simulateFromTrades(trades(15, 5), 100_000);

            FinalEquityDistribution equity = result.getFinalEquity();
            assertThat(equity.getPercentile5()).isLessThanOrEqualTo(equity.getPercentile25());
            assertThat(equity.getPercentile25()).isLessThanOrEqualTo(equity.getMedian());
            assertThat(equity.getMedian()).isLessThanOrEqualTo(equity.getPercentile75());
            assertThat(equity.getPercentile75()).isLessThanOrEqualTo(equity.getPercentile95());
            assertThat(result.getProbabilityOfProfit()).isGreaterThan(0.9);
            // a single 21% loser already breaches the 20% drawdown threshold
            assertThat(result.getProbabilityOfRuin()).isGreaterThan(0.9);
        }

        @Test
        @DisplayName("Too few closed trades is insufficient data")
        void tooFewTrades() {
            assertThatThrownBy(() -> simulator.simulateFromTrades(trades(3, 2), 100_000))
                    .isInstanceOf(InsufficientDataException.class);
        }

        @Test
        @DisplayName("Open positions are ignored")
        void openPositionsIgnored() {
            OptionsPosition open = OptionsPosition.open(
                    "SPY",
                    StrategyCategory.CASH_SECURED_PUT,
                    List.of(OptionLeg.builder()
                            .optionType(OptionType.PUT)
                            .strike(95)
                            .expiration(ENTRY.plusDays(28))
                            .quantity(-1)
                            .premium(2.0)
                            .build()),
                    ENTRY,
                    100.0);

            assertThatThrownBy(() -> simulator.simulateFromTrades(List.of(open), 100_000))
                    .isInstanceOf(InsufficientDataException.class);
        }

        @Test
        @DisplayName("Position size outside (0, 100] is rejected")
        void invalidPositionSize() {
            assertThatThrownBy(() -> simulator.simulateFromTrades(trades(20, 0), 100_000, 0, 0.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> simulator.simulateFromTrades(trades(20, 0), 100_000, 0, 150.0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
