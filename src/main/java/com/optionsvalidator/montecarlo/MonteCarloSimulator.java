package com.optionsvalidator.montecarlo;

import com.optionsvalidator.config.MonteCarloConfig;
import com.optionsvalidator.core.stats.ReturnStatistics;
import com.optionsvalidator.domain.enums.SimulationMethod;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.exception.InsufficientDataException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Monte Carlo robustness test for a daily return series or a list of closed trades.
 *
 * <p>Each trial rebuilds the series with one {@link SimulationMethod} and recomputes Sharpe,
 * compounded total return and max drawdown. The trial distributions are compared with
 * the observed values to separate skill from luck:
 * <ul>
 *   <li>probability of loss and of ruin (drawdown above the configured threshold)
 *   <li>VaR-95 / expected shortfall of total return
 *   <li>path dependency: how far the observed Sharpe sits from the simulated mean,
 *       relative to the simulated 95% band
 * </ul>
 *
 * <p>Trials are independent and drawn from a fresh generator per run, so a seeded
 * {@link RandomSource} makes every run reproducible.
 */
@Service
public class MonteCarloSimulator {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloSimulator.class);

    private static final double MIN_BAND_WIDTH = 0.1;
    private static final double FULL_POSITION_PCT = 100.0;

    private final MonteCarloConfig config;
    private final RandomSource randomSource;

    public MonteCarloSimulator(MonteCarloConfig config, RandomSource randomSource) {
        this.config = config;
        this.randomSource = randomSource;
    }

    public MonteCarloResult simulateFromReturns(List<Double> dailyReturns, double initialCapital) {
        return simulateFromReturns(dailyReturns, initialCapital, config.getDefaultMethod());
    }

    /**
     * Simulates alternative histories of {@code dailyReturns}. Non-finite values are dropped.
     *
     * @throws InsufficientDataException if fewer than the minimum observations remain
     */
    public MonteCarloResult simulateFromReturns(
            List<Double> dailyReturns, double initialCapital, SimulationMethod method) {
        double[] returns = requireObservations(ReturnStatistics.finite(dailyReturns));
        return simulate(returns, initialCapital, method, "base");
    }

    /**
     * Converts a portfolio value series to period returns and simulates those, using the
     * first value as starting capital.
     */
    public MonteCarloResult simulateFromEquityCurve(List<Double> equityCurve, SimulationMethod method) {
        if (equityCurve.isEmpty()) {
            throw new InsufficientDataException("equity curve", config.getMinObservations() + 1, 0);
        }
        double[] returns = ReturnStatistics.returnsFromValues(equityCurve);
        List<Double> boxed = new ArrayList<>(returns.length);
        for (double r : returns) {
            boxed.add(r);
        }
        return simulateFromReturns(boxed, equityCurve.get(0), method);
    }

    public MonteCarloResult simulateFromTrades(List<OptionsPosition> trades, double initialCapital) {
        return simulateFromTrades(trades, initialCapital, 0, FULL_POSITION_PCT);
    }

    /**
     * Bootstraps per-trade returns of closed positions into {@code tradesPerPath}-trade
     * equity paths. Each trade compounds {@code positionSizePct} percent of current equity
     * at the trade's return on capital at risk.
     *
     * <p>Sharpe is annualized from per-trade returns without a risk-free deduction.
     *
     * @param tradesPerPath trades per simulated path, 0 for the observed trade count
     * @throws InsufficientDataException if fewer than the minimum trades are usable
     */
    public MonteCarloResult simulateFromTrades(
            List<OptionsPosition> trades, double initialCapital, int tradesPerPath, double positionSizePct) {
        if (positionSizePct <= 0 || positionSizePct > FULL_POSITION_PCT) {
            throw new IllegalArgumentException("Position size must be in (0, 100] percent, got " + positionSizePct);
        }
        if (tradesPerPath < 0) {
            throw new IllegalArgumentException("Trades per path must not be negative, got " + tradesPerPath);
        }
        TradeStatistics stats = TradeStatistics.fromPositions(trades);
        if (stats.getNumTrades() < config.getMinTrades()) {
            throw new InsufficientDataException("trade Monte Carlo simulation", config.getMinTrades(), stats.getNumTrades());
        }

        double fraction = positionSizePct / FULL_POSITION_PCT;
        double[] sized = Arrays.stream(stats.getReturns()).map(r -> r * fraction).toArray();
        int pathLength = tradesPerPath == 0 ? sized.length : tradesPerPath;

        MonteCarloResult result = simulate(sized, pathLength, 0.0, initialCapital, SimulationMethod.BOOTSTRAP, "trades")
                .tradeStatistics(stats)
                .build();
        log.info(
                "Trade Monte Carlo: {} trades, win rate {}, P(profit)={}, P(double)={}, P(ruin)={}",
                stats.getNumTrades(),
                String.format("%.1f%%", stats.getWinRate() * 100),
                String.format("%.3f", result.getProbabilityOfProfit()),
                String.format("%.3f", result.getProbabilityOfDoubling()),
                String.format("%.3f", result.getProbabilityOfRuin()));
        return result;
    }

    public Map<String, MonteCarloResult> stressTestScenarios(List<Double> dailyReturns, double initialCapital) {
        return stressTestScenarios(dailyReturns, initialCapital, StressScenario.defaults(), config.getDefaultMethod());
    }

    /**
     * Runs a full simulation per scenario on the stressed series, re-centered on the
     * original mean and scaled around it.
     *
     * @return results keyed by scenario name, in scenario order
     */
    public Map<String, MonteCarloResult> stressTestScenarios(
            List<Double> dailyReturns, double initialCapital, List<StressScenario> scenarios, SimulationMethod method) {
        double[] returns = requireObservations(ReturnStatistics.finite(dailyReturns));
        double mean = ReturnStatistics.mean(returns);

        Map<String, MonteCarloResult> results = new LinkedHashMap<>();
        for (StressScenario scenario : scenarios) {
            MonteCarloResult result = simulate(scenario.apply(returns, mean), initialCapital, method, scenario.name());
            results.put(scenario.name(), result);
            log.info(
                    "Stress scenario {}: P(loss)={}, P(ruin)={}, mean sharpe={}",
                    scenario.name(),
                    String.format("%.3f", result.getProbabilityOfLoss()),
                    String.format("%.3f", result.getProbabilityOfRuin()),
                    String.format("%.2f", result.getSharpe().getMean()));
        }
        return results;
    }

    /**
     * Significance test: profit probability, ruin probability and median simulated Sharpe
     * must each clear their threshold.
     */
    public SignificanceCheck isStatisticallySignificant(
            MonteCarloResult result, double minProfitProbability, double maxRuinProbability, double minMedianSharpe) {
        List<String> failures = new ArrayList<>();
        if (result.getProbabilityOfProfit() < minProfitProbability) {
            failures.add(String.format(
                    "Profit probability %.1f%% < %.0f%%",
                    result.getProbabilityOfProfit() * 100, minProfitProbability * 100));
        }
        if (result.getProbabilityOfRuin() > maxRuinProbability) {
            failures.add(String.format(
                    "Ruin probability %.1f%% > %.0f%%", result.getProbabilityOfRuin() * 100, maxRuinProbability * 100));
        }
        if (result.getSharpe().getMedian() < minMedianSharpe) {
            failures.add(String.format(
                    "Median Sharpe %.2f < %.2f", result.getSharpe().getMedian(), minMedianSharpe));
        }
        return new SignificanceCheck(failures.isEmpty(), List.copyOf(failures));
    }

    // ==================== Simulation ====================

    private MonteCarloResult simulate(double[] returns, double initialCapital, SimulationMethod method, String scenario) {
        return simulate(returns, returns.length, config.getRiskFreeRate(), initialCapital, method, scenario)
                .build();
    }

    /**
     * Core trial loop. Each trial is a path of {@code pathLength} returns; shuffling needs
     * the path to be as long as the input.
     */
    private MonteCarloResult.MonteCarloResultBuilder simulate(
            double[] returns,
            int pathLength,
            double rf,
            double initialCapital,
            SimulationMethod method,
            String scenario) {
        if (method == SimulationMethod.SHUFFLE && pathLength != returns.length) {
            throw new IllegalArgumentException("Shuffle keeps the observed length of " + returns.length
                    + ", cannot build paths of " + pathLength);
        }
        int trials = config.getSimulations();
        RandomGenerator rng = randomSource.newGenerator();

        double originalSharpe = ReturnStatistics.sharpe(returns, rf);
        double originalReturn = ReturnStatistics.totalReturn(returns);
        double originalDrawdown = ReturnStatistics.maxDrawdown(returns);

        double mean = ReturnStatistics.mean(returns);
        double std = ReturnStatistics.populationStd(returns);
        NormalDistribution normal = std > 0 ? new NormalDistribution(rng, mean, std) : null;

        double[] sharpes = new double[trials];
        double[] totalReturns = new double[trials];
        double[] drawdowns = new double[trials];
        double[] finalEquities = new double[trials];
        double[] trial = new double[pathLength];

        for (int t = 0; t < trials; t++) {
            switch (method) {
                case SHUFFLE -> shuffle(returns, trial, rng);
                case BOOTSTRAP -> bootstrap(returns, trial, rng);
                case PARAMETRIC -> parametric(trial, mean, normal);
                default -> throw new IllegalArgumentException("Unsupported simulation method: " + method);
            }
            sharpes[t] = ReturnStatistics.sharpe(trial, rf);
            totalReturns[t] = ReturnStatistics.totalReturn(trial);
            drawdowns[t] = ReturnStatistics.maxDrawdown(trial);
            finalEquities[t] = initialCapital * (1.0 + totalReturns[t]);
        }

        MetricDistribution sharpeDist = distribution(originalSharpe, sharpes, 97.5);
        MetricDistribution returnDist = distribution(originalReturn, totalReturns, 97.5);
        MetricDistribution drawdownDist = distribution(originalDrawdown, drawdowns, 95.0);

        double ruinThreshold = config.getRuinThreshold();
        double probabilityOfLoss = fraction(totalReturns, r -> r < 0);
        double probabilityOfRuin = fraction(drawdowns, dd -> dd > ruinThreshold);
        double probabilityOfDoubling = fraction(totalReturns, r -> r > 1.0);
        double var95 = ReturnStatistics.percentile(totalReturns, 5.0);
        double expectedShortfall = ReturnStatistics.tailMean(totalReturns, var95);

        double pathDependency = Math.min(
                1.0,
                Math.abs(originalSharpe - sharpeDist.getMean()) / Math.max(sharpeDist.bandWidth(), MIN_BAND_WIDTH));

        log.debug(
                "Monte Carlo [{} / {}]: {} trials on {} obs, sharpe {} vs mean {}, P(loss)={}, P(ruin)={}",
                scenario,
                method,
                trials,
                returns.length,
                originalSharpe,
                sharpeDist.getMean(),
                probabilityOfLoss,
                probabilityOfRuin);

        return MonteCarloResult.builder()
                .scenario(scenario)
                .method(method)
                .simulations(trials)
                .observations(returns.length)
                .initialCapital(initialCapital)
                .sharpe(sharpeDist)
                .totalReturn(returnDist)
                .maxDrawdown(drawdownDist)
                .probabilityOfLoss(probabilityOfLoss)
                .probabilityOfRuin(probabilityOfRuin)
                .ruinThreshold(ruinThreshold)
                .var95(var95)
                .expectedShortfall95(expectedShortfall)
                .pathDependencyScore(pathDependency)
                .finalEquity(FinalEquityDistribution.of(finalEquities))
                .probabilityOfDoubling(probabilityOfDoubling);
    }

    /** Fisher-Yates permutation of {@code source} into {@code target}. */
    private static void shuffle(double[] source, double[] target, RandomGenerator rng) {
        System.arraycopy(source, 0, target, 0, source.length);
        for (int i = target.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            double tmp = target[i];
            target[i] = target[j];
            target[j] = tmp;
        }
    }

    private static void bootstrap(double[] source, double[] target, RandomGenerator rng) {
        for (int i = 0; i < target.length; i++) {
            target[i] = source[rng.nextInt(source.length)];
        }
    }

    private static void parametric(double[] target, double mean, NormalDistribution normal) {
        for (int i = 0; i < target.length; i++) {
            // Zero-variance input degenerates to a constant series
            target[i] = normal != null ? normal.sample() : mean;
        }
    }

    private static MetricDistribution distribution(double original, double[] simulated, double upperPercentile) {
        return MetricDistribution.builder()
                .original(original)
                .mean(ReturnStatistics.mean(simulated))
                .std(ReturnStatistics.populationStd(simulated))
                .median(ReturnStatistics.median(simulated))
                .lower95(ReturnStatistics.percentile(simulated, 2.5))
                .upper95(ReturnStatistics.percentile(simulated, upperPercentile))
                .build();
    }

    private static double fraction(double[] values, DoublePredicate predicate) {
        int count = 0;
        for (double v : values) {
            if (predicate.test(v)) {
                count++;
            }
        }
        return values.length == 0 ? 0.0 : (double) count / values.length;
    }

    private double[] requireObservations(double[] returns) {
        if (returns.length < config.getMinObservations()) {
            throw new InsufficientDataException("Monte Carlo simulation", config.getMinObservations(), returns.length);
        }
        return returns;
    }
}
