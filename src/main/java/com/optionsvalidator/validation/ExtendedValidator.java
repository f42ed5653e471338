package com.optionsvalidator.validation;

import com.optionsvalidator.backtest.BacktestMetrics;
import com.optionsvalidator.backtest.BacktestOutcome;
import com.optionsvalidator.backtest.OptionsBacktestEngine;
import com.optionsvalidator.backtest.OptionsBacktestEngineFactory;
import com.optionsvalidator.backtest.StrategyFunction;
import com.optionsvalidator.domain.model.PriceHistory;
import com.optionsvalidator.exception.InsufficientDataException;
import com.optionsvalidator.montecarlo.MonteCarloResult;
import com.optionsvalidator.montecarlo.MonteCarloSimulator;
import com.optionsvalidator.montecarlo.SignificanceCheck;
import com.optionsvalidator.risk.VaRCalculator;
import com.optionsvalidator.risk.VaRResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a strategy through every validation stage and produces a go/no-go verdict.
 *
 * <p>Stages: backtest thresholds, Monte Carlo significance and path dependency of the
 * bootstrapped closed trades, 95% VaR of the equity-curve daily returns,
 * transaction-cost drag and cost-adjusted Sharpe, and the current market regime.
 *
 * <p>Scores (each 0-100):
 * <ul>
 *   <li>backtest: min(1, sharpe/2)*40 + min(1, winRate/0.6)*30 + max(0, 1 - dd/0.3)*30
 *   <li>Monte Carlo: (1 - P(loss))*50 + max(0, 1 - 10*P(ruin))*30 + max(0, 1 - dd95/0.5)*20
 *   <li>cost/regime: min(1, max(0, costAdjSharpe/1.5))*50 + regimeScale*50
 * </ul>
 * The overall score is the equal-weight mean of the scores that could be computed.
 * A strategy passes only with no failures, a valid Monte Carlo run, and an overall score
 * at or above the configured minimum.
 */
@Service
public class ExtendedValidator {

    private static final Logger log = LoggerFactory.getLogger(ExtendedValidator.class);

    private static final double TARGET_SHARPE = 2.0;
    private static final double TARGET_WIN_RATE = 0.6;
    private static final double DRAWDOWN_CEILING = 0.3;
    private static final double MC_DRAWDOWN_CEILING = 0.5;
    private static final double TARGET_COST_ADJUSTED_SHARPE = 1.5;

    private final OptionsBacktestEngineFactory engineFactory;
    private final MonteCarloSimulator monteCarloSimulator;
    private final VaRCalculator varCalculator;
    private final TransactionCostModel costModel;
    private final RegimeDetector regimeDetector;
    private final ValidationCriteria defaultCriteria;

    public ExtendedValidator(
            OptionsBacktestEngineFactory engineFactory,
            MonteCarloSimulator monteCarloSimulator,
            VaRCalculator varCalculator,
            TransactionCostModel costModel,
            RegimeDetector regimeDetector,
            ValidationCriteria defaultCriteria) {
        this.engineFactory = engineFactory;
        this.monteCarloSimulator = monteCarloSimulator;
        this.varCalculator = varCalculator;
        this.costModel = costModel;
        this.regimeDetector = regimeDetector;
        this.defaultCriteria = defaultCriteria;
    }

    /**
     * Backtests {@code strategy} over the period, then validates the outcome. The regime is
     * detected on the first symbol's history up to {@code end}.
     */
    public ValidationResult validate(
            StrategyFunction strategy, List<String> symbols, LocalDate start, LocalDate end, int tradeFrequencyDays) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        log.info("Starting extended validation: symbols={}, {} to {}", symbols, start, end);

        OptionsBacktestEngine engine = engineFactory.create(start, end);
        BacktestOutcome outcome = engine.runBacktest(strategy, symbols, tradeFrequencyDays);

        PriceHistory regimeSeries = outcome.getPriceHistories().get(symbols.get(0));
        return validate(outcome, regimeSeries == null ? null : regimeSeries.upTo(end), defaultCriteria);
    }

    public ValidationResult validate(BacktestOutcome outcome, PriceHistory regimeSeries) {
        return validate(outcome, regimeSeries, defaultCriteria);
    }

    public ValidationResult validate(BacktestOutcome outcome, PriceHistory regimeSeries, ValidationCriteria criteria) {
        Objects.requireNonNull(outcome, "outcome");
        List<String> failures = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        BacktestMetrics metrics = outcome.getMetrics();

        // ==================== Backtest ====================

        failures.addAll(checkBacktest(metrics, criteria));

        // ==================== Monte Carlo ====================

        List<Double> returns = Arrays.stream(outcome.dailyReturns()).boxed().toList();
        MonteCarloResult mcResult = null;
        boolean mcValid = false;
        List<String> mcFailures = new ArrayList<>();
        if (!outcome.getClosedPositions().isEmpty()) {
            try {
                mcResult = monteCarloSimulator.simulateFromTrades(
                        outcome.getClosedPositions(), outcome.getInitialCapital());
                SignificanceCheck check = monteCarloSimulator.isStatisticallySignificant(
                        mcResult,
                        criteria.getMinProfitProbability(),
                        criteria.getMaxRuinProbability(),
                        criteria.getMinMedianSharpe());
                mcFailures.addAll(check.failures());
                if (mcResult.getPathDependencyScore() > criteria.getMaxPathDependency()) {
                    mcFailures.add(String.format(
                            "Path dependency %.2f > %.2f",
                            mcResult.getPathDependencyScore(), criteria.getMaxPathDependency()));
                }
                mcValid = mcFailures.isEmpty();
            } catch (InsufficientDataException e) {
                log.warn("Monte Carlo skipped: {}", e.getMessage());
                mcFailures.add("Monte Carlo simulation failed: " + e.getMessage());
            }
        } else {
            mcFailures.add("Monte Carlo simulation failed: no closed trades");
        }
        failures.addAll(mcFailures);
        if (!mcValid) {
            recommendations.add("Monte Carlo failed: Consider reviewing trade quality");
        }

        // ==================== VaR ====================

        VaRResult varResult = null;
        double finalEquity = outcome.getInitialCapital() + outcome.totalPnl();
        try {
            varResult = varCalculator.calculateVar(returns, finalEquity);
            if (varResult.isSufficientData() && varResult.getVar95LossPct() > criteria.getMaxVar95Pct()) {
                failures.add(String.format(
                        "VaR 95%% %.2f%% > %.1f%%", varResult.getVar95LossPct(), criteria.getMaxVar95Pct()));
                recommendations.add("Daily VaR above limit: Reduce position size per trade");
            }
        } catch (InsufficientDataException e) {
            log.debug("VaR check skipped: {}", e.getMessage());
        }

        // ==================== Costs ====================

        double sharpe = metrics.getSharpeRatio();
        double grossReturn = metrics.getTotalReturn();
        double netReturn = grossReturn;
        double totalCosts = 0.0;
        double costDrag = 0.0;
        double costAdjustedSharpe = sharpe;
        if (!outcome.getClosedPositions().isEmpty()) {
            List<CostAdjustedTrade> adjusted = costModel.adjustReturns(outcome.getClosedPositions());
            totalCosts = adjusted.stream().mapToDouble(CostAdjustedTrade::transactionCosts).sum();
            double grossPnl = adjusted.stream().mapToDouble(CostAdjustedTrade::originalPnl).sum();
            double netPnl = adjusted.stream().mapToDouble(CostAdjustedTrade::adjustedPnl).sum();

            costDrag = grossPnl != 0 ? totalCosts / Math.abs(grossPnl) * 100.0 : 0.0;
            netReturn = netPnl / outcome.getInitialCapital() * 100.0;
            if (sharpe > 0) {
                costAdjustedSharpe = sharpe * (1 - costDrag / 100.0);
            }

            if (costDrag > criteria.getMaxCostDragPct()) {
                failures.add(String.format("Cost drag %.1f%% > %.0f%%", costDrag, criteria.getMaxCostDragPct()));
                recommendations.add("High transaction costs: Consider fewer trades or larger positions");
            }
            if (costAdjustedSharpe < criteria.getMinCostAdjustedSharpe()) {
                failures.add(String.format(
                        "Cost-adjusted Sharpe %.2f < %.2f", costAdjustedSharpe, criteria.getMinCostAdjustedSharpe()));
            }
        }

        // ==================== Regime ====================

        RegimeState regime = null;
        double regimeScale = 1.0;
        if (regimeSeries != null && !regimeSeries.isEmpty()) {
            regime = regimeDetector.detectRegime(regimeSeries);
            regimeScale = regime.getRecommendedPositionScale();
            if (regimeScale < 0.5) {
                recommendations.add("Current regime (" + regime.getMarketRegime().name().toLowerCase()
                        + ") suggests reduced position sizes");
            }
        }

        // ==================== Score and verdict ====================

        double backtestScore = backtestScore(metrics);
        Double mcScore = mcResult == null ? null : monteCarloScore(mcResult);
        double miscScore = costRegimeScore(costAdjustedSharpe, regimeScale);
        double overall = mcScore == null
                ? (backtestScore + miscScore) / 2
                : (backtestScore + mcScore + miscScore) / 3;
        overall = clamp(overall, 0, 100);

        boolean valid = failures.isEmpty() && overall >= criteria.getMinOverallScore() && mcValid;
        String summary = valid
                ? String.format("PASS: Strategy validated for live trading (Score: %.0f/100)", overall)
                : String.format(
                        "FAIL: Strategy not ready for live trading (Score: %.0f/100, %d issues)",
                        overall, failures.size());

        log.info(summary);
        if (!failures.isEmpty()) {
            log.info("Validation failures: {}", String.join("; ", failures));
        }

        return ValidationResult.builder()
                .backtestMetrics(metrics)
                .monteCarloResult(mcResult)
                .monteCarloValid(mcValid)
                .monteCarloFailures(List.copyOf(mcFailures))
                .varResult(varResult)
                .grossReturn(grossReturn)
                .netReturn(netReturn)
                .totalCosts(totalCosts)
                .costDragPct(costDrag)
                .costAdjustedSharpe(costAdjustedSharpe)
                .regimeState(regime)
                .regimeAdjustedScore(regimeScale)
                .backtestScore(backtestScore)
                .monteCarloScore(mcScore)
                .costRegimeScore(miscScore)
                .overallScore(overall)
                .validForLiveTrading(valid)
                .summary(summary)
                .failures(List.copyOf(failures))
                .recommendations(List.copyOf(recommendations))
                .build();
    }

    // ==================== Checks ====================

    /** Metrics carry win rate and drawdown in percent; criteria carry fractions. */
    private List<String> checkBacktest(BacktestMetrics metrics, ValidationCriteria criteria) {
        List<String> failures = new ArrayList<>();
        double drawdown = metrics.getMaxDrawdown() / 100.0;
        double winRate = metrics.getWinRate() / 100.0;

        if (metrics.getSharpeRatio() < criteria.getMinSharpe()) {
            failures.add(String.format("Sharpe %.2f < %.1f", metrics.getSharpeRatio(), criteria.getMinSharpe()));
        }
        if (drawdown > criteria.getMaxDrawdown()) {
            failures.add(String.format(
                    "Drawdown %.1f%% > %.0f%%", drawdown * 100, criteria.getMaxDrawdown() * 100));
        }
        if (winRate < criteria.getMinWinRate()) {
            failures.add(String.format("Win rate %.1f%% < %.0f%%", winRate * 100, criteria.getMinWinRate() * 100));
        }
        if (metrics.getTotalTrades() < criteria.getMinTrades()) {
            failures.add(String.format(
                    "Only %d trades < %d minimum", metrics.getTotalTrades(), criteria.getMinTrades()));
        }
        return failures;
    }

    // ==================== Scores ====================

    public static double backtestScore(BacktestMetrics metrics) {
        double drawdown = metrics.getMaxDrawdown() / 100.0;
        double winRate = metrics.getWinRate() / 100.0;
        double score = Math.min(1, metrics.getSharpeRatio() / TARGET_SHARPE) * 40
                + Math.min(1, winRate / TARGET_WIN_RATE) * 30
                + Math.max(0, 1 - drawdown / DRAWDOWN_CEILING) * 30;
        return clamp(score, 0, 100);
    }

    public static double monteCarloScore(MonteCarloResult result) {
        double score = (1 - result.getProbabilityOfLoss()) * 50
                + Math.max(0, 1 - result.getProbabilityOfRuin() * 10) * 30
                + Math.max(0, 1 - result.getDrawdown95Upper() / MC_DRAWDOWN_CEILING) * 20;
        return clamp(score, 0, 100);
    }

    public static double costRegimeScore(double costAdjustedSharpe, double regimeScale) {
        double sharpeComponent = clamp(costAdjustedSharpe / TARGET_COST_ADJUSTED_SHARPE, 0, 1);
        return clamp(sharpeComponent * 50 + regimeScale * 50, 0, 100);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
