package com.optionsvalidator.backtest;

import com.optionsvalidator.core.stats.ReturnStatistics;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.domain.model.OptionsPosition;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reduces a backtest's closed positions and equity curve into {@link BacktestMetrics}.
 *
 * <p>Calculates: total return and CAGR, Sharpe and Sortino on equity-curve returns,
 * max/average drawdown, Calmar ratio, win rate, profit factor, win/loss averages and
 * extremes, holding days, commissions, average net Greeks and a per-category breakdown.
 *
 * <p>A run with no closed positions yields {@link BacktestMetrics#empty} instead of
 * failing, so an idle strategy produces an all-zero report.
 */
@Component
public class BacktestMetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(BacktestMetricsCalculator.class);

    public BacktestMetrics calculate(
            List<OptionsPosition> closedPositions,
            List<EquityPoint> equityCurve,
            double initialCapital,
            double riskFreeRate,
            LocalDate startDate,
            LocalDate endDate) {

        if (closedPositions.isEmpty()) {
            log.warn("No closed positions between {} and {}, returning empty metrics", startDate, endDate);
            return BacktestMetrics.empty(startDate, endDate);
        }

        int totalTrades = closedPositions.size();
        double[] wins = closedPositions.stream()
                .mapToDouble(OptionsPosition::getPnl)
                .filter(pnl -> pnl > 0)
                .toArray();
        double[] losses = closedPositions.stream()
                .mapToDouble(OptionsPosition::getPnl)
                .filter(pnl -> pnl < 0)
                .map(Math::abs)
                .toArray();

        double totalPnl = closedPositions.stream().mapToDouble(OptionsPosition::getPnl).sum();
        double grossProfit = sum(wins);
        double grossLoss = sum(losses);

        double winRate = (double) wins.length / totalTrades * 100.0;
        // Profit factor is reported as 0 when there are no losing trades
        double profitFactor = grossLoss > 0 ? grossProfit / grossLoss : 0.0;

        // ==================== Returns ====================

        double finalCapital = initialCapital + totalPnl;
        double totalReturn = totalPnl / initialCapital * 100.0;
        double years = ChronoUnit.DAYS.between(startDate, endDate) / 365.25;
        double cagr = 0.0;
        if (years > 0 && finalCapital > 0) {
            cagr = (Math.pow(finalCapital / initialCapital, 1.0 / years) - 1.0) * 100.0;
        }

        List<Double> equityValues =
                equityCurve.stream().map(EquityPoint::equity).collect(Collectors.toList());
        double[] dailyReturns = ReturnStatistics.finite(ReturnStatistics.returnsFromValues(equityValues));
        double avgDailyReturn = ReturnStatistics.mean(dailyReturns);

        // ==================== Risk ====================

        double sharpe = ReturnStatistics.sharpe(dailyReturns, riskFreeRate);
        double sortino = sortino(dailyReturns, avgDailyReturn, riskFreeRate);

        double[] drawdowns = drawdowns(equityValues);
        double maxDrawdown = 0.0;
        double negativeSum = 0.0;
        int negativeCount = 0;
        for (double dd : drawdowns) {
            maxDrawdown = Math.max(maxDrawdown, -dd);
            if (dd < 0) {
                negativeSum += dd;
                negativeCount++;
            }
        }
        maxDrawdown *= 100.0;
        double avgDrawdown = negativeCount > 0 ? Math.abs(negativeSum / negativeCount) * 100.0 : 0.0;
        double calmar = maxDrawdown > 0 ? Math.abs(cagr / maxDrawdown) : 0.0;

        // ==================== Options ====================

        double avgDaysInTrade = closedPositions.stream()
                .mapToLong(OptionsPosition::daysInTrade)
                .average()
                .orElse(0);
        double totalCommissions = closedPositions.stream()
                .mapToDouble(OptionsPosition::getTotalCommission)
                .sum();
        double commissionPct = grossProfit > 0 ? totalCommissions / grossProfit * 100.0 : 0.0;

        BacktestMetrics metrics = BacktestMetrics.builder()
                .startDate(startDate)
                .endDate(endDate)
                .tradingDays(Math.max(0, equityCurve.size() - 1))
                .totalReturn(totalReturn)
                .cagr(cagr)
                .avgDailyReturn(avgDailyReturn)
                .sharpeRatio(sharpe)
                .sortinoRatio(sortino)
                .maxDrawdown(maxDrawdown)
                .avgDrawdown(avgDrawdown)
                .calmarRatio(calmar)
                .totalTrades(totalTrades)
                .winningTrades(wins.length)
                .losingTrades(losses.length)
                .winRate(winRate)
                .profitFactor(profitFactor)
                .avgWin(ReturnStatistics.mean(wins))
                .avgLoss(ReturnStatistics.mean(losses))
                .avgTrade(totalPnl / totalTrades)
                .largestWin(max(wins))
                .largestLoss(max(losses))
                .avgDaysInTrade(avgDaysInTrade)
                .totalCommissions(totalCommissions)
                .commissionPct(commissionPct)
                .avgDeltaExposure(averageGreek(closedPositions, p -> p.getNetGreeks().getDelta()))
                .avgGammaExposure(averageGreek(closedPositions, p -> p.getNetGreeks().getGamma()))
                .avgThetaIncome(averageGreek(closedPositions, p -> p.getNetGreeks().getTheta()))
                .avgVegaExposure(averageGreek(closedPositions, p -> p.getNetGreeks().getVega()))
                .strategyBreakdown(breakdown(closedPositions))
                .build();

        log.debug(
                "Metrics: {} trades, {}% win rate, PF={}, sharpe={}, maxDD={}%",
                totalTrades, winRate, profitFactor, sharpe, maxDrawdown);
        return metrics;
    }

    /** Sortino uses the population std of the negative daily returns; needs at least two. */
    private double sortino(double[] dailyReturns, double avgDailyReturn, double riskFreeRate) {
        double[] negative = Arrays.stream(dailyReturns).filter(r -> r < 0).toArray();
        if (negative.length < 2) {
            return 0.0;
        }
        double downsideStd = ReturnStatistics.populationStd(negative);
        if (downsideStd <= 0) {
            return 0.0;
        }
        return (avgDailyReturn - riskFreeRate / ReturnStatistics.TRADING_DAYS_PER_YEAR)
                / downsideStd
                * Math.sqrt(ReturnStatistics.TRADING_DAYS_PER_YEAR);
    }

    /** (equity - running max) / running max for each point; values are &lt;= 0. */
    private double[] drawdowns(List<Double> equity) {
        double[] out = new double[equity.size()];
        double runningMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < equity.size(); i++) {
            double value = equity.get(i);
            runningMax = Math.max(runningMax, value);
            out[i] = runningMax > 0 ? (value - runningMax) / runningMax : 0.0;
        }
        return out;
    }

    private Map<String, StrategyBreakdown> breakdown(List<OptionsPosition> positions) {
        Map<StrategyCategory, List<OptionsPosition>> byCategory = new EnumMap<>(StrategyCategory.class);
        for (OptionsPosition position : positions) {
            byCategory.computeIfAbsent(position.getCategory(), c -> new ArrayList<>()).add(position);
        }

        Map<String, StrategyBreakdown> result = new LinkedHashMap<>();
        byCategory.forEach((category, group) -> {
            double pnl = group.stream().mapToDouble(OptionsPosition::getPnl).sum();
            long winners = group.stream().filter(p -> p.getPnl() > 0).count();
            result.put(
                    category.getLabel(),
                    StrategyBreakdown.builder()
                            .trades(group.size())
                            .pnl(pnl)
                            .winRate((double) winners / group.size() * 100.0)
                            .avgPnl(pnl / group.size())
                            .build());
        });
        return result;
    }

    private double averageGreek(
            List<OptionsPosition> positions, ToDoubleFunction<OptionsPosition> greek) {
        return positions.stream().mapToDouble(greek).average().orElse(0);
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    private static double max(double[] values) {
        double max = 0.0;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }
}
