package com.optionsvalidator.backtest;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of one completed backtest run. Immutable.
 *
 * <p>Units: returns, drawdowns, win rate and commission share are percentages
 * (12.5 = 12.5%); {@code avgDailyReturn} is a fraction; money fields are dollars;
 * ratios (Sharpe, Sortino, Calmar, profit factor) are dimensionless. Losses
 * ({@code avgLoss}, {@code largestLoss}) are reported as positive dollar amounts.
 */
@Getter
@Builder
@ToString
public class BacktestMetrics {

    // ==================== Period ====================

    private final LocalDate startDate;
    private final LocalDate endDate;

    /** Number of evaluation dates sampled into the equity curve. */
    private final int tradingDays;

    // ==================== Returns ====================

    private final double totalReturn;
    private final double cagr;
    private final double avgDailyReturn;

    // ==================== Risk ====================

    private final double sharpeRatio;
    private final double sortinoRatio;
    private final double maxDrawdown;
    private final double avgDrawdown;
    private final double calmarRatio;

    // ==================== Trades ====================

    private final int totalTrades;
    private final int winningTrades;
    private final int losingTrades;
    private final double winRate;
    private final double profitFactor;
    private final double avgWin;
    private final double avgLoss;
    private final double avgTrade;
    private final double largestWin;
    private final double largestLoss;

    // ==================== Options ====================

    private final double avgDaysInTrade;

    /** Entry plus exit commissions across all closed positions. */
    private final double totalCommissions;

    /** Total commissions as a percentage of gross profit (sum of winning trades). */
    private final double commissionPct;

    private final double avgDeltaExposure;
    private final double avgGammaExposure;
    private final double avgThetaIncome;
    private final double avgVegaExposure;

    @Builder.Default
    private final Map<String, StrategyBreakdown> strategyBreakdown = Map.of();

    /** Metrics of a run that closed no trades: every statistic is zero. */
    public static BacktestMetrics empty(LocalDate startDate, LocalDate endDate) {
        return BacktestMetrics.builder().startDate(startDate).endDate(endDate).build();
    }

    /** Nested, sectioned view for serialization and reports. */
    public Map<String, Object> toMap() {
        Map<String, Object> period = new LinkedHashMap<>();
        period.put("start", String.valueOf(startDate));
        period.put("end", String.valueOf(endDate));
        period.put("trading_days", tradingDays);

        Map<String, Object> returns = new LinkedHashMap<>();
        returns.put("total_return_pct", totalReturn);
        returns.put("cagr_pct", cagr);
        returns.put("avg_daily_return", avgDailyReturn);

        Map<String, Object> risk = new LinkedHashMap<>();
        risk.put("sharpe_ratio", sharpeRatio);
        risk.put("sortino_ratio", sortinoRatio);
        risk.put("max_drawdown_pct", maxDrawdown);
        risk.put("avg_drawdown_pct", avgDrawdown);
        risk.put("calmar_ratio", calmarRatio);

        Map<String, Object> trades = new LinkedHashMap<>();
        trades.put("total", totalTrades);
        trades.put("winning", winningTrades);
        trades.put("losing", losingTrades);
        trades.put("win_rate_pct", winRate);
        trades.put("profit_factor", profitFactor);
        trades.put("avg_win", avgWin);
        trades.put("avg_loss", avgLoss);
        trades.put("avg_trade", avgTrade);
        trades.put("largest_win", largestWin);
        trades.put("largest_loss", largestLoss);

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("avg_days_in_trade", avgDaysInTrade);
        options.put("total_commissions", totalCommissions);
        options.put("commission_pct", commissionPct);
        options.put("avg_delta_exposure", avgDeltaExposure);
        options.put("avg_gamma_exposure", avgGammaExposure);
        options.put("avg_theta_income", avgThetaIncome);
        options.put("avg_vega_exposure", avgVegaExposure);

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("period", period);
        map.put("returns", returns);
        map.put("risk", risk);
        map.put("trades", trades);
        map.put("options", options);
        map.put("strategy_breakdown", strategyBreakdown);
        return map;
    }
}
