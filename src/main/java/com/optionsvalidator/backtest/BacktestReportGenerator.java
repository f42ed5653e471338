package com.optionsvalidator.backtest;

import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders {@link BacktestMetrics} as a sectioned plain-text report.
 */
@Component
public class BacktestReportGenerator {

    static final String RULE = "=".repeat(80);

    public String generate(BacktestMetrics m) {
        StringBuilder sb = new StringBuilder();
        header(sb, "OPTIONS BACKTEST REPORT");
        line(sb, "Period: %s to %s", m.getStartDate(), m.getEndDate());
        line(sb, "Trading Days: %d", m.getTradingDays());

        header(sb, "RETURNS");
        line(sb, "Total Return: %+.2f%%", m.getTotalReturn());
        line(sb, "CAGR: %+.2f%%", m.getCagr());
        line(sb, "Avg Daily Return: %+.4f%%", m.getAvgDailyReturn() * 100);

        header(sb, "RISK METRICS");
        line(sb, "Sharpe Ratio: %.2f", m.getSharpeRatio());
        line(sb, "Sortino Ratio: %.2f", m.getSortinoRatio());
        line(sb, "Max Drawdown: %.2f%%", m.getMaxDrawdown());
        line(sb, "Avg Drawdown: %.2f%%", m.getAvgDrawdown());
        line(sb, "Calmar Ratio: %.2f", m.getCalmarRatio());

        header(sb, "TRADE STATISTICS");
        line(sb, "Total Trades: %d (%d won / %d lost)", m.getTotalTrades(), m.getWinningTrades(), m.getLosingTrades());
        line(sb, "Win Rate: %.1f%%", m.getWinRate());
        line(sb, "Profit Factor: %.2f", m.getProfitFactor());
        line(sb, "Avg Win: $%.2f   Avg Loss: $%.2f   Avg Trade: $%.2f", m.getAvgWin(), m.getAvgLoss(), m.getAvgTrade());
        line(sb, "Largest Win: $%.2f   Largest Loss: $%.2f", m.getLargestWin(), m.getLargestLoss());

        header(sb, "OPTIONS ANALYTICS");
        line(sb, "Avg Days in Trade: %.1f", m.getAvgDaysInTrade());
        line(sb, "Total Commissions: $%.2f (%.2f%% of gross profit)", m.getTotalCommissions(), m.getCommissionPct());
        line(sb, "Avg Net Delta: %.2f", m.getAvgDeltaExposure());
        line(sb, "Avg Net Gamma: %.4f", m.getAvgGammaExposure());
        line(sb, "Avg Net Theta: $%.2f/day", m.getAvgThetaIncome());
        line(sb, "Avg Net Vega: %.2f", m.getAvgVegaExposure());

        if (!m.getStrategyBreakdown().isEmpty()) {
            header(sb, "STRATEGY PERFORMANCE");
            for (Map.Entry<String, StrategyBreakdown> entry : m.getStrategyBreakdown().entrySet()) {
                StrategyBreakdown b = entry.getValue();
                line(
                        sb,
                        "%-18s trades=%d  pnl=$%.2f  win=%.1f%%  avg=$%.2f",
                        entry.getKey(),
                        b.getTrades(),
                        b.getPnl(),
                        b.getWinRate(),
                        b.getAvgPnl());
            }
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    static void header(StringBuilder sb, String title) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(RULE).append('\n').append(title).append('\n').append(RULE).append('\n');
    }

    static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.US, format, args)).append('\n');
    }
}
