package com.optionsvalidator.validation;

import com.optionsvalidator.backtest.BacktestMetrics;
import com.optionsvalidator.montecarlo.MonteCarloResult;
import com.optionsvalidator.risk.VaRResult;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Renders a {@link ValidationResult} as a sectioned plain-text report. */
@Component
public class ValidationReportGenerator {

    private static final String RULE = "=".repeat(80);
    private static final String SECTION_RULE = "-".repeat(80);

    public String generate(ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n').append("EXTENDED STRATEGY VALIDATION REPORT").append('\n').append(RULE).append('\n');

        section(sb, "OVERALL ASSESSMENT");
        line(sb, "Status: %s", result.isValidForLiveTrading() ? "PASS" : "FAIL");
        line(sb, "Score: %.0f/100", result.getOverallScore());
        line(sb, "Summary: %s", result.getSummary());

        BacktestMetrics bt = result.getBacktestMetrics();
        if (bt != null) {
            section(sb, "BACKTEST");
            line(sb, "  Total Return: %.2f%%", bt.getTotalReturn());
            line(sb, "  Sharpe Ratio: %.2f", bt.getSharpeRatio());
            line(sb, "  Max Drawdown: %.1f%%", bt.getMaxDrawdown());
            line(sb, "  Win Rate: %.1f%%", bt.getWinRate());
            line(sb, "  Total Trades: %d", bt.getTotalTrades());
        }

        section(sb, "MONTE CARLO");
        MonteCarloResult mc = result.getMonteCarloResult();
        if (mc != null) {
            line(sb, "  Status: %s", result.isMonteCarloValid() ? "PASS" : "FAIL");
            line(sb, "  Simulations: %,d", mc.getSimulations());
            line(sb, "  Profit Probability: %.1f%%", mc.getProbabilityOfProfit() * 100);
            line(sb, "  Ruin Probability: %.1f%%", mc.getProbabilityOfRuin() * 100);
            line(sb, "  Mean Return: %.1f%%", mc.getTotalReturn().getMean() * 100);
            line(sb, "  Path Dependency: %.2f", mc.getPathDependencyScore());
        } else {
            line(sb, "  Status: NOT RUN");
        }
        numbered(sb, "  Failures:", result.getMonteCarloFailures());

        VaRResult var = result.getVarResult();
        if (var != null) {
            section(sb, "VALUE AT RISK");
            line(sb, "  Method: %s (%d-day horizon)", var.getMethod(), var.getHorizonDays());
            line(sb, "  VaR 95%%: $%,.2f (%.2f%% of portfolio)", var.getVar95Dollars(), var.getVar95LossPct());
            line(sb, "  CVaR 95%%: $%,.2f", var.getCvar95Dollars());
            line(sb, "  VaR 99%%: $%,.2f", var.getVar99Dollars());
        }

        section(sb, "TRANSACTION COSTS");
        line(sb, "  Gross Return: %.2f%%", result.getGrossReturn());
        line(sb, "  Net Return: %.2f%%", result.getNetReturn());
        line(sb, "  Total Costs: $%,.2f", result.getTotalCosts());
        line(sb, "  Cost Drag: %.1f%%", result.getCostDragPct());
        line(sb, "  Cost-Adjusted Sharpe: %.2f", result.getCostAdjustedSharpe());

        RegimeState regime = result.getRegimeState();
        if (regime != null) {
            section(sb, "MARKET REGIME");
            line(sb, "  Current Regime: %s", regime.getMarketRegime());
            line(sb, "  Volatility: %s (%.0fth percentile)", regime.getVolatilityRegime(), regime.getVolatilityPercentile());
            line(sb, "  Trend: %s (strength %.2f)", regime.getTrendRegime(), regime.getTrendStrength());
            line(sb, "  Recommended Position Scale: %.0f%%", regime.getRecommendedPositionScale() * 100);
        }

        if (!result.getFailures().isEmpty()) {
            section(sb, "FAILURES");
            numbered(sb, null, result.getFailures());
        }
        if (!result.getRecommendations().isEmpty()) {
            section(sb, "RECOMMENDATIONS");
            numbered(sb, null, result.getRecommendations());
        }
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title) {
        sb.append('\n').append(SECTION_RULE).append('\n').append(title).append('\n').append(SECTION_RULE).append('\n');
    }

    private static void numbered(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        if (heading != null) {
            sb.append(heading).append('\n');
        }
        for (int i = 0; i < items.size(); i++) {
            line(sb, "  %d. %s", i + 1, items.get(i));
        }
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.US, format, args)).append('\n');
    }
}
