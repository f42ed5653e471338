package com.optionsvalidator.montecarlo;

import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Plain-text summary of Monte Carlo runs: metric distributions plus a risk assessment
 * with [OK]/[WARN]/[FAIL] markers.
 */
@Component
public class MonteCarloReportGenerator {

    private static final String RULE = "=".repeat(70);

    public String generate(MonteCarloResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n').append("MONTE CARLO SIMULATION REPORT").append('\n').append(RULE).append('\n');
        line(sb, "Scenario: %s   Method: %s", result.getScenario(), result.getMethod());
        line(
                sb,
                "Trials: %d on %d %s",
                result.getSimulations(),
                result.getObservations(),
                result.isTradeBased() ? "trades" : "observations");
        sb.append('\n');

        TradeStatistics trades = result.getTradeStatistics();
        if (trades != null) {
            sb.append("TRADE STATISTICS\n");
            line(sb, "  Trades: %d   Win Rate: %.1f%%", trades.getNumTrades(), trades.getWinRate() * 100);
            line(sb, "  Mean Return: %.2f%%   Std: %.2f%%", trades.getMeanReturn() * 100, trades.getStdReturn() * 100);
            line(sb, "  Avg Win: %.2f%%   Avg Loss: %.2f%%", trades.getAvgWin() * 100, trades.getAvgLoss() * 100);
            line(sb, "  Profit Factor: %.2f", trades.getProfitFactor());
            sb.append('\n');
        }

        FinalEquityDistribution equity = result.getFinalEquity();
        if (equity != null) {
            sb.append("FINAL EQUITY\n");
            line(sb, "  Initial: $%,.2f", result.getInitialCapital());
            line(sb, "  Mean: $%,.2f   Median: $%,.2f", equity.getMean(), equity.getMedian());
            line(sb, "  Min: $%,.2f   Max: $%,.2f", equity.getMin(), equity.getMax());
            line(
                    sb,
                    "  P5: $%,.2f   P25: $%,.2f   P75: $%,.2f   P95: $%,.2f",
                    equity.getPercentile5(),
                    equity.getPercentile25(),
                    equity.getPercentile75(),
                    equity.getPercentile95());
            sb.append('\n');
        }

        distribution(sb, "Sharpe Ratio", result.getSharpe(), false);
        distribution(sb, "Total Return", result.getTotalReturn(), true);
        distribution(sb, "Max Drawdown", result.getMaxDrawdown(), true);

        sb.append("RISK METRICS\n");
        line(sb, "  Probability of Loss: %.1f%%", result.getProbabilityOfLoss() * 100);
        line(sb, "  Probability of Doubling: %.1f%%", result.getProbabilityOfDoubling() * 100);
        line(
                sb,
                "  Probability of Ruin (>%.0f%% drawdown): %.1f%%",
                result.getRuinThreshold() * 100,
                result.getProbabilityOfRuin() * 100);
        line(sb, "  VaR 95%%: %.2f%% ($%,.2f)", result.getVar95() * 100, result.getVar95Dollars());
        line(
                sb,
                "  Expected Shortfall 95%%: %.2f%% ($%,.2f)",
                result.getExpectedShortfall95() * 100,
                result.getExpectedShortfall95Dollars());
        line(sb, "  Path Dependency: %.2f", result.getPathDependencyScore());
        sb.append('\n');

        sb.append("ASSESSMENT\n");
        if (result.getProbabilityOfRuin() <= 0.01) {
            sb.append("  [OK] Very low risk of ruin (<1%)\n");
        } else if (result.getProbabilityOfRuin() <= 0.05) {
            sb.append("  [WARN] Moderate risk of ruin (1-5%)\n");
        } else {
            sb.append("  [FAIL] High risk of ruin (>5%)\n");
        }
        if (result.getPathDependencyScore() > 0.8) {
            sb.append("  [FAIL] Result depends on the specific return sequence\n");
        } else if (result.getPathDependencyScore() > 0.5) {
            sb.append("  [WARN] Result is partly sequence dependent\n");
        } else {
            sb.append("  [OK] Result is robust to return ordering\n");
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    /** One-line-per-scenario comparison of stress results. */
    public String generateStressSummary(Map<String, MonteCarloResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n').append("STRESS TEST SCENARIOS").append('\n').append(RULE).append('\n');
        line(sb, "%-18s %10s %10s %12s %10s", "Scenario", "P(loss)", "P(ruin)", "Mean Sharpe", "VaR 95");
        results.forEach((name, r) -> line(
                sb,
                "%-18s %9.1f%% %9.1f%% %12.2f %9.2f%%",
                name,
                r.getProbabilityOfLoss() * 100,
                r.getProbabilityOfRuin() * 100,
                r.getSharpe().getMean(),
                r.getVar95() * 100));
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    private static void distribution(StringBuilder sb, String title, MetricDistribution d, boolean percent) {
        double scale = percent ? 100.0 : 1.0;
        String unit = percent ? "%%" : "";
        sb.append(title.toUpperCase(Locale.ROOT)).append('\n');
        line(sb, "  Original: %.2f" + unit, d.getOriginal() * scale);
        line(sb, "  Mean: %.2f" + unit + "   Std: %.2f" + unit, d.getMean() * scale, d.getStd() * scale);
        line(sb, "  Median: %.2f" + unit, d.getMedian() * scale);
        line(sb, "  Band: [%.2f" + unit + ", %.2f" + unit + "]", d.getLower95() * scale, d.getUpper95() * scale);
        sb.append('\n');
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.US, format, args)).append('\n');
    }
}
