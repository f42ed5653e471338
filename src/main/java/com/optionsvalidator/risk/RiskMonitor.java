package com.optionsvalidator.risk;

import com.optionsvalidator.domain.enums.AlertSeverity;
import com.optionsvalidator.exception.InsufficientDataException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateful risk session wrapped around the {@link VaRCalculator}.
 *
 * <p>Tracks the peak portfolio value and the day's starting value. {@link #checkRisk}
 * runs, in order:
 * <ol>
 *   <li>VaR 95% vs the VaR limit -&gt; WARNING, or CRITICAL at 1.5x the limit
 *   <li>intraday change vs the daily loss limit -&gt; CRITICAL and trading paused
 *   <li>drawdown from peak vs the drawdown limit -&gt; EMERGENCY and trading halted
 *   <li>per-symbol concentration vs the position limit -&gt; WARNING
 * </ol>
 *
 * <p>{@link #startNewDay} resets the daily baseline and lifts a pause; a halt is never
 * lifted. Alerts accumulate in an append-only log until {@link #resetAlerts}.
 *
 * <p>One instance per monitoring session; obtain it from {@link RiskMonitorFactory}.
 */
public class RiskMonitor {

    private static final Logger log = LoggerFactory.getLogger(RiskMonitor.class);

    private static final double CRITICAL_VAR_MULTIPLE = 1.5;

    private final RiskLimits limits;
    private final VaRCalculator varCalculator;
    private final List<RiskAlert> alerts = new ArrayList<>();

    private double peakValue;
    private double dailyStartingValue;
    private boolean paused;
    private boolean halted;

    public RiskMonitor(RiskLimits limits, VaRCalculator varCalculator) {
        this.limits = limits;
        this.varCalculator = varCalculator;
        log.info(
                "RiskMonitor initialized: VaR limit={}%, daily loss={}%, drawdown={}%, position={}%",
                limits.getVarLimitPct(),
                limits.getDailyLossLimitPct(),
                limits.getDrawdownLimitPct(),
                limits.getPositionLimitPct());
    }

    /**
     * Runs all risk checks against the current portfolio value.
     *
     * @param portfolioValue current portfolio value in dollars
     * @param returns        historical daily returns for the VaR check
     * @param positions      position value per symbol; may be empty
     * @return alerts raised by this check (also appended to the session log)
     * @throws IllegalArgumentException if a position has no symbol or no value; nothing is
     *                                  recorded in that case
     */
    public List<RiskAlert> checkRisk(double portfolioValue, List<Double> returns, Map<String, Double> positions) {
        if (positions != null) {
            positions.forEach((symbol, value) -> {
                if (symbol == null || value == null) {
                    throw new IllegalArgumentException("Position value missing for symbol " + symbol);
                }
            });
        }
        List<RiskAlert> raised = new ArrayList<>();
        peakValue = Math.max(peakValue, portfolioValue);

        // ==================== VaR ====================

        Optional<VaRResult> var = varFor(returns, portfolioValue);
        if (var.isPresent() && portfolioValue > 0) {
            double varPct = var.get().getVar95LossPct();
            if (varPct > limits.getVarLimitPct()) {
                raised.add(RiskAlert.builder()
                        .severity(
                                varPct < limits.getVarLimitPct() * CRITICAL_VAR_MULTIPLE
                                        ? AlertSeverity.WARNING
                                        : AlertSeverity.CRITICAL)
                        .metric("var_95")
                        .message(String.format("VaR 95%% (%.2f%%) exceeds limit (%.2f%%)", varPct, limits.getVarLimitPct()))
                        .currentValue(varPct)
                        .threshold(limits.getVarLimitPct())
                        .actionRequired("Reduce position sizes or hedge exposure")
                        .build());
            }
        }

        // ==================== Daily loss ====================

        if (dailyStartingValue > 0) {
            double dailyPnlPct = dailyPnlPct(portfolioValue);
            if (dailyPnlPct < -limits.getDailyLossLimitPct()) {
                raised.add(RiskAlert.builder()
                        .severity(AlertSeverity.CRITICAL)
                        .metric("daily_pnl")
                        .message(String.format(
                                "Daily loss (%.2f%%) exceeds limit (-%.2f%%)", dailyPnlPct, limits.getDailyLossLimitPct()))
                        .currentValue(dailyPnlPct)
                        .threshold(-limits.getDailyLossLimitPct())
                        .actionRequired("PAUSE trading for remainder of day")
                        .build());
                paused = true;
            }
        }

        // ==================== Drawdown ====================

        if (peakValue > 0) {
            double drawdownPct = drawdownPct(portfolioValue);
            if (drawdownPct > limits.getDrawdownLimitPct()) {
                raised.add(RiskAlert.builder()
                        .severity(AlertSeverity.EMERGENCY)
                        .metric("drawdown")
                        .message(String.format(
                                "Drawdown (%.2f%%) exceeds limit (%.2f%%)", drawdownPct, limits.getDrawdownLimitPct()))
                        .currentValue(drawdownPct)
                        .threshold(limits.getDrawdownLimitPct())
                        .actionRequired("HALT all trading. Manual review required.")
                        .build());
                halted = true;
            }
        }

        // ==================== Concentration ====================

        if (positions != null && !positions.isEmpty()) {
            double gross = positions.values().stream().mapToDouble(Math::abs).sum();
            if (gross > 0) {
                positions.forEach((symbol, value) -> {
                    double concentration = Math.abs(value) / gross * 100.0;
                    if (concentration > limits.getPositionLimitPct()) {
                        raised.add(RiskAlert.builder()
                                .severity(AlertSeverity.WARNING)
                                .metric("concentration")
                                .message(String.format(
                                        "%s concentration (%.1f%%) exceeds limit (%.1f%%)",
                                        symbol, concentration, limits.getPositionLimitPct()))
                                .currentValue(concentration)
                                .threshold(limits.getPositionLimitPct())
                                .actionRequired("Reduce " + symbol + " position or diversify")
                                .build());
                    }
                });
            }
        }

        for (RiskAlert alert : raised) {
            log.warn("Risk alert: {}", alert);
        }
        alerts.addAll(raised);
        return raised;
    }

    /** Resets the daily baseline and lifts a daily-loss pause. A halt stays in force. */
    public void startNewDay(double portfolioValue) {
        dailyStartingValue = portfolioValue;
        paused = false;
        log.info("New trading day started. Portfolio: ${}", String.format("%,.2f", portfolioValue));
    }

    public TradingDecision canTrade() {
        if (halted) {
            return new TradingDecision(false, "Trading HALTED due to drawdown limit breach");
        }
        if (paused) {
            return new TradingDecision(false, "Trading PAUSED due to daily loss limit breach");
        }
        return new TradingDecision(true, "Trading allowed");
    }

    public RiskSummary getRiskSummary(double portfolioValue, List<Double> returns) {
        Optional<VaRResult> var = varFor(returns, portfolioValue);
        TradingDecision decision = canTrade();
        return RiskSummary.builder()
                .portfolioValue(portfolioValue)
                .var95(var.map(VaRResult::getVar95Dollars).orElse(0.0))
                .var99(var.map(VaRResult::getVar99Dollars).orElse(0.0))
                .cvar95(var.map(VaRResult::getCvar95Dollars).orElse(0.0))
                .cvar99(var.map(VaRResult::getCvar99Dollars).orElse(0.0))
                .var95Pct(var.map(VaRResult::getVar95LossPct).orElse(0.0))
                .currentDrawdownPct(peakValue > 0 ? drawdownPct(portfolioValue) : 0.0)
                .maxDrawdownLimitPct(limits.getDrawdownLimitPct())
                .dailyPnlPct(dailyStartingValue > 0 ? dailyPnlPct(portfolioValue) : 0.0)
                .dailyLossLimitPct(limits.getDailyLossLimitPct())
                .peakValue(peakValue)
                .canTrade(decision.allowed())
                .tradingStatus(decision.reason())
                .activeAlerts(alerts.size())
                .build();
    }

    /** Clears the alert log. Does not lift a pause or halt. */
    public int resetAlerts() {
        int count = alerts.size();
        alerts.clear();
        return count;
    }

    public List<RiskAlert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isHalted() {
        return halted;
    }

    public double getPeakValue() {
        return peakValue;
    }

    public double getDailyStartingValue() {
        return dailyStartingValue;
    }

    private Optional<VaRResult> varFor(List<Double> returns, double portfolioValue) {
        if (returns == null || returns.isEmpty()) {
            return Optional.empty();
        }
        try {
            VaRResult result = varCalculator.calculateVar(returns, portfolioValue);
            return result.isSufficientData() ? Optional.of(result) : Optional.empty();
        } catch (InsufficientDataException e) {
            log.debug("Skipping VaR check: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private double dailyPnlPct(double portfolioValue) {
        return (portfolioValue - dailyStartingValue) / dailyStartingValue * 100.0;
    }

    private double drawdownPct(double portfolioValue) {
        return (peakValue - portfolioValue) / peakValue * 100.0;
    }
}
