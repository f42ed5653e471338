package com.optionsvalidator.backtest;

import com.optionsvalidator.config.BacktestConfig;
import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.domain.enums.BacktestState;
import com.optionsvalidator.domain.model.DailyBar;
import com.optionsvalidator.domain.model.OptionLeg;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.domain.model.PriceHistory;
import com.optionsvalidator.domain.model.PriceHistory.PricePoint;
import com.optionsvalidator.exception.InvalidStateException;
import com.optionsvalidator.exception.MissingMarketDataException;
import com.optionsvalidator.marketdata.PriceHistoryProvider;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Day-stepping options backtester for one date range.
 *
 * <p>State machine: CONFIGURED -&gt; DATA_LOADED -&gt; RUNNING -&gt; COMPLETED. An engine runs
 * once; create a new one (via {@link OptionsBacktestEngineFactory}) for another run.
 *
 * <p>Each evaluation date (weekdays, every {@code tradeFrequencyDays} calendar days) the
 * strategy is asked for a trade per symbol with history truncated at that date. Returned
 * positions are priced at exit with {@link OptionPricer} using the IV estimate in effect
 * on the exit date, closed, and their realized P&amp;L is added to the equity curve at the
 * date the trade was opened.
 *
 * <p>Per-trade failures (missing data, bad legs) are logged and the trade is skipped. A
 * symbol with no data at all fails the whole run.
 *
 * <p>Not thread-safe: the price cache, equity curve and closed positions belong to this
 * instance only.
 */
public class OptionsBacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(OptionsBacktestEngine.class);

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final double initialCapital;
    private final double riskFreeRate;
    private final double commissionPerContract;
    private final double ivMultiplier;
    private final double defaultImpliedVolatility;
    private final int minHistoryBars;
    private final int historyLookbackDays;
    private final int exitLookaheadDays;

    private final PriceHistoryProvider priceHistoryProvider;
    private final OptionPricer optionPricer;
    private final BacktestMetricsCalculator metricsCalculator;

    private final Map<String, PriceHistory> priceCache = new LinkedHashMap<>();
    private final List<OptionsPosition> closedPositions = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    private BacktestState state = BacktestState.CONFIGURED;
    private int skippedTrades;
    private BacktestMetrics metrics;

    public OptionsBacktestEngine(
            LocalDate startDate,
            LocalDate endDate,
            BacktestConfig config,
            PriceHistoryProvider priceHistoryProvider,
            OptionPricer optionPricer,
            BacktestMetricsCalculator metricsCalculator) {
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("Backtest end " + endDate + " is before start " + startDate);
        }
        this.startDate = startDate;
        this.endDate = endDate;
        this.initialCapital = config.getInitialCapital();
        this.riskFreeRate = config.getRiskFreeRate();
        this.commissionPerContract = config.getCommissionPerContract();
        this.ivMultiplier = config.getIvMultiplier();
        this.defaultImpliedVolatility = config.getDefaultImpliedVolatility();
        this.minHistoryBars = config.getMinHistoryBars();
        this.historyLookbackDays = config.getHistoryLookbackDays();
        this.exitLookaheadDays = config.getExitLookaheadDays();
        this.priceHistoryProvider = priceHistoryProvider;
        this.optionPricer = optionPricer;
        this.metricsCalculator = metricsCalculator;

        equityCurve.add(new EquityPoint(startDate, initialCapital));
    }

    // ==================== Data ====================

    /**
     * Loads and caches the symbol's history covering the backtest range plus the warm-up
     * lookback and the exit lookahead.
     */
    public PriceHistory loadPriceHistory(String symbol) {
        return loadPriceHistory(
                symbol, startDate.minusDays(historyLookbackDays), endDate.plusDays(exitLookaheadDays));
    }

    /**
     * Loads and caches the symbol's history for an explicit range. The first load of a
     * symbol wins for the lifetime of this engine.
     *
     * @throws MissingMarketDataException if the provider has no bars in the range
     */
    public PriceHistory loadPriceHistory(String symbol, LocalDate from, LocalDate to) {
        PriceHistory cached = priceCache.get(symbol);
        if (cached != null) {
            return cached;
        }

        List<DailyBar> bars = priceHistoryProvider.fetchDailyBars(symbol, from, to);
        if (bars.isEmpty()) {
            throw new MissingMarketDataException(symbol, "No price data for " + symbol + " between " + from + " and " + to);
        }

        PriceHistory history = PriceHistory.of(symbol, bars, ivMultiplier);
        priceCache.put(symbol, history);
        if (state == BacktestState.CONFIGURED) {
            state = BacktestState.DATA_LOADED;
        }
        log.info(
                "Loaded {} bars for {} ({} to {})",
                history.size(),
                symbol,
                history.firstDate().orElse(null),
                history.lastDate().orElse(null));
        return history;
    }

    // ==================== Trade simulation ====================

    /**
     * Exits a position opened by a strategy. The exit date is the position's recorded exit
     * date, else its last leg expiration; each leg is repriced there at the residual time
     * to its own expiration.
     *
     * @return the same position, now closed
     * @throws MissingMarketDataException if there is no bar at or before the entry date, or
     *     the exit date lies past the end of the loaded data
     */
    public OptionsPosition simulateTrade(OptionsPosition position) {
        String symbol = position.getSymbol();
        PriceHistory history = loadPriceHistory(symbol);

        if (history.pointOnOrBefore(position.getEntryDate()).isEmpty()) {
            throw new MissingMarketDataException(symbol, position.getEntryDate());
        }
        if (!position.isEntryCosted()) {
            position.calculateEntryCost(commissionPerContract);
        }

        LocalDate exitDate =
                position.getExitDate() != null ? position.getExitDate() : position.lastExpiration();
        LocalDate lastBar = history.lastDate().orElseThrow();
        if (exitDate.isAfter(lastBar)) {
            throw new MissingMarketDataException(symbol, exitDate);
        }
        PricePoint exitPoint =
                history.pointOnOrBefore(exitDate).orElseThrow(() -> new MissingMarketDataException(symbol, exitDate));

        double spot = exitPoint.close();
        double iv = Double.isFinite(exitPoint.ivEstimate()) && exitPoint.ivEstimate() > 0
                ? exitPoint.ivEstimate()
                : defaultImpliedVolatility;

        List<Double> exitPremiums = new ArrayList<>(position.getLegs().size());
        for (OptionLeg leg : position.getLegs()) {
            double years = Math.max(0, ChronoUnit.DAYS.between(exitDate, leg.getExpiration())) / 365.0;
            exitPremiums.add(optionPricer
                    .price(spot, leg.getStrike(), years, riskFreeRate, iv, leg.getOptionType())
                    .getPrice());
        }

        position.recordExit(exitDate, spot);
        position.calculatePnl(exitPremiums, commissionPerContract);
        return position;
    }

    // ==================== Run loop ====================

    /**
     * Runs the strategy over the configured date range.
     *
     * @param strategy           trade decision callback
     * @param symbols            underlyings to evaluate on each date
     * @param tradeFrequencyDays calendar days between evaluation dates (&gt;= 1)
     * @return the completed run
     * @throws MissingMarketDataException if a symbol has no data at all
     * @throws InvalidStateException      if this engine has already run
     */
    public BacktestOutcome runBacktest(StrategyFunction strategy, List<String> symbols, int tradeFrequencyDays) {
        if (state == BacktestState.RUNNING || state == BacktestState.COMPLETED) {
            throw new InvalidStateException("Backtest engine already " + state + "; create a new engine per run");
        }
        if (tradeFrequencyDays < 1) {
            throw new IllegalArgumentException("tradeFrequencyDays must be >= 1, got " + tradeFrequencyDays);
        }

        log.info(
                "Starting options backtest {} to {} on {} (every {} days, capital ${})",
                startDate,
                endDate,
                symbols,
                tradeFrequencyDays,
                initialCapital);

        for (String symbol : symbols) {
            loadPriceHistory(symbol);
        }
        state = BacktestState.RUNNING;

        LocalDate current = startDate;
        int tradeCount = 0;
        double realizedPnl = 0.0;

        while (!current.isAfter(endDate)) {
            if (isWeekend(current)) {
                current = current.plusDays(1);
                continue;
            }

            for (String symbol : symbols) {
                PriceHistory visible = priceCache.get(symbol).upTo(current);
                if (visible.size() < minHistoryBars) {
                    continue;
                }

                Optional<OptionsPosition> proposal = strategy.evaluate(symbol, current, visible);
                if (proposal.isEmpty()) {
                    continue;
                }

                try {
                    OptionsPosition closed = simulateTrade(proposal.get());
                    closedPositions.add(closed);
                    realizedPnl += closed.getPnl();
                    tradeCount++;
                    log.info(
                            "{}: {} {} P&L ${}",
                            current,
                            symbol,
                            closed.getCategory().getLabel(),
                            String.format("%.2f", closed.getPnl()));
                } catch (RuntimeException e) {
                    // one bad trade never aborts the run
                    skippedTrades++;
                    log.warn("Trade simulation failed for {} on {}: {}", symbol, current, e.toString());
                }
            }

            equityCurve.add(new EquityPoint(current, initialCapital + realizedPnl));
            current = current.plusDays(tradeFrequencyDays);
        }

        state = BacktestState.COMPLETED;
        metrics = calculateMetrics();
        log.info(
                "Backtest complete: {} trades executed, {} skipped, total return {}%",
                tradeCount,
                skippedTrades,
                String.format("%.2f", metrics.getTotalReturn()));
        return getOutcome();
    }

    /** Reduces the closed positions and equity curve recorded so far into metrics. */
    public BacktestMetrics calculateMetrics() {
        return metricsCalculator.calculate(
                closedPositions, equityCurve, initialCapital, riskFreeRate, startDate, endDate);
    }

    public BacktestOutcome getOutcome() {
        if (state != BacktestState.COMPLETED) {
            throw new InvalidStateException("Backtest has not completed (state " + state + ")");
        }
        return BacktestOutcome.builder()
                .startDate(startDate)
                .endDate(endDate)
                .initialCapital(initialCapital)
                .metrics(metrics)
                .closedPositions(getClosedPositions())
                .equityCurve(getEquityCurve())
                .priceHistories(Collections.unmodifiableMap(priceCache))
                .skippedTrades(skippedTrades)
                .build();
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public List<OptionsPosition> getClosedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    public BacktestState getState() {
        return state;
    }

    public int getSkippedTrades() {
        return skippedTrades;
    }

    public double getInitialCapital() {
        return initialCapital;
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
