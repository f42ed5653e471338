package com.optionsvalidator.backtest;

import com.optionsvalidator.config.BacktestConfig;
import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.marketdata.PriceHistoryProvider;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Creates one {@link OptionsBacktestEngine} per run, wired with the shared pricer, metrics
 * calculator and market-data provider. Engines are stateful and never shared.
 */
@Component
public class OptionsBacktestEngineFactory {

    private final BacktestConfig backtestConfig;
    private final PriceHistoryProvider priceHistoryProvider;
    private final OptionPricer optionPricer;
    private final BacktestMetricsCalculator metricsCalculator;

    public OptionsBacktestEngineFactory(
            BacktestConfig backtestConfig,
            PriceHistoryProvider priceHistoryProvider,
            OptionPricer optionPricer,
            BacktestMetricsCalculator metricsCalculator) {
        this.backtestConfig = backtestConfig;
        this.priceHistoryProvider = priceHistoryProvider;
        this.optionPricer = optionPricer;
        this.metricsCalculator = metricsCalculator;
    }

    public OptionsBacktestEngine create(LocalDate startDate, LocalDate endDate) {
        return new OptionsBacktestEngine(
                startDate, endDate, backtestConfig, priceHistoryProvider, optionPricer, metricsCalculator);
    }

    /** Engine with a different starting capital; all other settings from configuration. */
    public OptionsBacktestEngine create(LocalDate startDate, LocalDate endDate, double initialCapital) {
        BacktestConfig config = new BacktestConfig();
        config.setInitialCapital(initialCapital);
        config.setRiskFreeRate(backtestConfig.getRiskFreeRate());
        config.setCommissionPerContract(backtestConfig.getCommissionPerContract());
        config.setIvMultiplier(backtestConfig.getIvMultiplier());
        config.setDefaultImpliedVolatility(backtestConfig.getDefaultImpliedVolatility());
        config.setMinHistoryBars(backtestConfig.getMinHistoryBars());
        config.setHistoryLookbackDays(backtestConfig.getHistoryLookbackDays());
        config.setExitLookaheadDays(backtestConfig.getExitLookaheadDays());
        return new OptionsBacktestEngine(startDate, endDate, config, priceHistoryProvider, optionPricer, metricsCalculator);
    }
}
