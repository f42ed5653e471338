package com.optionsvalidator.backtest.strategy;

import com.optionsvalidator.backtest.StrategyFunction;
import com.optionsvalidator.core.processor.OptionPricer;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.BiFunction;

/** Strategies that can be backtested by name through the REST API. */
public enum BuiltInStrategy {
    BULL_PUT_SPREAD(BullPutSpreadStrategy::new),
    IRON_CONDOR(IronCondorStrategy::new);

    private final BiFunction<OptionPricer, StrategyParameters, StrategyFunction> constructor;

    BuiltInStrategy(BiFunction<OptionPricer, StrategyParameters, StrategyFunction> constructor) {
        this.constructor = constructor;
    }

    public StrategyFunction create(OptionPricer optionPricer, StrategyParameters parameters) {
        return constructor.apply(optionPricer, parameters);
    }

    /** Case-insensitive lookup accepting either "iron_condor" or "iron-condor". */
    public static BuiltInStrategy fromName(String name) {
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(s -> s.name().equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + name));
    }
}
