package com.optionsvalidator.backtest;

import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.domain.model.PriceHistory;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Trade decision callback consulted by the backtest engine on each evaluation date.
 *
 * <p>The history passed in ends at {@code date}; implementations must not look past it.
 * A returned position should carry entry premiums (and Greeks) for each leg. It may also
 * carry a planned exit date via {@link OptionsPosition#recordExit}; otherwise the engine
 * exits at the last leg expiration.
 */
@FunctionalInterface
public interface StrategyFunction {

    Optional<OptionsPosition> evaluate(String symbol, LocalDate date, PriceHistory historyUpToDate);
}
