package com.optionsvalidator.backtest.strategy;

import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.domain.model.OptionLeg;
import java.time.LocalDate;
import java.util.List;

/**
 * Bull put credit spread: sell an out-of-the-money put and buy a further OTM put below it.
 * Entered for a net credit; profits when the underlying stays above the short strike.
 */
public class BullPutSpreadStrategy extends PremiumSellingStrategy {

    public BullPutSpreadStrategy(OptionPricer optionPricer, StrategyParameters parameters) {
        super(optionPricer, parameters);
    }

    @Override
    protected StrategyCategory category() {
        return StrategyCategory.CREDIT_SPREAD;
    }

    @Override
    protected List<OptionLeg> buildLegs(double spot, LocalDate entryDate, LocalDate expiration, double iv) {
        double shortStrike = roundStrike(spot * (1 - parameters.getShortStrikeOffsetPct()));
        double longStrike = roundStrike(shortStrike - spot * parameters.getSpreadWidthPct());
        if (longStrike >= shortStrike) {
            return List.of();
        }
        int qty = parameters.getContracts();
        return List.of(
                leg(OptionType.PUT, shortStrike, -qty, spot, entryDate, expiration, iv),
                leg(OptionType.PUT, longStrike, qty, spot, entryDate, expiration, iv));
    }
}
