package com.optionsvalidator.backtest.strategy;

import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.domain.model.OptionLeg;
import java.time.LocalDate;
import java.util.List;

/**
 * Iron condor: a bull put spread below spot plus a bear call spread above it, all four
 * legs on the same expiration. Leg order: short put, long put, short call, long call.
 */
public class IronCondorStrategy extends PremiumSellingStrategy {

    public IronCondorStrategy(OptionPricer optionPricer, StrategyParameters parameters) {
        super(optionPricer, parameters);
    }

    @Override
    protected StrategyCategory category() {
        return StrategyCategory.IRON_CONDOR;
    }

    @Override
    protected List<OptionLeg> buildLegs(double spot, LocalDate entryDate, LocalDate expiration, double iv) {
        double offset = parameters.getShortStrikeOffsetPct();
        double width = spot * parameters.getSpreadWidthPct();

        double shortPut = roundStrike(spot * (1 - offset));
        double longPut = roundStrike(shortPut - width);
        double shortCall = roundStrike(spot * (1 + offset));
        double longCall = roundStrike(shortCall + width);
        if (longPut >= shortPut || longCall <= shortCall) {
            return List.of();
        }

        int qty = parameters.getContracts();
        return List.of(
                leg(OptionType.PUT, shortPut, -qty, spot, entryDate, expiration, iv),
                leg(OptionType.PUT, longPut, qty, spot, entryDate, expiration, iv),
                leg(OptionType.CALL, shortCall, -qty, spot, entryDate, expiration, iv),
                leg(OptionType.CALL, longCall, qty, spot, entryDate, expiration, iv));
    }
}
