package com.optionsvalidator.backtest.strategy;

import com.optionsvalidator.backtest.StrategyFunction;
import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.domain.model.OptionLeg;
import com.optionsvalidator.domain.model.OptionQuote;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.domain.model.PriceHistory;
import com.optionsvalidator.domain.model.PriceHistory.PricePoint;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Base for the built-in strategies: prices legs at entry from the latest close and IV
 * estimate, rounds strikes and applies the optional early-exit date.
 */
public abstract class PremiumSellingStrategy implements StrategyFunction {

    protected final OptionPricer optionPricer;
    protected final StrategyParameters parameters;

    protected PremiumSellingStrategy(OptionPricer optionPricer, StrategyParameters parameters) {
        this.optionPricer = optionPricer;
        this.parameters = parameters;
    }

    @Override
    public Optional<OptionsPosition> evaluate(String symbol, LocalDate date, PriceHistory historyUpToDate) {
        Optional<PricePoint> latest = historyUpToDate.latest();
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        PricePoint point = latest.get();
        double iv = Double.isFinite(point.ivEstimate()) && point.ivEstimate() > 0
                ? point.ivEstimate()
                : parameters.getDefaultImpliedVolatility();
        LocalDate expiration = date.plusDays(parameters.getDaysToExpiry());

        List<OptionLeg> legs = buildLegs(point.close(), date, expiration, iv);
        if (legs.isEmpty()) {
            return Optional.empty();
        }

        OptionsPosition position = OptionsPosition.open(symbol, category(), legs, date, point.close());
        if (parameters.getHoldDays() > 0 && parameters.getHoldDays() < parameters.getDaysToExpiry()) {
            position.recordExit(date.plusDays(parameters.getHoldDays()), null);
        }
        return Optional.of(position);
    }

    protected abstract StrategyCategory category();

    protected abstract List<OptionLeg> buildLegs(double spot, LocalDate entryDate, LocalDate expiration, double iv);

    protected OptionLeg leg(
            OptionType type, double strike, int signedQuantity, double spot, LocalDate entryDate, LocalDate expiration, double iv) {
        double years = Math.max(0, expiration.toEpochDay() - entryDate.toEpochDay()) / 365.0;
        OptionQuote quote = optionPricer.price(spot, strike, years, parameters.getRiskFreeRate(), iv, type);
        return OptionLeg.builder()
                .optionType(type)
                .strike(strike)
                .expiration(expiration)
                .quantity(signedQuantity)
                .premium(quote.getPrice())
                .greeks(quote.toGreeks())
                .impliedVolatility(iv)
                .build();
    }

    protected double roundStrike(double rawStrike) {
        double increment = parameters.getStrikeIncrement();
        return Math.max(increment, Math.round(rawStrike / increment) * increment);
    }
}
