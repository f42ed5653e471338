package com.optionsvalidator.domain.model;

import com.optionsvalidator.domain.enums.OptionType;
import java.time.LocalDate;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One option contract line within a position.
 *
 * <p>Quantity is signed: positive for bought (long) contracts, negative for sold (short)
 * contracts. It is never zero. Premium is per unit of underlying; one contract covers
 * {@link #CONTRACT_MULTIPLIER} units. Greeks are the per-unit snapshot at entry.
 */
@Getter
@ToString
public class OptionLeg {

    public static final int CONTRACT_MULTIPLIER = 100;

    private final OptionType optionType;
    private final double strike;
    private final LocalDate expiration;
    private final int quantity;
    private final double premium;
    private final Greeks greeks;

    /** Volatility the entry premium was priced at, if known. */
    private final double impliedVolatility;

    @Builder
    private OptionLeg(
            OptionType optionType,
            double strike,
            LocalDate expiration,
            int quantity,
            double premium,
            Greeks greeks,
            double impliedVolatility) {
        if (quantity == 0) {
            throw new IllegalArgumentException("Option leg quantity must be non-zero");
        }
        this.optionType = Objects.requireNonNull(optionType, "optionType");
        this.expiration = Objects.requireNonNull(expiration, "expiration");
        this.strike = strike;
        this.quantity = quantity;
        this.premium = premium;
        this.greeks = greeks != null ? greeks : Greeks.ZERO;
        this.impliedVolatility = impliedVolatility;
    }

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean isShort() {
        return quantity < 0;
    }

    public int contracts() {
        return Math.abs(quantity);
    }

    /**
     * Signed cash flow of trading this leg at the given premium: negative when buying
     * (debit), positive when selling (credit).
     */
    double cashFlowOnOpen(double premiumPerUnit) {
        double notional = premiumPerUnit * CONTRACT_MULTIPLIER * contracts();
        return isShort() ? notional : -notional;
    }
}
