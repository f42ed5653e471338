package com.optionsvalidator.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Theoretical option value and sensitivities produced by the option pricer.
 *
 * <p>Units:
 * <ul>
 *   <li>price: per unit of underlying (multiply by 100 for one contract)
 *   <li>theta: per calendar day
 *   <li>vega: per 1 percentage point of volatility
 *   <li>rho: per 1 percentage point of the risk-free rate
 * </ul>
 */
@Getter
@Builder
@ToString
public class OptionQuote {

    private final double price;
    private final double delta;
    private final double gamma;
    private final double theta;
    private final double vega;
    private final double rho;

    /** Greeks snapshot of this quote, for storing on a leg. */
    public Greeks toGreeks() {
        return Greeks.of(delta, gamma, theta, vega);
    }
}
