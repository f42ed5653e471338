package com.optionsvalidator.risk;

/**
 * One-step-ahead volatility estimate for a daily return series, in the same units as
 * the returns (a daily standard deviation, not annualized).
 */
public interface VolatilityForecaster {

    /**
     * @throws com.optionsvalidator.exception.NumericalFitException if the model cannot be
     *     estimated on this sample
     */
    double forecastVolatility(double[] returns);

    /** Short model label recorded on VaR results. */
    String name();
}
