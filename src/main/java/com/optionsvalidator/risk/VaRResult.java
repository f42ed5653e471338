package com.optionsvalidator.risk;

import com.optionsvalidator.domain.enums.VaRMethod;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * VaR and CVaR of a return sample at the 95% and 99% confidence levels.
 *
 * <p>Values are signed horizon returns: negative numbers are losses, so a more extreme
 * VaR is a more negative one. Dollar figures are the fraction times
 * {@link #portfolioValue}. {@code varByConfidence}/{@code cvarByConfidence} hold every
 * confidence level that was requested.
 */
@Getter
@Builder
@ToString
public class VaRResult {

    private final double var95;
    private final double var99;
    private final double cvar95;
    private final double cvar99;

    private final VaRMethod method;
    private final int horizonDays;
    private final double portfolioValue;
    private final int observations;

    /** Volatility model behind a parametric or Monte Carlo result ("GARCH(1,1)" / "SAMPLE"). */
    private final String volatilityModel;

    /** False when the sample was too short and the zero-result policy applied. */
    @Builder.Default
    private final boolean sufficientData = true;

    @Builder.Default
    private final Map<Double, Double> varByConfidence = Map.of();

    @Builder.Default
    private final Map<Double, Double> cvarByConfidence = Map.of();

    @Builder.Default
    private final Instant timestamp = Instant.now();

    public static VaRResult zero(VaRMethod method, int horizonDays, double portfolioValue, int observations) {
        return VaRResult.builder()
                .method(method)
                .horizonDays(horizonDays)
                .portfolioValue(portfolioValue)
                .observations(observations)
                .sufficientData(false)
                .build();
    }

    public double getVar95Dollars() {
        return var95 * portfolioValue;
    }

    public double getVar99Dollars() {
        return var99 * portfolioValue;
    }

    public double getCvar95Dollars() {
        return cvar95 * portfolioValue;
    }

    public double getCvar99Dollars() {
        return cvar99 * portfolioValue;
    }

    /** Size of the 95% VaR loss as a percentage of the portfolio (0 when VaR is not a loss). */
    public double getVar95LossPct() {
        return Math.max(0.0, -var95) * 100.0;
    }
}
