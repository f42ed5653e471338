package com.optionsvalidator.montecarlo;

import java.util.List;

/**
 * A (return shock, volatility multiplier) stress applied to a daily return series before
 * simulation: {@code stressed = mean + shock + (r - mean) * volatilityMultiplier}.
 */
public record StressScenario(String name, double returnShock, double volatilityMultiplier) {

    public static List<StressScenario> defaults() {
        return List.of(
                new StressScenario("base", 0.0, 1.0),
                new StressScenario("mild", -0.001, 1.25),
                new StressScenario("moderate", -0.002, 1.5),
                new StressScenario("severe", -0.004, 2.0),
                new StressScenario("historical_crisis", -0.006, 3.0),
                new StressScenario("flash_crash", -0.01, 4.0));
    }

    public double[] apply(double[] returns, double mean) {
        double[] stressed = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            stressed[i] = mean + returnShock + (returns[i] - mean) * volatilityMultiplier;
        }
        return stressed;
    }
}
