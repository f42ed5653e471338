package com.optionsvalidator.config;

import com.optionsvalidator.domain.enums.SimulationMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the Monte Carlo simulator ({@code optionsvalidator.monte-carlo.*}).
 */
@Configuration
@ConfigurationProperties(prefix = "optionsvalidator.monte-carlo")
@Getter
@Setter
public class MonteCarloConfig {

    /** Independent trials per simulation run. */
    private int simulations = 1000;

    /** Drawdown (fraction) beyond which a trial counts as ruined. */
    private double ruinThreshold = 0.20;

    /** Minimum finite return observations. */
    private int minObservations = 20;

    /** Minimum closed trades for a trade-based run. */
    private int minTrades = 10;

    /** Annual risk-free rate subtracted per day in the Sharpe ratio. */
    private double riskFreeRate = 0.04;

    private SimulationMethod defaultMethod = SimulationMethod.BOOTSTRAP;
}
