package com.optionsvalidator.config;

import com.optionsvalidator.domain.enums.InsufficientDataPolicy;
import com.optionsvalidator.domain.enums.VaRMethod;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for VaR/CVaR ({@code optionsvalidator.var.*}).
 *
 * <p>{@code insufficientDataPolicy} chooses between failing with a typed error (RAISE,
 * the default) and the legacy "no alarm on short history" zero result (ZERO_RESULT).
 */
@Configuration
@ConfigurationProperties(prefix = "optionsvalidator.var")
@Getter
@Setter
public class VaRConfig {

    private VaRMethod method = VaRMethod.HISTORICAL;

    /** Risk horizon in trading days; returns are scaled by sqrt(horizon). */
    private int horizonDays = 1;

    /** Sample size for the Monte Carlo method. */
    private int simulations = 10_000;

    private int minObservations = 20;

    /** Observations required before a GARCH(1,1) fit is attempted. */
    private int garchMinObservations = 100;

    private InsufficientDataPolicy insufficientDataPolicy = InsufficientDataPolicy.RAISE;

    private List<Double> confidenceLevels = List.of(0.95, 0.99);
}
