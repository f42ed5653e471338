package com.optionsvalidator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Parameters of the default options transaction-cost model ({@code optionsvalidator.costs.*}).
 *
 * <p>Commissions are already part of each position's P&amp;L; this model prices the
 * market frictions on top of them: crossing half the bid/ask spread and slippage,
 * on both entry and exit.
 */
@Configuration
@ConfigurationProperties(prefix = "optionsvalidator.costs")
@Getter
@Setter
public class CostModelConfig {

    /** Half the bid/ask spread as a fraction of the premium, paid per side. */
    private double halfSpreadPct = 0.02;

    /** Slippage as a fraction of the premium, paid per side. */
    private double slippagePct = 0.005;

    /** Floor on the per-side friction per contract, in dollars (one 0.01 tick on 100 units). */
    private double minCostPerContract = 1.0;
}
