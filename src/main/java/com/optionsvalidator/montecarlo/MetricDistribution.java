package com.optionsvalidator.montecarlo;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Simulated distribution of one performance metric next to its observed value.
 * {@code lower95}/{@code upper95} are the 2.5th/97.5th percentiles, except for drawdown
 * where the upper bound is the 95th percentile (the bad tail).
 */
@Getter
@Builder
@ToString
public class MetricDistribution {

    private final double original;
    private final double mean;
    private final double std;
    private final double median;
    private final double lower95;
    private final double upper95;

    public double bandWidth() {
        return upper95 - lower95;
    }
}
