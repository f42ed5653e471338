package com.optionsvalidator.montecarlo;

import com.optionsvalidator.core.stats.ReturnStatistics;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Dollar equity at the end of each simulated path. */
@Getter
@Builder
@ToString
public class FinalEquityDistribution {

    private final double mean;
    private final double median;
    private final double std;
    private final double min;
    private final double max;
    private final double percentile5;
    private final double percentile25;
    private final double percentile75;
    private final double percentile95;

    static FinalEquityDistribution of(double[] finalEquities) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double e : finalEquities) {
            min = Math.min(min, e);
            max = Math.max(max, e);
        }
        return FinalEquityDistribution.builder()
                .mean(ReturnStatistics.mean(finalEquities))
                .median(ReturnStatistics.median(finalEquities))
                .std(ReturnStatistics.populationStd(finalEquities))
                .min(min)
                .max(max)
                .percentile5(ReturnStatistics.percentile(finalEquities, 5.0))
                .percentile25(ReturnStatistics.percentile(finalEquities, 25.0))
                .percentile75(ReturnStatistics.percentile(finalEquities, 75.0))
                .percentile95(ReturnStatistics.percentile(finalEquities, 95.0))
                .build();
    }
}
