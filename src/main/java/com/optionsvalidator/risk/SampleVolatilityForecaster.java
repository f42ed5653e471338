package com.optionsvalidator.risk;

import com.optionsvalidator.core.stats.ReturnStatistics;
import org.springframework.stereotype.Component;

/** Constant-volatility model: the population standard deviation of the sample. */
@Component
public class SampleVolatilityForecaster implements VolatilityForecaster {

    @Override
    public double forecastVolatility(double[] returns) {
        return ReturnStatistics.populationStd(returns);
    }

    @Override
    public String name() {
        return "SAMPLE";
    }
}
