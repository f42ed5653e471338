package com.optionsvalidator.validation;

import com.optionsvalidator.domain.enums.MarketRegime;
import com.optionsvalidator.domain.enums.TrendRegime;
import com.optionsvalidator.domain.enums.VolatilityRegime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Market regime classification at the end of a price series.
 *
 * <p>{@code volatilityPercentile} is 0-100; {@code trendStrength} is in [-1, 1];
 * {@code confidence} and {@code recommendedPositionScale} are in [0, 1].
 */
@Getter
@Builder
@ToString
public class RegimeState {

    private final VolatilityRegime volatilityRegime;
    private final TrendRegime trendRegime;
    private final MarketRegime marketRegime;
    private final double volatilityPercentile;
    private final double trendStrength;
    private final double confidence;
    private final double recommendedPositionScale;

    /** Neutral classification used when the series is too short to classify. */
    public static RegimeState undetermined() {
        return RegimeState.builder()
                .volatilityRegime(VolatilityRegime.MEDIUM)
                .trendRegime(TrendRegime.RANGING)
                .marketRegime(MarketRegime.RANGING_LOW_VOL)
                .volatilityPercentile(50.0)
                .trendStrength(0.0)
                .confidence(0.0)
                .recommendedPositionScale(0.5)
                .build();
    }
}
