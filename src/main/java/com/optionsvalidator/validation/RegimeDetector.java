package com.optionsvalidator.validation;

import com.optionsvalidator.domain.model.PriceHistory;

/** Classifies the market regime from a closing-price series. */
public interface RegimeDetector {

    RegimeState detectRegime(double[] closes);

    default RegimeState detectRegime(PriceHistory history) {
        return detectRegime(history.closes());
    }
}
