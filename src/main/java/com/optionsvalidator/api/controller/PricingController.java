package com.optionsvalidator.api.controller;

import com.optionsvalidator.api.dto.request.OptionPriceRequest;
import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.domain.model.OptionQuote;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for theoretical option prices and Greeks.
 *
 * <p>{@code POST /api/pricing/options}: theta is per calendar day, vega and rho per
 * 1 percentage point.
 */
@RestController
@RequestMapping("/api/pricing")
public class PricingController {

    private final OptionPricer optionPricer;

    public PricingController(OptionPricer optionPricer) {
        this.optionPricer = optionPricer;
    }

    @PostMapping("/options")
    public OptionQuote price(@Valid @RequestBody OptionPriceRequest request) {
        double dividendYield = request.getDividendYield() == null ? 0.0 : request.getDividendYield();
        return optionPricer.price(
                request.getSpot(),
                request.getStrike(),
                request.getTimeToExpiryYears(),
                request.getRiskFreeRate(),
                request.getVolatility(),
                request.getOptionType(),
                dividendYield);
    }
}
