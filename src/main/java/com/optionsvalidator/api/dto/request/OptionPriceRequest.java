package com.optionsvalidator.api.dto.request;

import com.optionsvalidator.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for POST /api/pricing/options. Rates and volatility are annualized decimals. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionPriceRequest {

    @NotNull
    @Positive
    private Double spot;

    @NotNull
    @Positive
    private Double strike;

    /** Years to expiry; zero or negative prices the option at its intrinsic value. */
    @NotNull
    private Double timeToExpiryYears;

    @NotNull
    private Double riskFreeRate;

    @NotNull
    @PositiveOrZero
    private Double volatility;

    @NotNull
    private OptionType optionType;

    private Double dividendYield;
}
