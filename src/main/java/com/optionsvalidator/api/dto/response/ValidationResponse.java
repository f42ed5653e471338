package com.optionsvalidator.api.dto.response;

import com.optionsvalidator.validation.ValidationResult;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ValidationResponse {

    private final String strategy;
    private final boolean validForLiveTrading;
    private final double overallScore;
    private final ValidationResult result;
    private final String report;
}
