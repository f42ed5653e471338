package com.optionsvalidator.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    ARGUMENT_MISMATCH("ARGUMENT_MISMATCH", 400),
    NOT_FOUND("NOT_FOUND", 404),
    MISSING_MARKET_DATA("MISSING_MARKET_DATA", 404),
    POSITION_ALREADY_CLOSED("POSITION_ALREADY_CLOSED", 409),
    INVALID_STATE("INVALID_STATE", 409),
    INSUFFICIENT_DATA("INSUFFICIENT_DATA", 422),
    NUMERICAL_FIT_FAILURE("NUMERICAL_FIT_FAILURE", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
