package com.optionsvalidator.domain.enums;

public enum OptionType {
    CALL,
    PUT
}
