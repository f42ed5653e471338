package com.optionsvalidator.domain.enums;

public enum PositionStatus {
    OPEN,
    CLOSED
}
