package com.optionsvalidator.domain.enums;

/**
 * Tiered risk alert levels. CRITICAL pauses trading for the day, EMERGENCY halts it
 * until the monitor is replaced.
 */
public enum AlertSeverity {
    WARNING,
    CRITICAL,
    EMERGENCY
}
