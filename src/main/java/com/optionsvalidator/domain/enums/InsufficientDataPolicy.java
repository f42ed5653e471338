package com.optionsvalidator.domain.enums;

/**
 * What the VaR calculator does when the return history is shorter than its minimum.
 */
public enum InsufficientDataPolicy {
    /** Throw an InsufficientDataException. */
    RAISE,
    /** Return an all-zero result so no alarm is raised on a short history. */
    ZERO_RESULT
}
