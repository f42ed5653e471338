package com.optionsvalidator.domain.enums;

/**
 * How a Monte Carlo trial rebuilds a return sequence from the observed one.
 */
public enum SimulationMethod {
    /** Random permutation: keeps the multiset of returns, destroys ordering. */
    SHUFFLE,
    /** Sampling with replacement, same length as the input. */
    BOOTSTRAP,
    /** i.i.d. normal draws matching the sample mean and standard deviation. */
    PARAMETRIC
}
