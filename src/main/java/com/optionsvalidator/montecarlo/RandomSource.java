package com.optionsvalidator.montecarlo;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Factory for the random generators used by resampling code. Every simulation run asks
 * for a fresh generator, so a seeded source makes each run reproducible on its own and
 * independent of what ran before it.
 */
@FunctionalInterface
public interface RandomSource {

    RandomGenerator newGenerator();

    static RandomSource seeded(long seed) {
        return () -> new Well19937c(seed);
    }
}
