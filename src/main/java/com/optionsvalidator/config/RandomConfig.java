package com.optionsvalidator.config;

import com.optionsvalidator.montecarlo.RandomSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared {@link RandomSource} for Monte Carlo resampling and Monte Carlo VaR.
 * Seeded from {@code optionsvalidator.random-seed} so results are reproducible.
 */
@Configuration
public class RandomConfig {

    @Bean
    public RandomSource randomSource(@Value("${optionsvalidator.random-seed:42}") long seed) {
        return RandomSource.seeded(seed);
    }
}
