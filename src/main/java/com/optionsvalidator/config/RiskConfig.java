package com.optionsvalidator.config;

import com.optionsvalidator.risk.RiskLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} used by every {@code RiskMonitor} session.
 *
 * <p>Limits are percentages of portfolio value. Properties prefix: {@code optionsvalidator.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${optionsvalidator.risk.var-limit-pct:5.0}") double varLimitPct,
            @Value("${optionsvalidator.risk.daily-loss-limit-pct:2.0}") double dailyLossLimitPct,
            @Value("${optionsvalidator.risk.drawdown-limit-pct:10.0}") double drawdownLimitPct,
            @Value("${optionsvalidator.risk.position-limit-pct:25.0}") double positionLimitPct) {
        return RiskLimits.builder()
                .varLimitPct(varLimitPct)
                .dailyLossLimitPct(dailyLossLimitPct)
                .drawdownLimitPct(drawdownLimitPct)
                .positionLimitPct(positionLimitPct)
                .build();
    }
}
