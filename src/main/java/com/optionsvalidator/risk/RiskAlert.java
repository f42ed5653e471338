package com.optionsvalidator.risk;

import com.optionsvalidator.domain.enums.AlertSeverity;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * A failed risk check. Metric names: {@code var_95}, {@code daily_pnl}, {@code drawdown},
 * {@code concentration}. Values and thresholds are percentages.
 */
@Getter
@Builder
public class RiskAlert {

    private final AlertSeverity severity;
    private final String metric;
    private final String message;
    private final double currentValue;
    private final double threshold;
    private final String actionRequired;

    @Builder.Default
    private final Instant timestamp = Instant.now();

    @Override
    public String toString() {
        return severity + " " + metric + ": " + message;
    }
}
