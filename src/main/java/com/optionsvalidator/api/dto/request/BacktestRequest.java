package com.optionsvalidator.api.dto.request;

import com.optionsvalidator.backtest.strategy.StrategyParameters;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/backtests and POST /api/validation.
 *
 * <p>{@code strategy} names a built-in strategy ("bull_put_spread", "iron_condor").
 * Strategy tuning fields are optional and default to the strategy's own defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    @NotBlank
    private String strategy;

    @NotEmpty
    private List<String> symbols;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;

    /** Days between strategy evaluations; 7 when omitted. */
    @Min(1)
    private Integer tradeFrequencyDays;

    /** Ignored by the validation endpoint, which always uses the configured capital. */
    @Positive
    private Double initialCapital;

    // ==================== Strategy parameters ====================

    @Min(1)
    private Integer daysToExpiry;

    @Positive
    private Double shortStrikeOffsetPct;

    @Positive
    private Double spreadWidthPct;

    @Min(1)
    private Integer contracts;

    @Min(0)
    private Integer holdDays;

    public int tradeFrequencyOrDefault() {
        return tradeFrequencyDays == null ? 7 : tradeFrequencyDays;
    }

    /** Strategy parameters with every unset field left at its default. */
    public StrategyParameters toStrategyParameters() {
        StrategyParameters.StrategyParametersBuilder builder = StrategyParameters.builder();
        if (daysToExpiry != null) {
            builder.daysToExpiry(daysToExpiry);
        }
        if (shortStrikeOffsetPct != null) {
            builder.shortStrikeOffsetPct(shortStrikeOffsetPct);
        }
        if (spreadWidthPct != null) {
            builder.spreadWidthPct(spreadWidthPct);
        }
        if (contracts != null) {
            builder.contracts(contracts);
        }
        if (holdDays != null) {
            builder.holdDays(holdDays);
        }
        return builder.build();
    }
}
