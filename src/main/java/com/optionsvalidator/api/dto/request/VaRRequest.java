package com.optionsvalidator.api.dto.request;

import com.optionsvalidator.domain.enums.VaRMethod;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/risk/var. Method, horizon and confidence levels fall back to
 * the {@code optionsvalidator.var.*} configuration when omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaRRequest {

    /** Daily returns as decimal fractions. */
    @NotEmpty
    private List<@NotNull Double> returns;

    @NotNull
    @Positive
    private Double portfolioValue;

    private List<@NotNull Double> confidenceLevels;

    private VaRMethod method;

    @Min(1)
    private Integer horizonDays;
}
