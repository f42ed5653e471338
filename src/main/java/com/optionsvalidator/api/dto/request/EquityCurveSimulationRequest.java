package com.optionsvalidator.api.dto.request;

import com.optionsvalidator.domain.enums.SimulationMethod;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for POST /api/monte-carlo/equity-curve. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquityCurveSimulationRequest {

    /** Portfolio values in date order; the first value is the starting capital. */
    @NotEmpty
    private List<Double> equityCurve;

    private SimulationMethod method;
}
