package com.optionsvalidator.api.dto.request;

import com.optionsvalidator.domain.enums.SimulationMethod;
import com.optionsvalidator.montecarlo.StressScenario;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/monte-carlo/returns and /api/monte-carlo/stress.
 * {@code scenarios} is only read by the stress endpoint; when empty the built-in
 * scenario set is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonteCarloRequest {

    @NotEmpty
    private List<Double> returns;

    @NotNull
    @Positive
    private Double initialCapital;

    private SimulationMethod method;

    private List<StressScenario> scenarios;
}
