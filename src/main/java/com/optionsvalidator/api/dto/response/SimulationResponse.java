package com.optionsvalidator.api.dto.response;

import com.optionsvalidator.montecarlo.MonteCarloResult;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SimulationResponse {

    private final MonteCarloResult result;
    private final String report;
}
