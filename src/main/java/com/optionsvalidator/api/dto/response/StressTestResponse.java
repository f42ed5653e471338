package com.optionsvalidator.api.dto.response;

import com.optionsvalidator.montecarlo.MonteCarloResult;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Results keyed by scenario name, in the order the scenarios ran. */
@Getter
@Builder
public class StressTestResponse {

    private final Map<String, MonteCarloResult> scenarios;
    private final String summary;
}
