package com.optionsvalidator.api.controller;

import com.optionsvalidator.api.dto.request.EquityCurveSimulationRequest;
import com.optionsvalidator.api.dto.request.MonteCarloRequest;
import com.optionsvalidator.api.dto.response.SimulationResponse;
import com.optionsvalidator.api.dto.response.StressTestResponse;
import com.optionsvalidator.config.MonteCarloConfig;
import com.optionsvalidator.domain.enums.SimulationMethod;
import com.optionsvalidator.montecarlo.MonteCarloReportGenerator;
import com.optionsvalidator.montecarlo.MonteCarloResult;
import com.optionsvalidator.montecarlo.MonteCarloSimulator;
import com.optionsvalidator.montecarlo.StressScenario;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for Monte Carlo robustness testing.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/monte-carlo/returns} -- simulate a daily return series</li>
 *   <li>{@code POST /api/monte-carlo/equity-curve} -- simulate the returns of a value series</li>
 *   <li>{@code POST /api/monte-carlo/stress} -- one simulation per stress scenario</li>
 * </ul>
 * Fewer than the configured minimum observations is answered with 422 INSUFFICIENT_DATA.
 */
@RestController
@RequestMapping("/api/monte-carlo")
public class MonteCarloController {

    private final MonteCarloSimulator simulator;
    private final MonteCarloReportGenerator reportGenerator;
    private final MonteCarloConfig config;

    public MonteCarloController(
            MonteCarloSimulator simulator, MonteCarloReportGenerator reportGenerator, MonteCarloConfig config) {
        this.simulator = simulator;
        this.reportGenerator = reportGenerator;
        this.config = config;
    }

    @PostMapping("/returns")
    public SimulationResponse simulateReturns(@Valid @RequestBody MonteCarloRequest request) {
        MonteCarloResult result =
                simulator.simulateFromReturns(request.getReturns(), request.getInitialCapital(), method(request.getMethod()));
        return SimulationResponse.builder()
                .result(result)
                .report(reportGenerator.generate(result))
                .build();
    }

    @PostMapping("/equity-curve")
    public SimulationResponse simulateEquityCurve(@Valid @RequestBody EquityCurveSimulationRequest request) {
        MonteCarloResult result = simulator.simulateFromEquityCurve(request.getEquityCurve(), method(request.getMethod()));
        return SimulationResponse.builder()
                .result(result)
                .report(reportGenerator.generate(result))
                .build();
    }

    @PostMapping("/stress")
    public StressTestResponse stressTest(@Valid @RequestBody MonteCarloRequest request) {
        List<StressScenario> scenarios = request.getScenarios() == null || request.getScenarios().isEmpty()
                ? StressScenario.defaults()
                : request.getScenarios();
        Map<String, MonteCarloResult> results = simulator.stressTestScenarios(
                request.getReturns(), request.getInitialCapital(), scenarios, method(request.getMethod()));
        return StressTestResponse.builder()
                .scenarios(results)
                .summary(reportGenerator.generateStressSummary(results))
                .build();
    }

    private SimulationMethod method(SimulationMethod requested) {
        return requested != null ? requested : config.getDefaultMethod();
    }
}
