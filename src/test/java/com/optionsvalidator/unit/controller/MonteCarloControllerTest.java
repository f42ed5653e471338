package com.optionsvalidator.unit.controller;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.optionsvalidator.api.controller.MonteCarloController;
import com.optionsvalidator.api.dto.request.EquityCurveSimulationRequest;
import com.optionsvalidator.api.dto.request.MonteCarloRequest;
import com.optionsvalidator.config.ApiResponseAdvice;
import com.optionsvalidator.config.MonteCarloConfig;
import com.optionsvalidator.domain.enums.SimulationMethod;
import com.optionsvalidator.exception.GlobalExceptionHandler;
import com.optionsvalidator.montecarlo.MonteCarloReportGenerator;
import com.optionsvalidator.montecarlo.MonteCarloSimulator;
import com.optionsvalidator.montecarlo.RandomSource;
import com.optionsvalidator.montecarlo.StressScenario;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Standalone MockMvc tests for the MonteCarloController with a small seeded simulator. */
class MonteCarloControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MonteCarloConfig config = new MonteCarloConfig();
        config.setSimulations(200);
        MonteCarloSimulator simulator = new MonteCarloSimulator(config, RandomSource.seeded(42));
        MonteCarloController controller = new MonteCarloController(simulator, new MonteCarloReportGenerator(), config);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static List<Double> returns(int n) {
        List<Double> returns = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            returns.add(0.0008 + 0.01 * Math.sin(i * 2.1));
        }
        return returns;
    }

    @Test
    @DisplayName("POST /api/monte-carlo/returns simulates with the requested method")
    void simulateReturns() throws Exception {
        MonteCarloRequest request = MonteCarloRequest.builder()
                .returns(returns(60))
                .initialCapital(100_000.0)
                .method(SimulationMethod.SHUFFLE)
                .build();

        mockMvc.perform(post("/api/monte-carlo/returns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.result.method").value("SHUFFLE"))
                .andExpect(jsonPath("$.data.result.simulations").value(200))
                .andExpect(jsonPath("$.data.result.observations").value(60))
                .andExpect(jsonPath("$.data.result.pathDependencyScore", closeTo(0.0, 1e-6)))
                .andExpect(jsonPath("$.data.report", containsString("MONTE CARLO SIMULATION REPORT")));
    }

    @Test
    @DisplayName("POST /api/monte-carlo/equity-curve uses the first value as capital")
    void simulateEquityCurve() throws Exception {
        List<Double> curve = new ArrayList<>();
        double equity = 25_000;
        curve.add(equity);
        for (double r : returns(40)) {
            equity *= 1 + r;
            curve.add(equity);
        }
        EquityCurveSimulationRequest request = EquityCurveSimulationRequest.builder()
                .equityCurve(curve)
                .build();

        mockMvc.perform(post("/api/monte-carlo/equity-curve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.result.initialCapital").value(25_000.0))
                .andExpect(jsonPath("$.data.result.method").value("BOOTSTRAP"));
    }

    @Test
    @DisplayName("POST /api/monte-carlo/stress runs custom scenarios in order")
    void stressCustomScenarios() throws Exception {
        MonteCarloRequest request = MonteCarloRequest.builder()
                .returns(returns(60))
                .initialCapital(100_000.0)
                .scenarios(List.of(new StressScenario("calm", 0.0, 0.5), new StressScenario("storm", -0.005, 3.0)))
                .build();

        mockMvc.perform(post("/api/monte-carlo/stress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.scenarios.calm.scenario").value("calm"))
                .andExpect(jsonPath("$.data.scenarios.storm.scenario").value("storm"))
                .andExpect(jsonPath("$.data.summary").isString());
    }

    @Test
    @DisplayName("POST /api/monte-carlo/stress without scenarios uses the default set")
    void stressDefaultScenarios() throws Exception {
        MonteCarloRequest request = MonteCarloRequest.builder()
                .returns(returns(60))
                .initialCapital(100_000.0)
                .build();

        mockMvc.perform(post("/api/monte-carlo/stress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.scenarios.flash_crash").exists())
                .andExpect(jsonPath("$.data.scenarios.base").exists());
    }

    @Test
    @DisplayName("Too few returns is a 422 INSUFFICIENT_DATA")
    void tooFewReturns() throws Exception {
        MonteCarloRequest request = MonteCarloRequest.builder()
                .returns(returns(5))
                .initialCapital(100_000.0)
                .build();

        mockMvc.perform(post("/api/monte-carlo/returns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("INSUFFICIENT_DATA"));
    }
}
