package com.optionsvalidator.unit.controller;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionsvalidator.api.controller.PricingController;
import com.optionsvalidator.config.ApiResponseAdvice;
import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Standalone MockMvc tests for the PricingController against the real pricer. */
class PricingControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PricingController(new OptionPricer()))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("POST /api/pricing/options prices an at-the-money call")
    void pricesCall() throws Exception {
        String body =
                """
                {"spot": 100, "strike": 100, "timeToExpiryYears": 1.0, "riskFreeRate": 0.05,
                 "volatility": 0.20, "optionType": "CALL"}
                """;

        mockMvc.perform(post("/api/pricing/options").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.price", closeTo(10.4506, 1e-4)))
                .andExpect(jsonPath("$.data.delta", closeTo(0.6368, 1e-4)));
    }

    @Test
    @DisplayName("Expired options are worth their intrinsic value")
    void expiredPut() throws Exception {
        String body =
                """
                {"spot": 90, "strike": 100, "timeToExpiryYears": 0, "riskFreeRate": 0.05,
                 "volatility": 0.20, "optionType": "PUT"}
                """;

        mockMvc.perform(post("/api/pricing/options").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.price", closeTo(10.0, 1e-12)));
    }

    @Test
    @DisplayName("Missing or non-positive fields are a 400 with per-field details")
    void rejectsInvalidRequest() throws Exception {
        String body =
                """
                {"spot": -5, "timeToExpiryYears": 1.0, "riskFreeRate": 0.05, "volatility": 0.2, "optionType": "CALL"}
                """;

        mockMvc.perform(post("/api/pricing/options").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.spot").exists())
                .andExpect(jsonPath("$.error.details.strike").exists());
    }

    @Test
    @DisplayName("An unknown option type is a malformed body")
    void rejectsUnknownOptionType() throws Exception {
        String body =
                """
                {"spot": 100, "strike": 100, "timeToExpiryYears": 1.0, "riskFreeRate": 0.05,
                 "volatility": 0.2, "optionType": "STRADDLE"}
                """;

        mockMvc.perform(post("/api/pricing/options").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }
}
