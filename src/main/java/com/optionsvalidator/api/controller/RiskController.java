package com.optionsvalidator.api.controller;

import com.optionsvalidator.api.dto.request.VaRRequest;
import com.optionsvalidator.config.VaRConfig;
import com.optionsvalidator.domain.enums.VaRMethod;
import com.optionsvalidator.risk.VaRCalculator;
import com.optionsvalidator.risk.VaRResult;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for Value at Risk.
 *
 * <p>{@code POST /api/risk/var}: VaR and CVaR of a daily return series. Unset method,
 * horizon and confidence levels come from {@code optionsvalidator.var.*}.
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final VaRCalculator varCalculator;
    private final VaRConfig varConfig;

    public RiskController(VaRCalculator varCalculator, VaRConfig varConfig) {
        this.varCalculator = varCalculator;
        this.varConfig = varConfig;
    }

    @PostMapping("/var")
    public VaRResult calculateVar(@Valid @RequestBody VaRRequest request) {
        VaRMethod method = request.getMethod() != null ? request.getMethod() : varConfig.getMethod();
        int horizonDays = request.getHorizonDays() != null ? request.getHorizonDays() : varConfig.getHorizonDays();
        List<Double> levels = request.getConfidenceLevels() != null && !request.getConfidenceLevels().isEmpty()
                ? request.getConfidenceLevels()
                : varConfig.getConfidenceLevels();
        return varCalculator.calculateVar(request.getReturns(), request.getPortfolioValue(), levels, method, horizonDays);
    }
}
