package com.optionsvalidator.api.controller;

import com.optionsvalidator.api.dto.request.BacktestRequest;
import com.optionsvalidator.api.dto.response.BacktestResponse;
import com.optionsvalidator.api.dto.response.ValidationResponse;
import com.optionsvalidator.backtest.BacktestOutcome;
import com.optionsvalidator.backtest.BacktestReportGenerator;
import com.optionsvalidator.backtest.OptionsBacktestEngine;
import com.optionsvalidator.backtest.OptionsBacktestEngineFactory;
import com.optionsvalidator.backtest.StrategyFunction;
import com.optionsvalidator.backtest.strategy.BuiltInStrategy;
import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.validation.ExtendedValidator;
import com.optionsvalidator.validation.ValidationReportGenerator;
import com.optionsvalidator.validation.ValidationResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for running built-in strategies against the stored market data.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/backtests} -- backtest metrics, equity curve and text report</li>
 *   <li>{@code POST /api/validation} -- extended validation verdict and report</li>
 * </ul>
 * Each request runs on its own engine instance.
 */
@RestController
@RequestMapping("/api")
public class BacktestController {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private final OptionsBacktestEngineFactory engineFactory;
    private final OptionPricer optionPricer;
    private final BacktestReportGenerator backtestReportGenerator;
    private final ExtendedValidator extendedValidator;
    private final ValidationReportGenerator validationReportGenerator;

    public BacktestController(
            OptionsBacktestEngineFactory engineFactory,
            OptionPricer optionPricer,
            BacktestReportGenerator backtestReportGenerator,
            ExtendedValidator extendedValidator,
            ValidationReportGenerator validationReportGenerator) {
        this.engineFactory = engineFactory;
        this.optionPricer = optionPricer;
        this.backtestReportGenerator = backtestReportGenerator;
        this.extendedValidator = extendedValidator;
        this.validationReportGenerator = validationReportGenerator;
    }

    @PostMapping("/backtests")
    public BacktestResponse runBacktest(@Valid @RequestBody BacktestRequest request) {
        StrategyFunction strategy = resolveStrategy(request);
        OptionsBacktestEngine engine = request.getInitialCapital() != null
                ? engineFactory.create(request.getStartDate(), request.getEndDate(), request.getInitialCapital())
                : engineFactory.create(request.getStartDate(), request.getEndDate());

        log.info("Backtest requested: strategy={}, symbols={}", request.getStrategy(), request.getSymbols());
        BacktestOutcome outcome = engine.runBacktest(strategy, request.getSymbols(), request.tradeFrequencyOrDefault());

        return BacktestResponse.builder()
                .strategy(request.getStrategy())
                .symbols(request.getSymbols())
                .metrics(outcome.getMetrics().toMap())
                .equityCurve(outcome.getEquityCurve())
                .closedTrades(outcome.getClosedPositions().size())
                .skippedTrades(outcome.getSkippedTrades())
                .report(backtestReportGenerator.generate(outcome.getMetrics()))
                .build();
    }

    @PostMapping("/validation")
    public ValidationResponse validate(@Valid @RequestBody BacktestRequest request) {
        StrategyFunction strategy = resolveStrategy(request);

        log.info("Validation requested: strategy={}, symbols={}", request.getStrategy(), request.getSymbols());
        ValidationResult result = extendedValidator.validate(
                strategy,
                request.getSymbols(),
                request.getStartDate(),
                request.getEndDate(),
                request.tradeFrequencyOrDefault());

        return ValidationResponse.builder()
                .strategy(request.getStrategy())
                .validForLiveTrading(result.isValidForLiveTrading())
                .overallScore(result.getOverallScore())
                .result(result)
                .report(validationReportGenerator.generate(result))
                .build();
    }

    private StrategyFunction resolveStrategy(BacktestRequest request) {
        return BuiltInStrategy.fromName(request.getStrategy()).create(optionPricer, request.toStrategyParameters());
    }
}
