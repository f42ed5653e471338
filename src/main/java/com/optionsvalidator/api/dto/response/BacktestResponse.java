package com.optionsvalidator.api.dto.response;

import com.optionsvalidator.backtest.EquityPoint;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Response DTO for POST /api/backtests: sectioned metrics, the equity curve and the text report. */
@Getter
@Builder
public class BacktestResponse {

    private final String strategy;
    private final List<String> symbols;
    private final Map<String, Object> metrics;
    private final List<EquityPoint> equityCurve;
    private final int closedTrades;
    private final int skippedTrades;
    private final String report;
}
