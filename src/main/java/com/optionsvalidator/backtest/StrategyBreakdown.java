package com.optionsvalidator.backtest;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Per-strategy-category slice of a backtest: trade count, dollar P&L, win rate (%). */
@Getter
@Builder
@ToString
public class StrategyBreakdown {

    private final int trades;
    private final double pnl;
    private final double winRate;
    private final double avgPnl;
}
