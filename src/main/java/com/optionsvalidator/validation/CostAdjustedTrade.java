package com.optionsvalidator.validation;

import com.optionsvalidator.domain.model.OptionsPosition;

/** A closed position with its P&amp;L restated after market frictions. */
public record CostAdjustedTrade(
        OptionsPosition position, double originalPnl, double transactionCosts, double adjustedPnl) {}
