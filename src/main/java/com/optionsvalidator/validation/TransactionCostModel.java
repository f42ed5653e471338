package com.optionsvalidator.validation;

import com.optionsvalidator.domain.model.OptionsPosition;
import java.util.List;

/**
 * Prices the execution frictions a backtest ignores.
 *
 * <p>Costs are positive dollar amounts. Commissions are already part of a position's
 * P&amp;L and must not be charged again here.
 */
public interface TransactionCostModel {

    /** Entry plus exit friction for one closed position. */
    double estimateRoundTripCost(OptionsPosition position);

    default List<CostAdjustedTrade> adjustReturns(List<OptionsPosition> closedPositions) {
        return closedPositions.stream()
                .map(p -> {
                    double cost = estimateRoundTripCost(p);
                    return new CostAdjustedTrade(p, p.getPnl(), cost, p.getPnl() - cost);
                })
                .toList();
    }
}
