package com.optionsvalidator.montecarlo;

import com.optionsvalidator.core.stats.ReturnStatistics;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.exception.InsufficientDataException;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-trade return profile of a set of closed positions. A trade's return is its realized
 * P&amp;L over {@link OptionsPosition#capitalAtRisk()}, as a fraction.
 *
 * <p>Profit factor is gross wins over gross losses, infinite when nothing lost.
 */
@Getter
@Builder
@ToString(exclude = "returns")
public class TradeStatistics {

    private final double[] returns;
    private final int numTrades;
    private final double meanReturn;
    private final double stdReturn;
    private final double winRate;
    private final double avgWin;
    private final double avgLoss;
    private final double profitFactor;

    /**
     * @throws InsufficientDataException if no closed position has a positive capital at risk
     */
    public static TradeStatistics fromPositions(List<OptionsPosition> positions) {
        List<Double> usable = new ArrayList<>();
        for (OptionsPosition position : positions) {
            if (!position.isClosed()) {
                continue;
            }
            double basis = position.capitalAtRisk();
            if (basis > 0 && Double.isFinite(position.getPnl())) {
                usable.add(position.getPnl() / basis);
            }
        }
        if (usable.isEmpty()) {
            throw new InsufficientDataException("trade statistics", 1, 0);
        }
        return fromReturns(usable.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public static TradeStatistics fromReturns(double[] returns) {
        double winSum = 0.0;
        double lossSum = 0.0;
        int wins = 0;
        int losses = 0;
        for (double r : returns) {
            if (r > 0) {
                winSum += r;
                wins++;
            } else if (r < 0) {
                lossSum += r;
                losses++;
            }
        }
        return TradeStatistics.builder()
                .returns(returns.clone())
                .numTrades(returns.length)
                .meanReturn(ReturnStatistics.mean(returns))
                .stdReturn(ReturnStatistics.populationStd(returns))
                .winRate(returns.length == 0 ? 0.0 : (double) wins / returns.length)
                .avgWin(wins == 0 ? 0.0 : winSum / wins)
                .avgLoss(losses == 0 ? 0.0 : lossSum / losses)
                .profitFactor(lossSum == 0 ? Double.POSITIVE_INFINITY : winSum / Math.abs(lossSum))
                .build();
    }
}
