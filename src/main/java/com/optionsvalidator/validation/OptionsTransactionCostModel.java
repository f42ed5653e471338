package com.optionsvalidator.validation;

import com.optionsvalidator.config.CostModelConfig;
import com.optionsvalidator.domain.model.OptionLeg;
import com.optionsvalidator.domain.model.OptionsPosition;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Default friction model for listed options: half the bid/ask spread plus slippage,
 * both proportional to the premium traded, with a per-contract floor. Charged once at
 * entry (on entry premiums) and once at exit (on exit premiums).
 */
@Component
public class OptionsTransactionCostModel implements TransactionCostModel {

    private final CostModelConfig config;

    public OptionsTransactionCostModel(CostModelConfig config) {
        this.config = config;
    }

    @Override
    public double estimateRoundTripCost(OptionsPosition position) {
        List<OptionLeg> legs = position.getLegs();
        double entryNotional = 0.0;
        double exitNotional = 0.0;
        List<Double> exitPremiums = position.getExitPremiums();
        for (int i = 0; i < legs.size(); i++) {
            OptionLeg leg = legs.get(i);
            double units = (double) OptionLeg.CONTRACT_MULTIPLIER * leg.contracts();
            entryNotional += Math.abs(leg.getPremium()) * units;
            if (i < exitPremiums.size()) {
                exitNotional += Math.abs(exitPremiums.get(i)) * units;
            }
        }

        int contracts = position.totalContracts();
        double entryCost = sideCost(entryNotional, contracts);
        double exitCost = position.isClosed() ? sideCost(exitNotional, contracts) : 0.0;
        return entryCost + exitCost;
    }

    private double sideCost(double premiumNotional, int contracts) {
        double proportional = (config.getHalfSpreadPct() + config.getSlippagePct()) * premiumNotional;
        return Math.max(proportional, config.getMinCostPerContract() * contracts);
    }
}
