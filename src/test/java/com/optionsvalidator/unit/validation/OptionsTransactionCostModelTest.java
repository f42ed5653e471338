package com.optionsvalidator.unit.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.optionsvalidator.config.CostModelConfig;
import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.domain.model.OptionLeg;
import com.optionsvalidator.domain.model.OptionsPosition;
import com.optionsvalidator.validation.CostAdjustedTrade;
import com.optionsvalidator.validation.OptionsTransactionCostModel;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OptionsTransactionCostModelTest {

    private static final LocalDate ENTRY = LocalDate.of(2024, 3, 1);

    private OptionsTransactionCostModel costModel;

    @BeforeEach
    void setUp() {
        // Defaults: 2% half-spread + 0.5% slippage per side, $1 per contract floor
        costModel = new OptionsTransactionCostModel(new CostModelConfig());
    }

    private static OptionsPosition bullPut() {
        OptionLeg shortPut = OptionLeg.builder()
                .optionType(OptionType.PUT)
                .strike(95)
                .expiration(ENTRY.plusDays(30))
                .quantity(-1)
                .premium(3.00)
                .build();
        OptionLeg longPut = OptionLeg.builder()
                .optionType(OptionType.PUT)
                .strike(90)
                .expiration(ENTRY.plusDays(30))
                .quantity(1)
                .premium(1.00)
                .build();
        return OptionsPosition.open("SPY", StrategyCategory.CREDIT_SPREAD, List.of(shortPut, longPut), ENTRY, 100.0);
    }

    @Test
    @DisplayName("Entry friction is proportional to premium traded; cheap exits pay the floor")
    void roundTrip() {
        OptionsPosition position = bullPut();
        position.calculatePnl(List.of(0.50, 0.10), 0.65);

        // entry: 2.5% of $400 = $10; exit: 2.5% of $60 = $1.50, floored at 2 contracts x $1
        assertThat(costModel.estimateRoundTripCost(position)).isCloseTo(12.0, within(1e-9));
    }

    @Test
    @DisplayName("Open positions are only charged for the entry side")
    void openPosition() {
        assertThat(costModel.estimateRoundTripCost(bullPut())).isCloseTo(10.0, within(1e-9));
    }

    @Test
    @DisplayName("Cost-adjusted trades subtract frictions from realized P&L")
    void adjustReturns() {
        OptionsPosition position = bullPut();
        double pnl = position.calculatePnl(List.of(0.50, 0.10), 0.65);

        List<CostAdjustedTrade> adjusted = costModel.adjustReturns(List.of(position));

        assertThat(adjusted).singleElement().satisfies(t -> {
            assertThat(t.position()).isSameAs(position);
            assertThat(t.originalPnl()).isEqualTo(pnl);
            assertThat(t.transactionCosts()).isCloseTo(12.0, within(1e-9));
            assertThat(t.adjustedPnl()).isCloseTo(pnl - 12.0, within(1e-9));
        });
    }

    @Test
    @DisplayName("Wider spreads raise the charge")
    void configurableSpread() {
        CostModelConfig config = new CostModelConfig();
        config.setHalfSpreadPct(0.05);
        config.setSlippagePct(0.0);

        assertThat(new OptionsTransactionCostModel(config).estimateRoundTripCost(bullPut()))
                .isCloseTo(20.0, within(1e-9));
    }
}
