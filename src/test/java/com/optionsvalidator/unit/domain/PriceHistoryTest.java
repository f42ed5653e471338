package com.optionsvalidator.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.optionsvalidator.domain.model.DailyBar;
import com.optionsvalidator.domain.model.PriceHistory;
import com.optionsvalidator.domain.model.PriceHistory.PricePoint;
import com.optionsvalidator.unit.support.SyntheticBars;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class PriceHistoryTest {

    private final List<DailyBar> bars =
            SyntheticBars.trending(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 28), 100.0, 0.0005);

    @Test
    void sortsBarsAndDerivesRollingVolatility() {
        List<DailyBar> shuffled = new ArrayList<>(bars);
        Collections.reverse(shuffled);

        PriceHistory history = PriceHistory.of("SPY", shuffled, 1.2);

        assertThat(history.getBars()).isEqualTo(bars);
        // First return is at index 1, so a 20-day window is first complete at index 20
        assertThat(history.pointAt(19).hv20()).isNaN();
        assertThat(history.pointAt(20).hv20()).isFinite().isPositive();
        assertThat(history.pointAt(29).hv30()).isNaN();
        assertThat(history.pointAt(60).hv60()).isFinite();

        PricePoint point = history.pointAt(50);
        assertThat(point.ivEstimate()).isCloseTo(point.hv30() * 1.2, within(1e-12));
    }

    @Test
    void truncatesWithoutChangingPastValues() {
        PriceHistory history = PriceHistory.of("SPY", bars, 1.2);
        LocalDate cutoff = LocalDate.of(2024, 3, 16); // Saturday

        PriceHistory visible = history.upTo(cutoff);

        assertThat(visible.lastDate()).contains(LocalDate.of(2024, 3, 15));
        int last = visible.size() - 1;
        assertThat(visible.pointAt(last)).isEqualTo(history.pointAt(last));
        assertThat(history.upTo(LocalDate.of(2023, 12, 31)).isEmpty()).isTrue();
    }

    @Test
    void looksUpTheBarInEffectOnADate() {
        PriceHistory history = PriceHistory.of("SPY", bars, 1.2);

        assertThat(history.barOnOrBefore(LocalDate.of(2024, 1, 7)).map(DailyBar::date))
                .contains(LocalDate.of(2024, 1, 5));
        assertThat(history.pointOnOrBefore(LocalDate.of(2023, 12, 29))).isEmpty();
        assertThat(history.indexOnOrBefore(LocalDate.of(2030, 1, 1))).isEqualTo(history.size() - 1);
        assertThat(history.closes()).hasSize(history.size());
    }
}
