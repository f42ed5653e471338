package com.optionsvalidator.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionsvalidator.config.MarketDataConfig;
import com.optionsvalidator.domain.model.DailyBar;
import com.optionsvalidator.exception.MissingMarketDataException;
import com.optionsvalidator.marketdata.CsvPriceHistoryProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvPriceHistoryProviderTest {

    @TempDir
    Path dataDir;

    private CsvPriceHistoryProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(
                dataDir.resolve("SPY.csv"),
                String.join(
                        "\n",
                        "date,open,high,low,close,volume",
                        "2024-01-02,470.1,472.0,468.5,471.3,81000000",
                        "2024-01-03,471.0,471.9,466.2,467.0,90000000",
                        "",
                        "2024-01-04,467.5,469.0,465.1,466.1,",
                        "2024-01-05,466.0,468.4,464.9,467.9,70000000"));
        MarketDataConfig config = new MarketDataConfig();
        config.setDirectory(dataDir.toString());
        provider = new CsvPriceHistoryProvider(config);
    }

    @Test
    void readsRowsInsideTheRange() {
        List<DailyBar> bars = provider.fetchDailyBars("spy", LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4));

        assertThat(bars).extracting(DailyBar::date)
                .containsExactly(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4));
        assertThat(bars.get(0).close()).isEqualTo(467.0);
        assertThat(bars.get(1).volume()).isZero();
    }

    @Test
    void missingFileIsMissingMarketData() {
        assertThatThrownBy(() -> provider.fetchDailyBars("QQQ", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1)))
                .isInstanceOf(MissingMarketDataException.class);
    }

    @Test
    void malformedRowIsReported() throws IOException {
        Files.writeString(dataDir.resolve("BAD.csv"), "date,open,high,low,close,volume\n2024-01-02,abc,1,1,1,1\n");

        assertThatThrownBy(() -> provider.fetchDailyBars("BAD", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed row 2");
    }
}
