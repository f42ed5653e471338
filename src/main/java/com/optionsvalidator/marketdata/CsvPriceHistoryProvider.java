package com.optionsvalidator.marketdata;

import com.optionsvalidator.config.MarketDataConfig;
import com.optionsvalidator.domain.model.DailyBar;
import com.optionsvalidator.exception.MissingMarketDataException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads daily bars from {@code <directory>/<SYMBOL>.csv}.
 *
 * <p>Format: a header line followed by {@code date,open,high,low,close,volume} rows with
 * ISO dates. Blank lines are ignored; a malformed row fails the whole file.
 */
@Component
public class CsvPriceHistoryProvider implements PriceHistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvPriceHistoryProvider.class);

    private final Path directory;

    public CsvPriceHistoryProvider(MarketDataConfig marketDataConfig) {
        this.directory = Path.of(marketDataConfig.getDirectory());
    }

    @Override
    public List<DailyBar> fetchDailyBars(String symbol, LocalDate start, LocalDate end) {
        Path file = directory.resolve(symbol.toUpperCase(Locale.ROOT) + ".csv");
        if (!Files.isRegularFile(file)) {
            throw new MissingMarketDataException(symbol, "No price file for " + symbol + " at " + file);
        }

        List<DailyBar> bars = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            lineNumber++;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                DailyBar bar = parseRow(line.trim());
                if (!bar.date().isBefore(start) && !bar.date().isAfter(end)) {
                    bars.add(bar);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read price file " + file, e);
        } catch (NumberFormatException | DateTimeParseException | ArrayIndexOutOfBoundsException e) {
            throw new IllegalStateException("Malformed row " + lineNumber + " in " + file + ": " + e.getMessage(), e);
        }

        log.debug("Read {} bars for {} from {} ({} to {})", bars.size(), symbol, file, start, end);
        return bars;
    }

    private static DailyBar parseRow(String line) {
        String[] cols = line.split(",");
        return new DailyBar(
                LocalDate.parse(cols[0].trim()),
                Double.parseDouble(cols[1].trim()),
                Double.parseDouble(cols[2].trim()),
                Double.parseDouble(cols[3].trim()),
                Double.parseDouble(cols[4].trim()),
                cols.length > 5 && !cols[5].isBlank() ? (long) Double.parseDouble(cols[5].trim()) : 0L);
    }
}
