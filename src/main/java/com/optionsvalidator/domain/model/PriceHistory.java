package com.optionsvalidator.domain.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Daily price series for one symbol with its derived volatility columns.
 *
 * <p>Derived per bar (NaN until the window is full):
 * <ul>
 *   <li>HV20 / HV30 / HV60: rolling sample standard deviation of simple daily
 *       returns over 20/30/60 bars, annualized with sqrt(252)
 *   <li>IV estimate: HV30 times the configured implied-volatility multiplier
 * </ul>
 *
 * <p>Immutable. {@link #upTo(LocalDate)} returns a view truncated at a date, which is what
 * a strategy is handed so that it cannot see the future. Rolling values only look
 * backwards, so truncation does not change them.
 */
public final class PriceHistory {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private final String symbol;
    private final List<DailyBar> bars;
    private final double[] hv20;
    private final double[] hv30;
    private final double[] hv60;
    private final double[] ivEstimate;

    private PriceHistory(
            String symbol, List<DailyBar> bars, double[] hv20, double[] hv30, double[] hv60, double[] ivEstimate) {
        this.symbol = symbol;
        this.bars = bars;
        this.hv20 = hv20;
        this.hv30 = hv30;
        this.hv60 = hv60;
        this.ivEstimate = ivEstimate;
    }

    /**
     * Builds a history from raw bars, sorting by date and deriving volatility columns.
     *
     * @param ivMultiplier premium of implied over historical volatility (1.2 by default)
     */
    public static PriceHistory of(String symbol, List<DailyBar> rawBars, double ivMultiplier) {
        List<DailyBar> sorted = rawBars.stream()
                .sorted(Comparator.comparing(DailyBar::date))
                .toList();

        double[] returns = new double[sorted.size()];
        for (int i = 1; i < sorted.size(); i++) {
            double prev = sorted.get(i - 1).close();
            returns[i] = prev != 0 ? sorted.get(i).close() / prev - 1.0 : Double.NaN;
        }
        if (returns.length > 0) {
            returns[0] = Double.NaN;
        }

        double[] hv20 = rollingAnnualizedVol(returns, 20);
        double[] hv30 = rollingAnnualizedVol(returns, 30);
        double[] hv60 = rollingAnnualizedVol(returns, 60);
        double[] iv = new double[hv30.length];
        for (int i = 0; i < iv.length; i++) {
            iv[i] = hv30[i] * ivMultiplier;
        }
        return new PriceHistory(symbol, sorted, hv20, hv30, hv60, iv);
    }

    public static PriceHistory empty(String symbol) {
        double[] none = new double[0];
        return new PriceHistory(symbol, List.of(), none, none, none, none);
    }

    /** History truncated to bars on or before {@code date}. */
    public PriceHistory upTo(LocalDate date) {
        int end = indexOnOrBefore(date) + 1;
        return slice(end);
    }

    /** Index of the last bar dated on or before {@code date}, or -1 if none. */
    public int indexOnOrBefore(LocalDate date) {
        int lo = 0;
        int hi = bars.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (bars.get(mid).date().isAfter(date)) {
                hi = mid - 1;
            } else {
                found = mid;
                lo = mid + 1;
            }
        }
        return found;
    }

    /** The market snapshot in effect on {@code date}: the last bar on or before it. */
    public Optional<PricePoint> pointOnOrBefore(LocalDate date) {
        int idx = indexOnOrBefore(date);
        return idx < 0 ? Optional.empty() : Optional.of(pointAt(idx));
    }

    public Optional<DailyBar> barOnOrBefore(LocalDate date) {
        int idx = indexOnOrBefore(date);
        return idx < 0 ? Optional.empty() : Optional.of(bars.get(idx));
    }

    public PricePoint pointAt(int index) {
        DailyBar bar = bars.get(index);
        return new PricePoint(bar.date(), bar.close(), hv20[index], hv30[index], hv60[index], ivEstimate[index]);
    }

    public Optional<PricePoint> latest() {
        return bars.isEmpty() ? Optional.empty() : Optional.of(pointAt(bars.size() - 1));
    }

    public double[] closes() {
        return bars.stream().mapToDouble(DailyBar::close).toArray();
    }

    public String getSymbol() {
        return symbol;
    }

    public List<DailyBar> getBars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Optional<LocalDate> firstDate() {
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(0).date());
    }

    public Optional<LocalDate> lastDate() {
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(bars.size() - 1).date());
    }

    private PriceHistory slice(int end) {
        if (end >= bars.size()) {
            return this;
        }
        return new PriceHistory(
                symbol,
                bars.subList(0, end),
                Arrays.copyOf(hv20, end),
                Arrays.copyOf(hv30, end),
                Arrays.copyOf(hv60, end),
                Arrays.copyOf(ivEstimate, end));
    }

    private static double[] rollingAnnualizedVol(double[] returns, int window) {
        double[] out = new double[returns.length];
        Arrays.fill(out, Double.NaN);
        StandardDeviation sd = new StandardDeviation(true);
        // returns[0] is undefined, so the first full window ends at index == window
        for (int i = window; i < returns.length; i++) {
            double[] slice = Arrays.copyOfRange(returns, i - window + 1, i + 1);
            if (Arrays.stream(slice).allMatch(Double::isFinite)) {
                out[i] = sd.evaluate(slice) * Math.sqrt(TRADING_DAYS_PER_YEAR);
            }
        }
        return out;
    }

    /** Close and volatility columns for a single date. Volatility fields may be NaN. */
    public record PricePoint(LocalDate date, double close, double hv20, double hv30, double hv60, double ivEstimate) {}
}
