package com.optionsvalidator.domain.model;

import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.enums.PositionStatus;
import com.optionsvalidator.domain.enums.StrategyCategory;
import com.optionsvalidator.exception.ArgumentMismatchException;
import com.optionsvalidator.exception.PositionAlreadyClosedException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.ToString;

/**
 * A single- or multi-leg options trade on one underlying.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #open} creates the position in {@link PositionStatus#OPEN}
 *   <li>{@link #calculateEntryCost} fills entry cost, entry commission and net Greeks
 *   <li>{@link #calculatePnl} prices the exit, sets realized P&amp;L and moves to
 *       {@link PositionStatus#CLOSED}. A second close is rejected with
 *       {@link PositionAlreadyClosedException}.
 * </ol>
 *
 * <p>Sign convention: entry cost is the dollar amount paid to open, so it is negative
 * for a net credit and positive for a net debit. Commissions always increase it.
 */
@Getter
@ToString
public class OptionsPosition {

    private final String symbol;
    private final StrategyCategory category;
    private final List<OptionLeg> legs;
    private final LocalDate entryDate;
    private final double entryPrice;

    private PositionStatus status = PositionStatus.OPEN;
    private LocalDate exitDate;
    private Double exitPrice;

    private boolean entryCosted;
    private double entryCost;
    private double entryCommission;
    private double exitValue;
    private double exitCommission;
    private double pnl;
    private List<Double> exitPremiums = List.of();
    private Greeks netGreeks = Greeks.ZERO;

    private OptionsPosition(
            String symbol, StrategyCategory category, List<OptionLeg> legs, LocalDate entryDate, double entryPrice) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.category = Objects.requireNonNull(category, "category");
        this.entryDate = Objects.requireNonNull(entryDate, "entryDate");
        if (legs == null || legs.isEmpty()) {
            throw new IllegalArgumentException("A position needs at least one leg");
        }
        this.legs = List.copyOf(legs);
        this.entryPrice = entryPrice;
    }

    public static OptionsPosition open(
            String symbol, StrategyCategory category, List<OptionLeg> legs, LocalDate entryDate, double entryPrice) {
        return new OptionsPosition(symbol, category, legs, entryDate, entryPrice);
    }

    /**
     * Computes the opening cash flow. Short legs contribute the credit received, long legs
     * the debit paid, and every contract pays {@code commissionPerContract}.
     *
     * @return the entry cost (negative for a net credit)
     */
    public double calculateEntryCost(double commissionPerContract) {
        ensureOpen();

        double premiumFlow = 0.0;
        Greeks net = Greeks.ZERO;
        for (OptionLeg leg : legs) {
            premiumFlow += leg.cashFlowOnOpen(leg.getPremium());
            net = net.plus(leg.getGreeks().scale(leg.getQuantity()));
        }

        this.entryCommission = totalContracts() * commissionPerContract;
        // Cash received on open lowers the cost; commission raises it
        this.entryCost = -premiumFlow + entryCommission;
        this.netGreeks = net;
        this.entryCosted = true;
        return entryCost;
    }

    /**
     * Closes the position at the given per-unit exit premiums, one per leg in leg order.
     * Short legs are bought back (cash out), long legs are sold (cash in).
     *
     * @return realized P&amp;L = exit value - entry cost
     * @throws ArgumentMismatchException       if the premium count differs from the leg count
     * @throws PositionAlreadyClosedException if the position was already closed
     */
    public double calculatePnl(List<Double> exitPremiums, double commissionPerContract) {
        ensureOpen();
        if (exitPremiums == null || exitPremiums.size() != legs.size()) {
            int actual = exitPremiums == null ? 0 : exitPremiums.size();
            throw new ArgumentMismatchException(
                    "Exit premiums (" + actual + ") must match legs (" + legs.size() + ")", legs.size(), actual);
        }
        if (!entryCosted) {
            calculateEntryCost(commissionPerContract);
        }

        double value = 0.0;
        for (int i = 0; i < legs.size(); i++) {
            OptionLeg leg = legs.get(i);
            double notional = exitPremiums.get(i) * OptionLeg.CONTRACT_MULTIPLIER * leg.contracts();
            value += leg.isShort() ? -notional : notional;
        }

        this.exitPremiums = List.copyOf(exitPremiums);
        this.exitCommission = totalContracts() * commissionPerContract;
        this.exitValue = value - exitCommission;
        this.pnl = exitValue - entryCost;
        this.status = PositionStatus.CLOSED;
        return pnl;
    }

    /** Records where and when the position is (or will be) exited. Only legal while open. */
    public void recordExit(LocalDate exitDate, Double exitPrice) {
        ensureOpen();
        this.exitDate = exitDate;
        this.exitPrice = exitPrice;
    }

    public long daysInTrade() {
        return daysInTrade(LocalDate.now());
    }

    /** Holding period: exit - entry when closed with an exit date, otherwise today - entry. */
    public long daysInTrade(LocalDate today) {
        LocalDate end = isClosed() && exitDate != null ? exitDate : today;
        return ChronoUnit.DAYS.between(entryDate, end);
    }

    /** Latest expiration across all legs. */
    public LocalDate lastExpiration() {
        return legs.stream().map(OptionLeg::getExpiration).max(LocalDate::compareTo).orElseThrow();
    }

    /**
     * Dollar amount the trade can lose, used as the basis for its percentage return.
     *
     * <p>Per option type with short legs: the strike width times contracts when a long leg
     * of the same type covers it, otherwise the short put strike (cash secured) or the
     * underlying entry price (uncovered call). The widest side less the net credit is the
     * risk. Debit trades risk the amount paid.
     */
    public double capitalAtRisk() {
        double widest = 0.0;
        for (OptionType type : OptionType.values()) {
            int shortContracts = 0;
            boolean covered = false;
            double minStrike = Double.MAX_VALUE;
            double maxStrike = 0.0;
            double maxShortStrike = 0.0;
            for (OptionLeg leg : legs) {
                if (leg.getOptionType() != type) {
                    continue;
                }
                minStrike = Math.min(minStrike, leg.getStrike());
                maxStrike = Math.max(maxStrike, leg.getStrike());
                if (leg.isShort()) {
                    shortContracts += leg.contracts();
                    maxShortStrike = Math.max(maxShortStrike, leg.getStrike());
                } else {
                    covered = true;
                }
            }
            if (shortContracts == 0) {
                continue;
            }
            double perUnit;
            if (covered) {
                perUnit = maxStrike - minStrike;
            } else {
                perUnit = type == OptionType.PUT ? maxShortStrike : entryPrice;
            }
            widest = Math.max(widest, perUnit * OptionLeg.CONTRACT_MULTIPLIER * shortContracts);
        }

        double credit = Math.max(0.0, entryCommission - entryCost);
        double risk = widest - credit;
        return risk > 0 ? risk : Math.abs(entryCost);
    }

    public int totalContracts() {
        return legs.stream().mapToInt(OptionLeg::contracts).sum();
    }

    public double getTotalCommission() {
        return entryCommission + exitCommission;
    }

    /** True when the position was opened for a net credit. */
    public boolean isCredit() {
        return entryCosted && entryCost - entryCommission < 0;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean isClosed() {
        return status == PositionStatus.CLOSED;
    }

    private void ensureOpen() {
        if (isClosed()) {
            throw new PositionAlreadyClosedException(symbol, category.getLabel());
        }
    }
}
