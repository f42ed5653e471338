package com.optionsvalidator.core.processor;

import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.model.OptionQuote;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes-Merton pricer for European options with a continuous dividend yield.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)
 *   <li>Delta: e^(-qT) * N(d1) for calls, e^(-qT) * [N(d1) - 1] for puts
 *   <li>Gamma: e^(-qT) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Theta: annualized decay / 365 (per calendar day)
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T) / 100 (per 1 vol point)
 *   <li>Rho: K * T * e^(-rT) * N(d2) / 100 for calls, -K * T * e^(-rT) * N(-d2) / 100 for puts
 * </ul>
 *
 * <p>At or past expiry (T &lt;= 0) the quote is the intrinsic payoff. Delta becomes a
 * step function of moneyness and every other Greek is zero.
 *
 * <p>Stateless and thread-safe; the engine, the built-in strategies and the REST
 * layer share the singleton.
 */
@Component
public class OptionPricer {

    /** Premium of implied over historical volatility when no market IV is quoted. */
    public static final double DEFAULT_IV_MULTIPLIER = 1.2;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * Prices an option with zero dividend yield.
     *
     * @param spot              underlying price
     * @param strike            strike price
     * @param timeToExpiryYears time to expiry in years; values &lt;= 0 mean expired
     * @param riskFreeRate      continuously compounded rate as a decimal
     * @param volatility        annualized volatility as a decimal (0.20 = 20%)
     * @param type              call or put
     * @return price and Greeks
     */
    public OptionQuote price(
            double spot, double strike, double timeToExpiryYears, double riskFreeRate, double volatility, OptionType type) {
        return price(spot, strike, timeToExpiryYears, riskFreeRate, volatility, type, 0.0);
    }

    public OptionQuote price(
            double spot,
            double strike,
            double timeToExpiryYears,
            double riskFreeRate,
            double volatility,
            OptionType type,
            double dividendYield) {

        if (spot <= 0 || strike <= 0) {
            throw new IllegalArgumentException("Spot and strike must be positive: spot=" + spot + ", strike=" + strike);
        }

        boolean isCall = type == OptionType.CALL;

        if (timeToExpiryYears <= 0) {
            return expiryPayoff(spot, strike, isCall);
        }
        if (volatility <= 0) {
            throw new IllegalArgumentException("Volatility must be positive before expiry, got " + volatility);
        }

        double S = spot;
        double K = strike;
        double T = timeToExpiryYears;
        double r = riskFreeRate;
        double q = dividendYield;
        double sigma = volatility;

        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(S / K) + (r - q + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;

        double nd1 = NORM.density(d1);
        double expQT = Math.exp(-q * T);
        double expRT = Math.exp(-r * T);

        double price;
        double delta;
        double theta;
        double rho;

        if (isCall) {
            double Nd1 = NORM.cumulativeProbability(d1);
            double Nd2 = NORM.cumulativeProbability(d2);
            price = S * expQT * Nd1 - K * expRT * Nd2;
            delta = expQT * Nd1;
            theta = (-S * expQT * nd1 * sigma / (2.0 * sqrtT) + q * S * expQT * Nd1 - r * K * expRT * Nd2) / 365.0;
            rho = K * T * expRT * Nd2 / 100.0;
        } else {
            double NmD1 = NORM.cumulativeProbability(-d1);
            double NmD2 = NORM.cumulativeProbability(-d2);
            price = K * expRT * NmD2 - S * expQT * NmD1;
            delta = expQT * (NORM.cumulativeProbability(d1) - 1.0);
            theta = (-S * expQT * nd1 * sigma / (2.0 * sqrtT) - q * S * expQT * NmD1 + r * K * expRT * NmD2) / 365.0;
            rho = -K * T * expRT * NmD2 / 100.0;
        }

        // Gamma and vega are the same for calls and puts
        double gamma = expQT * nd1 / (S * sigma * sqrtT);
        double vega = S * expQT * nd1 * sqrtT / 100.0;

        return OptionQuote.builder()
                .price(Math.max(price, 0.0))
                .delta(delta)
                .gamma(gamma)
                .theta(theta)
                .vega(vega)
                .rho(rho)
                .build();
    }

    /** Implied volatility estimate using the default 1.2x premium over historical volatility. */
    public double impliedVolFromHistorical(double historicalVol) {
        return impliedVolFromHistorical(historicalVol, DEFAULT_IV_MULTIPLIER);
    }

    public double impliedVolFromHistorical(double historicalVol, double multiplier) {
        return historicalVol * multiplier;
    }

    private OptionQuote expiryPayoff(double spot, double strike, boolean isCall) {
        double intrinsic;
        double delta;
        if (isCall) {
            intrinsic = Math.max(0.0, spot - strike);
            delta = spot > strike ? 1.0 : 0.0;
        } else {
            intrinsic = Math.max(0.0, strike - spot);
            delta = spot < strike ? -1.0 : 0.0;
        }
        return OptionQuote.builder().price(intrinsic).delta(delta).build();
    }
}
