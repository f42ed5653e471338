package com.optionsvalidator.risk;

import com.optionsvalidator.config.VaRConfig;
import com.optionsvalidator.core.stats.ReturnStatistics;
import com.optionsvalidator.domain.enums.InsufficientDataPolicy;
import com.optionsvalidator.domain.enums.VaRMethod;
import com.optionsvalidator.exception.InsufficientDataException;
import com.optionsvalidator.exception.NumericalFitException;
import com.optionsvalidator.montecarlo.RandomSource;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Value-at-Risk and Conditional VaR (expected shortfall) of a daily return series.
 *
 * <p>Methods:
 * <ul>
 *   <li>HISTORICAL: VaR_c is the (1-c) percentile of the sample; CVaR_c is the mean of
 *       the returns at or below it
 *   <li>PARAMETRIC: VaR_c = mu + z * sigma with z = N^-1(1-c) and
 *       CVaR_c = mu - sigma * n(z) / (1-c). Sigma is a GARCH(1,1) forecast when at least
 *       {@code garchMinObservations} returns are available and the fit succeeds, else the
 *       sample standard deviation
 *   <li>MONTE_CARLO: percentile VaR/CVaR of a normal sample drawn from mu and the
 *       sample standard deviation
 * </ul>
 *
 * <p>Returns are scaled by sqrt(horizon) for multi-day horizons. Non-finite values are
 * dropped first. A sample shorter than {@code minObservations} either raises
 * {@link InsufficientDataException} or yields {@link VaRResult#zero}, depending on the
 * configured {@link InsufficientDataPolicy}.
 */
@Service
public class VaRCalculator {

    private static final Logger log = LoggerFactory.getLogger(VaRCalculator.class);

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private final VaRConfig config;
    private final RandomSource randomSource;
    private final VolatilityForecaster conditionalForecaster;
    private final VolatilityForecaster sampleForecaster;

    /**
     * @param conditionalForecaster model used by PARAMETRIC on long samples (GARCH by default)
     * @param sampleForecaster      fallback for short samples and failed fits, and the
     *                              volatility MONTE_CARLO draws with
     */
    public VaRCalculator(
            VaRConfig config,
            RandomSource randomSource,
            @Qualifier("garchVolatilityForecaster") VolatilityForecaster conditionalForecaster,
            @Qualifier("sampleVolatilityForecaster") VolatilityForecaster sampleForecaster) {
        this.config = config;
        this.randomSource = randomSource;
        this.conditionalForecaster = Objects.requireNonNull(conditionalForecaster, "conditionalForecaster");
        this.sampleForecaster = Objects.requireNonNull(sampleForecaster, "sampleForecaster");
    }

    public VaRResult calculateVar(List<Double> returns, double portfolioValue) {
        return calculateVar(returns, portfolioValue, config.getConfidenceLevels());
    }

    public VaRResult calculateVar(List<Double> returns, double portfolioValue, List<Double> confidenceLevels) {
        return calculateVar(returns, portfolioValue, confidenceLevels, config.getMethod(), config.getHorizonDays());
    }

    /**
     * Calculates VaR/CVaR with an explicit method and horizon. The 95% and 99% levels are
     * always computed in addition to {@code confidenceLevels}.
     */
    public VaRResult calculateVar(
            List<Double> returns, double portfolioValue, List<Double> confidenceLevels, VaRMethod method, int horizonDays) {
        if (horizonDays < 1) {
            throw new IllegalArgumentException("horizonDays must be >= 1, got " + horizonDays);
        }
        if (returns == null) {
            throw new IllegalArgumentException("returns must not be null");
        }
        if (confidenceLevels == null || confidenceLevels.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Confidence levels must not be null, got " + confidenceLevels);
        }

        double[] sample = ReturnStatistics.finite(returns);
        if (sample.length < config.getMinObservations()) {
            if (config.getInsufficientDataPolicy() == InsufficientDataPolicy.ZERO_RESULT) {
                log.debug("Only {} returns for VaR, returning zero result", sample.length);
                return VaRResult.zero(method, horizonDays, portfolioValue, sample.length);
            }
            throw new InsufficientDataException("VaR calculation", config.getMinObservations(), sample.length);
        }

        if (horizonDays > 1) {
            double scale = Math.sqrt(horizonDays);
            for (int i = 0; i < sample.length; i++) {
                sample[i] *= scale;
            }
        }

        TreeSet<Double> levels = new TreeSet<>(confidenceLevels);
        levels.add(0.95);
        levels.add(0.99);
        for (double c : levels) {
            if (c <= 0 || c >= 1) {
                throw new IllegalArgumentException("Confidence level must be in (0, 1), got " + c);
            }
        }

        Map<Double, Double> varByLevel = new LinkedHashMap<>();
        Map<Double, Double> cvarByLevel = new LinkedHashMap<>();
        String volatilityModel = null;

        switch (method) {
            case HISTORICAL -> empirical(sample, levels, varByLevel, cvarByLevel);
            case PARAMETRIC -> {
                double mu = ReturnStatistics.mean(sample);
                VolatilityEstimate vol = forecastVolatility(sample);
                volatilityModel = vol.model();
                for (double c : levels) {
                    double z = NORM.inverseCumulativeProbability(1 - c);
                    varByLevel.put(c, mu + z * vol.sigma());
                    cvarByLevel.put(c, mu - vol.sigma() * NORM.density(z) / (1 - c));
                }
            }
            case MONTE_CARLO -> {
                double mu = ReturnStatistics.mean(sample);
                double sigma = sampleForecaster.forecastVolatility(sample);
                volatilityModel = sampleForecaster.name();
                empirical(simulateNormal(mu, sigma), levels, varByLevel, cvarByLevel);
            }
            default -> throw new IllegalArgumentException("Unsupported VaR method: " + method);
        }

        VaRResult result = VaRResult.builder()
                .var95(varByLevel.get(0.95))
                .var99(varByLevel.get(0.99))
                .cvar95(cvarByLevel.get(0.95))
                .cvar99(cvarByLevel.get(0.99))
                .method(method)
                .horizonDays(horizonDays)
                .portfolioValue(portfolioValue)
                .observations(sample.length)
                .volatilityModel(volatilityModel)
                .varByConfidence(Map.copyOf(varByLevel))
                .cvarByConfidence(Map.copyOf(cvarByLevel))
                .build();

        log.debug(
                "VaR [{} / {}d] on {} obs: VaR95={} CVaR95={} VaR99={} CVaR99={}",
                method,
                horizonDays,
                sample.length,
                result.getVar95(),
                result.getCvar95(),
                result.getVar99(),
                result.getCvar99());
        return result;
    }

    /**
     * Picks GARCH(1,1) for long samples and falls back to the sample standard deviation
     * when the sample is short or the fit fails.
     */
    VolatilityEstimate forecastVolatility(double[] sample) {
        if (sample.length >= config.getGarchMinObservations()) {
            try {
                return new VolatilityEstimate(
                        conditionalForecaster.forecastVolatility(sample), conditionalForecaster.name());
            } catch (NumericalFitException e) {
                log.debug("GARCH fit failed on {} obs, using sample volatility: {}", sample.length, e.getMessage());
            }
        }
        return new VolatilityEstimate(sampleForecaster.forecastVolatility(sample), sampleForecaster.name());
    }

    private static void empirical(
            double[] sample, Iterable<Double> levels, Map<Double, Double> varByLevel, Map<Double, Double> cvarByLevel) {
        for (double c : levels) {
            double var = ReturnStatistics.percentile(sample, (1 - c) * 100.0);
            varByLevel.put(c, var);
            cvarByLevel.put(c, ReturnStatistics.tailMean(sample, var));
        }
    }

    private double[] simulateNormal(double mu, double sigma) {
        double[] draws = new double[config.getSimulations()];
        if (sigma <= 0) {
            Arrays.fill(draws, mu);
            return draws;
        }
        RandomGenerator rng = randomSource.newGenerator();
        NormalDistribution normal = new NormalDistribution(rng, mu, sigma);
        for (int i = 0; i < draws.length; i++) {
            draws[i] = normal.sample();
        }
        return draws;
    }

    record VolatilityEstimate(double sigma, String model) {}
}
