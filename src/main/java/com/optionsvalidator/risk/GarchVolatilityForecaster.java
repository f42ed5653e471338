package com.optionsvalidator.risk;

import com.optionsvalidator.core.stats.ReturnStatistics;
import com.optionsvalidator.exception.NumericalFitException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.springframework.stereotype.Component;

/**
 * GARCH(1,1) volatility forecast fitted by Gaussian maximum likelihood.
 *
 * <p>Model on demeaned returns e_t:
 * <ul>
 *   <li>sigma2_t = omega + alpha * e_(t-1)^2 + beta * sigma2_(t-1), sigma2_0 = sample variance
 *   <li>forecast sigma2_(T+1) = omega + alpha * e_T^2 + beta * sigma2_T
 * </ul>
 *
 * <p>Nelder-Mead searches an unconstrained space mapped onto the admissible region:
 * omega = exp(a), alpha + beta = 0.999 * sigmoid(b), alpha share = sigmoid(c). This keeps
 * omega &gt; 0, alpha, beta &gt;= 0 and alpha + beta &lt; 1 without explicit constraints.
 * Returns are scaled to percent while fitting for conditioning.
 */
@Component
public class GarchVolatilityForecaster implements VolatilityForecaster {

    private static final double SCALE = 100.0;
    private static final double MAX_PERSISTENCE = 0.999;
    private static final int MAX_EVALUATIONS = 5000;
    private static final double LOG_2PI = Math.log(2 * Math.PI);

    @Override
    public double forecastVolatility(double[] returns) {
        if (returns.length < 3) {
            throw new NumericalFitException("GARCH(1,1) needs at least 3 observations, got " + returns.length);
        }

        double mean = ReturnStatistics.mean(returns);
        double[] shocks = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            shocks[i] = (returns[i] - mean) * SCALE;
        }
        double sampleVariance = variance(shocks);
        if (!(sampleVariance > 0)) {
            throw new NumericalFitException("GARCH(1,1) cannot be fitted to a zero-variance sample");
        }

        double[] start = {
            Math.log(sampleVariance * 0.05), logit(0.95 / MAX_PERSISTENCE), logit(0.05 / 0.95)
        };

        PointValuePair optimum;
        try {
            SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-10);
            optimum = optimizer.optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new ObjectiveFunction(params -> negativeLogLikelihood(params, shocks, sampleVariance)),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new NelderMeadSimplex(3));
        } catch (TooManyEvaluationsException ex) {
            throw new NumericalFitException("GARCH(1,1) likelihood did not converge", ex);
        } catch (MathIllegalStateException ex) {
            throw new NumericalFitException("GARCH(1,1) optimizer failed: " + ex.getMessage(), ex);
        }

        double[] p = optimum.getPoint();
        double omega = Math.exp(p[0]);
        double persistence = MAX_PERSISTENCE * sigmoid(p[1]);
        double alpha = persistence * sigmoid(p[2]);
        double beta = persistence - alpha;

        double lastVariance = filter(shocks, omega, alpha, beta, sampleVariance);
        double last = shocks[shocks.length - 1];
        double forecast = omega + alpha * last * last + beta * lastVariance;
        if (!Double.isFinite(forecast) || forecast <= 0 || !Double.isFinite(optimum.getValue())) {
            throw new NumericalFitException("GARCH(1,1) produced a non-finite variance forecast");
        }
        return Math.sqrt(forecast) / SCALE;
    }

    @Override
    public String name() {
        return "GARCH(1,1)";
    }

    private static double negativeLogLikelihood(double[] params, double[] e, double initialVariance) {
        double omega = Math.exp(params[0]);
        double persistence = MAX_PERSISTENCE * sigmoid(params[1]);
        double alpha = persistence * sigmoid(params[2]);
        double beta = persistence - alpha;

        double variance = initialVariance;
        double nll = 0.0;
        for (int t = 0; t < e.length; t++) {
            if (t > 0) {
                variance = omega + alpha * e[t - 1] * e[t - 1] + beta * variance;
            }
            nll += 0.5 * (LOG_2PI + Math.log(variance) + e[t] * e[t] / variance);
        }
        return Double.isFinite(nll) ? nll : Double.MAX_VALUE;
    }

    /** Conditional variance at the last observation. */
    private static double filter(double[] e, double omega, double alpha, double beta, double initialVariance) {
        double variance = initialVariance;
        for (int t = 1; t < e.length; t++) {
            variance = omega + alpha * e[t - 1] * e[t - 1] + beta * variance;
        }
        return variance;
    }

    private static double variance(double[] values) {
        double std = ReturnStatistics.populationStd(values);
        return std * std;
    }

    private static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static double logit(double p) {
        return Math.log(p / (1.0 - p));
    }
}
