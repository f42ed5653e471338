package com.optionsvalidator.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Delta/gamma/theta/vega snapshot. Used both per leg (per unit, at entry) and as the
 * net exposure of a position (leg Greek times signed quantity, summed).
 */
@Getter
@Builder
@ToString
public class Greeks {

    public static final Greeks ZERO = Greeks.of(0.0, 0.0, 0.0, 0.0);

    private final double delta;
    private final double gamma;
    private final double theta;
    private final double vega;

    public static Greeks of(double delta, double gamma, double theta, double vega) {
        return Greeks.builder().delta(delta).gamma(gamma).theta(theta).vega(vega).build();
    }

    public Greeks scale(double factor) {
        return Greeks.of(delta * factor, gamma * factor, theta * factor, vega * factor);
    }

    public Greeks plus(Greeks other) {
        return Greeks.of(delta + other.delta, gamma + other.gamma, theta + other.theta, vega + other.vega);
    }
}
