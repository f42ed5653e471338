package com.optionsvalidator.domain.enums;

public enum TrendRegime {
    STRONG_UPTREND(1.0),
    WEAK_UPTREND(0.8),
    RANGING(0.6),
    WEAK_DOWNTREND(0.5),
    STRONG_DOWNTREND(0.3);

    private final double positionScale;

    TrendRegime(double positionScale) {
        this.positionScale = positionScale;
    }

    public double getPositionScale() {
        return positionScale;
    }

    public boolean isUp() {
        return this == STRONG_UPTREND || this == WEAK_UPTREND;
    }

    public boolean isDown() {
        return this == STRONG_DOWNTREND || this == WEAK_DOWNTREND;
    }
}
