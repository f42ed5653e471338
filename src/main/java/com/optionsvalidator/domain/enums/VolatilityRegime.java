package com.optionsvalidator.domain.enums;

public enum VolatilityRegime {
    LOW(1.0),
    MEDIUM(0.8),
    HIGH(0.5),
    EXTREME(0.25);

    private final double positionScale;

    VolatilityRegime(double positionScale) {
        this.positionScale = positionScale;
    }

    public double getPositionScale() {
        return positionScale;
    }
}
