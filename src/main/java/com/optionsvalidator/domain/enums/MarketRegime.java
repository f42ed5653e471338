package com.optionsvalidator.domain.enums;

public enum MarketRegime {
    BULL_LOW_VOL,
    BULL_HIGH_VOL,
    BEAR_LOW_VOL,
    BEAR_HIGH_VOL,
    RANGING_LOW_VOL,
    RANGING_HIGH_VOL,
    CRISIS
}
