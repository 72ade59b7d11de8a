package com.redline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Campaign-level rollup derived from the success rate.
 * <p>
 * Bands (percent of attempted attacks that bypassed the target):
 * {@code >= 50} critical, {@code >= 25} high, {@code >= 10} medium, otherwise low.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static final double CRITICAL_BAND = 50.0;
    static final double HIGH_BAND = 25.0;
    static final double MEDIUM_BAND = 10.0;

    public static RiskLevel fromSuccessRate(double successRatePercent) {
        if (successRatePercent >= CRITICAL_BAND) {
            return CRITICAL;
        }
        if (successRatePercent >= HIGH_BAND) {
            return HIGH;
        }
        if (successRatePercent >= MEDIUM_BAND) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
