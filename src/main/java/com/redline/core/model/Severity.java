package com.redline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative risk tier assigned to templates and inherited by attacks.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /** Bypasses at this tier are handed to the review queue. */
    public boolean requiresReview() {
        return this == CRITICAL || this == HIGH;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Severity is required");
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
