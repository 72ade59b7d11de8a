package com.redline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-attack state. An attack is {@code PENDING} from dispatch until the target
 * answers or the attempt fails; the other three values are terminal.
 */
public enum AttackOutcome {
    PENDING,
    BYPASSED,
    BLOCKED,
    ERRORED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
