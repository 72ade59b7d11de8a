package com.redline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Family of attack a template belongs to.
 */
public enum AttackCategory {
    JAILBREAK("jailbreak"),
    PROMPT_INJECTION("prompt-injection"),
    TOXICITY("toxicity"),
    DATA_LEAKAGE("data-leakage"),
    OBFUSCATION("obfuscation");

    private final String value;

    AttackCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a category label. Accepts both dashed and underscored spellings
     * ({@code prompt-injection}, {@code prompt_injection}) in any case.
     *
     * @throws IllegalArgumentException if the label names no known category
     */
    @JsonCreator
    public static AttackCategory fromValue(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Attack category is required");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (AttackCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown attack category: " + label);
    }
}
