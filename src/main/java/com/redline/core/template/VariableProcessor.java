package com.redline.core.template;

import java.util.Random;

/**
 * Resolves one placeholder to its value by dispatching on the rule's {@link VariableKind}.
 * Randomness comes only from {@code random_choice} rules without an override.
 */
public class VariableProcessor {

    private final Random random;

    public VariableProcessor() {
        this(new Random());
    }

    public VariableProcessor(Random random) {
        this.random = random;
    }

    /**
     * @param placeholder placeholder name, used in error messages
     * @param rule        the placeholder's rule
     * @param override    caller-supplied value; nullable
     * @return the resolved value, never null
     * @throws ValidationException if the rule cannot produce a value
     */
    public String resolve(String placeholder, VariableRule rule, String override) {
        if (rule == null) {
            throw new ValidationException(placeholder, "No variable rule for placeholder " + placeholder);
        }
        return rule.kind().resolve(placeholder, rule, override, random);
    }

    /**
     * The plain text behind an encoded value, or null for kinds that do not encode.
     */
    public String plainPayload(VariableRule rule, String override) {
        return rule.kind().isTransform() ? rule.baseValue(override) : null;
    }
}
