package com.redline.core.template;

import java.util.List;

/**
 * How a single placeholder gets its value.
 *
 * @param kind         processing strategy
 * @param defaultValue value used when no override is given; nullable
 * @param choices      candidate values for {@link VariableKind#RANDOM_CHOICE}
 * @param source       plain text fed to transform kinds; falls back to {@code defaultValue}
 * @param description  authoring note; nullable
 */
public record VariableRule(
    VariableKind kind,
    String defaultValue,
    List<String> choices,
    String source,
    String description
) {

    public VariableRule {
        kind = kind == null ? VariableKind.STRING : kind;
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static VariableRule string(String defaultValue) {
        return new VariableRule(VariableKind.STRING, defaultValue, List.of(), null, null);
    }

    public static VariableRule randomChoice(List<String> choices) {
        return new VariableRule(VariableKind.RANDOM_CHOICE, null, choices, null, null);
    }

    public static VariableRule transform(VariableKind kind, String source) {
        return new VariableRule(kind, null, List.of(), source, null);
    }

    /** Plain text a transform starts from: override, else source, else default. */
    String baseValue(String override) {
        if (override != null) {
            return override;
        }
        if (source != null) {
            return source;
        }
        return defaultValue == null ? "" : defaultValue;
    }

    public void validate(String placeholder) {
        if (kind == VariableKind.RANDOM_CHOICE && choices.isEmpty()) {
            throw new ValidationException(placeholder,
                    "random_choice placeholder " + placeholder + " declares no choices");
        }
    }
}
