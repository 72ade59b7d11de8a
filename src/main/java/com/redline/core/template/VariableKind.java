package com.redline.core.template;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Random;

/**
 * Closed set of placeholder processing strategies. Each constant resolves a
 * {@link VariableRule} plus an optional caller override into a single string.
 */
public enum VariableKind {

    /** Override if present, else the default. */
    STRING("string") {
        @Override
        String resolve(String placeholder, VariableRule rule, String override, Random random) {
            return override != null ? override : nullToEmpty(rule.defaultValue());
        }
    },

    /**
     * Uniform draw from the declared choices. A caller override must name one of the
     * choices and then selects it deterministically.
     */
    RANDOM_CHOICE("random_choice") {
        @Override
        String resolve(String placeholder, VariableRule rule, String override, Random random) {
            if (rule.choices().isEmpty()) {
                throw new ValidationException(placeholder,
                        "random_choice placeholder " + placeholder + " declares no choices");
            }
            if (override != null) {
                if (!rule.choices().contains(override)) {
                    throw new ValidationException(placeholder,
                            "Override '" + override + "' for " + placeholder + " is not one of " + rule.choices());
                }
                return override;
            }
            return rule.choices().get(random.nextInt(rule.choices().size()));
        }
    },

    BASE64_ENCODE("base64_encode") {
        @Override
        String resolve(String placeholder, VariableRule rule, String override, Random random) {
            return Base64.getEncoder().encodeToString(rule.baseValue(override).getBytes(StandardCharsets.UTF_8));
        }
    },

    ROT13("rot13") {
        @Override
        String resolve(String placeholder, VariableRule rule, String override, Random random) {
            return rot13(rule.baseValue(override));
        }
    },

    LEETSPEAK("leetspeak") {
        @Override
        String resolve(String placeholder, VariableRule rule, String override, Random random) {
            return leetspeak(rule.baseValue(override));
        }
    };

    private final String tag;

    VariableKind(String tag) {
        this.tag = tag;
    }

    abstract String resolve(String placeholder, VariableRule rule, String override, Random random);

    public String tag() {
        return tag;
    }

    /** True for the deterministic encodings whose plain form may be echoed back decoded. */
    public boolean isTransform() {
        return this == BASE64_ENCODE || this == ROT13 || this == LEETSPEAK;
    }

    /**
     * Looks up a kind by its template tag. A missing tag means {@link #STRING}.
     *
     * @throws ValidationException naming the placeholder when the tag is unknown
     */
    public static VariableKind fromTag(String tag, String placeholder) {
        if (tag == null || tag.isBlank()) {
            return STRING;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (VariableKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        throw new ValidationException(placeholder,
                "Unknown variable type '" + tag + "' for placeholder " + placeholder);
    }

    static String rot13(String input) {
        var out = new StringBuilder(input.length());
        for (char c : input.toCharArray()) {
            if (c >= 'a' && c <= 'z') {
                out.append((char) ('a' + (c - 'a' + 13) % 26));
            } else if (c >= 'A' && c <= 'Z') {
                out.append((char) ('A' + (c - 'A' + 13) % 26));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String leetspeak(String input) {
        var out = new StringBuilder(input.length());
        for (char c : input.toCharArray()) {
            out.append(switch (Character.toLowerCase(c)) {
                case 'a' -> '4';
                case 'e' -> '3';
                case 'i' -> '1';
                case 'o' -> '0';
                case 's' -> '5';
                case 't' -> '7';
                default -> c;
            });
        }
        return out.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
