package com.redline.core.template;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Double-brace placeholder syntax: {@code {{NAME}}} where NAME is a letter or underscore
 * followed by letters, digits or underscores.
 */
public final class Placeholders {

    static final Pattern PATTERN = Pattern.compile("\\{\\{([A-Za-z_][A-Za-z0-9_]*)}}");

    private Placeholders() {}

    /** Placeholder names in order of first appearance. */
    public static Set<String> find(String text) {
        var names = new LinkedHashSet<String>();
        if (text == null) {
            return names;
        }
        Matcher matcher = PATTERN.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Replaces every placeholder in one left-to-right pass. Values are inserted literally
     * and never rescanned, so a value that itself contains {@code {{X}}} stays as-is.
     */
    public static String substitute(String text, Function<String, String> values) {
        Matcher matcher = PATTERN.matcher(text);
        var out = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(values.apply(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
