package com.redline.core.template;

/**
 * Thrown when a template or one of its variable rules is malformed. Fatal to the
 * instantiation that hit it, never to a whole campaign.
 */
public class ValidationException extends RuntimeException {

    private final String placeholder;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String placeholder, String message) {
        super(message);
        this.placeholder = placeholder;
    }

    /** Offending placeholder, or null when the problem is not tied to one. */
    public String getPlaceholder() {
        return placeholder;
    }
}
