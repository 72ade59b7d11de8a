package com.redline.core.template;

/**
 * Thrown when a template cannot be resolved into a prompt: the template is unknown
 * or its text references a placeholder with no declared rule.
 */
public class TemplateException extends RuntimeException {

    public TemplateException(String message) {
        super(message);
    }
}
