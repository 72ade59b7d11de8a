package com.redline.core.target;

/**
 * Thrown when the target model could not be reached or returned no content.
 */
public class TargetUnavailableException extends RuntimeException {

    public TargetUnavailableException(String message) {
        super(message);
    }

    public TargetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
