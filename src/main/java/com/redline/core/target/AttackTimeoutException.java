package com.redline.core.target;

import java.time.Duration;

/**
 * Thrown when a target call exceeds the per-attack time budget.
 */
public class AttackTimeoutException extends RuntimeException {

    public AttackTimeoutException(Duration budget) {
        super("Target did not respond within " + budget.toSeconds() + "s");
    }
}
