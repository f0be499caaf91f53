package com.lodestar.core.config;

/**
 * Thrown when engine configuration is invalid: weights that do not sum to 1.0,
 * non-positive budgets, out-of-range thresholds. Raised while configuration objects
 * are constructed, never during a selection call.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
