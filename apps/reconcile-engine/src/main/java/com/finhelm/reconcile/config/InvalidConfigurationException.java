package com.finhelm.reconcile.config;

/**
 * Raised when matching or detection settings are out of range. Kept apart from data-quality
 * problems, which never throw.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
