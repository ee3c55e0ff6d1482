package com.vigilant.core.config;

/**
 * Thrown when a rule or monitoring configuration is rejected at load or update
 * time. The store or monitor it was aimed at is left unchanged.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
