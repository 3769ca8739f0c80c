package com.github.trinity.recovery.exception;

/**
 * A required parameter is missing or structurally invalid, for example symmetric sensing
 * requested with unequal dimensions or projected gradient descent without a projection.
 * Never retried.
 *
 * @author Sean Phillips
 */
public class ConfigurationException extends RecoveryException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
