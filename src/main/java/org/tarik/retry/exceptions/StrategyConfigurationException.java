package org.tarik.retry.exceptions;

/**
 * Exception thrown when a retry strategy is configured with invalid parameters, or can't be resolved by its alias.
 */
public class StrategyConfigurationException extends RuntimeException {
    public StrategyConfigurationException(String message) {
        super(message);
    }

    public StrategyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
