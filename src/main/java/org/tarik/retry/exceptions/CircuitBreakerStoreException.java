package org.tarik.retry.exceptions;

/**
 * Exception thrown by a circuit breaker state store which can't read or write the state of a breaker.
 */
public class CircuitBreakerStoreException extends RuntimeException {
    public CircuitBreakerStoreException(String message) {
        super(message);
    }

    public CircuitBreakerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
