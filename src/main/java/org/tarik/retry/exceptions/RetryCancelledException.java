package org.tarik.retry.exceptions;

/**
 * Exception with which a run ends when it's cancelled externally.
 */
public class RetryCancelledException extends RuntimeException {
    public RetryCancelledException(String message) {
        super(message);
    }

    public RetryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
