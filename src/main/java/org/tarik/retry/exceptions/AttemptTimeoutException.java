package org.tarik.retry.exceptions;

import java.time.Duration;

/**
 * Exception which replaces the failure of an attempt that exceeded its timeout.
 */
public class AttemptTimeoutException extends RuntimeException {
    private final Duration timeout;

    public AttemptTimeoutException(Duration timeout, Throwable cause) {
        super("Attempt timeout: the operation didn't complete within %d ms".formatted(timeout.toMillis()), cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
