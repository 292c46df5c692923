package org.tarik.retry.error;

/**
 * Categories of terminal failures produced by a retry run.
 * Transient failures which were retried successfully never surface as a category.
 */
public enum ErrorCategory {
    /**
     * The error matched a retryable pattern or type, but no attempts were left.
     * Retry: EXHAUSTED
     * Severity: ERROR
     */
    RETRYABLE_EXHAUSTED,

    /**
     * The error matched nothing, or the custom retry predicate rejected it.
     * Retry: NO
     * Severity: ERROR
     */
    NON_RETRYABLE,

    /**
     * The circuit breaker refused the attempt, so the operation wasn't invoked.
     * Retry: NO (until the breaker's reset timeout elapses)
     * Severity: WARN
     */
    CIRCUIT_OPEN,

    /**
     * The run was cancelled externally, either while an attempt was in flight or during a backoff wait.
     * Retry: NO
     * Severity: INFO
     */
    CANCELLED,

    /**
     * A result handling callback ({@code then}, {@code catchError} or {@code andFinally}) threw.
     * Retry: NO
     * Severity: ERROR
     */
    CALLBACK_FAILURE
}
