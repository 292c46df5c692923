package org.tarik.retry.error;

import org.jetbrains.annotations.Nullable;
import org.tarik.retry.strategies.RetryStrategy;

import java.time.Duration;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Per-operation overrides of the executor settings. Every {@code null} component keeps the executor's own value.
 *
 * @param maxRetries           Maximum number of retry attempts.
 * @param retryDelaySeconds    Base delay handed to the strategy, in seconds.
 * @param timeout              Timeout of a single attempt.
 * @param strategy             Backoff strategy for the operation.
 * @param additionalPatterns   Retryable message patterns added on top of the executor's ones.
 * @param additionalExceptions Retryable exception types added on top of the executor's ones.
 */
public record RetryPolicy(
        @Nullable Integer maxRetries,
        @Nullable Double retryDelaySeconds,
        @Nullable Duration timeout,
        @Nullable RetryStrategy strategy,
        List<String> additionalPatterns,
        List<Class<? extends Throwable>> additionalExceptions) {

    public RetryPolicy {
        checkArgument(maxRetries == null || maxRetries >= 0, "maxRetries must not be negative, got %s", maxRetries);
        checkArgument(retryDelaySeconds == null || retryDelaySeconds >= 0,
                "retryDelaySeconds must not be negative, got %s", retryDelaySeconds);
        additionalPatterns = additionalPatterns == null ? List.of() : List.copyOf(additionalPatterns);
        additionalExceptions = additionalExceptions == null ? List.of() : List.copyOf(additionalExceptions);
    }

    public RetryPolicy(@Nullable Integer maxRetries, @Nullable RetryStrategy strategy) {
        this(maxRetries, null, null, strategy, List.of(), List.of());
    }

    public static RetryPolicy none() {
        return new RetryPolicy(null, null, null, null, List.of(), List.of());
    }
}
