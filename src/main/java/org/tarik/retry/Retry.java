/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.retry;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.dto.ExceptionHistoryEntry;
import org.tarik.retry.dto.RetryCheckContext;
import org.tarik.retry.error.ErrorCategory;
import org.tarik.retry.error.RetryPolicy;
import org.tarik.retry.error.RetryPolicyProvider;
import org.tarik.retry.events.OperationFailedEvent;
import org.tarik.retry.events.OperationSucceededEvent;
import org.tarik.retry.events.RetryListener;
import org.tarik.retry.events.RetryingOperationEvent;
import org.tarik.retry.exceptions.AttemptTimeoutException;
import org.tarik.retry.exceptions.CircuitOpenException;
import org.tarik.retry.exceptions.RetryCancelledException;
import org.tarik.retry.handlers.ExceptionClassifier;
import org.tarik.retry.handlers.ExceptionHandlerManager;
import org.tarik.retry.strategies.RetryStrategy;
import org.tarik.retry.strategies.StrategyFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiPredicate;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.retry.error.ErrorCategory.*;
import static org.tarik.retry.utils.CommonUtils.secondsToDuration;

/**
 * Executes operations and retries their transient failures.
 * <p>
 * Each run makes at most {@code maxRetries + 1} attempts in the calling thread. A failure is retried if it's
 * retryable, attempts remain and the strategy agrees. A failure is retryable if the custom retry condition, when set,
 * accepts it, and the failure or one of its causes matches a retryable exception type or message pattern. The retry
 * condition can only reject failures, it can't make a failure retryable on its own.
 * <p>
 * {@link Error}s thrown by the operation aren't handled and propagate to the caller right away.
 * <p>
 * An executor can be reused for subsequent runs but isn't meant to run operations concurrently. The results of the
 * last run stay available for inspection.
 */
public class Retry {
    private static final Logger LOG = LoggerFactory.getLogger(Retry.class);

    private int maxRetries;
    private double retryDelay;
    private Duration timeout;
    private RetryStrategy strategy;
    private final ExceptionHandlerManager handlerManager;
    private final List<RetryListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Object> pendingMetadata = new LinkedHashMap<>();
    @Nullable
    private BiPredicate<Exception, RetryCheckContext> retryCondition;
    @Nullable
    private Consumer<String> progressCallback;
    @Nullable
    private CancellationToken cancellationToken;
    private boolean dispatchEvents = RetryConfig.isEventDispatchEnabled();
    private boolean useDefaultPatterns = true;
    private Clock clock = Clock.systemUTC();
    @Nullable
    private RetryContext lastContext;

    public Retry() {
        this(RetryConfig.getDefaultMaxRetries(), RetryConfig.getDefaultRetryDelaySeconds(),
                RetryConfig.getDefaultTimeout(), StrategyFactory.createDefault(), new ExceptionHandlerManager());
    }

    public Retry(int maxRetries, double retryDelay, Duration timeout, RetryStrategy strategy,
                 ExceptionHandlerManager handlerManager) {
        maxRetries(maxRetries);
        retryDelay(retryDelay);
        timeout(timeout);
        withStrategy(strategy);
        this.handlerManager = checkNotNull(handlerManager, "handlerManager").registerDefaultHandlers();
    }

    public Retry maxRetries(int maxRetries) {
        checkArgument(maxRetries >= 0, "maxRetries must not be negative, got %s", maxRetries);
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * Sets the base delay handed to the strategy, in seconds.
     */
    public Retry retryDelay(double retryDelay) {
        checkArgument(retryDelay >= 0, "retryDelay must not be negative, got %s", retryDelay);
        this.retryDelay = retryDelay;
        return this;
    }

    /**
     * Sets the timeout of a single attempt. A zero timeout disables it.
     */
    public Retry timeout(Duration timeout) {
        checkNotNull(timeout, "timeout");
        checkArgument(!timeout.isNegative(), "timeout must not be negative, got %s", timeout);
        this.timeout = timeout;
        return this;
    }

    public Retry withStrategy(RetryStrategy strategy) {
        this.strategy = checkNotNull(strategy, "strategy");
        return this;
    }

    /**
     * Sets the condition a failure must meet to be retried, on top of matching a retryable type or pattern.
     */
    public Retry retryIf(BiPredicate<Exception, RetryCheckContext> condition) {
        this.retryCondition = checkNotNull(condition, "condition");
        return this;
    }

    /**
     * Prevents retries of failures which meet the condition.
     */
    public Retry retryUnless(BiPredicate<Exception, RetryCheckContext> condition) {
        checkNotNull(condition, "condition");
        return retryIf(condition.negate());
    }

    /**
     * Sets a consumer of human-readable progress messages, one per retry.
     */
    public Retry withProgress(Consumer<String> progressCallback) {
        this.progressCallback = checkNotNull(progressCallback, "progressCallback");
        return this;
    }

    public Retry withMetadata(Map<String, ?> metadata) {
        pendingMetadata.putAll(metadata);
        return this;
    }

    public Retry withListener(RetryListener listener) {
        listeners.add(checkNotNull(listener, "listener"));
        return this;
    }

    public Retry dispatchEvents(boolean dispatchEvents) {
        this.dispatchEvents = dispatchEvents;
        return this;
    }

    /**
     * Disables the built-in retryable message patterns. Patterns of the exception handlers still apply.
     */
    public Retry withoutDefaultPatterns() {
        this.useDefaultPatterns = false;
        return this;
    }

    public Retry withCancellationToken(CancellationToken cancellationToken) {
        this.cancellationToken = checkNotNull(cancellationToken, "cancellationToken");
        return this;
    }

    public Retry withClock(Clock clock) {
        this.clock = checkNotNull(clock, "clock");
        return this;
    }

    public <T> RetryResult<T> run(Callable<T> operation) {
        return run(operation, List.of(), List.of());
    }

    public <T> RetryResult<T> run(Callable<T> operation, List<String> additionalPatterns) {
        return run(operation, additionalPatterns, List.of());
    }

    /**
     * Runs the operation until it succeeds, fails with a non-retryable error or runs out of attempts.
     *
     * @param operation            The operation to run. If it implements {@link RetryPolicyProvider}, its policy
     *                             overrides the settings of this executor for this run.
     * @param additionalPatterns   Retryable message patterns for this run only.
     * @param additionalExceptions Retryable exception types for this run only.
     * @return The result of the run. Failures are never thrown but returned as part of the result.
     */
    public <T> RetryResult<T> run(@NotNull Callable<T> operation, @NotNull List<String> additionalPatterns,
                                  @NotNull List<Class<? extends Throwable>> additionalExceptions) {
        checkNotNull(operation, "operation");
        var run = new RunSettings(resolvePolicy(operation));
        var classifier = createClassifier(run.policy, additionalPatterns, additionalExceptions);
        var context = new RetryContext(run.maxRetries, null, clock);
        context.addMetadata(pendingMetadata);
        this.lastContext = context;
        var token = cancellationToken == null ? new CancellationToken() : cancellationToken;
        run.strategy.prepare(context);
        LOG.debug("Starting operation {} with up to {} retries", context.getOperationId(), run.maxRetries);

        Exception lastError = null;
        for (int attempt = 0; attempt <= run.maxRetries; attempt++) {
            if (token.isCancelled()) {
                return cancelled(context, attempt, null);
            }
            try {
                run.strategy.checkAttemptPermitted();
            } catch (CircuitOpenException e) {
                LOG.warn("Operation {} wasn't attempted: {}", context.getOperationId(), e.getMessage());
                return failed(context, attempt, e, CIRCUIT_OPEN);
            }

            var attemptStart = clock.instant();
            AttemptOutcome<T> outcome;
            try {
                outcome = invoke(operation, run.timeout, token);
            } catch (Error e) {
                run.strategy.releaseAttempt();
                throw e;
            }
            var duration = Duration.between(attemptStart, clock.instant());

            if (token.isCancelled()) {
                Thread.interrupted();
                run.strategy.releaseAttempt();
                return cancelled(context, attempt, outcome.error());
            }
            Exception error = outcome.timedOut() ? new AttemptTimeoutException(run.timeout, outcome.error())
                    : outcome.error();
            if (error == null) {
                return succeeded(context, attempt, outcome.value(), duration, run.strategy);
            }
            if (error instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.currentThread().interrupt();
                run.strategy.releaseAttempt();
                return cancelled(context, attempt, error);
            }

            run.strategy.recordFailure(error);
            boolean retryable = isRetryable(error, classifier, context, attempt, run.maxRetries);
            boolean willRetry;
            Duration delay;
            try {
                willRetry = retryable && attempt < run.maxRetries
                        && run.strategy.shouldRetry(attempt, run.maxRetries, error);
                delay = willRetry ? secondsToDuration(run.strategy.getDelay(attempt, run.retryDelay)) : null;
            } catch (RuntimeException e) {
                LOG.error("Retry strategy failed while handling the failure of attempt {} of operation {}",
                        attempt + 1, context.getOperationId(), e);
                context.recordAttempt(attempt, error, false, null, duration);
                e.addSuppressed(error);
                return failed(context, attempt, e, NON_RETRYABLE);
            }
            context.recordAttempt(attempt, error, retryable, delay, duration);
            lastError = error;
            if (!willRetry) {
                LOG.error("Operation {} failed on attempt {} with a {} error: {}", context.getOperationId(),
                        attempt + 1, retryable ? "retryable" : "non-retryable", error.getMessage());
                return failed(context, attempt, error, retryable ? RETRYABLE_EXHAUSTED : NON_RETRYABLE);
            }

            int retry = attempt + 1;
            LOG.warn("Attempt {} of operation {} failed: {}. Retrying in {} ms", retry, context.getOperationId(),
                    error.getMessage(), delay.toMillis());
            reportProgress("Attempt %d failed: %s. Retrying in %d ms (retry %d of %d)".formatted(retry,
                    error.getMessage(), delay.toMillis(), retry, run.maxRetries));
            dispatch(listener -> listener.onRetrying(new RetryingOperationEvent(retry, run.maxRetries, delay, error,
                    clock.instant(), context.getSummary())));
            if (waitForRetry(delay, token)) {
                return cancelled(context, retry, null);
            }
        }

        checkNotNull(lastError, "Retry loop finished without an outcome");
        return failed(context, run.maxRetries, lastError, RETRYABLE_EXHAUSTED);
    }

    /**
     * Same as {@link #run(Callable, List, List)}, but returns the value of the operation or throws the terminal
     * error.
     */
    public <T> T execute(Callable<T> operation, List<String> additionalPatterns,
                         List<Class<? extends Throwable>> additionalExceptions) throws Exception {
        return run(operation, additionalPatterns, additionalExceptions).value();
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, List.of(), List.of());
    }

    public List<ExceptionHistoryEntry> getExceptionHistory() {
        return lastContext == null ? List.of() : lastContext.getExceptionHistory();
    }

    public int getExceptionCount() {
        return getExceptionHistory().size();
    }

    public int getRetryableExceptionCount() {
        return (int) getExceptionHistory().stream().filter(ExceptionHistoryEntry::wasRetryable).count();
    }

    public Optional<RetryContext> getLastContext() {
        return Optional.ofNullable(lastContext);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public double getRetryDelay() {
        return retryDelay;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public RetryStrategy getStrategy() {
        return strategy;
    }

    public ExceptionHandlerManager getHandlerManager() {
        return handlerManager;
    }

    private RetryPolicy resolvePolicy(Callable<?> operation) {
        if (operation instanceof RetryPolicyProvider provider) {
            var policy = provider.getRetryPolicy();
            if (policy != null) {
                LOG.debug("Using the retry policy provided by the operation: {}", policy);
                return policy;
            }
        }
        return RetryPolicy.none();
    }

    private ExceptionClassifier createClassifier(RetryPolicy policy, List<String> additionalPatterns,
                                                 List<Class<? extends Throwable>> additionalExceptions) {
        List<String> patterns = new ArrayList<>(handlerManager.getAllPatterns());
        patterns.addAll(additionalPatterns);
        patterns.addAll(policy.additionalPatterns());
        List<Class<? extends Throwable>> exceptions = new ArrayList<>(handlerManager.getAllExceptions());
        exceptions.addAll(additionalExceptions);
        exceptions.addAll(policy.additionalExceptions());
        return new ExceptionClassifier(patterns, exceptions, useDefaultPatterns);
    }

    private boolean isRetryable(Exception error, ExceptionClassifier classifier, RetryContext context, int attempt,
                                int maxRetries) {
        if (retryCondition != null) {
            var checkContext = new RetryCheckContext(attempt, maxRetries, Math.max(0, maxRetries - attempt),
                    context.getExceptionHistory());
            try {
                if (!retryCondition.test(error, checkContext)) {
                    LOG.debug("Retry condition rejected the failure of attempt {}", attempt + 1);
                    return false;
                }
            } catch (RuntimeException e) {
                LOG.error("Retry condition failed, treating the failure of attempt {} as non-retryable", attempt + 1,
                        e);
                return false;
            }
        }
        var match = classifier.findMatch(error);
        match.ifPresent(rule -> LOG.debug("Failure of attempt {} is retryable, it matches {}", attempt + 1, rule));
        return match.isPresent();
    }

    private <T> AttemptOutcome<T> invoke(Callable<T> operation, Duration timeout, CancellationToken token) {
        token.register(Thread.currentThread());
        T value = null;
        Exception error = null;
        boolean timedOut;
        try (var timer = AttemptTimer.start(timeout)) {
            try {
                value = operation.call();
            } catch (Exception e) {
                error = e;
            } finally {
                timedOut = timer.hasTimedOut();
            }
        } finally {
            token.unregister();
        }
        return new AttemptOutcome<>(value, error, timedOut);
    }

    private record AttemptOutcome<T>(@Nullable T value, @Nullable Exception error, boolean timedOut) {
    }

    private boolean waitForRetry(Duration delay, CancellationToken token) {
        if (delay.isZero()) {
            return false;
        }
        try {
            return token.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the next attempt");
            return true;
        }
    }

    private <T> RetryResult<T> succeeded(RetryContext context, int attempt, @Nullable T value, Duration duration,
                                         RetryStrategy strategy) {
        context.recordAttempt(attempt, null, false, null, duration);
        strategy.recordSuccess();
        LOG.debug("Operation {} succeeded on attempt {}", context.getOperationId(), attempt + 1);
        dispatch(listener -> listener.onSucceeded(new OperationSucceededEvent(attempt, value, context.getElapsedTime(),
                clock.instant(), context.getSummary())));
        return RetryResult.success(value, context.getExceptionHistory());
    }

    private <T> RetryResult<T> failed(RetryContext context, int attempt, Exception error, ErrorCategory category) {
        var history = context.getExceptionHistory();
        dispatch(listener -> listener.onFailed(new OperationFailedEvent(attempt, error, history, clock.instant(),
                context.getSummary())));
        return RetryResult.failure(error, category, history);
    }

    private <T> RetryResult<T> cancelled(RetryContext context, int attempt, @Nullable Exception cause) {
        LOG.info("Operation {} was cancelled before attempt {} completed", context.getOperationId(), attempt + 1);
        return failed(context, attempt, new RetryCancelledException("Retry run was cancelled", cause), CANCELLED);
    }

    private void reportProgress(String message) {
        if (progressCallback == null) {
            return;
        }
        try {
            progressCallback.accept(message);
        } catch (RuntimeException e) {
            LOG.error("Progress callback failed", e);
        }
    }

    private void dispatch(Consumer<RetryListener> notification) {
        if (!dispatchEvents) {
            return;
        }
        for (var listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                LOG.error("Retry listener {} failed", listener.getClass().getName(), e);
            }
        }
    }

    private class RunSettings {
        private final RetryPolicy policy;
        private final int maxRetries;
        private final double retryDelay;
        private final Duration timeout;
        private final RetryStrategy strategy;

        private RunSettings(RetryPolicy policy) {
            this.policy = policy;
            this.maxRetries = valueOrDefault(policy.maxRetries(), Retry.this.maxRetries);
            this.retryDelay = valueOrDefault(policy.retryDelaySeconds(), Retry.this.retryDelay);
            this.timeout = valueOrDefault(policy.timeout(), Retry.this.timeout);
            this.strategy = valueOrDefault(policy.strategy(), Retry.this.strategy);
        }
    }

    private static <V> V valueOrDefault(@Nullable V value, V defaultValue) {
        return value == null ? defaultValue : value;
    }
}
