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
package org.tarik.retry.strategies;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.RetryConfig;
import org.tarik.retry.exceptions.CircuitBreakerStoreException;
import org.tarik.retry.exceptions.CircuitOpenException;
import org.tarik.retry.strategies.circuit.CircuitBreakerSettings;
import org.tarik.retry.strategies.circuit.CircuitBreakerState;
import org.tarik.retry.strategies.circuit.CircuitBreakerStateStore;
import org.tarik.retry.strategies.circuit.CircuitState;
import org.tarik.retry.strategies.circuit.InMemoryCircuitBreakerStateStore;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.retry.strategies.circuit.CircuitState.*;

/**
 * Circuit breaker around an inner strategy. The state is kept in a {@link CircuitBreakerStateStore} under the name of
 * the breaker, so all strategies with the same name and store share it.
 * <p>
 * The circuit opens once the number of failures reaches the threshold. After the reset timeout has passed since the
 * last failure, exactly one caller gets a trial attempt and the circuit becomes half-open. A successful trial closes
 * the circuit, a failed one opens it again with a fresh timer.
 * <p>
 * If the store fails, attempts are permitted or refused depending on the fail-open flag of the settings.
 */
public class CircuitBreakerStrategy extends DelegatingRetryStrategy {
    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerStrategy.class);
    public static final String DEFAULT_NAME = "default";

    private final String name;
    private final CircuitBreakerSettings settings;
    private final CircuitBreakerStateStore store;
    private final Clock clock;

    public CircuitBreakerStrategy(String name, RetryStrategy innerStrategy) {
        this(name, innerStrategy, RetryConfig.getCircuitBreakerSettings(name));
    }

    public CircuitBreakerStrategy(String name, RetryStrategy innerStrategy, CircuitBreakerSettings settings) {
        this(name, innerStrategy, settings, InMemoryCircuitBreakerStateStore.shared(), Clock.systemUTC());
    }

    public CircuitBreakerStrategy(String name, RetryStrategy innerStrategy, CircuitBreakerSettings settings,
                                  CircuitBreakerStateStore store, Clock clock) {
        super(innerStrategy);
        this.name = checkNotNull(name, "name");
        this.settings = checkNotNull(settings, "settings");
        this.store = checkNotNull(store, "store");
        this.clock = checkNotNull(clock, "clock");
    }

    @Override
    public void checkAttemptPermitted() {
        var trialGranted = new AtomicBoolean();
        CircuitBreakerState state;
        try {
            state = store.compute(name, current -> {
                trialGranted.set(false);
                if (current.state() == OPEN && current.isResetTimeoutElapsed(clock.instant(), settings.resetTimeout())) {
                    trialGranted.set(true);
                    return current.toHalfOpenTrial();
                }
                return current;
            });
        } catch (CircuitBreakerStoreException e) {
            handleStoreFailure("check the permission of an attempt", e);
            return;
        }

        if (trialGranted.get()) {
            LOG.info("Circuit breaker '{}' is half-open, permitting a trial attempt", name);
        } else if (state.state() != CLOSED) {
            LOG.debug("Circuit breaker '{}' refused the attempt in state {}", name, state.state().getLabel());
            throw new CircuitOpenException(name, state.state());
        }
        innerStrategy.checkAttemptPermitted();
    }

    @Override
    public void recordSuccess() {
        try {
            var previous = store.get(name);
            store.compute(name, CircuitBreakerState::withSuccess);
            if (previous.state() != CLOSED) {
                LOG.info("Circuit breaker '{}' closed after a successful trial", name);
            }
        } catch (CircuitBreakerStoreException e) {
            LOG.error("Circuit breaker '{}' couldn't record a success", name, e);
        }
        super.recordSuccess();
    }

    @Override
    public void recordFailure(Throwable error) {
        try {
            var state = store.compute(name, current -> current.withFailure(clock.instant(), settings.failureThreshold()));
            if (state.state() == OPEN) {
                LOG.warn("Circuit breaker '{}' is open after {} failure(s), last one: {}", name, state.failureCount(),
                        error.getMessage());
            }
        } catch (CircuitBreakerStoreException e) {
            LOG.error("Circuit breaker '{}' couldn't record a failure", name, e);
        }
        super.recordFailure(error);
    }

    @Override
    public void releaseAttempt() {
        try {
            var previous = store.get(name);
            var state = store.compute(name, CircuitBreakerState::withTrialReleased);
            if (previous.state() == HALF_OPEN && state.state() == OPEN) {
                LOG.info("Circuit breaker '{}' is open again, its half-open attempt ended without an outcome", name);
            }
        } catch (CircuitBreakerStoreException e) {
            LOG.error("Circuit breaker '{}' couldn't release an attempt", name, e);
        }
        super.releaseAttempt();
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        try {
            var state = store.get(name);
            if (state.state() == OPEN && !state.isResetTimeoutElapsed(clock.instant(), settings.resetTimeout())) {
                LOG.debug("Circuit breaker '{}' is open, no more retries", name);
                return false;
            }
        } catch (CircuitBreakerStoreException e) {
            LOG.error("Circuit breaker '{}' couldn't read its state", name, e);
            if (!settings.failOpen()) {
                return false;
            }
        }
        return innerStrategy.shouldRetry(attempt, maxAttempts, lastError);
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        try {
            if (store.get(name).state() == HALF_OPEN) {
                return 0;
            }
        } catch (CircuitBreakerStoreException e) {
            LOG.error("Circuit breaker '{}' couldn't read its state, using the delay of the inner strategy", name, e);
        }
        return innerStrategy.getDelay(attempt, baseDelay);
    }

    public CircuitState getCircuitState() {
        return store.get(name).state();
    }

    public int getFailureCount() {
        return store.get(name).failureCount();
    }

    public void reset() {
        store.reset(name);
        LOG.info("Circuit breaker '{}' was reset", name);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    public Duration getResetTimeout() {
        return settings.resetTimeout();
    }

    private void handleStoreFailure(String action, CircuitBreakerStoreException e) {
        if (settings.failOpen()) {
            LOG.error("Circuit breaker '{}' couldn't {}, permitting it since the breaker fails open", name, action, e);
            innerStrategy.checkAttemptPermitted();
        } else {
            LOG.error("Circuit breaker '{}' couldn't {}, refusing it since the breaker fails closed", name, action, e);
            throw new CircuitOpenException(name, OPEN);
        }
    }
}
