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
package org.tarik.retry.strategies.circuit;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a circuit breaker. Every transition produces a new instance, so a store only needs to swap
 * values atomically per key.
 *
 * @param state           Current state of the circuit.
 * @param failureCount    Failures counted since the circuit was last closed.
 * @param lastFailureTime Moment of the most recent failure, {@code null} if none happened yet.
 * @param trialInFlight   Whether the single half-open trial has already been handed out.
 */
public record CircuitBreakerState(@NotNull CircuitState state,
                                  int failureCount,
                                  @Nullable Instant lastFailureTime,
                                  boolean trialInFlight) {

    public static CircuitBreakerState initial() {
        return new CircuitBreakerState(CircuitState.CLOSED, 0, null, false);
    }

    public boolean isResetTimeoutElapsed(Instant now, Duration resetTimeout) {
        return lastFailureTime == null || !now.isBefore(lastFailureTime.plus(resetTimeout));
    }

    public CircuitBreakerState withFailure(Instant now, int failureThreshold) {
        if (state == CircuitState.HALF_OPEN) {
            return new CircuitBreakerState(CircuitState.OPEN, failureCount + 1, now, false);
        }
        int failures = failureCount + 1;
        var newState = failures >= failureThreshold ? CircuitState.OPEN : state;
        return new CircuitBreakerState(newState, failures, now, false);
    }

    public CircuitBreakerState withSuccess() {
        return initial();
    }

    public CircuitBreakerState toHalfOpenTrial() {
        return new CircuitBreakerState(CircuitState.HALF_OPEN, failureCount, lastFailureTime, true);
    }

    /**
     * Hands the half-open trial back when it ended without an outcome. The circuit returns to OPEN with its last
     * failure time kept, so the next caller is granted a new trial right away.
     */
    public CircuitBreakerState withTrialReleased() {
        if (state != CircuitState.HALF_OPEN || !trialInFlight) {
            return this;
        }
        return new CircuitBreakerState(CircuitState.OPEN, failureCount, lastFailureTime, false);
    }
}
