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
import org.tarik.retry.RetryContext;
import org.tarik.retry.exceptions.CircuitOpenException;

/**
 * Backoff strategy of a retry run: maps an attempt to the delay before the next one and decides whether the run may
 * continue at all.
 * <p>
 * The lifecycle hooks are no-ops for stateless strategies. Strategies wrapping another strategy must forward them.
 */
public interface RetryStrategy {

    /**
     * Returns the delay in seconds before the attempt following the given one.
     *
     * @param attempt   Zero-based index of the failed attempt.
     * @param baseDelay Base delay of the run, in seconds.
     * @return A non-negative, finite delay in seconds.
     */
    double getDelay(int attempt, double baseDelay);

    default boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        return attempt < maxAttempts;
    }

    /**
     * Called once before the first attempt of a run.
     */
    default void prepare(RetryContext context) {
    }

    /**
     * Called before every attempt.
     *
     * @throws CircuitOpenException if the attempt must not be made.
     */
    default void checkAttemptPermitted() throws CircuitOpenException {
    }

    default void recordSuccess() {
    }

    default void recordFailure(Throwable error) {
    }

    /**
     * Called instead of {@link #recordSuccess()} or {@link #recordFailure(Throwable)} when a permitted attempt ended
     * without an outcome, e.g. because the run was cancelled or the operation threw an {@link Error}.
     */
    default void releaseAttempt() {
    }
}
