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

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Strategy fully defined by callbacks. The delay callback also gets the last error and the maximum number of attempts
 * seen by the most recent retry decision.
 */
public class CallbackRetryStrategy implements RetryStrategy {
    private final DelayCallback delayCallback;
    private final RetryCallback retryCallback;
    private final Map<String, Object> options;
    @Nullable
    private volatile Throwable lastError;
    private volatile int maxAttempts = Integer.MAX_VALUE;

    @FunctionalInterface
    public interface DelayCallback {
        double getDelay(int attempt, double baseDelay, int maxAttempts, @Nullable Throwable lastError,
                        Map<String, Object> options);
    }

    @FunctionalInterface
    public interface RetryCallback {
        boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError, Map<String, Object> options);
    }

    public CallbackRetryStrategy(DelayCallback delayCallback) {
        this(delayCallback, null, Map.of());
    }

    public CallbackRetryStrategy(DelayCallback delayCallback, @Nullable RetryCallback retryCallback,
                                 Map<String, Object> options) {
        this.delayCallback = checkNotNull(delayCallback, "delayCallback");
        this.retryCallback = retryCallback == null
                ? (attempt, max, error, opts) -> attempt < max
                : retryCallback;
        this.options = Map.copyOf(options);
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        return Delays.sanitize(delayCallback.getDelay(attempt, baseDelay, maxAttempts, lastError, options));
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        this.lastError = lastError;
        this.maxAttempts = maxAttempts;
        return retryCallback.shouldRetry(attempt, maxAttempts, lastError, options);
    }

    @Override
    public void recordFailure(Throwable error) {
        this.lastError = error;
    }
}
