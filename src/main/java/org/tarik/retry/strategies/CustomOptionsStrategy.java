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
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gives the caller full control over the delay and the retry decision while keeping the inner strategy as the default
 * for whatever isn't customized. Both callbacks see the options of the strategy.
 */
public class CustomOptionsStrategy extends DelegatingRetryStrategy {
    private final Map<String, Object> options = new ConcurrentHashMap<>();
    @Nullable
    private volatile DelayFunction delayFunction;
    @Nullable
    private volatile RetryPredicate retryPredicate;

    @FunctionalInterface
    public interface DelayFunction {
        double getDelay(int attempt, double baseDelay, Map<String, Object> options);
    }

    @FunctionalInterface
    public interface RetryPredicate {
        boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError, Map<String, Object> options);
    }

    public CustomOptionsStrategy(RetryStrategy innerStrategy) {
        this(innerStrategy, Map.of());
    }

    public CustomOptionsStrategy(RetryStrategy innerStrategy, Map<String, Object> options) {
        super(innerStrategy);
        this.options.putAll(options);
    }

    public CustomOptionsStrategy withDelayFunction(DelayFunction delayFunction) {
        this.delayFunction = delayFunction;
        return this;
    }

    public CustomOptionsStrategy withRetryPredicate(RetryPredicate retryPredicate) {
        this.retryPredicate = retryPredicate;
        return this;
    }

    public CustomOptionsStrategy setOption(String key, Object value) {
        options.put(key, value);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> T getOption(String key, T defaultValue) {
        return (T) options.getOrDefault(key, defaultValue);
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        var function = delayFunction;
        if (function == null) {
            return innerStrategy.getDelay(attempt, baseDelay);
        }
        return Delays.sanitize(function.getDelay(attempt, baseDelay, Map.copyOf(options)));
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        var predicate = retryPredicate;
        if (predicate == null) {
            return innerStrategy.shouldRetry(attempt, maxAttempts, lastError);
        }
        return predicate.shouldRetry(attempt, maxAttempts, lastError, Map.copyOf(options));
    }
}
