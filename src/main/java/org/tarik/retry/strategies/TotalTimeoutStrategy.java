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
import org.tarik.retry.RetryConfig;
import org.tarik.retry.exceptions.StrategyConfigurationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.retry.utils.CommonUtils.durationToSeconds;

/**
 * Bounds the whole run by a total time ceiling on top of the inner strategy. The start of the ceiling is the start
 * time of the run once it's prepared, or the construction time for standalone use. A prepared strategy measures the
 * elapsed time with the clock of the run.
 */
public class TotalTimeoutStrategy extends DelegatingRetryStrategy {
    private static final double EXECUTION_BUFFER_SECONDS = 0.1;

    private final Duration totalTimeout;
    private volatile Clock clock;
    private volatile Instant startTime;

    public TotalTimeoutStrategy(RetryStrategy innerStrategy) {
        this(innerStrategy, RetryConfig.getDefaultTotalTimeout(), Clock.systemUTC());
    }

    public TotalTimeoutStrategy(RetryStrategy innerStrategy, Duration totalTimeout, Clock clock) {
        super(innerStrategy);
        if (totalTimeout == null || totalTimeout.isNegative() || totalTimeout.isZero()) {
            throw new StrategyConfigurationException("totalTimeout must be positive, got " + totalTimeout);
        }
        this.totalTimeout = totalTimeout;
        this.clock = checkNotNull(clock, "clock");
        this.startTime = clock.instant();
    }

    @Override
    public void prepare(RetryContext context) {
        this.clock = context.getClock();
        this.startTime = context.getStartTime();
        super.prepare(context);
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        double requestedDelay = innerStrategy.getDelay(attempt, baseDelay);
        double remaining = durationToSeconds(totalTimeout.minus(getElapsedTime()));
        if (remaining <= 0) {
            return 0;
        }
        if (remaining < requestedDelay) {
            return Math.max(0, remaining - EXECUTION_BUFFER_SECONDS);
        }
        return requestedDelay;
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        if (getElapsedTime().compareTo(totalTimeout) >= 0) {
            return false;
        }
        return innerStrategy.shouldRetry(attempt, maxAttempts, lastError);
    }

    public Duration getElapsedTime() {
        return Duration.between(startTime, clock.instant());
    }

    public Duration getTotalTimeout() {
        return totalTimeout;
    }

    public void resetStartTime() {
        this.startTime = clock.instant();
    }
}
