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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

import static org.tarik.retry.strategies.Delays.requirePositive;
import static org.tarik.retry.utils.CommonUtils.durationToSeconds;

/**
 * Limits the number of retries permitted within a sliding time window. The window is shared by all strategies using
 * the same storage key within the JVM. Close to the limit an additional delay is added on top of the inner one.
 */
public class RateLimitStrategy extends DelegatingRetryStrategy {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimitStrategy.class);
    private static final Map<String, Deque<Instant>> RETRIES_PER_KEY = new ConcurrentHashMap<>();
    private static final double THROTTLING_USAGE_RATIO = 0.8;
    private static final double THROTTLING_WINDOW_SHARE = 0.1;
    public static final String DEFAULT_STORAGE_KEY = "default";

    private final int maxRetriesPerWindow;
    private final Duration timeWindow;
    private final String storageKey;
    private final Clock clock;

    public RateLimitStrategy(RetryStrategy innerStrategy) {
        this(innerStrategy, 100, Duration.ofMinutes(1), DEFAULT_STORAGE_KEY, Clock.systemUTC());
    }

    public RateLimitStrategy(RetryStrategy innerStrategy, int maxRetriesPerWindow, Duration timeWindow,
                             String storageKey, Clock clock) {
        super(innerStrategy);
        requirePositive(maxRetriesPerWindow, "maxRetriesPerWindow");
        requirePositive(timeWindow.toMillis(), "timeWindow");
        this.maxRetriesPerWindow = maxRetriesPerWindow;
        this.timeWindow = timeWindow;
        this.storageKey = storageKey;
        this.clock = clock;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        double delay = innerStrategy.getDelay(attempt, baseDelay);
        int currentRate = getCurrentRate();
        if (currentRate >= maxRetriesPerWindow * THROTTLING_USAGE_RATIO) {
            double usageRatio = (double) currentRate / maxRetriesPerWindow;
            double additionalDelay = Math.ceil(usageRatio * durationToSeconds(timeWindow) * THROTTLING_WINDOW_SHARE);
            LOG.debug("Rate limit '{}' is at {} of {} retries, adding {} s of delay", storageKey, currentRate,
                    maxRetriesPerWindow, additionalDelay);
            delay = Delays.sanitize(delay + additionalDelay);
        }
        return delay;
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        if (!innerStrategy.shouldRetry(attempt, maxAttempts, lastError)) {
            return false;
        }
        var retries = retries();
        synchronized (retries) {
            evictExpired(retries);
            if (retries.size() >= maxRetriesPerWindow) {
                LOG.warn("Rate limit '{}' of {} retries per {} is exhausted", storageKey, maxRetriesPerWindow,
                        timeWindow);
                return false;
            }
            retries.addLast(clock.instant());
            return true;
        }
    }

    public int getCurrentRate() {
        var retries = retries();
        synchronized (retries) {
            evictExpired(retries);
            return retries.size();
        }
    }

    public int getRemainingRetries() {
        return Math.max(0, maxRetriesPerWindow - getCurrentRate());
    }

    /**
     * Returns the time until the oldest retry in the window expires.
     */
    public Duration getTimeUntilReset() {
        var retries = retries();
        synchronized (retries) {
            evictExpired(retries);
            var oldest = retries.peekFirst();
            if (oldest == null) {
                return Duration.ZERO;
            }
            var untilReset = Duration.between(clock.instant(), oldest.plus(timeWindow));
            return untilReset.isNegative() ? Duration.ZERO : untilReset;
        }
    }

    public void reset() {
        RETRIES_PER_KEY.remove(storageKey);
    }

    public static void resetAll() {
        RETRIES_PER_KEY.clear();
    }

    private Deque<Instant> retries() {
        return RETRIES_PER_KEY.computeIfAbsent(storageKey, key -> new ConcurrentLinkedDeque<>());
    }

    private void evictExpired(Deque<Instant> retries) {
        var windowStart = clock.instant().minus(timeWindow);
        while (!retries.isEmpty() && !retries.peekFirst().isAfter(windowStart)) {
            retries.pollFirst();
        }
    }
}
