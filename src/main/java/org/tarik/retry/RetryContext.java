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

import org.jetbrains.annotations.Nullable;
import org.tarik.retry.dto.ContextSummary;
import org.tarik.retry.dto.ExceptionHistoryEntry;
import org.tarik.retry.dto.RetryMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.time.Duration.ZERO;

/**
 * State of a single retry run: the failed attempts, caller metadata and timing metrics. A context is owned by the run
 * which created it and isn't thread-safe.
 */
public class RetryContext {
    private static final String OPERATION_ID_PREFIX = "retry_";

    private final int maxRetries;
    private final Instant startTime;
    private final String operationId;
    private final Clock clock;
    private final List<ExceptionHistoryEntry> exceptionHistory = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private int totalAttempts = 1;
    private int timedAttempts;
    private Duration totalDuration = ZERO;
    @Nullable
    private Duration minAttemptDuration;
    private Duration maxAttemptDuration = ZERO;

    public RetryContext(int maxRetries) {
        this(maxRetries, null, Clock.systemUTC());
    }

    public RetryContext(int maxRetries, @Nullable String operationId, Clock clock) {
        checkArgument(maxRetries >= 0, "maxRetries must not be negative, got %s", maxRetries);
        this.clock = checkNotNull(clock, "clock");
        this.maxRetries = maxRetries;
        this.startTime = clock.instant();
        this.operationId = operationId == null ? OPERATION_ID_PREFIX + UUID.randomUUID() : operationId;
    }

    /**
     * Records the outcome of an attempt. Only failed attempts become part of the exception history, but the duration
     * of every attempt counts for the metrics.
     */
    public void recordAttempt(int attempt, @Nullable Exception error, boolean wasRetryable, @Nullable Duration delay,
                              @Nullable Duration duration) {
        checkArgument(attempt >= 0, "attempt must not be negative, got %s", attempt);
        totalAttempts = Math.max(totalAttempts, attempt + 1);
        if (error != null) {
            exceptionHistory.add(new ExceptionHistoryEntry(attempt, error, clock.instant(), wasRetryable, delay,
                    duration));
        }
        if (duration != null) {
            updateMetrics(duration);
        }
    }

    private void updateMetrics(Duration duration) {
        timedAttempts++;
        totalDuration = totalDuration.plus(duration);
        minAttemptDuration = minAttemptDuration == null || duration.compareTo(minAttemptDuration) < 0
                ? duration
                : minAttemptDuration;
        if (duration.compareTo(maxAttemptDuration) > 0) {
            maxAttemptDuration = duration;
        }
    }

    public void addMetadata(Map<String, ?> values) {
        metadata.putAll(values);
    }

    public void addMetadata(String key, @Nullable Object value) {
        metadata.put(key, value);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @SuppressWarnings("unchecked")
    public <T> T getMetadataValue(String key, T defaultValue) {
        var value = metadata.get(key);
        return value == null ? defaultValue : (T) value;
    }

    public RetryMetrics getMetrics() {
        var average = timedAttempts == 0 ? ZERO : totalDuration.dividedBy(timedAttempts);
        return new RetryMetrics(totalDuration, getTotalDelay(), average,
                Optional.ofNullable(minAttemptDuration).orElse(ZERO), maxAttemptDuration, getElapsedTime());
    }

    public Duration getTotalDelay() {
        return exceptionHistory.stream()
                .map(ExceptionHistoryEntry::delay)
                .filter(delay -> delay != null)
                .reduce(ZERO, Duration::plus);
    }

    public Duration getElapsedTime() {
        return Duration.between(startTime, clock.instant());
    }

    public ContextSummary getSummary() {
        int retryableExceptions = (int) exceptionHistory.stream().filter(ExceptionHistoryEntry::wasRetryable).count();
        return new ContextSummary(operationId, totalAttempts, maxRetries, exceptionHistory.size(), retryableExceptions,
                getMetrics(), metadata);
    }

    public List<ExceptionHistoryEntry> getExceptionHistory() {
        return List.copyOf(exceptionHistory);
    }

    public String getOperationId() {
        return operationId;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Clock getClock() {
        return clock;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public int getTotalAttempts() {
        return totalAttempts;
    }
}
