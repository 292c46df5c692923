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
package org.tarik.retry.deadletter;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.tarik.retry.RetryConfig;
import org.tarik.retry.RetryResult;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.retry.utils.CommonUtils.isBlank;

/**
 * Hands failed retry results over to a {@link DeadLetterQueueStorage} and processes the stored dead letters later.
 */
public class DeadLetterQueueHandler {
    private static final Logger LOG = LoggerFactory.getLogger(DeadLetterQueueHandler.class);
    private static final String UNNAMED_OPERATION = "Unnamed operation";

    private final DeadLetterQueueStorage storage;
    private final Clock clock;
    private boolean shouldLog;
    private Level logLevel;
    @Nullable
    private DeadLetterCallback callback;

    @FunctionalInterface
    public interface DeadLetterCallback {
        void onDeadLetter(RetryResult<?> result, String operation, Map<String, Object> context);
    }

    @FunctionalInterface
    public interface DeadLetterProcessor {
        @Nullable
        Object process(DeadLetter deadLetter, String id) throws Exception;
    }

    public record ProcessingOutcome(boolean success, @Nullable Object result, @Nullable String error) {
    }

    public DeadLetterQueueHandler(DeadLetterQueueStorage storage) {
        this(storage, RetryConfig.isDeadLetterFailureLoggingEnabled(), RetryConfig.getDeadLetterLogLevel(),
                Clock.systemUTC());
    }

    public DeadLetterQueueHandler(DeadLetterQueueStorage storage, boolean shouldLog, Level logLevel, Clock clock) {
        this.storage = checkNotNull(storage, "storage");
        this.shouldLog = shouldLog;
        this.logLevel = checkNotNull(logLevel, "logLevel");
        this.clock = checkNotNull(clock, "clock");
    }

    public DeadLetterQueueHandler withCallback(DeadLetterCallback callback) {
        this.callback = callback;
        return this;
    }

    public DeadLetterQueueHandler withLogging(boolean shouldLog) {
        this.shouldLog = shouldLog;
        return this;
    }

    public DeadLetterQueueHandler withLogLevel(Level logLevel) {
        this.logLevel = checkNotNull(logLevel, "logLevel");
        return this;
    }

    /**
     * Stores the failed result as a dead letter.
     *
     * @return ID of the stored dead letter, empty if the result didn't fail.
     */
    public Optional<String> handle(RetryResult<?> result, String operation, Map<String, Object> context) {
        if (!result.failed()) {
            return Optional.empty();
        }
        var deadLetter = DeadLetter.from(result, operation, context, clock.instant());
        if (shouldLog) {
            LOG.atLevel(logLevel).log("Retry operation failed after {} attempts: {}. Error: {}",
                    deadLetter.exceptionHistory().size(),
                    isBlank(deadLetter.operation()) ? UNNAMED_OPERATION : deadLetter.operation(),
                    deadLetter.errorMessage());
        }
        if (callback != null) {
            try {
                callback.onDeadLetter(result, deadLetter.operation(), deadLetter.context());
            } catch (RuntimeException e) {
                LOG.error("Dead letter callback failed for operation '{}'", deadLetter.operation(), e);
            }
        }
        var id = storage.store(deadLetter);
        LOG.debug("Stored dead letter {} for operation '{}'", id, deadLetter.operation());
        return Optional.of(id);
    }

    /**
     * Runs the processor on the matching dead letters and marks each of them as processed or failed.
     *
     * @return Outcome of processing per dead letter ID, in retrieval order.
     */
    public Map<String, ProcessingOutcome> processQueue(DeadLetterProcessor processor, int limit,
                                                       DeadLetterFilter filter) {
        checkArgument(limit > 0, "limit must be positive, got %s", limit);
        Map<String, ProcessingOutcome> outcomes = new LinkedHashMap<>();
        for (var stored : storage.retrieve(limit, filter)) {
            try {
                var processingResult = processor.process(stored.deadLetter(), stored.id());
                storage.markAsProcessed(stored.id(), processingResult);
                outcomes.put(stored.id(), new ProcessingOutcome(true, processingResult, null));
            } catch (Exception e) {
                storage.markAsFailed(stored.id(), String.valueOf(e.getMessage()));
                outcomes.put(stored.id(), new ProcessingOutcome(false, null, e.getMessage()));
                if (shouldLog) {
                    LOG.error("Failed to process dead letter {}", stored.id(), e);
                }
            }
        }
        return outcomes;
    }
}
