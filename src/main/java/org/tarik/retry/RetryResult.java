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
import org.tarik.retry.deadletter.DeadLetter;
import org.tarik.retry.deadletter.DeadLetterQueueHandler;
import org.tarik.retry.dto.ExceptionHistoryEntry;
import org.tarik.retry.error.ErrorCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.tarik.retry.error.ErrorCategory.CALLBACK_FAILURE;

/**
 * Immutable outcome of a retry run. Holds either the value of the operation or the terminal error, together with the
 * failures recorded during the run.
 * <p>
 * The chaining methods never modify the result but return a new one. A callback which throws turns the result into a
 * failure with the {@link ErrorCategory#CALLBACK_FAILURE} category.
 */
public final class RetryResult<T> {
    @Nullable
    private final T result;
    @Nullable
    private final Exception error;
    @Nullable
    private final ErrorCategory errorCategory;
    private final List<ExceptionHistoryEntry> exceptionHistory;

    private RetryResult(@Nullable T result, @Nullable Exception error, @Nullable ErrorCategory errorCategory,
                        List<ExceptionHistoryEntry> exceptionHistory) {
        this.result = result;
        this.error = error;
        this.errorCategory = errorCategory;
        this.exceptionHistory = List.copyOf(exceptionHistory);
    }

    public static <T> RetryResult<T> success(@Nullable T result, List<ExceptionHistoryEntry> exceptionHistory) {
        return new RetryResult<>(result, null, null, exceptionHistory);
    }

    public static <T> RetryResult<T> failure(Exception error, ErrorCategory errorCategory,
                                             List<ExceptionHistoryEntry> exceptionHistory) {
        return new RetryResult<>(null, checkNotNull(error, "error"), checkNotNull(errorCategory, "errorCategory"),
                exceptionHistory);
    }

    public <R> RetryResult<R> then(Function<? super T, ? extends R> callback) {
        if (error != null) {
            return new RetryResult<>(null, error, errorCategory, exceptionHistory);
        }
        try {
            return success(callback.apply(result), exceptionHistory);
        } catch (Exception e) {
            return failure(e, CALLBACK_FAILURE, exceptionHistory);
        }
    }

    public RetryResult<T> catchError(Function<? super Exception, ? extends T> callback) {
        if (error == null) {
            return this;
        }
        try {
            return success(callback.apply(error), exceptionHistory);
        } catch (Exception e) {
            return failure(e, CALLBACK_FAILURE, exceptionHistory);
        }
    }

    /**
     * Runs the callback regardless of the outcome. If the callback throws, the returned result fails with that
     * error, even if this one succeeded.
     */
    public RetryResult<T> andFinally(Runnable callback) {
        try {
            callback.run();
            return this;
        } catch (Exception e) {
            return failure(e, CALLBACK_FAILURE, exceptionHistory);
        }
    }

    @Nullable
    public T value() throws Exception {
        if (error != null) {
            throw error;
        }
        return result;
    }

    public void rethrow() throws Exception {
        if (error != null) {
            throw error;
        }
    }

    /**
     * Throws the first failure recorded during the run, which is usually the root cause of the terminal error. Falls
     * back to the terminal error if no failures were recorded.
     */
    public void throwFirst() throws Exception {
        if (!exceptionHistory.isEmpty()) {
            throw exceptionHistory.get(0).exception();
        }
        rethrow();
    }

    public Optional<T> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<ErrorCategory> getErrorCategory() {
        return Optional.ofNullable(errorCategory);
    }

    public List<ExceptionHistoryEntry> getExceptionHistory() {
        return exceptionHistory;
    }

    public boolean succeeded() {
        return error == null;
    }

    public boolean failed() {
        return error != null;
    }

    public Optional<DeadLetter> toDeadLetter(String operation, Map<String, Object> context) {
        return failed() ? Optional.of(DeadLetter.from(this, operation, context, Instant.now())) : Optional.empty();
    }

    public Optional<String> toDeadLetterQueue(DeadLetterQueueHandler handler, String operation,
                                              Map<String, Object> context) {
        return handler.handle(this, operation, context);
    }

    @Override
    public String toString() {
        return failed()
                ? "RetryResult[failed, category=%s, error=%s]".formatted(errorCategory, error)
                : "RetryResult[succeeded, result=%s]".formatted(result);
    }
}
