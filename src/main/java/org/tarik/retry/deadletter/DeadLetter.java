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

import com.google.common.base.Throwables;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.retry.RetryResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Record of a terminally failed operation, handed over to an external storage for inspection or reprocessing.
 *
 * @param operation        Name of the operation, may be empty.
 * @param errorMessage     Message of the terminal error.
 * @param errorClass       Fully qualified class name of the terminal error.
 * @param errorTrace       Stack trace of the terminal error.
 * @param exceptionHistory All failed attempts of the run.
 * @param context          Arbitrary data supplied by the caller.
 * @param createdAt        Creation time of the record.
 */
public record DeadLetter(@NotNull String operation,
                         @Nullable String errorMessage,
                         @NotNull String errorClass,
                         @NotNull String errorTrace,
                         @NotNull List<AttemptRecord> exceptionHistory,
                         @NotNull Map<String, Object> context,
                         @NotNull Instant createdAt) {

    public DeadLetter {
        operation = operation == null ? "" : operation;
        exceptionHistory = List.copyOf(exceptionHistory);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static DeadLetter from(RetryResult<?> result, String operation, Map<String, Object> context,
                                  Instant createdAt) {
        checkArgument(result.failed(), "Only failed results can become dead letters");
        var error = result.getError().orElseThrow();
        var history = result.getExceptionHistory().stream().map(AttemptRecord::from).toList();
        return new DeadLetter(operation, error.getMessage(), error.getClass().getName(),
                Throwables.getStackTraceAsString(error), history, context, createdAt);
    }
}
