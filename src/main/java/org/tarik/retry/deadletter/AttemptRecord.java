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
import org.tarik.retry.dto.ExceptionHistoryEntry;

import java.time.Duration;
import java.time.Instant;

/**
 * Serializable form of a failed attempt, detached from the exception instance.
 */
public record AttemptRecord(int attempt,
                            String errorClass,
                            @Nullable String errorMessage,
                            Instant timestamp,
                            boolean wasRetryable,
                            @Nullable Duration delay,
                            @Nullable Duration duration) {

    public static AttemptRecord from(ExceptionHistoryEntry entry) {
        return new AttemptRecord(entry.attempt(), entry.exception().getClass().getName(),
                entry.exception().getMessage(), entry.timestamp(), entry.wasRetryable(), entry.delay(),
                entry.duration());
    }
}
