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
package org.tarik.retry.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A single failed attempt of a retry run.
 *
 * @param attempt      Zero-based index of the attempt.
 * @param exception    The failure of the attempt.
 * @param timestamp    The moment the failure was recorded.
 * @param wasRetryable Whether the failure was classified as retryable.
 * @param delay        The backoff delay computed for the failure, only present for retryable ones.
 * @param duration     How long the attempt ran.
 */
public record ExceptionHistoryEntry(int attempt,
                                    @NotNull Exception exception,
                                    @NotNull Instant timestamp,
                                    boolean wasRetryable,
                                    @Nullable Duration delay,
                                    @Nullable Duration duration) {

    public Optional<Duration> getDelay() {
        return Optional.ofNullable(delay);
    }

    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }
}
