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

import java.time.Instant;

/**
 * Criteria for dead letter retrieval. {@code null} criteria match everything, the date range is exclusive on both
 * ends.
 */
public record DeadLetterFilter(@Nullable DeadLetterStatus status,
                               @Nullable String operation,
                               @Nullable Instant createdAfter,
                               @Nullable Instant createdBefore) {

    public static DeadLetterFilter any() {
        return new DeadLetterFilter(null, null, null, null);
    }

    public static DeadLetterFilter withStatus(DeadLetterStatus status) {
        return new DeadLetterFilter(status, null, null, null);
    }

    public DeadLetterFilter forOperation(String operation) {
        return new DeadLetterFilter(status, operation, createdAfter, createdBefore);
    }

    public DeadLetterFilter createdBetween(@Nullable Instant after, @Nullable Instant before) {
        return new DeadLetterFilter(status, operation, after, before);
    }

    public boolean matches(StoredDeadLetter stored) {
        var createdAt = stored.deadLetter().createdAt();
        return (status == null || status == stored.status())
                && (operation == null || operation.equals(stored.deadLetter().operation()))
                && (createdAfter == null || createdAt.isAfter(createdAfter))
                && (createdBefore == null || createdAt.isBefore(createdBefore));
    }
}
