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
 * Dead letter as kept by a storage, together with its processing state.
 */
public record StoredDeadLetter(String id,
                               DeadLetter deadLetter,
                               DeadLetterStatus status,
                               @Nullable Object processingResult,
                               @Nullable String failureReason,
                               @Nullable Instant processedAt) {

    public static StoredDeadLetter pending(String id, DeadLetter deadLetter) {
        return new StoredDeadLetter(id, deadLetter, DeadLetterStatus.PENDING, null, null, null);
    }
}
