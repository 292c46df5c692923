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

import java.util.List;

/**
 * Persistence of dead letters, provided by external adapters.
 */
public interface DeadLetterQueueStorage {

    /**
     * Stores the dead letter with the {@link DeadLetterStatus#PENDING} status and returns its ID.
     */
    String store(DeadLetter deadLetter);

    /**
     * Returns at most {@code limit} matching dead letters, most recent first.
     */
    List<StoredDeadLetter> retrieve(int limit, DeadLetterFilter filter);

    boolean markAsProcessed(String id, @Nullable Object result);

    boolean markAsFailed(String id, String error);

    boolean delete(String id);

    /**
     * Deletes all matching dead letters and returns their number.
     */
    int clear(DeadLetterFilter filter);

    int count(DeadLetterFilter filter);
}
