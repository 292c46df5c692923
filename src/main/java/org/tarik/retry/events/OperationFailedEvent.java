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
package org.tarik.retry.events;

import org.tarik.retry.dto.ContextSummary;
import org.tarik.retry.dto.ExceptionHistoryEntry;

import java.time.Instant;
import java.util.List;

/**
 * Emitted exactly once when a run ends with a terminal failure.
 *
 * @param attempt          Zero-based index of the last attempt.
 * @param error            Terminal error of the run.
 * @param exceptionHistory All failures recorded during the run.
 * @param timestamp        Emission time.
 * @param context          Snapshot of the run.
 */
public record OperationFailedEvent(int attempt,
                                   Exception error,
                                   List<ExceptionHistoryEntry> exceptionHistory,
                                   Instant timestamp,
                                   ContextSummary context) {
    public OperationFailedEvent {
        exceptionHistory = List.copyOf(exceptionHistory);
    }
}
