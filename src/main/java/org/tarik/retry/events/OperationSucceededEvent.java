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

import org.jetbrains.annotations.Nullable;
import org.tarik.retry.dto.ContextSummary;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted once the operation succeeded.
 *
 * @param attempt   Zero-based index of the successful attempt.
 * @param result    Value returned by the operation.
 * @param totalTime Time elapsed since the start of the run.
 * @param timestamp Emission time.
 * @param context   Snapshot of the run.
 */
public record OperationSucceededEvent(int attempt,
                                      @Nullable Object result,
                                      Duration totalTime,
                                      Instant timestamp,
                                      ContextSummary context) {
}
