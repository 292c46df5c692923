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

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted before the backoff wait which precedes a retry.
 *
 * @param attempt    One-based number of the upcoming retry.
 * @param maxRetries Maximum number of retries of the run.
 * @param delay      Backoff delay before the retry.
 * @param error      Failure of the previous attempt.
 * @param timestamp  Emission time.
 * @param context    Snapshot of the run.
 */
public record RetryingOperationEvent(int attempt,
                                     int maxRetries,
                                     Duration delay,
                                     Exception error,
                                     Instant timestamp,
                                     ContextSummary context) {
}
