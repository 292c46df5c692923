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

import java.util.List;

/**
 * What a custom retry predicate knows about the run when it's asked to classify a failure.
 *
 * @param attempt           Number of failures recorded before the current one.
 * @param maxRetries        Maximum number of retries of the run.
 * @param remainingAttempts Retries left before the current failure is counted.
 * @param exceptionHistory  Failures recorded so far.
 */
public record RetryCheckContext(int attempt,
                                int maxRetries,
                                int remainingAttempts,
                                List<ExceptionHistoryEntry> exceptionHistory) {
    public RetryCheckContext {
        exceptionHistory = List.copyOf(exceptionHistory);
    }
}
