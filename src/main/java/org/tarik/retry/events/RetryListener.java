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

/**
 * Observer of retry runs. Callbacks are invoked synchronously in the thread of the run: every retry produces
 * {@link #onRetrying} before its backoff wait, and the run ends with exactly one {@link #onSucceeded} or
 * {@link #onFailed}. Exceptions thrown by a listener are logged and don't affect the run.
 */
public interface RetryListener {

    default void onRetrying(RetryingOperationEvent event) {
    }

    default void onSucceeded(OperationSucceededEvent event) {
    }

    default void onFailed(OperationFailedEvent event) {
    }
}
