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
package org.tarik.retry.strategies.circuit;

import org.tarik.retry.exceptions.CircuitBreakerStoreException;

import java.util.function.UnaryOperator;

/**
 * Keyed storage of circuit breaker states. Implementations backed by a remote cache report backend failures with
 * {@link CircuitBreakerStoreException}.
 */
public interface CircuitBreakerStateStore {

    /**
     * Returns the current state of the breaker, or the initial closed state if the key is unknown.
     */
    CircuitBreakerState get(String key) throws CircuitBreakerStoreException;

    /**
     * Atomically replaces the state of the breaker with the result of the transition and returns it. The transition
     * must be side-effect free since it may be re-applied.
     */
    CircuitBreakerState compute(String key, UnaryOperator<CircuitBreakerState> transition)
            throws CircuitBreakerStoreException;

    void reset(String key) throws CircuitBreakerStoreException;
}
