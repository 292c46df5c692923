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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

public class InMemoryCircuitBreakerStateStore implements CircuitBreakerStateStore {
    private static final InMemoryCircuitBreakerStateStore SHARED = new InMemoryCircuitBreakerStateStore();
    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();

    /**
     * Returns the process-wide store, used by breakers which should share their state across executors.
     */
    public static InMemoryCircuitBreakerStateStore shared() {
        return SHARED;
    }

    @Override
    public CircuitBreakerState get(String key) {
        return states.getOrDefault(key, CircuitBreakerState.initial());
    }

    @Override
    public CircuitBreakerState compute(String key, UnaryOperator<CircuitBreakerState> transition) {
        return states.compute(key, (k, current) ->
                transition.apply(current == null ? CircuitBreakerState.initial() : current));
    }

    @Override
    public void reset(String key) {
        states.remove(key);
    }
}
