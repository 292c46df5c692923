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

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings of a single circuit breaker.
 *
 * @param failureThreshold Number of failures after which the circuit opens.
 * @param resetTimeout     Time after the last failure before a trial attempt is permitted.
 * @param failOpen         Whether attempts are permitted when the state store can't be reached.
 */
public record CircuitBreakerSettings(int failureThreshold, Duration resetTimeout, boolean failOpen) {
    public CircuitBreakerSettings {
        checkArgument(failureThreshold > 0, "failureThreshold must be positive, got %s", failureThreshold);
        checkNotNull(resetTimeout, "resetTimeout");
        checkArgument(!resetTimeout.isNegative(), "resetTimeout must not be negative, got %s", resetTimeout);
    }
}
