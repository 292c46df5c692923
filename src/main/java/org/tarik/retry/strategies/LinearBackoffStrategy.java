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
package org.tarik.retry.strategies;

import org.jetbrains.annotations.Nullable;

import static org.tarik.retry.strategies.Delays.*;

/**
 * Delay grows as {@code baseDelay + increment * attempt}. Without an explicit increment the base delay is used, which
 * gives {@code baseDelay * (attempt + 1)}.
 */
public class LinearBackoffStrategy implements RetryStrategy {
    @Nullable
    private final Double increment;
    @Nullable
    private final Double maxDelay;

    public LinearBackoffStrategy() {
        this(null, null);
    }

    public LinearBackoffStrategy(@Nullable Double increment, @Nullable Double maxDelay) {
        requireNonNegativeIfPresent(increment, "increment");
        requireNonNegativeIfPresent(maxDelay, "maxDelay");
        this.increment = increment;
        this.maxDelay = maxDelay;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        double step = increment == null ? baseDelay : increment;
        return sanitize(cap(sanitize(baseDelay + step * attempt), maxDelay));
    }
}
