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
import org.tarik.retry.exceptions.StrategyConfigurationException;

import java.util.Random;

import static org.tarik.retry.strategies.Delays.*;

/**
 * Picks a uniformly random delay within {@code [baseDelay * minFactor, min(maxDelay, baseDelay * maxFactor * 2^attempt)]},
 * which spreads the retries of concurrent clients apart.
 */
public class DecorrelatedJitterStrategy implements RetryStrategy {
    public static final double DEFAULT_MIN_FACTOR = 1.0;
    public static final double DEFAULT_MAX_FACTOR = 3.0;

    @Nullable
    private final Double maxDelay;
    private final double minFactor;
    private final double maxFactor;
    private final Random random;

    public DecorrelatedJitterStrategy() {
        this(null, DEFAULT_MIN_FACTOR, DEFAULT_MAX_FACTOR, new Random());
    }

    public DecorrelatedJitterStrategy(@Nullable Double maxDelay, double minFactor, double maxFactor, Random random) {
        requireNonNegativeIfPresent(maxDelay, "maxDelay");
        requireNonNegative(minFactor, "minFactor");
        requireNonNegative(maxFactor, "maxFactor");
        if (maxFactor < minFactor) {
            throw new StrategyConfigurationException(
                    "maxFactor (%s) must not be lower than minFactor (%s)".formatted(maxFactor, minFactor));
        }
        this.maxDelay = maxDelay;
        this.minFactor = minFactor;
        this.maxFactor = maxFactor;
        this.random = random;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        double lower = sanitize(baseDelay * minFactor);
        double upper = sanitize(cap(sanitize(baseDelay * maxFactor * Math.pow(2, attempt)), maxDelay));
        if (upper <= lower) {
            return upper;
        }
        return sanitize(lower + random.nextDouble() * (upper - lower));
    }
}
