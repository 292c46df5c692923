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

import java.util.Optional;
import java.util.Random;

import static org.tarik.retry.strategies.Delays.*;

/**
 * Delay grows as {@code baseDelay * multiplier^attempt}. Jitter, if configured, scales the delay by a random factor
 * within {@code ±jitterPercent} and is applied before the cap.
 */
public class ExponentialBackoffStrategy implements RetryStrategy {
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final double multiplier;
    @Nullable
    private final Double maxDelay;
    private final double jitterPercent;
    private final Random random;

    public ExponentialBackoffStrategy() {
        this(DEFAULT_MULTIPLIER, null);
    }

    public ExponentialBackoffStrategy(double multiplier, @Nullable Double maxDelay) {
        this(multiplier, maxDelay, 0, new Random());
    }

    public ExponentialBackoffStrategy(double multiplier, @Nullable Double maxDelay, double jitterPercent, Random random) {
        if (Double.isNaN(multiplier) || multiplier < 1) {
            throw new StrategyConfigurationException("multiplier must be at least 1, got " + multiplier);
        }
        requireNonNegativeIfPresent(maxDelay, "maxDelay");
        requireFraction(jitterPercent, "jitterPercent");
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitterPercent = jitterPercent;
        this.random = random;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        double delay = sanitize(baseDelay * Math.pow(multiplier, attempt));
        delay = applyJitter(delay, jitterPercent, random);
        return sanitize(cap(delay, maxDelay));
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Optional<Double> getMaxDelay() {
        return Optional.ofNullable(maxDelay);
    }

    public double getJitterPercent() {
        return jitterPercent;
    }
}
