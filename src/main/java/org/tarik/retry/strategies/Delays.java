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

final class Delays {
    private Delays() {
    }

    /**
     * Clamps the delay to the range of non-negative finite values. Overflowing growth saturates at the maximum.
     */
    static double sanitize(double delay) {
        if (Double.isNaN(delay) || delay <= 0) {
            return 0;
        }
        return Double.isInfinite(delay) ? Double.MAX_VALUE : delay;
    }

    static double cap(double delay, @Nullable Double maxDelay) {
        return maxDelay == null ? delay : Math.min(delay, maxDelay);
    }

    /**
     * Scales the delay by a random factor within {@code [1 - jitterPercent, 1 + jitterPercent]}.
     */
    static double applyJitter(double delay, double jitterPercent, Random random) {
        if (jitterPercent == 0) {
            return delay;
        }
        double factor = 1 + (random.nextDouble() * 2 - 1) * jitterPercent;
        return delay * factor;
    }

    static void requireNonNegative(double value, String name) {
        if (Double.isNaN(value) || value < 0) {
            throw new StrategyConfigurationException("%s must be a non-negative number, got %s".formatted(name, value));
        }
    }

    static void requireNonNegativeIfPresent(@Nullable Double value, String name) {
        if (value != null) {
            requireNonNegative(value, name);
        }
    }

    static void requireFraction(double value, String name) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new StrategyConfigurationException("%s must be within [0, 1], got %s".formatted(name, value));
        }
    }

    static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new StrategyConfigurationException("%s must be positive, got %s".formatted(name, value));
        }
    }
}
