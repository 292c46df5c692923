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

import java.util.Random;

import static org.tarik.retry.strategies.Delays.*;

/**
 * Delay grows as {@code baseDelay * fib(attempt + 1)}, i.e. 1, 1, 2, 3, 5, 8... times the base delay.
 */
public class FibonacciBackoffStrategy implements RetryStrategy {
    static final int MAX_EXACT_INDEX = 70;
    static final long MAX_FIBONACCI = 1_000_000_000L;
    private static final double JITTER_PERCENT = 0.2;

    @Nullable
    private final Double maxDelay;
    private final boolean withJitter;
    private final Random random;

    public FibonacciBackoffStrategy() {
        this(null, false, new Random());
    }

    public FibonacciBackoffStrategy(@Nullable Double maxDelay, boolean withJitter, Random random) {
        requireNonNegativeIfPresent(maxDelay, "maxDelay");
        this.maxDelay = maxDelay;
        this.withJitter = withJitter;
        this.random = random;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        double delay = sanitize(baseDelay * fibonacci(attempt + 1));
        if (withJitter) {
            delay = applyJitter(delay, JITTER_PERCENT, random);
        }
        return sanitize(cap(delay, maxDelay));
    }

    static long fibonacci(int n) {
        if (n <= 0) {
            return 0;
        }
        if (n > MAX_EXACT_INDEX) {
            return MAX_FIBONACCI;
        }
        long previous = 0;
        long current = 1;
        for (int i = 1; i < n; i++) {
            long next = previous + current;
            previous = current;
            current = next;
        }
        return Math.min(current, MAX_FIBONACCI);
    }
}
