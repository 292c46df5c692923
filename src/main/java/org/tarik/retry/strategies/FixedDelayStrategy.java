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

import java.util.Random;

import static org.tarik.retry.strategies.Delays.*;

public class FixedDelayStrategy implements RetryStrategy {
    private final double jitterPercent;
    private final Random random;

    public FixedDelayStrategy() {
        this(0, new Random());
    }

    public FixedDelayStrategy(double jitterPercent, Random random) {
        requireFraction(jitterPercent, "jitterPercent");
        this.jitterPercent = jitterPercent;
        this.random = random;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        return sanitize(applyJitter(baseDelay, jitterPercent, random));
    }
}
