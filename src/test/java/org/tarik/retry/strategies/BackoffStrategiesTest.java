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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tarik.retry.exceptions.StrategyConfigurationException;

import java.util.Random;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BackoffStrategiesTest {

    @Nested
    class Exponential {
        @ParameterizedTest
        @CsvSource({"0, 1.0", "1, 2.0", "2, 4.0", "3, 8.0", "10, 1024.0"})
        @DisplayName("Should double the delay with each attempt by default")
        void shouldGrowExponentially(int attempt, double expected) {
            assertThat(new ExponentialBackoffStrategy().getDelay(attempt, 1.0)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should never decrease and never exceed the cap")
        void shouldBeMonotonicAndCapped() {
            // Given
            var strategy = new ExponentialBackoffStrategy(3.0, 30.0);

            // When
            double[] delays = IntStream.range(0, 20).mapToDouble(attempt -> strategy.getDelay(attempt, 0.5)).toArray();

            // Then
            for (int i = 1; i < delays.length; i++) {
                assertThat(delays[i]).isGreaterThanOrEqualTo(delays[i - 1]).isLessThanOrEqualTo(30.0);
            }
            assertThat(delays[delays.length - 1]).isEqualTo(30.0);
        }

        @Test
        @DisplayName("Should saturate instead of overflowing for huge attempts")
        void shouldSaturateOnOverflow() {
            double delay = new ExponentialBackoffStrategy().getDelay(5000, 1.0);

            assertThat(Double.isFinite(delay)).isTrue();
            assertThat(delay).isPositive();
        }

        @Test
        @DisplayName("Should keep jittered delays within the jitter range")
        void shouldKeepJitterWithinRange() {
            // Given
            var strategy = new ExponentialBackoffStrategy(2.0, null, 0.1, new Random(42));

            // Then
            for (int i = 0; i < 100; i++) {
                assertThat(strategy.getDelay(3, 1.0)).isBetween(7.2, 8.8);
            }
        }

        @Test
        @DisplayName("Should clamp a negative base delay to zero")
        void shouldClampNegativeBaseDelay() {
            assertThat(new ExponentialBackoffStrategy().getDelay(2, -1.0)).isZero();
        }

        @Test
        @DisplayName("Should reject invalid parameters")
        void shouldRejectInvalidParameters() {
            assertThatThrownBy(() -> new ExponentialBackoffStrategy(0.5, null))
                    .isInstanceOf(StrategyConfigurationException.class)
                    .hasMessageContaining("multiplier");
            assertThatThrownBy(() -> new ExponentialBackoffStrategy(2.0, -1.0))
                    .isInstanceOf(StrategyConfigurationException.class);
            assertThatThrownBy(() -> new ExponentialBackoffStrategy(2.0, null, 1.5, new Random()))
                    .isInstanceOf(StrategyConfigurationException.class);
        }
    }

    @Nested
    class Linear {
        @Test
        @DisplayName("Should grow by the base delay without an explicit increment")
        void shouldGrowByBaseDelay() {
            var strategy = new LinearBackoffStrategy();

            assertThat(IntStream.range(0, 4).mapToDouble(attempt -> strategy.getDelay(attempt, 2.0)))
                    .containsExactly(2.0, 4.0, 6.0, 8.0);
        }

        @Test
        @DisplayName("Should grow by the increment and respect the cap")
        void shouldGrowByIncrement() {
            var strategy = new LinearBackoffStrategy(0.5, 2.0);

            assertThat(strategy.getDelay(0, 1.0)).isEqualTo(1.0);
            assertThat(strategy.getDelay(1, 1.0)).isEqualTo(1.5);
            assertThat(strategy.getDelay(10, 1.0)).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should reject a negative increment")
        void shouldRejectNegativeIncrement() {
            assertThatThrownBy(() -> new LinearBackoffStrategy(-1.0, null))
                    .isInstanceOf(StrategyConfigurationException.class)
                    .hasMessageContaining("increment");
        }
    }

    @Nested
    class Fixed {
        @Test
        @DisplayName("Should always return the base delay without jitter")
        void shouldReturnBaseDelay() {
            var strategy = new FixedDelayStrategy();

            assertThat(strategy.getDelay(0, 1.5)).isEqualTo(1.5);
            assertThat(strategy.getDelay(25, 1.5)).isEqualTo(1.5);
        }

        @Test
        @DisplayName("Should keep jittered delays around the base delay")
        void shouldJitterAroundBaseDelay() {
            var strategy = new FixedDelayStrategy(0.25, new Random(7));

            for (int i = 0; i < 100; i++) {
                assertThat(strategy.getDelay(i, 4.0)).isBetween(3.0, 5.0);
            }
        }
    }

    @Nested
    class Fibonacci {
        @Test
        @DisplayName("Should follow the Fibonacci sequence")
        void shouldFollowSequence() {
            var strategy = new FibonacciBackoffStrategy();

            assertThat(IntStream.range(0, 7).mapToDouble(attempt -> strategy.getDelay(attempt, 1.0)))
                    .containsExactly(1.0, 1.0, 2.0, 3.0, 5.0, 8.0, 13.0);
        }

        @Test
        @DisplayName("Should bound the sequence for large indexes")
        void shouldBoundLargeIndexes() {
            assertThat(FibonacciBackoffStrategy.fibonacci(0)).isZero();
            assertThat(FibonacciBackoffStrategy.fibonacci(40)).isEqualTo(102_334_155L);
            assertThat(FibonacciBackoffStrategy.fibonacci(50)).isEqualTo(FibonacciBackoffStrategy.MAX_FIBONACCI);
            assertThat(FibonacciBackoffStrategy.fibonacci(1000)).isEqualTo(FibonacciBackoffStrategy.MAX_FIBONACCI);
        }

        @Test
        @DisplayName("Should respect the cap and the jitter range")
        void shouldRespectCapAndJitter() {
            var capped = new FibonacciBackoffStrategy(10.0, false, new Random());
            var jittered = new FibonacciBackoffStrategy(null, true, new Random(3));

            assertThat(capped.getDelay(20, 1.0)).isEqualTo(10.0);
            for (int i = 0; i < 100; i++) {
                assertThat(jittered.getDelay(4, 1.0)).isCloseTo(5.0, within(1.0));
            }
        }
    }

    @Nested
    class DecorrelatedJitter {
        @Test
        @DisplayName("Should pick delays between the lower and the upper bound")
        void shouldStayWithinBounds() {
            var strategy = new DecorrelatedJitterStrategy(null, 1.0, 3.0, new Random(11));

            for (int attempt = 0; attempt < 5; attempt++) {
                double upper = 3.0 * Math.pow(2, attempt);
                for (int i = 0; i < 50; i++) {
                    assertThat(strategy.getDelay(attempt, 1.0)).isBetween(1.0, upper);
                }
            }
        }

        @Test
        @DisplayName("Should not exceed the maximum delay")
        void shouldRespectMaxDelay() {
            var strategy = new DecorrelatedJitterStrategy(5.0, 1.0, 3.0, new Random(11));

            for (int i = 0; i < 50; i++) {
                assertThat(strategy.getDelay(10, 1.0)).isBetween(1.0, 5.0);
            }
        }

        @Test
        @DisplayName("Should reject a max factor lower than the min factor")
        void shouldRejectInvertedFactors() {
            assertThatThrownBy(() -> new DecorrelatedJitterStrategy(null, 3.0, 1.0, new Random()))
                    .isInstanceOf(StrategyConfigurationException.class)
                    .hasMessageContaining("maxFactor");
        }
    }
}
