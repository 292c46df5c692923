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
import org.junit.jupiter.api.Test;
import org.tarik.retry.exceptions.StrategyConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyFactoryTest {

    static class Unsuffixed implements RetryStrategy {
        @Override
        public double getDelay(int attempt, double baseDelay) {
            return baseDelay;
        }
    }

    @Test
    @DisplayName("Should register every built-in strategy under its alias")
    void shouldRegisterBuiltInStrategies() {
        assertThat(StrategyRegistry.getAllAliases()).containsExactlyInAnyOrder(
                "exponential-backoff", "linear-backoff", "fixed-delay", "fibonacci-backoff", "decorrelated-jitter",
                "total-timeout", "response-content", "custom-options", "callback-retry", "rate-limit",
                "circuit-breaker");
    }

    @Test
    @DisplayName("Should map aliases and classes onto each other")
    void shouldRoundTripAliases() {
        for (String alias : StrategyRegistry.getAllAliases()) {
            var strategyClass = StrategyRegistry.aliasToClass(alias);
            assertThat(strategyClass).isPresent();
            assertThat(StrategyRegistry.classToAlias(strategyClass.get())).isEqualTo(alias);
        }
        assertThat(StrategyRegistry.aliasToClass(" Exponential-Backoff ")).contains(ExponentialBackoffStrategy.class);
        assertThat(StrategyRegistry.aliasToClass("unknown")).isEmpty();
        assertThat(StrategyRegistry.aliasToClass(null)).isEmpty();
    }

    @Test
    @DisplayName("Should reject classes without the strategy suffix")
    void shouldRejectUnsuffixedClass() {
        assertThatThrownBy(() -> StrategyRegistry.classToAlias(Unsuffixed.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsuffixed");
    }

    @Test
    @DisplayName("Should create a strategy of the registered class for every alias")
    void shouldCreateEveryStrategy() {
        for (String alias : StrategyRegistry.getAllAliases()) {
            var strategy = StrategyFactory.create(alias);
            assertThat(strategy).isInstanceOf(StrategyRegistry.aliasToClass(alias).orElseThrow());
        }
    }

    @Test
    @DisplayName("Should wrap an exponential backoff in decorating strategies")
    void shouldWrapExponentialBackoff() {
        var strategy = (DelegatingRetryStrategy) StrategyFactory.create("rate-limit");

        assertThat(strategy.getInnerStrategy()).isInstanceOf(ExponentialBackoffStrategy.class);
    }

    @Test
    @DisplayName("Should reject an unknown alias")
    void shouldRejectUnknownAlias() {
        assertThatThrownBy(() -> StrategyFactory.create("quantum-backoff"))
                .isInstanceOf(StrategyConfigurationException.class)
                .hasMessageContaining("quantum-backoff")
                .hasMessageContaining("exponential-backoff");
    }

    @Test
    @DisplayName("Should create the configured default strategy")
    void shouldCreateDefault() {
        assertThat(StrategyFactory.createDefault()).isInstanceOf(ExponentialBackoffStrategy.class);
    }

    @Test
    @DisplayName("Should fall back to exponential backoff when the strategy fails to initialize")
    void shouldFallBackWhenFactoryFails() {
        // Given
        var registration = new StrategyRegistry.Registration<>(RateLimitStrategy.class, () -> {
            throw new IllegalStateException("Rate limit store unavailable");
        });

        // When
        var strategy = StrategyFactory.create("rate-limit", registration);

        // Then
        assertThat(strategy).isExactlyInstanceOf(ExponentialBackoffStrategy.class);
    }

    @Test
    @DisplayName("Should return the strategy built by the registered factory")
    void shouldUseRegisteredFactory() {
        // Given
        var expected = new FixedDelayStrategy();
        var registration = new StrategyRegistry.Registration<>(FixedDelayStrategy.class, () -> expected);

        // When / Then
        assertThat(StrategyFactory.create("fixed-delay", registration)).isSameAs(expected);
    }
}
