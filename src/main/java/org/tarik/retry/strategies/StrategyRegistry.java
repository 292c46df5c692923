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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Compile-time registry of the built-in strategies. Each strategy is known under a kebab-case alias derived from its
 * class name, e.g. {@code exponential-backoff} for {@link ExponentialBackoffStrategy}. Strategies wrapping another one
 * are created around an {@link ExponentialBackoffStrategy}.
 */
public final class StrategyRegistry {
    private static final String STRATEGY_SUFFIX = "Strategy";
    private static final ImmutableMap<String, Registration<?>> REGISTRATIONS = ImmutableMap.<String, Registration<?>>builder()
            .put(entry(ExponentialBackoffStrategy.class, ExponentialBackoffStrategy::new))
            .put(entry(LinearBackoffStrategy.class, LinearBackoffStrategy::new))
            .put(entry(FixedDelayStrategy.class, FixedDelayStrategy::new))
            .put(entry(FibonacciBackoffStrategy.class, FibonacciBackoffStrategy::new))
            .put(entry(DecorrelatedJitterStrategy.class, DecorrelatedJitterStrategy::new))
            .put(entry(TotalTimeoutStrategy.class, () -> new TotalTimeoutStrategy(new ExponentialBackoffStrategy())))
            .put(entry(ResponseContentStrategy.class,
                    () -> new ResponseContentStrategy(new ExponentialBackoffStrategy())))
            .put(entry(CustomOptionsStrategy.class, () -> new CustomOptionsStrategy(new ExponentialBackoffStrategy())))
            .put(entry(CallbackRetryStrategy.class,
                    () -> new CallbackRetryStrategy((attempt, baseDelay, maxAttempts, lastError, options) -> baseDelay)))
            .put(entry(RateLimitStrategy.class, () -> new RateLimitStrategy(new ExponentialBackoffStrategy())))
            .put(entry(CircuitBreakerStrategy.class,
                    () -> new CircuitBreakerStrategy(CircuitBreakerStrategy.DEFAULT_NAME,
                            new ExponentialBackoffStrategy())))
            .build();

    record Registration<T extends RetryStrategy>(Class<T> strategyClass, Supplier<T> factory) {
    }

    private StrategyRegistry() {
    }

    public static String classToAlias(Class<? extends RetryStrategy> strategyClass) {
        String simpleName = strategyClass.getSimpleName();
        checkArgument(simpleName.endsWith(STRATEGY_SUFFIX) && simpleName.length() > STRATEGY_SUFFIX.length(),
                "Strategy class name must end with '%s', got '%s'", STRATEGY_SUFFIX, simpleName);
        String baseName = simpleName.substring(0, simpleName.length() - STRATEGY_SUFFIX.length());
        return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_HYPHEN, baseName);
    }

    public static Optional<Class<? extends RetryStrategy>> aliasToClass(String alias) {
        return getRegistration(alias).<Class<? extends RetryStrategy>>map(Registration::strategyClass);
    }

    public static Set<String> getAllAliases() {
        return REGISTRATIONS.keySet();
    }

    static Optional<Registration<?>> getRegistration(String alias) {
        return alias == null ? Optional.empty() : Optional.ofNullable(REGISTRATIONS.get(alias.trim().toLowerCase()));
    }

    private static <T extends RetryStrategy> Map.Entry<String, Registration<?>> entry(Class<T> strategyClass,
                                                                                       Supplier<T> factory) {
        return Maps.<String, Registration<?>>immutableEntry(classToAlias(strategyClass),
                new Registration<>(strategyClass, factory));
    }
}
