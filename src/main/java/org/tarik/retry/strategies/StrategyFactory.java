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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.RetryConfig;
import org.tarik.retry.exceptions.StrategyConfigurationException;

/**
 * Creates strategies by their registry alias. An unknown alias is a configuration error, while a strategy which fails
 * to initialize is replaced by an {@link ExponentialBackoffStrategy}.
 */
public final class StrategyFactory {
    private static final Logger LOG = LoggerFactory.getLogger(StrategyFactory.class);

    private StrategyFactory() {
    }

    public static RetryStrategy create(String alias) {
        var registration = StrategyRegistry.getRegistration(alias)
                .orElseThrow(() -> new StrategyConfigurationException(
                        "Unknown retry strategy '%s'. Known strategies: %s".formatted(alias,
                                StrategyRegistry.getAllAliases())));
        return create(alias, registration);
    }

    static RetryStrategy create(String alias, StrategyRegistry.Registration<?> registration) {
        try {
            return registration.factory().get();
        } catch (RuntimeException e) {
            LOG.error("Couldn't create the '{}' retry strategy, falling back to exponential backoff", alias, e);
            return new ExponentialBackoffStrategy();
        }
    }

    public static RetryStrategy createDefault() {
        return create(RetryConfig.getDefaultStrategy());
    }
}
