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

package org.tarik.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.tarik.retry.strategies.circuit.CircuitBreakerSettings;
import org.tarik.retry.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;
import static org.tarik.retry.utils.CommonUtils.secondsToDuration;

public class RetryConfig {
    private static final Logger LOG = LoggerFactory.getLogger(RetryConfig.class);
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "retry.properties";
    private static final String CIRCUIT_BREAKER_SERVICES_PREFIX = "retry.circuit.breaker.services.";

    // Main Config
    private static final ConfigProperty<Integer> MAX_RETRIES = loadPropertyAsInteger("retry.max.retries",
            "RETRY_MAX_ATTEMPTS", "3", false);
    private static final ConfigProperty<Double> RETRY_DELAY_SECONDS = loadPropertyAsDouble("retry.delay.seconds",
            "RETRY_DELAY", "1.0", false);
    private static final ConfigProperty<Double> TIMEOUT_SECONDS = loadPropertyAsDouble("retry.timeout.seconds",
            "RETRY_TIMEOUT", "30", false);
    private static final ConfigProperty<Double> TOTAL_TIMEOUT_SECONDS = loadPropertyAsDouble(
            "retry.total.timeout.seconds", "RETRY_TOTAL_TIMEOUT", "300", false);
    private static final ConfigProperty<String> DEFAULT_STRATEGY = loadProperty("retry.strategy", "RETRY_STRATEGY",
            "exponential-backoff", s -> s.trim().toLowerCase(), false);
    private static final ConfigProperty<Boolean> DISPATCH_EVENTS = loadProperty("retry.dispatch.events",
            "RETRY_DISPATCH_EVENTS", "true", Boolean::parseBoolean, false);

    // Circuit Breaker Config
    private static final ConfigProperty<Integer> CIRCUIT_BREAKER_FAILURE_THRESHOLD = loadPropertyAsInteger(
            "retry.circuit.breaker.failure.threshold", "RETRY_CIRCUIT_BREAKER_FAILURE_THRESHOLD", "5", false);
    private static final ConfigProperty<Double> CIRCUIT_BREAKER_RESET_TIMEOUT_SECONDS = loadPropertyAsDouble(
            "retry.circuit.breaker.reset.timeout.seconds", "RETRY_CIRCUIT_BREAKER_RESET_TIMEOUT", "60", false);
    private static final ConfigProperty<Boolean> CIRCUIT_BREAKER_FAIL_OPEN = loadProperty(
            "retry.circuit.breaker.fail.open", "RETRY_CIRCUIT_BREAKER_FAIL_OPEN", "true", Boolean::parseBoolean,
            false);

    // Dead Letter Config
    private static final ConfigProperty<Boolean> DEAD_LETTER_LOG_FAILURES = loadProperty(
            "retry.dead.letter.log.failures", "RETRY_DLQ_LOG_FAILURES", "true", Boolean::parseBoolean, false);
    private static final ConfigProperty<Level> DEAD_LETTER_LOG_LEVEL = loadProperty("retry.dead.letter.log.level",
            "RETRY_DLQ_LOG_LEVEL", "warn", s -> stream(Level.values())
                    .filter(level -> level.name().equalsIgnoreCase(s.trim()))
                    .findAny()
                    .orElseThrow(() -> new IllegalArgumentException(
                            ("%s is not a supported log level. Supported ones: %s".formatted(s,
                                    Arrays.toString(Level.values()))))),
            false);

    // Response Content Config
    private static final ConfigProperty<List<String>> RESPONSE_CONTENT_ERROR_CODES = loadProperty(
            "retry.response.content.error.codes", "RETRY_RESPONSE_ERROR_CODES",
            "TEMPORARY_ERROR,SERVER_BUSY,RATE_LIMITED,TRY_AGAIN_LATER,RESOURCE_EXHAUSTED,SERVICE_UNAVAILABLE," +
                    "INTERNAL_ERROR,TEMPORARILY_UNAVAILABLE",
            CommonUtils::parseCommaSeparated, false);
    private static final ConfigProperty<List<String>> RESPONSE_CONTENT_ERROR_CODE_PATHS = loadProperty(
            "retry.response.content.error.code.paths", "RETRY_RESPONSE_ERROR_CODE_PATHS",
            "error.code,error_code,code,status,error.type,errorCode,error.status",
            CommonUtils::parseCommaSeparated, false);
    private static final ConfigProperty<List<String>> RESPONSE_CONTENT_PATTERNS = loadProperty(
            "retry.response.content.patterns", "RETRY_RESPONSE_PATTERNS",
            "temporarily unavailable,server busy,try again later,rate limit(ed)?,too many requests," +
                    "service unavailable,internal (server )?error,timeout,throttl(ed|ing)",
            CommonUtils::parseCommaSeparated, false);

    // -----------------------------------------------------
    // Main Config
    public static int getDefaultMaxRetries() {
        return MAX_RETRIES.value();
    }

    public static double getDefaultRetryDelaySeconds() {
        return RETRY_DELAY_SECONDS.value();
    }

    public static Duration getDefaultTimeout() {
        return secondsToDuration(TIMEOUT_SECONDS.value());
    }

    public static Duration getDefaultTotalTimeout() {
        return secondsToDuration(TOTAL_TIMEOUT_SECONDS.value());
    }

    public static String getDefaultStrategy() {
        return DEFAULT_STRATEGY.value();
    }

    public static boolean isEventDispatchEnabled() {
        return DISPATCH_EVENTS.value();
    }

    // -----------------------------------------------------
    // Circuit Breaker Config
    public static CircuitBreakerSettings getCircuitBreakerSettings() {
        return new CircuitBreakerSettings(CIRCUIT_BREAKER_FAILURE_THRESHOLD.value(),
                secondsToDuration(CIRCUIT_BREAKER_RESET_TIMEOUT_SECONDS.value()), CIRCUIT_BREAKER_FAIL_OPEN.value());
    }

    /**
     * Returns the circuit breaker settings for the given service. Each value falls back to the global default when
     * no service-specific override like {@code retry.circuit.breaker.services.<service>.failure.threshold} exists.
     */
    public static CircuitBreakerSettings getCircuitBreakerSettings(String service) {
        var defaults = getCircuitBreakerSettings();
        var prefix = CIRCUIT_BREAKER_SERVICES_PREFIX + service + ".";
        int threshold = getServiceOverride(prefix + "failure.threshold", CommonUtils::parseStringAsInteger)
                .orElse(defaults.failureThreshold());
        Duration resetTimeout = getServiceOverride(prefix + "reset.timeout.seconds", CommonUtils::parseStringAsDouble)
                .map(CommonUtils::secondsToDuration)
                .orElse(defaults.resetTimeout());
        boolean failOpen = getServiceOverride(prefix + "fail.open", s -> Optional.of(Boolean.parseBoolean(s.trim())))
                .orElse(defaults.failOpen());
        return new CircuitBreakerSettings(threshold, resetTimeout, failOpen);
    }

    // -----------------------------------------------------
    // Dead Letter Config
    public static boolean isDeadLetterFailureLoggingEnabled() {
        return DEAD_LETTER_LOG_FAILURES.value();
    }

    public static Level getDeadLetterLogLevel() {
        return DEAD_LETTER_LOG_LEVEL.value();
    }

    // -----------------------------------------------------
    // Response Content Config
    public static List<String> getResponseContentErrorCodes() {
        return RESPONSE_CONTENT_ERROR_CODES.value();
    }

    public static List<String> getResponseContentErrorCodePaths() {
        return RESPONSE_CONTENT_ERROR_CODE_PATHS.value();
    }

    public static List<String> getResponseContentPatterns() {
        return RESPONSE_CONTENT_PATTERNS.value();
    }

    private static <T> Optional<T> getServiceOverride(String key, Function<String, Optional<T>> parser) {
        return ofNullable(properties.getProperty(key))
                .filter(CommonUtils::isNotBlank)
                .map(value -> parser.apply(value).orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not valid: %s".formatted(key, value))));
    }

    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = RetryConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue,
            Function<String, T> converter,
            boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        String rawValue = getProperty(propertyKey, envVar, defaultValue, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(rawValue)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey,
                                rawValue)));
        return new ConfigProperty<>(value, isSecret);
    }

    private static ConfigProperty<Double> loadPropertyAsDouble(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        String rawValue = getProperty(propertyKey, envVar, defaultValue, isSecret);
        Double value = CommonUtils.parseStringAsDouble(rawValue)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct double value:%s".formatted(propertyKey,
                                rawValue)));
        return new ConfigProperty<>(value, isSecret);
    }
}
