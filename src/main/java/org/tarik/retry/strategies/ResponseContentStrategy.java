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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.RetryConfig;
import org.tarik.retry.dto.ResponseDetails;
import org.tarik.retry.exceptions.ResponseAware;
import org.tarik.retry.exceptions.StrategyConfigurationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.time.format.DateTimeFormatter.RFC_1123_DATE_TIME;
import static java.util.regex.Pattern.CASE_INSENSITIVE;
import static org.tarik.retry.utils.CommonUtils.*;

/**
 * Decides on retries based on the response embedded into the failure, if any. A response is found when the failure
 * or one of its causes implements {@link ResponseAware}.
 * <p>
 * A response is retryable if any of these applies:
 * <ul>
 *     <li>its status is 429 or 5xx;</li>
 *     <li>its status is another 4xx and it carries rate-limit or retry headers;</li>
 *     <li>its body matches one of the content patterns;</li>
 *     <li>its body is JSON with one of the retryable error codes at one of the error code paths.</li>
 * </ul>
 * Any other 4xx response isn't retryable. Failures without a response are left to the inner strategy. The delay is
 * taken from {@code Retry-After}, {@code X-RateLimit-Reset} or {@code X-Retry-In} headers of the last response and
 * falls back to the inner strategy.
 */
public class ResponseContentStrategy extends DelegatingRetryStrategy {
    private static final Logger LOG = LoggerFactory.getLogger(ResponseContentStrategy.class);
    public static final double DEFAULT_MAX_DELAY_SECONDS = 300;
    static final String RETRY_AFTER = "Retry-After";
    static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    static final String RETRY_IN = "X-Retry-In";
    static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    private static final List<String> RETRY_HEADERS = List.of(RETRY_AFTER, RATE_LIMIT_RESET, RETRY_IN,
            RATE_LIMIT_REMAINING);

    private final List<Pattern> contentPatterns = new ArrayList<>();
    private final List<String> errorCodes = new ArrayList<>();
    private final List<String> errorCodePaths = new ArrayList<>();
    private final Clock clock;
    private double maxDelay = DEFAULT_MAX_DELAY_SECONDS;
    @Nullable
    private Predicate<ResponseDetails> contentChecker;
    @Nullable
    private volatile ResponseDetails lastResponse;

    public ResponseContentStrategy(RetryStrategy innerStrategy) {
        this(innerStrategy, RetryConfig.getResponseContentPatterns(), RetryConfig.getResponseContentErrorCodes(),
                RetryConfig.getResponseContentErrorCodePaths(), Clock.systemUTC());
    }

    public ResponseContentStrategy(RetryStrategy innerStrategy, List<String> contentPatterns, List<String> errorCodes,
                                   List<String> errorCodePaths, Clock clock) {
        super(innerStrategy);
        this.clock = clock;
        withContentPatterns(contentPatterns);
        withErrorCodes(errorCodes);
        this.errorCodePaths.addAll(errorCodePaths);
    }

    public ResponseContentStrategy withContentPatterns(List<String> patterns) {
        patterns.forEach(pattern -> {
            try {
                contentPatterns.add(Pattern.compile(pattern, CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new StrategyConfigurationException("Invalid response content pattern: " + pattern, e);
            }
        });
        return this;
    }

    public ResponseContentStrategy withErrorCodes(List<String> codes) {
        errorCodes.addAll(codes);
        return this;
    }

    public ResponseContentStrategy withErrorCodePaths(List<String> paths) {
        errorCodePaths.clear();
        errorCodePaths.addAll(paths);
        return this;
    }

    /**
     * Replaces all built-in response checks with the given one.
     */
    public ResponseContentStrategy withContentChecker(Predicate<ResponseDetails> checker) {
        this.contentChecker = checker;
        return this;
    }

    public ResponseContentStrategy withMaxDelay(double maxDelaySeconds) {
        Delays.requireNonNegative(maxDelaySeconds, "maxDelay");
        this.maxDelay = maxDelaySeconds;
        return this;
    }

    @Override
    public void recordFailure(Throwable error) {
        this.lastResponse = extractResponse(error).orElse(null);
        super.recordFailure(error);
    }

    @Override
    public void recordSuccess() {
        this.lastResponse = null;
        super.recordSuccess();
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        if (attempt >= maxAttempts) {
            return false;
        }
        var response = extractResponse(lastError);
        this.lastResponse = response.orElse(null);
        if (response.isEmpty()) {
            return innerStrategy.shouldRetry(attempt, maxAttempts, lastError);
        }
        if (isRetryable(response.get())) {
            return true;
        }
        if (isClientError(response.get().statusCode())) {
            LOG.debug("Response with status {} doesn't indicate a transient failure", response.get().statusCode());
            return false;
        }
        return innerStrategy.shouldRetry(attempt, maxAttempts, lastError);
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        var response = lastResponse;
        if (response != null) {
            var delayFromHeaders = getDelayFromHeaders(response);
            if (delayFromHeaders.isPresent()) {
                return Delays.sanitize(Math.min(delayFromHeaders.get(), maxDelay));
            }
        }
        return innerStrategy.getDelay(attempt, baseDelay);
    }

    public boolean isRetryable(ResponseDetails response) {
        if (contentChecker != null) {
            return contentChecker.test(response);
        }
        int status = response.statusCode();
        if (status == 429 || (status >= 500 && status < 600)) {
            return true;
        }
        if (isClientError(status) && RETRY_HEADERS.stream().anyMatch(response::hasHeader)) {
            return true;
        }
        var body = response.body();
        if (isBlank(body)) {
            return false;
        }
        if (contentPatterns.stream().anyMatch(pattern -> pattern.matcher(body).find())) {
            return true;
        }
        return parseJson(body)
                .map(json -> errorCodePaths.stream()
                        .map(path -> getNestedValue(json, path))
                        .flatMap(Optional::stream)
                        .anyMatch(errorCodes::contains))
                .orElse(false);
    }

    Optional<Double> getDelayFromHeaders(ResponseDetails response) {
        var retryAfter = response.getFirstHeader(RETRY_AFTER).flatMap(this::parseRetryAfter);
        if (retryAfter.isPresent()) {
            return retryAfter;
        }
        var reset = response.getFirstHeader(RATE_LIMIT_RESET)
                .flatMap(value -> parseStringAsDouble(value))
                .map(epochSeconds -> epochSeconds - clock.instant().getEpochSecond());
        if (reset.isPresent()) {
            return reset.map(seconds -> Math.max(0, seconds));
        }
        return response.getFirstHeader(RETRY_IN).flatMap(value -> parseStringAsDouble(value));
    }

    private Optional<Double> parseRetryAfter(String value) {
        var seconds = parseStringAsDouble(value);
        if (seconds.isPresent()) {
            return seconds;
        }
        try {
            Instant retryAt = ZonedDateTime.parse(value, RFC_1123_DATE_TIME).toInstant();
            return Optional.of(Math.max(0, durationToSeconds(Duration.between(clock.instant(), retryAt))));
        } catch (DateTimeParseException e) {
            LOG.debug("Couldn't parse {} header value '{}'", RETRY_AFTER, value);
            return Optional.empty();
        }
    }

    static Optional<ResponseDetails> extractResponse(@Nullable Throwable error) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (var current = error; current != null && visited.add(current); current = current.getCause()) {
            if (current instanceof ResponseAware responseAware) {
                var response = responseAware.getResponse();
                if (response.isPresent()) {
                    return response;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> parseJson(String body) {
        try {
            return Optional.ofNullable(getObjectMapper().readTree(body));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> getNestedValue(JsonNode json, String path) {
        var current = json;
        for (String key : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return Optional.empty();
            }
            current = current.get(key);
        }
        return current == null || current.isNull() || current.isContainerNode()
                ? Optional.empty()
                : Optional.of(current.asText());
    }

    private static boolean isClientError(int status) {
        return status >= 400 && status < 500;
    }
}
