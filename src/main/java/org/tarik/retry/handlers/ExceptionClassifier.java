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
package org.tarik.retry.handlers;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

import static java.util.regex.Pattern.CASE_INSENSITIVE;

/**
 * Decides whether a failure is transient. The failure and each of its causes are checked in turn: first against the
 * retryable exception types, then against the message patterns. {@link Error}s are never retryable.
 */
public class ExceptionClassifier {
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "rate[ _-]?limit",
            "timeout",
            "server[ _-]error",
            "connection refused",
            "connection timed out",
            "temporarily unavailable");

    private final List<Pattern> patterns;
    private final Set<Class<? extends Throwable>> exceptions;

    public ExceptionClassifier(Collection<String> patterns, Collection<Class<? extends Throwable>> exceptions,
                               boolean includeDefaultPatterns) {
        var allPatterns = includeDefaultPatterns
                ? Stream.concat(DEFAULT_PATTERNS.stream(), patterns.stream())
                : patterns.stream();
        this.patterns = allPatterns.distinct().map(ExceptionClassifier::compile).toList();
        this.exceptions = Collections.unmodifiableSet(new LinkedHashSet<>(exceptions));
    }

    public boolean isRetryable(@Nullable Throwable error) {
        return findMatch(error).isPresent();
    }

    /**
     * Returns a description of the rule which made the failure retryable, if any.
     */
    public Optional<String> findMatch(@Nullable Throwable error) {
        if (error == null || error instanceof Error) {
            return Optional.empty();
        }
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (var current = error; current != null && visited.add(current); current = current.getCause()) {
            if (current instanceof Error) {
                continue;
            }
            var link = current;
            var matchingType = exceptions.stream().filter(type -> type.isInstance(link)).findFirst();
            if (matchingType.isPresent()) {
                return Optional.of("type " + matchingType.get().getName());
            }
            var message = current.getMessage();
            if (message != null) {
                var matchingPattern = patterns.stream().filter(pattern -> pattern.matcher(message).find()).findFirst();
                if (matchingPattern.isPresent()) {
                    return Optional.of("pattern '%s'".formatted(matchingPattern.get().pattern()));
                }
            }
        }
        return Optional.empty();
    }

    public List<String> getPatterns() {
        return patterns.stream().map(Pattern::pattern).toList();
    }

    public Set<Class<? extends Throwable>> getExceptions() {
        return exceptions;
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern, CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid retryable message pattern: " + pattern, e);
        }
    }
}
