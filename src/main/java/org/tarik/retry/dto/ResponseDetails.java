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
package org.tarik.retry.dto;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.CASE_INSENSITIVE_ORDER;

/**
 * Transport-agnostic view of a remote call response. Header names are matched case-insensitively.
 */
public record ResponseDetails(int statusCode, Map<String, List<String>> headers, @Nullable String body) {

    public ResponseDetails {
        var caseInsensitiveHeaders = new TreeMap<String, List<String>>(CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> caseInsensitiveHeaders.put(name, List.copyOf(values)));
        }
        headers = Collections.unmodifiableMap(caseInsensitiveHeaders);
    }

    public ResponseDetails(int statusCode, @Nullable String body) {
        this(statusCode, Map.of(), body);
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name);
    }

    public Optional<String> getFirstHeader(String name) {
        return Optional.ofNullable(headers.get(name))
                .flatMap(values -> values.stream().findFirst())
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
