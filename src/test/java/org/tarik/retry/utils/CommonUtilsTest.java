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
package org.tarik.retry.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.tarik.retry.utils.CommonUtils.*;

@DisplayName("CommonUtils Tests")
class CommonUtilsTest {
    private record Sample(String name, Instant createdAt, Duration delay, Map<String, Integer> counts) {
    }

    @Test
    @DisplayName("parseStringAsInteger: Should parse valid integer string")
    void parseStringAsIntegerValid() {
        // Given
        String intStr = " 123 ";

        // When
        Optional<Integer> result = parseStringAsInteger(intStr);

        // Then
        assertTrue(result.isPresent());
        assertEquals(123, result.get());
    }

    @Test
    @DisplayName("parseStringAsInteger: Should return empty for invalid, null or blank string")
    void parseStringAsIntegerInvalid() {
        assertTrue(parseStringAsInteger("abc").isEmpty());
        assertTrue(parseStringAsInteger(null).isEmpty());
        assertTrue(parseStringAsInteger("   ").isEmpty());
    }

    @Test
    @DisplayName("parseStringAsDouble: Should parse valid double string")
    void parseStringAsDoubleValid() {
        // Given
        String doubleStr = " 123.45 ";

        // When
        Optional<Double> result = parseStringAsDouble(doubleStr);

        // Then
        assertTrue(result.isPresent());
        assertEquals(123.45, result.get());
    }

    @Test
    @DisplayName("parseStringAsDouble: Should return empty for invalid, null or blank string")
    void parseStringAsDoubleInvalid() {
        assertTrue(parseStringAsDouble("abc.def").isEmpty());
        assertTrue(parseStringAsDouble(null).isEmpty());
        assertTrue(parseStringAsDouble("   ").isEmpty());
    }

    @Test
    @DisplayName("parseCommaSeparated: Should split, trim and drop blank values")
    void parseCommaSeparatedValues() {
        assertEquals(List.of("error.code", "code", "status"), parseCommaSeparated(" error.code, code,, status ,"));
        assertEquals(List.of(), parseCommaSeparated(null));
        assertEquals(List.of(), parseCommaSeparated("  "));
    }

    @Test
    @DisplayName("isBlank/isNotBlank: Should detect null, empty and blank strings")
    void isBlankValues() {
        assertTrue(isBlank(null));
        assertTrue(isBlank(""));
        assertTrue(isBlank("   "));
        assertFalse(isBlank("abc"));
        assertFalse(isNotBlank(null));
        assertTrue(isNotBlank("abc"));
    }

    @Test
    @DisplayName("secondsToDuration: Should convert fractional seconds with millisecond precision")
    void secondsToDurationValues() {
        assertEquals(Duration.ofMillis(1500), secondsToDuration(1.5));
        assertEquals(Duration.ofMillis(10), secondsToDuration(0.01));
        assertEquals(Duration.ZERO, secondsToDuration(-3));
        assertEquals(Duration.ZERO, secondsToDuration(Double.NaN));
        assertEquals(Duration.ofMillis(Long.MAX_VALUE), secondsToDuration(Double.MAX_VALUE));
    }

    @Test
    @DisplayName("durationToSeconds: Should convert durations to fractional seconds")
    void durationToSecondsValues() {
        assertEquals(1.25, durationToSeconds(Duration.ofMillis(1250)));
        assertEquals(0.0, durationToSeconds(Duration.ZERO));
    }

    @Test
    @DisplayName("toJson: Should render records and java.time values")
    void toJsonRendersRecords() {
        // Given
        var sample = new Sample("trial", Instant.parse("2025-01-01T00:00:00Z"), Duration.ofMillis(1500),
                Map.of("failures", 2));

        // When
        Optional<String> json = toJson(sample);

        // Then
        assertTrue(json.isPresent());
        assertTrue(json.get().contains("\"name\":\"trial\""));
        assertTrue(json.get().contains("\"createdAt\":\"2025-01-01T00:00:00Z\""));
        assertTrue(json.get().contains("\"delay\":\"PT1.5S\""));
        assertTrue(json.get().contains("\"failures\":2"));
    }
}
