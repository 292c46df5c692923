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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.retry.utils.CommonUtils;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryContextTest {
    private final MutableClock clock = new MutableClock();

    @Test
    @DisplayName("Should start with one attempt and a generated operation ID")
    void shouldStartWithDefaults() {
        // Given
        var context = new RetryContext(3, null, clock);

        // Then
        assertThat(context.getTotalAttempts()).isEqualTo(1);
        assertThat(context.getOperationId()).startsWith("retry_");
        assertThat(context.getExceptionHistory()).isEmpty();
        assertThat(context.getMetrics().minAttemptDuration()).isEqualTo(Duration.ZERO);
        assertThat(context.getStartTime()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should record failed attempts and compute the metrics")
    void shouldRecordAttemptsAndComputeMetrics() {
        // Given
        var context = new RetryContext(3, "op-1", clock);

        // When
        context.recordAttempt(0, new IllegalStateException("timeout"), true, Duration.ofMillis(100),
                Duration.ofMillis(200));
        clock.advance(Duration.ofMillis(500));
        context.recordAttempt(1, new IllegalStateException("timeout"), true, Duration.ofMillis(300),
                Duration.ofMillis(400));
        clock.advance(Duration.ofMillis(500));
        context.recordAttempt(2, null, false, null, Duration.ofMillis(600));

        // Then
        var metrics = context.getMetrics();
        assertThat(context.getTotalAttempts()).isEqualTo(3);
        assertThat(context.getExceptionHistory()).hasSize(2);
        assertThat(metrics.totalDuration()).isEqualTo(Duration.ofMillis(1200));
        assertThat(metrics.totalDelay()).isEqualTo(Duration.ofMillis(400));
        assertThat(metrics.averageAttemptDuration()).isEqualTo(Duration.ofMillis(400));
        assertThat(metrics.minAttemptDuration()).isEqualTo(Duration.ofMillis(200));
        assertThat(metrics.maxAttemptDuration()).isEqualTo(Duration.ofMillis(600));
        assertThat(metrics.totalElapsedTime()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should summarize the run including metadata")
    void shouldSummarizeRun() {
        // Given
        var context = new RetryContext(2, "op-2", clock);
        context.addMetadata(Map.of("endpoint", "/orders"));
        context.addMetadata("priority", 5);
        context.recordAttempt(0, new IllegalStateException("timeout"), true, Duration.ZERO, Duration.ofMillis(10));
        context.recordAttempt(1, new IllegalStateException("bad"), false, null, Duration.ofMillis(10));

        // When
        var summary = context.getSummary();

        // Then
        assertThat(summary.operationId()).isEqualTo("op-2");
        assertThat(summary.totalAttempts()).isEqualTo(2);
        assertThat(summary.maxRetries()).isEqualTo(2);
        assertThat(summary.totalExceptions()).isEqualTo(2);
        assertThat(summary.retryableExceptions()).isEqualTo(1);
        assertThat(summary.metadata()).containsEntry("endpoint", "/orders").containsEntry("priority", 5);
        assertThat(CommonUtils.toJson(summary)).hasValueSatisfying(json -> assertThat(json)
                .contains("\"operationId\":\"op-2\"")
                .contains("\"endpoint\":\"/orders\""));
    }

    @Test
    @DisplayName("Should return the default for missing metadata")
    void shouldReturnDefaultForMissingMetadata() {
        // Given
        var context = new RetryContext(1, null, clock);

        // Then
        assertThat(context.getMetadataValue("missing", "fallback")).isEqualTo("fallback");
    }

    @Test
    @DisplayName("Should reject negative max retries")
    void shouldRejectNegativeMaxRetries() {
        assertThatThrownBy(() -> new RetryContext(-1, null, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
