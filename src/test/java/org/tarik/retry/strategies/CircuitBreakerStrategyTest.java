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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.retry.MutableClock;
import org.tarik.retry.exceptions.CircuitBreakerStoreException;
import org.tarik.retry.exceptions.CircuitOpenException;
import org.tarik.retry.strategies.circuit.CircuitBreakerSettings;
import org.tarik.retry.strategies.circuit.CircuitBreakerStateStore;
import org.tarik.retry.strategies.circuit.InMemoryCircuitBreakerStateStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.tarik.retry.strategies.circuit.CircuitState.*;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerStrategyTest {
    private static final String NAME = "inventory";
    private static final Duration RESET_TIMEOUT = Duration.ofSeconds(30);
    private static final CircuitBreakerSettings SETTINGS = new CircuitBreakerSettings(3, RESET_TIMEOUT, true);

    @Mock
    private CircuitBreakerStateStore failingStore;

    private MutableClock clock;
    private InMemoryCircuitBreakerStateStore store;
    private CircuitBreakerStrategy breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryCircuitBreakerStateStore();
        breaker = newBreaker();
    }

    private CircuitBreakerStrategy newBreaker() {
        return new CircuitBreakerStrategy(NAME, new FixedDelayStrategy(), SETTINGS, store, clock);
    }

    private void failTimes(int failures) {
        for (int i = 0; i < failures; i++) {
            breaker.recordFailure(new IllegalStateException("Service unavailable"));
        }
    }

    @Test
    @DisplayName("Should stay closed below the failure threshold")
    void shouldStayClosedBelowThreshold() {
        // When
        failTimes(2);

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(CLOSED);
        assertThat(breaker.getFailureCount()).isEqualTo(2);
        assertThatCode(breaker::checkAttemptPermitted).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should open at the failure threshold and refuse attempts")
    void shouldOpenAtThreshold() {
        // When
        failTimes(3);

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(OPEN);
        assertThat(breaker.shouldRetry(0, 10, null)).isFalse();
        assertThatThrownBy(breaker::checkAttemptPermitted)
                .isInstanceOfSatisfying(CircuitOpenException.class, e -> {
                    assertThat(e.getCircuitName()).isEqualTo(NAME);
                    assertThat(e.getState()).isEqualTo(OPEN);
                });
    }

    @Test
    @DisplayName("Should grant a single trial after the reset timeout")
    void shouldGrantSingleTrial() {
        // Given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);

        // When
        breaker.checkAttemptPermitted();

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(HALF_OPEN);
        assertThat(breaker.getDelay(2, 5.0)).isZero();
        assertThatThrownBy(newBreaker()::checkAttemptPermitted)
                .isInstanceOfSatisfying(CircuitOpenException.class,
                        e -> assertThat(e.getState()).isEqualTo(HALF_OPEN));
    }

    @Test
    @DisplayName("Should close after a successful trial")
    void shouldCloseAfterSuccessfulTrial() {
        // Given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);
        breaker.checkAttemptPermitted();

        // When
        breaker.recordSuccess();

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(CLOSED);
        assertThat(breaker.getFailureCount()).isZero();
        assertThat(breaker.getDelay(2, 5.0)).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should reopen with a fresh timer after a failed trial")
    void shouldReopenAfterFailedTrial() {
        // Given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);
        breaker.checkAttemptPermitted();

        // When
        failTimes(1);
        clock.advance(Duration.ofSeconds(10));

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(OPEN);
        assertThatThrownBy(breaker::checkAttemptPermitted).isInstanceOf(CircuitOpenException.class);

        // When
        clock.advance(Duration.ofSeconds(20));

        // Then
        assertThatCode(breaker::checkAttemptPermitted).doesNotThrowAnyException();
        assertThat(breaker.getCircuitState()).isEqualTo(HALF_OPEN);
    }

    @Test
    @DisplayName("Should hand the half-open attempt back when it ended without an outcome")
    void shouldReleaseHalfOpenAttempt() {
        // Given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);
        breaker.checkAttemptPermitted();

        // When
        breaker.releaseAttempt();

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(OPEN);
        assertThat(breaker.getFailureCount()).isEqualTo(3);
        assertThatCode(newBreaker()::checkAttemptPermitted).doesNotThrowAnyException();
        assertThat(breaker.getCircuitState()).isEqualTo(HALF_OPEN);
    }

    @Test
    @DisplayName("Should ignore a released attempt while the circuit is closed")
    void shouldIgnoreReleaseWhenClosed() {
        // Given
        failTimes(2);

        // When
        breaker.releaseAttempt();

        // Then
        assertThat(breaker.getCircuitState()).isEqualTo(CLOSED);
        assertThat(breaker.getFailureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should share the state between breakers with the same name")
    void shouldShareStateByName() {
        // Given
        failTimes(3);

        // Then
        assertThat(newBreaker().getCircuitState()).isEqualTo(OPEN);
        assertThat(new CircuitBreakerStrategy("other", new FixedDelayStrategy(), SETTINGS, store, clock)
                .getCircuitState()).isEqualTo(CLOSED);

        // When
        breaker.reset();

        // Then
        assertThat(newBreaker().getCircuitState()).isEqualTo(CLOSED);
    }

    @Test
    @DisplayName("Should hand out exactly one trial to concurrent callers")
    void shouldGrantOneTrialUnderConcurrency() throws Exception {
        // Given
        failTimes(3);
        clock.advance(RESET_TIMEOUT);
        int callers = 16;
        var executor = Executors.newFixedThreadPool(callers);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<Boolean>>();
        try {
            for (int i = 0; i < callers; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        newBreaker().checkAttemptPermitted();
                        return true;
                    } catch (CircuitOpenException e) {
                        return false;
                    }
                };
                futures.add(executor.submit(attempt));
            }

            // When
            start.countDown();
            int permitted = 0;
            for (var future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    permitted++;
                }
            }

            // Then
            assertThat(permitted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should permit attempts when the store fails and the breaker fails open")
    void shouldFailOpen() {
        // Given
        when(failingStore.compute(anyString(), any())).thenThrow(new CircuitBreakerStoreException("Cache is down"));
        var failOpenBreaker = new CircuitBreakerStrategy(NAME, new FixedDelayStrategy(), SETTINGS, failingStore, clock);

        // Then
        assertThatCode(failOpenBreaker::checkAttemptPermitted).doesNotThrowAnyException();
        assertThatCode(() -> failOpenBreaker.recordFailure(new IllegalStateException("timeout")))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should refuse attempts when the store fails and the breaker fails closed")
    void shouldFailClosed() {
        // Given
        when(failingStore.compute(anyString(), any())).thenThrow(new CircuitBreakerStoreException("Cache is down"));
        when(failingStore.get(anyString())).thenThrow(new CircuitBreakerStoreException("Cache is down"));
        var failClosedBreaker = new CircuitBreakerStrategy(NAME, new FixedDelayStrategy(),
                new CircuitBreakerSettings(3, RESET_TIMEOUT, false), failingStore, clock);

        // Then
        assertThatThrownBy(failClosedBreaker::checkAttemptPermitted).isInstanceOf(CircuitOpenException.class);
        assertThat(failClosedBreaker.shouldRetry(0, 3, null)).isFalse();
    }

    @Test
    @DisplayName("Should read per-service settings from the configuration")
    void shouldUseConfiguredSettings() {
        var payments = new CircuitBreakerStrategy("payments", new FixedDelayStrategy());

        assertThat(payments.getSettings().failureThreshold()).isEqualTo(2);
        assertThat(payments.getResetTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(payments.getSettings().failOpen()).isFalse();
    }
}
