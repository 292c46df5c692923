package org.tarik.retry.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.retry.MutableClock;
import org.tarik.retry.Retry;
import org.tarik.retry.RetryContext;
import org.tarik.retry.handlers.ExceptionHandlerManager;
import org.tarik.retry.strategies.FixedDelayStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingRetryListenerTest {
    private final LoggingRetryListener listener = new LoggingRetryListener();

    @Test
    @DisplayName("Should log every kind of event")
    void shouldLogEvents() {
        // Given
        var context = new RetryContext(3, "op-1", new MutableClock());
        context.addMetadata("tenant", "acme");
        var summary = context.getSummary();
        var error = new IllegalStateException("timeout");
        var now = Instant.parse("2025-01-01T00:00:00Z");

        // Then
        assertThatCode(() -> {
            listener.onRetrying(new RetryingOperationEvent(1, 3, Duration.ofMillis(200), error, now, summary));
            listener.onSucceeded(new OperationSucceededEvent(1, null, Duration.ofMillis(250), now, summary));
            listener.onFailed(new OperationFailedEvent(3, error, List.of(), now, summary));
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should not affect the outcome of a run")
    void shouldNotAffectRun() {
        // Given
        var attempts = new AtomicInteger();
        var retry = new Retry(2, 0, Duration.ZERO, new FixedDelayStrategy(), new ExceptionHandlerManager())
                .withListener(listener)
                .dispatchEvents(true);

        // When
        var result = retry.run(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("Connection refused");
            }
            return "Success";
        });

        // Then
        assertThat(result.getResult()).contains("Success");
        assertThat(attempts).hasValue(2);
    }
}
