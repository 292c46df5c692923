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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHandlerManagerTest {
    private ExceptionHandlerManager manager;

    @BeforeEach
    void setUp() {
        manager = new ExceptionHandlerManager();
    }

    @Test
    @DisplayName("Should register only applicable built-in handlers")
    void shouldRegisterApplicableDefaultHandlers() {
        // When
        manager.registerDefaultHandlers();

        // Then
        assertThat(manager.hasHandler(NetworkHandler.class)).isTrue();
        assertThat(manager.hasHandler(JdkHttpClientHandler.class)).isTrue();
        assertThat(manager.hasHandler(JdbcHandler.class)).isTrue();
        assertThat(manager.hasHandler(ApacheHttpClientHandler.class)).isFalse();
        assertThat(manager.getAllExceptions())
                .contains(ConnectException.class, HttpTimeoutException.class, SQLTransientException.class);
        assertThat(manager.getAllPatterns()).contains("connection reset", "deadlock", "RST_STREAM");
    }

    @Test
    @DisplayName("Should not duplicate handlers when defaults are registered twice")
    void shouldRegisterDefaultsIdempotently() {
        // Given
        manager.registerDefaultHandlers();
        var handlers = manager.getHandlers();
        var patterns = manager.getAllPatterns();
        var exceptions = manager.getAllExceptions();

        // When
        manager.registerDefaultHandlers();

        // Then
        assertThat(manager.getHandlers()).hasSameSizeAs(handlers);
        assertThat(manager.getAllPatterns()).isEqualTo(patterns);
        assertThat(manager.getAllExceptions()).isEqualTo(exceptions);
    }

    @Test
    @DisplayName("Should deduplicate patterns shared by several handlers")
    void shouldDeduplicatePatterns() {
        // Given
        manager.registerHandler(new NetworkHandler()).registerHandler(new JdbcHandler());

        // When
        var patterns = manager.getAllPatterns();

        // Then
        assertThat(patterns).doesNotHaveDuplicates();
        assertThat(patterns.stream().filter("timeout"::equals)).hasSize(1);
    }

    @Test
    @DisplayName("Should remove and clear handlers")
    void shouldRemoveAndClearHandlers() {
        // Given
        manager.registerHandler(new NetworkHandler()).registerHandler(new JdbcHandler());

        // When
        manager.removeHandler(JdbcHandler.class);

        // Then
        assertThat(manager.hasHandler(JdbcHandler.class)).isFalse();
        assertThat(manager.getAllExceptions()).doesNotContain(SQLTransientException.class);

        // When
        manager.clearHandlers();

        // Then
        assertThat(manager.getHandlers()).isEmpty();
        assertThat(manager.getAllPatterns()).isEmpty();
        assertThat(manager.getAllExceptions()).isEmpty();
    }

    @Test
    @DisplayName("Should accept custom handlers and expose read-only views")
    void shouldAcceptCustomHandlers() {
        // Given
        manager.registerHandler(new RetryableExceptionHandler() {
            @Override
            public List<String> getPatterns() {
                return List.of("queue is full");
            }

            @Override
            public Set<Class<? extends Throwable>> getExceptions() {
                return Set.of(IOException.class);
            }

            @Override
            public boolean isApplicable() {
                return true;
            }
        });

        // Then
        assertThat(manager.getAllPatterns()).containsExactly("queue is full");
        assertThat(manager.getAllExceptions()).containsExactly(IOException.class);
        assertThatThrownBy(() -> manager.getAllExceptions().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> manager.getHandlers().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject a null handler")
    void shouldRejectNullHandler() {
        assertThatThrownBy(() -> manager.registerHandler(null)).isInstanceOf(NullPointerException.class);
    }
}
