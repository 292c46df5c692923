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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Registry of the exception handlers used by an executor. Handlers should be registered before the registry is shared
 * between threads, after that it's safe for concurrent reads.
 */
public class ExceptionHandlerManager {
    private static final Logger LOG = LoggerFactory.getLogger(ExceptionHandlerManager.class);
    private final List<RetryableExceptionHandler> handlers = new CopyOnWriteArrayList<>();

    static List<RetryableExceptionHandler> builtInHandlers() {
        return List.of(
                new NetworkHandler(),
                new JdkHttpClientHandler(),
                new JdbcHandler(),
                new ApacheHttpClientHandler());
    }

    /**
     * Registers the applicable built-in handlers. Handlers of a type which is already registered are skipped, so
     * repeated calls don't change the registry.
     */
    public synchronized ExceptionHandlerManager registerDefaultHandlers() {
        for (var handler : builtInHandlers()) {
            if (!handler.isApplicable()) {
                LOG.debug("Skipping {} since it's not applicable in the current environment",
                        handler.getClass().getSimpleName());
            } else if (!hasHandler(handler.getClass())) {
                registerHandler(handler);
            }
        }
        return this;
    }

    public ExceptionHandlerManager registerHandler(RetryableExceptionHandler handler) {
        checkNotNull(handler, "handler");
        handlers.add(handler);
        LOG.debug("Registered exception handler {}", handler.getClass().getSimpleName());
        return this;
    }

    public boolean hasHandler(Class<? extends RetryableExceptionHandler> handlerClass) {
        return handlers.stream().anyMatch(handlerClass::isInstance);
    }

    public ExceptionHandlerManager removeHandler(Class<? extends RetryableExceptionHandler> handlerClass) {
        handlers.removeIf(handlerClass::isInstance);
        return this;
    }

    public ExceptionHandlerManager clearHandlers() {
        handlers.clear();
        return this;
    }

    public List<RetryableExceptionHandler> getHandlers() {
        return List.copyOf(handlers);
    }

    /**
     * Returns the patterns of all handlers in registration order, without duplicates.
     */
    public List<String> getAllPatterns() {
        Set<String> patterns = new LinkedHashSet<>();
        handlers.forEach(handler -> patterns.addAll(handler.getPatterns()));
        return List.copyOf(patterns);
    }

    public Set<Class<? extends Throwable>> getAllExceptions() {
        Set<Class<? extends Throwable>> exceptions = new LinkedHashSet<>();
        handlers.forEach(handler -> exceptions.addAll(handler.getExceptions()));
        return Collections.unmodifiableSet(exceptions);
    }
}
