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
import java.util.stream.Stream;

public abstract class BaseHandler implements RetryableExceptionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(BaseHandler.class);
    private static final List<String> COMMON_PATTERNS = List.of(
            "timeout",
            "temporarily unavailable",
            "server error",
            "connection refused");

    protected abstract List<String> getHandlerPatterns();

    protected abstract Set<Class<? extends Throwable>> getHandlerExceptions();

    @Override
    public List<String> getPatterns() {
        return Stream.concat(COMMON_PATTERNS.stream(), getHandlerPatterns().stream())
                .distinct()
                .toList();
    }

    @Override
    public Set<Class<? extends Throwable>> getExceptions() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(getHandlerExceptions()));
    }

    protected static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, BaseHandler.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    /**
     * Resolves the exception classes of an optional dependency by their names. Classes which can't be loaded are
     * skipped.
     */
    protected static Set<Class<? extends Throwable>> resolveExceptionClasses(String... classNames) {
        Set<Class<? extends Throwable>> result = new LinkedHashSet<>();
        for (String className : classNames) {
            try {
                var clazz = Class.forName(className, false, BaseHandler.class.getClassLoader());
                if (Throwable.class.isAssignableFrom(clazz)) {
                    result.add(clazz.asSubclass(Throwable.class));
                } else {
                    LOG.warn("{} is not an exception class, skipping it", className);
                }
            } catch (ClassNotFoundException | LinkageError e) {
                LOG.debug("Exception class {} is not available", className);
            }
        }
        return result;
    }
}
