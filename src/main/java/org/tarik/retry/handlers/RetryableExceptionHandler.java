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

import java.util.List;
import java.util.Set;

/**
 * Classification rule which bundles the message patterns and exception types of retryable failures for a specific
 * technology, e.g. a network stack or a database driver.
 */
public interface RetryableExceptionHandler {

    /**
     * Returns regular expressions which are matched case-insensitively against failure messages.
     */
    List<String> getPatterns();

    Set<Class<? extends Throwable>> getExceptions();

    /**
     * Returns {@code true} if the technology of this handler is available in the current environment.
     */
    boolean isApplicable();
}
