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

import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Set;

/**
 * Transient database failures reported through JDBC, like lost connections, deadlocks and lock timeouts.
 */
public class JdbcHandler extends BaseHandler {
    private static final String SQL_EXCEPTION_CLASS = "java.sql.SQLException";

    @Override
    protected List<String> getHandlerPatterns() {
        return List.of(
                "deadlock",
                "lock wait timeout exceeded",
                "could not serialize access",
                "too many connections",
                "communications link failure");
    }

    @Override
    protected Set<Class<? extends Throwable>> getHandlerExceptions() {
        return Set.of(SQLTransientException.class, SQLRecoverableException.class);
    }

    @Override
    public boolean isApplicable() {
        return isClassPresent(SQL_EXCEPTION_CLASS);
    }
}
