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
 * Failures of the {@code java.net.http} client.
 */
public class JdkHttpClientHandler extends BaseHandler {
    private static final String HTTP_CLIENT_CLASS = "java.net.http.HttpClient";

    @Override
    protected List<String> getHandlerPatterns() {
        return List.of(
                "GOAWAY received",
                "RST_STREAM",
                "header parser received no bytes",
                "too many concurrent streams");
    }

    @Override
    protected Set<Class<? extends Throwable>> getHandlerExceptions() {
        return resolveExceptionClasses(
                "java.net.http.HttpTimeoutException",
                "java.net.http.HttpConnectTimeoutException");
    }

    @Override
    public boolean isApplicable() {
        return isClassPresent(HTTP_CLIENT_CLASS);
    }
}
