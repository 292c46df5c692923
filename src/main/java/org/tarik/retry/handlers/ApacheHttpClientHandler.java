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
 * Failures of Apache HttpClient 5. The client is an optional dependency, so its exception classes are resolved by
 * name and the handler is only applicable if the client is on the classpath.
 */
public class ApacheHttpClientHandler extends BaseHandler {
    private static final String HTTP_CLIENT_CLASS = "org.apache.hc.client5.http.classic.HttpClient";

    @Override
    protected List<String> getHandlerPatterns() {
        return List.of(
                "failed to respond",
                "connect to .* failed",
                "timeout waiting for connection from pool");
    }

    @Override
    protected Set<Class<? extends Throwable>> getHandlerExceptions() {
        return resolveExceptionClasses(
                "org.apache.hc.client5.http.ConnectTimeoutException",
                "org.apache.hc.client5.http.HttpHostConnectException",
                "org.apache.hc.core5.http.NoHttpResponseException",
                "org.apache.hc.core5.http.ConnectionRequestTimeoutException");
    }

    @Override
    public boolean isApplicable() {
        return isClassPresent(HTTP_CLIENT_CLASS);
    }
}
