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

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Set;

/**
 * Socket level failures of {@code java.net}.
 */
public class NetworkHandler extends BaseHandler {

    @Override
    protected List<String> getHandlerPatterns() {
        return List.of(
                "connection reset",
                "broken pipe",
                "network is unreachable",
                "no route to host",
                "connection timed out",
                "could not resolve host");
    }

    @Override
    protected Set<Class<? extends Throwable>> getHandlerExceptions() {
        return Set.of(
                ConnectException.class,
                SocketTimeoutException.class,
                NoRouteToHostException.class,
                PortUnreachableException.class,
                UnknownHostException.class);
    }

    @Override
    public boolean isApplicable() {
        return true;
    }
}
