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
package org.tarik.retry.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.dto.ContextSummary;

import static org.tarik.retry.utils.CommonUtils.toJson;

/**
 * Forwards retry events to the log, together with the JSON summary of the run.
 */
public class LoggingRetryListener implements RetryListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public void onRetrying(RetryingOperationEvent event) {
        LOG.info("Retrying operation {} (retry {} of {}) in {} ms after: {}", event.context().operationId(),
                event.attempt(), event.maxRetries(), event.delay().toMillis(), event.error().getMessage());
        LOG.debug("Retry context: {}", render(event.context()));
    }

    @Override
    public void onSucceeded(OperationSucceededEvent event) {
        LOG.info("Operation {} succeeded on attempt {} after {} ms", event.context().operationId(),
                event.attempt() + 1, event.totalTime().toMillis());
        LOG.debug("Retry context: {}", render(event.context()));
    }

    @Override
    public void onFailed(OperationFailedEvent event) {
        LOG.error("Operation {} failed after {} attempt(s): {}", event.context().operationId(), event.attempt() + 1,
                event.error().getMessage());
        LOG.info("Retry context: {}", render(event.context()));
    }

    private static String render(ContextSummary summary) {
        return toJson(summary).orElse(summary.toString());
    }
}
