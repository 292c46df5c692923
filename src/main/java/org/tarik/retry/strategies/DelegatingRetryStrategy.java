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
package org.tarik.retry.strategies;

import org.jetbrains.annotations.Nullable;
import org.tarik.retry.RetryContext;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class of strategies which wrap another one. Everything not overridden is delegated to the inner strategy.
 */
public abstract class DelegatingRetryStrategy implements RetryStrategy {
    protected final RetryStrategy innerStrategy;

    protected DelegatingRetryStrategy(RetryStrategy innerStrategy) {
        this.innerStrategy = checkNotNull(innerStrategy, "innerStrategy");
    }

    public RetryStrategy getInnerStrategy() {
        return innerStrategy;
    }

    @Override
    public double getDelay(int attempt, double baseDelay) {
        return innerStrategy.getDelay(attempt, baseDelay);
    }

    @Override
    public boolean shouldRetry(int attempt, int maxAttempts, @Nullable Throwable lastError) {
        return innerStrategy.shouldRetry(attempt, maxAttempts, lastError);
    }

    @Override
    public void prepare(RetryContext context) {
        innerStrategy.prepare(context);
    }

    @Override
    public void checkAttemptPermitted() {
        innerStrategy.checkAttemptPermitted();
    }

    @Override
    public void recordSuccess() {
        innerStrategy.recordSuccess();
    }

    @Override
    public void recordFailure(Throwable error) {
        innerStrategy.recordFailure(error);
    }

    @Override
    public void releaseAttempt() {
        innerStrategy.releaseAttempt();
    }
}
