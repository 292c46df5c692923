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
package org.tarik.retry;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancels retry runs from another thread. Cancellation interrupts the attempt in flight and ends any pending backoff
 * wait. A token stays cancelled once cancelled, so it can't be reused for new runs.
 */
public class CancellationToken {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Object lock = new Object();
    @Nullable
    private Thread runningThread;

    public void cancel() {
        synchronized (lock) {
            if (isCancelled()) {
                return;
            }
            cancelled.countDown();
            if (runningThread != null) {
                LOG.debug("Interrupting thread {} of the cancelled retry run", runningThread.getName());
                runningThread.interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    void register(Thread thread) {
        synchronized (lock) {
            runningThread = thread;
        }
    }

    void unregister() {
        synchronized (lock) {
            runningThread = null;
        }
    }

    /**
     * Waits for the given time unless the token gets cancelled earlier.
     *
     * @return {@code true} if the token was cancelled.
     */
    boolean await(Duration delay) throws InterruptedException {
        return cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
