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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Watchdog of a single attempt. Interrupts the thread running the attempt once the timeout elapses. Closing the timer
 * stops it and clears the interrupt it may have caused, so the interrupt never leaks out of the attempt.
 */
final class AttemptTimer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AttemptTimer.class);
    private static final ScheduledExecutorService SCHEDULER = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("retry-attempt-timer-%d").build());

    private enum State {RUNNING, FINISHED, TIMED_OUT}

    private final Thread thread;
    private final Duration timeout;
    @Nullable
    private final ScheduledFuture<?> timeoutTask;
    private State state = State.RUNNING;

    private AttemptTimer(Thread thread, Duration timeout) {
        this.thread = thread;
        this.timeout = timeout;
        this.timeoutTask = isEnabled(timeout)
                ? SCHEDULER.schedule(this::onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS)
                : null;
    }

    static AttemptTimer start(Duration timeout) {
        return new AttemptTimer(Thread.currentThread(), timeout);
    }

    static boolean isEnabled(@Nullable Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    private synchronized void onTimeout() {
        if (state == State.RUNNING) {
            state = State.TIMED_OUT;
            LOG.debug("Attempt exceeded its timeout of {} ms, interrupting thread {}", timeout.toMillis(),
                    thread.getName());
            thread.interrupt();
        }
    }

    synchronized boolean hasTimedOut() {
        return state == State.TIMED_OUT;
    }

    @Override
    public synchronized void close() {
        if (state == State.RUNNING) {
            state = State.FINISHED;
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
        } else if (state == State.TIMED_OUT && Thread.currentThread() == thread) {
            // the attempt may not have consumed the interrupt
            Thread.interrupted();
        }
    }
}
