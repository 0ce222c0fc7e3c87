/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.subscription.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates and shuts down the executors owned by subscriptions and transports.
 */
public class ExecutorShutdown {
    private static final Logger log = LoggerFactory.getLogger(ExecutorShutdown.class);

    /**
     * Shutdown the executor service and wait for running tasks to complete for the given {@code timeout}.
     * Tasks that are still running after the timeout are interrupted.
     *
     * @param executorService The executor service
     * @param timeout         the maximum time to wait
     */
    public static void shutdownSafely(ExecutorService executorService, Duration timeout) {
        if (!executorService.isShutdown() && !executorService.isTerminated()) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Executor didn't terminate within {}, interrupting remaining tasks", timeout);
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                if (!executorService.isTerminated()) {
                    executorService.shutdownNow();
                }
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return A thread factory that creates daemon threads named {@code prefix-<n>}
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
