/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracecore.util;

import co.tracecore.sdk.logging.Logger;
import co.tracecore.sdk.logging.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the background threads of the span recorder.
 * <p>
 * All threads are daemon threads named {@code tracecore-<purpose>}, so that they never keep the application alive.
 * </p>
 */
public final class ExecutorUtils {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorUtils.class);

    static final String THREAD_PREFIX = "tracecore-";

    private ExecutorUtils() {
    }

    public static ThreadFactory namedDaemonThreadFactory(String threadPurpose) {
        return new NamedDaemonThreadFactory(THREAD_PREFIX + threadPurpose);
    }

    /**
     * Runs {@code task} on a dedicated daemon thread, with {@code delay} between the end of one run and the start of the next.
     * <p>
     * A run which throws is logged and does not cancel the following runs.
     * </p>
     *
     * @return the executor, to be shut down by the caller
     */
    public static ScheduledExecutorService scheduleWithFixedDelay(String threadPurpose, Runnable task, long delay, TimeUnit unit) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(namedDaemonThreadFactory(threadPurpose));
        executor.scheduleWithFixedDelay(new FailureLoggingRunnable(threadPurpose, task), delay, delay, unit);
        return executor;
    }

    /**
     * Shuts the executor down, interrupting its tasks if they did not complete within {@code timeout}.
     */
    public static void shutdownAndWaitTermination(ExecutorService executor, long timeout, TimeUnit unit) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, unit)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(timeout, unit)) {
                    logger.warn("Thread pool did not terminate in time {}", executor);
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static class NamedDaemonThreadFactory implements ThreadFactory {

        private final String baseName;
        private final AtomicInteger threadCount = new AtomicInteger();

        NamedDaemonThreadFactory(String baseName) {
            this.baseName = baseName;
        }

        @Override
        public Thread newThread(Runnable r) {
            // only additional threads get a number
            int count = threadCount.incrementAndGet();
            String threadName = count == 1 ? baseName : baseName + "-" + count;
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            logger.debug("Created thread {}", threadName);
            return thread;
        }
    }

    static class FailureLoggingRunnable implements Runnable {

        private final String taskName;
        private final Runnable delegate;

        FailureLoggingRunnable(String taskName, Runnable delegate) {
            this.taskName = taskName;
            this.delegate = delegate;
        }

        @Override
        public void run() {
            try {
                delegate.run();
            } catch (RuntimeException e) {
                logger.error("Scheduled task " + taskName + " failed, it will run again after the next delay", e);
            }
        }
    }
}
