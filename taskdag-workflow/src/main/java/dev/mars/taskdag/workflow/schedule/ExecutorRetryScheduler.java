/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.taskdag.workflow.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RetryScheduler} backed by a {@link ScheduledThreadPoolExecutor} of daemon threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExecutorRetryScheduler implements RetryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorRetryScheduler.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorRetryScheduler() {
        this(1);
    }

    public ExecutorRetryScheduler(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Scheduler needs at least one thread: " + threads);
        }
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(threads, runnable -> {
            Thread thread = new Thread(runnable, "taskdag-retry-" + pool + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        logger.debug("Created retry scheduler pool {} with {} thread(s)", pool, threads);
    }

    @Override
    public ScheduledRetry schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(delay, "Delay cannot be null");
        Objects.requireNonNull(task, "Task cannot be null");
        ScheduledFuture<?> future = executor.schedule(() -> runSafely(task),
                Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void shutdown() {
        if (!executor.isShutdown()) {
            executor.shutdown();
            logger.debug("Retry scheduler shut down");
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.error("Retry callback failed: {}", e.getMessage(), e);
        }
    }
}
