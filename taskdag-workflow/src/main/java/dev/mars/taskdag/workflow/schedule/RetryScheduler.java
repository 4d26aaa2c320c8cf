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

import java.time.Duration;

/**
 * Runs retry callbacks after a delay. The orchestrator owns no threads; it hands every backoff
 * wait to an implementation of this interface.
 */
public interface RetryScheduler {

    /**
     * Schedules {@code task} to run once after {@code delay}.
     *
     * @return a handle that cancels the task if it has not yet run
     */
    ScheduledRetry schedule(Duration delay, Runnable task);

    /**
     * Releases any threads held by the scheduler. Pending tasks are discarded.
     */
    default void shutdown() {
    }
}
