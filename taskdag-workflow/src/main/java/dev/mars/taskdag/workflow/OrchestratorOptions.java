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

package dev.mars.taskdag.workflow;

import dev.mars.taskdag.config.TaskDagConfiguration;
import dev.mars.taskdag.workflow.schedule.RetryScheduler;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Collaborators and defaults for a {@link TaskDagOrchestrator}.
 *
 * <p>When no {@link RetryScheduler} is supplied the orchestrator creates its own on the first
 * retry and shuts it down when the run ends.</p>
 */
public final class OrchestratorOptions {

    private static final OrchestratorOptions DEFAULTS = builder().build();

    private final RetryScheduler retryScheduler;
    private final Clock clock;
    private final RetryPolicy defaultRetryPolicy;

    private OrchestratorOptions(Builder builder) {
        this.retryScheduler = builder.retryScheduler;
        this.clock = builder.clock;
        this.defaultRetryPolicy = builder.defaultRetryPolicy;
    }

    public static OrchestratorOptions defaults() {
        return DEFAULTS;
    }

    public static OrchestratorOptions fromConfiguration(TaskDagConfiguration configuration) {
        return builder().configuration(configuration).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RetryScheduler> getRetryScheduler() {
        return Optional.ofNullable(retryScheduler);
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Policy for nodes that declare none. Never retries unless configured.
     */
    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    @Override
    public String toString() {
        return "OrchestratorOptions{" +
               "retryScheduler=" + (retryScheduler != null ? retryScheduler.getClass().getSimpleName() : "lazy") +
               ", clock=" + clock +
               ", defaultRetryPolicy=" + defaultRetryPolicy +
               '}';
    }

    public static final class Builder {
        private RetryScheduler retryScheduler;
        private Clock clock = Clock.systemUTC();
        private RetryPolicy defaultRetryPolicy = RetryPolicy.none();

        private Builder() {
        }

        public Builder retryScheduler(RetryScheduler retryScheduler) {
            this.retryScheduler = retryScheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = Objects.requireNonNull(defaultRetryPolicy, "Default retry policy cannot be null");
            return this;
        }

        /**
         * Takes the default retry policy from {@code taskdag.retry.default.*}.
         */
        public Builder configuration(TaskDagConfiguration configuration) {
            Objects.requireNonNull(configuration, "Configuration cannot be null");
            return defaultRetryPolicy(new RetryPolicy(
                    configuration.getDefaultMaxRetries(),
                    configuration.getDefaultRetryDelayMs(),
                    configuration.getDefaultBackoffMultiplier()));
        }

        public OrchestratorOptions build() {
            return new OrchestratorOptions(this);
        }
    }
}
