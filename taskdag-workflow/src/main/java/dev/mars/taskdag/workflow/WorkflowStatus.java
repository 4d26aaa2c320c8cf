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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Enumeration of workflow execution statuses.
 */
public enum WorkflowStatus {

    /**
     * Execution has been created but not started.
     */
    IDLE("idle"),

    /**
     * Execution is running.
     */
    RUNNING("running"),

    /**
     * Execution has been paused; readiness and retry timers are frozen.
     */
    PAUSED("paused"),

    /**
     * Every node finished and no failure escaped its routing.
     */
    COMPLETED("completed"),

    /**
     * At least one node failed without an {@code onFailure} route.
     */
    FAILED("failed"),

    /**
     * Execution has been cancelled.
     */
    CANCELLED("cancelled");

    private static final Map<WorkflowStatus, Set<WorkflowStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<WorkflowStatus, Set<WorkflowStatus>>(WorkflowStatus.class);
        map.put(IDLE, EnumSet.of(RUNNING, CANCELLED));
        map.put(RUNNING, EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED));
        map.put(PAUSED, EnumSet.of(RUNNING, CANCELLED));
        map.put(COMPLETED, EnumSet.noneOf(WorkflowStatus.class));
        map.put(FAILED, EnumSet.noneOf(WorkflowStatus.class));
        map.put(CANCELLED, EnumSet.noneOf(WorkflowStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(WorkflowStatus.class)).contains(target);
    }

    public Set<WorkflowStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    @JsonCreator
    public static WorkflowStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Workflow status value must not be null");
        }
        for (WorkflowStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
