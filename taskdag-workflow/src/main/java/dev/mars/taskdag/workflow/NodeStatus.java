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
 * Lifecycle of a single node within one workflow execution.
 *
 * <p>
 * <strong>State categories:</strong>
 * </p>
 * <ul>
 * <li><strong>Waiting</strong> ({@code PENDING}, {@code RETRYING}): not yet handed to the runner.</li>
 * <li><strong>Dispatched</strong> ({@code QUEUED}, {@code RUNNING}): announced through
 * {@code node:ready} and owned by the external runner.</li>
 * <li><strong>Terminal</strong> ({@code COMPLETED}, {@code FAILED}, {@code SKIPPED}): no further
 * transitions are possible.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum NodeStatus {

    /**
     * Waiting for dependencies or for a conditional route to release it.
     */
    PENDING("pending"),

    /**
     * Released and announced; waiting for the runner to pick it up.
     */
    QUEUED("queued"),

    /**
     * The runner has started an assistant session for it.
     */
    RUNNING("running"),

    COMPLETED("completed"),

    /**
     * Failed and out of retries.
     */
    FAILED("failed"),

    /**
     * Failed with retries left; waiting for the backoff delay to elapse.
     */
    RETRYING("retrying"),

    /**
     * Will never run: dependency failed, branch not taken, or the run was cancelled.
     */
    SKIPPED("skipped");

    // ========== Transition table (single source of truth) ==========

    private static final Map<NodeStatus, Set<NodeStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<NodeStatus, Set<NodeStatus>>(NodeStatus.class);
        map.put(PENDING, EnumSet.of(QUEUED, SKIPPED));
        map.put(QUEUED, EnumSet.of(RUNNING, SKIPPED));
        map.put(RUNNING, EnumSet.of(COMPLETED, FAILED, RETRYING));
        map.put(RETRYING, EnumSet.of(QUEUED, SKIPPED));
        map.put(COMPLETED, EnumSet.noneOf(NodeStatus.class));
        map.put(FAILED, EnumSet.noneOf(NodeStatus.class));
        map.put(SKIPPED, EnumSet.noneOf(NodeStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    NodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether the node has reached an outcome that can no longer change.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * Whether the node is still making progress: announced, running, or waiting on a retry timer.
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING || this == RETRYING;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <pre>
     *   PENDING   → QUEUED, SKIPPED
     *   QUEUED    → RUNNING, SKIPPED
     *   RUNNING   → COMPLETED, FAILED, RETRYING
     *   RETRYING  → QUEUED, SKIPPED
     *   COMPLETED, FAILED, SKIPPED → (terminal)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(NodeStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(NodeStatus.class)).contains(target);
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return unmodifiable set of valid target statuses (empty for terminal states)
     */
    public Set<NodeStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    @JsonCreator
    public static NodeStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node status value must not be null");
        }
        for (NodeStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown node status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
