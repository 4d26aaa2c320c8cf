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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one execution. Owned and guarded by its {@link TaskDagOrchestrator};
 * everything outside the orchestrator sees {@link #snapshot()} copies.
 */
final class ExecutionState {

    private final String executionId;
    private final WorkflowDefinition definition;
    private final Map<String, NodeRuntime> nodes = new LinkedHashMap<>();
    private WorkflowStatus status = WorkflowStatus.IDLE;
    private Instant startedAt;
    private Instant completedAt;

    ExecutionState(String executionId, WorkflowDefinition definition) {
        this.executionId = executionId;
        this.definition = definition;
        int index = 0;
        for (DagNode node : definition.getNodes()) {
            nodes.putIfAbsent(node.getId(), new NodeRuntime(node, index++));
        }
    }

    String getExecutionId() {
        return executionId;
    }

    WorkflowStatus getStatus() {
        return status;
    }

    NodeRuntime node(String nodeId) {
        return nodes.get(nodeId);
    }

    /**
     * Nodes in definition order.
     */
    Collection<NodeRuntime> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    void start(Instant now) {
        transitionTo(WorkflowStatus.RUNNING);
        startedAt = now;
    }

    void finish(WorkflowStatus outcome, Instant now) {
        transitionTo(outcome);
        completedAt = now;
    }

    void transitionTo(WorkflowStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Execution " + executionId + " cannot move from "
                    + status + " to " + target);
        }
        status = target;
    }

    boolean hasActiveNodes() {
        return nodes.values().stream().anyMatch(node -> node.status.isActive());
    }

    /**
     * Whether some node failed for good without an {@code onFailure} route to absorb it.
     */
    boolean hasUnroutedFailure() {
        return nodes.values().stream()
                .anyMatch(node -> node.status == NodeStatus.FAILED && !node.failureRouted);
    }

    int count(NodeStatus nodeStatus) {
        return (int) nodes.values().stream().filter(node -> node.status == nodeStatus).count();
    }

    WorkflowExecution snapshot() {
        Map<String, DagNodeState> states = new LinkedHashMap<>();
        List<NodeRuntime> running = new ArrayList<>();
        for (NodeRuntime node : nodes.values()) {
            states.put(node.getId(), node.snapshot());
            if (node.status == NodeStatus.RUNNING) {
                running.add(node);
            }
        }
        int completed = count(NodeStatus.COMPLETED);
        int failed = count(NodeStatus.FAILED);
        int skipped = count(NodeStatus.SKIPPED);

        return new WorkflowExecution(executionId, definition.getId(), definition.getName(), status, states,
                nodes.size(), completed, failed, skipped,
                running.stream().map(NodeRuntime::getId).toList(),
                stepLabel(running, completed, failed, skipped),
                startedAt, completedAt);
    }

    private String stepLabel(List<NodeRuntime> running, int completed, int failed, int skipped) {
        int total = nodes.size();
        int done = completed + failed + skipped;
        return switch (status) {
            case IDLE -> "Not started";
            case COMPLETED -> skipped == 0
                    ? "All " + total + " steps completed"
                    : completed + " completed, " + skipped + " skipped";
            case FAILED -> failed + " failed, " + completed + " completed";
            case CANCELLED -> "Workflow cancelled";
            case PAUSED -> "Workflow paused";
            case RUNNING -> {
                if (running.isEmpty()) {
                    yield done + "/" + total + " completed";
                }
                String current = running.size() == 1
                        ? running.get(0).node.getLabel()
                        : running.size() + " tasks in parallel";
                yield "Step " + Math.min(done + 1, total) + "/" + total + ": " + current;
            }
        };
    }

    /**
     * Runtime bookkeeping for one node.
     */
    static final class NodeRuntime {
        private final DagNode node;
        private final int index;
        private NodeStatus status = NodeStatus.PENDING;
        private int retryCount;
        private String sessionHandle;
        private Instant startedAt;
        private Instant completedAt;
        private Boolean success;
        private String error;
        private boolean failureRouted;

        private NodeRuntime(DagNode node, int index) {
            this.node = node;
            this.index = index;
        }

        String getId() {
            return node.getId();
        }

        DagNode getNode() {
            return node;
        }

        /**
         * Position in the definition, used to keep announcements in definition order.
         */
        int getIndex() {
            return index;
        }

        NodeStatus getStatus() {
            return status;
        }

        int getRetryCount() {
            return retryCount;
        }

        String getSessionHandle() {
            return sessionHandle;
        }

        void queue() {
            transitionTo(NodeStatus.QUEUED);
        }

        void markRunning(String handle, Instant now) {
            transitionTo(NodeStatus.RUNNING);
            sessionHandle = handle;
            startedAt = now;
        }

        void complete(Instant now) {
            transitionTo(NodeStatus.COMPLETED);
            success = Boolean.TRUE;
            error = null;
            completedAt = now;
        }

        /**
         * Moves to RETRYING and returns the 1-based number of the retry now pending.
         */
        int beginRetry(String failure) {
            transitionTo(NodeStatus.RETRYING);
            error = failure;
            return ++retryCount;
        }

        void fail(Instant now, String failure, boolean routed) {
            transitionTo(NodeStatus.FAILED);
            success = Boolean.FALSE;
            error = failure;
            failureRouted = routed;
            completedAt = now;
        }

        void skip(Instant now) {
            transitionTo(NodeStatus.SKIPPED);
            completedAt = now;
        }

        private void transitionTo(NodeStatus target) {
            if (!status.canTransitionTo(target)) {
                throw new IllegalStateException("Node " + node.getId() + " cannot move from "
                        + status + " to " + target);
            }
            status = target;
        }

        DagNodeState snapshot() {
            return new DagNodeState(node.getId(), status, retryCount, sessionHandle, startedAt, completedAt,
                    success, error);
        }
    }
}
