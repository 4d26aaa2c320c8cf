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

package dev.mars.taskdag.workflow.event;

import dev.mars.taskdag.workflow.DagNode;
import dev.mars.taskdag.workflow.WorkflowExecution;

import java.util.Objects;
import java.util.Optional;

/**
 * Events emitted by a {@link dev.mars.taskdag.workflow.TaskDagOrchestrator}.
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link NodeReady}: a node was released; the runner should start it</li>
 *   <li>{@link NodeRetry}: a node failed and will be released again after {@code delayMs}</li>
 *   <li>{@link NodeSkipped}: a node will never run</li>
 *   <li>{@link WorkflowProgress}: a snapshot after any state change</li>
 *   <li>{@link WorkflowCompleted} and {@link WorkflowFailed}: the run reached a terminal outcome</li>
 * </ul>
 *
 * <p>Cancellation has no dedicated event; the final {@link WorkflowProgress} carries the
 * {@code CANCELLED} status.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface OrchestratorEvent
        permits OrchestratorEvent.NodeReady,
                OrchestratorEvent.NodeRetry,
                OrchestratorEvent.NodeSkipped,
                OrchestratorEvent.WorkflowProgress,
                OrchestratorEvent.WorkflowCompleted,
                OrchestratorEvent.WorkflowFailed {

    EventType type();

    String executionId();

    /**
     * A node was moved to QUEUED in readiness pass {@code pass}.
     *
     * @param executionId the execution the node belongs to
     * @param nodeId      the released node
     * @param node        the full node, for the runner to build its task
     * @param pass        sequence number of the readiness pass that released it
     */
    record NodeReady(String executionId, String nodeId, DagNode node, long pass) implements OrchestratorEvent {
        public NodeReady {
            Objects.requireNonNull(executionId, "executionId");
            Objects.requireNonNull(node, "node");
        }

        @Override
        public EventType type() {
            return EventType.NODE_READY;
        }

        /**
         * The node's parallel group, a hint that it may share a session pool with its siblings.
         */
        public Optional<String> parallelGroup() {
            return node.getParallelGroup();
        }
    }

    /**
     * @param retryCount the 1-based retry that is now scheduled
     * @param delayMs    the backoff before the node is released again
     */
    record NodeRetry(String executionId, String nodeId, int retryCount, long delayMs) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.NODE_RETRY;
        }
    }

    record NodeSkipped(String executionId, String nodeId, String reason) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.NODE_SKIPPED;
        }
    }

    record WorkflowProgress(WorkflowExecution execution) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.WORKFLOW_PROGRESS;
        }

        @Override
        public String executionId() {
            return execution.getId();
        }
    }

    record WorkflowCompleted(WorkflowExecution execution) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.WORKFLOW_COMPLETED;
        }

        @Override
        public String executionId() {
            return execution.getId();
        }
    }

    record WorkflowFailed(WorkflowExecution execution) implements OrchestratorEvent {
        @Override
        public EventType type() {
            return EventType.WORKFLOW_FAILED;
        }

        @Override
        public String executionId() {
            return execution.getId();
        }
    }
}
