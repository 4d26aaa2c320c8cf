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

package dev.mars.taskdag.workflow.observability;

import dev.mars.taskdag.workflow.DagNode;
import dev.mars.taskdag.workflow.DagNodeState;
import dev.mars.taskdag.workflow.NodeStatus;
import dev.mars.taskdag.workflow.TaskType;
import dev.mars.taskdag.workflow.WorkflowDefinition;
import dev.mars.taskdag.workflow.WorkflowExecution;
import dev.mars.taskdag.workflow.WorkflowStatus;
import dev.mars.taskdag.workflow.event.OrchestratorEvent;
import dev.mars.taskdag.workflow.event.OrchestratorListener;

import java.time.Duration;
import java.util.Objects;

/**
 * Translates the events of one execution into {@link WorkflowMetrics} updates.
 * Subscribe one instance per orchestrator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class MetricsListener implements OrchestratorListener {

    private final WorkflowMetrics metrics;
    private final WorkflowDefinition definition;
    private boolean started;
    private boolean finished;

    public MetricsListener(WorkflowMetrics metrics, WorkflowDefinition definition) {
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
    }

    @Override
    public synchronized void onEvent(OrchestratorEvent event) {
        if (event instanceof OrchestratorEvent.NodeReady) {
            OrchestratorEvent.NodeReady ready = (OrchestratorEvent.NodeReady) event;
            metrics.recordNodeDispatched(definition.getName(), nodeTaskType(ready.node()));
        } else if (event instanceof OrchestratorEvent.NodeRetry) {
            OrchestratorEvent.NodeRetry retry = (OrchestratorEvent.NodeRetry) event;
            metrics.recordNodeRetry(definition.getName(), taskTypeOf(retry.nodeId()));
        } else if (event instanceof OrchestratorEvent.NodeSkipped) {
            OrchestratorEvent.NodeSkipped skipped = (OrchestratorEvent.NodeSkipped) event;
            metrics.recordNodeSkipped(definition.getName(), skipped.reason());
        } else if (event instanceof OrchestratorEvent.WorkflowProgress) {
            onProgress(((OrchestratorEvent.WorkflowProgress) event).execution());
        } else if (event instanceof OrchestratorEvent.WorkflowCompleted) {
            WorkflowExecution execution = ((OrchestratorEvent.WorkflowCompleted) event).execution();
            if (markFinished()) {
                recordFailedNodes(execution);
                metrics.recordWorkflowCompleted(definition.getName(), durationSeconds(execution));
            }
        } else if (event instanceof OrchestratorEvent.WorkflowFailed) {
            WorkflowExecution execution = ((OrchestratorEvent.WorkflowFailed) event).execution();
            if (markFinished()) {
                recordFailedNodes(execution);
                metrics.recordWorkflowFailed(definition.getName(), durationSeconds(execution));
            }
        }
    }

    private void onProgress(WorkflowExecution execution) {
        if (execution.getStatus() == WorkflowStatus.CANCELLED) {
            if (!finished) {
                finished = true;
                metrics.recordWorkflowCancelled(definition.getName(), started);
            }
        } else if (execution.getStatus() != WorkflowStatus.IDLE) {
            ensureStarted();
        }
    }

    private boolean markFinished() {
        ensureStarted();
        if (finished) {
            return false;
        }
        finished = true;
        return true;
    }

    private void ensureStarted() {
        if (!started) {
            started = true;
            metrics.recordWorkflowStarted(definition.getName());
        }
    }

    private void recordFailedNodes(WorkflowExecution execution) {
        for (DagNodeState state : execution.getNodeStates().values()) {
            if (state.getStatus() == NodeStatus.FAILED) {
                metrics.recordNodeFailed(definition.getName(), taskTypeOf(state.getNodeId()));
            }
        }
    }

    private String taskTypeOf(String nodeId) {
        return definition.getNode(nodeId).map(MetricsListener::nodeTaskType).orElse(null);
    }

    private static String nodeTaskType(DagNode node) {
        TaskType taskType = node.getTaskType();
        return taskType != null ? taskType.getValue() : null;
    }

    private static double durationSeconds(WorkflowExecution execution) {
        return execution.getDuration().map(Duration::toMillis).orElse(0L) / 1000.0;
    }
}
