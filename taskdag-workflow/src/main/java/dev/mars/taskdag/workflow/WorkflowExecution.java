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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a workflow execution. The orchestrator owns the live state;
 * callers and listeners only ever see copies like this one.
 *
 * <p>{@code completedNodes} counts successful nodes only; failures and skips have their own
 * counters. {@code nodeStates} iterates in definition order.</p>
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class WorkflowExecution {

    private final String id;
    private final String workflowId;
    private final String workflowName;
    private final WorkflowStatus status;
    private final Map<String, DagNodeState> nodeStates;
    private final int totalNodes;
    private final int completedNodes;
    private final int failedNodes;
    private final int skippedNodes;
    private final List<String> runningNodeIds;
    private final String currentStepLabel;
    private final Instant startedAt;
    private final Instant completedAt;

    @JsonCreator
    public WorkflowExecution(@JsonProperty("id") String id,
                             @JsonProperty("workflowId") String workflowId,
                             @JsonProperty("workflowName") String workflowName,
                             @JsonProperty("status") WorkflowStatus status,
                             @JsonProperty("nodeStates") Map<String, DagNodeState> nodeStates,
                             @JsonProperty("totalNodes") int totalNodes,
                             @JsonProperty("completedNodes") int completedNodes,
                             @JsonProperty("failedNodes") int failedNodes,
                             @JsonProperty("skippedNodes") int skippedNodes,
                             @JsonProperty("runningNodeIds") List<String> runningNodeIds,
                             @JsonProperty("currentStepLabel") String currentStepLabel,
                             @JsonProperty("startedAt") Instant startedAt,
                             @JsonProperty("completedAt") Instant completedAt) {
        this.id = Objects.requireNonNull(id, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.workflowName = workflowName;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.nodeStates = nodeStates != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(nodeStates))
                : Map.of();
        this.totalNodes = totalNodes;
        this.completedNodes = completedNodes;
        this.failedNodes = failedNodes;
        this.skippedNodes = skippedNodes;
        this.runningNodeIds = runningNodeIds != null ? List.copyOf(runningNodeIds) : List.of();
        this.currentStepLabel = currentStepLabel != null ? currentStepLabel : "";
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Map<String, DagNodeState> getNodeStates() {
        return nodeStates;
    }

    public Optional<DagNodeState> getNodeState(String nodeId) {
        return Optional.ofNullable(nodeStates.get(nodeId));
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public int getCompletedNodes() {
        return completedNodes;
    }

    public int getFailedNodes() {
        return failedNodes;
    }

    public int getSkippedNodes() {
        return skippedNodes;
    }

    public List<String> getRunningNodeIds() {
        return runningNodeIds;
    }

    public String getCurrentStepLabel() {
        return currentStepLabel;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Duration> getDuration() {
        return startedAt != null && completedAt != null
                ? Optional.of(Duration.between(startedAt, completedAt))
                : Optional.empty();
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.COMPLETED;
    }

    public boolean isRunning() {
        return status.isActive();
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return totalNodes == that.totalNodes &&
               completedNodes == that.completedNodes &&
               failedNodes == that.failedNodes &&
               skippedNodes == that.skippedNodes &&
               id.equals(that.id) &&
               workflowId.equals(that.workflowId) &&
               Objects.equals(workflowName, that.workflowName) &&
               status == that.status &&
               nodeStates.equals(that.nodeStates) &&
               runningNodeIds.equals(that.runningNodeIds) &&
               currentStepLabel.equals(that.currentStepLabel) &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(completedAt, that.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, workflowId, status, nodeStates, completedNodes, failedNodes, skippedNodes);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
               "id='" + id + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", completed=" + completedNodes +
               ", failed=" + failedNodes +
               ", skipped=" + skippedNodes +
               ", total=" + totalNodes +
               ", step='" + currentStepLabel + '\'' +
               '}';
    }
}
