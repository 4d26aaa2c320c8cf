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
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one node's runtime state within an execution.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class DagNodeState {

    private final String nodeId;
    private final NodeStatus status;
    private final int retryCount;
    private final String sessionHandle;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Boolean success;
    private final String error;

    @JsonCreator
    public DagNodeState(@JsonProperty("nodeId") String nodeId,
                        @JsonProperty("status") NodeStatus status,
                        @JsonProperty("retryCount") int retryCount,
                        @JsonProperty("sessionHandle") String sessionHandle,
                        @JsonProperty("startedAt") Instant startedAt,
                        @JsonProperty("completedAt") Instant completedAt,
                        @JsonProperty("success") Boolean success,
                        @JsonProperty("error") String error) {
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.retryCount = retryCount;
        this.sessionHandle = sessionHandle;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.success = success;
        this.error = error;
    }

    static DagNodeState pending(String nodeId) {
        return new DagNodeState(nodeId, NodeStatus.PENDING, 0, null, null, null, null, null);
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Optional<String> getSessionHandle() {
        return Optional.ofNullable(sessionHandle);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    /**
     * The known outcome: present only once the node has completed or failed for good.
     */
    public Optional<Boolean> getSuccess() {
        return Optional.ofNullable(success);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Duration> getDuration() {
        return startedAt != null && completedAt != null
                ? Optional.of(Duration.between(startedAt, completedAt))
                : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DagNodeState that = (DagNodeState) o;
        return retryCount == that.retryCount &&
               nodeId.equals(that.nodeId) &&
               status == that.status &&
               Objects.equals(sessionHandle, that.sessionHandle) &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(completedAt, that.completedAt) &&
               Objects.equals(success, that.success) &&
               Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, status, retryCount, sessionHandle, startedAt, completedAt, success, error);
    }

    @Override
    public String toString() {
        return "DagNodeState{" +
               "nodeId='" + nodeId + '\'' +
               ", status=" + status +
               ", retryCount=" + retryCount +
               ", success=" + success +
               '}';
    }
}
