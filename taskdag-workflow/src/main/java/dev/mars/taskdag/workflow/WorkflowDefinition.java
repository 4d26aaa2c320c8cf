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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a workflow: its nodes in definition order plus descriptive metadata.
 *
 * <p>A definition is not checked on construction; {@link WorkflowValidator} reports duplicate
 * ids, dangling references and cycles, and {@link TaskDagOrchestrator} refuses any definition
 * the validator rejects.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final List<DagNode> nodes;
    private final List<String> moduleIds;
    private final Integer estimatedMinutes;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, DagNode> nodeIndex;

    private WorkflowDefinition(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description != null ? builder.description : "";
        this.nodes = List.copyOf(builder.nodes);
        this.moduleIds = List.copyOf(builder.moduleIds);
        this.estimatedMinutes = builder.estimatedMinutes;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;

        Map<String, DagNode> index = new LinkedHashMap<>();
        for (DagNode node : nodes) {
            index.putIfAbsent(node.getId(), node);
        }
        this.nodeIndex = Collections.unmodifiableMap(index);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<DagNode> getNodes() {
        return nodes;
    }

    /**
     * Looks up a node by id. When ids are duplicated the first node in definition order wins.
     */
    public Optional<DagNode> getNode(String nodeId) {
        return Optional.ofNullable(nodeIndex.get(nodeId));
    }

    public List<String> getModuleIds() {
        return moduleIds;
    }

    public Optional<Integer> getEstimatedMinutes() {
        return Optional.ofNullable(estimatedMinutes);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) &&
               name.equals(that.name) &&
               description.equals(that.description) &&
               nodes.equals(that.nodes) &&
               moduleIds.equals(that.moduleIds) &&
               Objects.equals(estimatedMinutes, that.estimatedMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, nodes, moduleIds, estimatedMinutes);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", nodes=" + nodes.size() +
               ", moduleIds=" + moduleIds +
               '}';
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private final List<DagNode> nodes = new ArrayList<>();
        private final List<String> moduleIds = new ArrayList<>();
        private Integer estimatedMinutes;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id) {
            Objects.requireNonNull(id, "Workflow id cannot be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Workflow id cannot be blank");
            }
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder node(DagNode node) {
            this.nodes.add(Objects.requireNonNull(node, "Node cannot be null"));
            return this;
        }

        public Builder nodes(List<DagNode> nodes) {
            this.nodes.clear();
            if (nodes != null) {
                nodes.forEach(this::node);
            }
            return this;
        }

        public Builder moduleIds(List<String> moduleIds) {
            this.moduleIds.clear();
            if (moduleIds != null) {
                this.moduleIds.addAll(moduleIds);
            }
            return this;
        }

        public Builder estimatedMinutes(Integer estimatedMinutes) {
            this.estimatedMinutes = estimatedMinutes;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
