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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of work in a workflow definition.
 *
 * <p>The orchestrator uses only the identity, dependency, retry and routing fields. The
 * {@code label}, {@code moduleId}, {@code taskType}, {@code prompt} and {@code attributes}
 * are carried through untouched for the external runner.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class DagNode {

    private final String id;
    private final String label;
    private final String moduleId;
    private final TaskType taskType;
    private final String prompt;
    private final List<String> dependsOn;
    private final String parallelGroup;
    private final RetryPolicy retryPolicy;
    private final ConditionalBranch conditionalNext;
    private final Map<String, Object> attributes;

    private DagNode(Builder builder) {
        this.id = builder.id;
        this.label = builder.label != null ? builder.label : builder.id;
        this.moduleId = builder.moduleId;
        this.taskType = builder.taskType;
        this.prompt = builder.prompt != null ? builder.prompt : "";
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.parallelGroup = builder.parallelGroup;
        this.retryPolicy = builder.retryPolicy;
        this.conditionalNext = builder.conditionalNext;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * A builder pre-populated with this node's fields.
     */
    public Builder toBuilder() {
        return toBuilder(id);
    }

    /**
     * A builder pre-populated with this node's fields under a new id.
     */
    public Builder toBuilder(String newId) {
        Builder builder = new Builder(newId)
                .label(label)
                .moduleId(moduleId)
                .taskType(taskType)
                .prompt(prompt)
                .dependsOn(dependsOn)
                .parallelGroup(parallelGroup)
                .retryPolicy(retryPolicy)
                .conditionalNext(conditionalNext);
        builder.attributes.putAll(attributes);
        return builder;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getModuleId() {
        return moduleId;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public String getPrompt() {
        return prompt;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public Optional<String> getParallelGroup() {
        return Optional.ofNullable(parallelGroup);
    }

    public Optional<RetryPolicy> getRetryPolicy() {
        return Optional.ofNullable(retryPolicy);
    }

    public Optional<ConditionalBranch> getConditionalNext() {
        return Optional.ofNullable(conditionalNext);
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DagNode dagNode = (DagNode) o;
        return id.equals(dagNode.id) &&
               Objects.equals(label, dagNode.label) &&
               Objects.equals(moduleId, dagNode.moduleId) &&
               taskType == dagNode.taskType &&
               Objects.equals(prompt, dagNode.prompt) &&
               dependsOn.equals(dagNode.dependsOn) &&
               Objects.equals(parallelGroup, dagNode.parallelGroup) &&
               Objects.equals(retryPolicy, dagNode.retryPolicy) &&
               Objects.equals(conditionalNext, dagNode.conditionalNext) &&
               attributes.equals(dagNode.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, moduleId, taskType, prompt, dependsOn, parallelGroup,
                retryPolicy, conditionalNext, attributes);
    }

    @Override
    public String toString() {
        return "DagNode{" +
               "id='" + id + '\'' +
               ", label='" + label + '\'' +
               ", moduleId='" + moduleId + '\'' +
               ", taskType=" + taskType +
               ", dependsOn=" + dependsOn +
               ", parallelGroup='" + parallelGroup + '\'' +
               '}';
    }

    public static final class Builder {
        private final String id;
        private String label;
        private String moduleId;
        private TaskType taskType;
        private String prompt;
        private final LinkedHashSet<String> dependsOn = new LinkedHashSet<>();
        private String parallelGroup;
        private RetryPolicy retryPolicy;
        private ConditionalBranch conditionalNext;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String id) {
            Objects.requireNonNull(id, "Node id cannot be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Node id cannot be blank");
            }
            this.id = id;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder moduleId(String moduleId) {
            this.moduleId = moduleId;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        /**
         * Replaces the dependency list; duplicates are dropped, first occurrence wins.
         */
        public Builder dependsOn(List<String> nodeIds) {
            this.dependsOn.clear();
            if (nodeIds != null) {
                nodeIds.forEach(this::addDependency);
            }
            return this;
        }

        public Builder dependsOn(String... nodeIds) {
            return dependsOn(Arrays.asList(nodeIds));
        }

        private void addDependency(String nodeId) {
            this.dependsOn.add(Objects.requireNonNull(nodeId, "Dependency id cannot be null"));
        }

        public Builder parallelGroup(String parallelGroup) {
            this.parallelGroup = parallelGroup;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder conditionalNext(ConditionalBranch conditionalNext) {
            this.conditionalNext = conditionalNext;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(Objects.requireNonNull(key, "Attribute key cannot be null"), value);
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            this.attributes.clear();
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public DagNode build() {
            return new DagNode(this);
        }
    }
}
