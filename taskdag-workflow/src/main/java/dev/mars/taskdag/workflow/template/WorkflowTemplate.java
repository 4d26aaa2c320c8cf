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

package dev.mars.taskdag.workflow.template;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.mars.taskdag.workflow.DagNode;
import dev.mars.taskdag.workflow.RetryPolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A reusable workflow shape. Template nodes use {@value #MODULE_PLACEHOLDER} wherever the target
 * module id belongs; {@link TemplateHydrator} turns a template plus module ids into a concrete
 * {@link dev.mars.taskdag.workflow.WorkflowDefinition}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowTemplate {

    public static final String MODULE_PLACEHOLDER = "$MODULE";

    /**
     * How many modules a template is meant to be applied to.
     */
    public enum ModuleScope {
        SINGLE("single"),
        SELECTED("selected"),
        ALL("all");

        private final String value;

        ModuleScope(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public static ModuleScope fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Module scope cannot be null");
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ModuleScope scope : values()) {
                if (scope.value.equals(normalized)) {
                    return scope;
                }
            }
            throw new IllegalArgumentException("Unknown module scope: " + value);
        }
    }

    private final String id;
    private final String name;
    private final String description;
    private final String icon;
    private final ModuleScope moduleScope;
    private final List<DagNode> nodes;
    private final RetryPolicy defaultRetryPolicy;
    private final boolean parallelExecution;
    private final int estimatedMinutesPerModule;
    private final boolean builtIn;
    private final Instant createdAt;

    private WorkflowTemplate(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description != null ? builder.description : "";
        this.icon = builder.icon;
        this.moduleScope = builder.moduleScope;
        this.nodes = List.copyOf(builder.nodes);
        this.defaultRetryPolicy = builder.defaultRetryPolicy;
        this.parallelExecution = builder.parallelExecution;
        this.estimatedMinutesPerModule = builder.estimatedMinutesPerModule;
        this.builtIn = builder.builtIn;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .description(description)
                .icon(icon)
                .moduleScope(moduleScope)
                .nodes(nodes)
                .defaultRetryPolicy(defaultRetryPolicy)
                .parallelExecution(parallelExecution)
                .estimatedMinutesPerModule(estimatedMinutesPerModule)
                .builtIn(builtIn)
                .createdAt(createdAt);
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

    public Optional<String> getIcon() {
        return Optional.ofNullable(icon);
    }

    public ModuleScope getModuleScope() {
        return moduleScope;
    }

    public List<DagNode> getNodes() {
        return nodes;
    }

    public Optional<RetryPolicy> getDefaultRetryPolicy() {
        return Optional.ofNullable(defaultRetryPolicy);
    }

    public boolean isParallelExecution() {
        return parallelExecution;
    }

    public int getEstimatedMinutesPerModule() {
        return estimatedMinutesPerModule;
    }

    public boolean isBuiltIn() {
        return builtIn;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowTemplate that = (WorkflowTemplate) o;
        return parallelExecution == that.parallelExecution &&
               estimatedMinutesPerModule == that.estimatedMinutesPerModule &&
               builtIn == that.builtIn &&
               id.equals(that.id) &&
               name.equals(that.name) &&
               description.equals(that.description) &&
               Objects.equals(icon, that.icon) &&
               moduleScope == that.moduleScope &&
               nodes.equals(that.nodes) &&
               Objects.equals(defaultRetryPolicy, that.defaultRetryPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, moduleScope, nodes, defaultRetryPolicy, parallelExecution);
    }

    @Override
    public String toString() {
        return "WorkflowTemplate{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", moduleScope=" + moduleScope +
               ", nodes=" + nodes.size() +
               ", builtIn=" + builtIn +
               '}';
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String icon;
        private ModuleScope moduleScope = ModuleScope.SINGLE;
        private final List<DagNode> nodes = new ArrayList<>();
        private RetryPolicy defaultRetryPolicy;
        private boolean parallelExecution;
        private int estimatedMinutesPerModule;
        private boolean builtIn;
        private Instant createdAt;

        private Builder(String id) {
            Objects.requireNonNull(id, "Template id cannot be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Template id cannot be blank");
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

        public Builder icon(String icon) {
            this.icon = icon;
            return this;
        }

        public Builder moduleScope(ModuleScope moduleScope) {
            this.moduleScope = Objects.requireNonNull(moduleScope, "Module scope cannot be null");
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

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder parallelExecution(boolean parallelExecution) {
            this.parallelExecution = parallelExecution;
            return this;
        }

        public Builder estimatedMinutesPerModule(int estimatedMinutesPerModule) {
            if (estimatedMinutesPerModule < 0) {
                throw new IllegalArgumentException("Estimated minutes cannot be negative: " + estimatedMinutesPerModule);
            }
            this.estimatedMinutesPerModule = estimatedMinutesPerModule;
            return this;
        }

        public Builder builtIn(boolean builtIn) {
            this.builtIn = builtIn;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public WorkflowTemplate build() {
            return new WorkflowTemplate(this);
        }
    }
}
