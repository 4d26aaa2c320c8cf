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

import dev.mars.taskdag.workflow.ConditionalBranch;
import dev.mars.taskdag.workflow.DagNode;
import dev.mars.taskdag.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns a {@link WorkflowTemplate} into a concrete {@link WorkflowDefinition} for one or more modules.
 *
 * <p>Node ids are prefixed with {@code <module>::} and every dependency or branch reference is
 * rewritten the same way, so a multi-module hydration holds one independent copy of the template
 * DAG per module. A template node whose {@code moduleId} is {@value WorkflowTemplate#MODULE_PLACEHOLDER}
 * is bound to the target module.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateHydrator {

    private static final Logger logger = LoggerFactory.getLogger(TemplateHydrator.class);

    static final String NODE_ID_SEPARATOR = "::";

    private final Clock clock;

    public TemplateHydrator() {
        this(Clock.systemUTC());
    }

    public TemplateHydrator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public WorkflowDefinition hydrate(WorkflowTemplate template, List<String> moduleIds) {
        Objects.requireNonNull(template, "Template cannot be null");
        if (moduleIds == null || moduleIds.isEmpty()) {
            throw new IllegalArgumentException("At least one module id is required to hydrate template " + template.getId());
        }

        boolean multi = moduleIds.size() > 1;
        List<DagNode> nodes = new ArrayList<>();
        for (String moduleId : moduleIds) {
            for (DagNode node : template.getNodes()) {
                nodes.add(hydrateNode(template, node, moduleId, multi));
            }
        }

        String id;
        String name;
        if (multi) {
            id = template.getId() + "--multi-" + clock.millis();
            name = template.getName() + ": " + moduleIds.size() + " modules";
        } else {
            id = template.getId() + "--" + moduleIds.get(0);
            name = template.getName() + ": " + moduleIds.get(0);
        }

        WorkflowDefinition definition = WorkflowDefinition.builder(id)
                .name(name)
                .description(template.getDescription())
                .nodes(nodes)
                .moduleIds(moduleIds)
                .estimatedMinutes(template.getEstimatedMinutesPerModule() * moduleIds.size())
                .createdAt(clock.instant())
                .build();

        logger.debug("Hydrated template '{}' into workflow '{}' with {} node(s)",
                template.getId(), id, nodes.size());
        return definition;
    }

    private DagNode hydrateNode(WorkflowTemplate template, DagNode node, String moduleId, boolean multi) {
        DagNode.Builder builder = node.toBuilder(scoped(moduleId, node.getId()))
                .dependsOn(scopedAll(moduleId, node.getDependsOn()));

        if (WorkflowTemplate.MODULE_PLACEHOLDER.equals(node.getModuleId())) {
            builder.moduleId(moduleId);
        }

        node.getConditionalNext().ifPresent(branch -> builder.conditionalNext(new ConditionalBranch(
                scopedAll(moduleId, branch.getOnSuccess()),
                scopedAll(moduleId, branch.getOnFailure()))));

        if (multi) {
            builder.parallelGroup(node.getParallelGroup()
                    .map(group -> scoped(moduleId, group))
                    .orElse(moduleId));
        }

        if (node.getRetryPolicy().isEmpty()) {
            template.getDefaultRetryPolicy().ifPresent(builder::retryPolicy);
        }
        return builder.build();
    }

    private static String scoped(String moduleId, String id) {
        return moduleId + NODE_ID_SEPARATOR + id;
    }

    private static List<String> scopedAll(String moduleId, List<String> ids) {
        return ids.stream().map(id -> scoped(moduleId, id)).collect(Collectors.toList());
    }
}
