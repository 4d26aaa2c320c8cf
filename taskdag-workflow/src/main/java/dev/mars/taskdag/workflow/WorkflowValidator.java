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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of workflow definitions.
 *
 * <p>Checks run in a fixed order: duplicate node ids, then references in {@code dependsOn},
 * {@code conditionalNext.onSuccess} and {@code conditionalNext.onFailure} that name no node,
 * then cycles among {@code dependsOn} edges. Validation is pure: the same definition always
 * yields the same errors in the same order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowValidator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowValidator.class);

    /**
     * Validates a workflow definition.
     *
     * @param definition the definition to check
     * @return every problem found; empty when the definition is valid
     */
    public List<ValidationError> validate(WorkflowDefinition definition) {
        List<ValidationError> errors = new ArrayList<>();

        Set<String> ids = checkDuplicateIds(definition, errors);
        checkReferences(definition, ids, errors);

        for (List<String> cycle : DependencyGraph.of(definition).findCycles()) {
            errors.add(DependencyGraph.cycleError(cycle));
        }

        if (!errors.isEmpty()) {
            logger.debug("Workflow '{}' failed validation with {} error(s)", definition.getId(), errors.size());
        }
        return errors;
    }

    /**
     * Validates and throws when anything is wrong.
     *
     * @throws WorkflowValidationException carrying every error found
     */
    public void requireValid(WorkflowDefinition definition) throws WorkflowValidationException {
        List<ValidationError> errors = validate(definition);
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(definition.getId(), errors);
        }
    }

    private Set<String> checkDuplicateIds(WorkflowDefinition definition, List<ValidationError> errors) {
        Map<String, Integer> firstIndex = new LinkedHashMap<>();
        Set<String> reported = new LinkedHashSet<>();
        List<DagNode> nodes = definition.getNodes();

        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getId();
            Integer previous = firstIndex.putIfAbsent(id, i);
            if (previous != null && reported.add(id)) {
                errors.add(new ValidationError(ValidationError.Kind.DUPLICATE_NODE_ID, List.of(id),
                        "nodes[" + i + "].id",
                        "Duplicate node id '" + id + "' (first declared at nodes[" + previous + "])"));
            }
        }
        return firstIndex.keySet();
    }

    private void checkReferences(WorkflowDefinition definition, Set<String> ids, List<ValidationError> errors) {
        for (DagNode node : definition.getNodes()) {
            for (String dependency : node.getDependsOn()) {
                if (!ids.contains(dependency)) {
                    errors.add(unknownReference(node, dependency, "dependsOn"));
                }
            }
            node.getConditionalNext().ifPresent(branch -> {
                for (String target : branch.getOnSuccess()) {
                    if (!ids.contains(target)) {
                        errors.add(unknownReference(node, target, "conditionalNext.onSuccess"));
                    }
                }
                for (String target : branch.getOnFailure()) {
                    if (!ids.contains(target)) {
                        errors.add(unknownReference(node, target, "conditionalNext.onFailure"));
                    }
                }
            });
        }
    }

    private static ValidationError unknownReference(DagNode node, String missing, String field) {
        return new ValidationError(ValidationError.Kind.UNKNOWN_REFERENCE, List.of(node.getId(), missing),
                "nodes." + node.getId() + "." + field,
                "Node '" + node.getId() + "' references unknown node '" + missing + "' in " + field);
    }
}
