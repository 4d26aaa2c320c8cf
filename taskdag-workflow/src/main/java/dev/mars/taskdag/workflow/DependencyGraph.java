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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Represents the {@code dependsOn} graph of a workflow's nodes.
 * Provides stable topological sorting, execution batches and cycle detection.
 *
 * <p>Only edges between known nodes are part of the graph; dangling references are reported by
 * {@link WorkflowValidator}, not here. Every ordering this class produces follows definition order
 * wherever the dependencies leave a choice.</p>
 */
public class DependencyGraph {

    private final String workflowId;
    private final Map<String, DagNode> nodes;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;

    public DependencyGraph(List<DagNode> definitionNodes) {
        this("anonymous", definitionNodes);
    }

    public DependencyGraph(String workflowId, List<DagNode> definitionNodes) {
        Objects.requireNonNull(definitionNodes, "Nodes cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow id cannot be null");
        this.nodes = new LinkedHashMap<>();
        for (DagNode node : definitionNodes) {
            nodes.putIfAbsent(node.getId(), node);
        }

        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            dependents.put(id, new ArrayList<>());
        }
        for (DagNode node : nodes.values()) {
            List<String> known = new ArrayList<>();
            for (String dependency : node.getDependsOn()) {
                if (nodes.containsKey(dependency)) {
                    known.add(dependency);
                    dependents.get(dependency).add(node.getId());
                }
            }
            dependencies.put(node.getId(), Collections.unmodifiableList(known));
        }
        dependents.replaceAll((k, v) -> Collections.unmodifiableList(v));
    }

    public static DependencyGraph of(WorkflowDefinition definition) {
        return new DependencyGraph(definition.getId(), definition.getNodes());
    }

    /**
     * Gets the known dependencies of a node.
     *
     * @param nodeId the node id
     * @return dependency ids in declaration order, empty for unknown nodes
     */
    public List<String> getDependencies(String nodeId) {
        return dependencies.getOrDefault(nodeId, List.of());
    }

    /**
     * Gets the nodes that depend directly on the given node, in definition order.
     */
    public List<String> getDependents(String nodeId) {
        return dependents.getOrDefault(nodeId, List.of());
    }

    /**
     * Performs a stable topological sort.
     *
     * @return node ids with every dependency before its dependents; ties keep definition order
     * @throws WorkflowValidationException if the graph contains a cycle
     */
    public List<String> topologicalSort() throws WorkflowValidationException {
        // Kahn's algorithm, seeded and expanded in definition order
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>();
        List<String> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);

            for (String dependent : getDependents(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != nodes.size()) {
            throw cycleException();
        }

        return result;
    }

    /**
     * Groups nodes into levels: every node's dependencies sit in earlier batches.
     *
     * @return batches of node ids, each in definition order
     * @throws WorkflowValidationException if the graph contains a cycle
     */
    public List<List<String>> getExecutionBatches() throws WorkflowValidationException {
        List<List<String>> batches = new ArrayList<>();
        Map<String, Integer> inDegree = calculateInDegree();
        Set<String> processed = new HashSet<>();

        while (processed.size() < nodes.size()) {
            List<String> currentBatch = new ArrayList<>();

            for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
                if (entry.getValue() == 0 && !processed.contains(entry.getKey())) {
                    currentBatch.add(entry.getKey());
                }
            }

            if (currentBatch.isEmpty()) {
                throw cycleException();
            }

            processed.addAll(currentBatch);
            batches.add(List.copyOf(currentBatch));

            for (String nodeId : currentBatch) {
                for (String dependent : getDependents(nodeId)) {
                    inDegree.merge(dependent, -1, Integer::sum);
                }
            }
        }

        return batches;
    }

    /**
     * Finds the cycles among {@code dependsOn} edges using depth-first back-edge detection.
     * A node that depends on itself is a cycle of one.
     *
     * @return each distinct cycle once, as node ids in path order
     */
    public List<List<String>> findCycles() {
        Map<String, VisitState> visitStates = new HashMap<>();
        List<String> path = new ArrayList<>();
        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();

        for (String nodeId : nodes.keySet()) {
            if (!visitStates.containsKey(nodeId)) {
                visit(nodeId, visitStates, path, cycles, seen);
            }
        }
        return cycles;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    private void visit(String nodeId, Map<String, VisitState> visitStates, List<String> path,
                       List<List<String>> cycles, Set<Set<String>> seen) {
        visitStates.put(nodeId, VisitState.IN_PROGRESS);
        path.add(nodeId);

        for (String dependency : getDependencies(nodeId)) {
            VisitState state = visitStates.get(dependency);
            if (state == null) {
                visit(dependency, visitStates, path, cycles, seen);
            } else if (state == VisitState.IN_PROGRESS) {
                List<String> cycle = List.copyOf(path.subList(path.indexOf(dependency), path.size()));
                if (seen.add(new TreeSet<>(cycle))) {
                    cycles.add(cycle);
                }
            }
        }

        path.remove(path.size() - 1);
        visitStates.put(nodeId, VisitState.DONE);
    }

    private WorkflowValidationException cycleException() {
        List<ValidationError> errors = new ArrayList<>();
        for (List<String> cycle : findCycles()) {
            errors.add(cycleError(cycle));
        }
        return new WorkflowValidationException(workflowId, errors);
    }

    static ValidationError cycleError(List<String> cycle) {
        String joined = String.join(" -> ", cycle) + " -> " + cycle.get(0);
        return new ValidationError(ValidationError.Kind.CYCLE, cycle,
                "nodes." + cycle.get(0) + ".dependsOn",
                "Circular dependency detected: " + joined);
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
        }
        return inDegree;
    }

    private enum VisitState {
        IN_PROGRESS,
        DONE
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "nodes=" + nodes.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
