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

import dev.mars.taskdag.core.exceptions.InvalidTransitionException;
import dev.mars.taskdag.workflow.ExecutionState.NodeRuntime;
import dev.mars.taskdag.workflow.event.EventChannel;
import dev.mars.taskdag.workflow.event.OrchestratorEvent;
import dev.mars.taskdag.workflow.event.OrchestratorListener;
import dev.mars.taskdag.workflow.event.Subscription;
import dev.mars.taskdag.workflow.schedule.ExecutorRetryScheduler;
import dev.mars.taskdag.workflow.schedule.RetryScheduler;
import dev.mars.taskdag.workflow.schedule.ScheduledRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one execution of a {@link WorkflowDefinition}.
 *
 * <p>The orchestrator never runs task work. It announces nodes whose dependencies are satisfied
 * through {@code node:ready}, and an external runner reports back through
 * {@link #markNodeRunning(String, String)} and {@link #markNodeCompleted(String, boolean, String)}.
 * After every state change (start, completion report, retry coming due, resume) a readiness pass
 * releases what can run, skips what never will, and decides whether the run is over.</p>
 *
 * <p><strong>Readiness rules:</strong></p>
 * <ul>
 * <li>A pending node is ready when every {@code dependsOn} node completed successfully.</li>
 * <li>A node named in another node's {@code conditionalNext} is a branch target. It runs only
 * when one of its routers selects it, regardless of {@code dependsOn}, and is skipped once all of
 * its routers have finished without selecting it.</li>
 * <li>A pending node with a failed or skipped dependency is skipped. Skips cascade within the
 * same pass.</li>
 * </ul>
 *
 * <p>A run completes when nothing is queued, running or waiting on a retry. It fails if some node
 * failed for good without an {@code onFailure} route; otherwise it completes.</p>
 *
 * <p>All public methods are synchronized on the instance, so retry timers and caller commands are
 * applied one at a time. Listeners run on the thread that caused the event and may call back
 * into the orchestrator; their events are delivered after the current one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TaskDagOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TaskDagOrchestrator.class);
    private static final WorkflowValidator VALIDATOR = new WorkflowValidator();

    static final String REASON_DEPENDENCY_FAILED = "Dependency failed";
    static final String REASON_BRANCH_NOT_TAKEN = "Branch not taken";
    static final String REASON_CANCELLED = "Workflow cancelled";
    static final String REASON_UNREACHABLE = "No route can release this node";

    private final WorkflowDefinition workflow;
    private final String executionId;
    private final Clock clock;
    private final RetryPolicy defaultRetryPolicy;
    private final boolean ownsScheduler;
    private final ExecutionState state;
    private final EventChannel events = new EventChannel();

    private final Set<String> unlocked = new HashSet<>();
    private final Set<String> dueRetries = new HashSet<>();
    private final Map<String, PendingRetry> pendingRetries = new LinkedHashMap<>();
    private final List<CompletionReport> bufferedReports = new ArrayList<>();

    private RetryScheduler retryScheduler;
    private long passSequence;
    private long retryGeneration;
    private boolean terminalPublished;

    public TaskDagOrchestrator(WorkflowDefinition workflow, String executionId)
            throws WorkflowValidationException {
        this(workflow, executionId, OrchestratorOptions.defaults());
    }

    /**
     * Creates the orchestrator for one execution. The execution starts in {@code IDLE}.
     *
     * @throws WorkflowValidationException if the definition has duplicate ids, dangling references
     *                                     or a dependency cycle
     */
    public TaskDagOrchestrator(WorkflowDefinition workflow, String executionId, OrchestratorOptions options)
            throws WorkflowValidationException {
        this.workflow = Objects.requireNonNull(workflow, "Workflow definition cannot be null");
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        VALIDATOR.requireValid(workflow);

        this.clock = options.getClock();
        this.defaultRetryPolicy = options.getDefaultRetryPolicy();
        this.retryScheduler = options.getRetryScheduler().orElse(null);
        this.ownsScheduler = this.retryScheduler == null;
        this.state = new ExecutionState(executionId, workflow);

        logger.debug("Created execution {} for workflow '{}' ({} nodes)",
                executionId, workflow.getId(), workflow.getNodes().size());
    }

    // ========== Queries ==========

    public String getExecutionId() {
        return executionId;
    }

    public WorkflowDefinition getWorkflow() {
        return workflow;
    }

    /**
     * Returns an immutable snapshot of the execution.
     */
    public synchronized WorkflowExecution getExecution() {
        return state.snapshot();
    }

    public Optional<DagNode> getNode(String nodeId) {
        return workflow.getNode(nodeId);
    }

    /**
     * Registers a listener for every subsequent event of this execution.
     */
    public Subscription on(OrchestratorListener listener) {
        return events.subscribe(listener);
    }

    // ========== Run lifecycle ==========

    /**
     * Starts the run and announces every node whose dependencies are already satisfied.
     * Ignored unless the execution is {@code IDLE}.
     */
    public synchronized void start() {
        if (state.getStatus() != WorkflowStatus.IDLE) {
            logger.warn("Ignoring start of execution {}: status is {}", executionId, state.getStatus());
            return;
        }
        state.start(clock.instant());
        logger.info("Started execution {} of workflow '{}' with {} node(s)",
                executionId, workflow.getId(), workflow.getNodes().size());

        List<OrchestratorEvent> out = new ArrayList<>();
        advance(out);
        settle(out);
        events.publishAll(out);
    }

    /**
     * Pauses a running execution. Readiness passes stop, retry timers are frozen with their
     * remaining delay, and completion reports for running nodes are buffered until
     * {@link #resume()}.
     */
    public synchronized void pause() {
        if (state.getStatus() != WorkflowStatus.RUNNING) {
            logger.warn("Ignoring pause of execution {}: status is {}", executionId, state.getStatus());
            return;
        }
        state.transitionTo(WorkflowStatus.PAUSED);

        Instant now = clock.instant();
        for (PendingRetry retry : pendingRetries.values()) {
            retry.freeze(now);
            retry.generation = ++retryGeneration;
        }
        logger.info("Paused execution {} ({} retry timer(s) frozen)", executionId, pendingRetries.size());

        List<OrchestratorEvent> out = new ArrayList<>();
        settle(out);
        events.publishAll(out);
    }

    /**
     * Resumes a paused execution: buffered reports are applied in arrival order, frozen retry
     * timers are re-armed with their remaining delay, then readiness is recomputed.
     */
    public synchronized void resume() {
        if (state.getStatus() != WorkflowStatus.PAUSED) {
            logger.warn("Ignoring resume of execution {}: status is {}", executionId, state.getStatus());
            return;
        }
        state.transitionTo(WorkflowStatus.RUNNING);
        List<OrchestratorEvent> out = new ArrayList<>();

        List<CompletionReport> replay = new ArrayList<>(bufferedReports);
        bufferedReports.clear();
        for (CompletionReport report : replay) {
            NodeRuntime node = state.node(report.nodeId());
            if (node.getStatus() != NodeStatus.RUNNING) {
                logger.debug("Dropping buffered report for node {} in status {}", node.getId(), node.getStatus());
                continue;
            }
            applyCompletion(node, report.success(), report.error(), out);
        }

        for (Map.Entry<String, PendingRetry> entry : new ArrayList<>(pendingRetries.entrySet())) {
            PendingRetry retry = entry.getValue();
            if (!retry.frozen) {
                continue;
            }
            if (retry.remaining.isZero()) {
                pendingRetries.remove(entry.getKey());
                dueRetries.add(entry.getKey());
            } else {
                armRetry(entry.getKey(), retry.remaining);
            }
        }
        logger.info("Resumed execution {} ({} buffered report(s) applied)", executionId, replay.size());

        advance(out);
        settle(out);
        events.publishAll(out);
    }

    /**
     * Cancels the run. Pending, queued and retrying nodes are skipped and retry timers are
     * cancelled; running nodes are left alone and their later reports are ignored. Terminal and
     * irreversible.
     */
    public synchronized void cancel() {
        if (state.getStatus().isTerminal()) {
            logger.warn("Ignoring cancel of execution {}: status is {}", executionId, state.getStatus());
            return;
        }
        for (PendingRetry retry : pendingRetries.values()) {
            retry.cancel();
        }
        pendingRetries.clear();
        dueRetries.clear();
        unlocked.clear();
        if (!bufferedReports.isEmpty()) {
            logger.debug("Discarding {} buffered report(s) of cancelled execution {}",
                    bufferedReports.size(), executionId);
            bufferedReports.clear();
        }

        Instant now = clock.instant();
        List<OrchestratorEvent> out = new ArrayList<>();
        for (NodeRuntime node : state.nodes()) {
            NodeStatus status = node.getStatus();
            if (status == NodeStatus.PENDING || status == NodeStatus.QUEUED || status == NodeStatus.RETRYING) {
                skip(node, REASON_CANCELLED, now, out);
            }
        }
        state.finish(WorkflowStatus.CANCELLED, now);
        logger.info("Cancelled execution {} of workflow '{}'", executionId, workflow.getId());

        settle(out);
        releaseScheduler();
        events.publishAll(out);
    }

    // ========== Runner reports ==========

    /**
     * Records that the runner started a session for a queued node. Repeating the call for a node
     * already running under the same handle has no effect.
     *
     * @throws UnknownNodeException       if the node is not part of the workflow
     * @throws InvalidTransitionException if the node is not queued
     */
    public synchronized void markNodeRunning(String nodeId, String sessionHandle)
            throws UnknownNodeException, InvalidTransitionException {
        NodeRuntime node = requireNode(nodeId);
        if (state.getStatus() == WorkflowStatus.CANCELLED) {
            logger.debug("Ignoring running report for node {} of cancelled execution {}", nodeId, executionId);
            return;
        }
        if (node.getStatus() == NodeStatus.RUNNING && Objects.equals(node.getSessionHandle(), sessionHandle)) {
            logger.debug("Duplicate running report for node {} (session {})", nodeId, sessionHandle);
            return;
        }
        requireTransition(node, NodeStatus.RUNNING);

        node.markRunning(sessionHandle, clock.instant());
        logger.debug("Node {} running in execution {} (session {})", nodeId, executionId, sessionHandle);

        List<OrchestratorEvent> out = new ArrayList<>();
        settle(out);
        events.publishAll(out);
    }

    public void markNodeCompleted(String nodeId, boolean success)
            throws UnknownNodeException, InvalidTransitionException {
        markNodeCompleted(nodeId, success, null);
    }

    /**
     * Records the outcome of a running node. A failure is retried while the node's retry policy
     * allows, then routed through {@code onFailure}. Reports for nodes that already reached a
     * terminal status, and any report after cancellation, are ignored. While paused the report is
     * buffered and applied on resume.
     *
     * @param error failure message kept in the node state; ignored on success
     * @throws UnknownNodeException       if the node is not part of the workflow
     * @throws InvalidTransitionException if the node is neither running nor terminal
     */
    public synchronized void markNodeCompleted(String nodeId, boolean success, String error)
            throws UnknownNodeException, InvalidTransitionException {
        NodeRuntime node = requireNode(nodeId);
        if (state.getStatus() == WorkflowStatus.CANCELLED) {
            logger.debug("Ignoring completion of node {} in cancelled execution {}", nodeId, executionId);
            return;
        }
        if (node.getStatus().isTerminal()) {
            logger.debug("Ignoring duplicate completion of node {} (already {})", nodeId, node.getStatus());
            return;
        }
        requireTransition(node, success ? NodeStatus.COMPLETED : NodeStatus.FAILED);

        if (state.getStatus() == WorkflowStatus.PAUSED) {
            bufferedReports.add(new CompletionReport(nodeId, success, error));
            logger.debug("Buffered completion of node {} while execution {} is paused", nodeId, executionId);
            return;
        }

        List<OrchestratorEvent> out = new ArrayList<>();
        applyCompletion(node, success, error, out);
        advance(out);
        settle(out);
        events.publishAll(out);
    }

    // ========== Internals ==========

    private void applyCompletion(NodeRuntime node, boolean success, String error, List<OrchestratorEvent> out) {
        Instant now = clock.instant();
        DagNode definition = node.getNode();

        if (success) {
            node.complete(now);
            logger.debug("Node {} completed in execution {}", node.getId(), executionId);
            definition.getConditionalNext().ifPresent(branch -> unlock(node.getId(), branch.getOnSuccess()));
            return;
        }

        String failure = error != null && !error.isBlank() ? error : null;
        RetryPolicy policy = definition.getRetryPolicy().orElse(defaultRetryPolicy);
        if (policy.allowsRetry(node.getRetryCount())) {
            int retry = node.beginRetry(failure);
            Duration delay = policy.delayFor(retry);
            logger.info("Node {} failed in execution {}; retry {}/{} in {} ms",
                    node.getId(), executionId, retry, policy.getMaxRetries(), delay.toMillis());
            out.add(new OrchestratorEvent.NodeRetry(executionId, node.getId(), retry, delay.toMillis()));
            armRetry(node.getId(), delay);
            return;
        }

        List<String> route = definition.getConditionalNext()
                .map(ConditionalBranch::getOnFailure)
                .orElse(List.of());
        if (failure == null) {
            failure = node.getRetryCount() > 0
                    ? "Failed after " + node.getRetryCount() + " retries"
                    : "Task failed";
        }
        node.fail(now, failure, !route.isEmpty());
        logger.info("Node {} failed in execution {}: {}{}", node.getId(), executionId, failure,
                route.isEmpty() ? "" : " (routing to " + route + ")");
        unlock(node.getId(), route);
    }

    private void unlock(String routerId, List<String> targets) {
        for (String target : targets) {
            NodeRuntime node = state.node(target);
            if (node.getStatus() == NodeStatus.PENDING) {
                unlocked.add(target);
                logger.debug("Node {} unlocked by {}", target, routerId);
            } else {
                logger.debug("Route {} -> {} ignored: target is {}", routerId, target, node.getStatus());
            }
        }
    }

    /**
     * One readiness pass: releases every node that can run, skips every node that never will,
     * and repeats until nothing changes so skips cascade.
     */
    private void advance(List<OrchestratorEvent> out) {
        if (state.getStatus() != WorkflowStatus.RUNNING) {
            return;
        }
        long pass = ++passSequence;
        Instant now = clock.instant();
        List<NodeRuntime> released = new ArrayList<>();

        boolean changed;
        do {
            changed = false;
            for (NodeRuntime node : state.nodes()) {
                if (node.getStatus() == NodeStatus.RETRYING && dueRetries.remove(node.getId())) {
                    node.queue();
                    released.add(node);
                    continue;
                }
                if (node.getStatus() != NodeStatus.PENDING) {
                    continue;
                }
                switch (readinessOf(node)) {
                    case READY -> {
                        node.queue();
                        released.add(node);
                    }
                    case BRANCH_NOT_TAKEN -> {
                        skip(node, REASON_BRANCH_NOT_TAKEN, now, out);
                        changed = true;
                    }
                    case DEPENDENCY_FAILED -> {
                        skip(node, REASON_DEPENDENCY_FAILED, now, out);
                        changed = true;
                    }
                    case WAITING -> {
                    }
                }
            }
        } while (changed);

        released.sort(Comparator.comparingInt(NodeRuntime::getIndex));
        for (NodeRuntime node : released) {
            unlocked.remove(node.getId());
            out.add(new OrchestratorEvent.NodeReady(executionId, node.getId(), node.getNode(), pass));
        }
        if (!released.isEmpty()) {
            logger.debug("Pass {} of execution {} released {}", pass, executionId,
                    released.stream().map(NodeRuntime::getId).toList());
        }
    }

    private Readiness readinessOf(NodeRuntime node) {
        if (unlocked.contains(node.getId())) {
            return Readiness.READY;
        }

        boolean satisfied = true;
        for (String dependency : node.getNode().getDependsOn()) {
            NodeRuntime upstream = state.node(dependency);
            if (routedAway(upstream, node.getId())) {
                return Readiness.BRANCH_NOT_TAKEN;
            }
            NodeStatus status = upstream.getStatus();
            if (status == NodeStatus.FAILED || status == NodeStatus.SKIPPED) {
                return Readiness.DEPENDENCY_FAILED;
            }
            if (status != NodeStatus.COMPLETED) {
                satisfied = false;
            }
        }
        return satisfied ? Readiness.READY : Readiness.WAITING;
    }

    /**
     * True when {@code upstream} has finished and the route for its outcome names other nodes
     * but not {@code nodeId}. An empty route leaves plain dependency rules in charge.
     */
    private static boolean routedAway(NodeRuntime upstream, String nodeId) {
        Optional<ConditionalBranch> branch = upstream.getNode().getConditionalNext();
        if (branch.isEmpty()) {
            return false;
        }
        List<String> route = switch (upstream.getStatus()) {
            case COMPLETED -> branch.get().getOnSuccess();
            case FAILED -> branch.get().getOnFailure();
            default -> List.of();
        };
        return !route.isEmpty() && !route.contains(nodeId);
    }

    private void skip(NodeRuntime node, String reason, Instant now, List<OrchestratorEvent> out) {
        node.skip(now);
        logger.debug("Node {} skipped in execution {}: {}", node.getId(), executionId, reason);
        out.add(new OrchestratorEvent.NodeSkipped(executionId, node.getId(), reason));
    }

    /**
     * Appends the progress snapshot and, when nothing can move any more, finishes the run.
     */
    private void settle(List<OrchestratorEvent> out) {
        if (terminalPublished) {
            return;
        }
        if (state.getStatus() == WorkflowStatus.RUNNING && !state.hasActiveNodes()) {
            Instant now = clock.instant();
            for (NodeRuntime node : state.nodes()) {
                if (node.getStatus() == NodeStatus.PENDING) {
                    skip(node, REASON_UNREACHABLE, now, out);
                }
            }
            WorkflowStatus outcome = state.hasUnroutedFailure() ? WorkflowStatus.FAILED : WorkflowStatus.COMPLETED;
            state.finish(outcome, now);

            WorkflowExecution snapshot = state.snapshot();
            out.add(new OrchestratorEvent.WorkflowProgress(snapshot));
            out.add(outcome == WorkflowStatus.COMPLETED
                    ? new OrchestratorEvent.WorkflowCompleted(snapshot)
                    : new OrchestratorEvent.WorkflowFailed(snapshot));
            terminalPublished = true;

            logger.info("Execution {} of workflow '{}' {}: {}", executionId, workflow.getId(), outcome,
                    snapshot.getCurrentStepLabel());
            releaseScheduler();
            return;
        }

        out.add(new OrchestratorEvent.WorkflowProgress(state.snapshot()));
        if (state.getStatus().isTerminal()) {
            terminalPublished = true;
        }
    }

    private void armRetry(String nodeId, Duration delay) {
        PendingRetry retry = new PendingRetry(++retryGeneration, clock.instant().plus(delay));
        pendingRetries.put(nodeId, retry);
        long generation = retry.generation;
        retry.handle = scheduler().schedule(delay, () -> onRetryDue(nodeId, generation));
    }

    private synchronized void onRetryDue(String nodeId, long generation) {
        PendingRetry retry = pendingRetries.get(nodeId);
        if (retry == null || retry.generation != generation) {
            return;
        }
        pendingRetries.remove(nodeId);
        if (state.getStatus() != WorkflowStatus.RUNNING || state.node(nodeId).getStatus() != NodeStatus.RETRYING) {
            logger.debug("Dropping retry of node {}: execution {} is {}", nodeId, executionId, state.getStatus());
            return;
        }
        logger.debug("Retry of node {} due in execution {}", nodeId, executionId);
        dueRetries.add(nodeId);

        List<OrchestratorEvent> out = new ArrayList<>();
        advance(out);
        settle(out);
        events.publishAll(out);
    }

    private RetryScheduler scheduler() {
        if (retryScheduler == null) {
            retryScheduler = new ExecutorRetryScheduler();
        }
        return retryScheduler;
    }

    private void releaseScheduler() {
        if (ownsScheduler && retryScheduler != null) {
            retryScheduler.shutdown();
            retryScheduler = null;
        }
    }

    private NodeRuntime requireNode(String nodeId) throws UnknownNodeException {
        NodeRuntime node = nodeId != null ? state.node(nodeId) : null;
        if (node == null) {
            throw new UnknownNodeException(executionId, nodeId);
        }
        return node;
    }

    private static void requireTransition(NodeRuntime node, NodeStatus target) throws InvalidTransitionException {
        NodeStatus current = node.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(node.getId(), current, target,
                    current.getValidTransitions().toArray(new NodeStatus[0]));
        }
    }

    @Override
    public String toString() {
        return "TaskDagOrchestrator{" +
               "executionId='" + executionId + '\'' +
               ", workflowId='" + workflow.getId() + '\'' +
               '}';
    }

    private enum Readiness {
        READY,
        WAITING,
        DEPENDENCY_FAILED,
        BRANCH_NOT_TAKEN
    }

    private record CompletionReport(String nodeId, boolean success, String error) {
    }

    private static final class PendingRetry {
        private long generation;
        private final Instant dueAt;
        private ScheduledRetry handle;
        private boolean frozen;
        private Duration remaining = Duration.ZERO;

        private PendingRetry(long generation, Instant dueAt) {
            this.generation = generation;
            this.dueAt = dueAt;
        }

        void freeze(Instant now) {
            cancel();
            Duration left = Duration.between(now, dueAt);
            remaining = left.isNegative() ? Duration.ZERO : left;
            frozen = true;
        }

        void cancel() {
            if (handle != null) {
                handle.cancel();
                handle = null;
            }
        }
    }
}
