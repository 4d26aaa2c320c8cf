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
import dev.mars.taskdag.workflow.event.EventType;
import dev.mars.taskdag.workflow.event.OrchestratorEvent;
import dev.mars.taskdag.workflow.event.OrchestratorEvent.NodeReady;
import dev.mars.taskdag.workflow.event.OrchestratorEvent.NodeRetry;
import dev.mars.taskdag.workflow.event.OrchestratorEvent.NodeSkipped;
import dev.mars.taskdag.workflow.event.OrchestratorEvent.WorkflowProgress;
import dev.mars.taskdag.workflow.event.Subscription;
import dev.mars.taskdag.workflow.schedule.ManualRetryScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Behavioural tests for {@link TaskDagOrchestrator}, driven by a manual retry scheduler so that
 * every retry timer fires exactly when the test advances virtual time.
 */
@DisplayName("TaskDagOrchestrator")
class TaskDagOrchestratorTest {

    private ManualRetryScheduler scheduler;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        scheduler = new ManualRetryScheduler();
        listener = new RecordingListener();
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects a cyclic definition naming both nodes before anything runs")
        void rejectsCycle() {
            WorkflowDefinition definition = workflow(
                    node("A").dependsOn("B").build(),
                    node("B").dependsOn("A").build());

            assertThatThrownBy(() -> orchestrator(definition))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("A")
                    .hasMessageContaining("B")
                    .satisfies(e -> assertThat(((WorkflowValidationException) e).getErrors())
                            .extracting(ValidationError::getKind)
                            .containsExactly(ValidationError.Kind.CYCLE));
        }

        @Test
        @DisplayName("starts idle with every node pending and emits nothing")
        void idleUntilStarted() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());

            WorkflowExecution execution = orchestrator.getExecution();

            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.IDLE);
            assertThat(execution.getTotalNodes()).isEqualTo(4);
            assertThat(execution.getNodeStates().keySet()).containsExactly("A", "B", "C", "D");
            assertThat(execution.getNodeStates().values())
                    .extracting(DagNodeState::getStatus)
                    .containsOnly(NodeStatus.PENDING);
            assertThat(execution.getCurrentStepLabel()).isEqualTo("Not started");
            assertThat(listener.events()).isEmpty();
        }

        @Test
        @DisplayName("exposes definition nodes by id")
        void nodeLookup() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());

            assertThat(orchestrator.getNode("B").map(DagNode::getLabel)).contains("Step B");
            assertThat(orchestrator.getNode("Z")).isEmpty();
        }
    }

    @Nested
    @DisplayName("readiness")
    class Readiness {

        @Test
        @DisplayName("start announces each root exactly once, in definition order")
        void rootsReadyOnStart() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").build(),
                    node("C").dependsOn("A").build(),
                    node("B").build()));

            orchestrator.start();

            assertThat(listener.readyNodeIds()).containsExactly("A", "B");
            assertThat(listener.types()).containsExactly(
                    EventType.NODE_READY, EventType.NODE_READY, EventType.WORKFLOW_PROGRESS);
            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.QUEUED);
            assertThat(status(orchestrator, "C")).isEqualTo(NodeStatus.PENDING);
        }

        @Test
        @DisplayName("runs the A, B/C, D diamond to completion")
        void diamondScenario() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());

            orchestrator.start();
            assertThat(listener.readyNodeIds()).containsExactly("A");

            succeed(orchestrator, "A");
            assertThat(listener.readyNodeIds()).containsExactly("A", "B", "C");
            List<NodeReady> ready = listener.eventsOf(NodeReady.class);
            assertThat(ready.get(1).pass()).isEqualTo(ready.get(2).pass()).isGreaterThan(ready.get(0).pass());

            succeed(orchestrator, "B");
            assertThat(listener.readyNodeIds()).containsExactly("A", "B", "C");

            succeed(orchestrator, "C");
            assertThat(listener.readyNodeIds()).containsExactly("A", "B", "C", "D");

            succeed(orchestrator, "D");

            WorkflowExecution execution = orchestrator.getExecution();
            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(execution.getCompletedNodes()).isEqualTo(4);
            assertThat(execution.getFailedNodes()).isZero();
            assertThat(execution.getCompletedAt()).isPresent();
            assertThat(execution.getCurrentStepLabel()).isEqualTo("All 4 steps completed");
            assertThat(execution.getNodeStates().values())
                    .allSatisfy(state -> assertThat(state.getSuccess()).contains(true));

            List<EventType> types = listener.types();
            assertThat(types.subList(types.size() - 2, types.size()))
                    .containsExactly(EventType.WORKFLOW_PROGRESS, EventType.WORKFLOW_COMPLETED);
            assertThat(listener.eventsOf(OrchestratorEvent.WorkflowCompleted.class)).hasSize(1);
        }

        @Test
        @DisplayName("releases every member of a parallel group in the same pass")
        void parallelGroupSamePass() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("review").build(),
                    node("checklist").dependsOn("review").parallelGroup("verify").build(),
                    node("build").dependsOn("review").parallelGroup("verify").build()));

            orchestrator.start();
            succeed(orchestrator, "review");

            List<NodeReady> ready = listener.eventsOf(NodeReady.class);
            assertThat(ready).extracting(NodeReady::nodeId).containsExactly("review", "checklist", "build");
            assertThat(ready.get(1).pass()).isEqualTo(ready.get(2).pass());
            assertThat(ready.get(1).parallelGroup()).contains("verify");
            assertThat(ready.get(2).parallelGroup()).contains("verify");
        }

        @Test
        @DisplayName("skips the dependents of a failed node, cascading in one pass")
        void dependencyFailureCascades() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("C").dependsOn("B").build(),
                    node("A").build(),
                    node("B").dependsOn("A").build()));

            orchestrator.start();
            reportFailure(orchestrator, "A", "compile error");

            assertThat(listener.eventsOf(NodeSkipped.class))
                    .extracting(NodeSkipped::nodeId, NodeSkipped::reason)
                    .containsExactlyInAnyOrder(
                            tuple("B", TaskDagOrchestrator.REASON_DEPENDENCY_FAILED),
                            tuple("C", TaskDagOrchestrator.REASON_DEPENDENCY_FAILED));

            WorkflowExecution execution = orchestrator.getExecution();
            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(execution.getFailedNodes()).isEqualTo(1);
            assertThat(execution.getSkippedNodes()).isEqualTo(2);
            assertThat(execution.getCompletedNodes()).isZero();
            assertThat(execution.getNodeState("A").flatMap(DagNodeState::getError)).contains("compile error");
            assertThat(execution.getCurrentStepLabel()).isEqualTo("1 failed, 0 completed");
            assertThat(listener.eventsOf(OrchestratorEvent.WorkflowFailed.class)).hasSize(1);
        }

        @Test
        @DisplayName("an empty workflow completes as soon as it starts")
        void emptyWorkflow() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow());

            orchestrator.start();

            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(listener.types()).containsExactly(EventType.WORKFLOW_PROGRESS, EventType.WORKFLOW_COMPLETED);
        }

        @Test
        @DisplayName("a second start is ignored")
        void secondStartIgnored() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            listener.clear();

            orchestrator.start();

            assertThat(listener.events()).isEmpty();
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("three failures with two retries give 100 ms then 200 ms, then the node fails")
        void backoffThenFailure() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("fix").retryPolicy(new RetryPolicy(2, 100, 2.0)).build()));
            orchestrator.start();

            reportFailure(orchestrator, "fix", null);
            assertThat(status(orchestrator, "fix")).isEqualTo(NodeStatus.RETRYING);
            scheduler.advanceBy(Duration.ofMillis(99));
            assertThat(listener.readyNodeIds()).containsExactly("fix");
            scheduler.advanceBy(Duration.ofMillis(1));
            assertThat(listener.readyNodeIds()).containsExactly("fix", "fix");

            reportFailure(orchestrator, "fix", null);
            scheduler.advanceBy(Duration.ofMillis(200));
            assertThat(listener.readyNodeIds()).containsExactly("fix", "fix", "fix");

            reportFailure(orchestrator, "fix", null);

            assertThat(listener.eventsOf(NodeRetry.class))
                    .extracting(NodeRetry::retryCount, NodeRetry::delayMs)
                    .containsExactly(
                            tuple(1, 100L),
                            tuple(2, 200L));
            assertThat(scheduler.requestedDelays()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));

            DagNodeState state = orchestrator.getExecution().getNodeState("fix").orElseThrow();
            assertThat(state.getStatus()).isEqualTo(NodeStatus.FAILED);
            assertThat(state.getRetryCount()).isEqualTo(2);
            assertThat(state.getSuccess()).contains(false);
            assertThat(state.getError()).contains("Failed after 2 retries");
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.FAILED);
        }

        @Test
        @DisplayName("a retried node that then succeeds completes the run")
        void succeedsAfterRetry() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("fix").retryPolicy(new RetryPolicy(1, 50, 2.0)).build(),
                    node("verify").dependsOn("fix").build()));
            orchestrator.start();

            reportFailure(orchestrator, "fix", "flaky");
            assertThat(orchestrator.getExecution().getNodeState("fix").flatMap(DagNodeState::getError))
                    .contains("flaky");
            scheduler.advanceBy(Duration.ofMillis(50));
            succeed(orchestrator, "fix");
            succeed(orchestrator, "verify");

            WorkflowExecution execution = orchestrator.getExecution();
            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(execution.getNodeState("fix").orElseThrow().getRetryCount()).isEqualTo(1);
            assertThat(execution.getNodeState("fix").orElseThrow().getError()).isEmpty();
        }

        @Test
        @DisplayName("nodes without a policy use the configured default")
        void defaultPolicyApplies() throws Exception {
            OrchestratorOptions options = OrchestratorOptions.builder()
                    .retryScheduler(scheduler)
                    .clock(scheduler.clock())
                    .defaultRetryPolicy(new RetryPolicy(1, 3000, 2.0))
                    .build();
            TaskDagOrchestrator orchestrator = new TaskDagOrchestrator(workflow(node("A").build()), "exec-d", options);
            orchestrator.on(listener);
            orchestrator.start();

            reportFailure(orchestrator, "A", null);

            assertThat(listener.eventsOf(NodeRetry.class)).singleElement()
                    .extracting(NodeRetry::delayMs).isEqualTo(3000L);
        }

        @Test
        @DisplayName("a report for a node waiting on its retry timer is rejected")
        void reportWhileRetryingRejected() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").retryPolicy(new RetryPolicy(1, 100, 2.0)).build()));
            orchestrator.start();
            reportFailure(orchestrator, "A", null);

            assertThatThrownBy(() -> orchestrator.markNodeCompleted("A", true))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.RETRYING);
        }
    }

    @Nested
    @DisplayName("conditional routing")
    class Routing {

        @Test
        @DisplayName("onFailure releases a node that does not depend on the failed node")
        void onFailureUnlocks() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").conditionalNext(ConditionalBranch.onFailure("B")).build(),
                    node("C").build(),
                    node("B").dependsOn("C").build()));

            orchestrator.start();
            assertThat(listener.readyNodeIds()).containsExactly("A", "C");

            reportFailure(orchestrator, "A", "tests red");
            assertThat(listener.readyNodeIds()).containsExactly("A", "C", "B");

            succeed(orchestrator, "B");
            succeed(orchestrator, "C");
            WorkflowExecution execution = orchestrator.getExecution();
            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(execution.getFailedNodes()).isEqualTo(1);
            assertThat(execution.getCompletedNodes()).isEqualTo(2);
        }

        @Test
        @DisplayName("success takes onSuccess and skips the failure branch")
        void successBranch() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("review").conditionalNext(new ConditionalBranch(List.of("ship"), List.of("fix"))).build(),
                    node("ship").dependsOn("review").build(),
                    node("fix").dependsOn("review").build()));

            orchestrator.start();
            succeed(orchestrator, "review");

            assertThat(listener.readyNodeIds()).containsExactly("review", "ship");
            assertThat(listener.eventsOf(NodeSkipped.class)).singleElement()
                    .satisfies(skipped -> {
                        assertThat(skipped.nodeId()).isEqualTo("fix");
                        assertThat(skipped.reason()).isEqualTo(TaskDagOrchestrator.REASON_BRANCH_NOT_TAKEN);
                    });

            succeed(orchestrator, "ship");
            WorkflowExecution execution = orchestrator.getExecution();
            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(execution.getCurrentStepLabel()).isEqualTo("2 completed, 1 skipped");
        }

        @Test
        @DisplayName("onSuccess unlocking adds to normal dependency unlocking")
        void routingPlusDependencies() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").conditionalNext(ConditionalBranch.onSuccess("X")).build(),
                    node("D").dependsOn("A").build(),
                    node("X").dependsOn("A").build()));

            orchestrator.start();
            succeed(orchestrator, "A");

            List<NodeReady> ready = listener.eventsOf(NodeReady.class);
            assertThat(ready).extracting(NodeReady::nodeId).containsExactly("A", "D", "X");
            assertThat(ready.get(1).pass()).isEqualTo(ready.get(2).pass());
        }

        @Test
        @DisplayName("a branch target without dependencies is released on start")
        void independentBranchTargetReleasedOnStart() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").conditionalNext(ConditionalBranch.onFailure("E")).build(),
                    node("E").build()));

            orchestrator.start();
            assertThat(listener.readyNodeIds()).containsExactly("A", "E");

            succeed(orchestrator, "A");
            succeed(orchestrator, "E");
            assertThat(listener.eventsOf(NodeSkipped.class)).isEmpty();
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        }

        @Test
        @DisplayName("a dependent branch target waits through retries and is released by the failure route")
        void dependentBranchTargetWaitsForRouter() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("gate").retryPolicy(new RetryPolicy(1, 10, 1.0))
                            .conditionalNext(ConditionalBranch.onFailure("rescue")).build(),
                    node("rescue").dependsOn("gate").build()));

            orchestrator.start();
            reportFailure(orchestrator, "gate", null);
            assertThat(status(orchestrator, "rescue")).isEqualTo(NodeStatus.PENDING);

            scheduler.advanceBy(Duration.ofMillis(10));
            reportFailure(orchestrator, "gate", null);

            assertThat(listener.readyNodeIds()).containsExactly("gate", "gate", "rescue");
        }

        @Test
        @DisplayName("a router with no success route leaves its dependent failure target to plain dependency rules")
        void emptyRouteFallsBackToDependency() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("gate").conditionalNext(ConditionalBranch.onFailure("rescue")).build(),
                    node("rescue").dependsOn("gate").build(),
                    node("audit").build()));

            orchestrator.start();
            assertThat(listener.readyNodeIds()).containsExactly("gate", "audit");

            succeed(orchestrator, "gate");
            assertThat(listener.eventsOf(NodeSkipped.class)).isEmpty();
            assertThat(listener.readyNodeIds()).containsExactly("gate", "audit", "rescue");
        }

        @Test
        @DisplayName("a dependent node outside the chosen route is skipped as branch not taken")
        void dependentNodeOutsideRouteSkipped() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("review").conditionalNext(new ConditionalBranch(List.of("ship"), List.of("fix"))).build(),
                    node("ship").dependsOn("review").build(),
                    node("fix").dependsOn("review").build(),
                    node("notes").dependsOn("review").build()));

            orchestrator.start();
            reportFailure(orchestrator, "review", null);

            assertThat(listener.readyNodeIds()).containsExactly("review", "fix");
            assertThat(listener.eventsOf(NodeSkipped.class))
                    .extracting(NodeSkipped::nodeId, NodeSkipped::reason)
                    .containsExactly(
                            tuple("ship", TaskDagOrchestrator.REASON_BRANCH_NOT_TAKEN),
                            tuple("notes", TaskDagOrchestrator.REASON_BRANCH_NOT_TAKEN));
        }

        @Test
        @DisplayName("an unrouted failure fails the run even when another failure was routed")
        void unroutedFailureEscalates() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").conditionalNext(ConditionalBranch.onFailure("R")).build(),
                    node("B").build(),
                    node("R").build()));

            orchestrator.start();
            reportFailure(orchestrator, "A", null);
            reportFailure(orchestrator, "B", null);
            succeed(orchestrator, "R");

            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("runner reports")
    class Reports {

        @Test
        @DisplayName("completion for a pending node raises InvalidTransitionException and changes nothing")
        void completionBeforeDispatch() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            WorkflowExecution before = orchestrator.getExecution();

            assertThatThrownBy(() -> orchestrator.markNodeCompleted("B", true))
                    .isInstanceOf(InvalidTransitionException.class)
                    .satisfies(e -> {
                        InvalidTransitionException ex = (InvalidTransitionException) e;
                        assertThat(ex.getEntityId()).isEqualTo("B");
                        assertThat(ex.getCurrentState()).isEqualTo(NodeStatus.PENDING);
                        assertThat(ex.getRequestedState()).isEqualTo(NodeStatus.COMPLETED);
                    });
            assertThat(orchestrator.getExecution()).isEqualTo(before);
        }

        @Test
        @DisplayName("running report for a node that was never released is rejected")
        void runningBeforeReady() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();

            assertThatThrownBy(() -> orchestrator.markNodeRunning("D", "s-1"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("unknown node ids raise UnknownNodeException")
        void unknownNode() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();

            assertThatThrownBy(() -> orchestrator.markNodeRunning("Z", "s"))
                    .isInstanceOf(UnknownNodeException.class)
                    .hasMessageContaining("Z");
            assertThatThrownBy(() -> orchestrator.markNodeCompleted("Z", true))
                    .isInstanceOf(UnknownNodeException.class);
        }

        @Test
        @DisplayName("a repeated running report with the same handle is a no-op")
        void duplicateRunning() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            orchestrator.markNodeRunning("A", "session-1");
            listener.clear();

            orchestrator.markNodeRunning("A", "session-1");

            assertThat(listener.events()).isEmpty();
            assertThat(orchestrator.getExecution().getNodeState("A").flatMap(DagNodeState::getSessionHandle))
                    .contains("session-1");
            assertThatThrownBy(() -> orchestrator.markNodeRunning("A", "session-2"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("a late or duplicate completion for a terminal node is ignored")
        void duplicateCompletion() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            succeed(orchestrator, "A");
            listener.clear();
            WorkflowExecution before = orchestrator.getExecution();

            orchestrator.markNodeCompleted("A", true);
            orchestrator.markNodeCompleted("A", false);

            assertThat(listener.events()).isEmpty();
            assertThat(orchestrator.getExecution()).isEqualTo(before);
        }

        @Test
        @DisplayName("step label follows the running nodes")
        void stepLabel() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            orchestrator.markNodeRunning("A", "s-A");
            assertThat(orchestrator.getExecution().getCurrentStepLabel()).isEqualTo("Step 1/4: Step A");
            assertThat(orchestrator.getExecution().getRunningNodeIds()).containsExactly("A");

            orchestrator.markNodeCompleted("A", true);
            assertThat(orchestrator.getExecution().getCurrentStepLabel()).isEqualTo("1/4 completed");

            orchestrator.markNodeRunning("B", "s-B");
            orchestrator.markNodeRunning("C", "s-C");
            assertThat(orchestrator.getExecution().getCurrentStepLabel()).isEqualTo("Step 2/4: 2 tasks in parallel");
        }

        @Test
        @DisplayName("snapshots do not change after they are taken")
        void snapshotsAreImmutable() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            WorkflowExecution snapshot = orchestrator.getExecution();

            succeed(orchestrator, "A");

            assertThat(snapshot.getNodeState("A").map(DagNodeState::getStatus)).contains(NodeStatus.QUEUED);
            assertThatThrownBy(() -> snapshot.getNodeStates().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("pause and resume")
    class PauseResume {

        @Test
        @DisplayName("buffers completion reports while paused and applies them on resume")
        void buffersReports() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            orchestrator.markNodeRunning("A", "s-A");

            orchestrator.pause();
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.PAUSED);
            assertThat(orchestrator.getExecution().getCurrentStepLabel()).isEqualTo("Workflow paused");
            listener.clear();

            orchestrator.markNodeCompleted("A", true);
            assertThat(listener.events()).isEmpty();
            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.RUNNING);

            orchestrator.resume();
            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.COMPLETED);
            assertThat(listener.readyNodeIds()).containsExactly("B", "C");
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        }

        @Test
        @DisplayName("freezes a retry timer and re-arms it with the remaining delay")
        void freezesRetryTimer() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").retryPolicy(new RetryPolicy(1, 100, 1.0)).build()));
            orchestrator.start();
            reportFailure(orchestrator, "A", null);

            scheduler.advanceBy(Duration.ofMillis(40));
            orchestrator.pause();
            assertThat(scheduler.pendingCount()).isZero();

            scheduler.advanceBy(Duration.ofMillis(500));
            assertThat(listener.readyNodeIds()).containsExactly("A");

            orchestrator.resume();
            assertThat(scheduler.nextDelay()).contains(Duration.ofMillis(60));
            scheduler.advanceBy(Duration.ofMillis(59));
            assertThat(listener.readyNodeIds()).containsExactly("A");
            scheduler.advanceBy(Duration.ofMillis(1));
            assertThat(listener.readyNodeIds()).containsExactly("A", "A");
        }

        @Test
        @DisplayName("pause and resume from the wrong status are logged no-ops")
        void wrongStatusIsNoOp() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());

            orchestrator.pause();
            orchestrator.resume();
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.IDLE);

            orchestrator.start();
            orchestrator.resume();
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        }

        @Test
        @DisplayName("a queued node may still be picked up while paused")
        void runningWhilePaused() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();
            orchestrator.pause();

            orchestrator.markNodeRunning("A", "s-A");

            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.RUNNING);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("skips waiting nodes, leaves running ones, and ignores their later reports")
        void cancelSemantics() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").build(),
                    node("B").build(),
                    node("C").dependsOn("A").build()));
            orchestrator.start();
            orchestrator.markNodeRunning("A", "s-A");
            listener.clear();

            orchestrator.cancel();

            WorkflowExecution execution = orchestrator.getExecution();
            assertThat(execution.getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(execution.getCurrentStepLabel()).isEqualTo("Workflow cancelled");
            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.RUNNING);
            assertThat(status(orchestrator, "B")).isEqualTo(NodeStatus.SKIPPED);
            assertThat(status(orchestrator, "C")).isEqualTo(NodeStatus.SKIPPED);
            assertThat(listener.eventsOf(NodeSkipped.class))
                    .extracting(NodeSkipped::reason)
                    .containsOnly(TaskDagOrchestrator.REASON_CANCELLED);
            assertThat(listener.types()).last().isEqualTo(EventType.WORKFLOW_PROGRESS);

            listener.clear();
            orchestrator.markNodeCompleted("A", true);
            orchestrator.start();
            orchestrator.resume();
            orchestrator.cancel();

            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.RUNNING);
            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(listener.events()).isEmpty();
        }

        @Test
        @DisplayName("clears pending retry timers")
        void cancelClearsTimers() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(workflow(
                    node("A").retryPolicy(new RetryPolicy(3, 100, 2.0)).build()));
            orchestrator.start();
            reportFailure(orchestrator, "A", null);
            assertThat(scheduler.pendingCount()).isEqualTo(1);

            orchestrator.cancel();

            assertThat(scheduler.pendingCount()).isZero();
            assertThat(status(orchestrator, "A")).isEqualTo(NodeStatus.SKIPPED);
            scheduler.advanceBy(Duration.ofSeconds(1));
            assertThat(listener.readyNodeIds()).containsExactly("A");
        }

        @Test
        @DisplayName("an idle execution can be cancelled")
        void cancelIdle() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());

            orchestrator.cancel();

            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(orchestrator.getExecution().getSkippedNodes()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("listeners")
    class Listeners {

        @Test
        @DisplayName("a throwing listener does not stop delivery or the run")
        void throwingListenerIsolated() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.on(event -> {
                throw new IllegalStateException("listener bug");
            });

            orchestrator.start();
            succeed(orchestrator, "A");

            assertThat(listener.readyNodeIds()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("a runner calling back from inside a listener drives the run to completion")
        void reentrantRunner() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.on(event -> {
                if (event instanceof NodeReady ready) {
                    try {
                        orchestrator.markNodeRunning(ready.nodeId(), "session-" + ready.nodeId());
                        orchestrator.markNodeCompleted(ready.nodeId(), true);
                    } catch (Exception e) {
                        fail("runner callback failed", e);
                    }
                }
            });

            orchestrator.start();

            assertThat(orchestrator.getExecution().getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(listener.readyNodeIds()).containsExactly("A", "B", "C", "D");
            assertThat(listener.eventsOf(OrchestratorEvent.WorkflowCompleted.class)).hasSize(1);
            assertThat(listener.types()).last().isEqualTo(EventType.WORKFLOW_COMPLETED);
        }

        @Test
        @DisplayName("unsubscribed listeners receive nothing further")
        void unsubscribe() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            RecordingListener other = new RecordingListener();
            Subscription subscription = orchestrator.on(other);

            orchestrator.start();
            subscription.unsubscribe();
            succeed(orchestrator, "A");

            assertThat(other.readyNodeIds()).containsExactly("A");
            assertThat(listener.readyNodeIds()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("progress events carry snapshots of the execution")
        void progressCarriesSnapshot() throws Exception {
            TaskDagOrchestrator orchestrator = orchestrator(diamond());
            orchestrator.start();

            WorkflowProgress progress = listener.eventsOf(WorkflowProgress.class).get(0);
            assertThat(progress.executionId()).isEqualTo("exec-1");
            assertThat(progress.execution().getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(progress.execution().getStartedAt()).isPresent();
        }
    }

    // ========== Helpers ==========

    private TaskDagOrchestrator orchestrator(WorkflowDefinition definition) throws WorkflowValidationException {
        OrchestratorOptions options = OrchestratorOptions.builder()
                .retryScheduler(scheduler)
                .clock(scheduler.clock())
                .build();
        TaskDagOrchestrator orchestrator = new TaskDagOrchestrator(definition, "exec-1", options);
        orchestrator.on(listener);
        return orchestrator;
    }

    private static void succeed(TaskDagOrchestrator orchestrator, String nodeId) throws Exception {
        orchestrator.markNodeRunning(nodeId, "session-" + nodeId);
        orchestrator.markNodeCompleted(nodeId, true);
    }

    private static void reportFailure(TaskDagOrchestrator orchestrator, String nodeId, String error) throws Exception {
        orchestrator.markNodeRunning(nodeId, "session-" + nodeId);
        orchestrator.markNodeCompleted(nodeId, false, error);
    }

    private static NodeStatus status(TaskDagOrchestrator orchestrator, String nodeId) {
        return orchestrator.getExecution().getNodeState(nodeId).orElseThrow().getStatus();
    }

    private static DagNode.Builder node(String id) {
        return DagNode.builder(id).label("Step " + id).moduleId("billing").taskType(TaskType.FEATURE_FIX);
    }

    private static WorkflowDefinition workflow(DagNode... nodes) {
        return WorkflowDefinition.builder("wf-test").name("Test workflow").nodes(List.of(nodes)).build();
    }

    private static WorkflowDefinition diamond() {
        return workflow(
                node("A").build(),
                node("B").dependsOn("A").build(),
                node("C").dependsOn("A").build(),
                node("D").dependsOn("B", "C").build());
    }
}
