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

package dev.mars.taskdag.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the TaskDAG orchestrator.
 *
 * Provides the following metrics:
 * - taskdag.workflow.active (gauge) - Currently active workflow executions
 * - taskdag.workflow.total (counter) - Total workflows started
 * - taskdag.workflow.completed (counter) - Successfully completed workflows
 * - taskdag.workflow.failed (counter) - Failed workflows
 * - taskdag.workflow.cancelled (counter) - Cancelled workflows
 * - taskdag.workflow.duration.seconds (histogram) - Workflow duration distribution
 * - taskdag.node.dispatched (counter) - Nodes released to the runner
 * - taskdag.node.retries (counter) - Node retries scheduled
 * - taskdag.node.failed (counter) - Nodes that ended FAILED
 * - taskdag.node.skipped (counter) - Nodes that ended SKIPPED
 *
 * Without an OpenTelemetry SDK registered every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    public static final String METER_NAME = "taskdag-workflow";

    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter nodesDispatched;
    private final LongCounter nodeRetries;
    private final LongCounter nodesFailed;
    private final LongCounter nodesSkipped;

    // Histograms
    private final DoubleHistogram workflowDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> TASK_TYPE_KEY = AttributeKey.stringKey("task.type");
    private static final AttributeKey<String> SKIP_REASON_KEY = AttributeKey.stringKey("skip.reason");

    public WorkflowMetrics(Meter meter) {
        workflowsTotal = meter.counterBuilder("taskdag.workflow.total")
                .setDescription("Total number of workflows started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("taskdag.workflow.completed")
                .setDescription("Number of successfully completed workflows")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("taskdag.workflow.failed")
                .setDescription("Number of failed workflows")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("taskdag.workflow.cancelled")
                .setDescription("Number of cancelled workflows")
                .setUnit("1")
                .build();

        nodesDispatched = meter.counterBuilder("taskdag.node.dispatched")
                .setDescription("Number of nodes released to the runner")
                .setUnit("1")
                .build();

        nodeRetries = meter.counterBuilder("taskdag.node.retries")
                .setDescription("Number of node retries scheduled")
                .setUnit("1")
                .build();

        nodesFailed = meter.counterBuilder("taskdag.node.failed")
                .setDescription("Number of nodes that failed after exhausting retries")
                .setUnit("1")
                .build();

        nodesSkipped = meter.counterBuilder("taskdag.node.skipped")
                .setDescription("Number of nodes skipped")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("taskdag.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("taskdag.workflow.active")
                .setDescription("Number of currently active workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Shared instance bound to the global OpenTelemetry meter.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowName) {
        workflowsTotal.add(1, workflowAttributes(workflowName));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowName, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowName);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowName, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowName);
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    /**
     * @param wasActive whether the run had been counted as started
     */
    public void recordWorkflowCancelled(String workflowName, boolean wasActive) {
        if (wasActive) {
            activeWorkflows.decrementAndGet();
        }
        workflowsCancelled.add(1, workflowAttributes(workflowName));
    }

    public void recordNodeDispatched(String workflowName, String taskType) {
        nodesDispatched.add(1, nodeAttributes(workflowName, taskType));
    }

    public void recordNodeRetry(String workflowName, String taskType) {
        nodeRetries.add(1, nodeAttributes(workflowName, taskType));
    }

    public void recordNodeFailed(String workflowName, String taskType) {
        nodesFailed.add(1, nodeAttributes(workflowName, taskType));
    }

    public void recordNodeSkipped(String workflowName, String reason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(SKIP_REASON_KEY, reason != null ? reason : "unknown")
                .build();
        nodesSkipped.add(1, attrs);
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowName) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName != null ? workflowName : "unknown");
    }

    private static Attributes nodeAttributes(String workflowName, String taskType) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName != null ? workflowName : "unknown")
                .put(TASK_TYPE_KEY, taskType != null ? taskType : "unknown")
                .build();
    }
}
