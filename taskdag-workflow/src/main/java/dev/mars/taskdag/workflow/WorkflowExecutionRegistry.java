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

import dev.mars.taskdag.config.TaskDagConfiguration;
import dev.mars.taskdag.workflow.event.OrchestratorListener;
import dev.mars.taskdag.workflow.observability.MetricsListener;
import dev.mars.taskdag.workflow.observability.WorkflowMetrics;
import dev.mars.taskdag.workflow.schedule.ExecutorRetryScheduler;
import dev.mars.taskdag.workflow.schedule.RetryScheduler;
import dev.mars.taskdag.workflow.template.TemplateHydrator;
import dev.mars.taskdag.workflow.template.WorkflowTemplate;
import dev.mars.taskdag.workflow.template.WorkflowTemplateCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Host-side registry of workflow executions keyed by execution id.
 *
 * <p>Every execution gets its own {@link TaskDagOrchestrator}; all of them share one retry
 * scheduler and, when metrics are enabled, one {@link WorkflowMetrics}. Finished executions are
 * kept until {@link #clearCompletedExecutions()} or until more than
 * {@code taskdag.executions.max.retained} of them have accumulated, oldest first.</p>
 *
 * <p>The registry lock is never held while an orchestrator is called, so listeners may query the
 * registry from inside an event callback.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowExecutionRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowExecutionRegistry.class);

    private final WorkflowTemplateCatalog catalog;
    private final TemplateHydrator hydrator;
    private final RetryScheduler retryScheduler;
    private final boolean ownsScheduler;
    private final OrchestratorOptions options;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final int maxRetained;

    private final Map<String, TaskDagOrchestrator> executions = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean shutdown = false;

    public WorkflowExecutionRegistry(TaskDagConfiguration configuration, WorkflowTemplateCatalog catalog) {
        this(configuration, catalog, null, Clock.systemUTC(),
                configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null);
    }

    /**
     * @param retryScheduler shared retry scheduler, or null to create one with
     *                       {@code taskdag.scheduler.threads} threads owned by this registry
     * @param metrics        metrics sink, or null to disable metrics
     */
    public WorkflowExecutionRegistry(TaskDagConfiguration configuration, WorkflowTemplateCatalog catalog,
                                     RetryScheduler retryScheduler, Clock clock, WorkflowMetrics metrics) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.catalog = Objects.requireNonNull(catalog, "Template catalog cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.hydrator = new TemplateHydrator(clock);
        this.ownsScheduler = retryScheduler == null;
        this.retryScheduler = retryScheduler != null
                ? retryScheduler
                : new ExecutorRetryScheduler(configuration.getSchedulerThreads());
        this.options = OrchestratorOptions.builder()
                .configuration(configuration)
                .retryScheduler(this.retryScheduler)
                .clock(clock)
                .build();
        this.metrics = metrics;
        this.maxRetained = configuration.getMaxRetainedExecutions();

        logger.info("WorkflowExecutionRegistry initialized: {}, metrics {}",
                options, metrics != null ? "enabled" : "disabled");
    }

    // ========== Starting executions ==========

    public TaskDagOrchestrator startWorkflow(WorkflowDefinition definition) throws WorkflowValidationException {
        return startWorkflow(definition, null);
    }

    /**
     * Validates the definition, registers a new execution and starts it.
     *
     * @param listener subscribed before the run starts so it sees the first readiness pass; may be null
     * @throws WorkflowValidationException if the definition is invalid; nothing is registered
     * @throws IllegalStateException       if the registry has been shut down
     */
    public TaskDagOrchestrator startWorkflow(WorkflowDefinition definition, OrchestratorListener listener)
            throws WorkflowValidationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        requireNotShutdown();

        String executionId = nextExecutionId();
        TaskDagOrchestrator orchestrator = new TaskDagOrchestrator(definition, executionId, options);
        if (metrics != null) {
            orchestrator.on(new MetricsListener(metrics, definition));
        }
        if (listener != null) {
            orchestrator.on(listener);
        }

        // Checked again under the lock shutdown() takes, so every registered execution is seen by it.
        synchronized (executions) {
            requireNotShutdown();
            executions.put(executionId, orchestrator);
        }
        evictFinishedExecutions();

        logger.info("Registered execution {} for workflow '{}'", executionId, definition.getId());
        orchestrator.start();
        return orchestrator;
    }

    public TaskDagOrchestrator startTemplate(String templateId, List<String> moduleIds)
            throws WorkflowValidationException {
        return startTemplate(templateId, moduleIds, null);
    }

    /**
     * Hydrates a catalog template for the given modules and starts it.
     *
     * @throws IllegalArgumentException if no template has this id or {@code moduleIds} is empty
     */
    public TaskDagOrchestrator startTemplate(String templateId, List<String> moduleIds,
                                             OrchestratorListener listener) throws WorkflowValidationException {
        WorkflowTemplate template = catalog.findTemplate(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow template: " + templateId));
        return startWorkflow(hydrator.hydrate(template, moduleIds), listener);
    }

    // ========== Queries ==========

    public Optional<TaskDagOrchestrator> get(String executionId) {
        synchronized (executions) {
            return Optional.ofNullable(executions.get(executionId));
        }
    }

    public Optional<WorkflowExecution> getExecution(String executionId) {
        return get(executionId).map(TaskDagOrchestrator::getExecution);
    }

    /**
     * Snapshots of running and paused executions, oldest first.
     */
    public List<WorkflowExecution> activeExecutions() {
        return listExecutions().stream()
                .filter(WorkflowExecution::isRunning)
                .collect(Collectors.toList());
    }

    /**
     * Snapshots of every registered execution, oldest first.
     */
    public List<WorkflowExecution> listExecutions() {
        return orchestrators().stream()
                .map(TaskDagOrchestrator::getExecution)
                .collect(Collectors.toList());
    }

    public WorkflowTemplateCatalog getCatalog() {
        return catalog;
    }

    // ========== Housekeeping ==========

    /**
     * Drops every execution that is not running or paused.
     *
     * @return the number of executions removed
     */
    public int clearCompletedExecutions() {
        List<String> finished = orchestrators().stream()
                .filter(orchestrator -> !orchestrator.getExecution().isRunning())
                .map(TaskDagOrchestrator::getExecutionId)
                .collect(Collectors.toList());
        remove(finished);
        logger.debug("Cleared {} completed execution(s)", finished.size());
        return finished.size();
    }

    /**
     * Cancels every active execution and stops the retry scheduler if this registry created it.
     * Further starts are rejected.
     */
    public void shutdown() {
        synchronized (executions) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        int cancelled = 0;
        for (TaskDagOrchestrator orchestrator : orchestrators()) {
            // Includes executions registered but not yet started; their start() is then ignored.
            if (!orchestrator.getExecution().isFinished()) {
                orchestrator.cancel();
                cancelled++;
            }
        }
        if (ownsScheduler) {
            retryScheduler.shutdown();
        }
        logger.info("WorkflowExecutionRegistry shut down, {} active execution(s) cancelled", cancelled);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public void close() {
        shutdown();
    }

    private void evictFinishedExecutions() {
        List<String> finished = orchestrators().stream()
                .filter(orchestrator -> orchestrator.getExecution().isFinished())
                .map(TaskDagOrchestrator::getExecutionId)
                .collect(Collectors.toList());
        int excess = finished.size() - maxRetained;
        if (excess > 0) {
            List<String> evicted = finished.subList(0, excess);
            remove(evicted);
            logger.debug("Evicted {} finished execution(s) beyond the retention limit of {}", excess, maxRetained);
        }
    }

    private List<TaskDagOrchestrator> orchestrators() {
        synchronized (executions) {
            return new ArrayList<>(executions.values());
        }
    }

    private void remove(List<String> executionIds) {
        synchronized (executions) {
            executionIds.forEach(executions::remove);
        }
    }

    private void requireNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException("Workflow execution registry is shut down");
        }
    }

    private String nextExecutionId() {
        return "exec-" + clock.millis() + "-" + sequence.incrementAndGet();
    }
}
