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

package dev.mars.hivemind.workflow;

import dev.mars.hivemind.core.exceptions.NotFoundException;
import dev.mars.hivemind.workflow.event.LoggingWorkflowEventSink;
import dev.mars.hivemind.workflow.event.WorkflowEventSink;
import dev.mars.hivemind.workflow.observability.WorkflowMetrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory workflow registry and executor.
 * Definitions are validated at registration; each execution is driven by its own scheduler
 * and recorded in a bounded history once terminal.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowRegistry implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(WorkflowRegistry.class.getName());
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000;

    private final WorkflowRegistryOptions options;
    private final Map<String, WorkflowDefinition> definitions = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, WorkflowScheduler> activeExecutions = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final ExecutionHistory history;
    private final StepExecutor stepExecutor;
    private final RollbackCoordinator rollbackCoordinator = new RollbackCoordinator();
    private final WorkflowEventSink eventSink;
    private final WorkflowMetrics metrics;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public WorkflowRegistry() {
        this(WorkflowRegistryOptions.defaults());
    }

    public WorkflowRegistry(WorkflowRegistryOptions options) {
        this(options, new LoggingWorkflowEventSink());
    }

    public WorkflowRegistry(WorkflowRegistryOptions options, WorkflowEventSink eventSink) {
        this(options, eventSink, options.isMetricsEnabled() ? GlobalOpenTelemetry.get() : OpenTelemetry.noop());
    }

    public WorkflowRegistry(WorkflowRegistryOptions options, WorkflowEventSink eventSink, OpenTelemetry openTelemetry) {
        this(options, eventSink, openTelemetry, new StepExecutor());
    }

    WorkflowRegistry(WorkflowRegistryOptions options, WorkflowEventSink eventSink, OpenTelemetry openTelemetry,
                     StepExecutor stepExecutor) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.eventSink = guard(Objects.requireNonNull(eventSink, "Event sink cannot be null"));
        this.metrics = options.isMetricsEnabled()
                ? new WorkflowMetrics(Objects.requireNonNull(openTelemetry, "OpenTelemetry cannot be null"))
                : WorkflowMetrics.noop();
        this.history = new ExecutionHistory(options.isHistoryEnabled() ? options.getMaxHistoryEntries() : 0);
        this.stepExecutor = stepExecutor;

        logger.info("WorkflowRegistry initialized: " + options);
    }

    private static WorkflowEventSink guard(WorkflowEventSink sink) {
        return event -> {
            try {
                sink.emit(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Event sink failed for " + event.getType().getWireName() +
                           " of execution " + event.getExecutionId() + ": " + e.getMessage());
                logger.log(Level.FINE, "Event sink failure", e);
            }
        };
    }

    @Override
    public void register(WorkflowDefinition definition) throws WorkflowValidationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");

        ValidationResult result = DependencyGraph.of(definition).validate();
        if (!result.isValid()) {
            logger.warning("Rejected workflow " + definition.getId() + ": " + result.getErrors());
            throw new WorkflowValidationException(definition.getId(), result);
        }
        for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
            logger.warning("Workflow " + definition.getId() + ": " + warning);
        }

        if (definitions.putIfAbsent(definition.getId(), definition) != null) {
            throw new WorkflowValidationException(definition.getId(),
                    "Workflow '" + definition.getId() + "' is already registered; unregister it first");
        }
        logger.info("Registered workflow " + definition.getId() + " version " + definition.getVersion() +
                    " with " + definition.getSteps().size() + " steps");
    }

    @Override
    public boolean unregister(String workflowId) {
        boolean removed = definitions.remove(workflowId) != null;
        if (removed) {
            logger.info("Unregistered workflow " + workflowId);
        }
        return removed;
    }

    @Override
    public Optional<WorkflowDefinition> get(String workflowId) {
        return Optional.ofNullable(definitions.get(workflowId));
    }

    @Override
    public List<WorkflowDefinition> list(WorkflowQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        List<WorkflowDefinition> snapshot;
        synchronized (definitions) {
            snapshot = new ArrayList<>(definitions.values());
        }
        List<WorkflowDefinition> matches = new ArrayList<>();
        for (WorkflowDefinition definition : snapshot) {
            if (query.matches(definition)) {
                matches.add(definition);
            }
        }
        int from = Math.min(query.getOffset(), matches.size());
        int to = query.getLimit() > 0 ? Math.min(from + query.getLimit(), matches.size()) : matches.size();
        return List.copyOf(matches.subList(from, to));
    }

    @Override
    public CompletableFuture<WorkflowExecution> execute(String workflowId, Object input) throws NotFoundException {
        return execute(workflowId, input, ExecutionOptions.defaults());
    }

    @Override
    public CompletableFuture<WorkflowExecution> execute(String workflowId, Object input, ExecutionOptions executionOptions)
            throws NotFoundException {
        Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        WorkflowDefinition definition = definitions.get(workflowId);
        if (definition == null) {
            throw new NotFoundException("workflow", workflowId);
        }

        if (shutdown.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow registry is shut down"));
        }

        String executionId = UUID.randomUUID().toString();
        WorkflowScheduler scheduler = new WorkflowScheduler(executionId, definition, input,
                executionOptions != null ? executionOptions : ExecutionOptions.defaults(),
                options, stepExecutor, rollbackCoordinator, eventSink, metrics, this::onExecutionFinished);

        synchronized (admissionLock) {
            if (activeExecutions.size() >= options.getMaxConcurrentExecutions()) {
                logger.warning("Rejected execution of workflow " + workflowId + ": " +
                               options.getMaxConcurrentExecutions() + " executions already running");
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Maximum concurrent executions reached: " + options.getMaxConcurrentExecutions()));
            }
            activeExecutions.put(executionId, scheduler);
        }

        return scheduler.start();
    }

    private void onExecutionFinished(WorkflowExecution execution) {
        history.add(execution);
        activeExecutions.remove(execution.getExecutionId());
    }

    @Override
    public boolean cancel(String executionId) {
        WorkflowScheduler scheduler = activeExecutions.get(executionId);
        if (scheduler == null) {
            logger.fine("Cannot cancel unknown or finished execution " + executionId);
            return false;
        }
        return scheduler.cancel();
    }

    @Override
    public Optional<WorkflowExecution> getExecution(String executionId) {
        WorkflowScheduler scheduler = activeExecutions.get(executionId);
        if (scheduler != null) {
            return Optional.of(scheduler.snapshot());
        }
        return history.find(executionId);
    }

    @Override
    public List<WorkflowExecution> getHistory() {
        return history.query(HistoryQuery.all());
    }

    @Override
    public List<WorkflowExecution> getHistory(HistoryQuery query) {
        return history.query(query);
    }

    @Override
    public List<WorkflowExecution> getActiveExecutions() {
        List<WorkflowExecution> running = new ArrayList<>();
        for (WorkflowScheduler scheduler : activeExecutions.values()) {
            running.add(scheduler.snapshot());
        }
        running.sort(Comparator.comparing(WorkflowExecution::getStartedAt));
        return running;
    }

    @Override
    public int getActiveExecutionCount() {
        return activeExecutions.size();
    }

    @Override
    public void clear() {
        history.clear();
        logger.info("Execution history cleared");
    }

    @Override
    public void shutdown() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Cancels running executions and waits up to {@code timeoutMs} for them to settle before
     * stopping the step threads. Executions still running after that resolve with their
     * in-flight steps failed.
     *
     * @return true if every execution settled within the timeout
     */
    public boolean shutdown(long timeoutMs) {
        if (shutdown.getAndSet(true)) {
            return true;
        }
        List<WorkflowScheduler> running = new ArrayList<>(activeExecutions.values());
        logger.info("Shutting down workflow registry with " + running.size() + " active execution(s)");
        for (WorkflowScheduler scheduler : running) {
            scheduler.cancel();
        }

        boolean settled = awaitSettled(running, timeoutMs);
        if (!settled) {
            logger.warning("Executions did not settle within " + timeoutMs + "ms, abandoning in-flight steps");
        }
        stepExecutor.shutdown();
        logger.info("Workflow registry shutdown completed");
        return settled;
    }

    private static boolean awaitSettled(List<WorkflowScheduler> schedulers, long timeoutMs) {
        if (schedulers.isEmpty()) {
            return true;
        }
        CompletableFuture<?>[] completions = schedulers.stream()
                .map(WorkflowScheduler::getCompletion)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(completions).get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            logger.log(Level.WARNING, "Execution completed abnormally during shutdown", e.getCause());
            return true;
        }
    }

    public WorkflowRegistryOptions getOptions() {
        return options;
    }
}
