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

import dev.mars.hivemind.workflow.event.WorkflowEvent;
import dev.mars.hivemind.workflow.event.WorkflowEventSink;
import dev.mars.hivemind.workflow.event.WorkflowEventType;
import dev.mars.hivemind.workflow.observability.WorkflowMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one execution of a workflow definition.
 * <p>
 * Scheduling is event driven: whenever a step settles, every pending step whose dependencies
 * have all succeeded is launched, in declaration order. State is guarded by a single lock;
 * step launches and event emission happen outside it. The first failure raises the
 * execution's cancellation token and stops new launches; once nothing is in flight the
 * execution is finalized exactly once.
 */
final class WorkflowScheduler {

    private static final Logger logger = Logger.getLogger(WorkflowScheduler.class.getName());

    private final String executionId;
    private final WorkflowDefinition definition;
    private final Object input;
    private final ExecutionOptions executionOptions;
    private final WorkflowRegistryOptions registryOptions;
    private final StepExecutor stepExecutor;
    private final RollbackCoordinator rollbackCoordinator;
    private final WorkflowEventSink eventSink;
    private final WorkflowMetrics metrics;
    private final Consumer<WorkflowExecution> onTerminal;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final CompletableFuture<WorkflowExecution> completion = new CompletableFuture<>();
    private final Instant startedAt = Instant.now();

    private final Object lock = new Object();
    private final Map<String, StepState> states = new LinkedHashMap<>();
    private final List<String> completionOrder = new ArrayList<>();
    private final Map<String, Object> succeededOutputs = new LinkedHashMap<>();
    private WorkflowStatus status = WorkflowStatus.PENDING;
    private int inFlight;
    private Throwable failure;
    private String failedStepId;
    private boolean cancelRequested;
    private boolean finalizing;
    private WorkflowExecution terminalExecution;

    WorkflowScheduler(String executionId, WorkflowDefinition definition, Object input,
                      ExecutionOptions executionOptions, WorkflowRegistryOptions registryOptions,
                      StepExecutor stepExecutor, RollbackCoordinator rollbackCoordinator,
                      WorkflowEventSink eventSink, WorkflowMetrics metrics,
                      Consumer<WorkflowExecution> onTerminal) {
        this.executionId = executionId;
        this.definition = definition;
        this.input = input;
        this.executionOptions = executionOptions;
        this.registryOptions = registryOptions;
        this.stepExecutor = stepExecutor;
        this.rollbackCoordinator = rollbackCoordinator;
        this.eventSink = eventSink;
        this.metrics = metrics;
        this.onTerminal = onTerminal;
        for (WorkflowStep step : definition.getSteps()) {
            states.put(step.getId(), new StepState(step));
        }
    }

    String getExecutionId() {
        return executionId;
    }

    CompletableFuture<WorkflowExecution> getCompletion() {
        return completion;
    }

    CompletableFuture<WorkflowExecution> start() {
        synchronized (lock) {
            if (status != WorkflowStatus.PENDING) {
                return completion;
            }
            status = WorkflowStatus.RUNNING;
        }
        logger.info("Starting execution " + executionId + " of workflow " + definition.getId() +
                    " (" + states.size() + " steps)");
        metrics.recordWorkflowStarted(definition.getId());
        eventSink.emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_STARTED, executionId, definition.getId()));
        scheduleReady();
        return completion;
    }

    /**
     * Requests cancellation. In-flight steps settle normally; nothing new is launched.
     *
     * @return false if the execution is already finishing, failing or cancelling
     */
    boolean cancel() {
        boolean running;
        synchronized (lock) {
            if (status.isTerminal() || finalizing || cancelRequested || failure != null) {
                return false;
            }
            cancelRequested = true;
            running = status == WorkflowStatus.RUNNING;
        }
        logger.info("Cancellation requested for execution " + executionId);
        cancellationToken.cancel("Execution " + executionId + " cancelled");
        if (running) {
            scheduleReady();
        }
        return true;
    }

    private void scheduleReady() {
        List<Launch> launches = new ArrayList<>();
        boolean finished;
        synchronized (lock) {
            if (status != WorkflowStatus.RUNNING || finalizing) {
                return;
            }
            if (failure == null && !cancelRequested) {
                for (StepState state : states.values()) {
                    if (state.status == StepStatus.PENDING && dependenciesSucceeded(state.step)) {
                        state.status = StepStatus.RUNNING;
                        state.startedAt = Instant.now();
                        inFlight++;
                        launches.add(new Launch(state.step, newContext(state.step, succeededOutputs)));
                    }
                }
            }
            finished = inFlight == 0;
            if (finished) {
                finalizing = true;
            }
        }

        for (Launch launch : launches) {
            launch(launch);
        }
        if (finished) {
            complete();
        }
    }

    private boolean dependenciesSucceeded(WorkflowStep step) {
        for (String dependency : step.getDependencies()) {
            StepState upstream = states.get(dependency);
            if (upstream == null || upstream.status != StepStatus.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    private StepContext newContext(WorkflowStep step, Map<String, Object> outputs) {
        return new StepContext(executionId, definition.getId(), step.getId(), 1, outputs,
                executionOptions.getMetadata(), cancellationToken);
    }

    private void launch(Launch launch) {
        WorkflowStep step = launch.step;
        logger.fine("Launching step " + step.getId() + " of execution " + executionId);
        metrics.recordStepStarted(definition.getId());
        eventSink.emit(WorkflowEvent.step(WorkflowEventType.STEP_STARTED, executionId, definition.getId(), step.getId()));

        long timeoutMs = step.getTimeoutMs().orElse(
                executionOptions.getDefaultStepTimeoutMs().orElse(registryOptions.getDefaultStepTimeoutMs()));
        int retries = step.getRetries().orElse(registryOptions.getDefaultRetries());
        long retryDelayMs = step.getRetryDelayMs().orElse(registryOptions.getDefaultRetryDelayMs());

        stepExecutor.execute(step, input, launch.context, timeoutMs, retries, retryDelayMs,
                        (retried, attempt, error) -> eventSink.emit(WorkflowEvent.stepRetrying(
                                executionId, definition.getId(), retried.getId(), attempt, error.getMessage())))
                .whenComplete((outcome, error) -> onStepSettled(step, outcome != null
                        ? outcome
                        : StepOutcome.failure(new StepExecutionException(step.getId(), 1, error), 1)));
    }

    private void onStepSettled(WorkflowStep step, StepOutcome outcome) {
        String stepId = step.getId();
        boolean firstFailure = false;
        synchronized (lock) {
            StepState state = states.get(stepId);
            state.completedAt = Instant.now();
            state.attempts = outcome.getAttempts();
            inFlight--;
            if (outcome.isSuccess()) {
                state.status = StepStatus.SUCCEEDED;
                state.output = outcome.getOutput();
                succeededOutputs.put(stepId, outcome.getOutput());
                completionOrder.add(stepId);
            } else {
                state.status = StepStatus.FAILED;
                state.error = outcome.getError();
                if (failure == null && !cancelRequested) {
                    failure = outcome.getError();
                    failedStepId = stepId;
                    firstFailure = true;
                }
            }
        }

        if (outcome.isSuccess()) {
            logger.fine("Step " + stepId + " of execution " + executionId + " succeeded");
            eventSink.emit(WorkflowEvent.step(WorkflowEventType.STEP_COMPLETED, executionId, definition.getId(), stepId));
        } else {
            metrics.recordStepFailed(definition.getId(), outcome.isTimedOut());
            eventSink.emit(WorkflowEvent.stepFailed(executionId, definition.getId(), stepId,
                    outcome.getError().getMessage()));
        }

        if (firstFailure) {
            logger.warning("Step " + stepId + " failed, stopping execution " + executionId + ": " +
                           outcome.getError().getMessage());
            cancellationToken.cancel("Step " + stepId + " failed");
        }

        scheduleReady();
    }

    private void complete() {
        Throwable cause;
        boolean cancelled;
        synchronized (lock) {
            cause = failure;
            cancelled = cancelRequested;
        }

        Object output = null;
        String errorMessage = null;
        WorkflowStatus finalStatus;
        if (cause == null && !cancelled) {
            try {
                output = computeOutput();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Output transform failed for execution " + executionId, e);
                cause = e;
                errorMessage = "Output transform failed: " + e.getMessage();
            }
        }

        boolean rolledBack = false;
        if (cause != null) {
            if (errorMessage == null) {
                errorMessage = cause.getMessage();
            }
            rolledBack = rollback();
            finalStatus = WorkflowStatus.FAILED;
        } else if (cancelled) {
            errorMessage = cancellationToken.getReason();
            finalStatus = WorkflowStatus.CANCELLED;
        } else {
            finalStatus = WorkflowStatus.COMPLETED;
        }

        WorkflowExecution execution;
        synchronized (lock) {
            status = finalStatus;
            terminalExecution = buildSnapshot(Instant.now(), output, errorMessage, cause, rolledBack);
            execution = terminalExecution;
        }

        double seconds = execution.getDuration().map(Duration::toMillis).orElse(0L) / 1000.0;
        switch (finalStatus) {
            case COMPLETED:
                metrics.recordWorkflowCompleted(definition.getId(), seconds);
                break;
            case FAILED:
                metrics.recordWorkflowFailed(definition.getId(), seconds,
                        cause instanceof StepTimeoutException ? "timeout" : "error");
                break;
            default:
                metrics.recordWorkflowCancelled(definition.getId(), seconds);
                break;
        }
        logger.info("Execution " + executionId + " of workflow " + definition.getId() + " finished with status " +
                    finalStatus + " in " + seconds + "s");

        onTerminal.accept(execution);

        if (finalStatus == WorkflowStatus.COMPLETED) {
            eventSink.emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_COMPLETED, executionId, definition.getId()));
        } else if (finalStatus == WorkflowStatus.FAILED) {
            eventSink.emit(WorkflowEvent.workflowFailed(executionId, definition.getId(), errorMessage));
        } else {
            eventSink.emit(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_CANCELLED, executionId, definition.getId()));
        }

        completion.complete(execution);
    }

    private Object computeOutput() {
        Map<String, Object> outputs;
        Object lastDeclaredOutput = null;
        synchronized (lock) {
            outputs = Collections.unmodifiableMap(new LinkedHashMap<>(succeededOutputs));
            List<WorkflowStep> steps = definition.getSteps();
            if (!steps.isEmpty()) {
                lastDeclaredOutput = states.get(steps.get(steps.size() - 1).getId()).output;
            }
        }
        if (definition.getOutputTransform().isPresent()) {
            return definition.getOutputTransform().get().apply(outputs);
        }
        return lastDeclaredOutput;
    }

    /**
     * @return true if any succeeded step was swept
     */
    private boolean rollback() {
        List<WorkflowStep> completed = new ArrayList<>();
        Map<String, Object> outputs;
        synchronized (lock) {
            for (String stepId : completionOrder) {
                completed.add(states.get(stepId).step);
            }
            outputs = new LinkedHashMap<>(succeededOutputs);
        }
        if (completed.isEmpty()) {
            return false;
        }

        logger.info("Rolling back " + completed.size() + " succeeded step(s) of execution " + executionId);
        eventSink.emit(WorkflowEvent.workflow(WorkflowEventType.ROLLBACK_STARTED, executionId, definition.getId()));

        List<RollbackCoordinator.RollbackOutcome> outcomes = rollbackCoordinator.rollback(
                executionId, completed, outputs, step -> newContext(step, outputs));

        synchronized (lock) {
            for (RollbackCoordinator.RollbackOutcome outcome : outcomes) {
                StepState state = states.get(outcome.getStepId());
                if (outcome.isCompensated()) {
                    state.status = StepStatus.ROLLED_BACK;
                } else {
                    state.rollbackError = outcome.getError().orElse(null);
                }
            }
        }
        for (RollbackCoordinator.RollbackOutcome outcome : outcomes) {
            metrics.recordRollback(definition.getId(), outcome.isCompensated());
        }

        eventSink.emit(WorkflowEvent.workflow(WorkflowEventType.ROLLBACK_COMPLETED, executionId, definition.getId()));
        return true;
    }

    /**
     * Current view of the execution; the final snapshot once terminal.
     */
    WorkflowExecution snapshot() {
        synchronized (lock) {
            if (terminalExecution != null) {
                return terminalExecution;
            }
            return buildSnapshot(null, null, null, null, false);
        }
    }

    private WorkflowExecution buildSnapshot(Instant completedAt, Object output, String errorMessage,
                                            Throwable cause, boolean rolledBack) {
        Map<String, StepResult> results = new LinkedHashMap<>();
        for (StepState state : states.values()) {
            results.put(state.step.getId(), state.toResult());
        }
        return new WorkflowExecution(executionId, definition.getId(), definition.getVersion(), status, results,
                startedAt, completedAt, output, errorMessage, cause, failedStepId,
                executionOptions.getMetadata(), rolledBack);
    }

    private static final class Launch {
        private final WorkflowStep step;
        private final StepContext context;

        private Launch(WorkflowStep step, StepContext context) {
            this.step = step;
            this.context = context;
        }
    }

    private static final class StepState {
        private final WorkflowStep step;
        private StepStatus status = StepStatus.PENDING;
        private Object output;
        private Throwable error;
        private Instant startedAt;
        private Instant completedAt;
        private int attempts;
        private Throwable rollbackError;

        private StepState(WorkflowStep step) {
            this.step = step;
        }

        private StepResult toResult() {
            return new StepResult(step.getId(), status, output, error, startedAt, completedAt, attempts, rollbackError);
        }
    }
}
