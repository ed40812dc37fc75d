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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a workflow execution. The registry hands out a fresh snapshot
 * on every query; once the status is terminal the snapshot never changes.
 */
public class WorkflowExecution {

    private final String executionId;
    private final String workflowId;
    private final String workflowVersion;
    private final WorkflowStatus status;
    private final Map<String, StepResult> stepResults;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Object output;
    private final String errorMessage;
    private final Throwable cause;
    private final String failedStepId;
    private final Map<String, String> metadata;
    private final boolean rolledBack;

    public WorkflowExecution(String executionId, String workflowId, String workflowVersion,
                             WorkflowStatus status, Map<String, StepResult> stepResults,
                             Instant startedAt, Instant completedAt, Object output,
                             String errorMessage, Throwable cause, String failedStepId,
                             Map<String, String> metadata, boolean rolledBack) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.workflowVersion = workflowVersion;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.stepResults = stepResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stepResults))
                : Map.of();
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.completedAt = completedAt;
        this.output = output;
        this.errorMessage = errorMessage;
        this.cause = cause;
        this.failedStepId = failedStepId;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.rolledBack = rolledBack;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    /**
     * Step results keyed by step id, in the order the steps were declared.
     */
    public Map<String, StepResult> getStepResults() {
        return stepResults;
    }

    public Optional<StepResult> getStepResult(String stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Duration> getDuration() {
        return completedAt != null ? Optional.of(Duration.between(startedAt, completedAt)) : Optional.empty();
    }

    public Optional<Object> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * The originating error of a failed execution: the failing step's
     * {@link StepExecutionException} or {@link StepTimeoutException}.
     */
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public Optional<String> getFailedStepId() {
        return Optional.ofNullable(failedStepId);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Whether a rollback sweep ran for this execution.
     */
    public boolean isRolledBack() {
        return rolledBack;
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.COMPLETED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public WorkflowExecutionStats getStats() {
        int succeeded = 0;
        int failed = 0;
        int rolledBackSteps = 0;
        int pending = 0;
        int retries = 0;
        for (StepResult result : stepResults.values()) {
            switch (result.getStatus()) {
                case SUCCEEDED:
                    succeeded++;
                    break;
                case FAILED:
                    failed++;
                    break;
                case ROLLED_BACK:
                    rolledBackSteps++;
                    break;
                case PENDING:
                    pending++;
                    break;
                default:
                    break;
            }
            retries += Math.max(0, result.getAttempts() - 1);
        }
        return new WorkflowExecutionStats(stepResults.size(), succeeded, failed, rolledBackSteps,
                pending, retries, getDuration().orElse(null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return executionId.equals(that.executionId) && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, status);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
               "executionId='" + executionId + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", startedAt=" + startedAt +
               ", completedAt=" + completedAt +
               ", steps=" + stepResults.size() +
               (failedStepId != null ? ", failedStep='" + failedStepId + '\'' : "") +
               '}';
    }
}
