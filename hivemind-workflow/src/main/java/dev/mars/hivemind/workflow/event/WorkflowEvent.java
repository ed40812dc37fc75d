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

package dev.mars.hivemind.workflow.event;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A single lifecycle notification. Step-scoped kinds carry a step id; failure kinds
 * carry an error description; {@link WorkflowEventType#STEP_RETRYING} carries the attempt
 * that just failed.
 */
public final class WorkflowEvent {

    private final WorkflowEventType type;
    private final String executionId;
    private final String workflowId;
    private final String stepId;
    private final Instant timestamp;
    private final String error;
    private final int attempt;

    private WorkflowEvent(WorkflowEventType type, String executionId, String workflowId,
                          String stepId, String error, int attempt) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        if (type.isStepEvent() && stepId == null) {
            throw new IllegalArgumentException("Step ID is required for " + type.getWireName());
        }
        this.stepId = stepId;
        this.timestamp = Instant.now();
        this.error = error;
        this.attempt = attempt;
    }

    public static WorkflowEvent workflow(WorkflowEventType type, String executionId, String workflowId) {
        return new WorkflowEvent(type, executionId, workflowId, null, null, 0);
    }

    public static WorkflowEvent workflowFailed(String executionId, String workflowId, String error) {
        return new WorkflowEvent(WorkflowEventType.WORKFLOW_FAILED, executionId, workflowId, null, error, 0);
    }

    public static WorkflowEvent step(WorkflowEventType type, String executionId, String workflowId, String stepId) {
        return new WorkflowEvent(type, executionId, workflowId, stepId, null, 0);
    }

    public static WorkflowEvent stepFailed(String executionId, String workflowId, String stepId, String error) {
        return new WorkflowEvent(WorkflowEventType.STEP_FAILED, executionId, workflowId, stepId, error, 0);
    }

    public static WorkflowEvent stepRetrying(String executionId, String workflowId, String stepId,
                                             int attempt, String error) {
        return new WorkflowEvent(WorkflowEventType.STEP_RETRYING, executionId, workflowId, stepId, error, attempt);
    }

    public WorkflowEventType getType() {
        return type;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type.getWireName()).append(" [").append(workflowId).append('/').append(executionId);
        if (stepId != null) {
            sb.append('/').append(stepId);
        }
        sb.append(']');
        if (attempt > 0) {
            sb.append(" attempt=").append(attempt);
        }
        if (error != null) {
            sb.append(" error=").append(error);
        }
        return sb.toString();
    }
}
