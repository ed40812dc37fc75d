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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view handed to a step handler: which execution and step it belongs to,
 * the outputs of steps that have already succeeded, and the cancellation signal.
 */
public final class StepContext {

    private final String executionId;
    private final String workflowId;
    private final String stepId;
    private final int attempt;
    private final Map<String, Object> previousResults;
    private final Map<String, String> metadata;
    private final CancellationToken cancellationToken;

    StepContext(String executionId, String workflowId, String stepId, int attempt,
                Map<String, Object> previousResults, Map<String, String> metadata,
                CancellationToken cancellationToken) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.attempt = attempt;
        // step outputs may legitimately be null, so Map.copyOf is not an option here
        this.previousResults = previousResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(previousResults))
                : Map.of();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "Cancellation token cannot be null");
    }

    StepContext forAttempt(int nextAttempt) {
        return new StepContext(executionId, workflowId, stepId, nextAttempt, previousResults, metadata, cancellationToken);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getStepId() {
        return stepId;
    }

    /**
     * The 1-based attempt number of the current invocation.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Outputs of every step that had succeeded when this step was started, keyed by step id.
     */
    public Map<String, Object> getPreviousResults() {
        return previousResults;
    }

    public boolean hasResult(String upstreamStepId) {
        return previousResults.containsKey(upstreamStepId);
    }

    public Object getResult(String upstreamStepId) {
        return previousResults.get(upstreamStepId);
    }

    public <T> T getResult(String upstreamStepId, Class<T> type) {
        Object value = previousResults.get(upstreamStepId);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancellationRequested();
    }

    @Override
    public String toString() {
        return "StepContext{" +
               "executionId='" + executionId + '\'' +
               ", stepId='" + stepId + '\'' +
               ", attempt=" + attempt +
               ", previousResults=" + previousResults.keySet() +
               '}';
    }
}
