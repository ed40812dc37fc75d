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
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of one step of an execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepResult {

    private final String stepId;
    private final StepStatus status;
    private final Object output;
    private final Throwable error;
    private final Instant startedAt;
    private final Instant completedAt;
    private final int attempts;
    private final Throwable rollbackError;

    public StepResult(String stepId, StepStatus status, Object output, Throwable error,
                      Instant startedAt, Instant completedAt, int attempts, Throwable rollbackError) {
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output;
        this.error = error;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.attempts = attempts;
        this.rollbackError = rollbackError;
    }

    static StepResult pending(String stepId) {
        return new StepResult(stepId, StepStatus.PENDING, null, null, null, null, 0, null);
    }

    public String getStepId() {
        return stepId;
    }

    public StepStatus getStatus() {
        return status;
    }

    /**
     * Output of the handler. Kept for rolled-back steps so callers can see what was compensated.
     */
    public Optional<Object> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<String> getErrorMessage() {
        return error != null ? Optional.ofNullable(error.getMessage()) : Optional.empty();
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Duration> getDuration() {
        return startedAt != null && completedAt != null
                ? Optional.of(Duration.between(startedAt, completedAt))
                : Optional.empty();
    }

    /**
     * Number of handler invocations made, including retries.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Error raised by this step's rollback handler, if compensation was attempted and failed.
     */
    public Optional<Throwable> getRollbackError() {
        return Optional.ofNullable(rollbackError);
    }

    public boolean isSucceeded() {
        return status == StepStatus.SUCCEEDED;
    }

    @Override
    public String toString() {
        return "StepResult{" +
               "stepId='" + stepId + '\'' +
               ", status=" + status +
               ", attempts=" + attempts +
               (error != null ? ", error='" + error.getMessage() + '\'' : "") +
               '}';
    }
}
