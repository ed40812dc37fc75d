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
import java.util.Optional;

/**
 * Aggregate counts over the step results of one execution.
 */
public final class WorkflowExecutionStats {

    private final int totalSteps;
    private final int succeededSteps;
    private final int failedSteps;
    private final int rolledBackSteps;
    private final int pendingSteps;
    private final int totalRetries;
    private final Duration duration;

    WorkflowExecutionStats(int totalSteps, int succeededSteps, int failedSteps, int rolledBackSteps,
                           int pendingSteps, int totalRetries, Duration duration) {
        this.totalSteps = totalSteps;
        this.succeededSteps = succeededSteps;
        this.failedSteps = failedSteps;
        this.rolledBackSteps = rolledBackSteps;
        this.pendingSteps = pendingSteps;
        this.totalRetries = totalRetries;
        this.duration = duration;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public int getSucceededSteps() {
        return succeededSteps;
    }

    public int getFailedSteps() {
        return failedSteps;
    }

    public int getRolledBackSteps() {
        return rolledBackSteps;
    }

    /**
     * Steps that never started, for example downstream of a failure or after a cancel.
     */
    public int getPendingSteps() {
        return pendingSteps;
    }

    public int getTotalRetries() {
        return totalRetries;
    }

    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }

    @Override
    public String toString() {
        return "WorkflowExecutionStats{" +
               "total=" + totalSteps +
               ", succeeded=" + succeededSteps +
               ", failed=" + failedSteps +
               ", rolledBack=" + rolledBackSteps +
               ", pending=" + pendingSteps +
               ", retries=" + totalRetries +
               ", duration=" + duration +
               '}';
    }
}
