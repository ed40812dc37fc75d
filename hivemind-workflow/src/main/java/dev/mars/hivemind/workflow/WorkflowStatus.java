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

/**
 * Enumeration of workflow execution statuses.
 * Executions move from PENDING to RUNNING and then to exactly one terminal status.
 */
public enum WorkflowStatus {

    /**
     * Execution has been created but no step has been scheduled yet.
     */
    PENDING,

    /**
     * Steps are being scheduled or are in flight.
     */
    RUNNING,

    /**
     * Every step succeeded.
     */
    COMPLETED,

    /**
     * A step failed; succeeded steps have been rolled back.
     */
    FAILED,

    /**
     * Cancelled by the caller; in-flight steps were allowed to settle.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
