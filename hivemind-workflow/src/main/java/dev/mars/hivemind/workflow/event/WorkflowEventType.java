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

/**
 * Closed set of lifecycle notifications published by the workflow registry.
 */
public enum WorkflowEventType {

    WORKFLOW_STARTED("workflow:started"),
    STEP_STARTED("step:started"),
    STEP_COMPLETED("step:completed"),
    STEP_FAILED("step:failed"),
    STEP_RETRYING("step:retrying"),
    ROLLBACK_STARTED("rollback:started"),
    ROLLBACK_COMPLETED("rollback:completed"),
    WORKFLOW_COMPLETED("workflow:completed"),
    WORKFLOW_FAILED("workflow:failed"),
    WORKFLOW_CANCELLED("workflow:cancelled");

    private final String wireName;

    WorkflowEventType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * The event name as published to external sinks, e.g. {@code step:completed}.
     */
    public String getWireName() {
        return wireName;
    }

    public boolean isStepEvent() {
        return this == STEP_STARTED || this == STEP_COMPLETED || this == STEP_FAILED || this == STEP_RETRYING;
    }

    /**
     * Checks if this event marks the end of an execution.
     */
    public boolean isTerminal() {
        return this == WORKFLOW_COMPLETED || this == WORKFLOW_FAILED || this == WORKFLOW_CANCELLED;
    }
}
