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

import dev.mars.hivemind.core.exceptions.HivemindException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a workflow definition is structurally invalid and cannot be registered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowValidationException extends HivemindException {

    private final String workflowId;
    private final List<ValidationResult.ValidationIssue> issues;
    private final List<String> cycle;

    public WorkflowValidationException(String workflowId, String message) {
        super(message);
        this.workflowId = workflowId;
        this.issues = List.of();
        this.cycle = List.of();
    }

    public WorkflowValidationException(String workflowId, ValidationResult result) {
        super(buildMessage(workflowId, result.getErrors()));
        this.workflowId = workflowId;
        this.issues = result.getErrors();
        this.cycle = result.getCycle();
    }

    private static String buildMessage(String workflowId, List<ValidationResult.ValidationIssue> errors) {
        return "Workflow '" + workflowId + "' is invalid: " +
               errors.stream().map(ValidationResult.ValidationIssue::toString).collect(Collectors.joining("; "));
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<ValidationResult.ValidationIssue> getIssues() {
        return issues;
    }

    /**
     * The offending dependency cycle, e.g. {@code [a, b, a]}, or empty if the failure was not a cycle.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
