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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a workflow's step graph.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();
    private List<String> cycle = List.of();

    public void addError(String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, null, message));
    }

    public void addError(String stepId, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, stepId, message));
    }

    public void addWarning(String stepId, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, stepId, message));
    }

    void setCycle(List<String> cycle) {
        this.cycle = List.copyOf(cycle);
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    /**
     * The dependency cycle found during validation, first step repeated at the end
     * (for example {@code [a, b, a]}), or an empty list.
     */
    public List<String> getCycle() {
        return cycle;
    }

    public boolean hasCycle() {
        return !cycle.isEmpty();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() +
               (hasCycle() ? ", cycle=" + cycle : "") +
               "}";
    }

    /**
     * A single validation finding, optionally tied to a step.
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String stepId;
        private final String message;

        public ValidationIssue(Severity severity, String stepId, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.stepId = stepId;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getStepId() {
            return stepId;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(stepId, that.stepId) &&
                   message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, stepId, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(severity.name());
            if (stepId != null) {
                sb.append(" [").append(stepId).append("]");
            }
            return sb.append(": ").append(message).toString();
        }
    }
}
