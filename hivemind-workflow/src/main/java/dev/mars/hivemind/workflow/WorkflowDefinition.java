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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable description of a workflow: identity, version and its ordered steps.
 * Structural validity (unique ids, resolvable dependencies, no cycles) is checked
 * when the definition is registered, not when it is built.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final Set<String> tags;
    private final List<WorkflowStep> steps;
    private final Function<Map<String, Object>, Object> outputTransform;

    private WorkflowDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID cannot be null");
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.version = Objects.requireNonNull(builder.version, "Workflow version cannot be null");
        this.description = builder.description;
        this.tags = Set.copyOf(builder.tags);
        this.steps = List.copyOf(builder.steps);
        this.outputTransform = builder.outputTransform;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Set<String> getTags() {
        return tags;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public Optional<WorkflowStep> getStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }

    /**
     * Maps the outputs of succeeded steps to the execution output. When absent the
     * output of the last declared step is used.
     */
    public Optional<Function<Map<String, Object>, Object>> getOutputTransform() {
        return Optional.ofNullable(outputTransform);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               ", tags=" + tags +
               '}';
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static class Builder {
        private final String id;
        private String name;
        private String version = "1.0.0";
        private String description;
        private Set<String> tags = Set.of();
        private final List<WorkflowStep> steps = new ArrayList<>();
        private Function<Map<String, Object>, Object> outputTransform;

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = Set.of(tags);
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = Set.copyOf(tags);
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(Collection<WorkflowStep> steps) {
            steps.forEach(this::step);
            return this;
        }

        public Builder outputTransform(Function<Map<String, Object>, Object> outputTransform) {
            this.outputTransform = outputTransform;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
