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

package dev.mars.hivemind.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A unit of work to be allocated across the agent pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Task {

    public static final double DEFAULT_COMPLEXITY = 0.5;

    @JsonProperty("id")
    private final String id;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("requiredCapabilities")
    private final Set<String> requiredCapabilities;

    @JsonProperty("priority")
    private final TaskPriority priority;

    @JsonProperty("complexity")
    private final double complexity;

    @JsonCreator
    public Task(@JsonProperty("id") String id,
                @JsonProperty("description") String description,
                @JsonProperty("requiredCapabilities") Collection<String> requiredCapabilities,
                @JsonProperty("priority") TaskPriority priority,
                @JsonProperty("complexity") Double complexity) {
        this.id = Objects.requireNonNull(id, "Task ID cannot be null");
        this.description = description != null ? description : "";
        this.requiredCapabilities = requiredCapabilities != null
                ? Set.copyOf(new LinkedHashSet<>(requiredCapabilities))
                : Set.of();
        this.priority = priority != null ? priority : TaskPriority.MEDIUM;
        double value = complexity != null ? complexity : DEFAULT_COMPLEXITY;
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Task complexity must be within [0, 1]: " + value);
        }
        this.complexity = value;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public double getComplexity() {
        return complexity;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task task = (Task) o;
        return Double.compare(task.complexity, complexity) == 0 &&
               Objects.equals(id, task.id) &&
               Objects.equals(description, task.description) &&
               Objects.equals(requiredCapabilities, task.requiredCapabilities) &&
               priority == task.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, requiredCapabilities, priority, complexity);
    }

    @Override
    public String toString() {
        return "Task{" +
               "id='" + id + '\'' +
               ", priority=" + priority +
               ", complexity=" + complexity +
               ", requiredCapabilities=" + requiredCapabilities +
               '}';
    }

    /**
     * Builder for Task.
     */
    public static class Builder {
        private final String id;
        private String description = "";
        private Set<String> requiredCapabilities = new LinkedHashSet<>();
        private TaskPriority priority = TaskPriority.MEDIUM;
        private double complexity = DEFAULT_COMPLEXITY;

        private Builder(String id) {
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder requiredCapabilities(Collection<String> capabilities) {
            this.requiredCapabilities = new LinkedHashSet<>(capabilities);
            return this;
        }

        public Builder requiredCapability(String capability) {
            this.requiredCapabilities.add(capability);
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder complexity(double complexity) {
            this.complexity = complexity;
            return this;
        }

        public Task build() {
            return new Task(id, description, requiredCapabilities, priority, complexity);
        }
    }
}
