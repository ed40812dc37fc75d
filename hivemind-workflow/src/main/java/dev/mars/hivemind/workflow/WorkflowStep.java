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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A named step of a workflow together with the steps it depends on.
 * Timeout and retry settings left unset fall back to the registry defaults.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowStep {

    private final String id;
    private final String name;
    private final Set<String> dependencies;
    private final StepHandler handler;
    private final RollbackHandler rollback;
    private final Long timeoutMs;
    private final Integer retries;
    private final Long retryDelayMs;

    private WorkflowStep(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step ID cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.handler = Objects.requireNonNull(builder.handler, "Handler cannot be null for step " + builder.id);
        this.rollback = builder.rollback;
        if (builder.timeoutMs != null && builder.timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be positive for step " + builder.id);
        }
        if (builder.retries != null && builder.retries < 0) {
            throw new IllegalArgumentException("Retries cannot be negative for step " + builder.id);
        }
        if (builder.retryDelayMs != null && builder.retryDelayMs < 0) {
            throw new IllegalArgumentException("Retry delay cannot be negative for step " + builder.id);
        }
        this.timeoutMs = builder.timeoutMs;
        this.retries = builder.retries;
        this.retryDelayMs = builder.retryDelayMs;
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

    public Set<String> getDependencies() {
        return dependencies;
    }

    public StepHandler getHandler() {
        return handler;
    }

    public Optional<RollbackHandler> getRollback() {
        return Optional.ofNullable(rollback);
    }

    public OptionalLong getTimeoutMs() {
        return timeoutMs != null ? OptionalLong.of(timeoutMs) : OptionalLong.empty();
    }

    public OptionalInt getRetries() {
        return retries != null ? OptionalInt.of(retries) : OptionalInt.empty();
    }

    public OptionalLong getRetryDelayMs() {
        return retryDelayMs != null ? OptionalLong.of(retryDelayMs) : OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
               "id='" + id + '\'' +
               ", dependencies=" + dependencies +
               ", timeoutMs=" + timeoutMs +
               ", retries=" + retries +
               ", rollback=" + (rollback != null) +
               '}';
    }

    /**
     * Builder for WorkflowStep.
     */
    public static class Builder {
        private final String id;
        private String name;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private StepHandler handler;
        private RollbackHandler rollback;
        private Long timeoutMs;
        private Integer retries;
        private Long retryDelayMs;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            Collections.addAll(this.dependencies, stepIds);
            return this;
        }

        public Builder dependsOn(Collection<String> stepIds) {
            this.dependencies.addAll(stepIds);
            return this;
        }

        public Builder handler(StepHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder rollback(RollbackHandler rollback) {
            this.rollback = rollback;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(this);
        }
    }
}
