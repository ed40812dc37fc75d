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

import java.util.Map;
import java.util.OptionalLong;

/**
 * Per-execution options supplied to {@link WorkflowEngine#execute(String, Object, ExecutionOptions)}.
 */
public class ExecutionOptions {

    private static final ExecutionOptions DEFAULTS = builder().build();

    private final Map<String, String> metadata;
    private final Long defaultStepTimeoutMs;

    private ExecutionOptions(Builder builder) {
        this.metadata = builder.metadata != null ? Map.copyOf(builder.metadata) : Map.of();
        if (builder.defaultStepTimeoutMs != null && builder.defaultStepTimeoutMs <= 0) {
            throw new IllegalArgumentException("Default step timeout must be positive");
        }
        this.defaultStepTimeoutMs = builder.defaultStepTimeoutMs;
    }

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Caller metadata copied onto the execution and into every step context.
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Overrides the registry default timeout for steps that do not declare their own.
     */
    public OptionalLong getDefaultStepTimeoutMs() {
        return defaultStepTimeoutMs != null ? OptionalLong.of(defaultStepTimeoutMs) : OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
               "metadata=" + metadata +
               ", defaultStepTimeoutMs=" + defaultStepTimeoutMs +
               '}';
    }

    /**
     * Builder for ExecutionOptions.
     */
    public static class Builder {
        private Map<String, String> metadata = Map.of();
        private Long defaultStepTimeoutMs;

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder defaultStepTimeoutMs(long defaultStepTimeoutMs) {
            this.defaultStepTimeoutMs = defaultStepTimeoutMs;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
