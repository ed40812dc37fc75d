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

import dev.mars.hivemind.config.HivemindConfiguration;

/**
 * Immutable registry settings. Built directly or from a {@link HivemindConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowRegistryOptions {

    public static final long DEFAULT_STEP_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_STEP_RETRIES = 0;
    public static final long DEFAULT_RETRY_DELAY_MS = 1_000;
    public static final int DEFAULT_MAX_CONCURRENT_EXECUTIONS = 10;
    public static final int DEFAULT_MAX_HISTORY_ENTRIES = 1_000;

    private final long defaultStepTimeoutMs;
    private final int defaultRetries;
    private final long defaultRetryDelayMs;
    private final int maxConcurrentExecutions;
    private final int maxHistoryEntries;
    private final boolean historyEnabled;
    private final boolean metricsEnabled;

    private WorkflowRegistryOptions(Builder builder) {
        if (builder.defaultStepTimeoutMs <= 0) {
            throw new IllegalArgumentException("Default step timeout must be positive: " + builder.defaultStepTimeoutMs);
        }
        if (builder.defaultRetries < 0) {
            throw new IllegalArgumentException("Default retries cannot be negative: " + builder.defaultRetries);
        }
        if (builder.defaultRetryDelayMs < 0) {
            throw new IllegalArgumentException("Default retry delay cannot be negative: " + builder.defaultRetryDelayMs);
        }
        if (builder.maxConcurrentExecutions <= 0) {
            throw new IllegalArgumentException("Max concurrent executions must be positive: " + builder.maxConcurrentExecutions);
        }
        if (builder.maxHistoryEntries < 0) {
            throw new IllegalArgumentException("Max history entries cannot be negative: " + builder.maxHistoryEntries);
        }
        this.defaultStepTimeoutMs = builder.defaultStepTimeoutMs;
        this.defaultRetries = builder.defaultRetries;
        this.defaultRetryDelayMs = builder.defaultRetryDelayMs;
        this.maxConcurrentExecutions = builder.maxConcurrentExecutions;
        this.maxHistoryEntries = builder.maxHistoryEntries;
        this.historyEnabled = builder.historyEnabled;
        this.metricsEnabled = builder.metricsEnabled;
    }

    public static WorkflowRegistryOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkflowRegistryOptions fromConfiguration(HivemindConfiguration configuration) {
        return builder()
                .defaultStepTimeoutMs(configuration.getStepTimeoutMs())
                .defaultRetries(configuration.getStepRetries())
                .defaultRetryDelayMs(configuration.getStepRetryDelayMs())
                .maxConcurrentExecutions(configuration.getMaxConcurrentExecutions())
                .maxHistoryEntries(configuration.getHistoryMaxEntries())
                .historyEnabled(configuration.isHistoryEnabled())
                .metricsEnabled(configuration.isMetricsEnabled())
                .build();
    }

    public long getDefaultStepTimeoutMs() {
        return defaultStepTimeoutMs;
    }

    public int getDefaultRetries() {
        return defaultRetries;
    }

    public long getDefaultRetryDelayMs() {
        return defaultRetryDelayMs;
    }

    public int getMaxConcurrentExecutions() {
        return maxConcurrentExecutions;
    }

    public int getMaxHistoryEntries() {
        return maxHistoryEntries;
    }

    public boolean isHistoryEnabled() {
        return historyEnabled;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    @Override
    public String toString() {
        return "WorkflowRegistryOptions{" +
               "defaultStepTimeoutMs=" + defaultStepTimeoutMs +
               ", defaultRetries=" + defaultRetries +
               ", defaultRetryDelayMs=" + defaultRetryDelayMs +
               ", maxConcurrentExecutions=" + maxConcurrentExecutions +
               ", maxHistoryEntries=" + maxHistoryEntries +
               ", historyEnabled=" + historyEnabled +
               ", metricsEnabled=" + metricsEnabled +
               '}';
    }

    /**
     * Builder for WorkflowRegistryOptions.
     */
    public static class Builder {
        private long defaultStepTimeoutMs = DEFAULT_STEP_TIMEOUT_MS;
        private int defaultRetries = DEFAULT_STEP_RETRIES;
        private long defaultRetryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private int maxConcurrentExecutions = DEFAULT_MAX_CONCURRENT_EXECUTIONS;
        private int maxHistoryEntries = DEFAULT_MAX_HISTORY_ENTRIES;
        private boolean historyEnabled = true;
        private boolean metricsEnabled = true;

        public Builder defaultStepTimeoutMs(long defaultStepTimeoutMs) {
            this.defaultStepTimeoutMs = defaultStepTimeoutMs;
            return this;
        }

        public Builder defaultRetries(int defaultRetries) {
            this.defaultRetries = defaultRetries;
            return this;
        }

        public Builder defaultRetryDelayMs(long defaultRetryDelayMs) {
            this.defaultRetryDelayMs = defaultRetryDelayMs;
            return this;
        }

        public Builder maxConcurrentExecutions(int maxConcurrentExecutions) {
            this.maxConcurrentExecutions = maxConcurrentExecutions;
            return this;
        }

        public Builder maxHistoryEntries(int maxHistoryEntries) {
            this.maxHistoryEntries = maxHistoryEntries;
            return this;
        }

        public Builder historyEnabled(boolean historyEnabled) {
            this.historyEnabled = historyEnabled;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public WorkflowRegistryOptions build() {
            return new WorkflowRegistryOptions(this);
        }
    }
}
