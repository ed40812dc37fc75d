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

import java.time.Instant;
import java.util.Comparator;

/**
 * Filter and ordering for {@link WorkflowEngine#getHistory(HistoryQuery)}.
 */
public class HistoryQuery {

    public enum SortOrder {
        NEWEST_FIRST,
        OLDEST_FIRST
    }

    private final String workflowId;
    private final WorkflowStatus status;
    private final Instant startedAfter;
    private final Instant startedBefore;
    private final SortOrder sortOrder;
    private final int offset;
    private final int limit;

    private HistoryQuery(Builder builder) {
        if (builder.offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + builder.offset);
        }
        if (builder.limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + builder.limit);
        }
        this.workflowId = builder.workflowId;
        this.status = builder.status;
        this.startedAfter = builder.startedAfter;
        this.startedBefore = builder.startedBefore;
        this.sortOrder = builder.sortOrder;
        this.offset = builder.offset;
        this.limit = builder.limit;
    }

    public static HistoryQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(WorkflowExecution execution) {
        if (workflowId != null && !workflowId.equals(execution.getWorkflowId())) {
            return false;
        }
        if (status != null && status != execution.getStatus()) {
            return false;
        }
        if (startedAfter != null && execution.getStartedAt().isBefore(startedAfter)) {
            return false;
        }
        return startedBefore == null || execution.getStartedAt().isBefore(startedBefore);
    }

    public Comparator<WorkflowExecution> comparator() {
        Comparator<WorkflowExecution> byStart = Comparator.comparing(WorkflowExecution::getStartedAt);
        return sortOrder == SortOrder.OLDEST_FIRST ? byStart : byStart.reversed();
    }

    public SortOrder getSortOrder() {
        return sortOrder;
    }

    public int getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Builder for HistoryQuery.
     */
    public static class Builder {
        private String workflowId;
        private WorkflowStatus status;
        private Instant startedAfter;
        private Instant startedBefore;
        private SortOrder sortOrder = SortOrder.NEWEST_FIRST;
        private int offset;
        private int limit;

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        /**
         * Inclusive lower bound on the execution start time.
         */
        public Builder startedAfter(Instant startedAfter) {
            this.startedAfter = startedAfter;
            return this;
        }

        /**
         * Exclusive upper bound on the execution start time.
         */
        public Builder startedBefore(Instant startedBefore) {
            this.startedBefore = startedBefore;
            return this;
        }

        public Builder sortOrder(SortOrder sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public HistoryQuery build() {
            return new HistoryQuery(this);
        }
    }
}
