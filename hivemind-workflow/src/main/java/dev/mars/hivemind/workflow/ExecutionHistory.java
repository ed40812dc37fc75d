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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory log of terminal executions. When full, the oldest entry is evicted.
 * Safe for concurrent use by many executions.
 */
public class ExecutionHistory {

    private final int maxEntries;
    private final Deque<WorkflowExecution> entries = new ArrayDeque<>();

    /**
     * @param maxEntries capacity; 0 keeps nothing
     */
    public ExecutionHistory(int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("Max entries cannot be negative: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public synchronized void add(WorkflowExecution execution) {
        Objects.requireNonNull(execution, "Execution cannot be null");
        if (maxEntries == 0) {
            return;
        }
        while (entries.size() >= maxEntries) {
            entries.removeFirst();
        }
        entries.addLast(execution);
    }

    public synchronized Optional<WorkflowExecution> find(String executionId) {
        for (WorkflowExecution execution : entries) {
            if (execution.getExecutionId().equals(executionId)) {
                return Optional.of(execution);
            }
        }
        return Optional.empty();
    }

    public synchronized List<WorkflowExecution> query(HistoryQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        List<WorkflowExecution> matches = new ArrayList<>();
        // newest appended last; walk backwards so equal start times keep newest-first order
        Iterator<WorkflowExecution> it = query.getSortOrder() == HistoryQuery.SortOrder.NEWEST_FIRST
                ? entries.descendingIterator()
                : entries.iterator();
        while (it.hasNext()) {
            WorkflowExecution execution = it.next();
            if (query.matches(execution)) {
                matches.add(execution);
            }
        }
        matches.sort(query.comparator());

        int from = Math.min(query.getOffset(), matches.size());
        int to = query.getLimit() > 0 ? Math.min(from + query.getLimit(), matches.size()) : matches.size();
        return List.copyOf(matches.subList(from, to));
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
