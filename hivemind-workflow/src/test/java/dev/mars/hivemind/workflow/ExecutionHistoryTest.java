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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExecutionHistory}.
 */
class ExecutionHistoryTest {

    private static final Instant BASE = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    void testEvictsOldestWhenFull() {
        ExecutionHistory history = new ExecutionHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.add(execution("e" + i, "wf", WorkflowStatus.COMPLETED, i));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.find("e1")).isEmpty();
        assertThat(history.find("e2")).isEmpty();
        assertThat(history.find("e5")).isPresent();
        assertThat(ids(history.query(HistoryQuery.all()))).containsExactly("e5", "e4", "e3");
    }

    @Test
    void testZeroCapacityKeepsNothing() {
        ExecutionHistory history = new ExecutionHistory(0);
        history.add(execution("e1", "wf", WorkflowStatus.COMPLETED, 1));

        assertThat(history.size()).isZero();
        assertThat(history.find("e1")).isEmpty();
    }

    @Test
    void testNegativeCapacityRejected() {
        assertThatThrownBy(() -> new ExecutionHistory(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testQueryFiltersAndPages() {
        ExecutionHistory history = new ExecutionHistory(10);
        history.add(execution("a1", "alpha", WorkflowStatus.COMPLETED, 1));
        history.add(execution("b1", "beta", WorkflowStatus.FAILED, 2));
        history.add(execution("a2", "alpha", WorkflowStatus.FAILED, 3));
        history.add(execution("a3", "alpha", WorkflowStatus.COMPLETED, 4));

        assertThat(ids(history.query(HistoryQuery.builder().workflowId("alpha").build())))
                .containsExactly("a3", "a2", "a1");
        assertThat(ids(history.query(HistoryQuery.builder().status(WorkflowStatus.FAILED).build())))
                .containsExactly("a2", "b1");
        assertThat(ids(history.query(HistoryQuery.builder()
                .sortOrder(HistoryQuery.SortOrder.OLDEST_FIRST).offset(1).limit(2).build())))
                .containsExactly("b1", "a2");
        assertThat(ids(history.query(HistoryQuery.builder()
                .startedAfter(BASE.plusSeconds(2))
                .startedBefore(BASE.plusSeconds(4))
                .build())))
                .containsExactly("a2", "b1");
        assertThat(history.query(HistoryQuery.builder().offset(10).build())).isEmpty();
    }

    @Test
    void testConcurrentAppendsStayBounded() throws Exception {
        ExecutionHistory history = new ExecutionHistory(50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 400; i++) {
                int n = i;
                pool.execute(() -> history.add(execution("e" + n, "wf", WorkflowStatus.COMPLETED, n)));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(history.size()).isEqualTo(50);
        assertThat(history.query(HistoryQuery.all())).hasSize(50);
    }

    @Test
    void testClear() {
        ExecutionHistory history = new ExecutionHistory(5);
        history.add(execution("e1", "wf", WorkflowStatus.CANCELLED, 1));
        history.clear();

        assertThat(history.size()).isZero();
    }

    private static WorkflowExecution execution(String id, String workflowId, WorkflowStatus status, int offsetSeconds) {
        Instant started = BASE.plusSeconds(offsetSeconds);
        return new WorkflowExecution(id, workflowId, "1.0.0", status, Map.of(), started,
                started.plusMillis(500), null, null, null, null, Map.of(), false);
    }

    private static List<String> ids(List<WorkflowExecution> executions) {
        List<String> ids = new ArrayList<>();
        executions.forEach(execution -> ids.add(execution.getExecutionId()));
        return ids;
    }
}
