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

import dev.mars.hivemind.core.exceptions.NotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Registers DAG workflow definitions and executes them.
 */
public interface WorkflowEngine {

    /**
     * Validates and stores a definition.
     *
     * @param definition the workflow definition to register
     * @throws WorkflowValidationException if a step id is duplicated, a dependency cannot be
     *         resolved, the steps form a cycle, or a workflow with the same id is already registered
     */
    void register(WorkflowDefinition definition) throws WorkflowValidationException;

    /**
     * Removes a definition. Executions already running are not affected.
     *
     * @param workflowId the workflow id
     * @return true if a definition was removed
     */
    boolean unregister(String workflowId);

    Optional<WorkflowDefinition> get(String workflowId);

    /**
     * Lists registered definitions in registration order.
     */
    List<WorkflowDefinition> list(WorkflowQuery query);

    /**
     * Executes a registered workflow with default options.
     *
     * @see #execute(String, Object, ExecutionOptions)
     */
    CompletableFuture<WorkflowExecution> execute(String workflowId, Object input) throws NotFoundException;

    /**
     * Executes a registered workflow. The returned future completes normally with a terminal
     * execution whatever the outcome of the steps; it completes exceptionally only with
     * {@link IllegalStateException} when the engine is shut down or at capacity.
     *
     * @param workflowId the workflow id
     * @param input passed to every step handler
     * @param options per-execution options
     * @return future containing the terminal execution
     * @throws NotFoundException if no workflow with that id is registered
     */
    CompletableFuture<WorkflowExecution> execute(String workflowId, Object input, ExecutionOptions options)
            throws NotFoundException;

    /**
     * Requests cancellation of a running execution. Steps in flight are allowed to finish
     * but no further steps are started.
     *
     * @param executionId the execution ID
     * @return false if the execution is unknown, already terminal or already stopping
     */
    boolean cancel(String executionId);

    /**
     * Looks up a running execution, then the history.
     */
    Optional<WorkflowExecution> getExecution(String executionId);

    /**
     * All recorded executions, newest first.
     */
    List<WorkflowExecution> getHistory();

    List<WorkflowExecution> getHistory(HistoryQuery query);

    /**
     * Snapshots of the executions currently running.
     */
    List<WorkflowExecution> getActiveExecutions();

    int getActiveExecutionCount();

    /**
     * Drops the execution history. Definitions and running executions are kept.
     */
    void clear();

    /**
     * Shuts down the engine and releases its threads.
     */
    void shutdown();
}
