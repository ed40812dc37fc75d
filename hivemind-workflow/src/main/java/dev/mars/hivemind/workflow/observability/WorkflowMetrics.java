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

package dev.mars.hivemind.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the workflow registry.
 *
 * Provides the following instruments:
 * - hivemind.workflow.active (gauge) - Currently running executions
 * - hivemind.workflow.total (counter) - Executions started
 * - hivemind.workflow.completed (counter) - Executions completed successfully
 * - hivemind.workflow.failed (counter) - Failed executions
 * - hivemind.workflow.cancelled (counter) - Cancelled executions
 * - hivemind.workflow.steps.total (counter) - Steps started
 * - hivemind.workflow.steps.failed (counter) - Steps that failed after all attempts
 * - hivemind.workflow.steps.timed_out (counter) - Steps that failed by timeout
 * - hivemind.workflow.rollbacks (counter) - Rollback handler invocations
 * - hivemind.workflow.duration.seconds (histogram) - Execution duration distribution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "hivemind-workflow";

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsTimedOut;
    private final LongCounter rollbacks;

    // Histograms
    private final DoubleHistogram workflowDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("workflow.status");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");
    private static final AttributeKey<String> ROLLBACK_OUTCOME_KEY = AttributeKey.stringKey("rollback.outcome");

    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.get());
    }

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("hivemind.workflow.total")
                .setDescription("Total number of workflow executions started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("hivemind.workflow.completed")
                .setDescription("Number of successfully completed workflow executions")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("hivemind.workflow.failed")
                .setDescription("Number of failed workflow executions")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("hivemind.workflow.cancelled")
                .setDescription("Number of cancelled workflow executions")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("hivemind.workflow.steps.total")
                .setDescription("Total number of workflow steps started")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("hivemind.workflow.steps.failed")
                .setDescription("Number of workflow steps that failed")
                .setUnit("1")
                .build();

        stepsTimedOut = meter.counterBuilder("hivemind.workflow.steps.timed_out")
                .setDescription("Number of workflow steps that exceeded their timeout")
                .setUnit("1")
                .build();

        rollbacks = meter.counterBuilder("hivemind.workflow.rollbacks")
                .setDescription("Number of rollback handlers invoked")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("hivemind.workflow.duration.seconds")
                .setDescription("Workflow execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("hivemind.workflow.active")
                .setDescription("Number of currently running workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.fine("WorkflowMetrics initialized");
    }

    /**
     * Metrics backed by a no-op meter, used when metrics are disabled.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop());
    }

    public void recordWorkflowStarted(String workflowId) {
        workflowsTotal.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowId, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        workflowsCompleted.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        workflowDuration.record(durationSeconds, Attributes.of(WORKFLOW_ID_KEY, workflowId, STATUS_KEY, "completed"));
    }

    public void recordWorkflowFailed(String workflowId, double durationSeconds, String failureReason) {
        activeWorkflows.decrementAndGet();
        workflowsFailed.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId,
                FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown"));
        workflowDuration.record(durationSeconds, Attributes.of(WORKFLOW_ID_KEY, workflowId, STATUS_KEY, "failed"));
    }

    public void recordWorkflowCancelled(String workflowId, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        workflowDuration.record(durationSeconds, Attributes.of(WORKFLOW_ID_KEY, workflowId, STATUS_KEY, "cancelled"));
    }

    public void recordStepStarted(String workflowId) {
        stepsTotal.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    /**
     * @param timedOut whether the final attempt failed by timeout
     */
    public void recordStepFailed(String workflowId, boolean timedOut) {
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId,
                FAILURE_REASON_KEY, timedOut ? "timeout" : "error");
        stepsFailed.add(1, attrs);
        if (timedOut) {
            stepsTimedOut.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        }
    }

    public void recordRollback(String workflowId, boolean succeeded) {
        rollbacks.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId,
                ROLLBACK_OUTCOME_KEY, succeeded ? "succeeded" : "failed"));
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }
}
