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

package dev.mars.weave.workflow.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Weave workflow engine.
 *
 * Provides 10 workflow-specific metrics:
 * - weave.workflow.active (gauge) - Workflow runs currently in progress or paused
 * - weave.workflow.total (counter) - Total workflow runs started
 * - weave.workflow.completed (counter) - Runs that completed
 * - weave.workflow.failed (counter) - Runs that failed
 * - weave.workflow.cancelled (counter) - Runs that were canceled
 * - weave.workflow.steps.total (counter) - Components dispatched, by component type
 * - weave.workflow.steps.failed (counter) - Components that failed, by component type
 * - weave.workflow.triggers.failed (counter) - Trigger waits that failed and were skipped
 * - weave.workflow.duration.seconds (histogram) - Run duration distribution
 * - weave.workflow.components.per_workflow (histogram) - Components executed per run
 *
 * Instances are bound to the {@link OpenTelemetry} they are created with; nothing is
 * registered globally. Use {@link #noop()} when no telemetry backend is configured.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "weave-workflow";

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter triggersFailed;

    // Histograms
    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram componentsPerWorkflow;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> COMPONENT_TYPE_KEY = AttributeKey.stringKey("component.type");
    private static final AttributeKey<String> TRIGGER_NAME_KEY = AttributeKey.stringKey("trigger.name");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Objects.requireNonNull(openTelemetry, "OpenTelemetry cannot be null");
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("weave.workflow.total")
                .setDescription("Total number of workflow runs started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("weave.workflow.completed")
                .setDescription("Number of workflow runs that completed")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("weave.workflow.failed")
                .setDescription("Number of workflow runs that failed")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("weave.workflow.cancelled")
                .setDescription("Number of workflow runs that were canceled")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("weave.workflow.steps.total")
                .setDescription("Total number of workflow components dispatched")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("weave.workflow.steps.failed")
                .setDescription("Number of workflow components that failed")
                .setUnit("1")
                .build();

        triggersFailed = meter.counterBuilder("weave.workflow.triggers.failed")
                .setDescription("Number of trigger waits that failed and were skipped")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("weave.workflow.duration.seconds")
                .setDescription("Workflow run duration in seconds")
                .setUnit("s")
                .build();

        componentsPerWorkflow = meter.histogramBuilder("weave.workflow.components.per_workflow")
                .setDescription("Number of components executed per workflow run")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("weave.workflow.active")
                .setDescription("Number of workflow runs currently in progress or paused")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.fine("WorkflowMetrics initialized");
    }

    /**
     * Metrics bound to a no-op OpenTelemetry instance.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop());
    }

    /**
     * Record a workflow run started.
     */
    public void recordWorkflowStarted(String workflowName) {
        workflowsTotal.add(1, workflowAttributes(workflowName));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Record a workflow run completed.
     */
    public void recordWorkflowCompleted(String workflowName, double durationSeconds, int componentCount) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = workflowAttributes(workflowName);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
        componentsPerWorkflow.record(componentCount, attrs);
    }

    /**
     * Record a workflow run failed.
     */
    public void recordWorkflowFailed(String workflowName, double durationSeconds, String failureReason) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();

        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, workflowAttributes(workflowName));
    }

    /**
     * Record a workflow run canceled.
     */
    public void recordWorkflowCancelled(String workflowName, double durationSeconds) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = workflowAttributes(workflowName);
        workflowsCancelled.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a component dispatched.
     */
    public void recordStepExecuted(String workflowName, String componentType) {
        stepsTotal.add(1, stepAttributes(workflowName, componentType));
    }

    /**
     * Record a component failed.
     */
    public void recordStepFailed(String workflowName, String componentType, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(COMPONENT_TYPE_KEY, componentType)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();

        stepsFailed.add(1, attrs);
    }

    /**
     * Record a trigger wait that failed; the run continues.
     */
    public void recordTriggerFailed(String workflowName, String triggerName) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(TRIGGER_NAME_KEY, triggerName)
                .build();

        triggersFailed.add(1, attrs);
    }

    /**
     * Get the current number of active workflow runs.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowName) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName);
    }

    private static Attributes stepAttributes(String workflowName, String componentType) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName, COMPONENT_TYPE_KEY, componentType);
    }
}
