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

package dev.mars.weave.workflow;

import dev.mars.weave.core.ExecutionDetails;
import dev.mars.weave.core.RunState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summary of a workflow run built from the components it has completed so far.
 *
 * <p>The total execution time is the sum of the completed components' own times, so
 * time spent paused between components is not counted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class WorkflowReport {

    private final String id;
    private final String name;
    private final String description;
    private final RunState state;
    private final Duration executionTime;
    private final Map<String, Object> outputs;
    private final List<ComponentReport> componentReports;
    private final Throwable error;

    private WorkflowReport(Workflow workflow, List<Component> completed) {
        this.id = workflow.getId();
        this.name = workflow.getName();
        this.description = workflow.getDescription();
        this.state = workflow.getState();
        this.executionTime = completed.stream()
                .map(Component::getExecutionDetails)
                .flatMap(Optional::stream)
                .map(ExecutionDetails::getExecutionTime)
                .reduce(Duration.ZERO, Duration::plus);
        this.outputs = workflow.getOutputs();
        this.componentReports = ComponentReport.reportsOf(completed);
        this.error = workflow.getExecutionDetails().flatMap(ExecutionDetails::getError).orElse(null);
    }

    public static WorkflowReport of(Workflow workflow) {
        return new WorkflowReport(workflow, workflow.getComponentsManager().getCompletedComponents());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public RunState getState() {
        return state;
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public List<ComponentReport> getComponentReports() {
        return componentReports;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Renders the report as indented text.
     *
     * @param compact list child components as {@code - name (STATE)} instead of in full
     * @param showOutputs include output maps
     */
    public String printedReport(boolean compact, boolean showOutputs) {
        StringBuilder sb = new StringBuilder("Workflow Report:\n");
        sb.append("ID: ").append(id).append('\n');
        sb.append("Name: ").append(name).append('\n');
        sb.append("Description: ").append(description).append('\n');
        sb.append("State: ").append(state).append('\n');
        sb.append("Total Execution Time: ").append(formatSeconds(executionTime)).append(" sec\n");
        if (showOutputs && !outputs.isEmpty()) {
            sb.append("Workflow Outputs: ").append(outputs).append('\n');
        }
        if (error != null) {
            sb.append("Workflow Error: ").append(error.getMessage()).append('\n');
        }
        if (!componentReports.isEmpty()) {
            sb.append("Component Reports:\n");
            for (ComponentReport report : componentReports) {
                report.appendTo(sb, compact, showOutputs, "   ");
            }
        }
        return sb.toString();
    }

    public String printedReport() {
        return printedReport(false, true);
    }

    static String formatSeconds(Duration duration) {
        return String.format("%.2f", duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public String toString() {
        return "WorkflowReport{" +
               "name='" + name + '\'' +
               ", state=" + state +
               ", components=" + componentReports.size() +
               '}';
    }
}
