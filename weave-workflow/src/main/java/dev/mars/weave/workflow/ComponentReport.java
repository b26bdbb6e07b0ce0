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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Point-in-time summary of one component: identity, state, timing, outputs and error.
 *
 * <p>Task groups report their tasks as children and subflows report the components
 * their nested workflow has completed. A component that has not run yet reports
 * {@link RunState#NOT_STARTED} with no timing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class ComponentReport {

    private final String id;
    private final String name;
    private final String description;
    private final ComponentType type;
    private final RunState state;
    private final Duration executionTime;
    private final Map<String, Object> outputs;
    private final List<ComponentReport> childReports;
    private final Throwable error;

    private ComponentReport(Component component, ExecutionDetails details, Map<String, Object> outputs,
                            List<ComponentReport> childReports, Throwable error) {
        this.id = component.getId();
        this.name = component.getName();
        this.description = component.getDescription();
        this.type = component.getType();
        this.state = details != null ? details.getState() : RunState.NOT_STARTED;
        this.executionTime = details != null ? details.getExecutionTime() : null;
        this.outputs = outputs != null ? Collections.unmodifiableMap(outputs) : Map.of();
        this.childReports = List.copyOf(childReports);
        this.error = error;
    }

    /**
     * Builds the report of a component from its current execution details.
     */
    public static ComponentReport of(Component component) {
        Objects.requireNonNull(component, "Component cannot be null");
        ExecutionDetails details = component.getExecutionDetails().orElse(null);

        if (component instanceof Subflow) {
            Workflow nested = ((Subflow) component).getWorkflow();
            Throwable error = details != null ? details.getError().orElse(null) : null;
            return new ComponentReport(component, details, nested.getOutputs(),
                    reportsOf(nested.getComponentsManager().getCompletedComponents()), error);
        }

        List<ComponentReport> children = component instanceof TaskGroup
                ? reportsOf(((TaskGroup) component).getTasks())
                : List.of();
        if (details == null) {
            return new ComponentReport(component, null, null, children, null);
        }
        return new ComponentReport(component, details, details.getOutputs(), children,
                details.getError().orElse(null));
    }

    static List<ComponentReport> reportsOf(List<? extends Component> components) {
        return components.stream()
                .map(ComponentReport::of)
                .collect(Collectors.toList());
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

    public ComponentType getType() {
        return type;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Empty when the component has not run.
     */
    public Optional<Duration> getExecutionTime() {
        return Optional.ofNullable(executionTime);
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public List<ComponentReport> getChildReports() {
        return childReports;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public String printedReport(boolean compact, boolean showOutputs) {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, compact, showOutputs, "");
        return sb.toString();
    }

    void appendTo(StringBuilder sb, boolean compact, boolean showOutputs, String indent) {
        sb.append(indent).append("Type: ").append(type.getDisplayName()).append('\n');
        sb.append(indent).append("ID: ").append(id).append('\n');
        sb.append(indent).append("Name: ").append(name).append('\n');
        sb.append(indent).append("Description: ").append(description).append('\n');
        sb.append(indent).append("State: ").append(state).append('\n');
        if (executionTime != null) {
            sb.append(indent).append("Execution Time: ").append(WorkflowReport.formatSeconds(executionTime))
              .append(" sec\n");
        }
        if (showOutputs && !outputs.isEmpty()) {
            sb.append(indent).append("Outputs: ").append(outputs).append('\n');
        }
        if (error != null) {
            sb.append(indent).append("Error: ").append(error.getMessage()).append('\n');
        }
        if (!childReports.isEmpty()) {
            sb.append(indent).append("Child Reports:\n");
            for (ComponentReport child : childReports) {
                if (compact) {
                    sb.append(indent).append("  - ").append(child.name)
                      .append(" (").append(child.state).append(")\n");
                } else {
                    child.appendTo(sb, false, showOutputs, indent + "   ");
                }
            }
        }
    }

    @Override
    public String toString() {
        return "ComponentReport{" +
               "name='" + name + '\'' +
               ", type=" + type +
               ", state=" + state +
               ", children=" + childReports.size() +
               '}';
    }
}
