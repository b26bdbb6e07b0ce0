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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A nested workflow run to completion as a single component of its parent.
 *
 * <p>The parent does not dispatch anything else until the nested workflow finishes.
 * Its final outputs are merged into the parent without an extra prefix; the task
 * names inside the nested workflow already namespace them. A failed nested run
 * fails the parent.</p>
 *
 * <p>Identity and execution details are those of the wrapped workflow.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class Subflow implements Component {

    private final Workflow workflow;

    public Subflow(Workflow workflow) {
        this.workflow = Objects.requireNonNull(workflow, "Nested workflow cannot be null");
    }

    public static Subflow of(Workflow workflow) {
        return new Subflow(workflow);
    }

    /**
     * Builds a nested workflow with default dependencies from a plain component list.
     */
    public static Subflow of(String name, String description, List<Component> components) {
        return new Subflow(Workflow.builder()
                .name(name)
                .description(description)
                .components(components)
                .build());
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    @Override
    public String getId() {
        return workflow.getId();
    }

    @Override
    public String getName() {
        return workflow.getName();
    }

    @Override
    public String getDescription() {
        return workflow.getDescription();
    }

    @Override
    public ComponentType getType() {
        return ComponentType.SUBFLOW;
    }

    @Override
    public Optional<ExecutionDetails> getExecutionDetails() {
        return workflow.getExecutionDetails();
    }

    @Override
    public String toString() {
        return "Subflow{name='" + getName() + "'}";
    }
}
