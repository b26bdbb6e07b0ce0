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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named collection of tasks scheduled as a single workflow step.
 *
 * <p>Outputs of a task {@code T} inside group {@code G} land in the workflow outputs
 * under {@code G.T.key}. In {@link ExecutionMode#SEQUENTIAL} mode tasks run in list
 * order and each one sees the outputs of the tasks before it. In
 * {@link ExecutionMode#PARALLEL} mode all tasks resolve their inputs against the
 * outputs as they were before the group started, and the first failure cancels the
 * remaining tasks. Avoid duplicate task names within a group: their outputs would
 * overwrite each other.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class TaskGroup extends AbstractComponent implements Component {

    private final ExecutionMode mode;
    private final List<Task> tasks;

    private TaskGroup(Builder builder) {
        super(builder.name, builder.description);
        this.mode = builder.mode;
        this.tasks = List.copyOf(builder.tasks);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.TASK_GROUP;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public boolean isParallel() {
        return mode == ExecutionMode.PARALLEL;
    }

    @Override
    public String toString() {
        return "TaskGroup{" +
               "name='" + getName() + '\'' +
               ", mode=" + mode +
               ", taskCount=" + tasks.size() +
               '}';
    }

    public enum ExecutionMode {
        SEQUENTIAL, // Tasks run one after another in list order
        PARALLEL    // Tasks run concurrently, fail-fast
    }

    /**
     * Builder for TaskGroup.
     */
    public static class Builder {
        private final String name;
        private String description = "";
        private ExecutionMode mode = ExecutionMode.SEQUENTIAL;
        private final List<Task> tasks = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Task group name cannot be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = Objects.requireNonNull(mode, "Execution mode cannot be null");
            return this;
        }

        public Builder sequential() {
            return mode(ExecutionMode.SEQUENTIAL);
        }

        public Builder parallel() {
            return mode(ExecutionMode.PARALLEL);
        }

        public Builder task(Task task) {
            this.tasks.add(Objects.requireNonNull(task, "Task cannot be null"));
            return this;
        }

        public Builder tasks(List<Task> tasks) {
            tasks.forEach(this::task);
            return this;
        }

        public TaskGroup build() {
            return new TaskGroup(this);
        }
    }
}
