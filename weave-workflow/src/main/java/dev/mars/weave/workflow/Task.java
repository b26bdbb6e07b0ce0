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

import dev.mars.weave.core.exceptions.MissingExecutionLogicException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named unit of work taking resolved inputs and producing named outputs.
 *
 * <p>Static input values of the form {@code "{Name.Key}"} are references to outputs
 * of earlier components and are resolved by the workflow at dispatch time, see
 * {@link InputResolver}. Every other value is passed to the executor as is.</p>
 *
 * <pre>
 * Task doubler = Task.builder("B")
 *         .input("in", "{A.v}")
 *         .executor(inputs -&gt; Map.of("out", (Integer) inputs.get("in") * 2))
 *         .build();
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class Task extends AbstractComponent implements Component {

    private final Map<String, Object> inputs;
    private final TaskExecutor executor;

    private Task(Builder builder) {
        super(builder.name, builder.description);
        this.inputs = Collections.unmodifiableMap(withoutNullValues(builder.inputs));
        this.executor = builder.executor;
    }

    public static Task of(String name, TaskExecutor executor) {
        return builder(name).executor(executor).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static Builder builder() {
        return new Builder(null);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.TASK;
    }

    /**
     * Declared inputs, with references still unresolved.
     */
    public Map<String, Object> getInputs() {
        return inputs;
    }

    public boolean hasExecutor() {
        return executor != null;
    }

    /**
     * Runs the executor with the declared inputs overlaid by {@code runtimeInputs}.
     * Runtime values take precedence. Declared references are never passed on as
     * literal strings and {@code null} values are dropped, so a missing reference
     * shows up as an absent key.
     *
     * @param runtimeInputs inputs resolved by the workflow, may be null
     * @return the executor's outputs, never null
     * @throws MissingExecutionLogicException if the task was built without an executor
     * @throws Exception whatever the executor throws
     */
    public Map<String, Object> execute(Map<String, Object> runtimeInputs) throws Exception {
        if (executor == null) {
            throw new MissingExecutionLogicException(getName());
        }

        Map<String, Object> merged = new HashMap<>();
        inputs.forEach((key, value) -> {
            if (!InputResolver.isReference(value)) {
                merged.put(key, value);
            }
        });
        if (runtimeInputs != null) {
            merged.putAll(runtimeInputs);
        }

        Map<String, Object> outputs = executor.execute(withoutNullValues(merged));
        return outputs != null ? outputs : Map.of();
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                result.put(key, value);
            }
        });
        return result;
    }

    @Override
    public String toString() {
        return "Task{" +
               "name='" + getName() + '\'' +
               ", inputs=" + inputs.keySet() +
               '}';
    }

    /**
     * Builder for Task. The name defaults to {@code "Task"} when not set.
     */
    public static class Builder {
        private String name;
        private String description = "";
        private final Map<String, Object> inputs = new LinkedHashMap<>();
        private TaskExecutor executor;

        private Builder(String name) {
            this.name = name;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(String key, Object value) {
            this.inputs.put(Objects.requireNonNull(key, "Input key cannot be null"), value);
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            if (inputs != null) {
                this.inputs.putAll(inputs);
            }
            return this;
        }

        public Builder executor(TaskExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Task build() {
            if (name == null) {
                name = Task.class.getSimpleName();
            }
            return new Task(this);
        }
    }
}
