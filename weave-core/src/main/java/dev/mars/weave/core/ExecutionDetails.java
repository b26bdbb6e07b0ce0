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

package dev.mars.weave.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of how a workflow or one of its components executed:
 * resulting state, timing, outputs and the error that ended it, if any.
 *
 * <p>Outputs may legitimately contain {@code null} values produced by task bodies,
 * so they are copied into an unmodifiable {@link LinkedHashMap} rather than
 * {@link Map#copyOf(Map)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ExecutionDetails {

    private final RunState state;
    private final Instant startedAt;
    private final Instant endedAt;
    private final Duration executionTime;
    private final Map<String, Object> outputs;
    private final Throwable error;

    public ExecutionDetails(RunState state, Instant startedAt, Instant endedAt, Duration executionTime,
                            Map<String, Object> outputs, Throwable error) {
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.executionTime = executionTime != null ? executionTime : Duration.ZERO;
        this.outputs = outputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs))
                : Map.of();
        this.error = error;
    }

    /**
     * Details for a successful execution measured by the given timer.
     */
    public static ExecutionDetails completed(ExecutionTimer timer, Map<String, Object> outputs) {
        return fromTimer(RunState.COMPLETED, timer, outputs, null);
    }

    /**
     * Details for a failed execution measured by the given timer.
     */
    public static ExecutionDetails failed(ExecutionTimer timer, Map<String, Object> outputs, Throwable error) {
        return fromTimer(RunState.FAILED, timer, outputs, error);
    }

    public static ExecutionDetails fromTimer(RunState state, ExecutionTimer timer,
                                             Map<String, Object> outputs, Throwable error) {
        Objects.requireNonNull(timer, "Timer cannot be null");
        return new ExecutionDetails(
                state,
                timer.getStartTime().orElse(null),
                timer.getEndTime().orElse(null),
                timer.getDuration().orElse(Duration.ZERO),
                outputs,
                error
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public RunState getState() {
        return state;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccessful() {
        return state == RunState.COMPLETED;
    }

    @Override
    public String toString() {
        return "ExecutionDetails{" +
               "state=" + state +
               ", startedAt=" + startedAt +
               ", endedAt=" + endedAt +
               ", executionTime=" + executionTime +
               ", outputCount=" + outputs.size() +
               (error != null ? ", error=" + error.getMessage() : "") +
               '}';
    }

    /**
     * Builder for ExecutionDetails.
     */
    public static class Builder {
        private RunState state = RunState.NOT_STARTED;
        private Instant startedAt;
        private Instant endedAt;
        private Duration executionTime = Duration.ZERO;
        private Map<String, Object> outputs = Map.of();
        private Throwable error;

        public Builder state(RunState state) {
            this.state = state;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public Builder executionTime(Duration executionTime) {
            this.executionTime = executionTime;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public ExecutionDetails build() {
            return new ExecutionDetails(state, startedAt, endedAt, executionTime, outputs, error);
        }
    }
}
