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

package dev.mars.weave.core.exceptions;

import dev.mars.weave.core.RunState;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow is asked to move between two run states that the
 * {@link RunState} transition table does not connect.
 *
 * <p>The valid targets are taken from the current state, so the message always
 * tells the caller what it could have asked for instead.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidTransitionException extends WeaveException {

    private final String workflowId;
    private final RunState currentState;
    private final RunState requestedState;

    public InvalidTransitionException(String workflowId, RunState currentState, RunState requestedState) {
        super(String.format("Invalid transition for workflow '%s': %s → %s. Valid targets: %s",
                workflowId, currentState, requestedState, formatTransitions(currentState)));
        this.workflowId = workflowId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public RunState getCurrentState() {
        return currentState;
    }

    public RunState getRequestedState() {
        return requestedState;
    }

    public RunState[] getValidTransitions() {
        return currentState.getValidTransitions();
    }

    private static String formatTransitions(RunState from) {
        return Arrays.stream(from.getValidTransitions())
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
