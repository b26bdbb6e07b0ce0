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

/**
 * Thrown when the execution loop observes a run state it cannot continue from.
 * Only IN_PROGRESS, PAUSED and CANCELED are legal at a dispatch check point.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class UnexpectedRunStateException extends WeaveException {

    private final String workflowName;
    private final RunState observedState;

    public UnexpectedRunStateException(String workflowName, RunState observedState) {
        super(String.format("Workflow '%s' in unexpected state: %s", workflowName, observedState));
        this.workflowName = workflowName;
        this.observedState = observedState;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public RunState getObservedState() {
        return observedState;
    }
}
