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

/**
 * Run-level state of a workflow and of every component it executes.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * NOT_STARTED → IN_PROGRESS → {COMPLETED | FAILED}
 *      ↓             ↓  ↑            ↑
 *   CANCELED  ←──  PAUSED ───────────┘
 * </pre>
 *
 * <h3>State Transition Rules:</h3>
 * <ul>
 *   <li>NOT_STARTED can transition to IN_PROGRESS or CANCELED</li>
 *   <li>IN_PROGRESS can transition to PAUSED, CANCELED, COMPLETED or FAILED</li>
 *   <li>PAUSED can transition back to IN_PROGRESS, to CANCELED, or to COMPLETED/FAILED
 *       when the component that was in flight at pause time finishes the run</li>
 *   <li>CANCELED, COMPLETED and FAILED are terminal states</li>
 * </ul>
 *
 * <p>Enum constants are immutable; the holder that stores the current state of a
 * workflow is responsible for serialising transitions.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum RunState {

    /**
     * Created but {@code start()} has not been called yet.
     */
    NOT_STARTED,

    /**
     * The execution loop is dispatching components.
     */
    IN_PROGRESS,

    /**
     * Dispatch is suspended until the run is resumed or canceled.
     */
    PAUSED,

    /**
     * The run was stopped on request. Outputs gathered so far are kept, no error is recorded.
     */
    CANCELED,

    /**
     * Every queued component ran successfully.
     */
    COMPLETED,

    /**
     * A component failed and the run stopped draining its queue.
     */
    FAILED;

    /**
     * Checks if the state represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /**
     * Checks if the state represents an active (started, not yet finished) run.
     */
    public boolean isActive() {
        return this == IN_PROGRESS || this == PAUSED;
    }

    /**
     * Checks if the state represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    /**
     * Validates whether a transition from this state to the target state is allowed.
     *
     * @param target the desired target state
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(RunState target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case NOT_STARTED:
                return target == IN_PROGRESS || target == CANCELED;

            case IN_PROGRESS:
                return target == PAUSED || target == CANCELED ||
                       target == COMPLETED || target == FAILED;

            case PAUSED:
                return target == IN_PROGRESS || target == CANCELED ||
                       target == COMPLETED || target == FAILED;

            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this state.
     *
     * @return array of valid target states
     */
    public RunState[] getValidTransitions() {
        switch (this) {
            case NOT_STARTED:
                return new RunState[]{IN_PROGRESS, CANCELED};
            case IN_PROGRESS:
                return new RunState[]{PAUSED, CANCELED, COMPLETED, FAILED};
            case PAUSED:
                return new RunState[]{IN_PROGRESS, CANCELED, COMPLETED, FAILED};
            default:
                return new RunState[0];
        }
    }
}
