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
import dev.mars.weave.core.ExecutionTimer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Waits for an external condition, then injects components at the front of the
 * pending queue. The workflow does not dispatch anything else while a trigger waits.
 *
 * <p><strong>Polling loops.</strong> A waiter may return a fresh {@code Trigger} among
 * its components to poll again. Nothing in the engine bounds this: the waiter must
 * track its own counter or deadline and eventually return an empty list, otherwise
 * the workflow never completes.</p>
 *
 * <p><strong>Cancellation.</strong> Canceling the workflow does not interrupt a waiter
 * that is already blocked; cancellation is observed once the waiter returns. Waiters
 * expected to block for long should watch the workflow state themselves.</p>
 *
 * <p>Failures thrown by the waiter are recorded on this trigger and logged; they do
 * not fail the run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class Trigger extends AbstractComponent implements Component {

    private final TriggerWaiter waiter;

    public Trigger(String name, String description, TriggerWaiter waiter) {
        super(name != null ? name : Trigger.class.getSimpleName(), description);
        this.waiter = Objects.requireNonNull(waiter, "Trigger waiter cannot be null");
    }

    public static Trigger of(String name, TriggerWaiter waiter) {
        return new Trigger(name, "", waiter);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.TRIGGER;
    }

    /**
     * Blocks in the waiter and records timing on this trigger.
     *
     * @return the components to splice into the queue, never null
     * @throws Exception whatever the waiter throws
     */
    public List<Component> waitForTrigger() throws Exception {
        ExecutionTimer timer = new ExecutionTimer().start();
        try {
            List<Component> next = waiter.waitForTrigger();
            timer.stop();
            updateExecutionDetails(ExecutionDetails.completed(timer, Map.of()));
            return next != null ? List.copyOf(next) : List.of();
        } catch (Exception e) {
            timer.stop();
            updateExecutionDetails(ExecutionDetails.failed(timer, Map.of(), e));
            throw e;
        }
    }

    @Override
    public String toString() {
        return "Trigger{name='" + getName() + "'}";
    }
}
