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
 * A branching component: evaluated once when dispatched, it returns the components
 * that should run next. Those components are inserted at the front of the pending
 * queue, ahead of anything that was already queued behind this component.
 *
 * <p>The evaluator takes no inputs; it closes over whatever state it needs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class Logic extends AbstractComponent implements Component {

    private final LogicEvaluator evaluator;

    public Logic(String name, String description, LogicEvaluator evaluator) {
        super(name != null ? name : Logic.class.getSimpleName(), description);
        this.evaluator = Objects.requireNonNull(evaluator, "Logic evaluator cannot be null");
    }

    public static Logic of(String name, LogicEvaluator evaluator) {
        return new Logic(name, "", evaluator);
    }

    @Override
    public ComponentType getType() {
        return ComponentType.LOGIC;
    }

    /**
     * Runs the evaluator and records timing on this component.
     *
     * @return the components to splice into the queue, never null
     * @throws Exception whatever the evaluator throws
     */
    public List<Component> evaluate() throws Exception {
        ExecutionTimer timer = new ExecutionTimer().start();
        try {
            List<Component> next = evaluator.evaluate();
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
        return "Logic{name='" + getName() + "'}";
    }
}
