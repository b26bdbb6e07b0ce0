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

import java.util.Optional;

/**
 * One schedulable unit in a workflow's queue.
 *
 * <p>The set of variants is closed; the execution loop
 * dispatches on exactly these five kinds.
 * <ul>
 *   <li>{@link Task}: a named unit of work producing named outputs</li>
 *   <li>{@link TaskGroup}: tasks run sequentially or in parallel as one step</li>
 *   <li>{@link Logic}: computes components to run next</li>
 *   <li>{@link Trigger}: waits for a condition, then injects components</li>
 *   <li>{@link Subflow}: a nested workflow run to completion</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public sealed interface Component permits Task, TaskGroup, Logic, Trigger, Subflow {

    String getId();

    String getName();

    String getDescription();

    ComponentType getType();

    /**
     * Details of the last execution of this component; empty until it has run.
     */
    Optional<ExecutionDetails> getExecutionDetails();
}
