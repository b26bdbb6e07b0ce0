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

import java.util.List;

/**
 * Body of a {@link Trigger} component. May block for as long as the awaited
 * condition takes (a timer, an external notification, an I/O event).
 *
 * <p>Failures are logged and swallowed by the workflow: the run carries on without
 * the components this trigger would have produced.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@FunctionalInterface
public interface TriggerWaiter {

    /**
     * @return components to run once the trigger fired, possibly empty
     * @throws Exception any failure; logged, does not fail the run
     */
    List<Component> waitForTrigger() throws Exception;
}
