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

/**
 * Wraps an error raised by a task, a task group member, a logic evaluator or a subflow.
 *
 * <p>The wrapped cause is the error exactly as the component body threw it; the
 * workflow records that cause, not this wrapper, in its execution details.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ComponentExecutionException extends WeaveException {

    private final String componentName;

    public ComponentExecutionException(String componentName, Throwable cause) {
        super("Component '" + componentName + "' failed: " + describe(cause), cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
