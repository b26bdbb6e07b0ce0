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
 * Thrown when a task is executed but was built without an executor body.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class MissingExecutionLogicException extends WeaveException {

    private final String taskName;

    public MissingExecutionLogicException(String taskName) {
        super("No execution logic provided for task: " + taskName);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
