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

/**
 * The five kinds of schedulable workflow component.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum ComponentType {
    TASK("Task"),
    TASK_GROUP("TaskGroup"),
    LOGIC("Logic"),
    TRIGGER("Trigger"),
    SUBFLOW("Subflow");

    private final String displayName;

    ComponentType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name used in reports and as the metrics attribute value.
     */
    public String getDisplayName() {
        return displayName;
    }
}
