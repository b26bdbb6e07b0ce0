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

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity and execution-details bookkeeping shared by the leaf component types.
 * Details are written by the executing thread and read by reporters, hence volatile.
 */
abstract class AbstractComponent {

    private final String id;
    private final String name;
    private final String description;
    private volatile ExecutionDetails executionDetails;

    protected AbstractComponent(String name, String description) {
        this.id = UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(name, "Component name cannot be null");
        this.description = description != null ? description : "";
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Optional<ExecutionDetails> getExecutionDetails() {
        return Optional.ofNullable(executionDetails);
    }

    void updateExecutionDetails(ExecutionDetails details) {
        this.executionDetails = details;
    }
}
