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

import java.util.Map;

/**
 * Body of a {@link Task}: turns resolved inputs into named outputs.
 *
 * <p>Executors run on a worker thread and may block. Inside a parallel task group a
 * failing sibling cancels the others by interrupting their threads, so long-running
 * executors should respond to {@link InterruptedException} or poll
 * {@link Thread#isInterrupted()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@FunctionalInterface
public interface TaskExecutor {

    /**
     * @param inputs resolved inputs; references to missing outputs are absent
     * @return outputs keyed by output name, never prefixed by the task name
     * @throws Exception any failure, which fails the workflow run
     */
    Map<String, Object> execute(Map<String, Object> inputs) throws Exception;
}
