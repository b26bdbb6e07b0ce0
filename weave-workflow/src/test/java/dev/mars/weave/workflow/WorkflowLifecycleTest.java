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

import dev.mars.weave.config.WeaveConfiguration;
import dev.mars.weave.core.ExecutionDetails;
import dev.mars.weave.core.RunState;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for start, pause, resume and cancel.
 */
class WorkflowLifecycleTest {

    private static Task blocking(String name, CountDownLatch started, CountDownLatch release) {
        return Task.of(name, inputs -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS), "release latch");
            return Map.of("done", true);
        });
    }

    private static Task flagging(String name, AtomicBoolean ran) {
        return Task.of(name, inputs -> {
            ran.set(true);
            return Map.of("done", true);
        });
    }

    private static WeaveConfiguration fastPolling() {
        Properties props = new Properties();
        props.setProperty(WeaveConfiguration.PAUSE_CHECK_INTERVAL_KEY, "20");
        return new WeaveConfiguration(props);
    }

    @Test
    void testPauseHoldsNextComponentUntilResume() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean secondRan = new AtomicBoolean();

        Workflow workflow = Workflow.builder()
                .configuration(fastPolling())
                .component(blocking("A", started, release))
                .component(flagging("B", secondRan))
                .build();

        CompletableFuture<ExecutionDetails> future = workflow.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(workflow.pause());
        assertEquals(RunState.PAUSED, workflow.getState());
        release.countDown();

        Thread.sleep(200);
        assertFalse(secondRan.get());
        assertFalse(future.isDone());
        assertEquals(RunState.PAUSED, workflow.getState());

        assertTrue(workflow.resume());
        ExecutionDetails details = future.get(5, TimeUnit.SECONDS);

        assertEquals(RunState.COMPLETED, details.getState());
        assertTrue(secondRan.get());
        assertEquals(Map.of("A.done", true, "B.done", true), workflow.getOutputs());
    }

    @Test
    void testCancelStopsBeforeNextComponent() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean secondRan = new AtomicBoolean();

        Workflow workflow = Workflow.builder()
                .component(blocking("A", started, release))
                .component(flagging("B", secondRan))
                .build();

        CompletableFuture<ExecutionDetails> future = workflow.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(workflow.cancel());
        release.countDown();
        ExecutionDetails details = future.get(5, TimeUnit.SECONDS);

        assertEquals(RunState.CANCELED, details.getState());
        assertTrue(details.getError().isEmpty());
        assertFalse(secondRan.get());
        assertEquals(Map.of("A.done", true), workflow.getOutputs());
        assertEquals(1, workflow.getComponentsManager().getCompletedComponents().size());
    }

    @Test
    void testCancelWhilePausedEndsRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean secondRan = new AtomicBoolean();

        Workflow workflow = Workflow.builder()
                .component(blocking("A", started, release))
                .component(flagging("B", secondRan))
                .build();

        CompletableFuture<ExecutionDetails> future = workflow.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(workflow.pause());
        release.countDown();

        assertTrue(workflow.cancel());
        ExecutionDetails details = future.get(5, TimeUnit.SECONDS);

        assertEquals(RunState.CANCELED, details.getState());
        assertFalse(secondRan.get());
    }

    @Test
    void testCancelBeforeStart() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        Workflow workflow = Workflow.builder().component(flagging("A", ran)).build();

        assertTrue(workflow.cancel());
        ExecutionDetails details = workflow.start().get(1, TimeUnit.SECONDS);

        assertEquals(RunState.CANCELED, details.getState());
        assertEquals(RunState.CANCELED, workflow.getState());
        assertFalse(ran.get());
        assertTrue(workflow.getExecutionDetails().isPresent());
    }

    @Test
    void testStartIsIdempotent() throws Exception {
        Workflow workflow = Workflow.builder()
                .component(Task.of("A", inputs -> Map.of("v", 1)))
                .build();

        CompletableFuture<ExecutionDetails> first = workflow.start();
        CompletableFuture<ExecutionDetails> second = workflow.start();

        assertSame(first, second);
        assertEquals(RunState.COMPLETED, first.get(5, TimeUnit.SECONDS).getState());
        assertSame(first, workflow.start());
    }

    @Test
    void testControlCallsRejectedInWrongState() throws Exception {
        Workflow workflow = Workflow.builder()
                .component(Task.of("A", inputs -> Map.of()))
                .build();

        assertFalse(workflow.pause());
        assertFalse(workflow.resume());

        workflow.start().get(5, TimeUnit.SECONDS);

        assertFalse(workflow.pause());
        assertFalse(workflow.resume());
        assertFalse(workflow.cancel());
        assertEquals(RunState.COMPLETED, workflow.getState());
    }

    @Test
    void testResumeRejectedWhileRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Workflow workflow = Workflow.builder().component(blocking("A", started, release)).build();

        CompletableFuture<ExecutionDetails> future = workflow.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertFalse(workflow.resume());
        assertEquals(RunState.IN_PROGRESS, workflow.getState());

        release.countDown();
        assertEquals(RunState.COMPLETED, future.get(5, TimeUnit.SECONDS).getState());
    }

    @Test
    void testSuppliedExecutorIsUsedAndLeftRunning() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Workflow workflow = Workflow.builder()
                    .executorService(executor)
                    .component(TaskGroup.builder("G")
                            .parallel()
                            .task(Task.of("T1", inputs -> Map.of("t", Thread.currentThread().getName())))
                            .task(Task.of("T2", inputs -> Map.of("t", Thread.currentThread().getName())))
                            .build())
                    .build();

            assertEquals(RunState.COMPLETED, workflow.start().get(5, TimeUnit.SECONDS).getState());
            assertFalse(executor.isShutdown());
            assertTrue(workflow.getOutputs().get("G.T1.t").toString().startsWith("pool-"));
        } finally {
            executor.shutdownNow();
        }
    }
}
