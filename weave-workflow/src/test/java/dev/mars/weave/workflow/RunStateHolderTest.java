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

import dev.mars.weave.core.RunState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RunStateHolderTest {

    @Test
    void testFollowsTransitionTable() {
        RunStateHolder holder = new RunStateHolder();

        assertEquals(RunState.NOT_STARTED, holder.get());
        assertFalse(holder.tryTransition(RunState.COMPLETED));
        assertTrue(holder.tryTransition(RunState.IN_PROGRESS));
        assertTrue(holder.tryTransition(RunState.COMPLETED));
        assertFalse(holder.tryTransition(RunState.CANCELED));
        assertEquals(RunState.COMPLETED, holder.get());
    }

    @Test
    void testCompareAndTransitionRequiresExpectedState() {
        RunStateHolder holder = new RunStateHolder();
        holder.tryTransition(RunState.IN_PROGRESS);

        assertFalse(holder.compareAndTransition(RunState.PAUSED, RunState.IN_PROGRESS));
        assertTrue(holder.compareAndTransition(RunState.IN_PROGRESS, RunState.PAUSED));
        assertEquals(RunState.PAUSED, holder.get());
    }

    @Test
    void testAwaitReturnsImmediatelyWhenNotPaused() throws Exception {
        RunStateHolder holder = new RunStateHolder();
        holder.tryTransition(RunState.IN_PROGRESS);

        assertEquals(RunState.IN_PROGRESS, holder.awaitWhilePaused(Duration.ofSeconds(10)));
    }

    @Test
    void testResumeWakesWaiterBeforeIntervalElapses() throws Exception {
        RunStateHolder holder = new RunStateHolder();
        holder.tryTransition(RunState.IN_PROGRESS);
        holder.tryTransition(RunState.PAUSED);

        CompletableFuture<RunState> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return holder.awaitWhilePaused(Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        assertFalse(waiter.isDone());
        holder.compareAndTransition(RunState.PAUSED, RunState.IN_PROGRESS);

        assertEquals(RunState.IN_PROGRESS, waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testCancelWakesWaiter() throws Exception {
        RunStateHolder holder = new RunStateHolder();
        holder.tryTransition(RunState.IN_PROGRESS);
        holder.tryTransition(RunState.PAUSED);

        CompletableFuture<RunState> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return holder.awaitWhilePaused(Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        holder.tryTransition(RunState.CANCELED);

        assertEquals(RunState.CANCELED, waiter.get(5, TimeUnit.SECONDS));
    }
}
