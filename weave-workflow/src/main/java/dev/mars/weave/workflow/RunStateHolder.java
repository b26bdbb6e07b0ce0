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

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded cell holding the run state of one workflow.
 *
 * <p>Every read and every transition goes through the same lock, and every successful
 * transition signals {@link #awaitWhilePaused(Duration)} waiters, so a paused loop
 * wakes as soon as the run is resumed or canceled instead of sleeping out a full
 * polling interval.</p>
 */
class RunStateHolder {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private RunState state = RunState.NOT_STARTED;

    RunState get() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to {@code target} if the transition table allows it.
     *
     * @return true if the state changed
     */
    boolean tryTransition(RunState target) {
        lock.lock();
        try {
            if (!state.canTransitionTo(target)) {
                return false;
            }
            state = target;
            stateChanged.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves from exactly {@code expected} to {@code target}.
     *
     * @return true if the state was {@code expected} and changed
     */
    boolean compareAndTransition(RunState expected, RunState target) {
        lock.lock();
        try {
            if (state != expected) {
                return false;
            }
            return tryTransition(target);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the state is PAUSED, re-checking at least every {@code checkInterval}.
     *
     * @return the first non-PAUSED state observed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    RunState awaitWhilePaused(Duration checkInterval) throws InterruptedException {
        long intervalNanos = checkInterval.toNanos();
        lock.lockInterruptibly();
        try {
            while (state == RunState.PAUSED) {
                stateChanged.await(intervalNanos, TimeUnit.NANOSECONDS);
            }
            return state;
        } finally {
            lock.unlock();
        }
    }
}
