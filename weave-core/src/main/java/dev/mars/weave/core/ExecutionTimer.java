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

package dev.mars.weave.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Records the start and end instants of a single execution.
 * Not thread-safe; each execution owns its own timer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ExecutionTimer {

    private final Clock clock;
    private Instant startTime;
    private Instant endTime;

    public ExecutionTimer() {
        this(Clock.systemUTC());
    }

    public ExecutionTimer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Marks the start instant and clears any previous end instant.
     *
     * @return this timer, for chaining
     */
    public ExecutionTimer start() {
        startTime = clock.instant();
        endTime = null;
        return this;
    }

    public void stop() {
        endTime = clock.instant();
    }

    public void reset() {
        startTime = null;
        endTime = null;
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    /**
     * Elapsed time between start and stop; empty until both have been recorded.
     */
    public Optional<Duration> getDuration() {
        if (startTime == null || endTime == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startTime, endTime));
    }

    @Override
    public String toString() {
        return "ExecutionTimer{" +
               "startTime=" + startTime +
               ", endTime=" + endTime +
               '}';
    }
}
