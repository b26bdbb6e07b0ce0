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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionTimerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private StepClock clock;
    private ExecutionTimer timer;

    @BeforeEach
    void setUp() {
        clock = new StepClock(T0);
        timer = new ExecutionTimer(clock);
    }

    @Test
    void testNewTimerHasNoInstants() {
        assertTrue(timer.getStartTime().isEmpty());
        assertTrue(timer.getEndTime().isEmpty());
        assertTrue(timer.getDuration().isEmpty());
    }

    @Test
    void testDurationBetweenStartAndStop() {
        timer.start();
        clock.advance(Duration.ofMillis(1500));
        timer.stop();

        assertEquals(T0, timer.getStartTime().orElseThrow());
        assertEquals(T0.plusMillis(1500), timer.getEndTime().orElseThrow());
        assertEquals(Duration.ofMillis(1500), timer.getDuration().orElseThrow());
    }

    @Test
    void testDurationEmptyWhileRunning() {
        timer.start();
        clock.advance(Duration.ofSeconds(1));
        assertTrue(timer.getDuration().isEmpty());
    }

    @Test
    void testRestartClearsEndTime() {
        timer.start();
        timer.stop();
        clock.advance(Duration.ofSeconds(5));

        assertSame(timer, timer.start());
        assertTrue(timer.getEndTime().isEmpty());
        assertEquals(T0.plusSeconds(5), timer.getStartTime().orElseThrow());
    }

    @Test
    void testReset() {
        timer.start();
        timer.stop();
        timer.reset();

        assertTrue(timer.getStartTime().isEmpty());
        assertTrue(timer.getDuration().isEmpty());
    }

    @Test
    void testNullClockRejected() {
        assertThrows(NullPointerException.class, () -> new ExecutionTimer(null));
    }

    /**
     * Clock that only moves when told to.
     */
    static final class StepClock extends Clock {
        private Instant now;

        StepClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
