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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for RunState transition validation.
 * Covers every (source, target) pair so the transition table has no gaps.
 */
class RunStateTransitionTest {

    private static final EnumSet<RunState> FROM_NOT_STARTED =
            EnumSet.of(RunState.IN_PROGRESS, RunState.CANCELED);

    private static final EnumSet<RunState> FROM_IN_PROGRESS =
            EnumSet.of(RunState.PAUSED, RunState.CANCELED, RunState.COMPLETED, RunState.FAILED);

    private static final EnumSet<RunState> FROM_PAUSED =
            EnumSet.of(RunState.IN_PROGRESS, RunState.CANCELED, RunState.COMPLETED, RunState.FAILED);

    private static EnumSet<RunState> validTargets(RunState from) {
        switch (from) {
            case NOT_STARTED:
                return FROM_NOT_STARTED;
            case IN_PROGRESS:
                return FROM_IN_PROGRESS;
            case PAUSED:
                return FROM_PAUSED;
            default:
                return EnumSet.noneOf(RunState.class);
        }
    }

    static Stream<Arguments> allRunStatePairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (RunState from : RunState.values()) {
            Set<RunState> valid = validTargets(from);
            for (RunState to : RunState.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} -> {1} should be {2}")
    @MethodSource("allRunStatePairs")
    void canTransitionTo_coversAllPairs(RunState from, RunState to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s -> %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest
    @EnumSource(RunState.class)
    void getValidTransitions_matchesCanTransitionTo(RunState from) {
        Set<RunState> reported = EnumSet.noneOf(RunState.class);
        reported.addAll(Arrays.asList(from.getValidTransitions()));
        assertEquals(validTargets(from), reported, "Valid transitions for " + from);
    }

    @ParameterizedTest
    @EnumSource(value = RunState.class, names = {"CANCELED", "COMPLETED", "FAILED"})
    void terminalStatesHaveNoTransitions(RunState state) {
        assertTrue(state.isTerminal());
        assertFalse(state.isActive());
        assertEquals(0, state.getValidTransitions().length);
    }

    @Test
    void activeStates() {
        assertTrue(RunState.IN_PROGRESS.isActive());
        assertTrue(RunState.PAUSED.isActive());
        assertFalse(RunState.NOT_STARTED.isActive());
        assertFalse(RunState.NOT_STARTED.isTerminal());
    }

    @Test
    void onlyCompletedIsSuccessful() {
        for (RunState state : RunState.values()) {
            assertEquals(state == RunState.COMPLETED, state.isSuccessful(), state.name());
        }
    }

    @Test
    void selfTransitionsAreRejected() {
        for (RunState state : RunState.values()) {
            assertFalse(state.canTransitionTo(state), state.name());
        }
    }
}
