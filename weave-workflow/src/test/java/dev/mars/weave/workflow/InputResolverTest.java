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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InputResolverTest {

    private final InputResolver resolver = new InputResolver(Map.of("A.v", 1, "G.T.k", "deep"));

    @Test
    void resolvesReferencesAndPassesLiteralsThrough() {
        Map<String, Object> declared = new LinkedHashMap<>();
        declared.put("in", "{A.v}");
        declared.put("nested", "{G.T.k}");
        declared.put("literal", "hello");
        declared.put("number", 42);

        Map<String, Object> resolved = resolver.resolve(declared);

        assertThat(resolved)
                .containsEntry("in", 1)
                .containsEntry("nested", "deep")
                .containsEntry("literal", "hello")
                .containsEntry("number", 42);
    }

    @Test
    void missingReferenceIsOmitted() {
        Map<String, Object> resolved = resolver.resolve(Map.of("in", "{Nope.x}", "keep", "yes"));

        assertThat(resolved).doesNotContainKey("in").containsEntry("keep", "yes");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{A.v} and more", "prefix {A.v}", "{{A.v}}", "{}", "A.v"})
    void stringsThatAreNotWholeReferencesPassThrough(String value) {
        assertThat(InputResolver.isReference(value)).isFalse();
        assertThat(resolver.resolve(Map.of("in", value))).containsEntry("in", value);
    }

    @Test
    void referenceKeyIsTakenVerbatim() {
        assertThat(InputResolver.referenceKey("{A.v}")).contains("A.v");
        assertThat(InputResolver.referenceKey("{ A.v }")).contains(" A.v ");
        assertThat(InputResolver.referenceKey(7)).isEmpty();
    }

    @Test
    void paddedReferenceDoesNotMatchOutputKey() {
        assertThat(resolver.resolve(Map.of("in", "{ A.v }"))).doesNotContainKey("in");
    }

    @Test
    void resolvesDeclaredTaskInputs() {
        Task task = Task.builder("B").input("in", "{A.v}").executor(inputs -> Map.of()).build();

        assertThat(resolver.resolve(task)).containsExactly(Map.entry("in", 1));
    }

    @Test
    void referencedKeysListsEveryReference() {
        Map<String, Object> declared = new LinkedHashMap<>();
        declared.put("x", "{A.v}");
        declared.put("y", "plain");
        declared.put("z", "{G.T.k}");

        Set<String> keys = InputResolver.referencedKeys(declared);

        assertThat(keys).containsExactly("A.v", "G.T.k");
        assertThat(InputResolver.referencedKeys(null)).isEmpty();
    }
}
