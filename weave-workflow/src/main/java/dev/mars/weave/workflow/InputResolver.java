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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves task input references against the outputs a workflow has gathered so far.
 *
 * <p>A declared input whose value is a string of exactly the form {@code {Name.Key}}
 * is replaced by the output stored under {@code Name.Key}. A reference to an output
 * that does not exist resolves to nothing: the key is left out of the resolved inputs
 * and it is up to the task body to decide whether that is an error. Any other value,
 * including strings that merely contain braces, passes through unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InputResolver {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile("^\\{([^{}]+)\\}$");

    private final Map<String, Object> outputs;

    /**
     * @param outputs the outputs to resolve against; read, never modified
     */
    public InputResolver(Map<String, Object> outputs) {
        this.outputs = Objects.requireNonNull(outputs, "Outputs cannot be null");
    }

    /**
     * Resolves every declared input of a task.
     */
    public Map<String, Object> resolve(Task task) {
        Objects.requireNonNull(task, "Task cannot be null");
        return resolve(task.getInputs());
    }

    /**
     * Resolves a map of declared inputs. Unresolvable references are omitted.
     */
    public Map<String, Object> resolve(Map<String, Object> declaredInputs) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : declaredInputs.entrySet()) {
            Optional<String> reference = referenceKey(entry.getValue());
            if (reference.isPresent()) {
                Object value = outputs.get(reference.get());
                if (value != null) {
                    resolved.put(entry.getKey(), value);
                }
            } else if (entry.getValue() != null) {
                resolved.put(entry.getKey(), entry.getValue());
            }
        }
        return resolved;
    }

    /**
     * Checks if a declared input value is an output reference.
     */
    public static boolean isReference(Object value) {
        return referenceKey(value).isPresent();
    }

    /**
     * The output key a declared value refers to, e.g. {@code "A.y"} for {@code "{A.y}"}.
     */
    public static Optional<String> referenceKey(Object value) {
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        Matcher matcher = REFERENCE_PATTERN.matcher((String) value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }

    /**
     * Gets all output keys referenced by a map of declared inputs.
     */
    public static Set<String> referencedKeys(Map<String, Object> declaredInputs) {
        Set<String> keys = new LinkedHashSet<>();
        if (declaredInputs == null) {
            return keys;
        }
        for (Object value : declaredInputs.values()) {
            referenceKey(value).ifPresent(keys::add);
        }
        return keys;
    }
}
