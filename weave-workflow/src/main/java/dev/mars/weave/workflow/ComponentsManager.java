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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending run queue and completed log of a single workflow run.
 *
 * <p>The queue is consumed from the front. Components produced while the run is in
 * progress are inserted at the front, so they run immediately next, before anything
 * that was already queued (depth-first expansion).</p>
 *
 * <p>Mutation happens only on the workflow's execution loop. The read-only views are
 * synchronized so that reporting from another thread sees a consistent copy.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ComponentsManager {

    private final Deque<Component> pending;
    private final List<Component> completed = new ArrayList<>();

    public ComponentsManager(List<Component> initialComponents) {
        this.pending = new ArrayDeque<>();
        if (initialComponents != null) {
            initialComponents.forEach(c -> pending.addLast(Objects.requireNonNull(c, "Component cannot be null")));
        }
    }

    /**
     * Pops the head of the pending queue.
     */
    public synchronized Optional<Component> removeFirst() {
        return Optional.ofNullable(pending.pollFirst());
    }

    /**
     * Prepends {@code components} keeping their relative order: after
     * {@code insert([X, Y])} on {@code [Z]} the queue is {@code [X, Y, Z]}.
     */
    public synchronized void insert(List<Component> components) {
        if (components == null || components.isEmpty()) {
            return;
        }
        ListIterator<Component> it = components.listIterator(components.size());
        while (it.hasPrevious()) {
            pending.addFirst(Objects.requireNonNull(it.previous(), "Component cannot be null"));
        }
    }

    /**
     * Appends to the completed log; used for reporting only.
     */
    public synchronized void complete(Component component) {
        completed.add(Objects.requireNonNull(component, "Component cannot be null"));
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized List<Component> getPendingComponents() {
        return List.copyOf(pending);
    }

    public synchronized List<Component> getCompletedComponents() {
        return List.copyOf(completed);
    }
}
