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
import dev.mars.weave.core.ExecutionTimer;
import dev.mars.weave.core.RunState;
import dev.mars.weave.core.exceptions.ComponentExecutionException;
import dev.mars.weave.core.exceptions.InvalidTransitionException;
import dev.mars.weave.core.exceptions.UnexpectedRunStateException;
import dev.mars.weave.core.exceptions.WeaveException;
import dev.mars.weave.workflow.observability.WorkflowMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an ordered queue of components, one at a time, and threads their outputs by name.
 *
 * <p>A run drains the {@link ComponentsManager} queue. Tasks and task groups contribute
 * outputs under {@code "<ComponentName>.<OutputKey>"}; logic and trigger components
 * splice new components at the front of the queue; subflows run a nested workflow to
 * completion and merge its outputs unprefixed. The run ends COMPLETED when the queue
 * is empty, CANCELED when a cancellation is observed, or FAILED on the first error
 * from a task, task group, logic evaluator or subflow. Trigger failures are logged and
 * skipped.</p>
 *
 * <p>{@link #pause()}, {@link #resume()} and {@link #cancel()} may be called from any
 * thread. They are cooperative: the loop observes them before dispatching its next
 * component, and a component already in flight finishes its current unit of work.</p>
 *
 * <pre>
 * Workflow workflow = Workflow.builder()
 *         .name("Doubler")
 *         .component(Task.of("A", inputs -&gt; Map.of("v", 1)))
 *         .component(Task.builder("B")
 *                 .input("in", "{A.v}")
 *                 .executor(inputs -&gt; Map.of("out", (Integer) inputs.get("in") * 2))
 *                 .build())
 *         .build();
 * ExecutionDetails details = workflow.start().join();
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class Workflow {

    private static final Logger defaultLogger = Logger.getLogger(Workflow.class.getName());

    private final String id;
    private final String name;
    private final String description;
    private final ComponentsManager componentsManager;
    private final RunStateHolder stateHolder;
    private final Logger logger;
    private final WorkflowMetrics metrics;
    private final boolean metricsEnabled;
    private final Duration pauseCheckInterval;
    private final int executorThreads;
    private final ExecutorService providedExecutor;

    private final ReentrantLock outputsLock = new ReentrantLock();
    private final Map<String, Object> outputs = new LinkedHashMap<>();

    private final AtomicReference<CompletableFuture<ExecutionDetails>> runFuture = new AtomicReference<>();
    private final ExecutionTimer timer = new ExecutionTimer();
    private volatile ExecutionDetails executionDetails;
    private volatile Workflow activeSubflow;
    private ExecutorService executorService;
    private int step;

    private Workflow(Builder builder) {
        this.id = UUID.randomUUID().toString();
        this.name = builder.name;
        this.description = builder.description;
        this.componentsManager = new ComponentsManager(builder.components);
        this.stateHolder = new RunStateHolder();
        this.logger = builder.logger != null ? builder.logger : defaultLogger;
        this.metrics = builder.metrics != null ? builder.metrics : WorkflowMetrics.noop();

        WeaveConfiguration configuration = builder.configuration != null
                ? builder.configuration
                : WeaveConfiguration.defaults();
        this.metricsEnabled = configuration.isMetricsEnabled();
        this.pauseCheckInterval = configuration.getPauseCheckInterval();
        this.executorThreads = configuration.getExecutorThreads();
        this.providedExecutor = builder.executorService;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Control surface ==========

    /**
     * Starts the run on the workflow's executor.
     *
     * <p>Only the first call on a NOT_STARTED workflow runs anything. Later calls are
     * no-ops and return the future of the first call; a workflow canceled before it
     * was started returns an already completed future.</p>
     *
     * @return a future completed with the final execution details of the run
     */
    public CompletableFuture<ExecutionDetails> start() {
        CompletableFuture<ExecutionDetails> future = new CompletableFuture<>();
        if (!runFuture.compareAndSet(null, future)) {
            logger.fine("Workflow " + name + " already started");
            return runFuture.get();
        }

        if (!stateHolder.compareAndTransition(RunState.NOT_STARTED, RunState.IN_PROGRESS)) {
            logger.fine("Workflow " + name + " not started, state is " + stateHolder.get());
            future.complete(currentDetails());
            return future;
        }

        recordMetrics(m -> m.recordWorkflowStarted(name));
        executorService = providedExecutor != null ? providedExecutor : createExecutor();
        try {
            executorService.execute(() -> future.complete(run()));
        } catch (RejectedExecutionException e) {
            future.complete(failRun(e));
            shutdownOwnedExecutor();
        }
        return future;
    }

    /**
     * Suspends dispatch. Accepted only while IN_PROGRESS.
     *
     * @return true if the workflow is now paused
     */
    public boolean pause() {
        if (stateHolder.compareAndTransition(RunState.IN_PROGRESS, RunState.PAUSED)) {
            logger.info("Workflow paused: " + name);
            return true;
        }
        logger.fine("Cannot pause workflow " + name + " because it is not in progress (state: " +
                stateHolder.get() + ")");
        return false;
    }

    /**
     * Resumes dispatch from the next undispatched component. Accepted only while PAUSED.
     *
     * @return true if the workflow is now in progress again
     */
    public boolean resume() {
        if (stateHolder.compareAndTransition(RunState.PAUSED, RunState.IN_PROGRESS)) {
            logger.info("Workflow resumed: " + name);
            return true;
        }
        logger.fine("Cannot resume workflow " + name + " because it is not paused (state: " +
                stateHolder.get() + ")");
        return false;
    }

    /**
     * Requests cancellation. Accepted from any non-terminal state and propagated to a
     * subflow that is currently running. The loop observes it at its next state check.
     *
     * @return true if the workflow is now canceled
     */
    public boolean cancel() {
        boolean beforeStart = stateHolder.compareAndTransition(RunState.NOT_STARTED, RunState.CANCELED);
        if (!beforeStart && !stateHolder.tryTransition(RunState.CANCELED)) {
            logger.fine("Cannot cancel workflow " + name + " in state " + stateHolder.get());
            return false;
        }

        logger.info("Workflow canceled: " + name);
        if (beforeStart) {
            executionDetails = currentDetails();
        }

        Workflow nested = activeSubflow;
        if (nested != null) {
            nested.cancel();
        }
        return true;
    }

    // ========== Read access ==========

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public RunState getState() {
        return stateHolder.get();
    }

    /**
     * Snapshot of the outputs gathered so far.
     */
    public Map<String, Object> getOutputs() {
        outputsLock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        } finally {
            outputsLock.unlock();
        }
    }

    /**
     * Details of the finished run; empty while the workflow has not finished.
     */
    public Optional<ExecutionDetails> getExecutionDetails() {
        return Optional.ofNullable(executionDetails);
    }

    public ComponentsManager getComponentsManager() {
        return componentsManager;
    }

    public WorkflowReport generateReport() {
        return WorkflowReport.of(this);
    }

    // ========== Execution loop ==========

    private ExecutionDetails run() {
        timer.start();
        logger.info("Starting workflow execution: " + name + " (" + id + ")");

        try {
            executeComponents();
            timer.stop();

            RunState finalState = stateHolder.get();
            ExecutionDetails details = ExecutionDetails.fromTimer(finalState, timer, getOutputs(), null);
            executionDetails = details;

            double seconds = durationSeconds();
            if (finalState == RunState.CANCELED) {
                logger.info("Workflow execution canceled: " + name + " after " + formatSeconds(seconds) + "s");
                recordMetrics(m -> m.recordWorkflowCancelled(name, seconds));
            } else {
                logger.info("Workflow execution completed: " + name + " with state: " + finalState +
                        " in " + formatSeconds(seconds) + "s");
                int componentCount = componentsManager.getCompletedComponents().size();
                recordMetrics(m -> m.recordWorkflowCompleted(name, seconds, componentCount));
            }
            return details;

        } catch (ComponentExecutionException e) {
            return failRun(e.getCause() != null ? e.getCause() : e);
        } catch (WeaveException | RuntimeException e) {
            return failRun(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failRun(e);
        } catch (Error e) {
            return failRun(e);
        } finally {
            activeSubflow = null;
            shutdownOwnedExecutor();
        }
    }

    private void executeComponents() throws WeaveException, InterruptedException {
        while (!componentsManager.isEmpty()) {
            try {
                checkWorkflowState();
            } catch (CanceledDuringExecutionException e) {
                logger.fine("Workflow " + name + " execution canceled before step " + (step + 1));
                return;
            }

            Optional<Component> next = componentsManager.removeFirst();
            if (next.isEmpty()) {
                break;
            }

            Component component = next.get();
            step++;
            logger.fine(name + " step " + step + ": " + component.getType().getDisplayName() +
                    " '" + component.getName() + "'");

            try {
                executeComponent(component);
            } catch (CanceledDuringExecutionException e) {
                logger.fine("Workflow " + name + " execution canceled during " + component.getName());
                return;
            }
            componentsManager.complete(component);
        }

        completeRun();
    }

    private void checkWorkflowState() throws UnexpectedRunStateException, InterruptedException {
        RunState current = stateHolder.get();

        switch (current) {
            case IN_PROGRESS:
                return;
            case CANCELED:
                throw new CanceledDuringExecutionException(name);
            case PAUSED:
                logger.fine("Workflow " + name + " execution paused");
                RunState after = stateHolder.awaitWhilePaused(pauseCheckInterval);
                if (after == RunState.CANCELED) {
                    throw new CanceledDuringExecutionException(name);
                }
                if (after != RunState.IN_PROGRESS) {
                    throw new UnexpectedRunStateException(name, after);
                }
                logger.fine("Workflow " + name + " execution continuing after resume");
                return;
            default:
                throw new UnexpectedRunStateException(name, current);
        }
    }

    private void completeRun() throws InvalidTransitionException {
        if (stateHolder.tryTransition(RunState.COMPLETED)) {
            return;
        }
        RunState current = stateHolder.get();
        if (current == RunState.CANCELED) {
            logger.fine("Workflow " + name + " canceled during execution");
            return;
        }
        throw new InvalidTransitionException(id, current, RunState.COMPLETED);
    }

    private ExecutionDetails failRun(Throwable error) {
        timer.stop();
        if (timer.getStartTime().isEmpty()) {
            timer.start().stop();
        }

        if (!stateHolder.tryTransition(RunState.FAILED) && stateHolder.get() == RunState.CANCELED) {
            // cancel won the race; a canceled run carries no error
            logger.log(Level.WARNING, "Workflow " + name + " canceled while a component failed: " + error.getMessage());
            ExecutionDetails details = ExecutionDetails.fromTimer(RunState.CANCELED, timer, getOutputs(), null);
            executionDetails = details;
            recordMetrics(m -> m.recordWorkflowCancelled(name, durationSeconds()));
            return details;
        }

        // Message only; stack trace at FINE
        logger.log(Level.SEVERE, "Workflow execution failed: " + name + " - " + error.getMessage());
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Workflow execution exception details for: " + name, error);
        }

        ExecutionDetails details = ExecutionDetails.failed(timer, getOutputs(), error);
        executionDetails = details;
        String reason = error.getClass().getSimpleName();
        recordMetrics(m -> m.recordWorkflowFailed(name, durationSeconds(), reason));
        return details;
    }

    // ========== Component dispatch ==========

    private void executeComponent(Component component) throws ComponentExecutionException, InterruptedException {
        String type = component.getType().getDisplayName();
        recordMetrics(m -> m.recordStepExecuted(name, type));

        try {
            if (component instanceof Task) {
                executeTaskComponent((Task) component);
            } else if (component instanceof TaskGroup) {
                executeTaskGroupComponent((TaskGroup) component);
            } else if (component instanceof Logic) {
                executeLogicComponent((Logic) component);
            } else if (component instanceof Trigger) {
                executeTriggerComponent((Trigger) component);
            } else if (component instanceof Subflow) {
                executeSubflowComponent((Subflow) component);
            }
        } catch (ComponentExecutionException e) {
            String reason = e.getCause() != null ? e.getCause().getClass().getSimpleName() : "unknown";
            recordMetrics(m -> m.recordStepFailed(name, type, reason));
            throw e;
        }
    }

    private void executeTaskComponent(Task task) throws ComponentExecutionException {
        Map<String, Object> taskOutputs = executeTask(task, getOutputs());
        mergeOutputs(task.getName(), taskOutputs);
    }

    private void executeTaskGroupComponent(TaskGroup group) throws ComponentExecutionException, InterruptedException {
        logger.fine("Executing task group: " + group.getName() + " (" + group.getMode() + ")");
        ExecutionTimer groupTimer = new ExecutionTimer().start();

        Map<String, Object> groupOutputs;
        try {
            groupOutputs = group.isParallel() ? executeParallel(group) : executeSequential(group);
        } catch (ComponentExecutionException e) {
            groupTimer.stop();
            group.updateExecutionDetails(ExecutionDetails.failed(groupTimer, Map.of(), e.getCause()));
            throw e;
        } catch (CanceledDuringExecutionException e) {
            groupTimer.stop();
            group.updateExecutionDetails(ExecutionDetails.fromTimer(RunState.CANCELED, groupTimer, Map.of(), null));
            throw e;
        }

        groupTimer.stop();
        group.updateExecutionDetails(ExecutionDetails.completed(groupTimer, groupOutputs));
        if (group.isParallel()) {
            mergeOutputs(group.getName(), groupOutputs);
        }
        logger.fine("Task group " + group.getName() + " completed in " +
                formatSeconds(seconds(groupTimer)) + "s");
    }

    private Map<String, Object> executeSequential(TaskGroup group) throws ComponentExecutionException {
        Map<String, Object> groupOutputs = new LinkedHashMap<>();
        for (Task task : group.getTasks()) {
            Map<String, Object> taskOutputs = prefixKeys(task.getName(), executeTask(task, getOutputs()));
            groupOutputs.putAll(taskOutputs);
            mergeOutputs(group.getName(), taskOutputs);
        }
        return groupOutputs;
    }

    private Map<String, Object> executeParallel(TaskGroup group) throws ComponentExecutionException, InterruptedException {
        // Every task sees the outputs as they were before the group started
        Map<String, Object> available = getOutputs();
        Map<String, Object> groupOutputs = new LinkedHashMap<>();
        ReentrantLock mergeLock = new ReentrantLock();

        CompletionService<Void> completion = new ExecutorCompletionService<>(executorService);
        List<Future<Void>> futures = new ArrayList<>();
        for (Task task : group.getTasks()) {
            futures.add(completion.submit(() -> {
                Map<String, Object> taskOutputs = prefixKeys(task.getName(), executeTask(task, available));
                mergeLock.lock();
                try {
                    groupOutputs.putAll(taskOutputs);
                } finally {
                    mergeLock.unlock();
                }
                return null;
            }));
        }

        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<Void> done = completion.take();
                try {
                    done.get();
                } catch (ExecutionException e) {
                    cancelAll(futures);
                    throw unwrapGroupFailure(group, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        }

        mergeLock.lock();
        try {
            return new LinkedHashMap<>(groupOutputs);
        } finally {
            mergeLock.unlock();
        }
    }

    private ComponentExecutionException unwrapGroupFailure(TaskGroup group, Throwable cause) {
        if (cause instanceof ComponentExecutionException) {
            return (ComponentExecutionException) cause;
        }
        if (cause instanceof CanceledDuringExecutionException) {
            throw (CanceledDuringExecutionException) cause;
        }
        return new ComponentExecutionException(group.getName(), cause);
    }

    private void cancelAll(List<Future<Void>> futures) {
        int canceled = 0;
        for (Future<Void> future : futures) {
            if (!future.isDone() && future.cancel(true)) {
                canceled++;
            }
        }
        if (canceled > 0) {
            logger.fine("Canceled " + canceled + " in-flight task(s) in workflow " + name);
        }
    }

    /**
     * Resolves inputs, runs the task body and records its details on the task.
     */
    private Map<String, Object> executeTask(Task task, Map<String, Object> available) throws ComponentExecutionException {
        logger.fine("Executing task: " + task.getName());
        ExecutionTimer taskTimer = new ExecutionTimer().start();

        Map<String, Object> resolvedInputs = new InputResolver(available).resolve(task);

        if (stateHolder.get() == RunState.CANCELED) {
            logger.fine("Task " + task.getName() + " canceled before execution");
            throw new CanceledDuringExecutionException(name);
        }

        try {
            Map<String, Object> taskOutputs = task.execute(resolvedInputs);
            taskTimer.stop();
            task.updateExecutionDetails(ExecutionDetails.completed(taskTimer, taskOutputs));
            logger.fine("Task " + task.getName() + " completed in " + formatSeconds(seconds(taskTimer)) + "s");
            return taskOutputs;
        } catch (InterruptedException e) {
            taskTimer.stop();
            task.updateExecutionDetails(ExecutionDetails.fromTimer(RunState.CANCELED, taskTimer, Map.of(), null));
            Thread.currentThread().interrupt();
            throw new ComponentExecutionException(task.getName(), e);
        } catch (Exception | Error e) {
            taskTimer.stop();
            task.updateExecutionDetails(ExecutionDetails.failed(taskTimer, Map.of(), e));
            throw new ComponentExecutionException(task.getName(), e);
        }
    }

    private void executeLogicComponent(Logic logic) throws ComponentExecutionException {
        List<Component> next;
        try {
            next = logic.evaluate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComponentExecutionException(logic.getName(), e);
        } catch (Exception e) {
            throw new ComponentExecutionException(logic.getName(), e);
        }
        componentsManager.insert(next);
        logger.fine("Logic " + logic.getName() + " queued " + next.size() + " component(s)");
    }

    private void executeTriggerComponent(Trigger trigger) {
        try {
            List<Component> next = trigger.waitForTrigger();
            componentsManager.insert(next);
            logger.fine("Trigger " + trigger.getName() + " queued " + next.size() + " component(s)");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Trigger " + trigger.getName() + " interrupted while waiting");
            recordMetrics(m -> m.recordTriggerFailed(name, trigger.getName()));
        } catch (Exception e) {
            logger.warning("Trigger " + trigger.getName() + " failed: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Trigger exception details for: " + trigger.getName(), e);
            }
            recordMetrics(m -> m.recordTriggerFailed(name, trigger.getName()));
        }
    }

    private void executeSubflowComponent(Subflow subflow) throws ComponentExecutionException, InterruptedException {
        Workflow nested = subflow.getWorkflow();
        activeSubflow = nested;
        try {
            if (stateHolder.get() == RunState.CANCELED) {
                nested.cancel();
            }

            ExecutionDetails nestedDetails;
            try {
                nestedDetails = nested.start().get();
            } catch (ExecutionException e) {
                throw new ComponentExecutionException(nested.getName(), e.getCause());
            }

            mergeOutputs(null, nested.getOutputs());

            if (nestedDetails.getState() == RunState.FAILED) {
                Throwable cause = nestedDetails.getError()
                        .orElseGet(() -> new IllegalStateException("Subflow " + nested.getName() + " failed"));
                throw new ComponentExecutionException(nested.getName(), cause);
            }
        } finally {
            activeSubflow = null;
        }
    }

    // ========== Helpers ==========

    /**
     * Merges {@code source} into the workflow outputs, prefixing keys with
     * {@code prefix + "."} unless prefix is null. Later writes win.
     */
    private void mergeOutputs(String prefix, Map<String, Object> source) {
        outputsLock.lock();
        try {
            source.forEach((key, value) -> {
                if (value != null) {
                    outputs.put(prefix != null ? prefix + "." + key : key, value);
                }
            });
        } finally {
            outputsLock.unlock();
        }
    }

    private static Map<String, Object> prefixKeys(String prefix, Map<String, Object> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                result.put(prefix + "." + key, value);
            }
        });
        return result;
    }

    private ExecutionDetails currentDetails() {
        return ExecutionDetails.builder()
                .state(stateHolder.get())
                .outputs(getOutputs())
                .build();
    }

    private void recordMetrics(Consumer<WorkflowMetrics> recorder) {
        if (metricsEnabled) {
            recorder.accept(metrics);
        }
    }

    private double durationSeconds() {
        return seconds(timer);
    }

    private static double seconds(ExecutionTimer executionTimer) {
        return executionTimer.getDuration().map(d -> d.toNanos() / 1_000_000_000.0).orElse(0.0);
    }

    private static String formatSeconds(double seconds) {
        return String.format("%.2f", seconds);
    }

    private ExecutorService createExecutor() {
        ThreadFactory threadFactory = new WorkflowThreadFactory(name);
        // one thread for the execution loop plus executorThreads for parallel tasks
        return executorThreads > 0
                ? Executors.newFixedThreadPool(executorThreads + 1, threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
    }

    private void shutdownOwnedExecutor() {
        if (providedExecutor == null && executorService != null) {
            executorService.shutdown();
        }
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", state=" + stateHolder.get() +
               ", pending=" + componentsManager.pendingCount() +
               '}';
    }

    /**
     * Daemon threads named after the workflow.
     */
    private static class WorkflowThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkflowThreadFactory(String workflowName) {
            this.prefix = "weave-" + workflowName.replaceAll("\\s+", "-").toLowerCase() + "-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * Builder for Workflow.
     *
     * <p>A supplied {@link ExecutorService} runs both the execution loop and the tasks of
     * parallel groups, so it needs capacity for the loop plus the widest parallel group;
     * it is not shut down by the workflow. Without one, each run gets its own pool: the
     * loop thread plus {@link WeaveConfiguration#getExecutorThreads()} task threads, or a
     * cached pool when that is 0. The pool is shut down when the run ends.</p>
     */
    public static class Builder {
        private String name = Workflow.class.getSimpleName();
        private String description = "";
        private final List<Component> components = new ArrayList<>();
        private Logger logger;
        private WorkflowMetrics metrics;
        private WeaveConfiguration configuration;
        private ExecutorService executorService;

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder component(Component component) {
            this.components.add(Objects.requireNonNull(component, "Component cannot be null"));
            return this;
        }

        public Builder components(List<? extends Component> components) {
            components.forEach(this::component);
            return this;
        }

        /**
         * Adds the supplied component only when {@code condition} holds.
         */
        public Builder componentIf(boolean condition, Supplier<? extends Component> component) {
            if (condition) {
                component(component.get());
            }
            return this;
        }

        /**
         * Adds one of two components depending on {@code condition}.
         */
        public Builder componentEither(boolean condition, Supplier<? extends Component> whenTrue,
                                       Supplier<? extends Component> whenFalse) {
            return component(condition ? whenTrue.get() : whenFalse.get());
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder configuration(WeaveConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Workflow build() {
            return new Workflow(this);
        }
    }
}
