package com.taskweave.core.workflow;

import com.taskweave.core.config.TaskweaveProperties;
import com.taskweave.core.context.ContextStateException;
import com.taskweave.core.context.ContextStore;
import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.TaskweaveEvent;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.unit.UnitExecutionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs lists of {@link WorkflowStep}s over one shared {@link WorkflowContext}.
 * <p>
 * Sequential and conditional runs execute on the calling thread in list order
 * and stop at the first failure; the remaining steps are reported nowhere.
 * Parallel runs use a pool of at most {@code maxParallel} threads and let every
 * unit finish regardless of its siblings. All strategies return the same
 * {@link WorkflowResult} shape.
 * <p>
 * A run can be cancelled by context id while it is active. Units not yet
 * started are skipped; running units finish, and in a parallel run their
 * results are discarded.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    /**
     * @param maxParallel        concurrency limit of parallel runs
     * @param defaultUnitTimeout per-attempt timeout for units that set none; null for none
     * @param saveOnComplete     save the context after {@link #runWorkflow}
     * @param archiveOnComplete  archive the context after {@link #runWorkflow}
     */
    public record Options(int maxParallel, Duration defaultUnitTimeout, boolean saveOnComplete,
                          boolean archiveOnComplete) {

        public Options {
            if (maxParallel < 1) {
                throw new IllegalArgumentException("maxParallel must be >= 1");
            }
        }

        public static Options defaults() {
            return new Options(5, Duration.ofMinutes(5), true, false);
        }

        static Options from(TaskweaveProperties properties) {
            var context = properties.getContext();
            return new Options(properties.getWorkflow().getMaxParallel(), properties.getUnitTimeout(),
                    context.isSaveOnComplete(), context.isArchiveOnComplete());
        }
    }

    private record ActiveRun(WorkflowContext context, CancellationToken token) {}

    private final ContextStore store;
    private final Options options;
    private final EventBus eventBus;
    private final TaskweaveMetrics metrics;
    private final Clock clock;
    private final ConcurrentHashMap<String, ActiveRun> active = new ConcurrentHashMap<>();

    @Autowired
    public WorkflowOrchestrator(ContextStore store, TaskweaveProperties properties, EventBus eventBus,
                                @Autowired(required = false) TaskweaveMetrics metrics, Clock clock) {
        this(store, Options.from(properties), eventBus, metrics, clock);
    }

    public WorkflowOrchestrator(ContextStore store, Options options, EventBus eventBus, TaskweaveMetrics metrics,
                                Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.options = options;
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Entry points ────────────────────────────────────────────────────

    /**
     * Creates a context from {@code request}, runs the steps over it and then
     * saves or archives it as configured.
     */
    public WorkflowResult runWorkflow(ExecutionStrategy strategy, List<WorkflowStep> steps, WorkflowRequest request) {
        validateSteps(strategy, steps);
        WorkflowContext context = createContext(request);
        WorkflowResult result = run(strategy, steps, context);
        if (options.archiveOnComplete()) {
            store.archive(context);
        } else if (options.saveOnComplete()) {
            store.save(context);
        }
        return result;
    }

    public WorkflowResult run(ExecutionStrategy strategy, List<WorkflowStep> steps, WorkflowContext context) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(context, "context");
        validateSteps(strategy, steps);
        return execute(strategy, steps, context);
    }

    public WorkflowResult runSequential(List<WorkflowStep> steps, WorkflowContext context) {
        return run(ExecutionStrategy.SEQUENTIAL, steps, context);
    }

    public WorkflowResult runParallel(List<WorkflowStep> steps, WorkflowContext context) {
        return run(ExecutionStrategy.PARALLEL, steps, context);
    }

    public WorkflowResult runConditional(List<WorkflowStep> steps, WorkflowContext context) {
        return run(ExecutionStrategy.CONDITIONAL, steps, context);
    }

    // ── Context lifecycle ───────────────────────────────────────────────

    /**
     * Creates a context and applies the request's initial artifacts as a single update.
     */
    public WorkflowContext createContext(WorkflowRequest request) {
        WorkflowContext context = store.create(request.task(), request.owner(), request.priority(), request.ttl());
        if (!request.initialArtifacts().isEmpty()) {
            context.update(request.initialArtifacts());
        }
        return context;
    }

    public WorkflowContext loadContext(String id) {
        return store.load(id);
    }

    public String saveContext(WorkflowContext context) {
        return store.save(context);
    }

    public void archiveWorkflow(WorkflowContext context) {
        store.archive(context);
    }

    public void archiveWorkflow(String id) {
        store.archive(store.load(id));
    }

    /**
     * Signals the active run on context {@code id} to stop dispatching units.
     *
     * @return false when no run is active for that id
     */
    public boolean cancelWorkflow(String id) {
        ActiveRun run = active.get(id);
        if (run == null) {
            return false;
        }
        if (run.token().cancel()) {
            log.info("Cancellation requested for workflow {}", id);
        }
        return true;
    }

    /**
     * Archives every stored context past its TTL.
     *
     * @return ids that were archived
     */
    public List<String> cleanupExpiredWorkflows() {
        return store.cleanupExpired();
    }

    public boolean isActive(String id) {
        return active.containsKey(id);
    }

    public List<String> activeWorkflowIds() {
        return List.copyOf(active.keySet());
    }

    // ── Execution ───────────────────────────────────────────────────────

    private void validateSteps(ExecutionStrategy strategy, List<WorkflowStep> steps) {
        Objects.requireNonNull(steps, "steps");
        var names = new HashSet<String>();
        for (WorkflowStep step : steps) {
            Objects.requireNonNull(step, "step");
            if (!names.add(step.name())) {
                throw new IllegalArgumentException("Duplicate step name: " + step.name());
            }
            if (step.isConditional() && strategy != ExecutionStrategy.CONDITIONAL) {
                throw new IllegalArgumentException("Step '" + step.name() + "' has a condition but strategy is "
                        + strategy.wireName());
            }
        }
    }

    private WorkflowResult execute(ExecutionStrategy strategy, List<WorkflowStep> steps, WorkflowContext context) {
        var token = new CancellationToken();
        if (active.putIfAbsent(context.id(), new ActiveRun(context, token)) != null) {
            throw new IllegalStateException("A workflow is already running on context " + context.id());
        }
        MdcContext.setWorkflow(context.id());
        Instant start = clock.instant();
        var aggregate = new RunAggregate(steps);
        try {
            log.info("Workflow {} started: {} step(s), strategy {}", context.id(), steps.size(), strategy.wireName());
            bookkeep(context, "running", null, "workflow.started", strategy.wireName());
            publish("workflow.started", context.id(), null,
                    Map.of("strategy", strategy.wireName(), "steps", steps.size()));

            switch (strategy) {
                case SEQUENTIAL -> runInOrder(steps, context, token, aggregate, false);
                case CONDITIONAL -> runInOrder(steps, context, token, aggregate, true);
                case PARALLEL -> runBounded(steps, context, token, aggregate);
            }

            WorkflowResult result = aggregate.toResult(context.id(), strategy, token.isCancelled(),
                    Duration.between(start, clock.instant()));
            finish(context, result);
            return result;
        } finally {
            active.remove(context.id());
            MdcContext.clear();
        }
    }

    private void runInOrder(List<WorkflowStep> steps, WorkflowContext context, CancellationToken token,
                            RunAggregate aggregate, boolean conditional) {
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (token.isCancelled()) {
                skipRemaining(steps.subList(i, steps.size()), context, aggregate, "workflow cancelled");
                return;
            }
            if (conditional && step.isConditional()) {
                boolean shouldRun;
                try {
                    shouldRun = step.condition().test(context);
                } catch (RuntimeException e) {
                    log.error("Condition of step {} threw: {}", step.name(), e.getMessage(), e);
                    aggregate.record(UnitResult.failed(step.name(), "condition failed: " + e.getMessage(),
                            Duration.ZERO));
                    publish("unit.failed", context.id(), step.name(), Map.of("error", "condition failed"));
                    return;
                }
                if (!shouldRun) {
                    skip(step, context, aggregate, "condition not met");
                    continue;
                }
            }
            UnitResult result = runOne(step, context, token, aggregate, false);
            if (result.outcome() == UnitResult.Outcome.FAILED) {
                int remaining = steps.size() - i - 1;
                if (remaining > 0) {
                    log.warn("Aborting workflow {} after failure of {}; {} step(s) not run",
                            context.id(), step.name(), remaining);
                }
                return;
            }
        }
    }

    private void runBounded(List<WorkflowStep> steps, WorkflowContext context, CancellationToken token,
                            RunAggregate aggregate) {
        if (steps.isEmpty()) {
            return;
        }
        int threads = Math.min(options.maxParallel(), steps.size());
        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "workflow-" + context.id() + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try (var section = context.openParallelSection()) {
            var futures = new ArrayList<CompletableFuture<Void>>();
            for (WorkflowStep step : steps) {
                futures.add(CompletableFuture.runAsync(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        if (token.isCancelled()) {
                            skip(step, context, aggregate, "workflow cancelled");
                        } else {
                            runOne(step, context, token, aggregate, true);
                        }
                    } finally {
                        MDC.clear();
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }
    }

    private UnitResult runOne(WorkflowStep step, WorkflowContext context, CancellationToken token,
                              RunAggregate aggregate, boolean discardIfCancelled) {
        String name = step.name();
        Instant start = clock.instant();
        aggregate.started(name);
        publish("unit.started", context.id(), name, Map.of());

        UnitResult result;
        try {
            Object output = step.unit().run(context, options.defaultUnitTimeout());
            Duration elapsed = Duration.between(start, clock.instant());
            if (discardIfCancelled && token.isCancelled()) {
                log.info("Discarding result of {}: workflow {} was cancelled", name, context.id());
                withdraw(context, name);
                result = UnitResult.discarded(name, elapsed);
            } else {
                result = UnitResult.completed(name, output, elapsed);
                publish("unit.completed", context.id(), name, Map.of("durationMs", elapsed.toMillis()));
            }
        } catch (UnitExecutionFailedException e) {
            result = failure(step, context, start, describe(e.lastError()));
        } catch (RuntimeException e) {
            log.error("Unit {} could not be run: {}", name, e.getMessage(), e);
            result = failure(step, context, start, describe(e));
        }
        if (metrics != null) {
            metrics.recordUnitExecution(name, result.duration());
        }
        aggregate.record(result);
        return result;
    }

    private UnitResult failure(WorkflowStep step, WorkflowContext context, Instant start, String error) {
        Duration elapsed = Duration.between(start, clock.instant());
        publish("unit.failed", context.id(), step.name(), Map.of("error", error));
        return UnitResult.failed(step.name(), error, elapsed);
    }

    private void skip(WorkflowStep step, WorkflowContext context, RunAggregate aggregate, String reason) {
        log.info("Skipping {}: {}", step.name(), reason);
        aggregate.record(UnitResult.skipped(step.name(), reason));
        bookkeep(context, null, step.name(), "unit.skipped", reason);
        publish("unit.skipped", context.id(), step.name(), Map.of("reason", reason));
    }

    private void skipRemaining(List<WorkflowStep> remaining, WorkflowContext context, RunAggregate aggregate,
                               String reason) {
        for (WorkflowStep step : remaining) {
            skip(step, context, aggregate, reason);
        }
    }

    private void finish(WorkflowContext context, WorkflowResult result) {
        String kind = result.cancelled() ? "workflow.cancelled" : "workflow.completed";
        String phase = result.cancelled() ? "cancelled" : result.status().wireName();
        bookkeep(context, phase, null, kind, result.status().wireName());
        publish(kind, context.id(), null, Map.of(
                "status", result.status().wireName(),
                "completed", result.agentsCompleted().size(),
                "failed", result.agentsFailed().size(),
                "skipped", result.agentsSkipped().size()));
        if (metrics != null) {
            metrics.recordWorkflowResult(result.strategy().wireName(), phase);
        }
        log.info("Workflow {} {}: {} completed, {} failed, {} skipped in {}ms", context.id(), phase,
                result.agentsCompleted().size(), result.agentsFailed().size(), result.agentsSkipped().size(),
                result.duration().toMillis());
    }

    /** Context bookkeeping must not turn a finished run into an exception. */
    private void bookkeep(WorkflowContext context, String phase, String unit, String kind, String detail) {
        try {
            if (phase != null) {
                context.markPhase(phase);
            }
            context.appendEvent(unit, kind, detail);
        } catch (ContextStateException e) {
            log.warn("Could not record {} in context {}: {}", kind, context.id(), e.getMessage());
        }
    }

    private void withdraw(WorkflowContext context, String unit) {
        try {
            context.withdrawCompletion(unit);
            context.appendEvent(unit, "unit.discarded", "workflow cancelled");
        } catch (ContextStateException e) {
            log.warn("Could not withdraw {} from context {}: {}", unit, context.id(), e.getMessage());
        }
    }

    private void publish(String type, String workflowId, String unit, Map<String, Object> payload) {
        eventBus.publish(new TaskweaveEvent(type, workflowId, unit, payload, clock.instant()));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
