package com.taskweave.core.workflow;

import com.taskweave.core.context.ContextStore;
import com.taskweave.core.context.Priority;
import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.TaskweaveEvent;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.unit.WorkUnit;
import com.taskweave.core.unit.WorkUnits;
import com.taskweave.support.MutableClock;
import com.taskweave.support.TestStores;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowOrchestratorTest {

    private MutableClock clock;
    private ContextStore store;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private WorkflowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = TestStores.inMemory(clock);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        orchestrator = new WorkflowOrchestrator(store, new WorkflowOrchestrator.Options(2, null, true, false),
                eventBus, new TaskweaveMetrics(registry), clock);
    }

    private static WorkUnit failing(String name, String message) {
        return WorkUnits.of(name, 0, Duration.ZERO, c -> {
            throw new IllegalStateException(message);
        });
    }

    private static WorkUnit writing(String name, String key, Object value) {
        return WorkUnits.of(name, c -> {
            c.set(key, value);
            return value;
        });
    }

    @Nested
    @DisplayName("sequential")
    class SequentialTests {

        @Test
        @DisplayName("units share artifacts through the context in order")
        void endToEnd() {
            var ctx = store.create("demo", null, Priority.NORMAL, Duration.ofHours(24));
            var db = WorkUnits.of("DB_unit", c -> {
                c.set("schema", Map.of("table", "users"));
                return "schema ready";
            });
            var api = WorkUnits.of("API_unit", c -> {
                @SuppressWarnings("unchecked")
                var schema = (Map<String, Object>) c.get("schema");
                assertEquals("users", schema.get("table"));
                c.set("endpoints", List.of("/login"));
                return "endpoints ready";
            });

            var result = orchestrator.runSequential(List.of(WorkflowStep.of(db), WorkflowStep.of(api)), ctx);

            assertEquals(2, ctx.version());
            assertEquals(Map.of("schema", Map.of("table", "users"), "endpoints", List.of("/login")), ctx.artifacts());
            assertEquals(List.of("DB_unit", "API_unit"), ctx.completedUnits());

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertTrue(result.isSuccess());
            assertEquals(List.of("DB_unit", "API_unit"), result.agentsRun());
            assertEquals(List.of("DB_unit", "API_unit"), result.agentsCompleted());
            assertEquals("schema ready", result.results().get("DB_unit"));
            assertNull(result.error());
            assertEquals("completed", ctx.phase());
        }

        @Test
        @DisplayName("first failure stops the run and leaves later steps unlisted")
        void abortsOnFailure() {
            var ctx = store.create("t");
            var never = new AtomicInteger();
            var steps = List.of(
                    WorkflowStep.of(writing("first", "a", 1)),
                    WorkflowStep.of(failing("second", "disk on fire")),
                    WorkflowStep.of(WorkUnits.of("third", c -> never.incrementAndGet())));

            var result = orchestrator.runSequential(steps, ctx);

            assertEquals(WorkflowStatus.PARTIAL, result.status());
            assertEquals(List.of("first"), result.agentsCompleted());
            assertEquals(List.of("second"), result.agentsFailed());
            assertTrue(result.agentsSkipped().isEmpty());
            assertEquals(List.of("first", "second"), result.agentsRun());
            assertEquals("Unit 'second' failed: disk on fire", result.error());
            assertEquals("disk on fire", result.results().get("second"));
            assertFalse(result.results().containsKey("third"));
            assertEquals(0, never.get());
            assertEquals("partial", ctx.phase());
        }

        @Test
        @DisplayName("status is failed when nothing completed")
        void allFailed() {
            var result = orchestrator.runSequential(List.of(WorkflowStep.of(failing("only", "x"))), store.create("t"));
            assertEquals(WorkflowStatus.FAILED, result.status());
            assertFalse(result.isSuccess());
        }

        @Test
        @DisplayName("empty step list completes immediately")
        void emptySteps() {
            var result = orchestrator.runSequential(List.of(), store.create("t"));
            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertTrue(result.agentsRun().isEmpty());
        }

        @Test
        @DisplayName("lifecycle events are published in order")
        void events() {
            var ctx = store.create("t");
            var types = new ArrayList<String>();
            eventBus.subscribe(ctx.id(), e -> types.add(e.eventType()));

            orchestrator.runSequential(List.of(WorkflowStep.of(writing("a", "k", 1)),
                    WorkflowStep.of(writing("b", "j", 2))), ctx);

            assertEquals(List.of("workflow.started", "unit.started", "unit.completed",
                    "unit.started", "unit.completed", "workflow.completed"), types);
        }
    }

    @Nested
    @DisplayName("parallel")
    class ParallelTests {

        @Test
        @DisplayName("every unit runs and concurrency stays within maxParallel")
        void boundedConcurrency() {
            var ctx = store.create("t");
            var running = new AtomicInteger();
            var peak = new AtomicInteger();
            var steps = new ArrayList<WorkflowStep>();
            for (int i = 0; i < 5; i++) {
                String name = "worker-" + i;
                steps.add(WorkflowStep.of(WorkUnits.of(name, c -> {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(50);
                    running.decrementAndGet();
                    c.set(name, "done");
                    return name;
                })));
            }

            var result = orchestrator.runParallel(steps, ctx);

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(5, result.agentsCompleted().size());
            assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
            assertEquals(5, ctx.version());
            assertEquals(List.of("worker-0", "worker-1", "worker-2", "worker-3", "worker-4"),
                    List.copyOf(result.unitResults().keySet()));
        }

        @Test
        @DisplayName("a failing unit does not stop its siblings")
        void isolation() {
            var ctx = store.create("t");
            var steps = List.of(
                    WorkflowStep.of(writing("ok-1", "a", 1)),
                    WorkflowStep.of(failing("bad", "boom")),
                    WorkflowStep.of(writing("ok-2", "b", 2)));

            var result = orchestrator.runParallel(steps, ctx);

            assertEquals(WorkflowStatus.PARTIAL, result.status());
            assertEquals(2, result.agentsCompleted().size());
            assertEquals(List.of("bad"), result.agentsFailed());
            assertEquals(1, ctx.get("a"));
            assertEquals(2, ctx.get("b"));
        }

        @Test
        @DisplayName("unit timeouts apply to parallel units")
        void timeout() {
            var timed = new WorkflowOrchestrator(store,
                    new WorkflowOrchestrator.Options(2, Duration.ofMillis(100), true, false), eventBus, null, clock);
            var slow = WorkUnits.of("slow", 0, Duration.ZERO, c -> {
                Thread.sleep(5_000);
                return null;
            });

            var result = timed.runParallel(List.of(WorkflowStep.of(slow), WorkflowStep.of(writing("fast", "k", 1))),
                    store.create("t"));

            assertEquals(List.of("slow"), result.agentsFailed());
            assertEquals(List.of("fast"), result.agentsCompleted());
        }
    }

    @Nested
    @DisplayName("conditional")
    class ConditionalTests {

        @Test
        @DisplayName("steps whose condition is false are skipped")
        void skipsFalseCondition() {
            var ctx = store.create("t");
            var steps = List.of(
                    WorkflowStep.of(writing("plan", "needsTests", false)),
                    WorkflowStep.when(writing("tests", "tested", true), c -> Boolean.TRUE.equals(c.get("needsTests"))),
                    WorkflowStep.when(writing("deploy", "deployed", true), c -> c.contains("needsTests")));

            var result = orchestrator.runConditional(steps, ctx);

            assertEquals(List.of("plan", "deploy"), result.agentsCompleted());
            assertEquals(List.of("tests"), result.agentsSkipped());
            assertEquals(UnitResult.Outcome.SKIPPED, result.unitResults().get("tests").outcome());
            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertFalse(ctx.contains("tested"));
        }

        @Test
        @DisplayName("a throwing condition fails the step and stops the run")
        void throwingCondition() {
            var steps = List.of(
                    WorkflowStep.when(writing("check", "k", 1), c -> {
                        throw new IllegalStateException("cannot decide");
                    }),
                    WorkflowStep.of(writing("after", "j", 2)));

            var result = orchestrator.runConditional(steps, store.create("t"));

            assertEquals(List.of("check"), result.agentsFailed());
            assertTrue(result.error().contains("cannot decide"));
            assertTrue(result.agentsCompleted().isEmpty());
        }

        @Test
        @DisplayName("conditions are refused outside the conditional strategy")
        void conditionNeedsConditionalStrategy() {
            var steps = List.of(WorkflowStep.when(writing("x", "k", 1), c -> true));
            assertThrows(IllegalArgumentException.class, () -> orchestrator.runSequential(steps, store.create("t")));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancelling a sequential run skips the remaining steps")
        void cancelSequential() {
            var ctx = store.create("t");
            var canceller = WorkUnits.of("canceller", c -> orchestrator.cancelWorkflow(c.id()));
            var steps = List.of(WorkflowStep.of(canceller),
                    WorkflowStep.of(writing("b", "k", 1)),
                    WorkflowStep.of(writing("c", "j", 2)));

            var result = orchestrator.runSequential(steps, ctx);

            assertTrue(result.cancelled());
            assertFalse(result.isSuccess());
            assertEquals(WorkflowStatus.PARTIAL, result.status());
            assertEquals(List.of("canceller"), result.agentsCompleted());
            assertEquals(List.of("b", "c"), result.agentsSkipped());
            assertEquals(Boolean.TRUE, result.results().get("canceller"));
            assertEquals("cancelled", ctx.phase());
            assertFalse(orchestrator.isActive(ctx.id()));
        }

        @Test
        @DisplayName("results finishing after a parallel cancel are discarded")
        void cancelParallel() {
            var serial = new WorkflowOrchestrator(store, new WorkflowOrchestrator.Options(1, null, true, false),
                    eventBus, null, clock);
            var ctx = store.create("t");
            var canceller = WorkUnits.of("canceller", c -> serial.cancelWorkflow(c.id()));
            var steps = List.of(WorkflowStep.of(canceller),
                    WorkflowStep.of(writing("b", "k", 1)),
                    WorkflowStep.of(writing("c", "j", 2)));

            var result = serial.runParallel(steps, ctx);

            assertTrue(result.cancelled());
            assertEquals(WorkflowStatus.FAILED, result.status());
            assertTrue(result.agentsCompleted().isEmpty());
            assertEquals(UnitResult.Outcome.DISCARDED, result.unitResults().get("canceller").outcome());
            assertEquals(List.of("b", "c"), result.agentsSkipped());
            assertFalse(result.results().containsKey("canceller"));
            assertFalse(ctx.completedUnits().contains("canceller"));
            assertTrue(ctx.eventLog().stream().anyMatch(e -> e.kind().equals("unit.discarded")));
        }

        @Test
        @DisplayName("cancelling an unknown workflow reports false")
        void cancelUnknown() {
            assertFalse(orchestrator.cancelWorkflow("WF-NOPE"));
        }
    }

    @Nested
    @DisplayName("validation and lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("duplicate step names are rejected before anything runs")
        void duplicateNames() {
            var ran = new AtomicInteger();
            var steps = List.of(WorkflowStep.of(WorkUnits.of("same", c -> ran.incrementAndGet())),
                    WorkflowStep.of(WorkUnits.of("same", c -> ran.incrementAndGet())));

            assertThrows(IllegalArgumentException.class, () -> orchestrator.runParallel(steps, store.create("t")));
            assertEquals(0, ran.get());
        }

        @Test
        @DisplayName("step name must match its unit")
        void stepNameMismatch() {
            assertThrows(IllegalArgumentException.class,
                    () -> WorkflowStep.of("other", writing("unit", "k", 1)));
        }

        @Test
        @DisplayName("a context cannot host two runs at once")
        void noConcurrentRunsOnOneContext() {
            var ctx = store.create("t");
            var nested = new AtomicReference<Throwable>();
            var reentrant = WorkUnits.of("reentrant", c -> {
                try {
                    orchestrator.runSequential(List.of(), c);
                } catch (IllegalStateException e) {
                    nested.set(e);
                }
                return null;
            });

            orchestrator.runSequential(List.of(WorkflowStep.of(reentrant)), ctx);

            assertInstanceOf(IllegalStateException.class, nested.get());
        }

        @Test
        @DisplayName("runWorkflow seeds artifacts and saves the context")
        void runWorkflowSaves() {
            var request = WorkflowRequest.of("ship it", Map.of("branch", "main"));
            var seen = new CopyOnWriteArrayList<Object>();
            var unit = WorkUnits.of("reader", c -> {
                seen.add(c.get("branch"));
                return null;
            });

            var result = orchestrator.runWorkflow(ExecutionStrategy.SEQUENTIAL, List.of(WorkflowStep.of(unit)), request);

            assertEquals(List.of("main"), seen);
            assertTrue(store.exists(result.workflowId()));
            var loaded = orchestrator.loadContext(result.workflowId());
            assertEquals(1, loaded.version());
            assertEquals(List.of("reader"), loaded.completedUnits());
        }

        @Test
        @DisplayName("runWorkflow archives when configured to")
        void runWorkflowArchives() {
            var archiving = new WorkflowOrchestrator(store, new WorkflowOrchestrator.Options(2, null, true, true),
                    eventBus, null, clock);

            var result = archiving.runWorkflow(ExecutionStrategy.PARALLEL,
                    List.of(WorkflowStep.of(writing("a", "k", 1))), WorkflowRequest.of("t"));

            assertFalse(store.exists(result.workflowId()));
            assertEquals(List.of(result.workflowId()), store.listArchivedIds());
        }

        @Test
        @DisplayName("cleanupExpiredWorkflows archives contexts past their ttl")
        void cleanup() {
            WorkflowContext ctx = store.create("t", null, null, Duration.ofMinutes(1));
            orchestrator.saveContext(ctx);
            clock.advance(Duration.ofMinutes(2));

            assertEquals(List.of(ctx.id()), orchestrator.cleanupExpiredWorkflows());
        }

        @Test
        @DisplayName("workflow results are counted by strategy and status")
        void metrics() {
            orchestrator.runSequential(List.of(WorkflowStep.of(writing("a", "k", 1))), store.create("t"));

            var counter = registry.find("taskweave.workflows.total")
                    .tag("strategy", "sequential").tag("status", "completed").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
            assertNotNull(registry.find("taskweave.unit.duration").tag("unit", "a").timer());
        }

        @Test
        @DisplayName("global subscribers see unit failures with their error")
        void failureEvent() {
            var failures = new ArrayList<TaskweaveEvent>();
            eventBus.subscribeAll(e -> {
                if (e.eventType().equals("unit.failed")) {
                    failures.add(e);
                }
            });

            orchestrator.runSequential(List.of(WorkflowStep.of(failing("bad", "nope"))), store.create("t"));

            assertEquals(1, failures.size());
            assertEquals("bad", failures.get(0).unit());
            assertEquals("nope", failures.get(0).payload().get("error"));
        }
    }
}
