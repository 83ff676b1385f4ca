package com.taskweave.core.unit;

import com.taskweave.core.backend.BackendException;
import com.taskweave.core.backend.PrimaryBackend;
import com.taskweave.core.backend.SecondaryBackend;
import com.taskweave.core.context.ContextCodec;
import com.taskweave.core.context.ContextStore;
import com.taskweave.core.context.UnitState;
import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.invocation.BothBackendsFailedException;
import com.taskweave.core.invocation.FailureKind;
import com.taskweave.core.invocation.ResilientInvocationController;
import com.taskweave.core.workflow.WorkflowOrchestrator;
import com.taskweave.core.workflow.WorkflowStatus;
import com.taskweave.core.workflow.WorkflowStep;
import com.taskweave.support.MutableClock;
import com.taskweave.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InvokingUnitTest {

    private MutableClock clock;
    private ContextStore store;
    private WorkflowContext ctx;
    private AtomicInteger secondaryCalls;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = TestStores.inMemory(clock);
        ctx = store.create("build a login page");
        secondaryCalls = new AtomicInteger();
    }

    private ResilientInvocationController controller(PrimaryBackend primary, SecondaryBackend secondary) {
        return new ResilientInvocationController(primary, secondary, null,
                ResilientInvocationController.Options.defaults(), ContextCodec.defaultMapper())
                .withSleeper(d -> { })
                .withClock(clock);
    }

    @Test
    @DisplayName("stores the primary output under the output key")
    void storesOutput() {
        PrimaryBackend primary = (task, context, permissions) -> Map.of("task", task);
        var unit = new InvokingUnit("designer", controller(primary, prompt -> "unused"), "design it", "design");

        unit.run(ctx);

        assertEquals(Map.of("task", "design it"), ctx.get("design"));
        assertFalse(unit.lastRecord().degraded());
        assertEquals(UnitState.COMPLETED, unit.state());
    }

    @Test
    @DisplayName("task text can be built from earlier artifacts")
    void taskFromContext() {
        ctx.set("page", "login");
        PrimaryBackend primary = (task, context, permissions) -> Map.of("task", task);
        var unit = new InvokingUnit("coder", controller(primary, prompt -> "unused"),
                c -> "implement the " + c.get("page") + " page", "code", 0, Duration.ZERO, null);

        unit.run(ctx);

        assertEquals(Map.of("task", "implement the login page"), ctx.get("code"));
    }

    @Test
    @DisplayName("a degraded invocation inside a workflow still completes the unit")
    void degradesInsideWorkflow() {
        PrimaryBackend primary = (task, context, permissions) -> {
            throw new BackendException(FailureKind.BACKEND_UNAVAILABLE, "cli missing");
        };
        SecondaryBackend secondary = prompt -> {
            secondaryCalls.incrementAndGet();
            return "```json\n{\"files\": [\"Login.java\"]}\n```";
        };
        var controller = controller(primary, secondary);
        var orchestrator = new WorkflowOrchestrator(store, WorkflowOrchestrator.Options.defaults(), null, null, clock);

        var result = orchestrator.runSequential(
                List.of(WorkflowStep.of(new InvokingUnit("coder", controller, "write code", "code"))), ctx);

        assertEquals(WorkflowStatus.COMPLETED, result.status());
        assertEquals(Map.of("files", List.of("Login.java")), ctx.get("code"));
        assertEquals(1, secondaryCalls.get());
        assertEquals(1, ctx.degradationLog().size());
        assertEquals("backend_unavailable", ctx.degradationLog().get(0).failureKind());
        assertEquals(1, controller.getStatistics().degradedInvocations());
    }

    @Test
    @DisplayName("failure of both backends is not retried by the unit")
    void bothFailedNotRetried() {
        var primaryCalls = new AtomicInteger();
        PrimaryBackend primary = (task, context, permissions) -> {
            primaryCalls.incrementAndGet();
            throw new BackendException(FailureKind.CREDENTIALS_ABSENT, "no key");
        };
        SecondaryBackend secondary = prompt -> {
            throw new IllegalStateException("secondary down");
        };
        var unit = new InvokingUnit("coder", controller(primary, secondary), c -> "t", "out", 3,
                Duration.ZERO, null);

        var ex = assertThrows(UnitExecutionFailedException.class, () -> unit.run(ctx));

        assertInstanceOf(BothBackendsFailedException.class, ex.lastError());
        assertEquals(1, ex.attempts());
        assertEquals(1, primaryCalls.get());
    }
}
