package com.taskweave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow runs and backend invocations.
 */
@Service
public class TaskweaveMetrics {

    private final MeterRegistry registry;

    public TaskweaveMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordUnitExecution(String unit, Duration elapsed) {
        Timer.builder("taskweave.unit.duration")
                .tag("unit", unit)
                .register(registry)
                .record(elapsed);
    }

    public void recordWorkflowResult(String strategy, String status) {
        Counter.builder("taskweave.workflows.total")
                .tag("strategy", strategy)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records one completed invocation, degraded or not.
     *
     * @param backend name of the backend that produced the result
     */
    public void recordInvocation(String backend, boolean degraded, Duration elapsed) {
        Counter.builder("taskweave.invocations.total")
                .tag("backend", backend)
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
        Timer.builder("taskweave.invocation.duration")
                .tag("backend", backend)
                .register(registry)
                .record(elapsed);
    }

    public void recordInvocationFailure(String failureKind) {
        Counter.builder("taskweave.invocation.failures")
                .description("Classified primary backend failures")
                .tag("kind", failureKind)
                .register(registry)
                .increment();
    }

    public void recordInvocationRetry() {
        Counter.builder("taskweave.invocation.retries")
                .description("Primary backend retries after a retryable failure")
                .register(registry)
                .increment();
    }

    public void recordAlert(String unit) {
        Counter.builder("taskweave.alerts.total")
                .description("Repeated-failure alerts raised")
                .tag("unit", unit)
                .register(registry)
                .increment();
    }
}
