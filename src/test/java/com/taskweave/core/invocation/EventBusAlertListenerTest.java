package com.taskweave.core.invocation;

import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.TaskweaveEvent;
import com.taskweave.core.metrics.TaskweaveMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBusAlertListenerTest {

    private final RepeatedFailureAlert alert = new RepeatedFailureAlert(
            "API_unit", 6, 3, FailureKind.TIMEOUT, Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    void publishesAlertEventAndCountsIt() {
        var bus = new EventBus();
        var registry = new SimpleMeterRegistry();
        List<TaskweaveEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        new EventBusAlertListener(bus, new TaskweaveMetrics(registry)).onAlert(alert);

        assertEquals(1, received.size());
        TaskweaveEvent event = received.get(0);
        assertEquals("invocation.alert", event.eventType());
        assertNull(event.workflowId());
        assertEquals("API_unit", event.unit());
        assertEquals(6L, event.payload().get("degradeCount"));
        assertEquals(3, event.payload().get("threshold"));
        assertEquals("timeout", event.payload().get("lastFailure"));
        assertEquals(alert.timestamp(), event.timestamp());
        assertEquals(1.0, registry.get("taskweave.alerts.total").tag("unit", "API_unit").counter().count());
    }

    @Test
    void worksWithoutMetrics() {
        var bus = new EventBus();
        List<TaskweaveEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        assertDoesNotThrow(() -> new EventBusAlertListener(bus, null).onAlert(alert));
        assertEquals(1, received.size());
    }
}
