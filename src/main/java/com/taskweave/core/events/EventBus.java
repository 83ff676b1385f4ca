package com.taskweave.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process pub/sub for workflow and invocation events.
 * <p>
 * A subscription is scoped to one workflow or to all of them, and may narrow
 * itself to event types starting with a prefix such as {@code "invocation."}.
 * Workflow-scoped subscribers are called before unscoped ones, each in
 * subscription order, on the publishing thread. A subscriber that throws is
 * counted and logged; the publisher and the remaining subscribers carry on.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> byWorkflow = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Listener> unscoped = new CopyOnWriteArrayList<>();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private record Listener(String typePrefix, Consumer<TaskweaveEvent> consumer) {
        boolean accepts(TaskweaveEvent event) {
            return typePrefix == null
                    || (event.eventType() != null && event.eventType().startsWith(typePrefix));
        }
    }

    public void publish(TaskweaveEvent event) {
        Objects.requireNonNull(event, "event");
        published.incrementAndGet();
        log.debug("Publishing {} for workflow {}", event.eventType(), event.workflowId());

        if (event.workflowId() != null) {
            List<Listener> scoped = byWorkflow.get(event.workflowId());
            if (scoped != null) {
                scoped.forEach(listener -> deliver(listener, event));
            }
        }
        unscoped.forEach(listener -> deliver(listener, event));
    }

    /**
     * Receives every event of one workflow.
     *
     * @return a handle that removes the subscription
     */
    public Subscription subscribe(String workflowId, Consumer<TaskweaveEvent> consumer) {
        return subscribe(workflowId, null, consumer);
    }

    /**
     * Receives the events of one workflow whose type starts with {@code typePrefix};
     * a null prefix matches every type.
     */
    public Subscription subscribe(String workflowId, String typePrefix, Consumer<TaskweaveEvent> consumer) {
        Objects.requireNonNull(workflowId, "workflowId");
        var listener = new Listener(typePrefix, Objects.requireNonNull(consumer, "consumer"));
        byWorkflow.computeIfAbsent(workflowId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byWorkflow.computeIfPresent(workflowId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Receives every event, including those outside any workflow. */
    public Subscription subscribeAll(Consumer<TaskweaveEvent> consumer) {
        return subscribeToType(null, consumer);
    }

    /** Receives events of any workflow whose type starts with {@code typePrefix}. */
    public Subscription subscribeToType(String typePrefix, Consumer<TaskweaveEvent> consumer) {
        var listener = new Listener(typePrefix, Objects.requireNonNull(consumer, "consumer"));
        unscoped.add(listener);
        return () -> unscoped.remove(listener);
    }

    /** Whether anything is subscribed to {@code workflowId} specifically. */
    public boolean hasSubscribers(String workflowId) {
        return byWorkflow.containsKey(workflowId);
    }

    public DeliveryStats stats() {
        return new DeliveryStats(published.get(), delivered.get(), failed.get());
    }

    /**
     * Counters since the bus was created.
     *
     * @param published events handed to {@link #publish}
     * @param delivered subscriber calls that returned normally
     * @param failed    subscriber calls that threw
     */
    public record DeliveryStats(long published, long delivered, long failed) {}

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Listener listener, TaskweaveEvent event) {
        if (!listener.accepts(event)) {
            return;
        }
        try {
            listener.consumer().accept(event);
            delivered.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("Subscriber failed on {} for workflow {}: {}",
                    event.eventType(), event.workflowId(), e.getMessage(), e);
        }
    }
}
