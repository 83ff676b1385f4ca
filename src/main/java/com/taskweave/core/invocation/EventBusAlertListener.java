package com.taskweave.core.invocation;

import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.TaskweaveEvent;
import com.taskweave.core.metrics.TaskweaveMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default alert sink: logs the alert, publishes {@code invocation.alert} and
 * counts it.
 */
@Component
public class EventBusAlertListener implements FailureAlertListener {

    private static final Logger log = LoggerFactory.getLogger(EventBusAlertListener.class);

    private final EventBus eventBus;
    private final TaskweaveMetrics metrics;

    public EventBusAlertListener(EventBus eventBus, @Autowired(required = false) TaskweaveMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Override
    public void onAlert(RepeatedFailureAlert alert) {
        log.warn("Unit {} has degraded {} times (threshold {}), last failure: {}",
                alert.unit(), alert.degradeCount(), alert.threshold(), alert.lastFailure());
        eventBus.publish(new TaskweaveEvent("invocation.alert", null, alert.unit(),
                Map.of("degradeCount", alert.degradeCount(),
                       "threshold", alert.threshold(),
                       "lastFailure", String.valueOf(alert.lastFailure())),
                alert.timestamp()));
        if (metrics != null) {
            metrics.recordAlert(alert.unit());
        }
    }
}
