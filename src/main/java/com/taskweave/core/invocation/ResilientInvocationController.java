package com.taskweave.core.invocation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.backend.BackendException;
import com.taskweave.core.backend.PrimaryBackend;
import com.taskweave.core.backend.SecondaryBackend;
import com.taskweave.core.backend.ToolPermissions;
import com.taskweave.core.config.TaskweaveProperties;
import com.taskweave.core.context.ContextCodec;
import com.taskweave.core.context.ContextStateException;
import com.taskweave.core.context.DegradationRecord;
import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.TaskweaveEvent;
import com.taskweave.core.health.HealthEvaluator;
import com.taskweave.core.health.HealthReport;
import com.taskweave.core.health.HealthStatus;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.unit.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs a task on the primary backend and falls back to the secondary one when
 * the primary cannot serve it.
 * <p>
 * The flow for one {@link #invoke} call:
 * <ol>
 *   <li>If the health report says the primary is not ready, degrade without attempting it.</li>
 *   <li>Attempt the primary. Each failure is classified into a {@link FailureKind} and
 *       looked up in {@link DegradationPolicy}: degrade now, retry with backoff and then
 *       degrade, or surface to the caller.</li>
 *   <li>On degrade, convert the context into a prompt, call the secondary, and extract a
 *       structured result from its text. The context's degradation log gets one entry.</li>
 * </ol>
 * The return value looks the same either way; the attached {@link InvocationRecord}
 * says which path was taken. Only {@link BothBackendsFailedException} and
 * {@link InvocationValidationException} escape.
 */
@Service
public class ResilientInvocationController {

    private static final Logger log = LoggerFactory.getLogger(ResilientInvocationController.class);

    /**
     * Tunables of one controller.
     *
     * @param maxRetries     primary retries for retryable failures
     * @param baseBackoff    base of the exponential wait between primary retries
     * @param alertThreshold degrades per unit between repeated-failure alerts
     * @param historySize    number of recent records kept
     * @param permissions    tools the primary backend may use
     */
    public record Options(int maxRetries, Duration baseBackoff, int alertThreshold, int historySize,
                          ToolPermissions permissions) {

        public static Options defaults() {
            return new Options(3, Duration.ofSeconds(1), 3, 200, ToolPermissions.none());
        }

        static Options from(TaskweaveProperties properties) {
            var invocation = properties.getInvocation();
            return new Options(invocation.getMaxRetries(), properties.getInvocationBaseBackoff(),
                    invocation.getAlertThreshold(), invocation.getRecordHistorySize(),
                    ToolPermissions.of(invocation.getToolPermissions()));
        }
    }

    private final PrimaryBackend primary;
    private final SecondaryBackend secondary;
    private final HealthEvaluator health;
    private final Options options;
    private final Backoff backoff;
    private final ContextConverter converter;
    private final OutputExtractor extractor;
    private final InvocationStatistics statistics;
    private final RepeatedFailureAlerter alerter;
    private final List<FailureAlertListener> alertListeners = new CopyOnWriteArrayList<>();

    private EventBus eventBus;
    private TaskweaveMetrics metrics;
    private Backoff.Sleeper sleeper = Backoff.THREAD_SLEEP;
    private Clock clock = Clock.systemUTC();

    @Autowired
    public ResilientInvocationController(PrimaryBackend primary, SecondaryBackend secondary,
                                         @Autowired(required = false) HealthEvaluator health,
                                         TaskweaveProperties properties, EventBus eventBus,
                                         @Autowired(required = false) TaskweaveMetrics metrics,
                                         @Autowired(required = false) List<FailureAlertListener> listeners,
                                         Clock clock) {
        this(primary, secondary, health, Options.from(properties), ContextCodec.defaultMapper());
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        if (listeners != null) {
            alertListeners.addAll(listeners);
        }
    }

    /**
     * @param health readiness source, or null to always attempt the primary
     */
    public ResilientInvocationController(PrimaryBackend primary, SecondaryBackend secondary,
                                         HealthEvaluator health, Options options, ObjectMapper objectMapper) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
        this.health = health;
        this.options = options;
        this.backoff = new Backoff(options.baseBackoff());
        this.converter = new ContextConverter(objectMapper);
        this.extractor = new OutputExtractor(objectMapper);
        this.statistics = new InvocationStatistics(options.historySize());
        this.alerter = new RepeatedFailureAlerter(options.alertThreshold());
    }

    public ResilientInvocationController withSleeper(Backoff.Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        return this;
    }

    public ResilientInvocationController withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public ResilientInvocationController withEventBus(EventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    public ResilientInvocationController withMetrics(TaskweaveMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public ResilientInvocationController addAlertListener(FailureAlertListener listener) {
        alertListeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    // ── Invocation ──────────────────────────────────────────────────────

    /**
     * Runs {@code task} for {@code unitName}, degrading to the secondary backend
     * as a last resort.
     *
     * @throws InvocationValidationException if the input is malformed or the primary rejects it as such
     * @throws BothBackendsFailedException   if the secondary fails after the primary did
     */
    public InvocationResult invoke(String unitName, WorkflowContext context, String task) {
        Instant start = clock.instant();
        validate(unitName, context, task, start);

        MdcContext.setBackend(primary.name());
        try {
            FailureKind failure;
            Throwable cause;
            int retries = 0;

            HealthReport report = health != null ? health.currentReport() : null;
            if (report != null && !report.readyForPrimary()) {
                failure = kindFromReport(report);
                cause = new BackendException(failure, "Primary backend not ready: " + describeFailing(report));
                log.info("Skipping primary backend for unit {}: {}", unitName, cause.getMessage());
            } else {
                while (true) {
                    AttemptOutcome outcome = attemptPrimary(task, context);
                    if (outcome instanceof AttemptOutcome.Success success) {
                        return succeed(unitName, context, success.result(), retries, start);
                    }
                    var failed = (AttemptOutcome.Failure) outcome;
                    failure = failed.kind();
                    cause = failed.cause();
                    if (metrics != null) {
                        metrics.recordInvocationFailure(failure.wireName());
                    }

                    DegradationPolicy.Action action = DegradationPolicy.actionFor(failure);
                    if (action == DegradationPolicy.Action.SURFACE) {
                        record(unitName, context, primary.name(), failure, failure, retries, false, false, start);
                        throw new InvocationValidationException("Primary backend rejected task for unit '"
                                + unitName + "': " + cause.getMessage(), cause);
                    }
                    if (action == DegradationPolicy.Action.IMMEDIATE_DEGRADE) {
                        log.warn("Primary backend failed for unit {} with {}; degrading without retry",
                                unitName, failure);
                        break;
                    }
                    if (retries >= options.maxRetries()) {
                        log.warn("Primary backend failed for unit {} with {} after {} retries; degrading",
                                unitName, failure, retries);
                        break;
                    }
                    Duration wait = backoff.delay(retries);
                    log.info("Primary backend failed for unit {} with {}; retry {}/{} in {}ms",
                            unitName, failure, retries + 1, options.maxRetries(), wait.toMillis());
                    if (!pause(wait)) {
                        break;
                    }
                    retries++;
                    if (metrics != null) {
                        metrics.recordInvocationRetry();
                    }
                    if (health != null && !health.currentReport().readyForPrimary()) {
                        log.warn("Primary backend no longer ready for unit {}; degrading instead of retrying",
                                unitName);
                        break;
                    }
                }
            }
            return degrade(unitName, context, task, failure, retries, start);
        } finally {
            MdcContext.clearBackend();
        }
    }

    private void validate(String unitName, WorkflowContext context, String task, Instant start) {
        String problem = null;
        if (unitName == null || unitName.isBlank()) {
            problem = "unit name must not be blank";
        } else if (context == null) {
            problem = "context must not be null";
        } else if (task == null || task.isBlank()) {
            problem = "task must not be blank";
        }
        if (problem != null) {
            String unit = unitName == null ? "" : unitName;
            record(unit, context, primary.name(), FailureKind.VALIDATION_FAILURE, null, 0, false, false, start);
            throw new InvocationValidationException(problem);
        }
    }

    private AttemptOutcome attemptPrimary(String task, WorkflowContext context) {
        try {
            Map<String, Object> result = primary.call(task, context.snapshot(), options.permissions());
            if (result == null) {
                return AttemptOutcome.failure(FailureKind.BACKEND_CRASH,
                        new BackendException(FailureKind.BACKEND_CRASH, "Primary backend returned no result"));
            }
            return AttemptOutcome.success(result);
        } catch (Exception e) {
            return AttemptOutcome.failure(FailureClassifier.classify(e), e);
        }
    }

    private InvocationResult succeed(String unitName, WorkflowContext context, Map<String, Object> output,
                                     int retries, Instant start) {
        InvocationRecord record = record(unitName, context, primary.name(), null, null, retries, false, false, start);
        log.info("Unit {} served by primary backend ({} retries, {}ms)",
                unitName, retries, record.duration().toMillis());
        return new InvocationResult(output, record);
    }

    private InvocationResult degrade(String unitName, WorkflowContext context, String task, FailureKind failure,
                                     int retries, Instant start) {
        MdcContext.setBackend(secondary.name());
        ContextConverter.Conversion conversion = converter.convert(unitName, task, context.snapshot());

        String text;
        try {
            text = secondary.call(conversion.prompt());
        } catch (Exception e) {
            InvocationRecord record = record(unitName, context, secondary.name(), FailureKind.BOTH_FAILED, failure,
                    retries, true, conversion.degraded(), start);
            log.error("Both backends failed for unit {} (primary: {}, secondary: {})",
                    unitName, failure, e.getMessage());
            throw new BothBackendsFailedException(unitName, failure, e, record);
        }
        Map<String, Object> output = extractor.extract(text);

        Instant now = clock.instant();
        try {
            context.appendDegradation(new DegradationRecord(unitName, failure.wireName(), secondary.name(), now));
            context.appendEvent(unitName, "invocation.degraded", failure.wireName());
        } catch (ContextStateException e) {
            log.warn("Could not log degradation of unit {} in context {}: {}", unitName, context.id(), e.getMessage());
        }

        InvocationRecord record = record(unitName, context, secondary.name(), failure, failure, retries, true,
                conversion.degraded(), start);
        log.warn("Unit {} degraded to {} after {} ({} retries)", unitName, secondary.name(), failure, retries);
        publish("invocation.degraded", context.id(), unitName,
                Map.of("failureKind", failure.wireName(), "degradedTo", secondary.name(), "retries", retries));

        alerter.onDegrade(unitName, failure, now).ifPresent(this::raiseAlert);
        return new InvocationResult(output, record);
    }

    private InvocationRecord record(String unitName, WorkflowContext context, String backend, FailureKind outcome,
                                    FailureKind primaryFailure, int retries, boolean degraded,
                                    boolean conversionDegraded, Instant start) {
        Instant end = clock.instant();
        var record = new InvocationRecord(unitName, context != null ? context.id() : null, backend, outcome,
                primaryFailure, retries, degraded, conversionDegraded, Duration.between(start, end), end);
        statistics.record(record);
        if (metrics != null) {
            metrics.recordInvocation(backend, record.servedBySecondary(), record.duration());
        }
        return record;
    }

    private void raiseAlert(RepeatedFailureAlert alert) {
        statistics.recordAlert();
        for (FailureAlertListener listener : alertListeners) {
            try {
                listener.onAlert(alert);
            } catch (Exception e) {
                log.warn("Alert listener threw while handling alert for unit {}: {}", alert.unit(), e.getMessage(), e);
            }
        }
    }

    private boolean pause(Duration wait) {
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during backoff; degrading");
            return false;
        }
    }

    private void publish(String type, String workflowId, String unit, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new TaskweaveEvent(type, workflowId, unit, payload, clock.instant()));
        }
    }

    static FailureKind kindFromReport(HealthReport report) {
        HealthStatus credentials = report.checks().get("credentials");
        if (credentials != null && credentials.status() == HealthStatus.Status.CRITICAL) {
            return FailureKind.CREDENTIALS_ABSENT;
        }
        HealthStatus network = report.checks().get("network");
        if (network != null && network.status() == HealthStatus.Status.CRITICAL) {
            return FailureKind.NETWORK_FAILURE;
        }
        return FailureKind.BACKEND_UNAVAILABLE;
    }

    private static String describeFailing(HealthReport report) {
        var parts = new ArrayList<String>();
        for (HealthStatus status : report.failing()) {
            if (status.status() == HealthStatus.Status.CRITICAL) {
                parts.add(status.check() + " (" + status.detail() + ")");
            }
        }
        return parts.isEmpty() ? "no detail" : String.join(", ", parts);
    }

    // ── Statistics ──────────────────────────────────────────────────────

    public StatisticsSnapshot getStatistics() {
        return statistics.snapshot();
    }

    public List<InvocationRecord> recentRecords() {
        return statistics.recentRecords();
    }

    public long degradeCount(String unitName) {
        return alerter.degradeCount(unitName);
    }

    /**
     * Clears every counter, the record history and the alert cadence.
     */
    public void resetStatistics() {
        statistics.reset();
        alerter.reset();
        log.info("Invocation statistics reset");
    }
}
