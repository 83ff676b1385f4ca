package com.taskweave.core.unit;

import com.taskweave.core.context.ContextStateException;
import com.taskweave.core.context.UnitDescriptor;
import com.taskweave.core.context.UnitState;
import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A single named unit of work.
 * <p>
 * Subclasses implement {@link #process}; callers only ever use {@link #run},
 * which drives the state machine {@code INITIALIZED -> RUNNING -> COMPLETED | FAILED}
 * and retries {@code process} with exponential backoff. Each instance runs at
 * most once: calling {@code run} again after it has started fails fast.
 * <p>
 * Every transition is mirrored into the context's unit states and event log.
 */
public abstract class WorkUnit {

    private static final Logger log = LoggerFactory.getLogger(WorkUnit.class);

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(1);

    private final String name;
    private final int maxRetries;
    private final Backoff backoff;
    private final Duration timeout;

    private Backoff.Sleeper sleeper = Backoff.THREAD_SLEEP;
    private Clock clock = Clock.systemUTC();
    private UnitDescriptor descriptor;

    protected WorkUnit(String name) {
        this(name, DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF, null);
    }

    /**
     * @param maxRetries  retries after the first attempt, so {@code process} runs at most {@code maxRetries + 1} times
     * @param baseBackoff base of the exponential wait between attempts
     * @param timeout     per-attempt limit, or null to use whatever the caller supplies
     */
    protected WorkUnit(String name, int maxRetries, Duration baseBackoff, Duration timeout) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("unit name must not be blank");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.name = name;
        this.maxRetries = maxRetries;
        this.backoff = new Backoff(baseBackoff);
        this.timeout = timeout;
        this.descriptor = UnitDescriptor.initialized(name);
    }

    /**
     * The unit's behaviour. May throw; failures are retried by {@link #run}.
     */
    protected abstract Object process(WorkflowContext context) throws Exception;

    /**
     * Whether a failed attempt is worth retrying. Context state errors
     * (expired, archived, write conflicts) never are. JVM errors are never
     * retried and propagate unwrapped once the unit is marked failed.
     */
    protected boolean isRetryable(Throwable error) {
        return !(error instanceof ContextStateException);
    }

    public final String name() {
        return name;
    }

    public final int maxRetries() {
        return maxRetries;
    }

    public final Duration timeout() {
        return timeout;
    }

    public final synchronized UnitDescriptor descriptor() {
        return descriptor;
    }

    public final UnitState state() {
        return descriptor().state();
    }

    /** Replaces the blocking sleep between retries, mainly for tests. */
    public final WorkUnit withSleeper(Backoff.Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        return this;
    }

    public final WorkUnit withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public final Object run(WorkflowContext context) {
        return run(context, null);
    }

    /**
     * Runs the unit to a terminal state.
     *
     * @param defaultTimeout per-attempt limit used when the unit has none of its own; null for none
     * @return the outcome of the successful attempt
     * @throws UnitExecutionFailedException once retries are exhausted or the error is not retryable
     * @throws IllegalStateException        if the unit has already been run
     */
    public final Object run(WorkflowContext context, Duration defaultTimeout) {
        Objects.requireNonNull(context, "context");
        start(context);
        Duration effectiveTimeout = timeout != null ? timeout : defaultTimeout;

        try {
            return retryLoop(context, effectiveTimeout);
        } finally {
            MdcContext.clearUnit();
        }
    }

    private Object retryLoop(WorkflowContext context, Duration effectiveTimeout) {
        Throwable lastError;
        int attempt = 0;
        while (true) {
            try {
                Object outcome = attempt(context, effectiveTimeout);
                complete(context);
                return outcome;
            } catch (Exception e) {
                lastError = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            } catch (Error e) {
                lastError = e;
            }

            int attempts = attempt + 1;
            if (lastError instanceof Error error) {
                fail(context, attempts, error);
                throw error;
            }
            if (!isRetryable(lastError) || attempt >= maxRetries) {
                fail(context, attempts, lastError);
                throw new UnitExecutionFailedException(name, attempts, lastError);
            }

            Duration wait = backoff.delay(attempt);
            log.warn("Unit {} attempt {}/{} failed: {} (retrying in {}ms)",
                    name, attempts, maxRetries + 1, UnitExecutionFailedException.describe(lastError), wait.toMillis());
            attempt++;
            retrying(context, attempt, lastError);
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                fail(context, attempts, ie);
                throw new UnitExecutionFailedException(name, attempts, ie);
            }
        }
    }

    private Object attempt(WorkflowContext context, Duration limit) throws Exception {
        if (limit == null || limit.isZero() || limit.isNegative()) {
            try (var ignored = context.bindWriter(name)) {
                return process(context);
            }
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "unit-" + name);
            t.setDaemon(true);
            return t;
        });
        WorkflowContext.WriterGrant grant = context.grantWriter(name);
        try {
            Future<Object> future = executor.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try (var ignored = grant.bind()) {
                    return process(context);
                } finally {
                    MDC.clear();
                }
            });
            try {
                return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                grant.revoke();
                future.cancel(true);
                throw new UnitTimeoutException(name, limit);
            } catch (InterruptedException e) {
                grant.revoke();
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw e;
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private void start(WorkflowContext context) {
        synchronized (this) {
            if (descriptor.state() != UnitState.INITIALIZED) {
                throw new IllegalStateException("Unit '" + name + "' has already been run (state "
                        + descriptor.state() + ")");
            }
            descriptor = new UnitDescriptor(name, UnitState.RUNNING, clock.instant(), null, null, 0);
        }
        MdcContext.setUnit(name);
        log.info("Unit {} started", name);
        try {
            context.recordUnitState(descriptor());
            context.appendEvent(name, "unit.started", null);
        } catch (ContextStateException e) {
            fail(context, 0, e);
            MdcContext.clearUnit();
            throw new UnitExecutionFailedException(name, 0, e);
        }
    }

    private void retrying(WorkflowContext context, int retryCount, Throwable error) {
        UnitDescriptor current;
        synchronized (this) {
            descriptor = new UnitDescriptor(name, UnitState.RUNNING, descriptor.startedAt(), null,
                    UnitExecutionFailedException.describe(error), retryCount);
            current = descriptor;
        }
        mirror(context, current, "unit.retry", "attempt " + (retryCount + 1));
    }

    private void complete(WorkflowContext context) {
        UnitDescriptor current;
        synchronized (this) {
            descriptor = new UnitDescriptor(name, UnitState.COMPLETED, descriptor.startedAt(), clock.instant(),
                    null, descriptor.retryCount());
            current = descriptor;
        }
        log.info("Unit {} completed after {} retr{}", name, current.retryCount(),
                current.retryCount() == 1 ? "y" : "ies");
        mirror(context, current, "unit.completed", null);
    }

    private void fail(WorkflowContext context, int attempts, Throwable error) {
        UnitDescriptor current;
        String message = UnitExecutionFailedException.describe(error);
        synchronized (this) {
            Instant startedAt = descriptor.startedAt() != null ? descriptor.startedAt() : clock.instant();
            descriptor = new UnitDescriptor(name, UnitState.FAILED, startedAt, clock.instant(),
                    message, Math.max(0, attempts - 1));
            current = descriptor;
        }
        log.error("Unit {} failed after {} attempt(s): {}", name, attempts, message);
        mirror(context, current, "unit.failed", message);
    }

    /** Terminal bookkeeping must not mask the unit's own outcome. */
    private void mirror(WorkflowContext context, UnitDescriptor current, String kind, String detail) {
        try {
            context.recordUnitState(current);
            context.appendEvent(name, kind, detail);
        } catch (ContextStateException e) {
            log.warn("Could not record {} for unit {} in context {}: {}", kind, name, context.id(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + state() + "]";
    }
}
