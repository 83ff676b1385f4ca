package com.taskweave.core.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared, versioned state for one workflow run.
 * <p>
 * Artifacts are the only channel through which units exchange results. Every
 * {@link #set} and non-empty {@link #update} advances {@code version} by exactly one.
 * Lifecycle bookkeeping (phase, unit states, completed units and the two logs)
 * does not advance the version; the logs are append-only.
 * <p>
 * All operations are internally synchronized, so units running in parallel may
 * share one instance without external locking. Writes to the same key from
 * concurrent units follow the configured {@link WriteConflictPolicy}.
 * <p>
 * Once {@link #isExpired()} is true, or after archiving, every mutation fails and
 * leaves the state untouched.
 */
public final class WorkflowContext {

    private final String id;
    private final Clock clock;
    private final WriteConflictPolicy conflictPolicy;

    private final Instant createdAt;
    private final Duration ttl;
    private final String owner;
    private final Priority priority;
    private final String task;

    private Instant updatedAt;
    private long version;
    private boolean archived;
    private String phase;
    private String currentUnit;

    private final List<String> completedUnits = new ArrayList<>();
    private final Map<String, Object> artifacts = new LinkedHashMap<>();
    private final Map<String, UnitDescriptor> unitStates = new LinkedHashMap<>();
    private final List<ContextEvent> eventLog = new ArrayList<>();
    private final List<DegradationRecord> degradationLog = new ArrayList<>();

    /** Writer identity bound by the unit running on the current thread. */
    private final ThreadLocal<WriterGrant> writer = new ThreadLocal<>();
    /** Key -> first writer, tracked only while a parallel section is open. */
    private final Map<String, String> sectionWriters = new HashMap<>();
    private int openSections;

    WorkflowContext(String id, String task, String owner, Priority priority, Duration ttl,
                    Clock clock, WriteConflictPolicy conflictPolicy) {
        this.id = Objects.requireNonNull(id, "id");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.conflictPolicy = conflictPolicy != null ? conflictPolicy : WriteConflictPolicy.LAST_WRITE_WINS;
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.task = task;
        this.owner = owner;
        this.priority = priority != null ? priority : Priority.NORMAL;
        this.ttl = ttl;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.version = 0;
        this.phase = "created";
    }

    private WorkflowContext(ContextSnapshot snapshot, Clock clock, WriteConflictPolicy conflictPolicy) {
        var meta = snapshot.metadata();
        this.id = snapshot.id();
        this.clock = clock;
        this.conflictPolicy = conflictPolicy != null ? conflictPolicy : WriteConflictPolicy.LAST_WRITE_WINS;
        this.createdAt = meta.createdAt();
        this.updatedAt = meta.updatedAt();
        this.version = meta.version();
        this.ttl = meta.ttl();
        this.owner = meta.owner();
        this.priority = meta.priority() != null ? meta.priority() : Priority.NORMAL;
        this.task = snapshot.task();
        this.archived = snapshot.archived();
        this.phase = snapshot.phase();
        this.currentUnit = snapshot.currentUnit();
        if (snapshot.completedUnits() != null) completedUnits.addAll(snapshot.completedUnits());
        if (snapshot.artifacts() != null) artifacts.putAll(snapshot.artifacts());
        if (snapshot.unitStates() != null) unitStates.putAll(snapshot.unitStates());
        if (snapshot.eventLog() != null) eventLog.addAll(snapshot.eventLog());
        if (snapshot.degradationLog() != null) degradationLog.addAll(snapshot.degradationLog());
    }

    /**
     * Rebuilds a live context from a snapshot, e.g. after loading it from storage.
     */
    public static WorkflowContext fromSnapshot(ContextSnapshot snapshot, Clock clock, WriteConflictPolicy conflictPolicy) {
        Objects.requireNonNull(snapshot, "snapshot");
        return new WorkflowContext(snapshot, clock, conflictPolicy);
    }

    // ── Read side ───────────────────────────────────────────────────────

    public String id() {
        return id;
    }

    public String task() {
        return task;
    }

    public synchronized long version() {
        return version;
    }

    public synchronized ContextMetadata metadata() {
        return new ContextMetadata(createdAt, updatedAt, version, ttl, owner, priority);
    }

    public synchronized String phase() {
        return phase;
    }

    public synchronized String currentUnit() {
        return currentUnit;
    }

    public synchronized boolean isArchived() {
        return archived;
    }

    public WriteConflictPolicy conflictPolicy() {
        return conflictPolicy;
    }

    public synchronized Object get(String key) {
        return artifacts.get(key);
    }

    /**
     * Returns the artifact stored under {@code key}, or {@code defaultValue} when absent.
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> T get(String key, T defaultValue) {
        Object value = artifacts.get(key);
        return value != null ? (T) value : defaultValue;
    }

    public synchronized boolean contains(String key) {
        return artifacts.containsKey(key);
    }

    public synchronized Map<String, Object> artifacts() {
        return new LinkedHashMap<>(artifacts);
    }

    public synchronized List<String> completedUnits() {
        return List.copyOf(completedUnits);
    }

    public synchronized Map<String, UnitDescriptor> unitStates() {
        return new LinkedHashMap<>(unitStates);
    }

    public synchronized List<ContextEvent> eventLog() {
        return List.copyOf(eventLog);
    }

    public synchronized List<DegradationRecord> degradationLog() {
        return List.copyOf(degradationLog);
    }

    /**
     * True once the clock has moved strictly past {@code createdAt + ttl}.
     */
    public boolean isExpired() {
        return clock.instant().isAfter(createdAt.plus(ttl));
    }

    public synchronized ContextSnapshot snapshot() {
        return new ContextSnapshot(
                id,
                new ContextMetadata(createdAt, updatedAt, version, ttl, owner, priority),
                archived,
                task,
                phase,
                currentUnit,
                List.copyOf(completedUnits),
                new LinkedHashMap<>(artifacts),
                new LinkedHashMap<>(unitStates),
                List.copyOf(eventLog),
                List.copyOf(degradationLog)
        );
    }

    // ── Versioned mutations ─────────────────────────────────────────────

    public synchronized void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        ensureWritable();
        String who = claimKey(key);
        artifacts.put(key, ContextCodec.jsonForm(value));
        trackWriter(key, who);
        bumpVersion();
    }

    /**
     * Applies every entry of {@code values} with a single version increment.
     * Either the whole map is applied or, on any rejection, nothing is.
     */
    public synchronized void update(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        ensureWritable();
        if (values.isEmpty()) {
            return;
        }
        String who = null;
        for (String key : values.keySet()) {
            Objects.requireNonNull(key, "key");
            who = claimKey(key);
        }
        for (var entry : values.entrySet()) {
            artifacts.put(entry.getKey(), ContextCodec.jsonForm(entry.getValue()));
            trackWriter(entry.getKey(), who);
        }
        bumpVersion();
    }

    // ── Bookkeeping (not versioned) ─────────────────────────────────────

    public synchronized void appendEvent(ContextEvent event) {
        Objects.requireNonNull(event, "event");
        ensureWritable();
        eventLog.add(event);
        touch();
    }

    public void appendEvent(String unit, String kind, String detail) {
        appendEvent(new ContextEvent(clock.instant(), unit, kind, detail));
    }

    public synchronized void appendDegradation(DegradationRecord record) {
        Objects.requireNonNull(record, "record");
        ensureWritable();
        degradationLog.add(record);
        touch();
    }

    public synchronized void markPhase(String newPhase) {
        ensureWritable();
        this.phase = newPhase;
        touch();
    }

    /**
     * Records the latest descriptor of a unit. A running unit becomes the current
     * unit; a completed unit is appended to the completed list once.
     */
    public synchronized void recordUnitState(UnitDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        ensureWritable();
        unitStates.put(descriptor.name(), descriptor);
        if (descriptor.state() == UnitState.RUNNING) {
            currentUnit = descriptor.name();
        } else if (descriptor.state() == UnitState.COMPLETED && !completedUnits.contains(descriptor.name())) {
            completedUnits.add(descriptor.name());
        }
        touch();
    }

    /**
     * Removes {@code unitName} from the completed list, for a unit whose result
     * the orchestrator threw away. Its descriptor is left as recorded.
     */
    public synchronized void withdrawCompletion(String unitName) {
        ensureWritable();
        if (completedUnits.remove(unitName)) {
            touch();
        }
    }

    synchronized void markArchived() {
        this.archived = true;
    }

    // ── Writer identity and parallel sections ───────────────────────────

    /**
     * Binds {@code unitName} as the writer for mutations issued from the current thread.
     */
    public Scope bindWriter(String unitName) {
        return new WriterGrant(unitName).bind();
    }

    /**
     * Creates a writer identity that another thread can revoke. Once revoked,
     * every mutation issued under it fails with {@link WriterRevokedException}
     * and applies nothing.
     */
    public WriterGrant grantWriter(String unitName) {
        return new WriterGrant(unitName);
    }

    public final class WriterGrant {

        private final String unitName;
        private boolean revoked;

        private WriterGrant(String unitName) {
            this.unitName = Objects.requireNonNull(unitName, "unitName");
        }

        /** Binds this grant to the current thread until the returned scope closes. */
        public Scope bind() {
            WriterGrant previous = writer.get();
            writer.set(this);
            return () -> {
                if (previous == null) {
                    writer.remove();
                } else {
                    writer.set(previous);
                }
            };
        }

        public void revoke() {
            synchronized (WorkflowContext.this) {
                revoked = true;
            }
        }

        public boolean isRevoked() {
            synchronized (WorkflowContext.this) {
                return revoked;
            }
        }
    }

    /**
     * Opens a section in which concurrent units may write. Under
     * {@link WriteConflictPolicy#REJECT}, a key written by one unit inside the
     * section cannot be written by another unit until the section closes.
     */
    public synchronized Scope openParallelSection() {
        openSections++;
        return () -> {
            synchronized (WorkflowContext.this) {
                openSections = Math.max(0, openSections - 1);
                if (openSections == 0) {
                    sectionWriters.clear();
                }
            }
        };
    }

    private String claimKey(String key) {
        WriterGrant grant = writer.get();
        String who = grant != null ? grant.unitName : "anonymous";
        if (openSections > 0 && conflictPolicy == WriteConflictPolicy.REJECT) {
            String owner = sectionWriters.get(key);
            if (owner != null && !owner.equals(who)) {
                throw new WriteConflictException(key, owner, who);
            }
        }
        return who;
    }

    private void trackWriter(String key, String who) {
        if (openSections > 0) {
            sectionWriters.putIfAbsent(key, who);
        }
    }

    private void ensureWritable() {
        WriterGrant grant = writer.get();
        if (grant != null && grant.revoked) {
            throw new WriterRevokedException(id, grant.unitName);
        }
        if (archived) {
            throw new ContextArchivedException(id);
        }
        if (isExpired()) {
            throw new ContextExpiredException(id, createdAt.plus(ttl));
        }
    }

    private void bumpVersion() {
        version++;
        touch();
    }

    private void touch() {
        updatedAt = clock.instant();
    }

    /**
     * Closeable handle that does not throw checked exceptions.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    @Override
    public String toString() {
        return "WorkflowContext[" + id + ", v" + version() + ", phase=" + phase() + "]";
    }
}
