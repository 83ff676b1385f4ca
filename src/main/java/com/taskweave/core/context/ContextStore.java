package com.taskweave.core.context;

import com.taskweave.core.config.TaskweaveProperties;
import com.taskweave.core.persistence.ContextPersistenceException;
import com.taskweave.core.persistence.ContextRepository;
import com.taskweave.core.persistence.PersistenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates, persists and archives {@link WorkflowContext}s.
 * <p>
 * Contexts live in a hot {@link ContextRepository} while their workflow is
 * active and move to a separate archive repository, read-only, once they
 * expire or their workflow completes. The persisted form is the JSON encoding
 * of a {@link ContextSnapshot}; {@link #save} followed by {@link #load}
 * reproduces the same snapshot.
 */
@Service
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    private final ContextRepository repository;
    private final ContextRepository archive;
    private final ContextCodec codec;
    private final Clock clock;
    private final Duration defaultTtl;
    private final WriteConflictPolicy conflictPolicy;

    @Autowired
    public ContextStore(ContextRepository repository,
                        @Qualifier(PersistenceConfig.ARCHIVE) ContextRepository archive,
                        TaskweaveProperties properties,
                        Clock clock) {
        this(repository, archive, new ContextCodec(), clock,
                properties.getDefaultContextTtl(), properties.getContext().getWriteConflictPolicy());
    }

    public ContextStore(ContextRepository repository, ContextRepository archive, ContextCodec codec,
                        Clock clock, Duration defaultTtl, WriteConflictPolicy conflictPolicy) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.codec = codec;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.conflictPolicy = conflictPolicy;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    public WorkflowContext create(String task) {
        return create(task, null, Priority.NORMAL, defaultTtl);
    }

    /**
     * Creates a fresh context at version 0. A null {@code ttl} falls back to the
     * configured default.
     */
    public WorkflowContext create(String task, String owner, Priority priority, Duration ttl) {
        String id = "WF-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        var context = new WorkflowContext(id, task, owner, priority,
                ttl != null ? ttl : defaultTtl, clock, conflictPolicy);
        log.info("Created context {} (owner={}, priority={}, ttl={})",
                id, owner, context.metadata().priority(), context.metadata().ttl());
        return context;
    }

    public boolean isExpired(WorkflowContext context) {
        return context.isExpired();
    }

    // ── Artifact access ─────────────────────────────────────────────────

    public <T> T get(WorkflowContext context, String key, T defaultValue) {
        return context.get(key, defaultValue);
    }

    public void set(WorkflowContext context, String key, Object value) {
        context.set(key, value);
    }

    public void update(WorkflowContext context, Map<String, ?> values) {
        context.update(values);
    }

    public void appendEvent(WorkflowContext context, ContextEvent event) {
        context.appendEvent(event);
    }

    public void appendDegradation(WorkflowContext context, DegradationRecord record) {
        context.appendDegradation(record);
    }

    // ── Serialization and persistence ───────────────────────────────────

    public byte[] serialize(WorkflowContext context) {
        return codec.encode(context.snapshot());
    }

    public WorkflowContext deserialize(byte[] bytes) {
        return WorkflowContext.fromSnapshot(codec.decode(bytes), clock, conflictPolicy);
    }

    /**
     * Writes the context to the hot repository.
     *
     * @return the handle to pass to {@link #load}, i.e. the context id
     */
    public String save(WorkflowContext context) {
        if (context.isArchived()) {
            throw new ContextArchivedException(context.id());
        }
        byte[] bytes = serialize(context);
        repository.write(context.id(), bytes);
        log.debug("Saved context {} at version {} ({} bytes)", context.id(), context.version(), bytes.length);
        return context.id();
    }

    public WorkflowContext load(String id) {
        byte[] bytes = repository.read(id).orElseThrow(() -> new ContextNotFoundException(id));
        return deserialize(bytes);
    }

    public boolean exists(String id) {
        return repository.read(id).isPresent();
    }

    public List<String> listIds() {
        return repository.listIds();
    }

    public boolean delete(String id) {
        boolean removed = repository.delete(id);
        if (removed) {
            log.info("Deleted context {}", id);
        }
        return removed;
    }

    // ── Archive ─────────────────────────────────────────────────────────

    /**
     * Moves the context to cold storage. The instance becomes read-only and
     * its hot copy, if any, is removed.
     */
    public void archive(WorkflowContext context) {
        context.markArchived();
        archive.write(context.id(), serialize(context));
        repository.delete(context.id());
        log.info("Archived context {} at version {}", context.id(), context.version());
    }

    public WorkflowContext loadArchived(String id) {
        byte[] bytes = archive.read(id).orElseThrow(() -> new ContextNotFoundException(id));
        return deserialize(bytes);
    }

    public List<String> listArchivedIds() {
        return archive.listIds();
    }

    // ── Expiry sweep ────────────────────────────────────────────────────

    /**
     * Ids whose stored copy has not been written for longer than {@code ttl}.
     */
    public List<String> findExpired(Duration ttl) {
        return repository.listExpired(ttl);
    }

    /**
     * Archives every hot context whose own TTL has elapsed.
     *
     * @return ids that were archived
     */
    public List<String> cleanupExpired() {
        var archived = new ArrayList<String>();
        for (String id : repository.listIds()) {
            WorkflowContext context;
            try {
                context = load(id);
            } catch (ContextNotFoundException e) {
                continue;
            } catch (ContextPersistenceException e) {
                log.warn("Skipping unreadable context {} during cleanup: {}", id, e.getMessage());
                continue;
            }
            if (context.isExpired()) {
                archive(context);
                archived.add(id);
            }
        }
        if (!archived.isEmpty()) {
            log.info("Archived {} expired context(s): {}", archived.size(), archived);
        }
        return archived;
    }
}
