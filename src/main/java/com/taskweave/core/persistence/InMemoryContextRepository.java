package com.taskweave.core.persistence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable repository used when no store directory is configured, and in tests.
 * State is lost when the process exits.
 */
public class InMemoryContextRepository implements ContextRepository {

    private record Entry(byte[] data, Instant writtenAt) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryContextRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryContextRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void write(String id, byte[] data) {
        entries.put(id, new Entry(data.clone(), clock.instant()));
    }

    @Override
    public Optional<byte[]> read(String id) {
        var entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.data().clone());
    }

    @Override
    public boolean delete(String id) {
        return entries.remove(id) != null;
    }

    @Override
    public List<String> listIds() {
        var ids = new ArrayList<String>();
        for (String id : entries.keySet()) {
            if (!ContextRepository.isScratch(id)) {
                ids.add(id);
            }
        }
        ids.sort(null);
        return ids;
    }

    @Override
    public List<String> listExpired(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        var ids = new ArrayList<String>();
        entries.forEach((id, entry) -> {
            if (!ContextRepository.isScratch(id) && entry.writtenAt().isBefore(cutoff)) {
                ids.add(id);
            }
        });
        ids.sort(null);
        return ids;
    }
}
