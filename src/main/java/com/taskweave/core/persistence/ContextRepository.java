package com.taskweave.core.persistence;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store for serialized contexts, addressed by context id.
 * Implementations must be safe for concurrent use.
 */
public interface ContextRepository {

    /** Ids with this prefix are scratch entries written by health checks and are never listed. */
    String SCRATCH_PREFIX = "_scratch-";

    static boolean isScratch(String id) {
        return id.startsWith(SCRATCH_PREFIX);
    }

    void write(String id, byte[] data);

    Optional<byte[]> read(String id);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String id);

    /**
     * Ids of stored contexts, sorted; scratch entries are excluded.
     */
    List<String> listIds();

    /**
     * Ids of entries that have not been written for longer than {@code ttl}.
     */
    List<String> listExpired(Duration ttl);
}
