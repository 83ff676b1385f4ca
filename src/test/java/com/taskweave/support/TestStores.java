package com.taskweave.support;

import com.taskweave.core.context.ContextCodec;
import com.taskweave.core.context.ContextStore;
import com.taskweave.core.context.WriteConflictPolicy;
import com.taskweave.core.persistence.InMemoryContextRepository;

import java.time.Clock;
import java.time.Duration;

/**
 * In-memory {@link ContextStore}s for tests outside the context package.
 */
public final class TestStores {

    private TestStores() {}

    public static ContextStore inMemory(Clock clock) {
        return inMemory(clock, WriteConflictPolicy.LAST_WRITE_WINS);
    }

    public static ContextStore inMemory(Clock clock, WriteConflictPolicy policy) {
        return new ContextStore(new InMemoryContextRepository(clock), new InMemoryContextRepository(clock),
                new ContextCodec(), clock, Duration.ofHours(24), policy);
    }
}
