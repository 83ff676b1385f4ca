package com.taskweave.core.persistence;

import com.taskweave.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryContextRepositoryTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
    private final InMemoryContextRepository repository = new InMemoryContextRepository(clock);

    @Test
    @DisplayName("stored bytes are defensive copies")
    void copiesBytes() {
        byte[] data = {1, 2, 3};
        repository.write("WF-1", data);
        data[0] = 9;

        byte[] read = repository.read("WF-1").orElseThrow();
        assertEquals(1, read[0]);
        read[1] = 9;
        assertEquals(2, repository.read("WF-1").orElseThrow()[1]);
    }

    @Test
    @DisplayName("listExpired reports entries older than the ttl")
    void listExpired() {
        repository.write("WF-1", new byte[0]);
        clock.advance(Duration.ofMinutes(30));
        repository.write("WF-2", new byte[0]);
        clock.advance(Duration.ofMinutes(45));

        assertEquals(List.of("WF-1"), repository.listExpired(Duration.ofHours(1)));
        assertEquals(List.of("WF-1", "WF-2"), repository.listIds());
    }

    @Test
    @DisplayName("delete of an unknown id returns false")
    void deleteUnknown() {
        assertFalse(repository.delete("WF-X"));
    }
}
