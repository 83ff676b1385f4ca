package com.taskweave.core.persistence;

import com.taskweave.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileContextRepositoryTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileContextRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        repository = new FileContextRepository(tempDir.resolve("contexts"), clock);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("read and write")
    class ReadWriteTests {

        @Test
        @DisplayName("creates the root directory on construction")
        void createsRoot() {
            assertTrue(Files.isDirectory(tempDir.resolve("contexts")));
        }

        @Test
        @DisplayName("write stores one json file per id")
        void writeCreatesFile() {
            repository.write("WF-0001", bytes("{\"a\":1}"));

            assertTrue(Files.exists(repository.root().resolve("WF-0001.json")));
            assertArrayEquals(bytes("{\"a\":1}"), repository.read("WF-0001").orElseThrow());
        }

        @Test
        @DisplayName("second write replaces the first")
        void overwrite() {
            repository.write("WF-0001", bytes("first"));
            repository.write("WF-0001", bytes("second"));

            assertEquals("second", new String(repository.read("WF-0001").orElseThrow(), StandardCharsets.UTF_8));
            assertEquals(List.of("WF-0001"), repository.listIds());
        }

        @Test
        @DisplayName("read of a missing id is empty")
        void readMissing() {
            assertTrue(repository.read("WF-NOPE").isEmpty());
        }

        @Test
        @DisplayName("delete reports whether something was removed")
        void delete() {
            repository.write("WF-0001", bytes("x"));

            assertTrue(repository.delete("WF-0001"));
            assertFalse(repository.delete("WF-0001"));
            assertTrue(repository.read("WF-0001").isEmpty());
        }

        @Test
        @DisplayName("a failed write leaves no temporary file behind")
        void failedWriteCleansUp() throws Exception {
            Path blocked = repository.root().resolve("WF-0002.json");
            Files.createDirectories(blocked);
            Files.writeString(blocked.resolve("occupant"), "x");

            assertThrows(ContextPersistenceException.class, () -> repository.write("WF-0002", bytes("{}")));

            try (var files = Files.list(repository.root())) {
                assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
            }
        }

        @Test
        @DisplayName("ids that could escape the root are refused")
        void rejectsUnsafeIds() {
            assertThrows(IllegalArgumentException.class, () -> repository.write("../evil", bytes("x")));
            assertThrows(IllegalArgumentException.class, () -> repository.read("a/b"));
        }
    }

    @Nested
    @DisplayName("listing")
    class ListingTests {

        @Test
        @DisplayName("listIds is sorted and ignores foreign files")
        void listIdsSorted() throws Exception {
            repository.write("WF-B", bytes("b"));
            repository.write("WF-A", bytes("a"));
            Files.writeString(repository.root().resolve("notes.txt"), "ignored");

            assertEquals(List.of("WF-A", "WF-B"), repository.listIds());
        }

        @Test
        @DisplayName("scratch entries are readable but never listed")
        void scratchEntriesHidden() {
            String scratch = ContextRepository.SCRATCH_PREFIX + "abc";
            repository.write(scratch, bytes("{}"));
            repository.write("WF-A", bytes("a"));
            clock.advance(Duration.ofHours(2));

            assertTrue(repository.read(scratch).isPresent());
            assertEquals(List.of("WF-A"), repository.listIds());
            assertEquals(List.of("WF-A"), repository.listExpired(Duration.ofHours(1)));
        }

        @Test
        @DisplayName("listExpired uses last-modified time against the clock")
        void listExpired() throws Exception {
            repository.write("WF-OLD", bytes("old"));
            repository.write("WF-NEW", bytes("new"));
            Files.setLastModifiedTime(repository.root().resolve("WF-OLD.json"),
                    FileTime.from(clock.instant().minus(Duration.ofHours(3))));

            assertEquals(List.of("WF-OLD"), repository.listExpired(Duration.ofHours(1)));

            clock.advance(Duration.ofHours(2));
            assertEquals(List.of("WF-NEW", "WF-OLD"), repository.listExpired(Duration.ofHours(1)));
        }
    }
}
