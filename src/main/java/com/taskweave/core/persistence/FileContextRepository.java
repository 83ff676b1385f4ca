package com.taskweave.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-backed {@link ContextRepository}: one {@code <id>.json} file per context
 * under a root directory.
 * <p>
 * Writes go to a temp file first and are moved into place, so readers never
 * observe a half-written context. Expiry is judged from the file's
 * last-modified time.
 */
public class FileContextRepository implements ContextRepository {

    private static final Logger log = LoggerFactory.getLogger(FileContextRepository.class);

    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path root;
    private final Clock clock;

    public FileContextRepository(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileContextRepository(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.clock = clock;
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new ContextPersistenceException("Failed to create context directory: " + this.root, e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public void write(String id, byte[] data) {
        Path target = fileFor(id);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(root, id + ".", ".tmp");
            Files.write(tmp, data);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote context '{}' ({} bytes) to {}", id, data.length, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ContextPersistenceException("Failed to write context " + id, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }

    @Override
    public Optional<byte[]> read(String id) {
        Path file = fileFor(id);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ContextPersistenceException("Failed to read context " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        try {
            return Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new ContextPersistenceException("Failed to delete context " + id, e);
        }
    }

    @Override
    public List<String> listIds() {
        var ids = new ArrayList<String>();
        try (Stream<Path> files = Files.list(root)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .filter(id -> !ContextRepository.isScratch(id))
                    .sorted()
                    .forEach(ids::add);
        } catch (IOException e) {
            throw new ContextPersistenceException("Failed to list contexts in " + root, e);
        }
        return ids;
    }

    @Override
    public List<String> listExpired(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        var expired = new ArrayList<String>();
        for (String id : listIds()) {
            try {
                Instant modified = Files.getLastModifiedTime(fileFor(id)).toInstant();
                if (modified.isBefore(cutoff)) {
                    expired.add(id);
                }
            } catch (NoSuchFileException e) {
                log.debug("Context '{}' vanished while listing expired entries", id);
            } catch (IOException e) {
                throw new ContextPersistenceException("Failed to stat context " + id, e);
            }
        }
        return expired;
    }

    private Path fileFor(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid context id: " + id);
        }
        return root.resolve(id + SUFFIX);
    }
}
