package com.taskweave.core.health;

import com.taskweave.core.persistence.ContextRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

/**
 * Verifies the context repository accepts a write, returns it, and deletes it.
 */
public class StorageCheck implements HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(StorageCheck.class);

    public static final String NAME = "storage";

    private final ContextRepository repository;

    public StorageCheck(ContextRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean relevantToPrimary() {
        return false;
    }

    @Override
    public boolean relevantToSecondary() {
        return true;
    }

    @Override
    public HealthStatus check() {
        String scratchId = ContextRepository.SCRATCH_PREFIX + UUID.randomUUID();
        byte[] sample = "{}".getBytes(StandardCharsets.UTF_8);
        try {
            repository.write(scratchId, sample);
            boolean intact = repository.read(scratchId).map(b -> Arrays.equals(b, sample)).orElse(false);
            repository.delete(scratchId);
            if (!intact) {
                return HealthStatus.critical(NAME, "Scratch entry written but not read back");
            }
            return HealthStatus.healthy(NAME, repository.getClass().getSimpleName() + " writable");
        } catch (RuntimeException e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return HealthStatus.critical(NAME, "Storage error: " + e.getMessage());
        }
    }
}
