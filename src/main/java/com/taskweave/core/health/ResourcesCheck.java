package com.taskweave.core.health;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Free heap and free disk headroom. Critical below the minimums, warning below
 * the warning thresholds. Relevant to both backends.
 */
public class ResourcesCheck implements HealthCheck {

    public static final String NAME = "resources";

    private static final long MB = 1024L * 1024L;

    private final long minFreeMemoryMb;
    private final long warnFreeMemoryMb;
    private final long minFreeDiskMb;
    private final long warnFreeDiskMb;
    private final LongSupplier freeMemoryBytes;
    private final LongSupplier freeDiskBytes;

    public ResourcesCheck(long minFreeMemoryMb, long warnFreeMemoryMb, long minFreeDiskMb, long warnFreeDiskMb,
                          Path diskPath) {
        this(minFreeMemoryMb, warnFreeMemoryMb, minFreeDiskMb, warnFreeDiskMb,
                ResourcesCheck::availableHeap, () -> usableSpace(diskPath));
    }

    public ResourcesCheck(long minFreeMemoryMb, long warnFreeMemoryMb, long minFreeDiskMb, long warnFreeDiskMb,
                          LongSupplier freeMemoryBytes, LongSupplier freeDiskBytes) {
        this.minFreeMemoryMb = minFreeMemoryMb;
        this.warnFreeMemoryMb = warnFreeMemoryMb;
        this.minFreeDiskMb = minFreeDiskMb;
        this.warnFreeDiskMb = warnFreeDiskMb;
        this.freeMemoryBytes = freeMemoryBytes;
        this.freeDiskBytes = freeDiskBytes;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean relevantToSecondary() {
        return true;
    }

    @Override
    public HealthStatus check() {
        long memoryMb = freeMemoryBytes.getAsLong() / MB;
        long diskMb = freeDiskBytes.getAsLong() / MB;
        var metadata = Map.of("freeMemoryMb", String.valueOf(memoryMb), "freeDiskMb", String.valueOf(diskMb));
        String detail = memoryMb + " MB heap free, " + diskMb + " MB disk free";

        if (memoryMb < minFreeMemoryMb || diskMb < minFreeDiskMb) {
            return HealthStatus.critical(NAME, detail).withMetadata(metadata);
        }
        if (memoryMb < warnFreeMemoryMb || diskMb < warnFreeDiskMb) {
            return HealthStatus.warning(NAME, detail).withMetadata(metadata);
        }
        return HealthStatus.healthy(NAME, detail).withMetadata(metadata);
    }

    static long availableHeap() {
        Runtime rt = Runtime.getRuntime();
        return rt.maxMemory() - (rt.totalMemory() - rt.freeMemory());
    }

    static long usableSpace(Path path) {
        File dir = path.toAbsolutePath().toFile();
        while (dir != null && !dir.exists()) {
            dir = dir.getParentFile();
        }
        return dir == null ? 0L : dir.getUsableSpace();
    }
}
