package com.taskweave.core.health;

import com.taskweave.core.backend.CliPrimaryBackend;
import com.taskweave.core.backend.PrimaryBackend;
import com.taskweave.core.backend.SecondaryBackend;
import com.taskweave.core.config.TaskweaveProperties;
import com.taskweave.core.persistence.ContextRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the readiness battery and reduces it to a {@link HealthReport}.
 * <p>
 * The default battery, in order: primary_backend, secondary_backend,
 * credentials, storage, resources, network. {@link #getHealthReport()} always
 * re-evaluates; {@link #currentReport()} serves the last report while it is
 * younger than the cache TTL, which is what the invocation controller polls.
 */
@Service
public class HealthEvaluator {

    private static final Logger log = LoggerFactory.getLogger(HealthEvaluator.class);

    private final List<HealthCheck> battery;
    private final Duration cacheTtl;
    private final Clock clock;

    private volatile HealthReport cached;

    @Autowired
    public HealthEvaluator(TaskweaveProperties properties, PrimaryBackend primary, SecondaryBackend secondary,
                           ContextRepository repository, Clock clock) {
        this(defaultBattery(properties, primary, secondary, repository), properties.getHealthCacheTtl(), clock);
    }

    public HealthEvaluator(List<HealthCheck> battery, Duration cacheTtl, Clock clock) {
        this.battery = List.copyOf(battery);
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    static List<HealthCheck> defaultBattery(TaskweaveProperties properties, PrimaryBackend primary,
                                            SecondaryBackend secondary, ContextRepository repository) {
        var health = properties.getHealth();
        String storeDir = properties.getContext().getStoreDir();
        Path diskPath = storeDir == null || storeDir.isBlank() ? Path.of(".") : Path.of(storeDir);

        var checks = new ArrayList<HealthCheck>();
        checks.add(new BackendReachabilityCheck("primary_backend", primary));
        checks.add(new BackendReachabilityCheck("secondary_backend", secondary));
        if (primary instanceof CliPrimaryBackend cli) {
            checks.add(new CredentialsCheck(cli.credentialsEnv(), cli::hasCredentials));
        } else {
            checks.add(new CredentialsCheck(null, () -> true));
        }
        checks.add(new StorageCheck(repository));
        checks.add(new ResourcesCheck(health.getMinFreeMemoryMb(), health.getWarnFreeMemoryMb(),
                health.getMinFreeDiskMb(), health.getWarnFreeDiskMb(), diskPath));
        checks.add(new NetworkCheck(health.getNetworkHost(), health.getNetworkPort(), health.getNetworkTimeoutMs()));
        return checks;
    }

    /**
     * Runs every check now. A check that throws counts as critical.
     */
    public HealthReport getHealthReport() {
        var results = new ArrayList<HealthStatus>(battery.size());
        for (HealthCheck check : battery) {
            results.add(runSafely(check));
        }
        HealthReport report = HealthReport.reduce(battery, results, clock.instant());
        cached = report;
        if (report.overall() != HealthStatus.Status.HEALTHY) {
            log.info("Health {}: {} (primary ready={}, secondary ready={})", report.overall().wireName(),
                    report.failing().stream().map(s -> s.check() + "=" + s.status().wireName()).toList(),
                    report.readyForPrimary(), report.readyForSecondary());
        } else {
            log.debug("Health healthy across {} checks", battery.size());
        }
        return report;
    }

    /**
     * The cached report if still fresh, otherwise a newly evaluated one.
     */
    public HealthReport currentReport() {
        HealthReport report = cached;
        if (report != null && !cacheTtl.isNegative()
                && clock.instant().isBefore(report.evaluatedAt().plus(cacheTtl))) {
            return report;
        }
        return getHealthReport();
    }

    public boolean isReadyForPrimary() {
        return currentReport().readyForPrimary();
    }

    public boolean isReadyForSecondary() {
        return currentReport().readyForSecondary();
    }

    public void invalidate() {
        cached = null;
    }

    public List<String> checkNames() {
        return battery.stream().map(HealthCheck::name).toList();
    }

    private HealthStatus runSafely(HealthCheck check) {
        try {
            HealthStatus status = check.check();
            return status != null ? status : HealthStatus.critical(check.name(), "Check returned no result");
        } catch (Exception e) {
            log.warn("Health check {} failed: {}", check.name(), e.getMessage());
            return HealthStatus.critical(check.name(), "Check error: " + e.getMessage());
        }
    }
}
