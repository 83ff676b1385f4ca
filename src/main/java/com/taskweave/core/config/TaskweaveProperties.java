package com.taskweave.core.config;

import com.taskweave.core.context.WriteConflictPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskweave")
public class TaskweaveProperties {

    private Workflow workflow = new Workflow();
    private Invocation invocation = new Invocation();
    private Context context = new Context();
    private Primary primary = new Primary();
    private Secondary secondary = new Secondary();
    private Health health = new Health();

    // -- Derived accessors --
    public Duration getUnitBaseBackoff() { return Duration.ofMillis(workflow.unitBaseBackoffMs); }
    public Duration getUnitTimeout() { return Duration.ofSeconds(workflow.unitTimeoutSeconds); }
    public Duration getInvocationBaseBackoff() { return Duration.ofMillis(invocation.baseBackoffMs); }
    public Duration getHealthCacheTtl() { return Duration.ofSeconds(invocation.healthCacheSeconds); }
    public Duration getDefaultContextTtl() { return Duration.ofHours(context.defaultTtlHours); }

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Invocation getInvocation() { return invocation; }
    public void setInvocation(Invocation invocation) { this.invocation = invocation; }
    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }
    public Primary getPrimary() { return primary; }
    public void setPrimary(Primary primary) { this.primary = primary; }
    public Secondary getSecondary() { return secondary; }
    public void setSecondary(Secondary secondary) { this.secondary = secondary; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }

    public static class Workflow {
        private int maxParallel = 5;
        private int unitMaxRetries = 2;
        private long unitBaseBackoffMs = 1_000L;
        private int unitTimeoutSeconds = 300;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getUnitMaxRetries() { return unitMaxRetries; }
        public void setUnitMaxRetries(int unitMaxRetries) { this.unitMaxRetries = unitMaxRetries; }
        public long getUnitBaseBackoffMs() { return unitBaseBackoffMs; }
        public void setUnitBaseBackoffMs(long unitBaseBackoffMs) { this.unitBaseBackoffMs = unitBaseBackoffMs; }
        public int getUnitTimeoutSeconds() { return unitTimeoutSeconds; }
        public void setUnitTimeoutSeconds(int unitTimeoutSeconds) { this.unitTimeoutSeconds = unitTimeoutSeconds; }
    }

    public static class Invocation {
        private int maxRetries = 3;
        private long baseBackoffMs = 1_000L;
        private int alertThreshold = 3;
        private int healthCacheSeconds = 30;
        private int recordHistorySize = 200;
        private List<String> toolPermissions = new ArrayList<>(List.of("Read", "Write", "Edit", "Bash"));

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBaseBackoffMs() { return baseBackoffMs; }
        public void setBaseBackoffMs(long baseBackoffMs) { this.baseBackoffMs = baseBackoffMs; }
        public int getAlertThreshold() { return alertThreshold; }
        public void setAlertThreshold(int alertThreshold) { this.alertThreshold = alertThreshold; }
        public int getHealthCacheSeconds() { return healthCacheSeconds; }
        public void setHealthCacheSeconds(int healthCacheSeconds) { this.healthCacheSeconds = healthCacheSeconds; }
        public int getRecordHistorySize() { return recordHistorySize; }
        public void setRecordHistorySize(int recordHistorySize) { this.recordHistorySize = recordHistorySize; }
        public List<String> getToolPermissions() { return toolPermissions; }
        public void setToolPermissions(List<String> toolPermissions) { this.toolPermissions = toolPermissions; }
    }

    public static class Context {
        private String storeDir = "";
        private String archiveDir = "";
        private long defaultTtlHours = 24;
        private WriteConflictPolicy writeConflictPolicy = WriteConflictPolicy.LAST_WRITE_WINS;
        private boolean saveOnComplete = true;
        private boolean archiveOnComplete = false;

        public String getStoreDir() { return storeDir; }
        public void setStoreDir(String storeDir) { this.storeDir = storeDir; }
        public String getArchiveDir() { return archiveDir; }
        public void setArchiveDir(String archiveDir) { this.archiveDir = archiveDir; }
        public long getDefaultTtlHours() { return defaultTtlHours; }
        public void setDefaultTtlHours(long defaultTtlHours) { this.defaultTtlHours = defaultTtlHours; }
        public WriteConflictPolicy getWriteConflictPolicy() { return writeConflictPolicy; }
        public void setWriteConflictPolicy(WriteConflictPolicy writeConflictPolicy) { this.writeConflictPolicy = writeConflictPolicy; }
        public boolean isSaveOnComplete() { return saveOnComplete; }
        public void setSaveOnComplete(boolean saveOnComplete) { this.saveOnComplete = saveOnComplete; }
        public boolean isArchiveOnComplete() { return archiveOnComplete; }
        public void setArchiveOnComplete(boolean archiveOnComplete) { this.archiveOnComplete = archiveOnComplete; }
    }

    public static class Primary {
        private List<String> command = new ArrayList<>(List.of("claude", "-p", "--output-format", "json"));
        private String credentialsEnv = "ANTHROPIC_API_KEY";
        private int timeoutSeconds = 600;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getCredentialsEnv() { return credentialsEnv; }
        public void setCredentialsEnv(String credentialsEnv) { this.credentialsEnv = credentialsEnv; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Secondary {
        private List<String> command = new ArrayList<>(List.of("claude", "-p"));
        private int timeoutSeconds = 600;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Health {
        private long minFreeMemoryMb = 64;
        private long warnFreeMemoryMb = 256;
        private long minFreeDiskMb = 100;
        private long warnFreeDiskMb = 1_024;
        private String networkHost = "";
        private int networkPort = 443;
        private int networkTimeoutMs = 3_000;

        public long getMinFreeMemoryMb() { return minFreeMemoryMb; }
        public void setMinFreeMemoryMb(long minFreeMemoryMb) { this.minFreeMemoryMb = minFreeMemoryMb; }
        public long getWarnFreeMemoryMb() { return warnFreeMemoryMb; }
        public void setWarnFreeMemoryMb(long warnFreeMemoryMb) { this.warnFreeMemoryMb = warnFreeMemoryMb; }
        public long getMinFreeDiskMb() { return minFreeDiskMb; }
        public void setMinFreeDiskMb(long minFreeDiskMb) { this.minFreeDiskMb = minFreeDiskMb; }
        public long getWarnFreeDiskMb() { return warnFreeDiskMb; }
        public void setWarnFreeDiskMb(long warnFreeDiskMb) { this.warnFreeDiskMb = warnFreeDiskMb; }
        public String getNetworkHost() { return networkHost; }
        public void setNetworkHost(String networkHost) { this.networkHost = networkHost; }
        public int getNetworkPort() { return networkPort; }
        public void setNetworkPort(int networkPort) { this.networkPort = networkPort; }
        public int getNetworkTimeoutMs() { return networkTimeoutMs; }
        public void setNetworkTimeoutMs(int networkTimeoutMs) { this.networkTimeoutMs = networkTimeoutMs; }
    }
}
