package com.programmersdiary.aigateway.cron;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.ZoneId;

@Component
public class CronProperties {

    private final boolean enabled;
    private final Path storePath;
    private final long tickIntervalMs;
    private final int maxConcurrentRuns;
    private final ZoneId defaultTimezone;
    private final int runLogMaxEntries;

    public CronProperties(
            @Value("${aigateway.cron.enabled:true}") boolean enabled,
            @Value("${aigateway.cron.store-path:${aigateway.config-dir:${user.home}/.aigateway}/cron/jobs.json}") String storePath,
            @Value("${aigateway.cron.tick-interval-ms:1000}") long tickIntervalMs,
            @Value("${aigateway.cron.max-concurrent-runs:1}") int maxConcurrentRuns,
            @Value("${aigateway.cron.default-timezone:}") String defaultTimezone,
            @Value("${aigateway.cron.run-log.max-entries:200}") int runLogMaxEntries) {
        this.enabled = enabled;
        this.storePath = Path.of(storePath);
        this.tickIntervalMs = Math.max(100, tickIntervalMs);
        this.maxConcurrentRuns = Math.max(1, maxConcurrentRuns);
        this.defaultTimezone = defaultTimezone == null || defaultTimezone.isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(defaultTimezone.trim());
        this.runLogMaxEntries = Math.max(1, runLogMaxEntries);
    }

    public static CronProperties forStore(Path storePath) {
        return new CronProperties(true, storePath.toString(), 1000, 1, "UTC", 200);
    }

    public boolean enabled() {
        return enabled;
    }

    public Path storePath() {
        return storePath;
    }

    public long tickIntervalMs() {
        return tickIntervalMs;
    }

    public int maxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public ZoneId defaultTimezone() {
        return defaultTimezone;
    }

    public int runLogMaxEntries() {
        return runLogMaxEntries;
    }
}
