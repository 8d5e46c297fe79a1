package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJobState(
        Long nextRunAtMs,
        Long lastRunAtMs,
        RunStatus lastStatus,
        Long lastDurationMs,
        String lastError,
        Integer consecutiveErrors) {

    public static CronJobState empty() {
        return new CronJobState(null, null, null, null, null, null);
    }

    public CronJobState withNextRunAtMs(Long nextRunAtMs) {
        return new CronJobState(nextRunAtMs, lastRunAtMs, lastStatus, lastDurationMs, lastError, consecutiveErrors);
    }

    public int consecutiveErrorCount() {
        return consecutiveErrors != null ? consecutiveErrors : 0;
    }
}
