package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronRunLogEntry(
        long ts,
        String jobId,
        RunStatus status,
        String summary,
        String error,
        long runAtMs,
        long durationMs,
        Long nextRunAtMs) {
}
