package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A run outcome queued for a user-facing channel.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronAnnouncement(
        String jobId,
        String jobName,
        RunStatus status,
        String text,
        String channel,
        String to,
        long atMs) {
}
