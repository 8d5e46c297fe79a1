package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * When a job is due. Only the fields belonging to {@link #kind()} are set:
 * {@code expr}/{@code tz} for cron, {@code everyMs} for every, {@code atMs} for at.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronSchedule(ScheduleKind kind, String expr, String tz, Long everyMs, Long atMs) {

    public static CronSchedule cron(String expr, String tz) {
        return new CronSchedule(ScheduleKind.CRON, expr, tz, null, null);
    }

    public static CronSchedule every(long everyMs) {
        return new CronSchedule(ScheduleKind.EVERY, null, null, everyMs, null);
    }

    public static CronSchedule at(long atMs) {
        return new CronSchedule(ScheduleKind.AT, null, null, null, atMs);
    }
}
