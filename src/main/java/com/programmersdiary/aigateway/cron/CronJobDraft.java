package com.programmersdiary.aigateway.cron;

/**
 * Fields a caller supplies when creating a job; ids, timestamps and state are assigned by the service.
 */
public record CronJobDraft(
        String name,
        String description,
        Boolean enabled,
        Boolean deleteAfterRun,
        CronSchedule schedule,
        SessionTarget sessionTarget,
        WakeMode wakeMode,
        CronPayload payload,
        CronDelivery delivery) {
}
