package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJob(
        String id,
        String name,
        String description,
        boolean enabled,
        boolean deleteAfterRun,
        long createdAtMs,
        long updatedAtMs,
        CronSchedule schedule,
        SessionTarget sessionTarget,
        WakeMode wakeMode,
        CronPayload payload,
        CronDelivery delivery,
        CronJobState state) {

    public CronJob {
        if (sessionTarget == null) sessionTarget = SessionTarget.ISOLATED;
        if (wakeMode == null) wakeMode = WakeMode.NEXT_HEARTBEAT;
        if (delivery == null) delivery = CronDelivery.none();
        if (state == null) state = CronJobState.empty();
    }

    public CronJob withState(CronJobState state) {
        return new CronJob(id, name, description, enabled, deleteAfterRun, createdAtMs, updatedAtMs,
                schedule, sessionTarget, wakeMode, payload, delivery, state);
    }

    public CronJob withEnabled(boolean enabled, long updatedAtMs) {
        return new CronJob(id, name, description, enabled, deleteAfterRun, createdAtMs, updatedAtMs,
                schedule, sessionTarget, wakeMode, payload, delivery, state);
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
