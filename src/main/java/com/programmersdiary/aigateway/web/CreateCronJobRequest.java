package com.programmersdiary.aigateway.web;

import com.programmersdiary.aigateway.cron.CronDelivery;
import com.programmersdiary.aigateway.cron.CronJobDraft;
import com.programmersdiary.aigateway.cron.CronPayload;
import com.programmersdiary.aigateway.cron.CronSchedule;
import com.programmersdiary.aigateway.cron.SessionTarget;
import com.programmersdiary.aigateway.cron.WakeMode;

public record CreateCronJobRequest(
        String name,
        String description,
        Boolean enabled,
        Boolean deleteAfterRun,
        CronSchedule schedule,
        SessionTarget sessionTarget,
        WakeMode wakeMode,
        CronPayload payload,
        CronDelivery delivery) {

    public CronJobDraft toDraft() {
        return new CronJobDraft(name, description, enabled, deleteAfterRun, schedule,
                sessionTarget, wakeMode, payload, delivery);
    }
}
