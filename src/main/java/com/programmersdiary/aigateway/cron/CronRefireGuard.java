package com.programmersdiary.aigateway.cron;

/**
 * Decides whether a job may be dispatched now.
 * <p>
 * {@code nextRunAtMs} can still hold the slot a job has just fired for, because it is only
 * recomputed once the run has been recorded. A job that ran less than
 * {@link CronScheduleEvaluator#minRefireGapMs} ago is therefore never eligible, however stale
 * its cached due time is.
 */
public final class CronRefireGuard {

    private CronRefireGuard() {
    }

    public static boolean isDue(CronJob job, long nowMs) {
        var next = job.state().nextRunAtMs();
        return next != null && next <= nowMs;
    }

    public static boolean isEligible(CronJob job, long nowMs) {
        return job.enabled() && isDue(job, nowMs) && refireGapElapsed(job, nowMs);
    }

    public static boolean refireGapElapsed(CronJob job, long nowMs) {
        var lastRun = job.state().lastRunAtMs();
        return lastRun == null || nowMs - lastRun >= CronScheduleEvaluator.minRefireGapMs(job.schedule());
    }
}
