package com.programmersdiary.aigateway.cron;

public record CronRunResult(RunStatus status, String summary, String error) {

    public CronRunResult(RunStatus status, String summary) {
        this(status, summary, null);
    }

    public static CronRunResult ok(String summary) {
        return new CronRunResult(RunStatus.OK, summary, null);
    }

    public static CronRunResult error(String error) {
        return new CronRunResult(RunStatus.ERROR, null, error);
    }
}
