package com.programmersdiary.aigateway.cron;

public record ManualRunResult(boolean ran, String reason, CronRunLogEntry run) {

    public static ManualRunResult notRun(String reason) {
        return new ManualRunResult(false, reason, null);
    }

    public static ManualRunResult ran(CronRunLogEntry run) {
        return new ManualRunResult(true, null, run);
    }
}
