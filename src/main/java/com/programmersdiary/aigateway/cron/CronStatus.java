package com.programmersdiary.aigateway.cron;

public record CronStatus(boolean enabled, boolean timerArmed, int jobs, Long nextWakeAtMs, String storePath) {
}
