package com.programmersdiary.aigateway.cron;

import java.util.List;

/**
 * What one tick did. {@code skipped} means another tick or management call held the store.
 */
public record CronTickResult(boolean skipped, List<String> dispatchedJobIds) {

    public static CronTickResult skippedTick() {
        return new CronTickResult(true, List.of());
    }

    public static CronTickResult ran(List<String> dispatchedJobIds) {
        return new CronTickResult(false, List.copyOf(dispatchedJobIds));
    }
}
