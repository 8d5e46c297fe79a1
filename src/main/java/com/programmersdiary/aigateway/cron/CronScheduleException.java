package com.programmersdiary.aigateway.cron;

/**
 * A schedule that cannot be evaluated: unparsable cron expression, unknown time zone,
 * or missing/invalid fields for its kind.
 */
public class CronScheduleException extends RuntimeException {

    public CronScheduleException(String message) {
        super(message);
    }

    public CronScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
