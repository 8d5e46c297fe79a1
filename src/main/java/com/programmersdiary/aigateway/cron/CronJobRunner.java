package com.programmersdiary.aigateway.cron;

import java.util.concurrent.CompletableFuture;

/**
 * Executes the work described by an agent-turn job. Failures may be thrown directly or
 * reported through an exceptionally completed future; both are recorded as a failed run.
 */
@FunctionalInterface
public interface CronJobRunner {

    CompletableFuture<CronRunResult> run(CronJob job);
}
