package com.programmersdiary.aigateway.cron;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CronRefireGuardTest {

    private static final long NOW = 1_771_084_950_000L;

    private static CronJob job(CronSchedule schedule, boolean enabled, Long lastRunAtMs, Long nextRunAtMs) {
        return new CronJob("job", "job", null, enabled, false, 0, 0, schedule,
                SessionTarget.ISOLATED, WakeMode.NOW, CronPayload.agentTurn("hi"), CronDelivery.none(),
                new CronJobState(nextRunAtMs, lastRunAtMs, RunStatus.OK, null, null, null));
    }

    @Test
    void staleDueTime_isBlockedWithinGap() {
        var job = job(CronSchedule.cron("0 16 * * *", "Asia/Shanghai"), true, NOW - 1_000, NOW - 30 * 60_000);

        assertThat(CronRefireGuard.isDue(job, NOW)).isTrue();
        assertThat(CronRefireGuard.isEligible(job, NOW)).isFalse();
    }

    @Test
    void gapExactlyElapsed_isEligible() {
        var job = job(CronSchedule.cron("0 16 * * *", "Asia/Shanghai"), true, NOW - 2_000, NOW - 1);

        assertThat(CronRefireGuard.isEligible(job, NOW)).isTrue();
    }

    @Test
    void neverRun_isEligibleWhenDue() {
        var job = job(CronSchedule.every(60_000), true, null, NOW);

        assertThat(CronRefireGuard.isEligible(job, NOW)).isTrue();
    }

    @Test
    void notDue_isNotEligible() {
        assertThat(CronRefireGuard.isEligible(job(CronSchedule.every(60_000), true, null, NOW + 1), NOW)).isFalse();
        assertThat(CronRefireGuard.isEligible(job(CronSchedule.every(60_000), true, null, null), NOW)).isFalse();
    }

    @Test
    void disabled_isNeverEligible() {
        assertThat(CronRefireGuard.isEligible(job(CronSchedule.every(60_000), false, null, NOW - 1), NOW)).isFalse();
    }

    @Test
    void fastEverySchedule_usesHalfIntervalGap() {
        var schedule = CronSchedule.every(1_500);

        assertThat(CronRefireGuard.isEligible(job(schedule, true, NOW - 1_500, NOW - 1), NOW)).isTrue();
        assertThat(CronRefireGuard.isEligible(job(schedule, true, NOW - 700, NOW - 1), NOW)).isFalse();
    }
}
