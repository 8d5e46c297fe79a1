package com.programmersdiary.aigateway.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class CronScheduleEvaluatorTest {

    private final CronScheduleEvaluator evaluator = new CronScheduleEvaluator(ZoneOffset.UTC);

    private static long ms(String instant) {
        return Instant.parse(instant).toEpochMilli();
    }

    @Test
    void cron_evaluatesInJobTimezone() {
        var schedule = CronSchedule.cron("0 16 * * *", "Asia/Shanghai");

        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-02-14T07:59:59Z")))
                .isEqualTo(ms("2026-02-14T08:00:00Z"));
    }

    @Test
    void cron_returnsInstantStrictlyAfterFrom() {
        var schedule = CronSchedule.cron("0 16 * * *", "Asia/Shanghai");

        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-02-14T08:00:00Z")))
                .isEqualTo(ms("2026-02-15T08:00:00Z"));
    }

    @Test
    void cron_withoutTimezoneUsesDefaultZone() {
        var schedule = CronSchedule.cron("0 9 * * *", null);

        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-01-01T00:00:00Z")))
                .isEqualTo(ms("2026-01-01T09:00:00Z"));
    }

    @Test
    void cron_acceptsSixFieldExpressionWithSeconds() {
        var schedule = CronSchedule.cron("*/30 * * * * *", "UTC");

        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-01-01T00:00:10Z")))
                .isEqualTo(ms("2026-01-01T00:00:30Z"));
    }

    @Test
    void cron_toleratesExtraWhitespace() {
        var schedule = CronSchedule.cron("  0   9 * *  * ", "UTC");

        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-01-01T00:00:00Z")))
                .isEqualTo(ms("2026-01-01T09:00:00Z"));
    }

    @Test
    void cron_followsDaylightSavingOffsetChange() {
        var schedule = CronSchedule.cron("0 9 * * *", "America/New_York");

        // 9am EST is 14:00Z, 9am EDT (after 2026-03-08 02:00 local) is 13:00Z
        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-03-07T12:00:00Z")))
                .isEqualTo(ms("2026-03-07T14:00:00Z"));
        assertThat(evaluator.computeNextRunAtMs(schedule, ms("2026-03-07T15:00:00Z")))
                .isEqualTo(ms("2026-03-08T13:00:00Z"));
    }

    @Test
    void cron_localTimeSkippedByDstStillResolvesToAnInstant() {
        var schedule = CronSchedule.cron("30 2 * * *", "America/New_York");
        long from = ms("2026-03-08T05:00:00Z");

        assertThat(evaluator.computeNextRunAtMs(schedule, from))
                .isGreaterThan(from)
                .isLessThan(ms("2026-03-09T12:00:00Z"));
    }

    @Test
    void every_addsIntervalToFrom() {
        assertThat(evaluator.computeNextRunAtMs(CronSchedule.every(10_000), 1_000L)).isEqualTo(11_000L);
    }

    @Test
    void at_isDueOnceThenNever() {
        var schedule = CronSchedule.at(5_000);

        assertThat(evaluator.computeNextRunAtMs(schedule, 1_000L)).isEqualTo(5_000L);
        assertThat(evaluator.computeNextRunAtMs(schedule, 5_000L)).isNull();
    }

    @Test
    void invalidExpression_throwsScheduleException() {
        assertThatThrownBy(() -> evaluator.computeNextRunAtMs(CronSchedule.cron("61 * * * *", "UTC"), 0L))
                .isInstanceOf(CronScheduleException.class)
                .hasMessageContaining("61 * * * *");
        assertThatThrownBy(() -> evaluator.computeNextRunAtMs(CronSchedule.cron("* * * *", "UTC"), 0L))
                .isInstanceOf(CronScheduleException.class)
                .hasMessageContaining("5 or 6 fields");
    }

    @Test
    void unknownTimezone_throwsScheduleException() {
        assertThatThrownBy(() -> evaluator.computeNextRunAtMs(CronSchedule.cron("0 9 * * *", "Mars/Olympus"), 0L))
                .isInstanceOf(CronScheduleException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    void validate_rejectsIncompleteSchedules() {
        assertThatThrownBy(() -> evaluator.validate(null)).isInstanceOf(CronScheduleException.class);
        assertThatThrownBy(() -> evaluator.validate(new CronSchedule(ScheduleKind.EVERY, null, null, 0L, null)))
                .isInstanceOf(CronScheduleException.class);
        assertThatThrownBy(() -> evaluator.validate(new CronSchedule(ScheduleKind.AT, null, null, null, null)))
                .isInstanceOf(CronScheduleException.class);
        assertThatCode(() -> evaluator.validate(CronSchedule.cron("0 9 * * 1-5", "Europe/Vilnius")))
                .doesNotThrowAnyException();
    }

    @Test
    void minRefireGap_usesFloorForCronAndAt() {
        assertThat(CronScheduleEvaluator.minRefireGapMs(CronSchedule.cron("* * * * *", null))).isEqualTo(2_000);
        assertThat(CronScheduleEvaluator.minRefireGapMs(CronSchedule.at(0))).isEqualTo(2_000);
    }

    @Test
    void minRefireGap_usesHalfIntervalOnlyBelowTwiceTheFloor() {
        assertThat(CronScheduleEvaluator.minRefireGapMs(CronSchedule.every(1_500))).isEqualTo(750);
        assertThat(CronScheduleEvaluator.minRefireGapMs(CronSchedule.every(3_999))).isEqualTo(1_999);
        assertThat(CronScheduleEvaluator.minRefireGapMs(CronSchedule.every(4_000))).isEqualTo(2_000);
        assertThat(CronScheduleEvaluator.minRefireGapMs(CronSchedule.every(10_000))).isEqualTo(2_000);
    }
}
