package com.programmersdiary.aigateway.cron;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pure next-run and refire-gap arithmetic for {@link CronSchedule}s.
 * <p>
 * Cron expressions use the standard 5-field form (minute hour day-of-month month day-of-week)
 * or a 6-field form with leading seconds. They are evaluated in the schedule's IANA zone, or in
 * the evaluator's default zone when the schedule has none. DST gaps and overlaps follow
 * {@link CronExpression#next}: a local time skipped by a forward shift fires at the first
 * valid instant after it, and an ambiguous local time fires once, on its first occurrence.
 */
public class CronScheduleEvaluator {

    public static final long MIN_REFIRE_GAP_MS = 2_000;

    private final ZoneId defaultZone;
    private final Map<String, CronExpression> expressions = new ConcurrentHashMap<>();

    public CronScheduleEvaluator(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public CronScheduleEvaluator() {
        this(ZoneId.systemDefault());
    }

    /**
     * First instant strictly after {@code fromMs} at which the schedule is due,
     * or {@code null} when it will never be due again.
     */
    public Long computeNextRunAtMs(CronSchedule schedule, long fromMs) {
        if (schedule == null || schedule.kind() == null) {
            throw new CronScheduleException("Schedule kind is required");
        }
        return switch (schedule.kind()) {
            case CRON -> nextCronRun(schedule, fromMs);
            case EVERY -> fromMs + requireEveryMs(schedule);
            case AT -> {
                long atMs = requireAtMs(schedule);
                yield atMs > fromMs ? atMs : null;
            }
        };
    }

    /**
     * Minimum time that must pass after a run before the same job may fire again.
     * Intervals shorter than twice the floor use half their own period instead, so
     * they are never blocked by a gap longer than the interval itself.
     */
    public static long minRefireGapMs(CronSchedule schedule) {
        if (schedule != null && schedule.kind() == ScheduleKind.EVERY
                && schedule.everyMs() != null && schedule.everyMs() > 0
                && schedule.everyMs() < 2 * MIN_REFIRE_GAP_MS) {
            return schedule.everyMs() / 2;
        }
        return MIN_REFIRE_GAP_MS;
    }

    /**
     * Fails fast on schedules that could never be evaluated.
     */
    public void validate(CronSchedule schedule) {
        if (schedule == null || schedule.kind() == null) {
            throw new CronScheduleException("Schedule kind is required");
        }
        switch (schedule.kind()) {
            case CRON -> {
                parse(schedule.expr());
                resolveZone(schedule.tz());
            }
            case EVERY -> requireEveryMs(schedule);
            case AT -> requireAtMs(schedule);
        }
    }

    private Long nextCronRun(CronSchedule schedule, long fromMs) {
        var expression = parse(schedule.expr());
        var zone = resolveZone(schedule.tz());
        var from = ZonedDateTime.ofInstant(Instant.ofEpochMilli(fromMs), zone);
        var next = expression.next(from);
        return next != null ? next.toInstant().toEpochMilli() : null;
    }

    private CronExpression parse(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new CronScheduleException("Cron expression is required");
        }
        var normalized = expr.trim().replaceAll("\\s+", " ");
        return expressions.computeIfAbsent(normalized, CronScheduleEvaluator::compile);
    }

    private static CronExpression compile(String expr) {
        var fields = expr.split(" ");
        var springExpr = switch (fields.length) {
            case 5 -> "0 " + expr;
            case 6 -> expr;
            default -> throw new CronScheduleException(
                    "Cron expression must have 5 or 6 fields: '" + expr + "'");
        };
        try {
            return CronExpression.parse(springExpr);
        } catch (IllegalArgumentException e) {
            throw new CronScheduleException("Invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    private ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new CronScheduleException("Unknown time zone '" + tz + "'", e);
        }
    }

    private static long requireEveryMs(CronSchedule schedule) {
        if (schedule.everyMs() == null || schedule.everyMs() <= 0) {
            throw new CronScheduleException("'every' schedule requires a positive everyMs");
        }
        return schedule.everyMs();
    }

    private static long requireAtMs(CronSchedule schedule) {
        if (schedule.atMs() == null) {
            throw new CronScheduleException("'at' schedule requires atMs");
        }
        return schedule.atMs();
    }
}
