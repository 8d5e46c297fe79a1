package com.programmersdiary.aigateway.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the cron store and the timer that ticks over it.
 * <p>
 * Each tick loads the store if needed, dispatches every enabled job that is due and past its
 * refire gap, records the outcomes on the in-memory store and then writes the store once.
 * Ticks never overlap: a tick that finds the store busy is skipped. Management calls take the
 * same lock, so the store has a single writer at any time.
 */
public class CronService {

    private static final Logger log = LoggerFactory.getLogger(CronService.class);
    private static final int SUMMARY_LIMIT = 2_000;

    private final CronProperties properties;
    private final CronStoreRepository repository;
    private final CronRunLog runLog;
    private final CronScheduleEvaluator evaluator;
    private final CronJobRunner jobRunner;
    private final SystemEventSink systemEvents;
    private final HeartbeatRequester heartbeat;
    private final AnnouncementSink announcements;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ReentrantLock storeLock = new ReentrantLock();
    private final Set<String> reportedInvalidSchedules = ConcurrentHashMap.newKeySet();
    private ScheduledFuture<?> timer;

    public CronService(CronProperties properties,
                       CronStoreRepository repository,
                       CronRunLog runLog,
                       CronScheduleEvaluator evaluator,
                       CronJobRunner jobRunner,
                       SystemEventSink systemEvents,
                       HeartbeatRequester heartbeat,
                       AnnouncementSink announcements,
                       TaskScheduler taskScheduler,
                       Clock clock) {
        this.properties = properties;
        this.repository = repository;
        this.runLog = runLog;
        this.evaluator = evaluator;
        this.jobRunner = jobRunner;
        this.systemEvents = systemEvents;
        this.heartbeat = heartbeat;
        this.announcements = announcements;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public synchronized void start() {
        if (!properties.enabled()) {
            log.info("Cron is disabled, timer not started");
            return;
        }
        if (timer != null) {
            return;
        }
        timer = taskScheduler.scheduleWithFixedDelay(this::tickSafely,
                Duration.ofMillis(properties.tickIntervalMs()));
        log.info("Cron timer started (every {} ms, store {})", properties.tickIntervalMs(), repository.storePath());
    }

    /**
     * Cancels future ticks. A tick already in progress runs to completion. Safe to call repeatedly.
     */
    public synchronized void stop() {
        if (timer == null) {
            return;
        }
        timer.cancel(false);
        timer = null;
        log.info("Cron timer stopped");
    }

    public synchronized boolean isTimerArmed() {
        return timer != null;
    }

    public CronTickResult tick() {
        if (!storeLock.tryLock()) {
            log.debug("Cron tick skipped, store busy");
            return CronTickResult.skippedTick();
        }
        try {
            CronStore store;
            try {
                store = repository.ensureLoaded();
            } catch (CronStoreCorruptException e) {
                log.error("{}; cron jobs will not run until the file is fixed", e.getMessage());
                return CronTickResult.ran(List.of());
            } catch (UncheckedIOException e) {
                log.error("Cron store could not be read: {}", e.getMessage());
                return CronTickResult.ran(List.of());
            }

            long now = clock.millis();
            boolean dirty = assignMissingNextRuns(store, now);
            var eligible = new ArrayList<CronJob>();
            for (var job : List.copyOf(store.jobs())) {
                if (!job.enabled() || !CronRefireGuard.isDue(job, now)) {
                    continue;
                }
                try {
                    evaluator.validate(job.schedule());
                } catch (CronScheduleException e) {
                    reportInvalidSchedule(job, e);
                    continue;
                }
                if (CronRefireGuard.refireGapElapsed(job, now)) {
                    eligible.add(job);
                } else {
                    log.debug("Cron job '{}' is due but ran {} ms ago, inside its refire gap",
                            job.displayName(), now - job.state().lastRunAtMs());
                    dirty |= refreshStaleNextRun(store, job);
                }
            }

            execute(store, eligible);
            if (dirty || !eligible.isEmpty()) {
                persistQuietly(store);
            }
            return CronTickResult.ran(eligible.stream().map(CronJob::id).toList());
        } finally {
            storeLock.unlock();
        }
    }

    public List<CronJob> list(boolean includeDisabled) {
        return withStore(store -> store.jobs().stream()
                .filter(j -> includeDisabled || j.enabled())
                .toList());
    }

    public Optional<CronJob> get(String id) {
        return withStore(store -> store.findById(id));
    }

    public CronJob add(CronJobDraft draft) {
        validate(draft);
        return withStore(store -> {
            long now = clock.millis();
            var enabled = draft.enabled() == null || draft.enabled();
            var job = new CronJob(
                    UUID.randomUUID().toString(),
                    draft.name(),
                    draft.description(),
                    enabled,
                    Boolean.TRUE.equals(draft.deleteAfterRun()),
                    now,
                    now,
                    draft.schedule(),
                    draft.sessionTarget(),
                    draft.wakeMode(),
                    draft.payload(),
                    draft.delivery(),
                    CronJobState.empty());
            if (enabled) {
                job = job.withState(job.state().withNextRunAtMs(initialNextRun(job, now)));
            }
            store.jobs().add(job);
            try {
                repository.persist(store);
            } catch (UncheckedIOException e) {
                store.remove(job.id());
                throw e;
            }
            log.info("Added cron job '{}' ({})", job.displayName(), job.id());
            return job;
        });
    }

    public Optional<CronJob> setEnabled(String id, boolean enabled) {
        return withStore(store -> {
            var existing = store.findById(id);
            if (existing.isEmpty()) {
                return Optional.<CronJob>empty();
            }
            long now = clock.millis();
            var job = existing.get().withEnabled(enabled, now);
            if (enabled && job.state().nextRunAtMs() == null) {
                job = job.withState(job.state().withNextRunAtMs(initialNextRun(job, now)));
            }
            store.replace(job);
            try {
                repository.persist(store);
            } catch (UncheckedIOException e) {
                store.replace(existing.get());
                throw e;
            }
            log.info("Cron job '{}' {}", job.displayName(), enabled ? "enabled" : "disabled");
            return Optional.of(job);
        });
    }

    public boolean remove(String id) {
        return withStore(store -> {
            var existing = store.findById(id);
            if (existing.isEmpty()) {
                return false;
            }
            int index = store.jobs().indexOf(existing.get());
            store.remove(id);
            try {
                repository.persist(store);
            } catch (UncheckedIOException e) {
                store.jobs().add(index, existing.get());
                throw e;
            }
            forget(id);
            log.info("Removed cron job {}", id);
            return true;
        });
    }

    /**
     * Runs a job outside the timer. The job must be enabled and past its refire gap; without
     * {@code force} it must also be due.
     */
    public ManualRunResult runNow(String id, boolean force) {
        return withStore(store -> {
            var found = store.findById(id);
            if (found.isEmpty()) {
                return ManualRunResult.notRun("not-found");
            }
            var job = found.get();
            long now = clock.millis();
            if (!job.enabled()) {
                return ManualRunResult.notRun("disabled");
            }
            if (!force && !CronRefireGuard.isDue(job, now)) {
                return ManualRunResult.notRun("not-due");
            }
            if (!CronRefireGuard.refireGapElapsed(job, now)) {
                return ManualRunResult.notRun("refire-gap");
            }
            var runs = execute(store, List.of(job));
            persistQuietly(store);
            return ManualRunResult.ran(runs.get(0));
        });
    }

    public List<CronRunLogEntry> runs(String id, int limit) {
        return runLog != null ? runLog.readRuns(id, limit) : List.of();
    }

    public CronStatus status() {
        return withStore(store -> {
            Long nextWake = store.jobs().stream()
                    .filter(CronJob::enabled)
                    .map(j -> j.state().nextRunAtMs())
                    .filter(Objects::nonNull)
                    .min(Long::compare)
                    .orElse(null);
            return new CronStatus(properties.enabled(), isTimerArmed(), store.jobs().size(), nextWake,
                    repository.storePath().toString());
        });
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Cron tick failed: {}", e.getMessage(), e);
        }
    }

    private <T> T withStore(Function<CronStore, T> action) {
        storeLock.lock();
        try {
            return action.apply(repository.ensureLoaded());
        } finally {
            storeLock.unlock();
        }
    }

    private boolean assignMissingNextRuns(CronStore store, long now) {
        boolean changed = false;
        for (var job : List.copyOf(store.jobs())) {
            if (!job.enabled() || job.state().nextRunAtMs() != null) {
                continue;
            }
            try {
                var next = initialNextRun(job, now);
                if (next == null) {
                    store.replace(job.withEnabled(false, now));
                    log.info("Cron job '{}' has no further runs, disabling", job.displayName());
                } else {
                    store.replace(job.withState(job.state().withNextRunAtMs(next)));
                }
                changed = true;
            } catch (CronScheduleException e) {
                reportInvalidSchedule(job, e);
            }
        }
        return changed;
    }

    private Long initialNextRun(CronJob job, long now) {
        var schedule = job.schedule();
        if (schedule != null && schedule.kind() == ScheduleKind.AT && job.state().lastRunAtMs() == null) {
            evaluator.validate(schedule);
            return schedule.atMs();
        }
        return evaluator.computeNextRunAtMs(schedule, now);
    }

    private boolean refreshStaleNextRun(CronStore store, CronJob job) {
        try {
            var next = evaluator.computeNextRunAtMs(job.schedule(), job.state().lastRunAtMs());
            if (next != null && !next.equals(job.state().nextRunAtMs())) {
                store.replace(job.withState(job.state().withNextRunAtMs(next)));
                return true;
            }
        } catch (CronScheduleException e) {
            reportInvalidSchedule(job, e);
        }
        return false;
    }

    private List<CronRunLogEntry> execute(CronStore store, List<CronJob> jobs) {
        var entries = new ArrayList<CronRunLogEntry>();
        int batchSize = properties.maxConcurrentRuns();
        for (int from = 0; from < jobs.size(); from += batchSize) {
            var pending = new ArrayList<PendingRun>();
            for (var job : jobs.subList(from, Math.min(jobs.size(), from + batchSize))) {
                pending.add(dispatch(job));
            }
            for (var run : pending) {
                entries.add(record(store, run.job(), run.startedAtMs(), run.outcome().join()));
            }
        }
        return entries;
    }

    private PendingRun dispatch(CronJob job) {
        long startedAt = clock.millis();
        log.info("Running cron job '{}' ({})", job.displayName(), job.id());
        CompletableFuture<CronRunResult> future;
        try {
            future = invoke(job, startedAt);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        var outcome = future.handle((result, error) -> new RunOutcome(result, unwrap(error), clock.millis()));
        return new PendingRun(job, startedAt, outcome);
    }

    private CompletableFuture<CronRunResult> invoke(CronJob job, long startedAt) {
        var payload = job.payload();
        if (payload == null || payload.kind() == null) {
            throw new IllegalStateException("Cron job " + job.id() + " has no payload");
        }
        return switch (payload.kind()) {
            case AGENT_TURN -> {
                var future = jobRunner.run(job);
                if (future == null) {
                    throw new IllegalStateException("Job runner returned no result for " + job.id());
                }
                yield future;
            }
            case SYSTEM_EVENT -> {
                systemEvents.enqueueSystemEvent(new SystemEvent("cron", job.id(), payload.text(), startedAt));
                yield CompletableFuture.completedFuture(CronRunResult.ok(payload.text()));
            }
        };
    }

    private CronRunLogEntry record(CronStore store, CronJob job, long startedAt, RunOutcome outcome) {
        var result = outcome.result();
        boolean failed = outcome.error() != null || result == null || result.status() == RunStatus.ERROR;
        var status = failed ? RunStatus.ERROR : (result.status() != null ? result.status() : RunStatus.OK);
        var summary = result != null ? truncate(result.summary()) : null;
        var error = failed ? errorMessage(outcome, result) : null;
        long duration = Math.max(0, outcome.endedAtMs() - startedAt);

        Long next = null;
        try {
            next = evaluator.computeNextRunAtMs(job.schedule(), startedAt);
        } catch (CronScheduleException e) {
            log.warn("Cron job '{}' has an invalid schedule after running: {}", job.displayName(), e.getMessage());
        }

        var current = store.findById(job.id()).orElse(job);
        if (!failed && current.deleteAfterRun()) {
            store.remove(current.id());
            forget(current.id());
            log.info("One-shot cron job '{}' finished and was removed", current.displayName());
        } else {
            int errors = failed ? current.state().consecutiveErrorCount() + 1 : 0;
            var state = new CronJobState(next, startedAt, status, duration, error, errors);
            var updated = current.withState(state);
            if (next == null && current.enabled()) {
                updated = updated.withEnabled(false, outcome.endedAtMs());
            }
            store.replace(updated);
        }

        if (failed) {
            log.warn("Cron job '{}' failed after {} ms: {}", job.displayName(), duration, error);
        } else {
            log.info("Cron job '{}' finished with status {} in {} ms", job.displayName(), status.toValue(), duration);
        }

        var entry = new CronRunLogEntry(outcome.endedAtMs(), job.id(), status, summary, error, startedAt, duration, next);
        if (store.findById(job.id()).isPresent()) {
            appendRunLog(entry);
        }
        signal(job, status, summary, error, outcome.endedAtMs());
        return entry;
    }

    private void signal(CronJob job, RunStatus status, String summary, String error, long atMs) {
        if (job.wakeMode() == WakeMode.NOW) {
            try {
                heartbeat.requestHeartbeatNow("cron:" + job.id());
            } catch (RuntimeException e) {
                log.warn("Heartbeat request for cron job '{}' failed: {}", job.displayName(), e.getMessage());
            }
        }
        var text = describe(job, status, summary, error);
        if (job.payload() == null || job.payload().kind() != PayloadKind.SYSTEM_EVENT || status == RunStatus.ERROR) {
            try {
                systemEvents.enqueueSystemEvent(new SystemEvent("cron", job.id(), text, atMs));
            } catch (RuntimeException e) {
                log.warn("System event for cron job '{}' was dropped: {}", job.displayName(), e.getMessage());
            }
        }
        if (job.delivery().announces()) {
            try {
                announcements.announce(new CronAnnouncement(job.id(), job.displayName(), status, text,
                        job.delivery().channel(), job.delivery().to(), atMs));
            } catch (RuntimeException e) {
                log.warn("Announcement for cron job '{}' was dropped: {}", job.displayName(), e.getMessage());
            }
        }
    }

    private void appendRunLog(CronRunLogEntry entry) {
        if (runLog == null) return;
        try {
            runLog.append(entry);
        } catch (UncheckedIOException e) {
            log.warn("Run log for cron job {} not written: {}", entry.jobId(), e.getMessage());
        }
    }

    private void forget(String jobId) {
        reportedInvalidSchedules.removeIf(key -> key.startsWith(jobId + "|"));
        if (runLog == null) return;
        try {
            runLog.delete(jobId);
        } catch (UncheckedIOException e) {
            log.warn("Run log for removed cron job {} not deleted: {}", jobId, e.getMessage());
        }
    }

    private void reportInvalidSchedule(CronJob job, CronScheduleException e) {
        if (reportedInvalidSchedules.add(job.id() + "|" + job.schedule())) {
            log.warn("Cron job '{}' skipped: {}", job.displayName(), e.getMessage());
        } else {
            log.debug("Cron job '{}' still skipped: {}", job.displayName(), e.getMessage());
        }
    }

    private void persistQuietly(CronStore store) {
        try {
            repository.persist(store);
        } catch (UncheckedIOException e) {
            log.error("Cron store not persisted, keeping in-memory state: {}", e.getMessage());
        }
    }

    private void validate(CronJobDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("Cron job is required");
        }
        evaluator.validate(draft.schedule());
        var payload = draft.payload();
        if (payload == null || payload.kind() == null) {
            throw new IllegalArgumentException("Cron job payload is required");
        }
        switch (payload.kind()) {
            case AGENT_TURN -> {
                if (payload.message() == null || payload.message().isBlank()) {
                    throw new IllegalArgumentException("agentTurn payload requires a message");
                }
            }
            case SYSTEM_EVENT -> {
                if (payload.text() == null || payload.text().isBlank()) {
                    throw new IllegalArgumentException("systemEvent payload requires text");
                }
            }
        }
    }

    private static String describe(CronJob job, RunStatus status, String summary, String error) {
        var sb = new StringBuilder("Cron job '").append(job.displayName()).append("' ");
        if (status == RunStatus.ERROR) {
            sb.append("failed");
            if (error != null) sb.append(": ").append(error);
        } else {
            sb.append("finished (").append(status.toValue()).append(")");
            if (summary != null && !summary.isBlank()) sb.append(": ").append(summary);
        }
        return sb.toString();
    }

    private static String errorMessage(RunOutcome outcome, CronRunResult result) {
        if (outcome.error() != null) {
            var message = outcome.error().getMessage();
            return message != null ? message : outcome.error().getClass().getSimpleName();
        }
        if (result == null) {
            return "Job runner returned no result";
        }
        return result.error() != null ? result.error() : "Job reported an error";
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= SUMMARY_LIMIT) return text;
        return text.substring(0, SUMMARY_LIMIT) + "…";
    }

    private record PendingRun(CronJob job, long startedAtMs, CompletableFuture<RunOutcome> outcome) {
    }

    private record RunOutcome(CronRunResult result, Throwable error, long endedAtMs) {
    }
}
