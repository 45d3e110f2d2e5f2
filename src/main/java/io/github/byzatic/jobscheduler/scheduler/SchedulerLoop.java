package io.github.byzatic.jobscheduler.scheduler;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.JobEventPublisher;
import io.github.byzatic.jobscheduler.SchedulerConfiguration;
import io.github.byzatic.jobscheduler.dispatch.DispatchItem;
import io.github.byzatic.jobscheduler.dispatch.DispatchQueue;
import io.github.byzatic.jobscheduler.dispatch.PendingRetry;
import io.github.byzatic.jobscheduler.exceptions.ConcurrentJobModificationException;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import io.github.byzatic.jobscheduler.exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.model.ExecutionOutcome;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobFilter;
import io.github.byzatic.jobscheduler.model.JobStatus;
import io.github.byzatic.jobscheduler.model.ScheduleKind;
import io.github.byzatic.jobscheduler.retry.RetryPolicy;
import io.github.byzatic.jobscheduler.store.HistoryStoreInterface;
import io.github.byzatic.jobscheduler.store.JobStoreInterface;
import io.github.byzatic.jobscheduler.worker.ExecutionLifecycle;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic driver of the scheduling core.
 * <p>
 * Every tick it moves retries whose backoff has elapsed and jobs whose {@code nextRunAt} has been reached onto the
 * {@link DispatchQueue}. It also owns the status bookkeeping around an execution ({@link ExecutionLifecycle}):
 * marking the job running, deciding on a retry and applying the final transition.
 * <p>
 * A job is "in flight" from the moment its occurrence is enqueued until the execution, retries included,
 * concludes. While in flight no further occurrence of the job is enqueued; occurrences falling due meanwhile are
 * skipped. All job changes go through the store's version check; a lost race is re-read and re-applied.
 */
@ThreadSafe
public final class SchedulerLoop implements ExecutionLifecycle, AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

    static final int MAX_UPDATE_ATTEMPTS = 16;

    private final JobStoreInterface store;
    private final HistoryStoreInterface history;
    private final DispatchQueue queue;
    private final RetryPolicy retryPolicy;
    private final JobEventPublisher events;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration defaultBaseRetryDelay;
    private final Duration defaultMaxRetryDelay;

    private final DelayQueue<PendingRetry> retries = new DelayQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private volatile Thread loopThread;

    public SchedulerLoop(@NotNull JobStoreInterface store,
                         @NotNull HistoryStoreInterface history,
                         @NotNull DispatchQueue queue,
                         @NotNull RetryPolicy retryPolicy,
                         @NotNull JobEventPublisher events,
                         @NotNull SchedulerConfiguration configuration) {
        this.store = Objects.requireNonNull(store, "store");
        this.history = Objects.requireNonNull(history, "history");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.events = Objects.requireNonNull(events, "events");
        Objects.requireNonNull(configuration, "configuration");
        this.clock = configuration.getClock();
        this.pollInterval = configuration.getPollInterval();
        this.defaultBaseRetryDelay = configuration.getDefaultBaseRetryDelay();
        this.defaultMaxRetryDelay = configuration.getDefaultMaxRetryDelay();
    }

    // ======== Loop ========

    /**
     * Recovers executions left in flight by a previous run on the same store, then starts ticking.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) return;
        recoverStaleExecutions();
        Thread thread = new ThreadFactoryBuilder()
                .setNameFormat("job-scheduler-loop")
                .setDaemon(true)
                .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                .build()
                .newThread(this::runLoop);
        loopThread = thread;
        thread.start();
        logger.info("Scheduler loop started, poll interval {}", pollInterval);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        Thread thread = loopThread;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(Math.max(1000L, pollInterval.toMillis() * 2));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Scheduler loop stopped after {} tick(s), {} retry(ies) dropped", ticks.get(), retries.size());
        retries.clear();
    }

    private void runLoop() {
        final long period = pollInterval.toNanos();
        long nextTick = System.nanoTime();
        while (running.get()) {
            try {
                tick();
            } catch (Throwable t) {
                logger.error("Scheduler tick failed", t);
            }
            nextTick += period;
            long now = System.nanoTime();
            if (now - nextTick >= 0) {
                // опоздали: один тик сразу, пропущенные не догоняем
                logger.debug("Scheduler loop is {} ms behind, ticking now", TimeUnit.NANOSECONDS.toMillis(now - nextTick));
                nextTick = now;
                continue;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(nextTick - now);
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            }
        }
    }

    /**
     * One pass: release due retries, then enqueue every due job. Per-job failures are logged and skipped.
     */
    @VisibleForTesting
    public void tick() {
        ticks.incrementAndGet();
        Instant now = clock.instant();
        releaseRetries();

        List<Job> due = store.list(JobFilter.due(now));
        if (!due.isEmpty()) logger.debug("Tick at {}: {} due job(s)", now, due.size());
        for (Job job : due) {
            try {
                dispatch(job, now);
            } catch (InvalidScheduleSpecException e) {
                logger.error("Job {} '{}' has a schedule that cannot be evaluated, skipped", job.getId(), job.getName(), e);
            } catch (JobNotFoundException e) {
                logger.debug("Job {} deleted while dispatching", job.getId());
            } catch (ConcurrentJobModificationException e) {
                logger.debug("Job {} changed while dispatching, left for the next tick", job.getId());
            }
        }
    }

    /**
     * Resets jobs left {@code RUNNING} or in flight by a manager that stopped before their execution concluded.
     * The interrupted execution is not retried: a pending cancel or pause is applied, otherwise the job returns to
     * {@code SCHEDULED} with its {@code nextRunAt} kept, so an overdue occurrence runs on the next tick.
     * <p>
     * Must run before anything is dispatched from this store.
     *
     * @return number of jobs reset
     */
    @VisibleForTesting
    public int recoverStaleExecutions() {
        int recovered = 0;
        for (Job job : store.list(JobFilter.all())) {
            if (!isStale(job)) continue;
            if (recover(job.getId())) recovered++;
        }
        if (recovered > 0) logger.warn("Recovered {} job(s) left in flight by a previous run", recovered);
        return recovered;
    }

    private static boolean isStale(Job job) {
        return job.isExecutionInFlight() || job.getStatus() == JobStatus.RUNNING;
    }

    private boolean recover(UUID jobId) {
        for (int i = 0; i < MAX_UPDATE_ATTEMPTS; i++) {
            Optional<Job> found = store.find(jobId);
            if (found.isEmpty() || !isStale(found.get())) return false;
            Job job = found.get();
            JobStatus requested = job.getRequestedStatus();
            Job.Builder builder = job.toBuilder().setExecutionInFlight(false).setRequestedStatus(null);
            if (requested == JobStatus.CANCELLED) {
                builder.setStatus(JobStatus.CANCELLED).setNextRunAt(null);
            } else {
                builder.setStatus(requested == JobStatus.PAUSED ? JobStatus.PAUSED : JobStatus.SCHEDULED);
                if (job.getNextRunAt() == null && job.getScheduleKind() != ScheduleKind.ONCE) {
                    builder.setNextRunAt(nextRunAfterFinish(job, clock.instant()));
                }
            }
            try {
                Job reset = store.update(builder.build());
                logger.info("Job {} '{}' recovered as {}, next run at {}", jobId, job.getName(), reset.getStatus(),
                        reset.getNextRunAt());
                if (reset.getStatus() == JobStatus.CANCELLED) events.fire(l -> l.onCancelled(jobId));
                return true;
            } catch (ConcurrentJobModificationException e) {
                logger.trace("recovery of job {} lost a race, re-reading", jobId);
            } catch (JobNotFoundException e) {
                return false;
            }
        }
        logger.error("Job {} could not be recovered after {} attempts", jobId, MAX_UPDATE_ATTEMPTS);
        return false;
    }

    public int pendingRetryCount() {
        return retries.size();
    }

    private void dispatch(Job job, Instant now)
            throws InvalidScheduleSpecException, JobNotFoundException, ConcurrentJobModificationException {
        Instant dueAt = Objects.requireNonNull(job.getNextRunAt());
        if (job.isExecutionInFlight()) {
            Instant next = job.getSchedule().nextRunAfter(now, job.getTimezone());
            if (next == null) return;
            store.update(job.toBuilder().setNextRunAt(next).build());
            logger.warn("Job {} '{}' still executing, occurrence at {} skipped, next run at {}",
                    job.getId(), job.getName(), dueAt, next);
            return;
        }
        // для once nextRunAt остаётся до завершения
        Instant next = job.getScheduleKind() == ScheduleKind.ONCE
                ? dueAt
                : job.getSchedule().nextRunAfter(now, job.getTimezone());
        store.update(job.toBuilder()
                .setExecutionInFlight(true)
                .setLastRunAt(now)
                .setNextRunAt(next)
                .build());
        queue.offer(DispatchItem.firstAttempt(job.getId(), job.getPriority(), dueAt));
        logger.debug("Job {} '{}' due at {} enqueued ({}), next run at {}", job.getId(), job.getName(), dueAt,
                job.getPriority(), next);
    }

    private void releaseRetries() {
        // отменённые не ждут окончания backoff
        Iterator<PendingRetry> it = retries.iterator();
        List<PendingRetry> cancelled = new ArrayList<>();
        while (it.hasNext()) {
            PendingRetry pending = it.next();
            Optional<Job> job = store.find(pending.getItem().getJobId());
            if (job.isEmpty() || job.get().getRequestedStatus() == JobStatus.CANCELLED) {
                cancelled.add(pending);
            }
        }
        for (PendingRetry pending : cancelled) {
            if (retries.remove(pending)) {
                UUID jobId = pending.getItem().getJobId();
                if (store.find(jobId).isPresent()) {
                    conclude(jobId, clock.instant());
                    events.fire(l -> l.onCancelled(jobId));
                } else {
                    logger.warn("Retry of deleted job {} dropped", jobId);
                }
            }
        }

        PendingRetry ready;
        while ((ready = retries.poll()) != null) {
            DispatchItem item = ready.getItem();
            queue.offer(item);
            logger.debug("Retry released: {}", item);
        }
    }

    // ======== ExecutionLifecycle ========

    @Override
    public @Nullable Job claim(@NotNull DispatchItem item) {
        UUID jobId = item.getJobId();
        for (int i = 0; i < MAX_UPDATE_ATTEMPTS; i++) {
            Optional<Job> found = store.find(jobId);
            if (found.isEmpty()) {
                logger.warn("Dispatched job {} no longer exists, attempt dropped", jobId);
                return null;
            }
            Job job = found.get();
            if (!job.isExecutionInFlight() || job.getStatus().isTerminal()) {
                logger.warn("Job {} is {} and not in flight, attempt {} dropped", jobId, job.getStatus(), item.getAttempt());
                return null;
            }
            if (job.getRequestedStatus() == JobStatus.CANCELLED) {
                conclude(jobId, clock.instant());
                events.fire(l -> l.onCancelled(jobId));
                return null;
            }
            try {
                return store.update(job.toBuilder().setStatus(JobStatus.RUNNING).build());
            } catch (ConcurrentJobModificationException e) {
                logger.trace("claim of job {} lost a race, re-reading", jobId);
            } catch (JobNotFoundException e) {
                return null;
            }
        }
        logger.warn("Job {} could not be claimed after {} attempts, conflicting updates", jobId, MAX_UPDATE_ATTEMPTS);
        conclude(jobId, clock.instant());
        return null;
    }

    @Override
    public void complete(@NotNull DispatchItem item, @NotNull ExecutionRecord record) {
        UUID jobId = item.getJobId();
        Optional<Job> found = store.find(jobId);
        if (found.isEmpty()) {
            // job deleted while running: outcome discarded
            history.delete(jobId);
            logger.debug("Outcome of deleted job {} discarded", jobId);
            return;
        }
        Job job = found.get();
        ExecutionOutcome outcome = record.getOutcome();
        boolean failed = outcome == ExecutionOutcome.FAILURE || outcome == ExecutionOutcome.TIMEOUT;
        if (failed && job.getRequestedStatus() != JobStatus.CANCELLED) {
            Duration base = job.getBaseRetryDelay() != null ? job.getBaseRetryDelay() : defaultBaseRetryDelay;
            Duration max = job.getMaxRetryDelay() != null ? job.getMaxRetryDelay() : defaultMaxRetryDelay;
            if (max.compareTo(base) < 0) max = base;
            Optional<Duration> delay = retryPolicy.nextRetryDelay(record.getAttempt(), job.getMaxRetries(), base, max);
            if (delay.isPresent()) {
                scheduleRetry(item, record, delay.get());
                return;
            }
            if (job.getMaxRetries() > 0) {
                logger.warn("Job {} '{}' failed after {} attempt(s), giving up: {}", jobId, job.getName(),
                        record.getAttempt(), record.getErrorDetail());
            }
            events.fire(l -> l.onRetriesExhausted(jobId, record));
        }
        conclude(jobId, record.getFinishedAt());
    }

    private void scheduleRetry(DispatchItem item, ExecutionRecord record, Duration delay) {
        UUID jobId = item.getJobId();
        for (int i = 0; i < MAX_UPDATE_ATTEMPTS; i++) {
            Optional<Job> found = store.find(jobId);
            if (found.isEmpty()) {
                history.delete(jobId);
                return;
            }
            Job job = found.get();
            try {
                store.update(job.toBuilder().setStatus(JobStatus.SCHEDULED).build());
                DispatchItem next = item.retry(clock.instant().plus(delay));
                retries.offer(new PendingRetry(next, clock));
                logger.info("Job {} '{}' attempt {} ended with {}, attempt {} in {} ms", jobId, job.getName(),
                        record.getAttempt(), record.getOutcome(), next.getAttempt(), delay.toMillis());
                events.fire(l -> l.onRetryScheduled(jobId, next.getAttempt(), delay));
                return;
            } catch (ConcurrentJobModificationException e) {
                logger.trace("retry scheduling of job {} lost a race, re-reading", jobId);
            } catch (JobNotFoundException e) {
                history.delete(jobId);
                return;
            }
        }
        logger.warn("Retry of job {} could not be recorded after {} attempts, concluding", jobId, MAX_UPDATE_ATTEMPTS);
        conclude(jobId, record.getFinishedAt());
    }

    /**
     * Ends the execution: applies a requested pause or cancel, completes one-off jobs and makes sure the next
     * regular occurrence lies after {@code finishedAt}.
     */
    private void conclude(UUID jobId, Instant finishedAt) {
        for (int i = 0; i < MAX_UPDATE_ATTEMPTS; i++) {
            Optional<Job> found = store.find(jobId);
            if (found.isEmpty()) {
                history.delete(jobId);
                return;
            }
            Job job = found.get();
            JobStatus requested = job.getRequestedStatus();
            Job.Builder builder = job.toBuilder().setExecutionInFlight(false).setRequestedStatus(null);
            if (requested == JobStatus.CANCELLED) {
                builder.setStatus(JobStatus.CANCELLED).setNextRunAt(null);
            } else if (job.getScheduleKind() == ScheduleKind.ONCE) {
                builder.setStatus(JobStatus.COMPLETED).setNextRunAt(null);
            } else {
                builder.setStatus(requested == JobStatus.PAUSED ? JobStatus.PAUSED : JobStatus.SCHEDULED);
                builder.setNextRunAt(nextRunAfterFinish(job, finishedAt));
            }
            try {
                Job concluded = store.update(builder.build());
                logger.debug("Job {} '{}' concluded as {}, next run at {}", jobId, job.getName(),
                        concluded.getStatus(), concluded.getNextRunAt());
                return;
            } catch (ConcurrentJobModificationException e) {
                logger.trace("conclusion of job {} lost a race, re-reading", jobId);
            } catch (JobNotFoundException e) {
                history.delete(jobId);
                return;
            }
        }
        logger.error("Job {} could not be concluded after {} attempts and stays in flight", jobId, MAX_UPDATE_ATTEMPTS);
    }

    private @Nullable Instant nextRunAfterFinish(Job job, Instant finishedAt) {
        Instant next = job.getNextRunAt();
        if (next != null && next.isAfter(finishedAt)) return next;
        try {
            return job.getSchedule().nextRunAfter(finishedAt, job.getTimezone());
        } catch (InvalidScheduleSpecException e) {
            logger.error("Job {} '{}' has no occurrence after {}, left without a next run", job.getId(), job.getName(),
                    finishedAt, e);
            return null;
        }
    }
}
