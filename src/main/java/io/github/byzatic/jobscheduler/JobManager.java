package io.github.byzatic.jobscheduler;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.dispatch.DispatchQueue;
import io.github.byzatic.jobscheduler.exceptions.ConcurrentJobModificationException;
import io.github.byzatic.jobscheduler.exceptions.IllegalJobStateException;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import io.github.byzatic.jobscheduler.exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobDefinition;
import io.github.byzatic.jobscheduler.model.JobFilter;
import io.github.byzatic.jobscheduler.model.JobPriority;
import io.github.byzatic.jobscheduler.model.JobStatus;
import io.github.byzatic.jobscheduler.model.ScheduleSpec;
import io.github.byzatic.jobscheduler.retry.RetryPolicy;
import io.github.byzatic.jobscheduler.scheduler.SchedulerLoop;
import io.github.byzatic.jobscheduler.store.HistoryStoreInterface;
import io.github.byzatic.jobscheduler.store.InMemoryHistoryStore;
import io.github.byzatic.jobscheduler.store.InMemoryJobStore;
import io.github.byzatic.jobscheduler.store.JobStoreInterface;
import io.github.byzatic.jobscheduler.worker.HandlerRegistryInterface;
import io.github.byzatic.jobscheduler.worker.JobLeases;
import io.github.byzatic.jobscheduler.worker.WorkerPool;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JobManager
 * - Cron, one-off and fixed-interval jobs behind one facade
 * - Priority-ordered dispatch to a bounded worker pool, at most one execution per job
 * - Per-attempt timeout with cooperative stop via CancellationToken
 * - Retries with exponential backoff and jitter
 * - Bounded execution history per job
 * - Event subscription (start/complete/error/timeout/cancelled/retry)
 */
@ThreadSafe
public final class JobManager implements JobManagerInterface {
    private final static Logger logger = LoggerFactory.getLogger(JobManager.class);

    private final SchedulerConfiguration configuration;
    private final JobStoreInterface store;
    private final HistoryStoreInterface history;
    private final HandlerRegistryInterface handlers;
    private final JobEventPublisher events;
    private final DispatchQueue queue;
    private final SchedulerLoop schedulerLoop;
    private final WorkerPool workerPool;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private JobManager(Builder builder) {
        this.configuration = builder.configuration;
        this.store = builder.jobStore != null
                ? builder.jobStore
                : new InMemoryJobStore(configuration.getClock(), configuration.getDefaultTimezone());
        this.history = builder.historyStore != null
                ? builder.historyStore
                : new InMemoryHistoryStore(configuration.getHistoryRetentionPerJob());
        this.handlers = Objects.requireNonNull(builder.handlers, "handlers");
        this.events = new JobEventPublisher(builder.listeners);
        this.queue = new DispatchQueue();
        this.schedulerLoop = new SchedulerLoop(store, history, queue, builder.retryPolicy, events, configuration);
        this.workerPool = new WorkerPool(queue, handlers, history, schedulerLoop, new JobLeases(),
                configuration.getClock(), configuration.getWorkerPoolSize(), configuration.getCancellationGrace(), events);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private SchedulerConfiguration configuration = SchedulerConfiguration.defaults();
        private JobStoreInterface jobStore;
        private HistoryStoreInterface historyStore;
        private HandlerRegistryInterface handlers;
        private RetryPolicy retryPolicy = new RetryPolicy();
        private boolean autoStart = true;
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        private Builder() {
        }

        public Builder configuration(SchedulerConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration);
            return this;
        }

        /**
         * Custom job store; by default an in-memory one.
         */
        public Builder jobStore(JobStoreInterface jobStore) {
            this.jobStore = Objects.requireNonNull(jobStore);
            return this;
        }

        /**
         * Custom history store; by default an in-memory one keeping {@code historyRetentionPerJob} records.
         */
        public Builder historyStore(HistoryStoreInterface historyStore) {
            this.historyStore = Objects.requireNonNull(historyStore);
            return this;
        }

        /**
         * Resolves {@code handlerRef}s to code, required. Usually a {@link io.github.byzatic.jobscheduler.worker.HandlerRegistry}.
         */
        public Builder handlers(HandlerRegistryInterface handlers) {
            this.handlers = Objects.requireNonNull(handlers);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy);
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        /**
         * Start the loop and the workers from {@link #build()} (default {@code true}).
         */
        public Builder autoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        public JobManager build() {
            JobManager manager = new JobManager(this);
            if (autoStart) manager.start();
            return manager;
        }
    }

    // ======== Lifecycle ========

    @Override
    public void start() {
        if (closed.get()) throw new IllegalStateException("Job manager is closed");
        if (!started.compareAndSet(false, true)) return;
        logger.info("Starting job manager: {}", configuration);
        workerPool.start();
        schedulerLoop.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        logger.info("Closing job manager");
        // сначала перестаём диспатчить, потом останавливаем воркеров
        schedulerLoop.close();
        workerPool.close();
        queue.clear();
        logger.info("Job manager closed");
    }

    // ======== Creation ========

    @Override
    public @NotNull Job scheduleCron(@NotNull String name, @NotNull String cronExpression, @Nullable ZoneId timezone,
                                     @NotNull JobPriority priority, int maxRetries, @NotNull Duration timeout,
                                     @NotNull String handlerRef) throws InvalidScheduleSpecException {
        return schedule(JobDefinition.newBuilder()
                .setName(name)
                .setSchedule(ScheduleSpec.cron(cronExpression))
                .setTimezone(timezone)
                .setPriority(priority)
                .setMaxRetries(maxRetries)
                .setTimeout(timeout)
                .setHandlerRef(handlerRef)
                .build());
    }

    @Override
    public @NotNull Job scheduleOnce(@NotNull String name, @NotNull Instant at, @NotNull JobPriority priority,
                                     int maxRetries, @NotNull Duration timeout, @NotNull String handlerRef)
            throws InvalidScheduleSpecException {
        return schedule(JobDefinition.newBuilder()
                .setName(name)
                .setSchedule(ScheduleSpec.once(at))
                .setPriority(priority)
                .setMaxRetries(maxRetries)
                .setTimeout(timeout)
                .setHandlerRef(handlerRef)
                .build());
    }

    @Override
    public @NotNull Job scheduleInterval(@NotNull String name, @NotNull Duration every, @NotNull JobPriority priority,
                                         int maxRetries, @NotNull Duration timeout, @NotNull String handlerRef)
            throws InvalidScheduleSpecException {
        return schedule(JobDefinition.newBuilder()
                .setName(name)
                .setSchedule(ScheduleSpec.interval(every))
                .setPriority(priority)
                .setMaxRetries(maxRetries)
                .setTimeout(timeout)
                .setHandlerRef(handlerRef)
                .build());
    }

    @Override
    public @NotNull Job schedule(@NotNull JobDefinition definition) throws InvalidScheduleSpecException {
        Objects.requireNonNull(definition, "definition");
        Job job = store.create(definition);
        logger.info("Job {} '{}' created: {} ({}), {} priority, handler '{}', next run at {}", job.getId(),
                job.getName(), job.getSchedule(), job.getTimezone(), job.getPriority(), job.getHandlerRef(),
                job.getNextRunAt());
        return job;
    }

    // ======== Control ========

    @Override
    public @NotNull Job pause(@NotNull UUID id)
            throws JobNotFoundException, IllegalJobStateException, ConcurrentJobModificationException {
        Job job = store.get(id);
        if (job.getStatus() == JobStatus.PAUSED || job.getRequestedStatus() == JobStatus.PAUSED) {
            return job;
        }
        if (job.getStatus().isTerminal()) {
            throw new IllegalJobStateException("Job " + id + " is " + job.getStatus() + " and cannot be paused");
        }
        if (job.getRequestedStatus() == JobStatus.CANCELLED) {
            throw new IllegalJobStateException("Job " + id + " is being cancelled and cannot be paused");
        }
        Job paused;
        if (job.isExecutionInFlight()) {
            paused = store.update(job.toBuilder().setRequestedStatus(JobStatus.PAUSED).build());
            logger.info("Job {} '{}' will be paused when its current execution concludes", id, job.getName());
        } else {
            paused = store.updateStatus(id, job.getVersion(), JobStatus.PAUSED);
            logger.info("Job {} '{}' paused", id, job.getName());
        }
        return paused;
    }

    @Override
    public @NotNull Job resume(@NotNull UUID id)
            throws JobNotFoundException, IllegalJobStateException, ConcurrentJobModificationException,
            InvalidScheduleSpecException {
        Job job = store.get(id);
        if (job.getStatus().isTerminal()) {
            throw new IllegalJobStateException("Job " + id + " is " + job.getStatus() + " and cannot be resumed");
        }
        if (job.getRequestedStatus() == JobStatus.CANCELLED) {
            throw new IllegalJobStateException("Job " + id + " is being cancelled and cannot be resumed");
        }
        if (job.getRequestedStatus() == JobStatus.PAUSED) {
            // пауза ещё не применилась: просто снимаем запрос
            logger.info("Job {} '{}' pending pause withdrawn", id, job.getName());
            return store.update(job.toBuilder().setRequestedStatus(null).build());
        }
        if (job.getStatus() != JobStatus.PAUSED) {
            return job;
        }
        Instant now = configuration.getClock().instant();
        Instant next = job.getSchedule().resumeRunAt(now, job.getTimezone());
        Job resumed = store.update(job.toBuilder().setStatus(JobStatus.SCHEDULED).setNextRunAt(next).build());
        logger.info("Job {} '{}' resumed, next run at {}", id, job.getName(), next);
        return resumed;
    }

    @Override
    public @NotNull Job cancel(@NotNull UUID id)
            throws JobNotFoundException, IllegalJobStateException, ConcurrentJobModificationException {
        Job job = store.get(id);
        if (job.getStatus() == JobStatus.CANCELLED || job.getRequestedStatus() == JobStatus.CANCELLED) {
            return job;
        }
        if (job.getStatus() == JobStatus.COMPLETED) {
            throw new IllegalJobStateException("Job " + id + " is already completed");
        }
        if (!job.isExecutionInFlight()) {
            Job cancelled = store.updateStatus(id, job.getVersion(), JobStatus.CANCELLED);
            logger.info("Job {} '{}' cancelled", id, job.getName());
            return cancelled;
        }
        Job cancelling = store.update(job.toBuilder().setRequestedStatus(JobStatus.CANCELLED).build());
        boolean wasRunning = workerPool.requestStop(id, "Job cancelled");
        logger.info("Job {} '{}' will be cancelled when its current execution concludes{}", id, job.getName(),
                wasRunning ? ", stop requested" : "");
        return cancelling;
    }

    @Override
    public void delete(@NotNull UUID id) throws JobNotFoundException {
        Job job = store.get(id);
        store.delete(id);
        history.delete(id);
        logger.info("Job {} '{}' deleted", id, job.getName());
    }

    @Override
    public @NotNull Job reschedule(@NotNull UUID id, @NotNull ScheduleSpec schedule, @Nullable ZoneId timezone)
            throws JobNotFoundException, InvalidScheduleSpecException, IllegalJobStateException,
            ConcurrentJobModificationException {
        Job job = store.get(id);
        if (job.getStatus().isTerminal()) {
            throw new IllegalJobStateException("Job " + id + " is " + job.getStatus() + " and cannot be rescheduled");
        }
        Job rescheduled = store.updateSchedule(id, job.getVersion(), schedule, timezone);
        logger.info("Job {} '{}' rescheduled: {} ({}), next run at {}", id, job.getName(), rescheduled.getSchedule(),
                rescheduled.getTimezone(), rescheduled.getNextRunAt());
        return rescheduled;
    }

    @Override
    public @NotNull Job rename(@NotNull UUID id, @NotNull String name)
            throws JobNotFoundException, ConcurrentJobModificationException {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        Job job = store.get(id);
        if (job.getName().equals(name)) return job;
        return store.update(job.toBuilder().setName(name).build());
    }

    // ======== Queries ========

    @Override
    public @NotNull Job get(@NotNull UUID id) throws JobNotFoundException {
        return store.get(id);
    }

    @Override
    public @NotNull List<Job> list(@NotNull JobFilter filter) {
        return store.list(Objects.requireNonNull(filter, "filter"));
    }

    @Override
    public @NotNull List<ExecutionRecord> getHistory(@NotNull UUID id, int limit) throws JobNotFoundException {
        store.get(id);
        return history.recent(id, limit);
    }

    @Override
    public @NotNull SchedulerStats stats() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        int inFlight = 0;
        for (Job job : store.list(JobFilter.all())) {
            counts.merge(job.getStatus(), 1, Integer::sum);
            if (job.isExecutionInFlight()) inFlight++;
        }
        return new SchedulerStats(counts, queue.size(), schedulerLoop.pendingRetryCount(), inFlight,
                workerPool.runningCount(), workerPool.busyWorkers(), workerPool.getSize());
    }

    @Override
    public void addListener(@NotNull JobEventListener l) {
        events.addListener(l);
    }

    @Override
    public void removeListener(@NotNull JobEventListener l) {
        events.removeListener(l);
    }

    public @NotNull SchedulerConfiguration getConfiguration() {
        return configuration;
    }

    @VisibleForTesting
    SchedulerLoop schedulerLoop() {
        return schedulerLoop;
    }

    @VisibleForTesting
    WorkerPool workerPool() {
        return workerPool;
    }
}
