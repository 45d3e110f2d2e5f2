package io.github.byzatic.jobscheduler.worker;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.JobEventPublisher;
import io.github.byzatic.jobscheduler.dispatch.DispatchItem;
import io.github.byzatic.jobscheduler.dispatch.DispatchQueue;
import io.github.byzatic.jobscheduler.exceptions.ExecutionTimeoutException;
import io.github.byzatic.jobscheduler.model.ExecutionOutcome;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.store.HistoryStoreInterface;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads draining the {@link DispatchQueue}.
 * <ul>
 *     <li>at most one attempt per job at any time (non-blocking {@link JobLeases})</li>
 *     <li>every attempt is bounded by the job's timeout; on expiry the token is raised, the handler thread
 *     interrupted and, after the cancellation grace, the lease released anyway</li>
 *     <li>every attempt that ran produces exactly one {@link ExecutionRecord}</li>
 * </ul>
 * Handler code runs on a separate cached executor so a worker can give up on a handler that ignores its token.
 */
@ThreadSafe
public final class WorkerPool implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long TAKE_POLL_MILLIS = 100;

    private final DispatchQueue queue;
    private final HandlerRegistryInterface handlers;
    private final HistoryStoreInterface history;
    private final ExecutionLifecycle lifecycle;
    private final JobLeases leases;
    private final Clock clock;
    private final int size;
    private final long graceMillis;
    private final JobEventPublisher events;

    private final ExecutorService workerExecutor;
    private final ExecutorService handlerExecutor;
    private final Map<UUID, Execution> running = new ConcurrentHashMap<>();
    private final AtomicInteger busyWorkers = new AtomicInteger();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closing = new AtomicBoolean(false);

    public WorkerPool(@NotNull DispatchQueue queue,
                      @NotNull HandlerRegistryInterface handlers,
                      @NotNull HistoryStoreInterface history,
                      @NotNull ExecutionLifecycle lifecycle,
                      @NotNull JobLeases leases,
                      @NotNull Clock clock,
                      int size,
                      @NotNull Duration cancellationGrace,
                      @NotNull JobEventPublisher events) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.history = Objects.requireNonNull(history, "history");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.leases = Objects.requireNonNull(leases, "leases");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.size = size;
        this.graceMillis = Objects.requireNonNull(cancellationGrace, "cancellationGrace").toMillis();
        this.events = Objects.requireNonNull(events, "events");

        this.workerExecutor = Executors.newFixedThreadPool(size, new ThreadFactoryBuilder()
                .setNameFormat("job-worker-%d")
                .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                .build());
        // хендлеры, игнорирующие interrupt, не должны держать JVM
        this.handlerExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("job-handler-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                .build());
    }

    public void start() {
        if (closing.get()) throw new IllegalStateException("Worker pool is closed");
        if (!started.compareAndSet(false, true)) return;
        for (int i = 0; i < size; i++) {
            workerExecutor.execute(this::workLoop);
        }
        logger.info("Worker pool started with {} worker(s)", size);
    }

    /**
     * Raises the stop flag of the job's running attempt, if any.
     *
     * @return {@code true} if an attempt of the job was running
     */
    public boolean requestStop(@NotNull UUID jobId, @NotNull String reason) {
        Execution execution = running.get(jobId);
        if (execution == null) return false;
        stop(execution, reason);
        return true;
    }

    public boolean isRunning(@NotNull UUID jobId) {
        return running.containsKey(jobId);
    }

    /**
     * Attempts whose handler is currently executing.
     */
    public int runningCount() {
        return running.size();
    }

    /**
     * Workers busy with an attempt, including the bookkeeping around the handler call.
     */
    public int busyWorkers() {
        return busyWorkers.get();
    }

    public int getSize() {
        return size;
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) return;
        logger.info("Worker pool closing, {} attempt(s) running", running.size());
        for (Execution execution : running.values()) {
            stop(execution, "Worker pool closing");
        }
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(graceMillis + TAKE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                // воркеры, ждущие хендлер, получат interrupt и запишут cancelled
                workerExecutor.shutdownNow();
                if (!workerExecutor.awaitTermination(graceMillis + TAKE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    logger.warn("Worker threads did not terminate within {} ms", graceMillis);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        }
        handlerExecutor.shutdownNow();
        logger.info("Worker pool closed");
    }

    // ======== Internal ========

    private void workLoop() {
        while (!closing.get()) {
            DispatchItem item;
            try {
                item = queue.poll(TAKE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                break;
            }
            if (item == null) continue;
            try {
                process(item);
            } catch (Throwable t) {
                logger.error("Worker failed to process {}", item, t);
            }
        }
    }

    /**
     * Runs one dispatched attempt on the calling thread: lease, claim, execute, record, release, complete.
     */
    @VisibleForTesting
    void process(@NotNull DispatchItem item) {
        UUID jobId = item.getJobId();
        if (!leases.tryAcquire(jobId)) {
            logger.debug("Job {} already holds a lease, dropping {}", jobId, item);
            return;
        }
        ExecutionRecord record = null;
        busyWorkers.incrementAndGet();
        try {
            Job job = lifecycle.claim(item);
            if (job == null) {
                logger.debug("Attempt {} of job {} not claimed, dropped", item.getAttempt(), jobId);
                return;
            }
            Instant startedAt = clock.instant();
            try {
                record = execute(job, item);
            } catch (RuntimeException e) {
                // сломался registry или listener: попытка всё равно должна завершиться
                logger.error("Job {} '{}' attempt {} failed inside the worker", jobId, job.getName(),
                        item.getAttempt(), e);
                record = record(job, item.getAttempt(), startedAt, ExecutionOutcome.FAILURE, String.valueOf(e));
                events.fire(l -> l.onError(jobId, e));
            }
            try {
                history.append(record);
            } catch (RuntimeException e) {
                logger.error("History store rejected {}, outcome still applied to job {}", record, jobId, e);
            }
        } finally {
            leases.release(jobId);
            busyWorkers.decrementAndGet();
        }
        lifecycle.complete(item, record);
    }

    private ExecutionRecord execute(Job job, DispatchItem item) {
        UUID jobId = job.getId();
        int attempt = item.getAttempt();
        Instant startedAt = clock.instant();
        events.fire(l -> l.onStart(jobId, attempt));

        Optional<JobHandler> resolved = handlers.resolve(job.getHandlerRef());
        if (resolved.isEmpty()) {
            String detail = "No handler registered for '" + job.getHandlerRef() + "'";
            logger.error("Job {} '{}': {}", jobId, job.getName(), detail);
            IllegalStateException error = new IllegalStateException(detail);
            events.fire(l -> l.onError(jobId, error));
            return record(job, attempt, startedAt, ExecutionOutcome.FAILURE, detail);
        }

        JobHandler handler = resolved.get();
        CancellationToken token = new CancellationToken();
        ExecutionContext context = new ExecutionContext(jobId, job.getName(), job.getHandlerRef(), attempt,
                item.getScheduledFor(), job.getTimeout());
        CountDownLatch exited = new CountDownLatch(1);
        Execution execution = new Execution(handler, token);
        running.put(jobId, execution);
        try {
            Future<?> future;
            try {
                future = handlerExecutor.submit(() -> {
                    try {
                        handler.run(context, token);
                        return null;
                    } finally {
                        exited.countDown();
                    }
                });
            } catch (RejectedExecutionException ree) {
                return record(job, attempt, startedAt, ExecutionOutcome.CANCELLED, "Worker pool closing");
            }
            logger.debug("Job {} '{}' attempt {} started", jobId, job.getName(), attempt);

            try {
                future.get(job.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (token.isStopRequested()) {
                    events.fire(l -> l.onCancelled(jobId));
                    return record(job, attempt, startedAt, ExecutionOutcome.CANCELLED, "Stopped: " + token.reason());
                }
                events.fire(l -> l.onComplete(jobId));
                return record(job, attempt, startedAt, ExecutionOutcome.SUCCESS, null);

            } catch (TimeoutException te) {
                ExecutionTimeoutException timeout = new ExecutionTimeoutException(
                        "Attempt " + attempt + " of job " + jobId + " exceeded its timeout of " + job.getTimeout());
                stop(execution, "Timeout");
                future.cancel(true);
                awaitExit(exited, jobId);
                logger.warn("Job {} '{}': {}", jobId, job.getName(), timeout.getMessage());
                events.fire(l -> l.onTimeout(jobId));
                return record(job, attempt, startedAt, ExecutionOutcome.TIMEOUT, timeout.getMessage());

            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (token.isStopRequested()
                        && (cause instanceof InterruptedException || cause instanceof CancellationException)) {
                    events.fire(l -> l.onCancelled(jobId));
                    return record(job, attempt, startedAt, ExecutionOutcome.CANCELLED, "Stopped: " + token.reason());
                }
                logger.warn("Job {} '{}' attempt {} failed: {}", jobId, job.getName(), attempt, String.valueOf(cause));
                events.fire(l -> l.onError(jobId, cause));
                return record(job, attempt, startedAt, ExecutionOutcome.FAILURE, String.valueOf(cause));

            } catch (CancellationException ce) {
                events.fire(l -> l.onCancelled(jobId));
                return record(job, attempt, startedAt, ExecutionOutcome.CANCELLED, "Stopped: " + token.reason());

            } catch (InterruptedException ie) {
                // пул закрывается: просим хендлер остановиться и ждём grace
                stop(execution, "Worker pool closing");
                future.cancel(true);
                awaitExit(exited, jobId);
                Thread.currentThread().interrupt();
                events.fire(l -> l.onCancelled(jobId));
                return record(job, attempt, startedAt, ExecutionOutcome.CANCELLED, "Stopped: " + token.reason());
            }
        } finally {
            running.remove(jobId, execution);
        }
    }

    private void stop(Execution execution, String reason) {
        if (!execution.token.requestStop(reason)) return;
        try {
            execution.handler.onStopRequested();
        } catch (RuntimeException e) {
            logger.warn("onStopRequested failed", e);
        }
    }

    private void awaitExit(CountDownLatch exited, UUID jobId) {
        try {
            if (!exited.await(graceMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Handler of job {} did not exit within {} ms of its stop request, lease released anyway",
                        jobId, graceMillis);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionRecord record(Job job, int attempt, Instant startedAt, ExecutionOutcome outcome, @Nullable String detail) {
        Instant finishedAt = clock.instant();
        if (finishedAt.isBefore(startedAt)) finishedAt = startedAt;
        return new ExecutionRecord(job.getId(), attempt, startedAt, finishedAt, outcome, detail);
    }

    private static final class Execution {
        final JobHandler handler;
        final CancellationToken token;

        Execution(JobHandler handler, CancellationToken token) {
            this.handler = handler;
            this.token = token;
        }
    }
}
