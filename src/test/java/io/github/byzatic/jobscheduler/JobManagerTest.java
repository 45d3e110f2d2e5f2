package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.exceptions.IllegalJobStateException;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import io.github.byzatic.jobscheduler.exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.model.ExecutionOutcome;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobDefinition;
import io.github.byzatic.jobscheduler.model.JobFilter;
import io.github.byzatic.jobscheduler.model.JobPriority;
import io.github.byzatic.jobscheduler.model.JobStatus;
import io.github.byzatic.jobscheduler.model.ScheduleSpec;
import io.github.byzatic.jobscheduler.retry.RetryPolicy;
import io.github.byzatic.jobscheduler.store.InMemoryJobStore;
import io.github.byzatic.jobscheduler.worker.HandlerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class JobManagerTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    final HandlerRegistry handlers = new HandlerRegistry();
    JobManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) manager.close();
    }

    private static SchedulerConfiguration.Builder fastConfig() {
        return SchedulerConfiguration.newBuilder()
                .pollInterval(Duration.ofMillis(20))
                .workerPoolSize(4)
                .defaultTimezone(ZoneOffset.UTC)
                .defaultBaseRetryDelay(Duration.ofMillis(20))
                .defaultMaxRetryDelay(Duration.ofMillis(50))
                .cancellationGrace(Duration.ofMillis(500));
    }

    private Job awaitJob(UUID id, Predicate<Job> condition) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        Job job = manager.get(id);
        while (!condition.test(job)) {
            if (System.nanoTime() > deadline) fail("condition not reached, last state: " + job);
            Thread.sleep(10);
            job = manager.get(id);
        }
        return job;
    }

    private static Instant soon() {
        return Instant.now().plusMillis(100);
    }

    @Test
    void onceJobRunsExactlyOnceAndCompletes() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch completed = new CountDownLatch(1);
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().build())
                .addListener(new JobEventListener() {
                    @Override
                    public void onComplete(UUID jobId) {
                        completed.countDown();
                    }
                })
                .build();
        handlers.register("count", (ctx, token) -> runs.incrementAndGet());

        Job job = manager.scheduleOnce("once", soon(), JobPriority.NORMAL, 0, TIMEOUT, "count");
        assertEquals(JobStatus.SCHEDULED, job.getStatus());

        assertTrue(completed.await(3, TimeUnit.SECONDS));
        Job done = awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);
        assertNull(done.getNextRunAt());
        assertFalse(done.isExecutionInFlight());

        Thread.sleep(200);
        assertEquals(1, runs.get());
        List<ExecutionRecord> history = manager.getHistory(job.getId(), 10);
        assertEquals(1, history.size());
        assertEquals(ExecutionOutcome.SUCCESS, history.get(0).getOutcome());
        assertNull(history.get(0).getErrorDetail());
    }

    @Test
    void intervalJobRepeatsAndHistoryIsNewestFirst() throws Exception {
        CountDownLatch threeRuns = new CountDownLatch(3);
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        handlers.register("tick", (ctx, token) -> threeRuns.countDown());

        Job job = manager.scheduleInterval("every-100ms", Duration.ofMillis(100), JobPriority.LOW, 0, TIMEOUT, "tick");
        assertTrue(threeRuns.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> !j.isExecutionInFlight() && j.getStatus() == JobStatus.SCHEDULED);

        List<ExecutionRecord> history = manager.getHistory(job.getId(), 10);
        assertTrue(history.size() >= 3);
        for (int i = 1; i < history.size(); i++) {
            assertFalse(history.get(i).getStartedAt().isAfter(history.get(i - 1).getStartedAt()));
        }
        assertEquals(2, manager.getHistory(job.getId(), 2).size());
    }

    @Test
    void failingJobIsRetriedThenGivenUp() throws Exception {
        CountDownLatch exhausted = new CountDownLatch(1);
        List<Integer> retriesAnnounced = new CopyOnWriteArrayList<>();
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().build())
                .retryPolicy(new RetryPolicy(() -> 0.5))
                .addListener(new JobEventListener() {
                    @Override
                    public void onRetryScheduled(UUID jobId, int nextAttempt, Duration delay) {
                        retriesAnnounced.add(nextAttempt);
                    }

                    @Override
                    public void onRetriesExhausted(UUID jobId, ExecutionRecord lastRecord) {
                        exhausted.countDown();
                    }
                })
                .build();
        List<Integer> attemptsSeen = new CopyOnWriteArrayList<>();
        handlers.register("flaky", (ctx, token) -> {
            attemptsSeen.add(ctx.getAttempt());
            throw new IllegalStateException("boom " + ctx.getAttempt());
        });

        Job job = manager.scheduleOnce("flaky", soon(), JobPriority.HIGH, 2, TIMEOUT, "flaky");
        assertTrue(exhausted.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);

        assertEquals(List.of(1, 2, 3), attemptsSeen);
        assertEquals(List.of(2, 3), retriesAnnounced);
        List<ExecutionRecord> history = manager.getHistory(job.getId(), 10);
        assertEquals(3, history.size());
        assertEquals(3, history.get(0).getAttempt());
        assertEquals(1, history.get(2).getAttempt());
        for (ExecutionRecord r : history) {
            assertEquals(ExecutionOutcome.FAILURE, r.getOutcome());
            assertTrue(r.getErrorDetail().contains("boom"), r.getErrorDetail());
        }
    }

    @Test
    void missingHandlerIsAFailure() throws Exception {
        CountDownLatch errored = new CountDownLatch(1);
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().build())
                .addListener(new JobEventListener() {
                    @Override
                    public void onError(UUID jobId, Throwable error) {
                        errored.countDown();
                    }
                })
                .build();

        Job job = manager.scheduleOnce("orphan", soon(), JobPriority.NORMAL, 0, TIMEOUT, "nobody-home");
        assertTrue(errored.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);

        ExecutionRecord record = manager.getHistory(job.getId(), 1).get(0);
        assertEquals(ExecutionOutcome.FAILURE, record.getOutcome());
        assertTrue(record.getErrorDetail().contains("nobody-home"));
    }

    @Test
    void slowHandlerTimesOut() throws Exception {
        CountDownLatch timedOut = new CountDownLatch(1);
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().build())
                .addListener(new JobEventListener() {
                    @Override
                    public void onTimeout(UUID jobId) {
                        timedOut.countDown();
                    }
                })
                .build();
        handlers.register("slow", (ctx, token) -> Thread.sleep(5_000));

        Job job = manager.scheduleOnce("slow", soon(), JobPriority.NORMAL, 0, Duration.ofMillis(100), "slow");
        assertTrue(timedOut.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);
        assertEquals(ExecutionOutcome.TIMEOUT, manager.getHistory(job.getId(), 1).get(0).getOutcome());
    }

    @Test
    void pauseResumeCancelOnIdleJob() throws Exception {
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        Job job = manager.scheduleInterval("hourly", Duration.ofHours(1), JobPriority.NORMAL, 0, TIMEOUT, "h");

        Job paused = manager.pause(job.getId());
        assertEquals(JobStatus.PAUSED, paused.getStatus());
        assertEquals(job.getVersion() + 1, paused.getVersion());
        assertEquals(paused.getVersion(), manager.pause(job.getId()).getVersion(), "pause is idempotent");

        Job resumed = manager.resume(job.getId());
        assertEquals(JobStatus.SCHEDULED, resumed.getStatus());
        assertTrue(resumed.getNextRunAt().isAfter(Instant.now().plus(Duration.ofMinutes(59))));
        assertEquals(resumed.getVersion(), manager.resume(job.getId()).getVersion(), "resume is idempotent");

        Job cancelled = manager.cancel(job.getId());
        assertEquals(JobStatus.CANCELLED, cancelled.getStatus());
        assertNull(cancelled.getNextRunAt());
        assertEquals(cancelled.getVersion(), manager.cancel(job.getId()).getVersion());

        assertThrows(IllegalJobStateException.class, () -> manager.pause(job.getId()));
        assertThrows(IllegalJobStateException.class, () -> manager.resume(job.getId()));
        assertThrows(IllegalJobStateException.class,
                () -> manager.reschedule(job.getId(), ScheduleSpec.interval(Duration.ofHours(2)), null));
    }

    @Test
    void completedJobCannotBeCancelledOrResumed() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        handlers.register("noop", (ctx, token) -> completed.countDown());
        Job job = manager.scheduleOnce("once", soon(), JobPriority.NORMAL, 0, TIMEOUT, "noop");
        assertTrue(completed.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);

        assertThrows(IllegalJobStateException.class, () -> manager.cancel(job.getId()));
        assertThrows(IllegalJobStateException.class, () -> manager.resume(job.getId()));
        assertThrows(IllegalJobStateException.class, () -> manager.pause(job.getId()));
    }

    @Test
    void pausedOnceJobPastItsInstantRunsOnResume() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        handlers.register("late", (ctx, token) -> ran.countDown());

        Job job = manager.scheduleOnce("late", Instant.now().plusMillis(150), JobPriority.NORMAL, 0, TIMEOUT, "late");
        manager.pause(job.getId());
        Thread.sleep(300);
        assertEquals(1, ran.getCount(), "paused job must not run");

        manager.resume(job.getId());
        assertTrue(ran.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);
    }

    @Test
    void pauseWhileRunningTakesEffectAfterExecution() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        handlers.register("blocking", (ctx, token) -> {
            started.countDown();
            release.await();
        });

        Job job = manager.scheduleInterval("blocking", Duration.ofMillis(100), JobPriority.NORMAL, 0, TIMEOUT, "blocking");
        assertTrue(started.await(3, TimeUnit.SECONDS));

        Job pending = manager.pause(job.getId());
        assertEquals(JobStatus.RUNNING, pending.getStatus());
        assertEquals(JobStatus.PAUSED, pending.getRequestedStatus());

        release.countDown();
        Job paused = awaitJob(job.getId(), j -> j.getStatus() == JobStatus.PAUSED);
        assertNull(paused.getRequestedStatus());
        assertNotNull(paused.getNextRunAt());
        assertEquals(ExecutionOutcome.SUCCESS, manager.getHistory(job.getId(), 1).get(0).getOutcome());
    }

    @Test
    void cancelWhileRunningStopsHandler() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch cancelledEvent = new CountDownLatch(1);
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().build())
                .addListener(new JobEventListener() {
                    @Override
                    public void onCancelled(UUID jobId) {
                        cancelledEvent.countDown();
                    }
                })
                .build();
        handlers.register("cooperative", (ctx, token) -> {
            started.countDown();
            long end = System.currentTimeMillis() + 5_000;
            while (System.currentTimeMillis() < end) {
                if (token.isStopRequested()) return;
                Thread.sleep(10);
            }
        });

        Job job = manager.scheduleInterval("long", Duration.ofMillis(100), JobPriority.NORMAL, 3, TIMEOUT, "cooperative");
        assertTrue(started.await(3, TimeUnit.SECONDS));

        Job cancelling = manager.cancel(job.getId());
        assertEquals(JobStatus.CANCELLED, cancelling.getRequestedStatus());
        assertTrue(cancelledEvent.await(3, TimeUnit.SECONDS));

        Job cancelled = awaitJob(job.getId(), j -> j.getStatus() == JobStatus.CANCELLED);
        assertNull(cancelled.getNextRunAt());
        assertFalse(cancelled.isExecutionInFlight());
        ExecutionRecord last = manager.getHistory(job.getId(), 1).get(0);
        assertEquals(ExecutionOutcome.CANCELLED, last.getOutcome());
        assertTrue(last.getErrorDetail().contains("Job cancelled"));
    }

    @Test
    void deleteRemovesJobAndHistory() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        handlers.register("noop", (ctx, token) -> completed.countDown());
        Job job = manager.scheduleOnce("once", soon(), JobPriority.NORMAL, 0, TIMEOUT, "noop");
        assertTrue(completed.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);
        assertEquals(1, manager.getHistory(job.getId(), 10).size());

        manager.delete(job.getId());
        assertThrows(JobNotFoundException.class, () -> manager.get(job.getId()));
        assertThrows(JobNotFoundException.class, () -> manager.getHistory(job.getId(), 10));
        assertThrows(JobNotFoundException.class, () -> manager.delete(job.getId()));
        assertTrue(manager.list(JobFilter.all()).isEmpty());
    }

    @Test
    void rescheduleAndRename() throws Exception {
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).autoStart(false).build();
        Job job = manager.scheduleCron("nightly", "0 2 * * *", null, JobPriority.NORMAL, 0, TIMEOUT, "h");
        assertEquals(ZoneOffset.UTC, job.getTimezone());

        Job moved = manager.reschedule(job.getId(), ScheduleSpec.cron("30 3 * * *"), null);
        assertEquals(3, moved.getNextRunAt().atZone(ZoneOffset.UTC).getHour());
        assertEquals(30, moved.getNextRunAt().atZone(ZoneOffset.UTC).getMinute());

        assertThrows(InvalidScheduleSpecException.class,
                () -> manager.reschedule(job.getId(), ScheduleSpec.interval(Duration.ofHours(1)), null));
        assertThrows(InvalidScheduleSpecException.class,
                () -> manager.reschedule(job.getId(), ScheduleSpec.cron("61 * * * *"), null));

        Job renamed = manager.rename(job.getId(), "nightly-report");
        assertEquals("nightly-report", renamed.getName());
        assertEquals(renamed.getVersion(), manager.rename(job.getId(), "nightly-report").getVersion());
        assertThrows(IllegalArgumentException.class, () -> manager.rename(job.getId(), "  "));
    }

    @Test
    void invalidDefinitionsAreRejected() {
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).autoStart(false).build();
        assertThrows(InvalidScheduleSpecException.class,
                () -> manager.scheduleOnce("past", Instant.now().minusSeconds(1), JobPriority.NORMAL, 0, TIMEOUT, "h"));
        assertThrows(InvalidScheduleSpecException.class,
                () -> manager.scheduleCron("bad", "* * *", null, JobPriority.NORMAL, 0, TIMEOUT, "h"));
        assertThrows(IllegalArgumentException.class,
                () -> manager.scheduleInterval("retries", Duration.ofMinutes(1), JobPriority.NORMAL, -1, TIMEOUT, "h"));
        assertTrue(manager.list(JobFilter.all()).isEmpty());
    }

    @Test
    void statsCountJobsByStatus() throws Exception {
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().workerPoolSize(3).build())
                .autoStart(false)
                .build();
        Job a = manager.scheduleInterval("a", Duration.ofHours(1), JobPriority.NORMAL, 0, TIMEOUT, "h");
        manager.scheduleInterval("b", Duration.ofHours(1), JobPriority.NORMAL, 0, TIMEOUT, "h");
        manager.schedule(JobDefinition.newBuilder()
                .setName("c")
                .setSchedule(ScheduleSpec.cron("0 0 1 1 *"))
                .setHandlerRef("h")
                .build());
        manager.pause(a.getId());

        SchedulerStats stats = manager.stats();
        assertEquals(3, stats.getTotalJobs());
        assertEquals(2, stats.getJobCount(JobStatus.SCHEDULED));
        assertEquals(1, stats.getJobCount(JobStatus.PAUSED));
        assertEquals(0, stats.getJobCount(JobStatus.RUNNING));
        assertEquals(0, stats.getQueueDepth());
        assertEquals(0, stats.getPendingRetries());
        assertEquals(0, stats.getExecutionsInFlight());
        assertEquals(3, stats.getWorkerPoolSize());
        assertEquals(JobStatus.values().length, stats.getJobsByStatus().size());
    }

    @Test
    void criticalRunsBeforeLowWhenBothAreDue() throws Exception {
        Instant t0 = Instant.parse("2026-03-01T12:00:00Z");
        MutableClock clock = new MutableClock(t0);
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch both = new CountDownLatch(2);
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().workerPoolSize(1).clock(clock).build())
                .autoStart(false)
                .build();
        handlers.register("record", (ctx, token) -> {
            order.add(ctx.getJobName());
            both.countDown();
        });

        manager.scheduleOnce("low", t0.plusSeconds(1), JobPriority.LOW, 0, TIMEOUT, "record");
        manager.scheduleOnce("critical", t0.plusSeconds(2), JobPriority.CRITICAL, 0, TIMEOUT, "record");
        clock.advance(Duration.ofSeconds(5));
        manager.schedulerLoop().tick();
        assertEquals(2, manager.stats().getQueueDepth());

        manager.workerPool().start();
        assertTrue(both.await(3, TimeUnit.SECONDS));
        assertEquals(List.of("critical", "low"), order);
    }

    @Test
    void failingListenerDoesNotBreakScheduling() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        manager = JobManager.newBuilder()
                .handlers(handlers).configuration(fastConfig().build())
                .addListener(new JobEventListener() {
                    @Override
                    public void onStart(UUID jobId, int attempt) {
                        throw new IllegalStateException("listener bug");
                    }
                })
                .addListener(new JobEventListener() {
                    @Override
                    public void onComplete(UUID jobId) {
                        completed.countDown();
                    }
                })
                .build();
        handlers.register("noop", (ctx, token) -> {
        });
        Job job = manager.scheduleOnce("once", soon(), JobPriority.NORMAL, 0, TIMEOUT, "noop");
        assertTrue(completed.await(3, TimeUnit.SECONDS));
        awaitJob(job.getId(), j -> j.getStatus() == JobStatus.COMPLETED);
    }

    @Test
    void executionLeftInFlightOnSharedStoreRunsAfterRestart() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore(Clock.systemUTC(), ZoneOffset.UTC);
        Job stale = store.create(JobDefinition.newBuilder()
                .setName("interrupted")
                .setSchedule(ScheduleSpec.once(soon()))
                .setHandlerRef("count")
                .build());
        store.update(stale.toBuilder().setStatus(JobStatus.RUNNING).setExecutionInFlight(true).build());

        AtomicInteger runs = new AtomicInteger();
        handlers.register("count", (ctx, token) -> runs.incrementAndGet());
        manager = JobManager.newBuilder().handlers(handlers).jobStore(store).configuration(fastConfig().build()).build();

        Job done = awaitJob(stale.getId(), j -> j.getStatus() == JobStatus.COMPLETED);
        assertFalse(done.isExecutionInFlight());
        assertEquals(1, runs.get());
        assertEquals(1, manager.getHistory(stale.getId(), 10).size());
    }

    @Test
    void closedManagerCannotRestart() {
        manager = JobManager.newBuilder().handlers(handlers).configuration(fastConfig().build()).build();
        manager.close();
        manager.close();
        assertThrows(IllegalStateException.class, () -> manager.start());
    }
}
