package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.exceptions.ConcurrentJobModificationException;
import io.github.byzatic.jobscheduler.exceptions.IllegalJobStateException;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import io.github.byzatic.jobscheduler.exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobDefinition;
import io.github.byzatic.jobscheduler.model.JobFilter;
import io.github.byzatic.jobscheduler.model.JobPriority;
import io.github.byzatic.jobscheduler.model.ScheduleSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Entry point of the scheduling core: create, control and query jobs.
 * <p>
 * Structural errors are thrown synchronously; execution errors never are, they end up in the history.
 * Mutations are version-checked: a {@link ConcurrentJobModificationException} means the job changed
 * concurrently and the caller should re-read it and retry.
 */
public interface JobManagerInterface extends AutoCloseable {

    /**
     * @param timezone zone the expression is evaluated in, {@code null} for the configured default
     */
    @NotNull Job scheduleCron(@NotNull String name, @NotNull String cronExpression, @Nullable ZoneId timezone,
                              @NotNull JobPriority priority, int maxRetries, @NotNull Duration timeout,
                              @NotNull String handlerRef) throws InvalidScheduleSpecException;

    @NotNull Job scheduleOnce(@NotNull String name, @NotNull Instant at, @NotNull JobPriority priority, int maxRetries,
                              @NotNull Duration timeout, @NotNull String handlerRef) throws InvalidScheduleSpecException;

    @NotNull Job scheduleInterval(@NotNull String name, @NotNull Duration every, @NotNull JobPriority priority,
                                  int maxRetries, @NotNull Duration timeout, @NotNull String handlerRef)
            throws InvalidScheduleSpecException;

    /**
     * Creates a job from a full definition, including per-job retry delays.
     */
    @NotNull Job schedule(@NotNull JobDefinition definition) throws InvalidScheduleSpecException;

    /**
     * Stops regular dispatching. Pausing a paused job is a no-op. A job in flight is paused once its execution
     * concludes.
     *
     * @throws IllegalJobStateException the job is completed or cancelled
     */
    @NotNull Job pause(@NotNull UUID id)
            throws JobNotFoundException, IllegalJobStateException, ConcurrentJobModificationException;

    /**
     * Re-enables dispatching with {@code nextRunAt} recomputed from now. Resuming a scheduled job is a no-op.
     *
     * @throws IllegalJobStateException the job is completed or cancelled, or a cancel is pending
     */
    @NotNull Job resume(@NotNull UUID id)
            throws JobNotFoundException, IllegalJobStateException, ConcurrentJobModificationException,
            InvalidScheduleSpecException;

    /**
     * Cancels the job for good. A running attempt is asked to stop and the job becomes cancelled when it
     * finishes. Cancelling a cancelled job is a no-op.
     *
     * @throws IllegalJobStateException the job is completed
     */
    @NotNull Job cancel(@NotNull UUID id)
            throws JobNotFoundException, IllegalJobStateException, ConcurrentJobModificationException;

    @NotNull Job get(@NotNull UUID id) throws JobNotFoundException;

    @NotNull List<Job> list(@NotNull JobFilter filter);

    /**
     * @return at most {@code limit} records, newest first
     */
    @NotNull List<ExecutionRecord> getHistory(@NotNull UUID id, int limit) throws JobNotFoundException;

    /**
     * Removes the job and its history. An attempt already running finishes, its outcome is discarded.
     */
    void delete(@NotNull UUID id) throws JobNotFoundException;

    /**
     * Replaces the schedule of a non-terminal job with one of the same kind.
     *
     * @param timezone new zone, {@code null} keeps the current one
     */
    @NotNull Job reschedule(@NotNull UUID id, @NotNull ScheduleSpec schedule, @Nullable ZoneId timezone)
            throws JobNotFoundException, InvalidScheduleSpecException, IllegalJobStateException,
            ConcurrentJobModificationException;

    @NotNull Job rename(@NotNull UUID id, @NotNull String name)
            throws JobNotFoundException, ConcurrentJobModificationException;

    @NotNull SchedulerStats stats();

    void addListener(@NotNull JobEventListener l);

    void removeListener(@NotNull JobEventListener l);

    /**
     * Starts the scheduler loop and the workers; a no-op when already started.
     */
    void start();

    @Override
    void close();
}
