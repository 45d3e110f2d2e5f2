package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.exceptions.ConcurrentJobModificationException;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import io.github.byzatic.jobscheduler.exceptions.JobNotFoundException;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobDefinition;
import io.github.byzatic.jobscheduler.model.JobFilter;
import io.github.byzatic.jobscheduler.model.JobStatus;
import io.github.byzatic.jobscheduler.model.ScheduleSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Source of truth for job definitions and their mutable status.
 * <p>
 * Every mutation carries the version the caller last saw and fails with
 * {@link ConcurrentJobModificationException} if the stored job has moved on since. A successful mutation
 * increments the version by one and refreshes {@code updatedAt}.
 */
public interface JobStoreInterface {
    /**
     * Assigns id, status {@link JobStatus#SCHEDULED}, version 1 and the first {@code nextRunAt}.
     *
     * @throws InvalidScheduleSpecException unparseable cron, past one-off instant, non-positive interval
     */
    @NotNull Job create(@NotNull JobDefinition definition) throws InvalidScheduleSpecException;

    @NotNull Job get(@NotNull UUID id) throws JobNotFoundException;

    @NotNull Optional<Job> find(@NotNull UUID id);

    /**
     * Matching jobs ordered by creation time.
     */
    @NotNull List<Job> list(@NotNull JobFilter filter);

    /**
     * Compare-and-set of a modified snapshot; {@code modified.getVersion()} is the expected version.
     * Id, schedule kind and creation time cannot change.
     */
    @NotNull Job update(@NotNull Job modified) throws JobNotFoundException, ConcurrentJobModificationException;

    /**
     * Terminal statuses clear {@code nextRunAt} and any requested status; other statuses keep them.
     */
    @NotNull Job updateStatus(@NotNull UUID id, long expectedVersion, @NotNull JobStatus newStatus)
            throws JobNotFoundException, ConcurrentJobModificationException;

    /**
     * Replaces the schedule (same kind only) and optionally the zone, then recomputes {@code nextRunAt}.
     *
     * @param timezone new zone, {@code null} keeps the current one
     */
    @NotNull Job updateSchedule(@NotNull UUID id, long expectedVersion, @NotNull ScheduleSpec schedule, @Nullable ZoneId timezone)
            throws InvalidScheduleSpecException, JobNotFoundException, ConcurrentJobModificationException;

    void delete(@NotNull UUID id) throws JobNotFoundException;

    int size();
}
