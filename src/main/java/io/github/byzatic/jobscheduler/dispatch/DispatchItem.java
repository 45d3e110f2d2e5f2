package io.github.byzatic.jobscheduler.dispatch;

import io.github.byzatic.jobscheduler.model.JobPriority;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution attempt of a job waiting for a worker.
 */
public final class DispatchItem {
    final UUID jobId;
    final JobPriority priority;
    final Instant dueAt;
    final Instant scheduledFor;
    final int attempt;

    private DispatchItem(UUID jobId, JobPriority priority, Instant dueAt, Instant scheduledFor, int attempt) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.priority = Objects.requireNonNull(priority, "priority");
        this.dueAt = Objects.requireNonNull(dueAt, "dueAt");
        this.scheduledFor = Objects.requireNonNull(scheduledFor, "scheduledFor");
        this.attempt = attempt;
    }

    /**
     * First attempt of a regular occurrence due at {@code dueAt}.
     */
    public static @NotNull DispatchItem firstAttempt(@NotNull UUID jobId, @NotNull JobPriority priority, @NotNull Instant dueAt) {
        return new DispatchItem(jobId, priority, dueAt, dueAt, 1);
    }

    /**
     * Next attempt of the same execution, due once its backoff has elapsed.
     */
    public @NotNull DispatchItem retry(@NotNull Instant retryAt) {
        return new DispatchItem(jobId, priority, retryAt, scheduledFor, attempt + 1);
    }

    public @NotNull UUID getJobId() {
        return jobId;
    }

    public @NotNull JobPriority getPriority() {
        return priority;
    }

    /**
     * Ordering key within a priority level: the regular run time, or the retry time for retries.
     */
    public @NotNull Instant getDueAt() {
        return dueAt;
    }

    /**
     * Regular occurrence this execution belongs to; unchanged across retries.
     */
    public @NotNull Instant getScheduledFor() {
        return scheduledFor;
    }

    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "DispatchItem{jobId=" + jobId + ", priority=" + priority + ", dueAt=" + dueAt + ", attempt=" + attempt + '}';
    }
}
