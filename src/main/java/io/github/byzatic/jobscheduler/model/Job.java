package io.github.byzatic.jobscheduler.model;

import com.google.errorprone.annotations.Immutable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.UUID;

/**
 * Snapshot of a schedulable job as held by the job store.
 * <p>
 * Snapshots never change; a mutation is expressed as {@code job.toBuilder()...build()} and handed back to the
 * store, which accepts it only if {@link #getVersion()} still equals the stored version.
 */
@Immutable
public final class Job {
    private final UUID id;
    private final String name;
    private final ScheduleSpec schedule;
    private final ZoneId timezone;
    private final JobPriority priority;
    private final int maxRetries;
    private final Duration timeout;
    private final Duration baseRetryDelay;
    private final Duration maxRetryDelay;
    private final String handlerRef;
    private final JobStatus status;
    private final JobStatus requestedStatus;
    private final boolean executionInFlight;
    private final Instant nextRunAt;
    private final Instant lastRunAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    private Job(Builder builder) {
        id = Objects.requireNonNull(builder.id, "id");
        name = Objects.requireNonNull(builder.name, "name");
        schedule = Objects.requireNonNull(builder.schedule, "schedule");
        timezone = Objects.requireNonNull(builder.timezone, "timezone");
        priority = Objects.requireNonNull(builder.priority, "priority");
        maxRetries = builder.maxRetries;
        timeout = Objects.requireNonNull(builder.timeout, "timeout");
        baseRetryDelay = builder.baseRetryDelay;
        maxRetryDelay = builder.maxRetryDelay;
        handlerRef = Objects.requireNonNull(builder.handlerRef, "handlerRef");
        status = Objects.requireNonNull(builder.status, "status");
        requestedStatus = builder.requestedStatus;
        executionInFlight = builder.executionInFlight;
        nextRunAt = builder.nextRunAt;
        lastRunAt = builder.lastRunAt;
        createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        updatedAt = Objects.requireNonNull(builder.updatedAt, "updatedAt");
        version = builder.version;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.name = name;
        builder.schedule = schedule;
        builder.timezone = timezone;
        builder.priority = priority;
        builder.maxRetries = maxRetries;
        builder.timeout = timeout;
        builder.baseRetryDelay = baseRetryDelay;
        builder.maxRetryDelay = maxRetryDelay;
        builder.handlerRef = handlerRef;
        builder.status = status;
        builder.requestedStatus = requestedStatus;
        builder.executionInFlight = executionInFlight;
        builder.nextRunAt = nextRunAt;
        builder.lastRunAt = lastRunAt;
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        builder.version = version;
        return builder;
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull ScheduleSpec getSchedule() {
        return schedule;
    }

    public @NotNull ScheduleKind getScheduleKind() {
        return schedule.getKind();
    }

    public @NotNull ZoneId getTimezone() {
        return timezone;
    }

    public @NotNull JobPriority getPriority() {
        return priority;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public @NotNull Duration getTimeout() {
        return timeout;
    }

    public @Nullable Duration getBaseRetryDelay() {
        return baseRetryDelay;
    }

    public @Nullable Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public @NotNull String getHandlerRef() {
        return handlerRef;
    }

    public @NotNull JobStatus getStatus() {
        return status;
    }

    /**
     * Pause or cancel requested while an execution was in flight; applied when that execution concludes.
     */
    public @Nullable JobStatus getRequestedStatus() {
        return requestedStatus;
    }

    /**
     * An execution of this job is queued, running or waiting for a retry. At most one at a time.
     */
    public boolean isExecutionInFlight() {
        return executionInFlight;
    }

    public @Nullable Instant getNextRunAt() {
        return nextRunAt;
    }

    /**
     * When the job was last handed to the dispatch queue.
     */
    public @Nullable Instant getLastRunAt() {
        return lastRunAt;
    }

    public @NotNull Instant getCreatedAt() {
        return createdAt;
    }

    public @NotNull Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Status {@code SCHEDULED}, nothing requested and {@code nextRunAt} reached.
     */
    public boolean isDue(@NotNull Instant now) {
        return status == JobStatus.SCHEDULED && requestedStatus == null && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return version == job.version && id.equals(job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", schedule=" + schedule +
                ", timezone=" + timezone +
                ", priority=" + priority +
                ", status=" + status +
                (requestedStatus != null ? ", requestedStatus=" + requestedStatus : "") +
                (executionInFlight ? ", executionInFlight" : "") +
                ", nextRunAt=" + nextRunAt +
                ", version=" + version +
                '}';
    }

    /**
     * {@code Job} builder static inner class.
     */
    public static final class Builder {
        private UUID id;
        private String name;
        private ScheduleSpec schedule;
        private ZoneId timezone;
        private JobPriority priority = JobPriority.NORMAL;
        private int maxRetries;
        private Duration timeout = JobDefinition.DEFAULT_TIMEOUT;
        private Duration baseRetryDelay;
        private Duration maxRetryDelay;
        private String handlerRef;
        private JobStatus status = JobStatus.SCHEDULED;
        private JobStatus requestedStatus;
        private boolean executionInFlight;
        private Instant nextRunAt;
        private Instant lastRunAt;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        private Builder() {
        }

        public Builder setId(UUID id) {
            this.id = id;
            return this;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setSchedule(ScheduleSpec schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder setTimezone(ZoneId timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder setPriority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder setTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder setBaseRetryDelay(Duration baseRetryDelay) {
            this.baseRetryDelay = baseRetryDelay;
            return this;
        }

        public Builder setMaxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder setHandlerRef(String handlerRef) {
            this.handlerRef = handlerRef;
            return this;
        }

        public Builder setStatus(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder setRequestedStatus(JobStatus requestedStatus) {
            this.requestedStatus = requestedStatus;
            return this;
        }

        public Builder setExecutionInFlight(boolean executionInFlight) {
            this.executionInFlight = executionInFlight;
            return this;
        }

        public Builder setNextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder setLastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder setCreatedAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder setUpdatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder setVersion(long version) {
            this.version = version;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
