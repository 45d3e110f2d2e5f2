package io.github.byzatic.jobscheduler.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Caller-supplied part of a job. The store assigns identity, status and timestamps on creation.
 */
public final class JobDefinition {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

    private final String name;
    private final ScheduleSpec schedule;
    private final ZoneId timezone;
    private final JobPriority priority;
    private final int maxRetries;
    private final Duration timeout;
    private final Duration baseRetryDelay;
    private final Duration maxRetryDelay;
    private final String handlerRef;

    private JobDefinition(Builder builder) {
        name = builder.name;
        schedule = builder.schedule;
        timezone = builder.timezone;
        priority = builder.priority;
        maxRetries = builder.maxRetries;
        timeout = builder.timeout;
        baseRetryDelay = builder.baseRetryDelay;
        maxRetryDelay = builder.maxRetryDelay;
        handlerRef = builder.handlerRef;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull ScheduleSpec getSchedule() {
        return schedule;
    }

    /**
     * @return explicit zone, or {@code null} to use the configured default
     */
    public @Nullable ZoneId getTimezone() {
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

    @Override
    public String toString() {
        return "JobDefinition{" +
                "name='" + name + '\'' +
                ", schedule=" + schedule +
                ", timezone=" + timezone +
                ", priority=" + priority +
                ", maxRetries=" + maxRetries +
                ", timeout=" + timeout +
                ", handlerRef='" + handlerRef + '\'' +
                '}';
    }

    /**
     * {@code JobDefinition} builder static inner class.
     */
    public static final class Builder {
        private String name;
        private ScheduleSpec schedule;
        private ZoneId timezone;
        private JobPriority priority = JobPriority.NORMAL;
        private int maxRetries = 0;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration baseRetryDelay;
        private Duration maxRetryDelay;
        private String handlerRef;

        private Builder() {
        }

        public Builder setName(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder setSchedule(@NotNull ScheduleSpec schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder setTimezone(@Nullable ZoneId timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder setPriority(@NotNull JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder setTimeout(@NotNull Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Overrides the configured backoff base for this job.
         */
        public Builder setBaseRetryDelay(@Nullable Duration baseRetryDelay) {
            this.baseRetryDelay = baseRetryDelay;
            return this;
        }

        /**
         * Overrides the configured backoff cap for this job.
         */
        public Builder setMaxRetryDelay(@Nullable Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder setHandlerRef(@NotNull String handlerRef) {
            this.handlerRef = handlerRef;
            return this;
        }

        public JobDefinition build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(schedule, "schedule");
            Objects.requireNonNull(priority, "priority");
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(handlerRef, "handlerRef");
            if (handlerRef.isBlank()) throw new IllegalArgumentException("handlerRef must not be blank");
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
            if (baseRetryDelay != null && (baseRetryDelay.isZero() || baseRetryDelay.isNegative())) {
                throw new IllegalArgumentException("baseRetryDelay must be > 0");
            }
            if (maxRetryDelay != null && maxRetryDelay.isNegative()) {
                throw new IllegalArgumentException("maxRetryDelay must be >= 0");
            }
            return new JobDefinition(this);
        }
    }
}
