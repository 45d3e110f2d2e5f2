package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.store.InMemoryHistoryStore;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * Process-wide options of the scheduling core (read-only).
 */
public final class SchedulerConfiguration {
    public static final String PREFIX = "job-scheduler.";
    public static final String POLL_INTERVAL = PREFIX + "poll-interval";
    public static final String WORKER_POOL_SIZE = PREFIX + "worker-pool-size";
    public static final String DEFAULT_TIMEZONE = PREFIX + "default-timezone";
    public static final String HISTORY_RETENTION_PER_JOB = PREFIX + "history-retention-per-job";
    public static final String DEFAULT_BASE_RETRY_DELAY = PREFIX + "default-base-retry-delay";
    public static final String DEFAULT_MAX_RETRY_DELAY = PREFIX + "default-max-retry-delay";
    public static final String CANCELLATION_GRACE = PREFIX + "cancellation-grace";

    private final Duration pollInterval;
    private final int workerPoolSize;
    private final ZoneId defaultTimezone;
    private final int historyRetentionPerJob;
    private final Duration defaultBaseRetryDelay;
    private final Duration defaultMaxRetryDelay;
    private final Duration cancellationGrace;
    private final Clock clock;

    private SchedulerConfiguration(Builder b) {
        this.pollInterval = b.pollInterval;
        this.workerPoolSize = b.workerPoolSize;
        this.defaultTimezone = b.defaultTimezone;
        this.historyRetentionPerJob = b.historyRetentionPerJob;
        this.defaultBaseRetryDelay = b.defaultBaseRetryDelay;
        this.defaultMaxRetryDelay = b.defaultMaxRetryDelay;
        this.cancellationGrace = b.cancellationGrace;
        this.clock = b.clock;
    }

    public static @NotNull SchedulerConfiguration defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Reads the {@code job-scheduler.*} keys; absent keys keep their defaults.
     * Durations are ISO-8601 ({@code PT0.5S}) or plain milliseconds.
     *
     * @throws IllegalArgumentException naming the key of a malformed value
     */
    public static @NotNull SchedulerConfiguration fromProperties(@NotNull Properties properties) {
        Builder b = newBuilder();
        String v;
        if ((v = properties.getProperty(POLL_INTERVAL)) != null) b.pollInterval(duration(POLL_INTERVAL, v));
        if ((v = properties.getProperty(WORKER_POOL_SIZE)) != null) b.workerPoolSize(integer(WORKER_POOL_SIZE, v));
        if ((v = properties.getProperty(DEFAULT_TIMEZONE)) != null) {
            try {
                b.defaultTimezone(ZoneId.of(v.trim()));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid value of " + DEFAULT_TIMEZONE + ": " + v, e);
            }
        }
        if ((v = properties.getProperty(HISTORY_RETENTION_PER_JOB)) != null) {
            b.historyRetentionPerJob(integer(HISTORY_RETENTION_PER_JOB, v));
        }
        if ((v = properties.getProperty(DEFAULT_BASE_RETRY_DELAY)) != null) {
            b.defaultBaseRetryDelay(duration(DEFAULT_BASE_RETRY_DELAY, v));
        }
        if ((v = properties.getProperty(DEFAULT_MAX_RETRY_DELAY)) != null) {
            b.defaultMaxRetryDelay(duration(DEFAULT_MAX_RETRY_DELAY, v));
        }
        if ((v = properties.getProperty(CANCELLATION_GRACE)) != null) b.cancellationGrace(duration(CANCELLATION_GRACE, v));
        return b.build();
    }

    private static Duration duration(String key, String value) {
        String s = value.trim();
        try {
            if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(s));
            }
            return Duration.parse(s);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value of " + key + ": " + value, e);
        }
    }

    private static int integer(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value of " + key + ": " + value, e);
        }
    }

    public @NotNull Duration getPollInterval() {
        return pollInterval;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public @NotNull ZoneId getDefaultTimezone() {
        return defaultTimezone;
    }

    public int getHistoryRetentionPerJob() {
        return historyRetentionPerJob;
    }

    public @NotNull Duration getDefaultBaseRetryDelay() {
        return defaultBaseRetryDelay;
    }

    public @NotNull Duration getDefaultMaxRetryDelay() {
        return defaultMaxRetryDelay;
    }

    /**
     * How long a handler may keep running after its stop was requested before the worker moves on.
     */
    public @NotNull Duration getCancellationGrace() {
        return cancellationGrace;
    }

    public @NotNull Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "SchedulerConfiguration{pollInterval=" + pollInterval + ", workerPoolSize=" + workerPoolSize +
                ", defaultTimezone=" + defaultTimezone + ", historyRetentionPerJob=" + historyRetentionPerJob +
                ", defaultBaseRetryDelay=" + defaultBaseRetryDelay + ", defaultMaxRetryDelay=" + defaultMaxRetryDelay +
                ", cancellationGrace=" + cancellationGrace + '}';
    }

    public static final class Builder {
        private Duration pollInterval = Duration.ofSeconds(1);
        private int workerPoolSize = 10;
        private ZoneId defaultTimezone = ZoneId.systemDefault();
        private int historyRetentionPerJob = InMemoryHistoryStore.DEFAULT_RETENTION_PER_JOB;
        private Duration defaultBaseRetryDelay = Duration.ofSeconds(1);
        private Duration defaultMaxRetryDelay = Duration.ofSeconds(60);
        private Duration cancellationGrace = Duration.ofSeconds(10);
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Scheduler loop tick cadence.
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval);
            return this;
        }

        /**
         * Max concurrent executions.
         */
        public Builder workerPoolSize(int workerPoolSize) {
            this.workerPoolSize = workerPoolSize;
            return this;
        }

        public Builder defaultTimezone(ZoneId defaultTimezone) {
            this.defaultTimezone = Objects.requireNonNull(defaultTimezone);
            return this;
        }

        public Builder historyRetentionPerJob(int historyRetentionPerJob) {
            this.historyRetentionPerJob = historyRetentionPerJob;
            return this;
        }

        public Builder defaultBaseRetryDelay(Duration defaultBaseRetryDelay) {
            this.defaultBaseRetryDelay = Objects.requireNonNull(defaultBaseRetryDelay);
            return this;
        }

        public Builder defaultMaxRetryDelay(Duration defaultMaxRetryDelay) {
            this.defaultMaxRetryDelay = Objects.requireNonNull(defaultMaxRetryDelay);
            return this;
        }

        public Builder cancellationGrace(Duration cancellationGrace) {
            this.cancellationGrace = Objects.requireNonNull(cancellationGrace);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public SchedulerConfiguration build() {
            if (pollInterval.isZero() || pollInterval.isNegative()) throw new IllegalArgumentException("pollInterval must be > 0");
            if (workerPoolSize <= 0) throw new IllegalArgumentException("workerPoolSize must be > 0");
            if (historyRetentionPerJob <= 0) throw new IllegalArgumentException("historyRetentionPerJob must be > 0");
            if (defaultBaseRetryDelay.isZero() || defaultBaseRetryDelay.isNegative()) {
                throw new IllegalArgumentException("defaultBaseRetryDelay must be > 0");
            }
            if (defaultMaxRetryDelay.compareTo(defaultBaseRetryDelay) < 0) {
                throw new IllegalArgumentException("defaultMaxRetryDelay must be >= defaultBaseRetryDelay");
            }
            if (cancellationGrace.isNegative()) throw new IllegalArgumentException("cancellationGrace must be >= 0");
            return new SchedulerConfiguration(this);
        }
    }
}
