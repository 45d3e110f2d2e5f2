package io.github.byzatic.jobscheduler.model;

import io.github.byzatic.jobscheduler.cron.CronEvaluator;
import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * When a job runs: a cron expression, a single instant or a fixed interval.
 */
public final class ScheduleSpec {
    private final ScheduleKind kind;
    private final String cronExpression;
    private final Instant runAt;
    private final Duration interval;

    private ScheduleSpec(ScheduleKind kind, String cronExpression, Instant runAt, Duration interval) {
        this.kind = kind;
        this.cronExpression = cronExpression;
        this.runAt = runAt;
        this.interval = interval;
    }

    public static @NotNull ScheduleSpec cron(@NotNull String expression) {
        return new ScheduleSpec(ScheduleKind.CRON, Objects.requireNonNull(expression, "expression").trim(), null, null);
    }

    public static @NotNull ScheduleSpec once(@NotNull Instant at) {
        return new ScheduleSpec(ScheduleKind.ONCE, null, Objects.requireNonNull(at, "at"), null);
    }

    public static @NotNull ScheduleSpec interval(@NotNull Duration every) {
        return new ScheduleSpec(ScheduleKind.INTERVAL, null, null, Objects.requireNonNull(every, "every"));
    }

    public @NotNull ScheduleKind getKind() {
        return kind;
    }

    public @Nullable String getCronExpression() {
        return cronExpression;
    }

    public @Nullable Instant getRunAt() {
        return runAt;
    }

    public @Nullable Duration getInterval() {
        return interval;
    }

    /**
     * Rejects a schedule that can never produce a run from {@code now} on.
     */
    public void validate(@NotNull Instant now, @NotNull ZoneId zone) throws InvalidScheduleSpecException {
        switch (kind) {
            case CRON:
                CronEvaluator.nextOccurrence(cronExpression, zone, now);
                break;
            case ONCE:
                if (!runAt.isAfter(now)) {
                    throw new InvalidScheduleSpecException("One-off run time " + runAt + " is not in the future (now " + now + ")");
                }
                break;
            case INTERVAL:
                if (interval.isZero() || interval.isNegative()) {
                    throw new InvalidScheduleSpecException("Interval must be positive: " + interval);
                }
                break;
        }
    }

    /**
     * First due instant of a freshly created or re-timed job.
     */
    public @NotNull Instant firstRunAt(@NotNull Instant now, @NotNull ZoneId zone) throws InvalidScheduleSpecException {
        switch (kind) {
            case CRON:
                return CronEvaluator.nextOccurrence(cronExpression, zone, now);
            case ONCE:
                return runAt;
            default:
                return now.plus(interval);
        }
    }

    /**
     * Due instant after a resume: computed from {@code now}, a one-off job whose instant has passed runs right away.
     */
    public @NotNull Instant resumeRunAt(@NotNull Instant now, @NotNull ZoneId zone) throws InvalidScheduleSpecException {
        if (kind == ScheduleKind.ONCE) {
            return runAt.isAfter(now) ? runAt : now;
        }
        return firstRunAt(now, zone);
    }

    /**
     * Next regular occurrence strictly after {@code after}, or {@code null} for one-off schedules.
     */
    public @Nullable Instant nextRunAfter(@NotNull Instant after, @NotNull ZoneId zone) throws InvalidScheduleSpecException {
        switch (kind) {
            case CRON:
                return CronEvaluator.nextOccurrence(cronExpression, zone, after);
            case INTERVAL:
                return after.plus(interval);
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduleSpec that = (ScheduleSpec) o;
        return kind == that.kind
                && Objects.equals(cronExpression, that.cronExpression)
                && Objects.equals(runAt, that.runAt)
                && Objects.equals(interval, that.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, cronExpression, runAt, interval);
    }

    @Override
    public String toString() {
        switch (kind) {
            case CRON:
                return "cron '" + cronExpression + "'";
            case ONCE:
                return "once at " + runAt;
            default:
                return "every " + interval;
        }
    }
}
