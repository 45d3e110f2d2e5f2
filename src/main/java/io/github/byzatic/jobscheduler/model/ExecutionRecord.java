package io.github.byzatic.jobscheduler.model;

import com.google.errorprone.annotations.Immutable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of one execution attempt (read-only).
 */
@Immutable
public final class ExecutionRecord {
    private final UUID jobId;
    private final int attempt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final ExecutionOutcome outcome;
    private final String errorDetail;

    public ExecutionRecord(@NotNull UUID jobId, int attempt, @NotNull Instant startedAt, @NotNull Instant finishedAt,
                           @NotNull ExecutionOutcome outcome, @Nullable String errorDetail) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        if (attempt < 1) throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        if (finishedAt.isBefore(startedAt)) throw new IllegalArgumentException("finishedAt before startedAt");
        if (outcome == ExecutionOutcome.SUCCESS && errorDetail != null) {
            throw new IllegalArgumentException("successful attempt carries no error detail");
        }
        if (outcome != ExecutionOutcome.SUCCESS && errorDetail == null) {
            throw new IllegalArgumentException("failed attempt requires an error detail");
        }
        this.attempt = attempt;
        this.errorDetail = errorDetail;
    }

    public @NotNull UUID getJobId() {
        return jobId;
    }

    public int getAttempt() {
        return attempt;
    }

    public @NotNull Instant getStartedAt() {
        return startedAt;
    }

    public @NotNull Instant getFinishedAt() {
        return finishedAt;
    }

    public @NotNull ExecutionOutcome getOutcome() {
        return outcome;
    }

    /**
     * Present iff the outcome is not {@link ExecutionOutcome#SUCCESS}.
     */
    public @Nullable String getErrorDetail() {
        return errorDetail;
    }

    public @NotNull Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionRecord that = (ExecutionRecord) o;
        return attempt == that.attempt
                && jobId.equals(that.jobId)
                && startedAt.equals(that.startedAt)
                && finishedAt.equals(that.finishedAt)
                && outcome == that.outcome
                && Objects.equals(errorDetail, that.errorDetail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, attempt, startedAt, finishedAt, outcome, errorDetail);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{jobId=" + jobId + ", attempt=" + attempt + ", startedAt=" + startedAt +
                ", finishedAt=" + finishedAt + ", outcome=" + outcome +
                (errorDetail != null ? ", errorDetail='" + errorDetail + '\'' : "") + '}';
    }
}
