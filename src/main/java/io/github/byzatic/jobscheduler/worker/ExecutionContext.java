package io.github.byzatic.jobscheduler.worker;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * What a handler gets to know about the attempt it runs (read-only).
 */
public final class ExecutionContext {
    private final UUID jobId;
    private final String jobName;
    private final String handlerRef;
    private final int attempt;
    private final Instant scheduledFor;
    private final Duration timeout;

    ExecutionContext(UUID jobId, String jobName, String handlerRef, int attempt, Instant scheduledFor, Duration timeout) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.handlerRef = handlerRef;
        this.attempt = attempt;
        this.scheduledFor = scheduledFor;
        this.timeout = timeout;
    }

    public @NotNull UUID getJobId() {
        return jobId;
    }

    public @NotNull String getJobName() {
        return jobName;
    }

    public @NotNull String getHandlerRef() {
        return handlerRef;
    }

    /**
     * 1 for the first attempt, incremented by every retry of the same run.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * The regular occurrence this attempt belongs to.
     */
    public @NotNull Instant getScheduledFor() {
        return scheduledFor;
    }

    public @NotNull Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "ExecutionContext{jobId=" + jobId + ", jobName='" + jobName + "', handlerRef='" + handlerRef +
                "', attempt=" + attempt + ", scheduledFor=" + scheduledFor + '}';
    }
}
