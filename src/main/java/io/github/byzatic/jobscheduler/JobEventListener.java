package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.model.ExecutionRecord;

import java.time.Duration;
import java.util.UUID;

/**
 * Job event listener. Callbacks run on scheduler and worker threads and must return quickly.
 */
public interface JobEventListener {
    default void onStart(UUID jobId, int attempt) {
    }

    default void onComplete(UUID jobId) {
    }

    default void onError(UUID jobId, Throwable error) {
    }

    default void onTimeout(UUID jobId) {
    }

    default void onCancelled(UUID jobId) {
    }

    /**
     * A failed or timed out attempt will be retried as {@code nextAttempt} after {@code delay}.
     */
    default void onRetryScheduled(UUID jobId, int nextAttempt, Duration delay) {
    }

    /**
     * The retry policy gave up; {@code lastRecord} is the final outcome of the execution.
     */
    default void onRetriesExhausted(UUID jobId, ExecutionRecord lastRecord) {
    }
}
