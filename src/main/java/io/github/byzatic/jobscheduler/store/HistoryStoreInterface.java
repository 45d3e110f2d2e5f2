package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Bounded, per-job, append-only log of execution attempts. The oldest record of a job is evicted first.
 */
public interface HistoryStoreInterface {
    void append(@NotNull ExecutionRecord record);

    /**
     * @return at most {@code limit} records of the job, newest first
     */
    @NotNull List<ExecutionRecord> recent(@NotNull UUID jobId, int limit);

    int count(@NotNull UUID jobId);

    void delete(@NotNull UUID jobId);
}
