package io.github.byzatic.jobscheduler.worker;

import io.github.byzatic.jobscheduler.dispatch.DispatchItem;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import io.github.byzatic.jobscheduler.model.Job;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Status bookkeeping around an attempt, implemented by the scheduler loop.
 */
public interface ExecutionLifecycle {
    /**
     * Marks the job running before its handler is invoked.
     *
     * @return the running job, or {@code null} if the attempt must not run (job deleted or cancelled meanwhile)
     */
    @Nullable Job claim(@NotNull DispatchItem item);

    /**
     * Receives the recorded outcome once the lease is released; decides on retry and the next status.
     */
    void complete(@NotNull DispatchItem item, @NotNull ExecutionRecord record);
}
