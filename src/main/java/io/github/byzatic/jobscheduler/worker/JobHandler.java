package io.github.byzatic.jobscheduler.worker;

import org.jetbrains.annotations.NotNull;

/**
 * Business logic behind a {@code handlerRef}. Always check the token!
 * <p>
 * Returning normally is a success, throwing is a failure that goes through the retry policy.
 * Returning after the token was raised records the attempt as cancelled.
 */
@FunctionalInterface
public interface JobHandler {
    void run(@NotNull ExecutionContext context, @NotNull CancellationToken token) throws Exception;

    /**
     * Called when a soft stop is requested (optional).
     */
    default void onStopRequested() {
    }
}
