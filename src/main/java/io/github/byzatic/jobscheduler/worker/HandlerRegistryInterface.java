package io.github.byzatic.jobscheduler.worker;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Resolves the opaque {@code handlerRef} of a job to the code that runs it.
 * The scheduling core depends on it but does not own the registrations.
 */
public interface HandlerRegistryInterface {
    @NotNull Optional<JobHandler> resolve(@NotNull String handlerRef);
}
