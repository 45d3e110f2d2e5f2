package io.github.byzatic.jobscheduler.worker;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed registry. Handlers can be registered or replaced at any time, also after jobs referencing them exist.
 */
@ThreadSafe
public class HandlerRegistry implements HandlerRegistryInterface {
    private final static Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    /**
     * @return the handler previously registered under {@code handlerRef}, if any
     */
    public @Nullable JobHandler register(@NotNull String handlerRef, @NotNull JobHandler handler) {
        Objects.requireNonNull(handlerRef, "handlerRef");
        Objects.requireNonNull(handler, "handler");
        if (handlerRef.isBlank()) throw new IllegalArgumentException("handlerRef must not be blank");
        JobHandler previous = handlers.put(handlerRef, handler);
        logger.info("Handler registered: {}{}", handlerRef, previous != null ? " (replaced)" : "");
        return previous;
    }

    public boolean unregister(@NotNull String handlerRef) {
        return handlers.remove(handlerRef) != null;
    }

    @Override
    public @NotNull Optional<JobHandler> resolve(@NotNull String handlerRef) {
        return Optional.ofNullable(handlers.get(handlerRef));
    }

    public @NotNull Set<String> registeredRefs() {
        return Set.copyOf(handlers.keySet());
    }
}
