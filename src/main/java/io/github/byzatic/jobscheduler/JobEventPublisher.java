package io.github.byzatic.jobscheduler;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans events out to the registered listeners. A failing listener never affects scheduling.
 */
@ThreadSafe
public final class JobEventPublisher {
    private final static Logger logger = LoggerFactory.getLogger(JobEventPublisher.class);

    private final List<JobEventListener> listeners;

    public JobEventPublisher() {
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public JobEventPublisher(@NotNull Collection<JobEventListener> listeners) {
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public void addListener(@NotNull JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    public void removeListener(@NotNull JobEventListener l) {
        listeners.remove(l);
    }

    public void fire(@NotNull Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.error("Exception occurred in job event listener, swallow to keep scheduling alive", t);
            }
        }
    }
}
