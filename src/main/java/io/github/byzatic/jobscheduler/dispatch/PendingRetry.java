package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * Retry attempt parked until its backoff elapses, for use in a {@link java.util.concurrent.DelayQueue}.
 */
public final class PendingRetry implements Delayed {
    private final DispatchItem item;
    private final Clock clock;

    public PendingRetry(@NotNull DispatchItem item, @NotNull Clock clock) {
        this.item = item;
        this.clock = clock;
    }

    public @NotNull DispatchItem getItem() {
        return item;
    }

    public @NotNull Instant getReadyAt() {
        return item.dueAt;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        long diff = item.dueAt.toEpochMilli() - clock.millis();
        return unit.convert(diff, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        return item.dueAt.compareTo(((PendingRetry) o).item.dueAt);
    }
}
