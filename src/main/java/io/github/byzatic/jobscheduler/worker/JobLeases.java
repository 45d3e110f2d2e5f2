package io.github.byzatic.jobscheduler.worker;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job mutual exclusion tokens. Acquisition never blocks: a held lease makes {@link #tryAcquire} fail.
 */
@ThreadSafe
public final class JobLeases {
    private final Set<UUID> held = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(@NotNull UUID jobId) {
        return held.add(jobId);
    }

    public void release(@NotNull UUID jobId) {
        held.remove(jobId);
    }

    public boolean isHeld(@NotNull UUID jobId) {
        return held.contains(jobId);
    }

    public int size() {
        return held.size();
    }
}
