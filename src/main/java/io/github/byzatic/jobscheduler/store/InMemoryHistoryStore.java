package io.github.byzatic.jobscheduler.store;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * History store keeping a fixed-capacity ring buffer per job.
 */
@ThreadSafe
public class InMemoryHistoryStore implements HistoryStoreInterface {
    public static final int DEFAULT_RETENTION_PER_JOB = 1_000;

    private final Map<UUID, RingBuffer> buffers = new ConcurrentHashMap<>();
    private final int retentionPerJob;

    public InMemoryHistoryStore() {
        this(DEFAULT_RETENTION_PER_JOB);
    }

    public InMemoryHistoryStore(int retentionPerJob) {
        if (retentionPerJob <= 0) throw new IllegalArgumentException("retentionPerJob must be > 0");
        this.retentionPerJob = retentionPerJob;
    }

    @Override
    public void append(@NotNull ExecutionRecord record) {
        Objects.requireNonNull(record, "record");
        buffers.computeIfAbsent(record.getJobId(), id -> new RingBuffer(retentionPerJob)).add(record);
    }

    @Override
    public @NotNull List<ExecutionRecord> recent(@NotNull UUID jobId, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        RingBuffer buffer = buffers.get(jobId);
        if (buffer == null || limit == 0) return Collections.emptyList();
        return buffer.newestFirst(limit);
    }

    @Override
    public int count(@NotNull UUID jobId) {
        RingBuffer buffer = buffers.get(jobId);
        return buffer == null ? 0 : buffer.size();
    }

    @Override
    public void delete(@NotNull UUID jobId) {
        buffers.remove(jobId);
    }

    public int getRetentionPerJob() {
        return retentionPerJob;
    }

    private static final class RingBuffer {
        @GuardedBy("this")
        private final ExecutionRecord[] slots;
        @GuardedBy("this")
        private int next;
        @GuardedBy("this")
        private int size;

        RingBuffer(int capacity) {
            this.slots = new ExecutionRecord[capacity];
        }

        synchronized void add(ExecutionRecord record) {
            // при заполнении перезаписываем самую старую запись
            slots[next] = record;
            next = (next + 1) % slots.length;
            if (size < slots.length) size++;
        }

        synchronized List<ExecutionRecord> newestFirst(int limit) {
            int n = Math.min(limit, size);
            List<ExecutionRecord> out = new ArrayList<>(n);
            for (int i = 1; i <= n; i++) {
                out.add(slots[Math.floorMod(next - i, slots.length)]);
            }
            return out;
        }

        synchronized int size() {
            return size;
        }
    }
}
