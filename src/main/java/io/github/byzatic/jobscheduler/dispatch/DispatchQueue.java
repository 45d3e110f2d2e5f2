package io.github.byzatic.jobscheduler.dispatch;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Due work awaiting a free worker.
 * <p>
 * Order: priority ({@code CRITICAL} first), then ascending due time, then insertion order.
 * {@link #take()} blocks while the queue is empty.
 */
@ThreadSafe
public final class DispatchQueue {
    private static final Comparator<Entry> ORDER = Comparator
            .comparing((Entry e) -> e.item.priority)
            .thenComparing(e -> e.item.dueAt)
            .thenComparingLong(e -> e.sequence);

    private final PriorityBlockingQueue<Entry> queue = new PriorityBlockingQueue<>(16, ORDER);
    private final AtomicLong sequence = new AtomicLong();

    public void offer(@NotNull DispatchItem item) {
        queue.offer(new Entry(Objects.requireNonNull(item, "item"), sequence.getAndIncrement()));
    }

    public @NotNull DispatchItem take() throws InterruptedException {
        return queue.take().item;
    }

    public @Nullable DispatchItem poll(long timeout, @NotNull TimeUnit unit) throws InterruptedException {
        Entry entry = queue.poll(timeout, unit);
        return entry == null ? null : entry.item;
    }

    public @Nullable DispatchItem poll() {
        Entry entry = queue.poll();
        return entry == null ? null : entry.item;
    }

    /**
     * Items in dispatch order; a copy, the queue is not modified.
     */
    public @NotNull List<DispatchItem> snapshot() {
        List<Entry> entries = new ArrayList<>(queue);
        entries.sort(ORDER);
        List<DispatchItem> out = new ArrayList<>(entries.size());
        for (Entry entry : entries) out.add(entry.item);
        return out;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public void clear() {
        queue.clear();
    }

    private static final class Entry {
        final DispatchItem item;
        final long sequence;

        Entry(DispatchItem item, long sequence) {
            this.item = item;
            this.sequence = sequence;
        }
    }
}
