package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.model.ExecutionOutcome;
import io.github.byzatic.jobscheduler.model.ExecutionRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryHistoryStoreTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static ExecutionRecord record(UUID jobId, int n) {
        Instant start = T0.plusSeconds(n);
        return new ExecutionRecord(jobId, 1, start, start.plusMillis(10), ExecutionOutcome.SUCCESS, null);
    }

    @Test
    void keepsOnlyNewestRecords() {
        InMemoryHistoryStore store = new InMemoryHistoryStore(1_000);
        UUID id = UUID.randomUUID();
        for (int i = 0; i < 1_500; i++) store.append(record(id, i));

        assertEquals(1_000, store.count(id));
        List<ExecutionRecord> all = store.recent(id, 5_000);
        assertEquals(1_000, all.size());
        assertEquals(T0.plusSeconds(1_499), all.get(0).getStartedAt());
        assertEquals(T0.plusSeconds(500), all.get(999).getStartedAt());
    }

    @Test
    void recentIsNewestFirstAndLimited() {
        InMemoryHistoryStore store = new InMemoryHistoryStore();
        UUID id = UUID.randomUUID();
        for (int i = 0; i < 10; i++) store.append(record(id, i));

        List<ExecutionRecord> last3 = store.recent(id, 3);
        assertEquals(3, last3.size());
        assertEquals(T0.plusSeconds(9), last3.get(0).getStartedAt());
        assertEquals(T0.plusSeconds(7), last3.get(2).getStartedAt());
        assertTrue(store.recent(id, 0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.recent(id, -1));
    }

    @Test
    void jobsAreIsolatedAndDeletable() {
        InMemoryHistoryStore store = new InMemoryHistoryStore(5);
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        store.append(record(a, 1));
        store.append(record(b, 2));
        store.append(record(b, 3));

        assertEquals(1, store.count(a));
        assertEquals(2, store.count(b));
        store.delete(b);
        assertEquals(0, store.count(b));
        assertTrue(store.recent(b, 10).isEmpty());
        assertEquals(1, store.count(a));
        assertTrue(store.recent(UUID.randomUUID(), 10).isEmpty());
    }

    @Test
    void concurrentAppendsAreAllCounted() throws Exception {
        InMemoryHistoryStore store = new InMemoryHistoryStore(10_000);
        UUID id = UUID.randomUUID();
        Thread[] threads = new Thread[4];
        for (int t = 0; t < threads.length; t++) {
            int base = t * 1_000;
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 1_000; i++) store.append(record(id, base + i));
            });
            threads[t].start();
        }
        for (Thread t : threads) t.join();
        assertEquals(4_000, store.count(id));
    }

    @Test
    void retentionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryHistoryStore(0));
    }
}
