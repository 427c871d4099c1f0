package com.agentcrew.persistence;

import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.TaskMessage;
import com.agentcrew.shared.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final InMemoryTaskStore store = new InMemoryTaskStore(clock);

    @Test
    void createdTaskIsPending() {
        var task = store.create("Report", "Write it", "c1", ExecutionMode.DYNAMIC);

        var loaded = store.find(task.id()).orElseThrow();
        assertEquals(TaskStatus.PENDING, loaded.status());
        assertEquals(clock.instant(), loaded.createdAt());
        assertNull(loaded.startedAt());
        assertTrue(store.messages(task.id()).isEmpty());
    }

    @Test
    void onlyOneClaimWins() {
        var task = store.create("t", null, "c1", null);

        assertTrue(store.markInProgress(task.id()));
        assertFalse(store.markInProgress(task.id()));
        assertEquals(clock.instant(), store.find(task.id()).orElseThrow().startedAt());
    }

    @Test
    void terminalTransitionsRequireInProgress() {
        var task = store.create("t", null, "c1", null);
        assertThrows(IllegalStateException.class, () -> store.markCompleted(task.id(), "done"));

        store.markInProgress(task.id());
        store.markCompleted(task.id(), "done");
        var done = store.find(task.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals("done", done.result());

        assertThrows(IllegalStateException.class, () -> store.markFailed(task.id(), "late"));
        assertFalse(store.markInProgress(task.id()));
        assertEquals("done", store.find(task.id()).orElseThrow().result());
    }

    @Test
    void unknownTaskIsReported() {
        assertTrue(store.find("nope").isEmpty());
        assertThrows(TaskNotFoundException.class, () -> store.markFailed("nope", "x"));
        assertThrows(TaskNotFoundException.class,
                () -> store.appendMessage("nope", MessageAuthor.SYSTEM, null, "x"));
        assertFalse(store.markInProgress("nope"));
    }

    @Test
    void concurrentAppendsGetDistinctSequences() throws Exception {
        var task = store.create("t", null, "c1", null);
        int writers = 8;
        int perWriter = 50;
        var pool = Executors.newFixedThreadPool(writers);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int w = 0; w < writers; w++) {
                int id = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        store.appendMessage(task.id(), MessageAuthor.AGENT, "ask_" + id, "m" + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        var sequences = store.messages(task.id()).stream().mapToLong(TaskMessage::sequence).toArray();
        assertArrayEquals(LongStream.rangeClosed(1, (long) writers * perWriter).toArray(), sequences);
    }
}
