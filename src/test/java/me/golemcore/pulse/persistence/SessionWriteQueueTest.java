package me.golemcore.pulse.persistence;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionWriteQueueTest {

    private final SessionWriteQueue queue = new SessionWriteQueue();

    @Test
    void shouldStartNextWriteOnlyAfterPreviousCompletes() {
        List<String> started = new CopyOnWriteArrayList<>();
        CompletableFuture<String> firstWrite = new CompletableFuture<>();

        CompletableFuture<String> first = queue.submit("s1", () -> {
            started.add("first");
            return firstWrite;
        });
        CompletableFuture<String> second = queue.submit("s1", () -> {
            started.add("second");
            return CompletableFuture.completedFuture("second");
        });

        assertEquals(List.of("first"), started);
        assertFalse(second.isDone());

        firstWrite.complete("first");

        assertEquals("first", first.join());
        assertEquals("second", second.join());
        assertEquals(List.of("first", "second"), started);
    }

    @Test
    void shouldContinueChainAfterFailedWrite() {
        CompletableFuture<String> failing = queue.submit("s1",
                () -> CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        CompletableFuture<String> next = queue.submit("s1", () -> CompletableFuture.completedFuture("ok"));

        assertTrue(failing.isCompletedExceptionally());
        assertEquals("ok", next.join());
    }

    @Test
    void shouldRunDifferentSessionsIndependently() {
        CompletableFuture<String> blocked = new CompletableFuture<>();
        queue.submit("s1", () -> blocked);

        CompletableFuture<String> other = queue.submit("s2", () -> CompletableFuture.completedFuture("s2"));

        assertEquals("s2", other.join());
        blocked.complete("done");
    }

    @Test
    void shouldTurnThrowingSupplierIntoFailedWrite() {
        CompletableFuture<String> write = queue.submit("s1", () -> {
            throw new IllegalArgumentException("bad id");
        });

        assertTrue(write.isCompletedExceptionally());
    }

    @Test
    void shouldDropIdleSessions() {
        queue.submit("s1", () -> CompletableFuture.completedFuture("a")).join();
        queue.submit("s2", () -> CompletableFuture.completedFuture("b")).join();

        assertEquals(0, queue.activeSessions());
    }
}
