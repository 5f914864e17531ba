package me.golemcore.pulse.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void shouldCancelRegisteredFutures() {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<String> future = new CompletableFuture<>();
        token.register(future);

        assertTrue(token.cancel("superseded"));

        assertTrue(future.isCancelled());
        assertTrue(token.isCancelled());
        assertEquals("superseded", token.getReason());
    }

    @Test
    void shouldCancelOnlyOnce() {
        CancellationToken token = CancellationToken.create();

        assertTrue(token.cancel("first"));
        assertFalse(token.cancel("second"));
        assertEquals("first", token.getReason());
    }

    @Test
    void shouldCancelFutureRegisteredAfterCancellation() {
        CancellationToken token = CancellationToken.create();
        token.cancel("user");
        CompletableFuture<String> future = new CompletableFuture<>();

        token.register(future);

        assertTrue(future.isCancelled());
    }

    @Test
    void shouldNotCancelFutureAfterRegistrationIsClosed() {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<String> future = new CompletableFuture<>();
        try (CancellationToken.Registration ignored = token.register(future)) {
            future.complete("done");
        }
        CompletableFuture<String> detached = new CompletableFuture<>();
        token.register(detached).close();

        token.cancel("late");

        assertFalse(detached.isCancelled());
        assertEquals("done", future.join());
    }

    @Test
    void shouldSleepFullDurationWhenNotCancelled() {
        assertTrue(CancellationToken.create().sleep(Duration.ofMillis(5)));
    }

    @Test
    void shouldWakeUpSleeperOnCancel() {
        CancellationToken token = CancellationToken.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> token.cancel("stop"), 50, TimeUnit.MILLISECONDS);

            boolean slept = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> token.sleep(Duration.ofMinutes(5)));

            assertFalse(slept);
        } finally {
            scheduler.shutdownNow();
        }
    }
}
