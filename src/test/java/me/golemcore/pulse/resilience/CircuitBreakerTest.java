package me.golemcore.pulse.resilience;

import me.golemcore.pulse.domain.model.CircuitState;
import me.golemcore.pulse.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration RESET_TIMEOUT = Duration.ofSeconds(30);

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        breaker = new CircuitBreaker("primary.save", 3, RESET_TIMEOUT, clock);
    }

    // ===== Closed =====

    @Test
    void shouldStayClosedBelowThreshold() {
        fail(2);

        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
        assertEquals(2, breaker.getState().getFailureCount());
    }

    @Test
    void shouldResetFailureCountOnSuccess() {
        fail(2);
        breaker.execute(() -> CompletableFuture.completedFuture("ok")).join();
        fail(2);

        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
        assertEquals(2, breaker.getState().getFailureCount());
    }

    @Test
    void shouldPassThroughResult() {
        String result = breaker.execute(() -> CompletableFuture.completedFuture("value")).join();

        assertEquals("value", result);
    }

    @Test
    void shouldCountSupplierThatThrowsAsFailure() {
        for (int i = 0; i < 3; i++) {
            CompletableFuture<String> future = breaker.execute(() -> {
                throw new IllegalStateException("boom");
            });
            assertTrue(future.isCompletedExceptionally());
        }

        assertEquals(CircuitState.OPEN, breaker.getState().getState());
    }

    // ===== Open =====

    @Test
    void shouldOpenAtThreshold() {
        fail(3);

        assertEquals(CircuitState.OPEN, breaker.getState().getState());
        assertEquals(START, breaker.getState().getOpenedAt());
    }

    @Test
    void shouldRejectWithoutCallingWhenOpen() {
        fail(3);
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> rejected = breaker.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });

        CompletionException error = assertThrows(CompletionException.class, rejected::join);
        assertInstanceOf(CircuitOpenException.class, error.getCause());
        assertEquals("primary.save", ((CircuitOpenException) error.getCause()).getDependencyName());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldKeepRejectingUntilResetTimeoutElapses() {
        fail(3);
        clock.advance(RESET_TIMEOUT.minusMillis(1));

        assertEquals(CircuitState.OPEN, breaker.getState().getState());
        assertTrue(breaker.execute(() -> CompletableFuture.completedFuture("x")).isCompletedExceptionally());
    }

    // ===== Half-open =====

    @Test
    void shouldReportHalfOpenOnceResetTimeoutElapsed() {
        fail(3);
        clock.advance(RESET_TIMEOUT);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState().getState());
    }

    @Test
    void shouldAllowSingleTrialCallWhenHalfOpen() {
        fail(3);
        clock.advance(RESET_TIMEOUT);
        CompletableFuture<String> pendingTrial = new CompletableFuture<>();
        AtomicInteger secondCalls = new AtomicInteger();

        CompletableFuture<String> trial = breaker.execute(() -> pendingTrial);
        CompletableFuture<String> concurrent = breaker.execute(() -> {
            secondCalls.incrementAndGet();
            return CompletableFuture.completedFuture("second");
        });

        CompletionException error = assertThrows(CompletionException.class, concurrent::join);
        assertInstanceOf(CircuitOpenException.class, error.getCause());
        assertEquals(0, secondCalls.get());

        pendingTrial.complete("recovered");
        assertEquals("recovered", trial.join());
        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
        assertEquals(0, breaker.getState().getFailureCount());
    }

    @Test
    void shouldLetExactlyOneOfTwoRacingCallersRunTheTrial() throws Exception {
        fail(3);
        clock.advance(RESET_TIMEOUT);
        CompletableFuture<String> pendingTrial = new CompletableFuture<>();
        AtomicInteger invocations = new AtomicInteger();
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<CompletableFuture<String>> caller = () -> {
                ready.countDown();
                go.await();
                return breaker.execute(() -> {
                    invocations.incrementAndGet();
                    return pendingTrial;
                });
            };
            Future<CompletableFuture<String>> first = pool.submit(caller);
            Future<CompletableFuture<String>> second = pool.submit(caller);
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();

            List<CompletableFuture<String>> results = List.of(
                    first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));

            assertEquals(1, invocations.get());
            long rejected = results.stream().filter(CompletableFuture::isCompletedExceptionally).count();
            assertEquals(1, rejected);
            pendingTrial.complete("recovered");
            assertEquals(CircuitState.CLOSED, breaker.getState().getState());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldNotCountArgumentErrorsAsFailures() {
        for (int i = 0; i < 5; i++) {
            breaker.<String>execute(() -> CompletableFuture.failedFuture(new IllegalArgumentException("bad id")))
                    .exceptionally(e -> null)
                    .join();
            breaker.<String>execute(() -> {
                throw new IllegalArgumentException("bad id");
            }).exceptionally(e -> null).join();
        }

        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
        assertEquals(0, breaker.getState().getFailureCount());
    }

    @Test
    void shouldFreeTrialWhenTrialFailsWithArgumentError() {
        fail(3);
        clock.advance(RESET_TIMEOUT);

        breaker.<String>execute(() -> CompletableFuture.failedFuture(new IllegalArgumentException("bad id")))
                .exceptionally(e -> null)
                .join();
        String next = breaker.execute(() -> CompletableFuture.completedFuture("next")).join();

        assertEquals("next", next);
        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
    }

    @Test
    void shouldReopenWhenTrialFails() {
        fail(3);
        clock.advance(RESET_TIMEOUT);
        Instant trialTime = clock.instant();

        fail(1);

        assertEquals(CircuitState.OPEN, breaker.getState().getState());
        assertEquals(trialTime, breaker.getState().getOpenedAt());
        assertTrue(breaker.execute(() -> CompletableFuture.completedFuture("x")).isCompletedExceptionally());
    }

    @Test
    void shouldFreeTrialWhenTrialIsCancelled() {
        fail(3);
        clock.advance(RESET_TIMEOUT);
        CompletableFuture<String> pendingTrial = new CompletableFuture<>();

        CompletableFuture<String> trial = breaker.execute(() -> pendingTrial);
        trial.cancel(true);

        assertTrue(pendingTrial.isCancelled());
        String next = breaker.execute(() -> CompletableFuture.completedFuture("next")).join();
        assertEquals("next", next);
        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
    }

    @Test
    void shouldRejectInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 0, RESET_TIMEOUT, clock));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.<String>execute(() -> CompletableFuture.failedFuture(new IllegalStateException("down")))
                    .exceptionally(e -> null)
                    .join();
        }
    }
}
