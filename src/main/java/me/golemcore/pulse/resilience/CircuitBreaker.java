package me.golemcore.pulse.resilience;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pulse.domain.model.CircuitBreakerState;
import me.golemcore.pulse.domain.model.CircuitState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Failure-counting circuit breaker guarding one dependency.
 *
 * <p>
 * State machine:
 * <ul>
 * <li><b>CLOSED</b> - calls pass; a failure increments the counter, a success
 * resets it. Reaching the threshold opens the circuit.</li>
 * <li><b>OPEN</b> - calls fail fast with {@link CircuitOpenException} until the
 * reset timeout elapses, checked lazily on the next call.</li>
 * <li><b>HALF_OPEN</b> - exactly one trial call is let through; concurrent
 * calls fail fast. Success closes the circuit, failure reopens it and restarts
 * the timer.</li>
 * </ul>
 *
 * <p>
 * All transitions happen under a single lock. A call cancelled by its caller,
 * or rejected for a bad argument ({@link IllegalArgumentException}), counts
 * neither as success nor failure and frees a half-open trial slot for the next
 * caller.
 *
 * @since 1.0
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private final Object lock = new Object();
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    /**
     * Runs the call if the breaker permits it and records the outcome.
     *
     * <p>
     * The returned future completes after the outcome has been recorded.
     * Cancelling it cancels the future produced by the call.
     *
     * @return the call's result, or a future failed with
     *         {@link CircuitOpenException} if the call was rejected
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> call) {
        if (!tryAcquirePermission()) {
            log.trace("[Breaker] {} rejected call", name);
            return CompletableFuture.failedFuture(new CircuitOpenException(name));
        }

        CompletableFuture<T> source;
        try {
            source = call.get();
        } catch (RuntimeException e) {
            recordOutcome(e);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> guarded = source.whenComplete((result, error) -> recordOutcome(error));
        guarded.whenComplete((result, error) -> {
            if (guarded.isCancelled()) {
                source.cancel(true);
            }
        });
        return guarded;
    }

    /**
     * Current state view. An open breaker whose reset timeout has elapsed is
     * reported as half-open; the actual transition happens on the next call.
     */
    public CircuitBreakerState getState() {
        synchronized (lock) {
            CircuitState reported = state;
            if (state == CircuitState.OPEN && resetTimeoutElapsed(clock.instant())) {
                reported = CircuitState.HALF_OPEN;
            }
            return CircuitBreakerState.builder()
                    .dependencyName(name)
                    .state(reported)
                    .failureCount(failureCount)
                    .lastFailureAt(lastFailureAt)
                    .openedAt(openedAt)
                    .build();
        }
    }

    boolean tryAcquirePermission() {
        synchronized (lock) {
            if (state == CircuitState.OPEN) {
                if (!resetTimeoutElapsed(clock.instant())) {
                    return false;
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = false;
            }
            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
            }
            return true;
        }
    }

    private void recordOutcome(Throwable error) {
        if (error == null) {
            onSuccess();
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof CancellationException || cause instanceof IllegalArgumentException) {
            releaseTrial();
        } else {
            onFailure(cause);
        }
    }

    private void onSuccess() {
        synchronized (lock) {
            failureCount = 0;
            trialInFlight = false;
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
                openedAt = null;
            }
        }
    }

    private void onFailure(Throwable error) {
        synchronized (lock) {
            Instant now = clock.instant();
            failureCount++;
            lastFailureAt = now;
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
                openedAt = now;
                transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
                openedAt = now;
                transitionTo(CircuitState.OPEN);
            }
            log.debug("[Breaker] {} failure {}/{}: {}", name, failureCount, failureThreshold,
                    error.getMessage());
        }
    }

    private void releaseTrial() {
        synchronized (lock) {
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
            }
        }
    }

    private boolean resetTimeoutElapsed(Instant now) {
        return openedAt != null && !now.isBefore(openedAt.plus(resetTimeout));
    }

    // Caller holds lock.
    private void transitionTo(CircuitState target) {
        if (state == target) {
            return;
        }
        if (target == CircuitState.OPEN) {
            log.warn("[Breaker] {} {} -> OPEN after {} failures", name, state, failureCount);
        } else {
            log.info("[Breaker] {} {} -> {}", name, state, target);
        }
        state = target;
    }
}
