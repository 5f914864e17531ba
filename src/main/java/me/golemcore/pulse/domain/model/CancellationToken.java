package me.golemcore.pulse.domain.model;

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

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handle threaded through every external call of a
 * request.
 * <p>
 * Futures registered with the token are cancelled with interruption when the
 * token is cancelled, so workers blocked in HTTP calls are released. A future
 * registered after cancellation is cancelled immediately.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Set<Future<?>> registered = ConcurrentHashMap.newKeySet();
    private volatile String reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return {@code true} if this call cancelled the token, {@code false} if it
     *         was already cancelled
     */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason;
        cancelledLatch.countDown();
        for (Future<?> future : registered) {
            future.cancel(true);
        }
        registered.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    public Registration register(Future<?> future) {
        registered.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
        return () -> registered.remove(future);
    }

    /**
     * Waits for the given duration unless the token is cancelled first.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if the
     *         token was cancelled or the thread interrupted
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelledLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Handle returned by {@link #register(Future)}; closing it detaches the
     * future once the call it guards has finished.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
