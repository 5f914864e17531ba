package me.golemcore.pulse.persistence;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Serializes history writes per session.
 *
 * <p>
 * Each submitted write starts only after the previous write of the same
 * session has completed, successfully or not. Writes of different sessions
 * run in parallel. Finished chains are dropped from the map so idle sessions
 * hold no state.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SessionWriteQueue {

    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public <T> CompletableFuture<T> submit(String sessionId, Supplier<CompletableFuture<T>> write) {
        AtomicReference<CompletableFuture<T>> holder = new AtomicReference<>();
        tails.compute(sessionId, (key, tail) -> {
            CompletableFuture<?> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            CompletableFuture<T> next = previous
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> start(write));
            holder.set(next);
            return next;
        });
        CompletableFuture<T> next = holder.get();
        next.whenComplete((ignored, error) -> tails.remove(sessionId, next));
        return next;
    }

    int activeSessions() {
        return tails.size();
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> write) {
        try {
            return write.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
