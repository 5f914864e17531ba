package me.golemcore.pulse.infrastructure.concurrent;

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

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * {@link CompletableFuture} whose cancellation, or exceptional completion from
 * outside such as {@link CompletableFuture#orTimeout}, interrupts the worker
 * thread running the task. Plain {@code CompletableFuture.supplyAsync} never
 * interrupts, which would leave blocked HTTP calls running after a timeout.
 */
public final class InterruptibleFuture<T> extends CompletableFuture<T> {

    private volatile Future<?> task;

    private InterruptibleFuture() {
    }

    public static <T> InterruptibleFuture<T> supplyAsync(Callable<T> callable, ExecutorService executor) {
        InterruptibleFuture<T> future = new InterruptibleFuture<>();
        future.task = executor.submit(() -> {
            try {
                future.complete(callable.call());
            } catch (Throwable e) {
                future.completeWithFailure(e);
            }
        });
        if (future.isDone()) {
            future.task.cancel(true);
        }
        return future;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        interruptTask();
        return cancelled;
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        boolean completed = super.completeExceptionally(ex);
        if (completed) {
            interruptTask();
        }
        return completed;
    }

    private void completeWithFailure(Throwable e) {
        super.completeExceptionally(e instanceof CompletionException && e.getCause() != null ? e.getCause() : e);
    }

    private void interruptTask() {
        Future<?> current = task;
        if (current != null) {
            current.cancel(true);
        }
    }
}
