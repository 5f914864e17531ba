package me.golemcore.pulse.execution;

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

import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.port.outbound.ProviderException;
import me.golemcore.pulse.port.outbound.StorageUnavailableException;
import me.golemcore.pulse.resilience.CircuitOpenException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures of model calls onto {@link ErrorKind}.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException || cause instanceof InterruptedException) {
            return ErrorKind.CANCELLED;
        }
        if (cause instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof CircuitOpenException) {
            return ErrorKind.CIRCUIT_OPEN;
        }
        if (cause instanceof ProviderException providerException) {
            return providerException.getKind();
        }
        if (cause instanceof StorageUnavailableException) {
            return ErrorKind.STORAGE_UNAVAILABLE;
        }
        if (cause instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.MODEL_UNAVAILABLE;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
