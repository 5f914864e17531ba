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

/**
 * Classification of every failure the orchestrator can surface.
 * <ul>
 * <li>Retryable locally: {@link #CONNECTIVITY}, {@link #RATE_LIMIT},
 * {@link #TIMEOUT}</li>
 * <li>Fatal for the operation: {@link #AUTH}, {@link #VALIDATION},
 * {@link #CANCELLED}</li>
 * <li>Routing signals: {@link #MODEL_UNAVAILABLE},
 * {@link #STORAGE_UNAVAILABLE}, {@link #CIRCUIT_OPEN}</li>
 * </ul>
 */
public enum ErrorKind {

    CONNECTIVITY(true, false,
            "I can't reach the model providers right now. Please check your connection and try again."),
    AUTH(false, true,
            "The model provider rejected the configured credentials. Please check the API key."),
    RATE_LIMIT(true, false,
            "The model providers are rate limiting requests. Please try again in a moment."),
    TIMEOUT(true, false,
            "The model took too long to respond. Please try again."),
    MODEL_UNAVAILABLE(false, false,
            "No model is available to answer right now."),
    STORAGE_UNAVAILABLE(false, false,
            "Conversation storage is unavailable right now."),
    CIRCUIT_OPEN(false, false,
            "All suitable models are temporarily disabled after repeated failures. Please try again shortly."),
    VALIDATION(false, true,
            "The request was rejected as invalid."),
    CANCELLED(false, true,
            "The request was cancelled.");

    private final boolean retryable;
    private final boolean fatal;
    private final String userMessage;

    ErrorKind(boolean retryable, boolean fatal, String userMessage) {
        this.retryable = retryable;
        this.fatal = fatal;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isFatal() {
        return fatal;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
