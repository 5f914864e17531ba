package me.golemcore.pulse.adapter.outbound.llm;

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

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.util.Locale;

/**
 * Maps langchain4j and transport exceptions to {@link ProviderException}
 * kinds.
 *
 * <p>
 * The whole cause chain is inspected, typed exceptions first, then well-known
 * message fragments (HTTP status codes, provider error codes) for providers
 * that report errors only in the response body. Anything unrecognized is
 * {@link ErrorKind#MODEL_UNAVAILABLE}, which makes the executor move on to the
 * next model.
 */
public final class ProviderErrorTranslator {

    private ProviderErrorTranslator() {
    }

    public static ProviderException translate(Throwable error, String modelId) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        ErrorKind kind = classify(error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ProviderException(kind, modelId, "Model " + modelId + " failed: " + message, error);
    }

    static ErrorKind classify(Throwable error) {
        ErrorKind typed = classifyByType(error);
        if (typed != null) {
            return typed;
        }
        ErrorKind byMessage = classifyByMessage(error);
        return byMessage != null ? byMessage : ErrorKind.MODEL_UNAVAILABLE;
    }

    private static ErrorKind classifyByType(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProviderException providerException) {
                return providerException.getKind();
            }
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return ErrorKind.RATE_LIMIT;
            }
            if (current instanceof dev.langchain4j.exception.AuthenticationException) {
                return ErrorKind.AUTH;
            }
            if (current instanceof dev.langchain4j.exception.ModelNotFoundException) {
                return ErrorKind.MODEL_UNAVAILABLE;
            }
            if (current instanceof dev.langchain4j.exception.InvalidRequestException) {
                return ErrorKind.VALIDATION;
            }
            if (current instanceof dev.langchain4j.exception.InternalServerException) {
                return ErrorKind.MODEL_UNAVAILABLE;
            }
            if (current instanceof HttpConnectTimeoutException || current instanceof ConnectException
                    || current instanceof UnknownHostException || current instanceof NoRouteToHostException) {
                return ErrorKind.CONNECTIVITY;
            }
            if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException
                    || current instanceof java.util.concurrent.TimeoutException) {
                return ErrorKind.TIMEOUT;
            }
            if (current instanceof InterruptedException || current instanceof ClosedByInterruptException
                    || current instanceof InterruptedIOException) {
                return ErrorKind.CANCELLED;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorKind classifyByMessage(Throwable error) {
        Throwable current = error;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("rate_limit") || lower.contains("too many requests") || lower.contains("429")
                        || lower.contains("quota")) {
                    return ErrorKind.RATE_LIMIT;
                }
                if (lower.contains("401") || lower.contains("403") || lower.contains("unauthorized")
                        || lower.contains("invalid_api_key") || lower.contains("invalid api key")) {
                    return ErrorKind.AUTH;
                }
                if (lower.contains("timed out") || lower.contains("timeout")) {
                    return ErrorKind.TIMEOUT;
                }
                if (lower.contains("connection refused") || lower.contains("failed to connect")) {
                    return ErrorKind.CONNECTIVITY;
                }
            }
            current = current.getCause();
        }
        return null;
    }
}
