package me.golemcore.pulse.port.outbound;

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

import me.golemcore.pulse.domain.model.ProviderKind;
import me.golemcore.pulse.domain.model.ProviderRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for AI model providers. One adapter exists per {@link ProviderKind}; the
 * model to call is named in the request.
 *
 * <p>
 * Failures complete the future with a {@link ProviderException} carrying the
 * error kind. Cancelling the returned future interrupts the worker that runs
 * the HTTP call.
 */
public interface ProviderPort {

    ProviderKind getKind();

    CompletableFuture<String> invoke(ProviderRequest request);

    /**
     * Whether the provider is configured (credentials, endpoint) to accept calls.
     */
    boolean isAvailable();
}
