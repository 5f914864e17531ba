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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ProviderKind;
import me.golemcore.pulse.port.outbound.ProviderPort;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Indexes provider adapters by {@link ProviderKind}.
 *
 * <p>
 * All adapters are Spring beans; the invocation executor looks up the adapter
 * for a model's provider kind here. A kind with no adapter makes its models
 * unavailable rather than failing startup.
 *
 * @see OpenRouterProviderAdapter
 * @see OllamaProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderRegistry {

    private final List<ProviderPort> providers;

    private final Map<ProviderKind, ProviderPort> providersByKind = new EnumMap<>(ProviderKind.class);

    @PostConstruct
    public void init() {
        for (ProviderPort provider : providers) {
            ProviderPort previous = providersByKind.put(provider.getKind(), provider);
            if (previous != null) {
                log.warn("[Provider] Two adapters for {}: {} replaces {}", provider.getKind(),
                        provider.getClass().getSimpleName(), previous.getClass().getSimpleName());
            }
            log.debug("[Provider] Registered {} adapter: {}", provider.getKind(),
                    provider.getClass().getSimpleName());
        }
        for (ProviderKind kind : ProviderKind.values()) {
            ProviderPort provider = providersByKind.get(kind);
            if (provider == null) {
                log.warn("[Provider] No adapter for {}, its models are unavailable", kind);
            } else if (!provider.isAvailable()) {
                log.warn("[Provider] {} adapter is not configured", kind);
            }
        }
    }

    public Optional<ProviderPort> get(ProviderKind kind) {
        return Optional.ofNullable(providersByKind.get(kind));
    }

    public boolean isAvailable(ProviderKind kind) {
        ProviderPort provider = providersByKind.get(kind);
        return provider != null && provider.isAvailable();
    }
}
