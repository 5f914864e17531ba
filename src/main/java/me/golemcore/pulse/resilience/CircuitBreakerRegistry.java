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
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and owns one {@link CircuitBreaker} per named dependency
 * ({@code primary.save}, {@code backup.findById}, {@code provider.<modelId>},
 * ...). Breakers are created lazily with the configured threshold and reset
 * timeout.
 *
 * @since 1.0
 */
@Component
public class CircuitBreakerRegistry {

    private final PulseProperties properties;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(PulseProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public CircuitBreaker breaker(String dependencyName) {
        return breakers.computeIfAbsent(dependencyName, name -> new CircuitBreaker(
                name,
                properties.getBreaker().getFailureThreshold(),
                properties.getBreaker().getResetTimeout(),
                clock));
    }

    /**
     * Immutable state views of all breakers created so far, sorted by name.
     */
    public List<CircuitBreakerState> states() {
        return breakers.values().stream()
                .map(CircuitBreaker::getState)
                .sorted(Comparator.comparing(CircuitBreakerState::getDependencyName))
                .toList();
    }
}
