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

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter: {@code base * factor^attempt},
 * scaled by a random factor in {@code [1 - jitter, 1 + jitter)}.
 */
@Component
@RequiredArgsConstructor
public class BackoffPolicy {

    private final PulseProperties properties;

    /**
     * @param attempt
     *            zero-based index of the attempt that just failed
     */
    public Duration delay(int attempt) {
        PulseProperties.ExecutorProperties config = properties.getExecutor();
        double baseMs = config.getBackoffBase().toMillis() * Math.pow(config.getBackoffFactor(), attempt);
        double jitter = config.getBackoffJitter();
        double scale = jitter > 0 ? 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter) : 1.0;
        return Duration.ofMillis(Math.max(0, Math.round(baseMs * scale)));
    }
}
