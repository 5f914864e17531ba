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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of host resources used for routing decisions.
 * <p>
 * Snapshots are immutable and replaced wholesale by the resource monitor.
 * {@code stale} marks a snapshot that was kept after a failed sample.
 */
@Value
@Builder(toBuilder = true)
public class ResourceSnapshot {

    double cpuPercent;
    long memAvailableMb;
    double memPercent;
    boolean connectivity;
    boolean localInferenceAvailable;
    Instant capturedAt;
    boolean stale;

    public Duration age(Instant now) {
        return Duration.between(capturedAt, now);
    }

    public ResourceSnapshot markStale() {
        return stale ? this : toBuilder().stale(true).build();
    }

    /**
     * Default served before the first successful sample: idle CPU, half the memory
     * in use, online, no local inference server.
     */
    public static ResourceSnapshot optimistic(Instant now) {
        return ResourceSnapshot.builder()
                .cpuPercent(0.0)
                .memAvailableMb(0)
                .memPercent(50.0)
                .connectivity(true)
                .localInferenceAvailable(false)
                .capturedAt(now)
                .stale(true)
                .build();
    }
}
