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

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of routing a query.
 */
@Value
@Builder(toBuilder = true)
public class RoutingDecision {

    String selectedModelId;
    String intent;
    double confidence;

    /** Candidates that survived filtering, in the order they will be tried. */
    List<String> fallbackChainConsidered;

    Instant decidedAt;
    String cacheKey;
    ResourceBucket resourceBucket;

    /** True when served from the routing cache. */
    boolean cached;
}
