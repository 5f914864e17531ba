package me.golemcore.pulse.routing;

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

import me.golemcore.pulse.domain.model.ModelUsage;
import me.golemcore.pulse.domain.model.RoutingDecision;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable routing state: the short-lived decision cache and the per-model
 * usage counters.
 *
 * <p>
 * Owned by the orchestrator and passed to every router call, so independent
 * orchestrators (and tests) never share routing state. Both maps are
 * concurrent; counters only ever grow.
 */
public class RouterState {

    private final Map<String, CachedDecision> cache = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> usage = new ConcurrentHashMap<>();

    public Optional<RoutingDecision> cachedDecision(String cacheKey, Instant now) {
        CachedDecision cached = cache.get(cacheKey);
        if (cached == null) {
            return Optional.empty();
        }
        if (cached.isExpired(now)) {
            cache.remove(cacheKey, cached);
            return Optional.empty();
        }
        return Optional.of(cached.decision());
    }

    public void cache(String cacheKey, RoutingDecision decision, Instant expiresAt, int maxSize, Instant now) {
        if (cache.size() >= maxSize) {
            evict(now, maxSize);
        }
        cache.put(cacheKey, new CachedDecision(decision, expiresAt));
    }

    public void invalidate(String cacheKey) {
        cache.remove(cacheKey);
    }

    public long recordUsage(String modelId) {
        return usage.computeIfAbsent(modelId, id -> new AtomicLong()).incrementAndGet();
    }

    public long usageCount(String modelId) {
        AtomicLong counter = usage.get(modelId);
        return counter != null ? counter.get() : 0;
    }

    /**
     * Usage per model with its share of all selections, most used first.
     */
    public List<ModelUsage> usageReport() {
        long total = usage.values().stream().mapToLong(AtomicLong::get).sum();
        List<ModelUsage> report = new ArrayList<>();
        usage.forEach((modelId, counter) -> {
            long count = counter.get();
            double percentage = total > 0 ? count * 100.0 / total : 0.0;
            report.add(new ModelUsage(modelId, count, percentage));
        });
        report.sort(Comparator.comparingLong(ModelUsage::count).reversed().thenComparing(ModelUsage::modelId));
        return report;
    }

    int cacheSize() {
        return cache.size();
    }

    private void evict(Instant now, int maxSize) {
        cache.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        if (cache.size() < maxSize) {
            return;
        }
        // Still full: drop the oldest tenth
        List<Map.Entry<String, CachedDecision>> entries = new ArrayList<>(cache.entrySet());
        entries.sort(Comparator.comparing(entry -> entry.getValue().expiresAt()));
        int toRemove = Math.max(1, entries.size() / 10);
        for (int i = 0; i < toRemove; i++) {
            cache.remove(entries.get(i).getKey());
        }
    }

    private record CachedDecision(RoutingDecision decision, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
