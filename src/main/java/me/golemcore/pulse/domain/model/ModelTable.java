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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated set of model profiles together with the leader model
 * (appended to every candidate list) and the hard default used when no
 * candidate survives the resource filter.
 */
public final class ModelTable {

    private final Map<String, ModelProfile> profiles;
    private final String leaderModelId;
    private final String fallbackModelId;
    private final Map<String, String> intentDescriptions;

    private ModelTable(Map<String, ModelProfile> profiles, String leaderModelId, String fallbackModelId,
            Map<String, String> intentDescriptions) {
        this.profiles = profiles;
        this.leaderModelId = leaderModelId;
        this.fallbackModelId = fallbackModelId;
        this.intentDescriptions = intentDescriptions;
    }

    /**
     * Builds a table and checks its invariants.
     *
     * @throws InvalidModelTableException
     *             if the table is empty, ids collide, the leader is unknown, or
     *             the hard default is unknown, not {@link ResourceRequirement#LOW}
     *             or not offline-capable
     */
    public static ModelTable of(Collection<ModelProfile> models, String leaderModelId, String fallbackModelId,
            Map<String, String> intentDescriptions) {
        if (models == null || models.isEmpty()) {
            throw new InvalidModelTableException("Model table is empty");
        }
        Map<String, ModelProfile> byId = new LinkedHashMap<>();
        for (ModelProfile profile : models) {
            if (profile.getId() == null || profile.getId().isBlank()) {
                throw new InvalidModelTableException("Model without id in model table");
            }
            if (profile.getProviderKind() == null || profile.getResourceRequirement() == null) {
                throw new InvalidModelTableException(
                        "Model '" + profile.getId() + "' must declare providerKind and resourceRequirement");
            }
            if (byId.put(profile.getId(), profile) != null) {
                throw new InvalidModelTableException("Duplicate model id: " + profile.getId());
            }
        }
        if (leaderModelId == null || !byId.containsKey(leaderModelId)) {
            throw new InvalidModelTableException("Leader model '" + leaderModelId + "' is not in the model table");
        }
        ModelProfile fallback = fallbackModelId != null ? byId.get(fallbackModelId) : null;
        if (fallback == null) {
            throw new InvalidModelTableException("Default model '" + fallbackModelId + "' is not in the model table");
        }
        if (fallback.getResourceRequirement() != ResourceRequirement.LOW || !fallback.isOfflineCapable()) {
            throw new InvalidModelTableException("Default model '" + fallbackModelId
                    + "' must be LOW resource and offline-capable");
        }
        Map<String, String> descriptions = intentDescriptions != null
                ? new LinkedHashMap<>(intentDescriptions)
                : new LinkedHashMap<>();
        return new ModelTable(Collections.unmodifiableMap(byId), leaderModelId, fallbackModelId,
                Collections.unmodifiableMap(descriptions));
    }

    public Optional<ModelProfile> find(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(profiles.get(modelId));
    }

    public Collection<ModelProfile> all() {
        return profiles.values();
    }

    public ModelProfile leader() {
        return profiles.get(leaderModelId);
    }

    public ModelProfile fallback() {
        return profiles.get(fallbackModelId);
    }

    public Map<String, String> intentDescriptions() {
        return intentDescriptions;
    }

    /**
     * Profiles declaring the intent, ordered by priority ascending (table order
     * breaks ties), with the leader model appended last if it is not already
     * present.
     */
    public List<ModelProfile> candidatesFor(String intent) {
        List<ModelProfile> candidates = new ArrayList<>();
        for (ModelProfile profile : profiles.values()) {
            if (profile.supportsIntent(intent)) {
                candidates.add(profile);
            }
        }
        candidates.sort(Comparator.comparingInt(ModelProfile::getPriority));
        ModelProfile leader = leader();
        if (!candidates.contains(leader)) {
            candidates.add(leader);
        }
        return candidates;
    }
}
