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
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Static description of a routable model, loaded once from the model table.
 */
@Value
@Builder
public class ModelProfile {

    /** Routing identifier, unique within the table. */
    String id;

    /** Model name as the provider expects it. */
    String modelName;

    ProviderKind providerKind;
    ResourceRequirement resourceRequirement;
    boolean offlineCapable;

    /** Lower value wins among candidates for the same intent. */
    int priority;

    @Singular
    Set<String> intents;

    String description;

    public boolean supportsIntent(String intent) {
        return intent != null && intents.contains(intent);
    }
}
