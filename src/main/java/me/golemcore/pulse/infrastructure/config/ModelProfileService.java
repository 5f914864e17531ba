package me.golemcore.pulse.infrastructure.config;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.InvalidModelTableException;
import me.golemcore.pulse.domain.model.ModelProfile;
import me.golemcore.pulse.domain.model.ModelTable;
import me.golemcore.pulse.domain.model.ProviderKind;
import me.golemcore.pulse.domain.model.ResourceRequirement;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the static model table from {@code classpath:models.json}.
 *
 * <p>
 * The table is read once at startup and never reloaded. Any violation of the
 * table invariants (unknown leader, a hard default that is not low-resource and
 * offline-capable, missing provider kind) fails startup with
 * {@link InvalidModelTableException}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelProfileService {

    private final PulseProperties properties;
    private final ObjectMapper objectMapper;
    private volatile ModelTable table;

    public ModelProfileService(PulseProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String resourceName = properties.getRouter().getModelsResource();
        ModelsConfig config = readConfig(resourceName);
        table = toTable(config);
        log.info("[ModelConfig] Loaded {} models from classpath:{}", table.all().size(), resourceName);
    }

    public ModelTable getTable() {
        ModelTable current = table;
        if (current == null) {
            throw new IllegalStateException("Model table not loaded");
        }
        return current;
    }

    ModelsConfig readConfig(String resourceName) {
        ClassPathResource resource = new ClassPathResource(resourceName);
        if (!resource.exists()) {
            throw new InvalidModelTableException("Model table resource not found: classpath:" + resourceName);
        }
        try (InputStream is = resource.getInputStream()) {
            return objectMapper.readValue(is, ModelsConfig.class);
        } catch (IOException e) {
            throw new InvalidModelTableException("Failed to parse model table classpath:" + resourceName, e);
        }
    }

    static ModelTable toTable(ModelsConfig config) {
        List<ModelProfile> profiles = new ArrayList<>();
        for (Map.Entry<String, ModelDefinition> entry : config.getModels().entrySet()) {
            ModelDefinition definition = entry.getValue();
            if (definition.getIntents() == null || definition.getIntents().isEmpty()) {
                log.warn("[ModelConfig] Model '{}' declares no intents, it is only reachable explicitly",
                        entry.getKey());
            }
            profiles.add(ModelProfile.builder()
                    .id(entry.getKey())
                    .modelName(definition.getModelName() != null ? definition.getModelName() : entry.getKey())
                    .providerKind(definition.getProviderKind())
                    .resourceRequirement(definition.getResourceRequirement())
                    .offlineCapable(definition.isOfflineCapable())
                    .priority(definition.getPriority())
                    .intents(definition.getIntents() != null ? definition.getIntents() : Set.of())
                    .description(definition.getDescription())
                    .build());
        }
        return ModelTable.of(profiles, config.getLeaderModel(), config.getFallbackModel(),
                config.getIntentDescriptions());
    }

    /**
     * Root of models.json.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        private String leaderModel;
        private String fallbackModel;
        private Map<String, String> intentDescriptions = new LinkedHashMap<>();
        private Map<String, ModelDefinition> models = new LinkedHashMap<>();
    }

    /**
     * One model entry, keyed by its routing id.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelDefinition {
        private String modelName;
        private ProviderKind providerKind;
        private ResourceRequirement resourceRequirement;
        private boolean offlineCapable;
        private int priority = 1;
        private Set<String> intents = new HashSet<>();
        private String description;
    }
}
