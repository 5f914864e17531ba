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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code pulse.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace files and the networked primary
 * store</li>
 * <li>{@link MonitorProperties} - resource sampling and staleness</li>
 * <li>{@link BreakerProperties} - circuit breaker thresholds</li>
 * <li>{@link RepositoryProperties} - storage timeouts and reconciliation</li>
 * <li>{@link VectorProperties} - native vector backend and result limits</li>
 * <li>{@link RouterProperties} - routing thresholds and decision cache</li>
 * <li>{@link ExecutorProperties} - model call timeout, retries and
 * backoff</li>
 * <li>{@link ProviderProperties} - per-provider endpoints and credentials</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "pulse")
@Data
public class PulseProperties {

    private StorageProperties storage = new StorageProperties();
    private MonitorProperties monitor = new MonitorProperties();
    private BreakerProperties breaker = new BreakerProperties();
    private RepositoryProperties repository = new RepositoryProperties();
    private VectorProperties vector = new VectorProperties();
    private RouterProperties router = new RouterProperties();
    private ExecutorProperties executor = new ExecutorProperties();
    private Map<String, ProviderProperties> providers = new HashMap<>();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private HttpProperties http = new HttpProperties();
    private ContextProperties context = new ContextProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private PrimaryStorageProperties primary = new PrimaryStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.pulse/workspace";
    }

    @Data
    public static class PrimaryStorageProperties {
        private String uri = "mongodb://localhost:27017";
        private String database = "pulse";
        private String collection = "entities";
    }

    @Data
    public static class DirectoriesProperties {
        private String entities = "entities";
        private String vectors = "vectors";
    }

    // ==================== RESOURCES ====================

    @Data
    public static class MonitorProperties {
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration maxStaleness = Duration.ofSeconds(30);
        private String connectivityProbeUrl = "https://openrouter.ai/api/v1/models";
        private Duration probeTimeout = Duration.ofSeconds(2);
    }

    // ==================== RESILIENCE ====================

    @Data
    public static class BreakerProperties {
        private int failureThreshold = 3;
        private Duration resetTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RepositoryProperties {
        private Duration timeout = Duration.ofSeconds(5);
        private Duration reconciliationInterval = Duration.ofSeconds(60);
        private int reconciliationBatchSize = 100;
    }

    // ==================== VECTOR ====================

    @Data
    public static class VectorProperties {
        private boolean nativeEnabled = true;
        private int defaultK = 5;
        private int maxK = 50;
        private Duration queryTimeout = Duration.ofSeconds(5);
    }

    // ==================== ROUTING ====================

    @Data
    public static class RouterProperties {
        private double minConfidence = 0.5;
        private double memoryConstrainedPercent = 80.0;
        private double cpuConstrainedPercent = 90.0;
        private Duration cacheTtl = Duration.ofSeconds(10);
        private int cacheMaxSize = 500;
        private String defaultIntent = "general";
        private List<String> commandIntents = new ArrayList<>(
                List.of("help", "status", "exit", "memory", "dashboard", "version", "clear"));
        private String modelsResource = "models.json";
        private String keywordsResource = "intent-keywords.json";
    }

    @Data
    public static class ExecutorProperties {
        private Duration modelTimeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        private Duration backoffBase = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private double backoffJitter = 0.2;
        private int maxTokens = 1024;
    }

    // ==================== PROVIDERS ====================

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class EmbeddingProperties {
        private String provider = "openai";
        private String model = "text-embedding-3-small";
        private Integer dimensions;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        private int maxTokens = 500;
        private double turnShare = 0.8;
        private int recentTurns = 5;
        private int relatedMemories = 3;
        private int charsPerToken = 4;
    }
}
