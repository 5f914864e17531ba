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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ModelTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans and the startup summary.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>The system {@link Clock}, injected everywhere time matters</li>
 * <li>The application {@link ObjectMapper} with Java time support</li>
 * <li>Daemon executors for provider calls, invocation pipelines and blocking
 * storage I/O</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final PulseProperties properties;
    private final ModelProfileService modelProfileService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Workers that block in provider HTTP calls. Unbounded so that a cancelled
     * call stuck in I/O never starves new ones.
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService providerCallExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("provider-call"));
    }

    /**
     * Runs invocation pipelines (retry loops and backoff waits).
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService invocationExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("invocation"));
    }

    /**
     * Blocking driver calls against the networked primary store.
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService storageExecutor() {
        return Executors.newFixedThreadPool(4, daemonThreads("storage"));
    }

    @PostConstruct
    public void init() {
        ModelTable table = modelProfileService.getTable();
        log.info("PULSE orchestrator starting...");
        log.info("Models: {} (leader: {}, default: {})", table.all().size(), table.leader().getId(),
                table.fallback().getId());
        log.info("Primary store: {}/{}", properties.getStorage().getPrimary().getUri(),
                properties.getStorage().getPrimary().getDatabase());
        log.info("Backup storage path: {}", properties.getStorage().getLocal().getBasePath());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
