package me.golemcore.pulse;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the PULSE orchestrator.
 *
 * <p>
 * PULSE is a single-user personal assistant that dispatches queries to
 * interchangeable AI model providers and keeps conversation state across
 * several storage backends. It provides:
 * <ul>
 * <li>Adaptive model routing driven by intent, resource constraints and live
 * system health</li>
 * <li>Retrying, escalating model invocation guarded by circuit breakers</li>
 * <li>Primary/backup persistence with background reconciliation</li>
 * <li>Semantic recall over a vector index that degrades to brute-force
 * search</li>
 * </ul>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class PulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseApplication.class, args);
    }
}
