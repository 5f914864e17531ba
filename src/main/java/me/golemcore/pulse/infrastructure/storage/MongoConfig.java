package me.golemcore.pulse.infrastructure.storage;

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

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.bson.Document;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the MongoDB primary store.
 *
 * <p>
 * Server selection and socket timeouts are bounded by the repository storage
 * timeout, so an unreachable server fails calls instead of parking storage
 * threads for the driver's 30 second default.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class MongoConfig {

    private final PulseProperties properties;

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient() {
        long timeoutMs = properties.getRepository().getTimeout().toMillis();
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(properties.getStorage().getPrimary().getUri()))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout((int) timeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout((int) timeoutMs, TimeUnit.MILLISECONDS))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoCollection<Document> entityCollection(MongoClient mongoClient) {
        PulseProperties.PrimaryStorageProperties primary = properties.getStorage().getPrimary();
        return mongoClient.getDatabase(primary.getDatabase()).getCollection(primary.getCollection());
    }
}
