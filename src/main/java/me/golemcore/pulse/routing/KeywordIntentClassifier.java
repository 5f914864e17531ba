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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.IntentClassification;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.IntentClassifierPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-overlap intent classifier, used when the semantic classifier is
 * unsure or unavailable.
 *
 * <p>
 * The query is lower-cased, tokenized and stripped of stopwords. Every token
 * matching an intent keyword scores one point for that intent; keywords
 * containing spaces match as phrases. The best-scoring intent wins (table order
 * breaks ties) with confidence equal to its share of all points. No matching
 * keyword yields {@link IntentClassification#none()}.
 *
 * <p>
 * Keywords are loaded from {@code classpath:intent-keywords.json}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class KeywordIntentClassifier implements IntentClassifierPort {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_+#]+");

    private final Map<String, Set<String>> keywordsByIntent;
    private final Set<String> stopwords;

    @Autowired
    public KeywordIntentClassifier(PulseProperties properties, ObjectMapper objectMapper) {
        KeywordTable table = load(properties.getRouter().getKeywordsResource(), objectMapper);
        this.keywordsByIntent = normalize(table.getIntents());
        this.stopwords = lowerCase(table.getStopwords());
        log.info("[KeywordClassifier] Loaded keywords for {} intents", keywordsByIntent.size());
    }

    public KeywordIntentClassifier(Map<String, ? extends Collection<String>> keywordsByIntent,
            Collection<String> stopwords) {
        this.keywordsByIntent = normalize(keywordsByIntent);
        this.stopwords = lowerCase(stopwords);
    }

    @Override
    public IntentClassification classify(String text) {
        if (text == null || text.isBlank()) {
            return IntentClassification.none();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        List<String> tokens = tokenize(normalized);

        Map<String, Integer> scores = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, Set<String>> entry : keywordsByIntent.entrySet()) {
            int score = 0;
            for (String keyword : entry.getValue()) {
                if (keyword.indexOf(' ') >= 0) {
                    if (normalized.contains(keyword)) {
                        score++;
                    }
                } else {
                    score += Collections.frequency(tokens, keyword);
                }
            }
            if (score > 0) {
                scores.put(entry.getKey(), score);
                total += score;
            }
        }
        if (scores.isEmpty()) {
            log.trace("[KeywordClassifier] No keyword matched");
            return IntentClassification.none();
        }

        String bestIntent = null;
        int bestScore = 0;
        for (Map.Entry<String, Integer> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                bestIntent = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        double confidence = (double) bestScore / total;
        log.debug("[KeywordClassifier] {} (score {}/{})", bestIntent, bestScore, total);
        return new IntentClassification(bestIntent, confidence);
    }

    List<String> tokenize(String lowerCaseText) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(lowerCaseText);
        while (matcher.find()) {
            String token = matcher.group();
            if (!stopwords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static KeywordTable load(String resourceName, ObjectMapper objectMapper) {
        ClassPathResource resource = new ClassPathResource(resourceName);
        if (!resource.exists()) {
            log.warn("[KeywordClassifier] classpath:{} not found, keyword classification disabled", resourceName);
            return new KeywordTable();
        }
        try (InputStream is = resource.getInputStream()) {
            return objectMapper.readValue(is, KeywordTable.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse classpath:" + resourceName, e);
        }
    }

    private static Map<String, Set<String>> normalize(Map<String, ? extends Collection<String>> source) {
        Map<String, Set<String>> normalized = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((intent, keywords) -> normalized.put(intent, lowerCase(keywords)));
        }
        return Collections.unmodifiableMap(normalized);
    }

    private static Set<String> lowerCase(Collection<String> words) {
        Set<String> result = new HashSet<>();
        if (words != null) {
            for (String word : words) {
                if (word != null && !word.isBlank()) {
                    result.add(word.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Root of intent-keywords.json.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeywordTable {
        private List<String> stopwords = new ArrayList<>();
        private Map<String, List<String>> intents = new LinkedHashMap<>();
    }
}
