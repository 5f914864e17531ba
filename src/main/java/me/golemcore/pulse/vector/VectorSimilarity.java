package me.golemcore.pulse.vector;

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

import me.golemcore.pulse.domain.model.ScoredVectorRecord;

import java.time.Instant;
import java.util.Comparator;

/**
 * Similarity math and result ordering shared by both vector backends.
 */
public final class VectorSimilarity {

    /**
     * Score descending; equal scores rank the most recently created record
     * first.
     */
    public static final Comparator<ScoredVectorRecord> RANKING = Comparator
            .comparingDouble(ScoredVectorRecord::score).reversed()
            .thenComparing(scored -> scored.record().getCreatedAt(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private VectorSimilarity() {
    }

    /**
     * Cosine similarity in [-1, 1]; zero vectors score 0.
     *
     * @throws IllegalArgumentException
     *             if the vectors differ in length
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length");
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
