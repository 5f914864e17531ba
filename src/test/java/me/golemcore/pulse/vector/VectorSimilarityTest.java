package me.golemcore.pulse.vector;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VectorSimilarityTest {

    @Test
    void shouldComputeCosine() {
        assertEquals(1.0, VectorSimilarity.cosine(new float[] { 1, 2 }, new float[] { 2, 4 }), 1e-6);
        assertEquals(0.0, VectorSimilarity.cosine(new float[] { 1, 0 }, new float[] { 0, 1 }), 1e-6);
        assertEquals(-1.0, VectorSimilarity.cosine(new float[] { 1, 0 }, new float[] { -3, 0 }), 1e-6);
    }

    @Test
    void shouldReturnZeroForZeroVector() {
        assertEquals(0.0, VectorSimilarity.cosine(new float[] { 0, 0 }, new float[] { 1, 1 }));
    }

    @Test
    void shouldRejectDimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> VectorSimilarity.cosine(new float[] { 1 }, new float[] { 1, 2 }));
    }
}
