package me.golemcore.pulse.routing;

import me.golemcore.pulse.domain.model.IntentClassification;
import me.golemcore.pulse.domain.model.ModelTable;
import me.golemcore.pulse.infrastructure.config.ModelProfileService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.EmbeddingPort;
import me.golemcore.pulse.testsupport.ModelTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SemanticIntentClassifierTest {

    private static final float[] CODE_VECTOR = { 1f, 0f, 0f };
    private static final float[] GENERAL_VECTOR = { 0f, 1f, 0f };

    private EmbeddingPort embeddingPort;
    private SemanticIntentClassifier classifier;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        ModelProfileService modelProfileService = mock(ModelProfileService.class);
        ModelTable table = ModelTables.sample();
        when(modelProfileService.getTable()).thenReturn(table);
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embedBatch(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(text.startsWith("code:") ? CODE_VECTOR : GENERAL_VECTOR);
            }
            return CompletableFuture.completedFuture(vectors);
        });
        classifier = new SemanticIntentClassifier(embeddingPort, modelProfileService, new PulseProperties());
    }

    @Test
    void shouldPickIntentWithMostSimilarDescription() {
        when(embeddingPort.embed("sort a list in place"))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 0.8f, 0.6f, 0f }));

        IntentClassification result = classifier.classify("sort a list in place");

        assertEquals("code", result.intent());
        assertEquals(0.8, result.confidence(), 1e-6);
    }

    @Test
    void shouldFloorNegativeSimilarityAtZero() {
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.completedFuture(new float[] { -1f, -1f, 0f }));

        IntentClassification result = classifier.classify("something odd");

        assertEquals(0.0, result.confidence());
    }

    @Test
    void shouldIndexDescriptionsOnlyOnce() {
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 0f, 1f, 0f }));

        classifier.classify("hello there");
        classifier.classify("how are you");

        verify(embeddingPort, times(1)).embedBatch(anyList());
        verify(embeddingPort, times(2)).embed(anyString());
    }

    @Test
    void shouldReturnNoneWhenEmbedderIsUnavailable() {
        when(embeddingPort.isAvailable()).thenReturn(false);

        IntentClassification result = classifier.classify("sort a list");

        assertTrue(result.isEmpty());
        verify(embeddingPort, never()).embed(any());
    }

    @Test
    void shouldReturnNoneWhenEmbeddingFails() {
        when(embeddingPort.embed(eq("boom")))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection refused")));

        IntentClassification result = classifier.classify("boom");

        assertTrue(result.isEmpty());
    }

    @Test
    void shouldRetryIndexingAfterFailure() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")))
                .thenReturn(CompletableFuture.completedFuture(List.of(GENERAL_VECTOR, CODE_VECTOR)));
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f, 0f }));

        assertTrue(classifier.classify("first").isEmpty());
        IntentClassification second = classifier.classify("second");

        assertEquals(1.0, second.confidence(), 1e-6);
        verify(embeddingPort, times(2)).embedBatch(anyList());
    }
}
