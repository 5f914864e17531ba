package me.golemcore.pulse.execution;

import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.port.outbound.ProviderException;
import me.golemcore.pulse.port.outbound.StorageUnavailableException;
import me.golemcore.pulse.resilience.CircuitOpenException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ErrorClassifierTest {

    @Test
    void shouldClassifyWrappedFailuresByCause() {
        assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify(new CompletionException(new TimeoutException())));
        assertEquals(ErrorKind.CIRCUIT_OPEN,
                ErrorClassifier.classify(new CompletionException(new CircuitOpenException("provider.x"))));
        assertEquals(ErrorKind.RATE_LIMIT, ErrorClassifier.classify(
                new ExecutionException(new ProviderException(ErrorKind.RATE_LIMIT, "x", "429"))));
    }

    @Test
    void shouldClassifyCancellationAndInterruption() {
        assertEquals(ErrorKind.CANCELLED, ErrorClassifier.classify(new CancellationException()));
        assertEquals(ErrorKind.CANCELLED, ErrorClassifier.classify(new InterruptedException()));
    }

    @Test
    void shouldClassifyStorageAndValidationFailures() {
        assertEquals(ErrorKind.STORAGE_UNAVAILABLE,
                ErrorClassifier.classify(new StorageUnavailableException("primary down", new IllegalStateException("timeout"))));
        assertEquals(ErrorKind.VALIDATION, ErrorClassifier.classify(new IllegalArgumentException("bad id")));
    }

    @Test
    void shouldTreatUnknownFailuresAsUnavailableModel() {
        assertEquals(ErrorKind.MODEL_UNAVAILABLE, ErrorClassifier.classify(new IllegalStateException("boom")));
    }

    @Test
    void shouldUnwrapNestedCompletionLayers() {
        TimeoutException root = new TimeoutException();

        assertSame(root, ErrorClassifier.unwrap(new CompletionException(new ExecutionException(root))));
    }
}
