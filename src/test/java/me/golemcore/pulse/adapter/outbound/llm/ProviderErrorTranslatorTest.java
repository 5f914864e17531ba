package me.golemcore.pulse.adapter.outbound.llm;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.port.outbound.ProviderException;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderErrorTranslatorTest {

    @Test
    void shouldMapLangchainExceptions() {
        assertEquals(ErrorKind.RATE_LIMIT, ProviderErrorTranslator.classify(new RateLimitException("slow down")));
        assertEquals(ErrorKind.AUTH, ProviderErrorTranslator.classify(new AuthenticationException("bad key")));
    }

    @Test
    void shouldMapTransportExceptionsAnywhereInCauseChain() {
        assertEquals(ErrorKind.CONNECTIVITY, ProviderErrorTranslator.classify(
                new RuntimeException("wrapped", new ConnectException("refused"))));
        assertEquals(ErrorKind.CONNECTIVITY,
                ProviderErrorTranslator.classify(new UnknownHostException("openrouter.ai")));
        assertEquals(ErrorKind.TIMEOUT, ProviderErrorTranslator.classify(
                new RuntimeException(new SocketTimeoutException("read timed out"))));
    }

    @Test
    void shouldFallBackToMessageFragments() {
        assertEquals(ErrorKind.RATE_LIMIT,
                ProviderErrorTranslator.classify(new RuntimeException("HTTP 429 Too Many Requests")));
        assertEquals(ErrorKind.AUTH,
                ProviderErrorTranslator.classify(new RuntimeException("status 401: invalid_api_key")));
        assertEquals(ErrorKind.CONNECTIVITY,
                ProviderErrorTranslator.classify(new RuntimeException("Connection refused: localhost/11434")));
    }

    @Test
    void shouldTreatUnknownFailuresAsUnavailableModel() {
        assertEquals(ErrorKind.MODEL_UNAVAILABLE,
                ProviderErrorTranslator.classify(new IllegalStateException("unexpected response")));
    }

    @Test
    void shouldKeepExistingProviderException() {
        ProviderException original = new ProviderException(ErrorKind.AUTH, "m", "401");

        assertSame(original, ProviderErrorTranslator.translate(original, "m"));
    }

    @Test
    void shouldWrapWithModelIdAndCause() {
        IllegalStateException cause = new IllegalStateException("boom");

        ProviderException translated = ProviderErrorTranslator.translate(cause, "hermes");

        assertEquals(ErrorKind.MODEL_UNAVAILABLE, translated.getKind());
        assertEquals("hermes", translated.getModelId());
        assertSame(cause, translated.getCause());
        assertTrue(translated.getMessage().contains("hermes"));
    }
}
