package com.ragward.resilience;

import com.ragward.exception.ErrorKind;
import com.ragward.exception.InputException;
import com.ragward.exception.MediationException;
import com.ragward.exception.ProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProviderErrorClassifier.
 */
class ProviderErrorClassifierTest {

    @Test
    void testTooManyRequestsIsRateLimit() {
        MediationException error = ProviderErrorClassifier.classify("gemini", response(429, "slow down"));

        assertEquals(ErrorKind.RATE_LIMIT, error.getKind());
        assertEquals(429, ((ProviderException) error).getStatusCode());
        assertTrue(error.isRetryable());
    }

    @Test
    void testQuotaBodyIsRateLimit() {
        MediationException error = ProviderErrorClassifier.classify("gemini",
                response(403, "{\"error\":{\"status\":\"RESOURCE_EXHAUSTED\"}}"));

        assertEquals(ErrorKind.RATE_LIMIT, error.getKind());
    }

    @Test
    void testServerErrorIsTransient() {
        assertEquals(ErrorKind.TRANSIENT_PROVIDER,
                ProviderErrorClassifier.classify("azure-openai", response(503, "unavailable")).getKind());
        assertEquals(ErrorKind.TRANSIENT_PROVIDER,
                ProviderErrorClassifier.classify("azure-openai", response(500, "")).getKind());
    }

    @Test
    void testClientErrorsArePermanent() {
        for (int status : new int[]{400, 401, 403, 404}) {
            MediationException error = ProviderErrorClassifier.classify("azure-openai", response(status, "nope"));
            assertEquals(ErrorKind.PERMANENT_PROVIDER, error.getKind(), "status " + status);
            assertFalse(error.isRetryable());
        }
    }

    @Test
    void testConnectionFailuresAreTransient() {
        WebClientRequestException request = new WebClientRequestException(new ConnectException("refused"),
                HttpMethod.POST, URI.create("https://example.invalid"), HttpHeaders.EMPTY);

        assertEquals(ErrorKind.TRANSIENT_PROVIDER, ProviderErrorClassifier.classify("gemini", request).getKind());
        assertEquals(ErrorKind.TRANSIENT_PROVIDER,
                ProviderErrorClassifier.classify("gemini", new IOException("reset")).getKind());
    }

    @Test
    void testMediationErrorPassesThrough() {
        InputException input = new InputException("empty");

        assertSame(input, ProviderErrorClassifier.classify("gemini", input));
    }

    @Test
    void testLongBodiesAreTruncated() {
        MediationException error = ProviderErrorClassifier.classify("gemini", response(400, "x".repeat(5000)));

        assertTrue(error.getMessage().length() < 400);
    }

    private WebClientResponseException response(int status, String body) {
        return WebClientResponseException.create(status, "status " + status, HttpHeaders.EMPTY,
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }
}
