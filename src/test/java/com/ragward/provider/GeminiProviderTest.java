package com.ragward.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.config.JacksonConfiguration;
import com.ragward.config.RagwardProperties;
import com.ragward.exception.PermanentProviderException;
import com.ragward.exception.RateLimitException;
import com.ragward.model.ModelParameters;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GeminiProvider against a stubbed exchange.
 */
class GeminiProviderTest {

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void testGenerateContentConcatenatesParts() {
        GeminiProvider provider = provider("v1beta", HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hall \"},{\"text\":\"sensors.\"}]}}]}");

        StepVerifier.create(provider.invokeText("Compare sensor types", ModelParameters.defaults()))
                .expectNext("Hall sensors.")
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertEquals("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent",
                request.url().toString());
        assertEquals("secret", request.headers().getFirst("x-goog-api-key"));
        assertFalse(request.url().toString().contains("secret"));
    }

    @Test
    void testAzureStyleApiVersionFallsBackToV1beta() {
        GeminiProvider provider = provider("2024-12-01-preview", HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"ok\"}]}}]}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectNext("ok")
                .verifyComplete();

        assertTrue(lastRequest.get().url().getPath().startsWith("/v1beta/"));
    }

    @Test
    void testBlockedPromptIsPermanent() {
        GeminiProvider provider = provider("v1beta", HttpStatus.OK,
                "{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(PermanentProviderException.class, error);
                    assertTrue(error.getMessage().contains("SAFETY"));
                })
                .verify();
    }

    @Test
    void testResourceExhaustedIsRateLimit() {
        GeminiProvider provider = provider("v1beta", HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"code\":429,\"status\":\"RESOURCE_EXHAUSTED\"}}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectError(RateLimitException.class)
                .verify();
    }

    @Test
    void testBatchEmbedContents() {
        GeminiProvider provider = provider("v1beta", HttpStatus.OK,
                "{\"embeddings\":[{\"values\":[1.0,0.0]},{\"values\":[0.0,1.0]}]}");

        StepVerifier.create(provider.invokeEmbedding(List.of("first", "second")))
                .assertNext(vectors -> {
                    assertArrayEquals(new float[]{1.0f, 0.0f}, vectors.get(0));
                    assertArrayEquals(new float[]{0.0f, 1.0f}, vectors.get(1));
                })
                .verifyComplete();

        assertEquals("https://generativelanguage.googleapis.com/v1beta/models/text-embedding-004:batchEmbedContents",
                lastRequest.get().url().toString());
    }

    private GeminiProvider provider(String apiVersion, HttpStatus status, String body) {
        RagwardProperties.ProviderConfig config = new RagwardProperties.ProviderConfig(
                RagwardProperties.ProviderType.GEMINI, "https://generativelanguage.googleapis.com", "secret",
                "gemini-1.5-flash", apiVersion, "text-embedding-004", "v1beta", 2);

        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new GeminiProvider(webClient, config, objectMapper);
    }
}
