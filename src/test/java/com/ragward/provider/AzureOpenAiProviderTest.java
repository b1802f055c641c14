package com.ragward.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.config.JacksonConfiguration;
import com.ragward.config.RagwardProperties;
import com.ragward.exception.PermanentProviderException;
import com.ragward.exception.RateLimitException;
import com.ragward.exception.TransientProviderException;
import com.ragward.model.ModelParameters;
import org.junit.jupiter.api.BeforeEach;
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
 * Tests for AzureOpenAiProvider against a stubbed exchange.
 */
class AzureOpenAiProviderTest {

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private RagwardProperties.ProviderConfig config;

    @BeforeEach
    void setUp() {
        config = new RagwardProperties.ProviderConfig(RagwardProperties.ProviderType.AZURE_OPENAI,
                "https://example.openai.azure.com/", "secret", "gpt-4o", "2024-12-01-preview",
                "text-embedding-3-large", "2024-02-01", 3);
    }

    @Test
    void testChatCompletion() {
        AzureOpenAiProvider provider = provider(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Thermocouples.\"},"
                        + "\"finish_reason\":\"stop\"}]}");

        StepVerifier.create(provider.invokeText("Compare sensor types", ModelParameters.defaults()))
                .expectNext("Thermocouples.")
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertEquals("https://example.openai.azure.com/openai/deployments/gpt-4o/chat/completions"
                + "?api-version=2024-12-01-preview", request.url().toString());
        assertEquals("secret", request.headers().getFirst("api-key"));
    }

    @Test
    void testMissingContentIsPermanent() {
        AzureOpenAiProvider provider = provider(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\"},\"finish_reason\":\"content_filter\"}]}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(PermanentProviderException.class, error);
                    assertTrue(error.getMessage().contains("content_filter"));
                })
                .verify();
    }

    @Test
    void testTooManyRequestsIsRateLimit() {
        AzureOpenAiProvider provider = provider(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"code\":\"429\",\"message\":\"Rate limit is exceeded.\"}}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectError(RateLimitException.class)
                .verify();
    }

    @Test
    void testServerErrorIsTransient() {
        AzureOpenAiProvider provider = provider(HttpStatus.BAD_GATEWAY, "{}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectError(TransientProviderException.class)
                .verify();
    }

    @Test
    void testEmbeddingsOrderedByIndex() {
        AzureOpenAiProvider provider = provider(HttpStatus.OK,
                "{\"data\":["
                        + "{\"index\":1,\"embedding\":[0.4,0.5,0.6]},"
                        + "{\"index\":0,\"embedding\":[0.1,0.2,0.3]}]}");

        StepVerifier.create(provider.invokeEmbedding(List.of("first", "second")))
                .assertNext(vectors -> {
                    assertEquals(2, vectors.size());
                    assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, vectors.get(0));
                    assertArrayEquals(new float[]{0.4f, 0.5f, 0.6f}, vectors.get(1));
                })
                .verifyComplete();

        assertEquals("https://example.openai.azure.com/openai/deployments/text-embedding-3-large/embeddings"
                + "?api-version=2024-02-01", lastRequest.get().url().toString());
    }

    @Test
    void testEmbeddingCountMismatchIsPermanent() {
        AzureOpenAiProvider provider = provider(HttpStatus.OK,
                "{\"data\":[{\"index\":0,\"embedding\":[0.1,0.2,0.3]}]}");

        StepVerifier.create(provider.invokeEmbedding(List.of("first", "second")))
                .expectError(PermanentProviderException.class)
                .verify();
    }

    @Test
    void testUnconfiguredProviderFailsWithoutCall() {
        config = new RagwardProperties.ProviderConfig(RagwardProperties.ProviderType.AZURE_OPENAI,
                null, null, "gpt-4o", "2024-12-01-preview", "text-embedding-3-large", "2024-02-01", 3);
        AzureOpenAiProvider provider = provider(HttpStatus.OK, "{}");

        StepVerifier.create(provider.invokeText("question", ModelParameters.defaults()))
                .expectError(PermanentProviderException.class)
                .verify();
        assertNull(lastRequest.get());
    }

    private AzureOpenAiProvider provider(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new AzureOpenAiProvider(webClient, config, objectMapper);
    }
}
