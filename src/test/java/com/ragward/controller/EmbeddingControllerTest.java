package com.ragward.controller;

import com.ragward.exception.InputException;
import com.ragward.provider.EmbeddingProvider;
import com.ragward.service.embedding.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for EmbeddingController.
 */
class EmbeddingControllerTest {

    private EmbeddingService embeddingService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        embeddingService = mock(EmbeddingService.class);
        EmbeddingProvider provider = mock(EmbeddingProvider.class);
        when(provider.getEmbeddingModel()).thenReturn("text-embedding-3-large");
        when(provider.getDimensions()).thenReturn(2);

        client = WebTestClient.bindToController(new EmbeddingController(embeddingService, provider))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testEmbeddingsInInputOrder() {
        when(embeddingService.embed(List.of("alpha", "beta")))
                .thenReturn(Mono.just(List.of(new float[]{1.0f, 0.0f}, new float[]{0.0f, 1.0f})));

        client.post().uri("/v1/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"input\":[\"alpha\",\"beta\"]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.model").isEqualTo("text-embedding-3-large")
                .jsonPath("$.dimensions").isEqualTo(2)
                .jsonPath("$.data[0].index").isEqualTo(0)
                .jsonPath("$.data[1].embedding[1]").isEqualTo(1.0);
    }

    @Test
    void testEmptyInputIsBadRequest() {
        when(embeddingService.embed(any())).thenReturn(Mono.error(new InputException("At least one text is required")));

        client.post().uri("/v1/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"input\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("input");
    }
}
