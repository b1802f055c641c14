package com.ragward.controller;

import com.ragward.model.dto.EmbeddingRequestDto;
import com.ragward.model.dto.EmbeddingResponseDto;
import com.ragward.provider.EmbeddingProvider;
import com.ragward.service.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1")
public class EmbeddingController {

    private final EmbeddingService embeddingService;
    private final EmbeddingProvider provider;

    public EmbeddingController(EmbeddingService embeddingService, EmbeddingProvider provider) {
        this.embeddingService = embeddingService;
        this.provider = provider;
    }

    @PostMapping(value = "/embeddings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<EmbeddingResponseDto> embed(@RequestBody EmbeddingRequestDto request) {
        log.info("Received embedding request: {} texts",
                request.getInput() != null ? request.getInput().size() : 0);

        return embeddingService.embed(request.getInput())
                .map(vectors -> {
                    List<EmbeddingResponseDto.Item> items = new ArrayList<>(vectors.size());
                    for (int i = 0; i < vectors.size(); i++) {
                        items.add(new EmbeddingResponseDto.Item(i, vectors.get(i)));
                    }
                    return EmbeddingResponseDto.builder()
                            .model(provider.getEmbeddingModel())
                            .dimensions(provider.getDimensions())
                            .data(items)
                            .build();
                });
    }
}
