package com.ragward.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Embedding response body, vectors in input order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResponseDto {

    @JsonProperty("model")
    private String model;

    @JsonProperty("dimensions")
    private int dimensions;

    @JsonProperty("data")
    private List<Item> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @JsonProperty("index")
        private int index;

        @JsonProperty("embedding")
        private float[] embedding;
    }
}
