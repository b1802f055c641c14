package com.ragward.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-query outcome inside a batch response. Exactly one of result and error is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemDto {

    @JsonProperty("index")
    private int index;

    @JsonProperty("result")
    private QueryResponseDto result;

    @JsonProperty("error")
    private ErrorResponseDto error;
}
