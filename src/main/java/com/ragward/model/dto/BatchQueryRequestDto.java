package com.ragward.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of queries dispatched with bounded concurrency.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchQueryRequestDto {

    @JsonProperty("queries")
    private List<QueryRequestDto> queries;
}
