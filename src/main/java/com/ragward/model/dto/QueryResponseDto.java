package com.ragward.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragward.model.QueryMode;
import com.ragward.model.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query response body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponseDto {

    @JsonProperty("response")
    private String response;

    @JsonProperty("mode")
    private QueryMode mode;

    @JsonProperty("cache_hit")
    private boolean cacheHit;

    @JsonProperty("cache_key")
    private String cacheKey;

    public static QueryResponseDto from(QueryResult result) {
        return QueryResponseDto.builder()
                .response(result.getResponse())
                .mode(result.getMode())
                .cacheHit(result.isCacheHit())
                .cacheKey(result.getCacheKey() != null ? result.getCacheKey().getDigest() : null)
                .build();
    }
}
