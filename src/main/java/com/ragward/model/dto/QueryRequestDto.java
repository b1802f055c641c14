package com.ragward.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragward.model.ModelParameters;
import com.ragward.model.QueryMode;
import com.ragward.model.QueryRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Query request body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRequestDto {

    @JsonProperty("question")
    private String question;

    /**
     * Optional pinned mode: bypass, local, global, hybrid or naive.
     */
    @JsonProperty("mode")
    private QueryMode mode;

    @JsonProperty("corpus_version")
    private String corpusVersion;

    @JsonProperty("timeout_seconds")
    private Integer timeoutSeconds;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("top_p")
    private Double topP;

    public QueryRequest toQueryRequest() {
        ModelParameters defaults = ModelParameters.defaults();
        ModelParameters parameters = defaults.toBuilder()
                .temperature(temperature != null ? temperature : defaults.getTemperature())
                .maxTokens(maxTokens != null ? maxTokens : defaults.getMaxTokens())
                .topP(topP != null ? topP : defaults.getTopP())
                .build();

        return QueryRequest.builder()
                .rawText(question)
                .mode(mode)
                .corpusVersion(corpusVersion != null ? corpusVersion : "")
                .maxWait(timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null)
                .parameters(parameters)
                .build();
    }
}
