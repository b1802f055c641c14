package com.ragward.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body: {@code {error, message, cause}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDto {

    /**
     * Error kind in lower case (e.g., "rate_limit", "timeout").
     */
    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    /**
     * Message of the underlying error, if any.
     */
    @JsonProperty("cause")
    private String cause;
}
