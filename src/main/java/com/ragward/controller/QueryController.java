package com.ragward.controller;

import com.ragward.exception.InputException;
import com.ragward.model.QueryRequest;
import com.ragward.model.QueryResult;
import com.ragward.model.dto.BatchItemDto;
import com.ragward.model.dto.BatchQueryRequestDto;
import com.ragward.model.dto.QueryRequestDto;
import com.ragward.model.dto.QueryResponseDto;
import com.ragward.service.BatchOutcome;
import com.ragward.service.QueryDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Question answering endpoints with cache provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class QueryController {

    public static final String CACHE_HIT = "x-cache-hit";
    public static final String QUERY_MODE = "x-query-mode";
    public static final String CACHE_KEY = "x-cache-key";

    private final QueryDispatcher dispatcher;

    public QueryController(QueryDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<QueryResponseDto>> query(@RequestBody QueryRequestDto request) {
        log.info("Received query: mode={}, timeout={}s", request.getMode(), request.getTimeoutSeconds());

        return dispatcher.dispatch(request.toQueryRequest())
                .map(result -> ResponseEntity.ok()
                        .headers(provenanceHeaders(result))
                        .body(QueryResponseDto.from(result)));
    }

    /**
     * Dispatch several questions; each item reports its own result or error.
     */
    @PostMapping(value = "/query/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<BatchItemDto>> queryBatch(@RequestBody BatchQueryRequestDto request) {
        if (request.getQueries() == null || request.getQueries().isEmpty()) {
            return Mono.error(new InputException("Batch must contain at least one query"));
        }

        List<QueryRequest> requests = request.getQueries().stream()
                .map(QueryRequestDto::toQueryRequest)
                .toList();
        log.info("Received batch of {} queries", requests.size());

        return dispatcher.dispatchAll(requests)
                .map(this::toItem)
                .collectList();
    }

    private BatchItemDto toItem(BatchOutcome outcome) {
        if (outcome.isSuccess()) {
            return BatchItemDto.builder()
                    .index(outcome.getIndex())
                    .result(QueryResponseDto.from(outcome.getResult()))
                    .build();
        }
        return BatchItemDto.builder()
                .index(outcome.getIndex())
                .error(GlobalExceptionHandler.toBody(outcome.getError()))
                .build();
    }

    private HttpHeaders provenanceHeaders(QueryResult result) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(CACHE_HIT, String.valueOf(result.isCacheHit()));
        headers.add(QUERY_MODE, result.getMode().wireName());
        if (result.getCacheKey() != null) {
            headers.add(CACHE_KEY, result.getCacheKey().getDigest());
        }
        return headers;
    }
}
