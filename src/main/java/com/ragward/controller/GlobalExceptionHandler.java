package com.ragward.controller;

import com.ragward.exception.MediationException;
import com.ragward.model.dto.ErrorResponseDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Locale;

/**
 * Maps mediation failures onto HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MediationException.class)
    public ResponseEntity<ErrorResponseDto> handleMediation(MediationException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("[{}] {}", ex.getKind(), ex.getMessage());
        } else {
            log.warn("[{}] {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(toBody(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[INPUT] {}", ex.getMessage());
        return ResponseEntity.badRequest().body(toBody(ex));
    }

    /**
     * HTTP status for a failure: INPUT 400, RATE_LIMIT 429, PERMANENT 502, TRANSIENT 503, TIMEOUT 504.
     */
    public static HttpStatus statusFor(Throwable error) {
        if (error instanceof MediationException mediation) {
            return switch (mediation.getKind()) {
                case INPUT -> HttpStatus.BAD_REQUEST;
                case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
                case PERMANENT_PROVIDER -> HttpStatus.BAD_GATEWAY;
                case TRANSIENT_PROVIDER -> HttpStatus.SERVICE_UNAVAILABLE;
                case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            };
        }
        if (error instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    public static ErrorResponseDto toBody(Throwable error) {
        String kind = error instanceof MediationException mediation
                ? mediation.getKind().name().toLowerCase(Locale.ROOT)
                : error instanceof IllegalArgumentException ? "input" : "internal";

        Throwable cause = error.getCause();
        return ErrorResponseDto.builder()
                .error(kind)
                .message(error.getMessage())
                .cause(cause != null && cause != error ? cause.getMessage() : null)
                .build();
    }
}
