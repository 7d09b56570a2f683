package me.golemcore.sessions.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.SessionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Centralized exception handler for session API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.sessions.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SessionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSession(SessionException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("[API] {} {}: {}", status.value(), ex.getErrorCode().value(), ex.getMessage());
        } else {
            log.warn("[API] {} {}: {}", status.value(), ex.getErrorCode().value(), ex.getMessage());
        }
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(ex.getErrorCode().value())
                .message(ex.getMessage())
                .details(ex.getDetails())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .details(Map.of())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .code(ErrorCode.INVALID_TYPE.value())
                .message(ex.getMessage())
                .details(Map.of())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .details(Map.of())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
        case SESSION_NOT_FOUND, MEMORY_NOT_FOUND, SAVED_SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
        case MISSING_FIELDS, INVALID_TYPE, EMPTY_FIELD, INVALID_IMPORTANCE, INVALID_SESSION_ID, DATA_TOO_LARGE ->
            HttpStatus.BAD_REQUEST;
        case INVALID_TRANSITION, CONVERSATION_LIMIT, PROMOTION_IN_PROGRESS, SESSION_UNAVAILABLE, HANDLE_CLOSED,
                EMPTY ->
            HttpStatus.CONFLICT;
        case QUEUE_FULL -> HttpStatus.TOO_MANY_REQUESTS;
        case TIMEOUT -> HttpStatus.SERVICE_UNAVAILABLE;
        case STORAGE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
