package me.golemcore.context.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.context.domain.exception.ConfigurationException;
import me.golemcore.context.domain.exception.StorageException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Centralized exception handler for API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.context.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(ConfigurationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConfiguration(ConfigurationException ex) {
        log.warn("[API] Invalid configuration: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NoSuchElementException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(CancellationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCancellation(CancellationException ex) {
        log.info("[API] Operation cancelled: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Operation cancelled");
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStorage(StorageException ex) {
        log.error("[API] Storage failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure");
    }

    @ExceptionHandler(CompletionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ResponseStatusException rse) {
            return handleResponseStatus(rse);
        }
        if (cause instanceof ConfigurationException ce) {
            return handleConfiguration(ce);
        }
        if (cause instanceof IllegalArgumentException iae) {
            return handleIllegalArgument(iae);
        }
        if (cause instanceof NoSuchElementException nse) {
            return handleNotFound(nse);
        }
        if (cause instanceof CancellationException ce) {
            return handleCancellation(ce);
        }
        if (cause instanceof IllegalStateException ise) {
            return handleIllegalState(ise);
        }
        if (cause instanceof StorageException se) {
            return handleStorage(se);
        }
        return handleGeneric(ex);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
