package com.pdm.engine.exception;

import com.pdm.engine.catalog.UnknownEquipmentProfileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Global exception handler for REST endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle validation errors.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();

        String path = exchange.getRequest().getPath().value();

        log.warn("Validation failed for {}: {}", path, details);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed",
                path
        ).withDetails(details);

        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    /**
     * Handle unreadable request bodies, e.g. malformed JSON or unknown enum values.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        String message = rootCause(ex).getMessage();
        if (message == null) {
            message = "Invalid request body";
        }

        log.warn("Unreadable request for {}: {}", path, message);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                message,
                path
        );

        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    /**
     * Handle illegal argument exceptions (e.g., unknown enum values in a path).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.warn("Invalid argument for {}: {}", path, ex.getMessage());

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                ex.getMessage(),
                path
        );

        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    /**
     * An equipment type with no OEM profile is a deployment problem, not a bad request.
     */
    @ExceptionHandler(UnknownEquipmentProfileException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnknownProfile(
            UnknownEquipmentProfileException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.error("Configuration error for {}: {}", path, ex.getMessage());

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Configuration Error",
                ex.getMessage(),
                path
        );

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response));
    }

    @ExceptionHandler(TimeoutException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTimeout(
            TimeoutException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.warn("Analysis timed out for {}: {}", path, ex.getMessage());

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.GATEWAY_TIMEOUT,
                "Gateway Timeout",
                "Analysis did not complete in time",
                path
        );

        return Mono.just(ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(response));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(
            ResponseStatusException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        HttpStatusCode status = ex.getStatusCode();

        ErrorResponse response = ErrorResponse.of(
                status,
                ex.getReason() != null ? ex.getReason() : status.toString(),
                ex.getMessage(),
                path
        );

        return Mono.just(ResponseEntity.status(status).body(response));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.error("Unexpected error for {}: {}", path, ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                path
        );

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response));
    }

    private static Throwable rootCause(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }
}
