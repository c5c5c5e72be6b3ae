package com.pdm.engine.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatusCode;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every analysis and catalog endpoint.
 * {@code details} lists one entry per rejected request field.
 */
public record ErrorResponse(
    @JsonProperty("status")
    int status,

    @JsonProperty("error")
    String error,

    @JsonProperty("message")
    String message,

    @JsonProperty("path")
    String path,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("details")
    List<String> details
) {
    public ErrorResponse {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ErrorResponse of(HttpStatusCode status, String error, String message, String path) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), List.of());
    }

    public ErrorResponse withDetails(List<String> fieldErrors) {
        return new ErrorResponse(status, error, message, path, timestamp, fieldErrors);
    }
}
