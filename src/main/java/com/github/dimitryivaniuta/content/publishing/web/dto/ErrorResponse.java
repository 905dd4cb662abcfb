package com.github.dimitryivaniuta.content.publishing.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/**
 * Error body for request-level failures (bad input, integrity conflicts, unexpected errors).
 * Lifecycle refusals and lost races are answered with a {@code ProblemDetail} instead.
 *
 * @param code machine-readable code
 * @param message human readable message
 * @param path request path
 * @param correlationId id from {@code X-Correlation-Id}, for matching the request's log lines
 * @param fieldErrors rejected request fields and why; empty unless {@code code} is VALIDATION_ERROR
 * @param timestamp event time
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String code,
        String message,
        String path,
        String correlationId,
        Map<String, String> fieldErrors,
        Instant timestamp
) {

    public ErrorResponse {
        fieldErrors = fieldErrors == null ? Map.of() : Map.copyOf(fieldErrors);
    }

    public static ErrorResponse of(String code, String message, String path, String correlationId) {
        return new ErrorResponse(code, message, path, correlationId, Map.of(), Instant.now());
    }
}
