package com.github.dimitryivaniuta.gateway.checkout.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Error body for request-level failures (validation, malformed input, unexpected errors). Checkout failures
 * use {@link org.springframework.http.ProblemDetail} instead.
 *
 * @param code machine-readable code
 * @param message human readable message
 * @param violations offending fields, only for validation errors
 * @param correlationId id of the request in the logs
 * @param timestamp event time
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String code,
        String message,
        List<FieldViolation> violations,
        String correlationId,
        Instant timestamp
) {

    public static ErrorResponse of(String code, String message, String correlationId) {
        return new ErrorResponse(code, message, List.of(), correlationId, Instant.now());
    }

    /**
     * @param field request field
     * @param message constraint message
     */
    public record FieldViolation(String field, String message) {}
}
