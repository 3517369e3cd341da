package com.github.dimitryivaniuta.labelbridge.web;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

import java.time.Instant;

import static com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

/**
 * Error body for every non-2xx response, whether produced by a controller or by a filter.
 */
public record ApiError(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId
) {

    public static ApiError of(HttpStatus status, String message, String path) {
        return new ApiError(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                path,
                MDC.get(CORRELATION_ID_MDC_KEY)
        );
    }
}
