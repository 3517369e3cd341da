package com.github.dimitryivaniuta.labelbridge.web;

import com.github.dimitryivaniuta.labelbridge.authz.AccessDeniedException;
import com.github.dimitryivaniuta.labelbridge.authz.DenyReason;
import com.github.dimitryivaniuta.labelbridge.bridge.BridgeUnauthorizedException;
import com.github.dimitryivaniuta.labelbridge.bridge.BridgeUnavailableException;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticationFailedException;
import com.github.dimitryivaniuta.labelbridge.credential.WeakSecretException;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Single translation point from internal failures to HTTP. Messages are deliberately generic for
 * anything that could reveal account state or tenant structure.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    static final String RETRY_AFTER = "Retry-After";

    private final LabelBridgeMetrics metrics;

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ApiError> handleAuthentication(AuthenticationFailedException ex, HttpServletRequest req) {
        metrics.authenticationFailed(ex.kind());
        log.debug("Authentication failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiError.of(HttpStatus.UNAUTHORIZED, "Authentication failed", req.getRequestURI()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex, HttpServletRequest req) {
        if (ex.getReason() == DenyReason.NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiError.of(HttpStatus.NOT_FOUND, "Not found", req.getRequestURI()));
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiError.of(HttpStatus.FORBIDDEN, "Access denied", req.getRequestURI()));
    }

    @ExceptionHandler(BridgeUnavailableException.class)
    public ResponseEntity<ApiError> handleBridgeUnavailable(BridgeUnavailableException ex, HttpServletRequest req) {
        log.warn("Annotation engine unavailable: {}", ex.getMessage());
        HttpHeaders h = new HttpHeaders();
        h.set(RETRY_AFTER, String.valueOf(BridgeUnavailableException.DEFAULT_RETRY_AFTER_SECONDS));
        ApiError body = ApiError.of(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable", req.getRequestURI());
        return new ResponseEntity<>(body, h, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(BridgeUnauthorizedException.class)
    public ResponseEntity<ApiError> handleBridgeUnauthorized(BridgeUnauthorizedException ex, HttpServletRequest req) {
        log.warn("Annotation engine refused request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiError.of(HttpStatus.FORBIDDEN, "Not permitted", req.getRequestURI()));
    }

    @ExceptionHandler(WeakSecretException.class)
    public ResponseEntity<ApiError> handleWeakSecret(WeakSecretException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage(), req.getRequestURI()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(ApiError.of(status, ex.getReason(), req.getRequestURI()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.of(HttpStatus.BAD_REQUEST, "Validation failed", req.getRequestURI()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.of(HttpStatus.BAD_REQUEST, "Malformed request body", req.getRequestURI()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(NoResourceFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiError.of(HttpStatus.NOT_FOUND, "Not found", req.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req.getRequestURI()));
    }
}
