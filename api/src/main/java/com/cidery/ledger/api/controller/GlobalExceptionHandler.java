package com.cidery.ledger.api.controller;

import com.cidery.ledger.application.service.CorrelationIdService;
import com.cidery.ledger.domain.exception.LedgerEntityNotFoundException;
import com.cidery.ledger.domain.exception.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps ledger failures to HTTP responses. Validation failures are 400, missing records 404,
 * conflicts 409 (the caller may retry) and invariant violations 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final CorrelationIdService correlationIdService;

    public GlobalExceptionHandler(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerException(LedgerException e) {
        HttpStatus status;
        if (e instanceof LedgerEntityNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else {
            status = switch (e.getCategory()) {
                case VALIDATION -> HttpStatus.BAD_REQUEST;
                case CONFLICT -> HttpStatus.CONFLICT;
                case INVARIANT -> HttpStatus.INTERNAL_SERVER_ERROR;
            };
        }
        if (status.is5xxServerError()) {
            log.error("Ledger invariant violated [{}]: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(body(e.getCode(), e.getMessage(), e.getDetails(), e.getCategory().name(), e.isRetryable()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.debug("Rejected malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(body("BAD_REQUEST", e.getMessage(), Collections.emptyMap(), "VALIDATION", false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "Internal server error", Collections.emptyMap(), "INTERNAL", false));
    }

    private Map<String, Object> body(String code, String message, Map<String, Object> details,
                                     String category, boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("details", details);
        body.put("category", category);
        body.put("retryable", retryable);
        body.put("correlationId", correlationIdService.getCurrentCorrelationId());
        return body;
    }
}
