package com.trackinglog.api.rest;

import com.trackinglog.core.exception.*;
import com.trackinglog.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps ledger exceptions to HTTP responses.
 */
@RestControllerAdvice
public class LedgerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LedgerExceptionHandler.class);

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerException(LedgerException ex) {
        HttpStatus status = statusFor(ex);
        log.info("Request rejected: {} {}", ex.getErrorCode(), ex.getMessage());
        ResponseEntity<Map<String, Object>> response = error(status, ex.getErrorCode(), ex.getMessage());
        if (ex instanceof InvalidInputException) {
            response.getBody().put("field", ((InvalidInputException) ex).getField());
        }
        return response;
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingRequestHeaderException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.info("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, InvalidInputException.ERROR_CODE, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    static HttpStatus statusFor(LedgerException ex) {
        if (ex instanceof UnauthorizedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof InvalidInputException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof PausedException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.CONFLICT;
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("errorCode", errorCode);
        body.put("message", message);
        String traceId = LoggingContext.getTraceId();
        body.put("traceId", traceId != null ? traceId : "no-trace-id");
        return ResponseEntity.status(status).body(body);
    }
}
