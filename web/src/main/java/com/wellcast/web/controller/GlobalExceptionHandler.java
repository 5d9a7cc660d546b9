/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web.controller;

import com.wellcast.common.exception.AuthenticationException;
import com.wellcast.common.exception.BrokerConnectionException;
import com.wellcast.common.exception.ValidationException;
import com.wellcast.common.exception.WellCastException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions from the REST endpoints to a JSON body of the form
 * {@code {"error": ..., "code": ..., "timestamp": ...}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleAuthentication(AuthenticationException ex,
                                                                    HttpServletRequest request) {
        log.warn("Rejected {} {} from {}: {}", request.getMethod(), request.getRequestURI(),
                request.getRemoteAddr(), ex.getMessage());
        return body(HttpStatus.UNAUTHORIZED, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(BrokerConnectionException.class)
    public ResponseEntity<Map<String, Object>> handleBroker(BrokerConnectionException ex) {
        log.error("Broker unavailable: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(WellCastException.class)
    public ResponseEntity<Map<String, Object>> handleWellCast(WellCastException ex) {
        log.error("Request failed: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "WC_BAD_REQUEST", "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse framework) {
            // 404, 405, 415 and friends raised by Spring MVC itself
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return body(status, "WC_HTTP_" + status.value(), status.getReasonPhrase());
        }
        log.error("Unhandled exception at {} {}: {}", request.getMethod(),
                request.getRequestURI(), ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "WC_INTERNAL", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
