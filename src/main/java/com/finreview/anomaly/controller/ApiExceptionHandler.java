package com.finreview.anomaly.controller;

import com.finreview.anomaly.exception.ConfigurationException;
import com.finreview.anomaly.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException ex) {
        log.warn("Rejected request with invalid detection settings: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage(), "field", ex.getField()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidRequestException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage(), "field", ex.getField()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
