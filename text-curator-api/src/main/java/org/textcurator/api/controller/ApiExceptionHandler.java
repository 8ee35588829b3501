package org.textcurator.api.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.textcurator.api.service.JobNotFoundException;
import org.textcurator.service.chunking.ChunkingConfigurationException;

import java.util.Map;

/**
 * Maps engine exceptions to JSON error bodies of the form {@code {error, message}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ChunkingConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ChunkingConfigurationException ex) {
        log.debug("Rejected chunking request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_options", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "malformed_request", "Request body could not be read");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
