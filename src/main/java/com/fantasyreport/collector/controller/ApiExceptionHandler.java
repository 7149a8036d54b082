package com.fantasyreport.collector.controller;

import com.fantasyreport.collector.exception.IngestAbortedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps ingestion failures to HTTP responses for the admin endpoints.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("bad_request", ex.getMessage(), Instant.now()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidParameter(HandlerMethodValidationException ex) {
        String message = ex.getAllErrors().stream()
                .map(MessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Invalid request parameter: {}", message);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("bad_request", message, Instant.now()));
    }

    @ExceptionHandler(IngestAbortedException.class)
    public ResponseEntity<ErrorResponse> handleAborted(IngestAbortedException ex) {
        log.error("Ingest run aborted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("ingest_aborted", ex.getMessage(), Instant.now()));
    }

    public record ErrorResponse(String error, String message, Instant timestamp) {}
}
