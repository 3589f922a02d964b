package com.lifecycle.api.rest;

import com.lifecycle.core.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps event store errors to HTTP responses with an
 * {@code {errorCode, message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String BAD_REQUEST = "BAD_REQUEST";
    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final Map<String, HttpStatus> STATUS_BY_CODE = Map.ofEntries(
        Map.entry(EventValidationException.ERROR_CODE, HttpStatus.BAD_REQUEST),
        Map.entry(InvalidActorException.ERROR_CODE, HttpStatus.BAD_REQUEST),
        Map.entry(NotFoundException.ERROR_CODE, HttpStatus.NOT_FOUND),
        Map.entry(SequenceConflictException.ERROR_CODE, HttpStatus.CONFLICT),
        Map.entry(AppendFailedException.ERROR_CODE, HttpStatus.CONFLICT),
        Map.entry(CheckpointConflictException.ERROR_CODE, HttpStatus.CONFLICT),
        Map.entry(InvalidStateTransitionException.ERROR_CODE, HttpStatus.CONFLICT),
        Map.entry(ImmutableRecordException.ERROR_CODE, HttpStatus.CONFLICT),
        Map.entry(RebuildCancelledException.ERROR_CODE, HttpStatus.CONFLICT),
        Map.entry(RebuildVerificationMismatchException.ERROR_CODE, HttpStatus.UNPROCESSABLE_ENTITY)
    );

    @ExceptionHandler(LifecycleException.class)
    public ResponseEntity<ErrorResponse> handleLifecycle(LifecycleException e) {
        HttpStatus status = STATUS_BY_CODE.getOrDefault(e.getErrorCode(), HttpStatus.INTERNAL_SERVER_ERROR);
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected ({}): {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR, e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
