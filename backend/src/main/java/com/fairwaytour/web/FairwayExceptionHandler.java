package com.fairwaytour.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class FairwayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FairwayExceptionHandler.class);

    @ExceptionHandler(FairwayException.class)
    public ResponseEntity<FairwayErrorResponse> handle(FairwayException ex) {
        log.debug("Request rejected with {}: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(new FairwayErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );

        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("validation_failed", detail, fieldErrors));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<FairwayErrorResponse> handleMalformedRequest(Exception ex) {
        return ResponseEntity
                .badRequest()
                .body(new FairwayErrorResponse("validation_failed", "Malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler({
            OptimisticLockingFailureException.class,
            PessimisticLockingFailureException.class,
            DataIntegrityViolationException.class
    })
    public ResponseEntity<FairwayErrorResponse> handleConcurrentWrite(DataAccessException ex) {
        log.warn("Concurrent write rejected: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new FairwayErrorResponse(
                        "stale_state",
                        "The resource was modified concurrently; reload and retry"
                ));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<FairwayErrorResponse> handlePersistenceFailure(DataAccessException ex) {
        log.error("Persistence failure while handling request", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new FairwayErrorResponse("internal_error", "Unexpected persistence failure"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<FairwayErrorResponse> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse && !errorResponse.getStatusCode().is5xxServerError()) {
            return ResponseEntity
                    .status(errorResponse.getStatusCode())
                    .body(new FairwayErrorResponse("request_rejected", ex.getMessage()));
        }
        log.error("Unhandled failure while handling request", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new FairwayErrorResponse("internal_error", "Unexpected server error"));
    }

    public record FairwayErrorResponse(
            String code,
            String message
    ) {
    }

    public record ValidationErrorResponse(
            String code,
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
