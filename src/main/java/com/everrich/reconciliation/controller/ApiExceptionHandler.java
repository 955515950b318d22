package com.everrich.reconciliation.controller;

import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.everrich.reconciliation.dto.ApiError;
import com.everrich.reconciliation.exception.AlreadyAllocatedException;
import com.everrich.reconciliation.exception.ConcurrencyConflictException;
import com.everrich.reconciliation.exception.ConflictingReconciliationModeException;
import com.everrich.reconciliation.exception.LedgerException;
import com.everrich.reconciliation.exception.NotFoundException;

/**
 * Maps the ledger error taxonomy to HTTP responses: missing records 404, conflicts with
 * existing allocations or concurrent writers 409, every other rule violation 422.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({AlreadyAllocatedException.class, ConflictingReconciliationModeException.class,
            ConcurrencyConflictException.class})
    public ResponseEntity<ApiError> handleConflict(LedgerException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleRuleViolation(LedgerException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        log.warn("Rejected malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(HttpStatus.BAD_REQUEST.value(),
                HttpStatus.BAD_REQUEST.getReasonPhrase(), "Malformed request", LocalDateTime.now()));
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, LedgerException e) {
        log.warn("{} -> {}: {}", e.getClass().getSimpleName(), status.value(), e.getMessage());
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), status.getReasonPhrase(), e.getMessage(), LocalDateTime.now()));
    }
}
