package com.claimsledger.exception;

import com.claimsledger.dto.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                    | HTTP Status | Code
 * ----------------------------------|-------------|--------------------
 * IllegalArgumentException          | 400         | BAD_REQUEST
 * MethodArgumentNotValidException   | 400         | field → message map
 * HttpMessageNotReadableException   | 400         | BAD_REQUEST (unknown enum value, bad date)
 * NoSuchElementException            | 404         | NOT_FOUND
 * InvalidOperationException         | 409         | INVALID_OPERATION
 * InvalidTransitionException        | 409         | INVALID_TRANSITION
 * DuplicateClaimNumberException     | 409         | DUPLICATE_KEY
 * IllegalStateException (other)     | 409         | CONFLICT
 * DataIntegrityViolationException   | 409         | CONFLICT
 * Exception (fallback)              | 500         | INTERNAL_SERVER_ERROR
 *
 * RULES:
 * - Domain exception messages are passed through verbatim
 * - No stack traces in responses
 * - All responses except field validation use the ErrorResponse shape
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST - Invalid input
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Input guard failures from ClaimService and the domain constructors:
     *   - zero amount, negative amount on a non-adjustment type
     *   - share percent outside 0-100
     *   - missing referenceId / actor, referenceId reused on another claim
     *   - unconfirmed status change, unreadable report date
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Handles @Valid/@NotNull/@DecimalMin annotation failures on request DTOs.
     * Returns a field → message map instead of generic error for clearer API feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    /**
     * Unreadable body: malformed JSON, a transaction type or status outside the
     * enum, or a date that is not ISO.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse(
                        "BAD_REQUEST",
                        "Malformed request body or unknown enum value"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse(
                        "BAD_REQUEST",
                        String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName())));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 NOT FOUND - Resource does not exist
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Unknown claim or policy id (NotFoundException is a NoSuchElementException).
     */
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT - Lifecycle / state violation
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Ledger guard: claim not open, or informational-only.
     */
    @ExceptionHandler(InvalidOperationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleInvalidOperation(InvalidOperationException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("INVALID_OPERATION", ex.getMessage()));
    }

    /**
     * Status change outside the transition table (e.g. OPEN → REOPENED).
     */
    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("INVALID_TRANSITION", ex.getMessage()));
    }

    @ExceptionHandler(DuplicateClaimNumberException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDuplicateClaimNumber(DuplicateClaimNumberException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("DUPLICATE_KEY", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", ex.getMessage()));
    }

    /**
     * A write the database rejected after the service guards passed. In practice
     * a concurrent insert of the same referenceId that passed the idempotency
     * lookup before the other writer committed; a retry with the same
     * referenceId returns the stored snapshot.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse(
                        "CONFLICT",
                        "Write rejected by a data constraint. " +
                        "If this was a concurrent duplicate, retry with the same referenceId to retrieve the stored result."
                ));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 INTERNAL SERVER ERROR - Unexpected failures
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Safety net for any unhandled exception. The message stays generic.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse(
                        "INTERNAL_SERVER_ERROR",
                        "An unexpected error occurred. Please contact support."
                ));
    }
}
