package com.procureflow.engine.api;

import java.time.Instant;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.procureflow.engine.exception.BudgetInvariantViolationException;
import com.procureflow.engine.exception.IneligibleApproverException;
import com.procureflow.engine.exception.InvalidTransitionException;
import com.procureflow.engine.exception.NotFoundException;

import jakarta.validation.ConstraintViolationException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps engine exceptions to HTTP statuses. Every error body is {@code {error, message, timestamp}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> invalidTransition(InvalidTransitionException e) {
        log.info("Rejected action: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "invalid_transition", e.getMessage());
    }

    @ExceptionHandler(IneligibleApproverException.class)
    public ResponseEntity<ErrorResponse> ineligibleApprover(IneligibleApproverException e) {
        log.info("Rejected approver: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "ineligible_approver", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", detail);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> invalidParameter(ConstraintViolationException e) {
        String detail = e.getConstraintViolations().stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", detail);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> conflict(DataIntegrityViolationException e) {
        log.warn("Write rejected by a database constraint: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "conflict", "Request conflicts with stored data");
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(BudgetInvariantViolationException.class)
    public ResponseEntity<ErrorResponse> invariantViolation(BudgetInvariantViolationException e) {
        log.error("Budget invariant violation, transaction rolled back: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "budget_invariant_violation", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message, Instant.now()));
    }

    @Value
    public static class ErrorResponse {
        String error;
        String message;
        Instant timestamp;
    }
}
