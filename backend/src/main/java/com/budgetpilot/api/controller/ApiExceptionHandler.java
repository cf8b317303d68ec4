package com.budgetpilot.api.controller;

import com.budgetpilot.api.dto.ErrorBody;
import com.budgetpilot.categorization.CategorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps validation failures and categorization errors to HTTP status + ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String MISSING_USER = "MISSING_USER";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(VALIDATION_ERROR, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(VALIDATION_ERROR,
                ex.getReason() != null ? ex.getReason() : "Malformed request"));
    }

    @ExceptionHandler(MissingUserException.class)
    public ResponseEntity<ErrorBody> handleMissingUser(MissingUserException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(MISSING_USER, ex.getMessage()));
    }

    @ExceptionHandler(CategorizationException.class)
    public ResponseEntity<ErrorBody> handleCategorization(CategorizationException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case CategorizationException.NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CategorizationException.ALREADY_RESOLVED, CategorizationException.ALREADY_PROCESSING -> HttpStatus.CONFLICT;
            case CategorizationException.INVALID_OVERRIDE -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        log.debug("{} {}: {}", status.value(), ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }
}
