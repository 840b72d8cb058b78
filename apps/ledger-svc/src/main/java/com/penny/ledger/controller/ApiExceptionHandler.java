package com.penny.ledger.controller;

import com.penny.ledger.controller.dto.ErrorResponseDto;
import com.penny.ledger.error.LedgerIntegrityException;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.error.TransactionConflictException;
import com.penny.ledger.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LedgerNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(LedgerNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of(
                "entity", ex.entity(),
                "id", String.valueOf(ex.id())
        ));
    }

    @ExceptionHandler(LedgerIntegrityException.class)
    public ResponseEntity<ErrorResponseDto> handleIntegrity(LedgerIntegrityException ex) {
        Map<String, Object> details = new HashMap<>();
        ex.count().ifPresent(count -> details.put("count", count));
        return build(HttpStatus.CONFLICT, "INTEGRITY_VIOLATION", ex.getMessage(), details);
    }

    @ExceptionHandler(TransactionConflictException.class)
    public ResponseEntity<ErrorResponseDto> handleTransactionConflict(TransactionConflictException ex) {
        return build(HttpStatus.CONFLICT, "TRANSACTION_CONFLICT", "Store is busy, retry the request", Map.of(
                "conflict", ex.conflict().name(),
                "reason", String.valueOf(ex.getMessage())
        ));
    }

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleLedgerValidation(LedgerValidationException ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponseDto> handleUnreadable(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request", Map.of(
                "reason", String.valueOf(ex.getMessage())
        ));
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause().getMessage();
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Ledger store temporarily unavailable", Map.of(
                "reason", String.valueOf(specific)
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        String msg = ex.getMessage() != null ? ex.getMessage().toLowerCase() : "";
        if (msg.contains("no such table")) {
            return build(HttpStatus.INTERNAL_SERVER_ERROR, "DB_SCHEMA_MISSING", "Database schema not initialized", Map.of(
                    "action", "Enable PENNY_DB_BOOTSTRAP=true so db/schema.sql is applied at startup",
                    "reason", ex.getMessage()
            ));
        }
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of(
                "reason", String.valueOf(ex.getMessage())
        ));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details,
                        RequestContextHolder.traceId().orElse(null),
                        RequestContextHolder.path().orElse(null)));
    }
}
