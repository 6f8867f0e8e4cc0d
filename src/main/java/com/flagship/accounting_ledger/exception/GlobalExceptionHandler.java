package com.flagship.accounting_ledger.exception;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures to HTTP responses with a consistent error body.
 *
 * Domain errors keep their stable code in the {@code error} field; storage
 * failures are reported as STORAGE_ERROR so they are never confused with
 * validation problems.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ValidationException.class, InvalidReferenceException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(LedgerException e) {
        log.warn("Rejected request [{}]: {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({DuplicateCodeException.class, ImmutableStateException.class, HasPaymentsException.class})
    public ResponseEntity<ErrorResponse> handleConflict(LedgerException e) {
        log.warn("Conflict [{}]: {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({OverpaymentException.class, UnbalancedEntryException.class})
    public ResponseEntity<ErrorResponse> handleUnprocessable(LedgerException e) {
        log.warn("Unprocessable [{}]: {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(),
                "The ledger store is temporarily unavailable", null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Unexpected storage failure", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, StorageException.CODE,
                "The ledger store is temporarily unavailable", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, ValidationException.CODE,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, ValidationException.CODE, "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ValidationException.CODE,
                "Malformed request: check numbers and dates", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  Map<String, String> details) {
        ErrorResponse error = ErrorResponse.builder()
            .error(code)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response DTO.
     */
    @Value
    @Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
