package com.example.crosstab.exception;

import com.example.crosstab.dto.ErrorResponse;
import com.example.crosstab.util.Constants.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<ErrorResponse> handleProtocolException(ProtocolException ex, ServerWebExchange exchange) {
        log.warn("ProtocolException [{}]: {}", ex.getCode(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Protocol Error", ex.getCode().name(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(ConnectionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleConnectionNotFoundException(ConnectionNotFoundException ex, ServerWebExchange exchange) {
        log.warn("ConnectionNotFoundException: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", null, ex.getMessage(), exchange);
    }

    @ExceptionHandler(RecoveryExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleRecoveryExhaustedException(RecoveryExhaustedException ex, ServerWebExchange exchange) {
        log.warn("RecoveryExhaustedException: {}", ex.getMessage());
        return build(HttpStatus.GONE, "Recovery Exhausted", ErrorCode.RECOVERY_EXHAUSTED.name(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(StaleMessageException.class)
    public ResponseEntity<ErrorResponse> handleStaleMessageException(StaleMessageException ex, ServerWebExchange exchange) {
        log.debug("StaleMessageException: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Stale Message", null, ex.getMessage(), exchange);
    }

    @ExceptionHandler(CollaboratorFailureException.class)
    public ResponseEntity<ErrorResponse> handleCollaboratorFailureException(CollaboratorFailureException ex, ServerWebExchange exchange) {
        log.error("CollaboratorFailureException: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", null, ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", null, errors, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(),
                ex.getStatusCode().value(),
                ex.getStatusCode().toString(),
                null,
                ex.getReason(),
                exchange.getRequest().getPath().toString()
        );
        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }
        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String code, String message, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(),
                status.value(),
                error,
                code,
                message,
                exchange.getRequest().getPath().toString()
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
