package dev.resumematcher.exception;

import dev.resumematcher.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses with a JSON error body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), exchange);
    }

    @ExceptionHandler(MatchRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(MatchRejectedException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.CONFLICT, "MATCH_REJECTED", ex.getMessage(), exchange);
    }

    @ExceptionHandler(MatchPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(MatchPersistenceException ex, ServerWebExchange exchange) {
        log.error("Match persistence failed: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "PERSISTENCE_ERROR",
                "The match could not be stored, please retry", exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", errors, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", exchange);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .message(message)
                .status(status.value())
                .timestamp(Instant.now())
                .path(exchange.getRequest().getPath().value())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
