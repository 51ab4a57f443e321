package dev.catananti.reviewhub.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), exchange));
    }

    @ExceptionHandler(UnauthenticatedException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleUnauthenticated(UnauthenticatedException ex, ServerWebExchange exchange) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "Authentication required", exchange));
    }

    @ExceptionHandler(UnauthorizedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleUnauthorized(UnauthorizedException ex, ServerWebExchange exchange) {
        log.warn("Forbidden: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage(), exchange));
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleAccessDeniedException(AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.FORBIDDEN, "FORBIDDEN", "Access denied", exchange));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex, ServerWebExchange exchange) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage(), exchange));
    }

    @ExceptionHandler(StaleStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleStaleState(StaleStateException ex, ServerWebExchange exchange) {
        log.warn("Stale state: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.CONFLICT, StaleStateException.CODE,
                ex.getMessage() + ", refetch and retry", exchange));
    }

    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInvalidInput(InvalidInputException ex, ServerWebExchange exchange) {
        log.warn("Invalid input: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), exchange));
    }

    @ExceptionHandler(ConnectionRejectedException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Mono<ErrorResponse> handleConnectionRejected(ConnectionRejectedException ex, ServerWebExchange exchange) {
        log.warn("Connection rejected: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.SERVICE_UNAVAILABLE, "CONNECTION_REJECTED", ex.getMessage(), exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value",
                        (existing, ignored) -> existing
                ));

        log.warn("Validation failed: {}", errors);
        ErrorResponse response = error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Invalid request data", exchange);
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, "INVALID_INPUT",
                ex.getReason() != null ? ex.getReason() : "Invalid request", exchange));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        return Mono.just(ResponseEntity.status(status).body(error(status, status.name(), message, exchange)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred", exchange));
    }

    private ErrorResponse error(HttpStatus status, String code, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }
}
