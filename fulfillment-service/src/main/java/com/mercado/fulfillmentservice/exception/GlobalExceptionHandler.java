package com.mercado.fulfillmentservice.exception;

import com.mercado.common.dto.ErrorResponse;
import com.mercado.common.dto.ValidationErrorResponse;
import com.mercado.common.exception.AccessDeniedException;
import com.mercado.common.exception.InsufficientStockException;
import com.mercado.common.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ErrorResponse.ErrorResponseBuilder baseResponse(HttpStatus status, String message,
                                                            String errorCode, HttpServletRequest request) {
        return ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(generateCorrelationId());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.NOT_FOUND, ex.getMessage(),
                "RESOURCE_NOT_FOUND", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.FORBIDDEN, ex.getMessage(),
                "ACCESS_DENIED", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.FORBIDDEN);
    }

    /**
     * Handles InsufficientStockException (422 - Unprocessable Entity)
     * The body carries the units still available so the client can offer them.
     * Logged at service layer, where product and requested quantity are known.
     */
    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                "INSUFFICIENT_STOCK", request)
                .availableStock(ex.getAvailableStock())
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    /**
     * Handles InvalidTransitionException (422 - Unprocessable Entity)
     * Lists the statuses the order can legally move to from where it is.
     */
    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransitionException(
            InvalidTransitionException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                "INVALID_STATUS_TRANSITION", request)
                .legalNextStatuses(ex.getLegalNextStatuses().stream().map(Enum::name).sorted().toList())
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(ReservationCommitException.class)
    public ResponseEntity<ErrorResponse> handleReservationCommitException(
            ReservationCommitException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT, ex.getMessage(),
                "RESERVATION_COMMIT_FAILED", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(ReservationNotActiveException.class)
    public ResponseEntity<ErrorResponse> handleReservationNotActiveException(
            ReservationNotActiveException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT, ex.getMessage(),
                "RESERVATION_NOT_ACTIVE", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.CONFLICT);
    }

    /**
     * Handles ConsistencyViolationException (500)
     * Stored data contradicts itself. Needs a human, so it is logged at ERROR with the
     * correlation id the client sees.
     */
    @ExceptionHandler(ConsistencyViolationException.class)
    public ResponseEntity<ErrorResponse> handleConsistencyViolationException(
            ConsistencyViolationException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(),
                "CONSISTENCY_VIOLATION", request).build();
        log.error("[{}] Consistency violation - Path: {} - {}",
                errorResponse.getCorrelationId(), request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT,
                "The resource was modified concurrently. Please refresh and try again.",
                "CONCURRENT_MODIFICATION", request).build();
        log.warn("[{}] Optimistic locking conflict - Path: {}",
                errorResponse.getCorrelationId(), request.getRequestURI());

        return new ResponseEntity<>(errorResponse, HttpStatus.CONFLICT);
    }

    /**
     * Handles TransientDataAccessException (503 - Service Unavailable)
     * Lock timeouts and deadlocks that survived the retry policy. Nothing was committed,
     * the client may try again.
     */
    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ErrorResponse> handleTransientDataAccessException(
            TransientDataAccessException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.SERVICE_UNAVAILABLE,
                "The request could not be completed due to contention. Please retry.",
                "TRANSIENT_FAILURE", request).build();
        log.warn("[{}] Transient failure after retries - Path: {} - {}",
                errorResponse.getCorrelationId(), request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(errorResponse, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    // unknown status names, malformed UUIDs, unreadable JSON
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Malformed request",
                "MALFORMED_REQUEST", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, ex.getMessage(),
                "INVALID_ARGUMENT", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", request).build();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                errorResponse.getCorrelationId(),
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
