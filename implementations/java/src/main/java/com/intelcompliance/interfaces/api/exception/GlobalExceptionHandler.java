package com.intelcompliance.interfaces.api.exception;

import com.intelcompliance.domain.exception.AuditPersistenceException;
import com.intelcompliance.domain.exception.AuthenticationFailureException;
import com.intelcompliance.domain.exception.FileCorruptionException;
import com.intelcompliance.domain.exception.InvalidTransitionException;
import com.intelcompliance.domain.exception.NotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.interfaces.api.dto.ErrorResponse;
import jakarta.persistence.OptimisticLockException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Maps the compliance exception taxonomy onto HTTP statuses:
 * - Validation: 400
 * - Integrity and authentication failures: 422
 * - Not found: 404
 * - Invalid transitions and concurrent modification: 409
 * - Audit loss and everything else: 500
 *
 * Messages never carry key material, plaintext or stack traces.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.ValidationError.builder()
                .field(error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName())
                .message(error.getDefaultMessage())
                .build())
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request parameters", request,
            builder -> builder.validationErrors(validationErrors));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleDomainValidation(
            ValidationException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getViolations().stream()
            .map(v -> ErrorResponse.ValidationError.builder()
                .field(v.field())
                .message(v.message())
                .build())
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error on {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request,
            builder -> builder.validationErrors(validationErrors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(
            Exception ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        }
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request, builder -> { });
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            NotFoundException ex,
            HttpServletRequest request) {

        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, builder -> { });
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(
            InvalidTransitionException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Rejected transition on {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return respond(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage(), request,
            builder -> builder
                .currentState(ex.getCurrentState().name())
                .requestedState(ex.getRequestedState() != null ? ex.getRequestedState().name() : null));
    }

    /**
     * Handle optimistic locking failures.
     */
    @ExceptionHandler({OptimisticLockException.class, ObjectOptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            RuntimeException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Optimistic lock exception on {}", request.getRequestURI());
        }
        return respond(HttpStatus.CONFLICT, "Concurrent Modification",
            "The resource was modified by another request. Please retry.", request, builder -> { });
    }

    @ExceptionHandler({AuthenticationFailureException.class, FileCorruptionException.class})
    public ResponseEntity<ErrorResponse> handleIntegrityFailure(
            RuntimeException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Integrity failure on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        }
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Integrity Failure",
            "The data failed authentication or integrity verification", request, builder -> { });
    }

    @ExceptionHandler(AuditPersistenceException.class)
    public ResponseEntity<ErrorResponse> handleAuditLoss(
            AuditPersistenceException ex,
            HttpServletRequest request) {

        log.error("AUDIT LOSS surfaced to client on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Audit Failure",
            "The audit trail could not be written; the operation may be incomplete", request, builder -> { });
    }

    /**
     * Handle security exceptions.
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ErrorResponse> handleSecurityException(
            SecurityException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Security exception: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return respond(HttpStatus.FORBIDDEN, "Security Violation", "Security policy violation detected",
            request, builder -> { });
    }

    /**
     * Handle illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(),
            request, builder -> { });
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred. Please contact support.", request, builder -> { });
    }

    private static ResponseEntity<ErrorResponse> respond(
            HttpStatus status,
            String error,
            String message,
            HttpServletRequest request,
            Consumer<ErrorResponse.ErrorResponseBuilder> details) {

        ErrorResponse.ErrorResponseBuilder builder = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI());
        details.accept(builder);
        return ResponseEntity.status(status).body(builder.build());
    }
}
