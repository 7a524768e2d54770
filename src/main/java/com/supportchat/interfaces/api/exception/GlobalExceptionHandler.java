package com.supportchat.interfaces.api.exception;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.supportchat.application.exceptions.UserContextBusyException;
import com.supportchat.domain.repository.ConversationStoreException;
import com.supportchat.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Error responses never echo message text; internal failures are reported
 * with a generic message and logged in full.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final PropertyNamingStrategies.NamingBase SNAKE_CASE =
        new PropertyNamingStrategies.SnakeCaseStrategy();

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.InvalidField> invalidFields = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> new ErrorResponse.InvalidField(jsonName(error), error.getDefaultMessage()))
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                invalidFields.size(), request.getRequestURI());
        }

        ErrorResponse errorResponse = error(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid request parameters", request)
            .invalidFields(invalidFields)
            .build();
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        }
        return ResponseEntity.badRequest()
            .body(error(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request).build());
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
        return ResponseEntity.badRequest()
            .body(error(HttpStatus.BAD_REQUEST, "Bad Request",
                "Invalid request: " + ex.getMessage(), request).build());
    }

    @ExceptionHandler(UserContextBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(
            UserContextBusyException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("User context busy on {}", request.getRequestURI());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(error(HttpStatus.CONFLICT, "Concurrent Modification",
                "Another request for this user is in progress. Please retry.", request).build());
    }

    @ExceptionHandler(ConversationStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(
            ConversationStoreException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Conversation store failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(error(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "Conversation storage is temporarily unavailable. Please retry.", request).build());
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
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support.", request).build());
    }

    private static ErrorResponse.ErrorResponseBuilder error(
            HttpStatus status, String error, String detail, HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .detail(detail)
            .path(request.getRequestURI());
    }

    private static String jsonName(ObjectError error) {
        if (error instanceof FieldError) {
            return SNAKE_CASE.translate(((FieldError) error).getField());
        }
        return error.getObjectName();
    }
}
