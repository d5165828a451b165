package com.webdynamo.contact_manager.exception;

import com.webdynamo.contact_manager.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders every failure as {@code {"errors": "..."}}.
 * Messages of unexpected failures are logged, never returned.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle bean validation errors on request bodies and query objects
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .sorted(Comparator.comparing(FieldError::getField))
                .map(error -> error.getField() + ": " + describe(error))
                .collect(Collectors.joining(", "));

        if (errors.isEmpty()) {
            errors = ex.getBindingResult().getAllErrors().stream()
                    .map(MessageSourceResolvable::getDefaultMessage)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining(", "));
        }

        log.warn("Validation errors: {}", errors);
        return error(HttpStatus.BAD_REQUEST, errors);
    }

    /**
     * Handle constraint violations on individual handler parameters (path variables, headers, query values)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        String errors = ex.getParameterValidationResults().stream()
                .flatMap(result -> {
                    String name = Objects.requireNonNullElse(
                            result.getMethodParameter().getParameterName(), "parameter");
                    return result.getResolvableErrors().stream()
                            .map(MessageSourceResolvable::getDefaultMessage)
                            .filter(Objects::nonNull)
                            .map(message -> name + ": " + message);
                })
                .sorted()
                .collect(Collectors.joining(", "));

        log.warn("Parameter validation errors: {}", errors);
        return error(HttpStatus.BAD_REQUEST, errors);
    }

    /**
     * Handle missing or malformed JSON body
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request body is missing or malformed");
    }

    /**
     * Handle non-numeric ids and similar path/query conversion failures
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());
        return error(HttpStatus.BAD_REQUEST, ex.getName() + ": invalid value");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("Missing header: {}", ex.getHeaderName());
        return error(HttpStatus.BAD_REQUEST, ex.getHeaderName() + " header is required");
    }

    /**
     * Handle domain failures (validation, unauthorized, not found)
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex) {
        log.warn("{} {}: {}", ex.getStatus().value(), ex.getClass().getSimpleName(), ex.getMessage());
        return error(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        log.warn("No route: {}", ex.getResourcePath());
        return error(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not supported: {}", ex.getMethod());
        return error(HttpStatus.METHOD_NOT_ALLOWED, "Method " + ex.getMethod() + " is not supported");
    }

    /**
     * Handle constraint violations that slipped past the service checks
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request conflicts with existing data");
    }

    /**
     * Handle database/data access errors
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException ex) {
        log.error("Database exception: ", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    /**
     * Catch-all for any other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected exception: ", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static String describe(FieldError error) {
        // Conversion failures carry framework text such as "Failed to convert property value..."
        if (error.isBindingFailure()) {
            return "invalid value";
        }
        return error.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String errors) {
        return ResponseEntity.status(status).body(new ErrorResponse(errors));
    }
}
