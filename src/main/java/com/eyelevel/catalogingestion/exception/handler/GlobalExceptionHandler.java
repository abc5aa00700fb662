package com.eyelevel.catalogingestion.exception.handler;

import com.eyelevel.catalogingestion.dto.common.ApiResponse;
import com.eyelevel.catalogingestion.exception.apiclient.ApiException;
import com.eyelevel.catalogingestion.exception.apiclient.BadRequestException;
import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import com.eyelevel.catalogingestion.exception.apiclient.ForbiddenException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles business-rule violations such as a non-PDF upload or an invalid page size. (400 Bad Request)
     */
    @ExceptionHandler({BadRequestException.class, JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed.");
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing required request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Required parameter is missing.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles a multipart request without the expected file part. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingRequestPart(MissingServletRequestPartException ex) {
        String errorMessage = String.format("Required part '%s' is missing.", ex.getRequestPartName());
        log.warn("Handling MissingServletRequestPartException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Required file is missing.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles uploads above the configured multipart limit. (400 Bad Request)
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Object>> handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex) {
        log.warn("Handling MaxUploadSizeExceededException: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("The uploaded file is too large.", ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid input provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> String.format("'%s': %s",
                        violation.getPropertyPath().toString().substring(violation.getPropertyPath().toString().lastIndexOf('.') + 1),
                        violation.getMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid input provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles method-level validation performed by Spring MVC itself. (400 Bad Request)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Object>> handleHandlerMethodValidation(HandlerMethodValidationException ex) {
        String errors = ex.getAllErrors().stream()
                .map(error -> Objects.toString(error.getDefaultMessage(), "invalid value"))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling handler method validation exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid input provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters (e.g., string for a Long). (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid parameter type provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles edits to staged data that is no longer under review. (403 Forbidden)
     */
    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiResponse<Object>> handleForbidden(ForbiddenException ex) {
        log.warn("Forbidden Access Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.FORBIDDEN);
    }

    /**
     * Handles resource not found errors. (404 Not Found)
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(NotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = ex.getSupportedMethods() == null ? "" : String.join(", ", ex.getSupportedMethods());
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Method not allowed.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles state conflicts such as importing twice or a stale version. (409 Conflict)
     */
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(ConflictException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.CONFLICT);
    }

    /**
     * Handles a concurrent update detected by the entity's version column at flush time. (409 Conflict)
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Object>> handleOptimisticLock(ObjectOptimisticLockingFailureException ex) {
        log.warn("Optimistic lock failure on {}: {}", ex.getPersistentClassName(), ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("The record was modified concurrently. Reload it and try again.");
        return new ResponseEntity<>(response, HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles any other {@link ApiException} with the status code it carries.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Object>> handleApiException(ApiException ex) {
        HttpStatus status = Objects.requireNonNullElse(HttpStatus.resolve(ex.getStatusCode()), HttpStatus.INTERNAL_SERVER_ERROR);
        if (status.is5xxServerError()) {
            log.error("API Exception with status {}: {}", status.value(), ex.getMessage(), ex);
        } else {
            log.warn("API Exception with status {}: {}", status.value(), ex.getMessage());
        }
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, status);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        ApiResponse<Object> response = ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
