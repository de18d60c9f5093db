package com.platform.relay.error;

import com.platform.relay.observability.RelayMetrics;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Global exception handler for all REST controllers.
 *
 * Converts exceptions to standardized ErrorResponse.
 * Logs all errors with appropriate severity.
 * Tracks error metrics.
 *
 * RULES:
 * - Never swallow exceptions (always log)
 * - Never return HTTP 200 on failure
 * - Always include error code for client action
 * - Distinguish fatal vs recoverable
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final RelayMetrics metrics;

    public GlobalExceptionHandler(RelayMetrics metrics) {
        this.metrics = metrics;
    }

    // ==================== Relay Exceptions ====================

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<ErrorResponse> handleRelayException(RelayException ex, HttpServletRequest request) {
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        logError(ex, errorCode, traceId);
        recordMetric(errorCode);

        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), status.value(),
            request.getRequestURI(), traceId);
        response.setDetail(errorCode.getDefaultMessage());
        response.setMetadata(metadataFor(ex));
        if (ex instanceof ValidationException validation && validation.getField() != null) {
            response.setFieldErrors(List.of(ErrorResponse.FieldError.builder()
                .field(validation.getField())
                .message(ex.getMessage())
                .rejectedValue(validation.getRejectedValue())
                .build()));
        }
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Async controller results arrive wrapped; unwrap and handle the cause.
     */
    @ExceptionHandler({CompletionException.class, ExecutionException.class})
    public ResponseEntity<ErrorResponse> handleAsyncWrapper(Exception ex, HttpServletRequest request) {
        Throwable cause = ex.getCause();
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RelayException relayException) {
            return handleRelayException(relayException, request);
        }
        return handleGenericException(cause instanceof Exception e ? e : ex, request);
    }

    // ==================== Spring Validation ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();

        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);

        String message = fieldErrors.isEmpty()
            ? "Validation failed"
            : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getMessage();
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, message,
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ErrorResponse.FieldError.builder()
                .field(getFieldName(cv))
                .message(cv.getMessage())
                .rejectedValue(cv.getInvalidValue())
                .build())
            .toList();

        log.warn("[{}] Constraint violation: {} violations", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Constraint violation",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        return ResponseEntity.badRequest().body(response);
    }

    // ==================== Database Errors ====================

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        String traceId = getOrCreateTraceId();

        // FATAL: Database errors are serious
        log.error("[{}] FATAL: Database error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.DATABASE_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.DATABASE_ERROR, "Database operation failed",
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);

        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.MISSING_REQUIRED_FIELD,
            String.format("Missing required parameter: %s", ex.getParameterName()),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);

        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_FIELD_VALUE,
            String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ErrorResponse.of(ErrorCode.INVALID_REQUEST,
            String.format("Method %s not supported for this endpoint", ex.getMethod()),
            HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), traceId));
    }

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleAsyncTimeout(
            AsyncRequestTimeoutException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Async request timed out: {}", traceId, request.getRequestURI());
        recordMetric(ErrorCode.COMMAND_TIMEOUT);

        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ErrorResponse.of(ErrorCode.COMMAND_TIMEOUT,
            HttpStatus.GATEWAY_TIMEOUT.value(), request.getRequestURI(), traceId));
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        String traceId = getOrCreateTraceId();

        // FATAL: Unexpected errors are always fatal
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    // ==================== Helpers ====================

    private String getOrCreateTraceId() {
        String traceId = MDC.get("trace_id");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("trace_id", traceId);
        }
        return traceId;
    }

    private void logError(RelayException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }

    private void recordMetric(ErrorCode errorCode) {
        metrics.incrementCounter("relay.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }

    private Map<String, Object> metadataFor(RelayException ex) {
        if (ex instanceof ResourceNotFoundException notFound) {
            return Map.of("resourceType", notFound.getResourceType(), "resourceId", notFound.getResourceId());
        }
        if (ex instanceof AgentCommandException command) {
            return command.getCommandId() == null
                ? Map.of("agentId", command.getAgentId())
                : Map.of("agentId", command.getAgentId(), "commandId", command.getCommandId());
        }
        if (ex instanceof NetworkIsolationException isolation) {
            return Map.of("tenantId", isolation.getTenantId(), "subnet", isolation.getSubnet());
        }
        if (ex instanceof DockerDaemonUnavailableException docker) {
            return Map.of("operation", docker.getOperation());
        }
        return null;
    }

    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, AGENT_NOT_FOUND, NETWORK_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case NETWORK_ISOLATION_VIOLATION ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE, UNKNOWN_TOOL,
                 AGENT_PROTOCOL_ERROR ->
                HttpStatus.BAD_REQUEST;
            case MISSING_CREDENTIAL, INVALID_CREDENTIAL ->
                HttpStatus.UNAUTHORIZED;
            case FORBIDDEN ->
                HttpStatus.FORBIDDEN;
            case AGENT_UNAVAILABLE, NETWORK_POOL_EXHAUSTED, NETWORK_PROVISIONING_FAILED, DOCKER_UNAVAILABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            case COMMAND_TIMEOUT ->
                HttpStatus.GATEWAY_TIMEOUT;
            case AGENT_DISCONNECTED, COMMAND_FAILED ->
                HttpStatus.BAD_GATEWAY;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private String getFieldName(ConstraintViolation<?> cv) {
        String path = cv.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot > 0 ? path.substring(lastDot + 1) : path;
    }
}
