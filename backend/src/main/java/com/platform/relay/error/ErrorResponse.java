package com.platform.relay.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * All API errors return this structure, including the {@code success:false, error}
 * pair that tenant clients check first.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Always false for error bodies.
     */
    private boolean success;

    /**
     * Short human-readable error, mirrored from message.
     */
    private String error;

    /**
     * Unique error code (e.g., RL-401).
     */
    private String code;

    private String message;

    /**
     * Detailed description for debugging.
     */
    private String detail;

    /**
     * Whether this error is fatal (requires intervention) or recoverable (can retry).
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    /**
     * Request path that caused the error.
     */
    private String path;

    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;

    /**
     * Field-level validation errors.
     */
    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }

    /**
     * Create from ErrorCode with custom message.
     */
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .success(false)
            .error(message)
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }

    /**
     * Create from ErrorCode with its default message.
     */
    public static ErrorResponse of(ErrorCode errorCode, int status, String path, String traceId) {
        return of(errorCode, errorCode.getDefaultMessage(), status, path, traceId);
    }
}
