package com.platform.relay.error;

/**
 * Exception for validation errors.
 */
public class ValidationException extends RelayException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException missingField(String field) {
        return new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, field, null,
            String.format("Missing required field: %s", field));
    }

    public static ValidationException unknownTool(String tool) {
        return new ValidationException(ErrorCode.UNKNOWN_TOOL, "tool", tool,
            String.format("Unknown tool: %s", tool));
    }

    public static ValidationException invalidArgument(String argument, Object value) {
        return new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "arguments." + argument, value,
            String.format("Argument %s must be a string, number or boolean", argument));
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
