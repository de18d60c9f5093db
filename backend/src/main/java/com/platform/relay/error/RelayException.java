package com.platform.relay.error;

/**
 * Base exception for all relay exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class RelayException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RelayException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected RelayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RelayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
