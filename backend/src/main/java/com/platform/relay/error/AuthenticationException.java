package com.platform.relay.error;

/**
 * Raised when a presented tenant secret is missing or does not resolve to a tenant.
 */
public class AuthenticationException extends RelayException {

    public AuthenticationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public static AuthenticationException missing() {
        return new AuthenticationException(ErrorCode.MISSING_CREDENTIAL);
    }

    public static AuthenticationException invalid() {
        return new AuthenticationException(ErrorCode.INVALID_CREDENTIAL);
    }
}
