package com.platform.relay.error;

public class EncryptionException extends RelayException {

    public EncryptionException(String message, Throwable cause) {
        super(ErrorCode.ENCRYPTION_ERROR, message, cause);
    }
}
