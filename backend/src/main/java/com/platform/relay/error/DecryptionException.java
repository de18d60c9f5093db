package com.platform.relay.error;

/**
 * Ciphertext, nonce or tag failed GCM authentication. No plaintext is ever released.
 */
public class DecryptionException extends RelayException {

    public DecryptionException(Throwable cause) {
        super(ErrorCode.DECRYPTION_FAILED, ErrorCode.DECRYPTION_FAILED.getDefaultMessage(), cause);
    }
}
