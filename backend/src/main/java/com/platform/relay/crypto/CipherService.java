package com.platform.relay.crypto;

import com.platform.relay.error.DecryptionException;
import com.platform.relay.error.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM encryption of scripts and commands.
 *
 * A fresh 96-bit nonce is drawn for every call. Decryption verifies the tag
 * before releasing any plaintext.
 */
@Slf4j
@Service
public class CipherService {

    public static final String ALGORITHM = "aes-256-gcm";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int NONCE_BYTES = 12;
    static final int TAG_BYTES = 16;
    private static final int KEY_BYTES = 32;

    private final SecureRandom secureRandom;

    public CipherService(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public EncryptedPayload encrypt(String plaintext, byte[] key) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    public EncryptedPayload encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        byte[] nonce = new byte[NONCE_BYTES];
        secureRandom.nextBytes(nonce);

        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BYTES * 8, nonce));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt payload", e);
        }

        int split = sealed.length - TAG_BYTES;
        return new EncryptedPayload(
            Arrays.copyOfRange(sealed, 0, split),
            nonce,
            Arrays.copyOfRange(sealed, split, sealed.length));
    }

    /**
     * Authenticate and decrypt. Any modification of ciphertext, nonce or tag fails.
     */
    public byte[] decrypt(EncryptedPayload payload, byte[] key) {
        requireKey(key);
        byte[] sealed = new byte[payload.ciphertext().length + payload.tag().length];
        System.arraycopy(payload.ciphertext(), 0, sealed, 0, payload.ciphertext().length);
        System.arraycopy(payload.tag(), 0, sealed, payload.ciphertext().length, payload.tag().length);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                new GCMParameterSpec(TAG_BYTES * 8, payload.nonce()));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            log.warn("Rejected payload with invalid authentication tag");
            throw new DecryptionException(e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException(e);
        }
    }

    public String decryptToString(EncryptedPayload payload, byte[] key) {
        return new String(decrypt(payload, key), StandardCharsets.UTF_8);
    }

    private void requireKey(byte[] key) {
        if (key == null || key.length != KEY_BYTES) {
            throw new IllegalArgumentException("AES-256 key must be 32 bytes, got "
                + (key == null ? "null" : key.length));
        }
    }
}
