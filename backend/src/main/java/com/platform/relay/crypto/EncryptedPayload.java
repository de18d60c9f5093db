package com.platform.relay.crypto;

import java.util.HexFormat;

/**
 * AES-GCM output split into its wire parts. The tag is the trailing 16 bytes the
 * JCE appends to the ciphertext.
 */
public record EncryptedPayload(byte[] ciphertext, byte[] nonce, byte[] tag) {

    private static final HexFormat HEX = HexFormat.of();

    public String ciphertextHex() {
        return HEX.formatHex(ciphertext);
    }

    public String nonceHex() {
        return HEX.formatHex(nonce);
    }

    public String tagHex() {
        return HEX.formatHex(tag);
    }

    public static EncryptedPayload fromHex(String ciphertextHex, String nonceHex, String tagHex) {
        return new EncryptedPayload(HEX.parseHex(ciphertextHex), HEX.parseHex(nonceHex), HEX.parseHex(tagHex));
    }
}
