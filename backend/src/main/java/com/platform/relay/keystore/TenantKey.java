package com.platform.relay.keystore;

import java.util.HexFormat;

/**
 * A resolved tenant: identity plus its 256-bit encryption key as 64 hex chars.
 */
public record TenantKey(String tenantId, String resourceName, String encryptionKey) {

    public byte[] keyBytes() {
        return HexFormat.of().parseHex(encryptionKey);
    }

    @Override
    public String toString() {
        return "TenantKey[tenantId=" + tenantId + ", resourceName=" + resourceName + "]";
    }
}
