package com.platform.relay.security;

import com.platform.relay.keystore.TenantKey;

/**
 * The authenticated tenant of an API request, stored as a request attribute.
 */
public record TenantContext(String tenantId, String resourceName, String encryptionKey) {

    public static final String ATTRIBUTE = "relay.tenantContext";

    public static TenantContext of(TenantKey key) {
        return new TenantContext(key.tenantId(), key.resourceName(), key.encryptionKey());
    }

    public TenantKey toTenantKey() {
        return new TenantKey(tenantId, resourceName, encryptionKey);
    }

    @Override
    public String toString() {
        return "TenantContext[tenantId=" + tenantId + ", resourceName=" + resourceName + "]";
    }
}
