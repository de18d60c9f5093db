package com.platform.relay.error;

public class NetworkProvisioningException extends RelayException {

    private final String tenantId;

    public NetworkProvisioningException(String tenantId, String message, Throwable cause) {
        super(ErrorCode.NETWORK_PROVISIONING_FAILED, message, cause);
        this.tenantId = tenantId;
    }

    public NetworkProvisioningException(ErrorCode errorCode, String tenantId, String message) {
        super(errorCode, message);
        this.tenantId = tenantId;
    }

    public static NetworkProvisioningException poolExhausted(String tenantId, int blocks) {
        return new NetworkProvisioningException(ErrorCode.NETWORK_POOL_EXHAUSTED, tenantId,
            String.format("All %d tenant subnets are in use", blocks));
    }

    public String getTenantId() {
        return tenantId;
    }
}
