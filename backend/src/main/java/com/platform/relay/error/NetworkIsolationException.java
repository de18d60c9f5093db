package com.platform.relay.error;

/**
 * A tenant subnet would overlap the control plane, another tenant, or a foreign Docker network.
 */
public class NetworkIsolationException extends RelayException {

    private final String tenantId;
    private final String subnet;

    public NetworkIsolationException(String tenantId, String subnet, String reason) {
        super(ErrorCode.NETWORK_ISOLATION_VIOLATION,
            String.format("Subnet %s for tenant %s violates isolation: %s", subnet, tenantId, reason));
        this.tenantId = tenantId;
        this.subnet = subnet;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getSubnet() {
        return subnet;
    }
}
