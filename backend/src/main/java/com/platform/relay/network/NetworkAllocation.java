package com.platform.relay.network;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.relay.persistence.entity.TenantNetworkEntity;

import java.time.Instant;

/**
 * A tenant's isolated network and the fixed role addresses inside it.
 * Serialized as-is by the provisioning API.
 */
public record NetworkAllocation(
    String tenantId,
    @JsonProperty("subnetCIDR") String subnetCIDR,
    String gatewayAddress,
    Addresses addresses,
    String networkName,
    String networkId,
    NetworkStatus status,
    boolean relayAttached,
    Instant createdAt
) {
    public record Addresses(String vm, String fileShare, String relay) {}

    static NetworkAllocation from(TenantNetworkEntity entity) {
        return new NetworkAllocation(
            entity.getTenantId(),
            entity.getSubnetCidr(),
            entity.getGateway(),
            new Addresses(entity.getVmAddress(), entity.getFileShareAddress(), entity.getRelayAddress()),
            entity.getNetworkName(),
            entity.getNetworkId(),
            entity.getStatus(),
            entity.isRelayAttached(),
            entity.getCreatedAt());
    }
}
