package com.platform.relay.persistence.entity;

import com.platform.relay.network.NetworkStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for tenant network allocations.
 * subnet_index is unique among reserved subnets and cleared once the
 * allocation reaches RELEASED, which frees the block for reuse.
 */
@Entity
@Table(name = "tenant_networks", indexes = {
    @Index(name = "idx_tenant_networks_subnet_index", columnList = "subnet_index", unique = true),
    @Index(name = "idx_tenant_networks_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantNetworkEntity {

    @Id
    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(name = "subnet_index", unique = true)
    private Integer subnetIndex;

    @Column(name = "subnet_cidr", length = 18, nullable = false)
    private String subnetCidr;

    @Column(length = 15, nullable = false)
    private String gateway;

    @Column(name = "vm_address", length = 15, nullable = false)
    private String vmAddress;

    @Column(name = "file_share_address", length = 15, nullable = false)
    private String fileShareAddress;

    @Column(name = "relay_address", length = 15, nullable = false)
    private String relayAddress;

    @Column(name = "network_name", nullable = false)
    private String networkName;

    @Column(name = "network_id", length = 64)
    private String networkId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private NetworkStatus status;

    @Column(name = "relay_attached", nullable = false)
    private boolean relayAttached;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Version
    @Column(nullable = false)
    private Long version;
}
