package com.platform.relay.network;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.ErrorCode;
import com.platform.relay.error.NetworkIsolationException;
import com.platform.relay.error.NetworkProvisioningException;
import com.platform.relay.error.RelayException;
import com.platform.relay.error.ResourceNotFoundException;
import com.platform.relay.observability.RelayMetrics;
import com.platform.relay.persistence.entity.TenantNetworkEntity;
import com.platform.relay.persistence.repository.TenantNetworkJpaRepository;
import com.platform.relay.security.SecurityAuditLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Provisions one isolated Docker bridge network per tenant and multi-homes the relay onto it.
 *
 * <p>Subnets are /24 blocks (by default) carved from a private pool. A tenant's preferred block
 * is derived from a hash of its id; collisions are resolved by linear probing over the blocks
 * not held by a live allocation. A block stays reserved until its Docker network is confirmed
 * removed.
 */
@Slf4j
@Service
public class NetworkAllocator {

    public static final String LABEL_TENANT = "relay.tenant-id";
    public static final String LABEL_MANAGED = "relay.managed";

    static final int GATEWAY_OFFSET = 1;
    static final int FILE_SHARE_OFFSET = 2;
    static final int VM_OFFSET = 3;
    static final int RELAY_OFFSET = 4;

    private static final int MAX_RESERVE_ATTEMPTS = 3;

    private final TenantNetworkJpaRepository repository;
    private final DockerNetworkClient docker;
    private final RelayProperties.Network config;
    private final RelayMetrics metrics;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;
    private final Ipv4Cidr pool;
    private final List<Ipv4Cidr> controlPlane;

    public NetworkAllocator(TenantNetworkJpaRepository repository,
                            DockerNetworkClient docker,
                            RelayProperties properties,
                            RelayMetrics metrics,
                            SecurityAuditLogger auditLogger,
                            Clock clock) {
        this.repository = repository;
        this.docker = docker;
        this.config = properties.getNetwork();
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.pool = Ipv4Cidr.parse(config.getPoolCidr());
        this.controlPlane = config.getControlPlaneCidrs().stream().map(Ipv4Cidr::parse).toList();
        if (config.getTenantPrefix() < pool.prefix() || config.getTenantPrefix() > 29) {
            throw new IllegalStateException("relay.network.tenant-prefix /" + config.getTenantPrefix()
                + " does not fit pool " + pool);
        }
    }

    /**
     * Allocate (or return the existing) isolated network for a tenant.
     */
    public NetworkAllocation allocate(String tenantId) {
        requireEnabled(tenantId);
        Optional<TenantNetworkEntity> existing = repository.findById(tenantId);
        if (existing.isPresent()) {
            TenantNetworkEntity entity = existing.get();
            if (entity.getStatus() == NetworkStatus.ACTIVE && entity.getNetworkId() != null) {
                log.debug("Tenant {} already has network {}", tenantId, entity.getNetworkName());
                return NetworkAllocation.from(entity);
            }
            if (entity.getStatus() == NetworkStatus.RELEASING) {
                throw new NetworkProvisioningException(ErrorCode.NETWORK_PROVISIONING_FAILED, tenantId,
                    "Previous network " + entity.getNetworkName() + " is still being released");
            }
        }

        TenantNetworkEntity reserved = reserve(tenantId, existing.orElse(null));
        Ipv4Cidr subnet = Ipv4Cidr.parse(reserved.getSubnetCidr());
        String createdId = null;
        try {
            verifyPlanned(tenantId, subnet);
            createdId = createOrAdopt(tenantId, reserved, subnet);
            verifyCreated(tenantId, subnet, createdId);

            reserved.setNetworkId(createdId);
            TenantNetworkEntity saved = repository.saveAndFlush(reserved);
            metrics.recordNetworkOperation("allocate", true);
            auditLogger.logNetworkOperation(tenantId, "ALLOCATE", subnet.toString(), true, saved.getNetworkName());
            log.info("Allocated network {} ({}) for tenant {}", saved.getNetworkName(), subnet, tenantId);
            return NetworkAllocation.from(saved);
        } catch (RuntimeException e) {
            rollback(reserved, createdId);
            metrics.recordNetworkOperation("allocate", false);
            auditLogger.logNetworkOperation(tenantId, "ALLOCATE", subnet.toString(), false, e.getMessage());
            if (e instanceof RelayException) {
                throw e;
            }
            throw new NetworkProvisioningException(tenantId, "Failed to create tenant network: " + e.getMessage(), e);
        }
    }

    /**
     * Connect the relay container to the tenant network at its fixed relay address.
     */
    public NetworkAllocation attachRelay(String tenantId) {
        requireEnabled(tenantId);
        TenantNetworkEntity entity = repository.findById(tenantId)
            .filter(e -> e.getStatus() == NetworkStatus.ACTIVE && e.getNetworkId() != null)
            .orElseThrow(() -> ResourceNotFoundException.network(tenantId));

        boolean connected = docker.connectContainer(entity.getNetworkId(), config.getRelayContainer(),
            entity.getRelayAddress());
        if (!connected) {
            log.debug("Relay already attached to {}", entity.getNetworkName());
        }
        entity.setRelayAttached(true);
        TenantNetworkEntity saved = repository.saveAndFlush(entity);
        metrics.recordNetworkOperation("attach_relay", true);
        auditLogger.logNetworkOperation(tenantId, "ATTACH_RELAY", entity.getSubnetCidr(), true,
            entity.getRelayAddress());
        return NetworkAllocation.from(saved);
    }

    /**
     * Tear down a tenant network. Idempotent; a failed removal leaves the record RELEASING.
     */
    public void release(String tenantId) {
        requireEnabled(tenantId);
        Optional<TenantNetworkEntity> found = repository.findById(tenantId);
        if (found.isEmpty() || found.get().getStatus() == NetworkStatus.RELEASED) {
            log.debug("No live network for tenant {}", tenantId);
            return;
        }
        TenantNetworkEntity entity = found.get();
        entity.setStatus(NetworkStatus.RELEASING);
        entity = repository.saveAndFlush(entity);

        try {
            if (entity.getNetworkId() != null) {
                docker.disconnectContainer(entity.getNetworkId(), config.getRelayContainer());
                docker.removeNetwork(entity.getNetworkId());
            }
        } catch (RuntimeException e) {
            metrics.recordNetworkOperation("release", false);
            auditLogger.logNetworkOperation(tenantId, "RELEASE", entity.getSubnetCidr(), false, e.getMessage());
            log.error("Failed to remove network {} for tenant {}: {}", entity.getNetworkName(), tenantId, e.getMessage());
            throw e;
        }

        markReleased(entity);
        metrics.recordNetworkOperation("release", true);
        auditLogger.logNetworkOperation(tenantId, "RELEASE", entity.getSubnetCidr(), true, entity.getNetworkName());
        log.info("Released network {} for tenant {}", entity.getNetworkName(), tenantId);
    }

    public Optional<NetworkAllocation> find(String tenantId) {
        return repository.findById(tenantId).map(NetworkAllocation::from);
    }

    /**
     * Preferred block index for a tenant. Stable across restarts and JVMs.
     */
    int preferredIndex(String tenantId) {
        int blocks = pool.blockCount(config.getTenantPrefix());
        byte[] digest = sha256(tenantId);
        long hash = ((digest[0] & 0xFFL) << 24) | ((digest[1] & 0xFFL) << 16)
            | ((digest[2] & 0xFFL) << 8) | (digest[3] & 0xFFL);
        return (int) (hash % blocks);
    }

    String networkName(String tenantId) {
        String shortId = tenantId.length() > 8 ? tenantId.substring(0, 8) : tenantId;
        return config.getNamePrefix() + shortId + "-net";
    }

    private TenantNetworkEntity reserve(String tenantId, TenantNetworkEntity previous) {
        for (int attempt = 1; ; attempt++) {
            Set<Integer> used = new HashSet<>();
            for (TenantNetworkEntity live : repository.findByStatusNot(NetworkStatus.RELEASED)) {
                if (live.getSubnetIndex() != null && !live.getTenantId().equals(tenantId)) {
                    used.add(live.getSubnetIndex());
                }
            }
            int index = probe(tenantId, used);
            Ipv4Cidr subnet = pool.block(index, config.getTenantPrefix());

            TenantNetworkEntity entity = previous != null ? previous : new TenantNetworkEntity();
            entity.setTenantId(tenantId);
            entity.setSubnetIndex(index);
            entity.setSubnetCidr(subnet.toString());
            entity.setGateway(subnet.address(GATEWAY_OFFSET));
            entity.setFileShareAddress(subnet.address(FILE_SHARE_OFFSET));
            entity.setVmAddress(subnet.address(VM_OFFSET));
            entity.setRelayAddress(subnet.address(RELAY_OFFSET));
            entity.setNetworkName(networkName(tenantId));
            entity.setNetworkId(null);
            entity.setStatus(NetworkStatus.ACTIVE);
            entity.setRelayAttached(false);
            entity.setCreatedAt(clock.instant());
            entity.setReleasedAt(null);
            try {
                return repository.saveAndFlush(entity);
            } catch (DataIntegrityViolationException e) {
                if (attempt >= MAX_RESERVE_ATTEMPTS) {
                    throw new NetworkProvisioningException(tenantId, "Could not reserve a subnet", e);
                }
                log.debug("Subnet index {} taken concurrently, probing again", index);
                previous = repository.findById(tenantId).orElse(null);
            }
        }
    }

    private int probe(String tenantId, Set<Integer> used) {
        int blocks = pool.blockCount(config.getTenantPrefix());
        int start = preferredIndex(tenantId);
        for (int i = 0; i < blocks; i++) {
            int index = (start + i) % blocks;
            if (used.contains(index)) {
                continue;
            }
            Ipv4Cidr candidate = pool.block(index, config.getTenantPrefix());
            if (controlPlane.stream().noneMatch(candidate::overlaps)) {
                return index;
            }
        }
        throw NetworkProvisioningException.poolExhausted(tenantId, blocks);
    }

    private void verifyPlanned(String tenantId, Ipv4Cidr subnet) {
        if (!pool.contains(subnet)) {
            throw new NetworkIsolationException(tenantId, subnet.toString(), "outside pool " + pool);
        }
        for (Ipv4Cidr reserved : controlPlane) {
            if (reserved.overlaps(subnet)) {
                throw new NetworkIsolationException(tenantId, subnet.toString(),
                    "overlaps control-plane range " + reserved);
            }
        }
        for (TenantNetworkEntity other : repository.findByStatusNot(NetworkStatus.RELEASED)) {
            if (!other.getTenantId().equals(tenantId)
                && Ipv4Cidr.parse(other.getSubnetCidr()).overlaps(subnet)) {
                throw new NetworkIsolationException(tenantId, subnet.toString(),
                    "overlaps tenant " + other.getTenantId());
            }
        }
    }

    private String createOrAdopt(String tenantId, TenantNetworkEntity reserved, Ipv4Cidr subnet) {
        Optional<DockerNetwork> present = docker.inspectNetwork(reserved.getNetworkName());
        if (present.isPresent()) {
            DockerNetwork network = present.get();
            if (!tenantId.equals(network.labels().get(LABEL_TENANT))) {
                throw new NetworkIsolationException(tenantId, subnet.toString(),
                    "network name " + network.name() + " is taken by another owner");
            }
            if (network.subnets().contains(subnet)) {
                log.info("Adopting existing network {} for tenant {}", network.name(), tenantId);
                return network.id();
            }
            log.warn("Removing stale network {} with subnets {}", network.name(), network.subnets());
            docker.removeNetwork(network.id());
        }
        Map<String, String> labels = Map.of(LABEL_TENANT, tenantId, LABEL_MANAGED, "true");
        return docker.createNetwork(reserved.getNetworkName(), subnet, reserved.getGateway(), labels);
    }

    private void verifyCreated(String tenantId, Ipv4Cidr subnet, String networkId) {
        DockerNetwork created = docker.inspectNetwork(networkId)
            .orElseThrow(() -> new NetworkProvisioningException(ErrorCode.NETWORK_PROVISIONING_FAILED, tenantId,
                "Network " + networkId + " vanished after creation"));
        if (!created.subnets().equals(List.of(subnet))) {
            throw new NetworkIsolationException(tenantId, subnet.toString(),
                "Docker assigned " + created.subnets());
        }
        for (DockerNetwork other : docker.listNetworks()) {
            if (!other.id().equals(networkId) && other.overlaps(subnet)) {
                throw new NetworkIsolationException(tenantId, subnet.toString(),
                    "overlaps Docker network " + other.name());
            }
        }
    }

    private void rollback(TenantNetworkEntity reserved, String createdId) {
        if (createdId != null) {
            try {
                docker.removeNetwork(createdId);
            } catch (RuntimeException cleanup) {
                log.error("Failed to remove network {} after failed allocation: {}", createdId, cleanup.getMessage());
                reserved.setNetworkId(createdId);
                reserved.setStatus(NetworkStatus.RELEASING);
                repository.saveAndFlush(reserved);
                return;
            }
        }
        markReleased(reserved);
    }

    private void markReleased(TenantNetworkEntity entity) {
        entity.setStatus(NetworkStatus.RELEASED);
        entity.setSubnetIndex(null);
        entity.setRelayAttached(false);
        entity.setReleasedAt(clock.instant());
        repository.saveAndFlush(entity);
    }

    private void requireEnabled(String tenantId) {
        if (!config.isEnabled()) {
            throw new NetworkProvisioningException(ErrorCode.NETWORK_PROVISIONING_FAILED, tenantId,
                "Tenant network provisioning is disabled");
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
