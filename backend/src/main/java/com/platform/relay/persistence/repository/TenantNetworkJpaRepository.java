package com.platform.relay.persistence.repository;

import com.platform.relay.network.NetworkStatus;
import com.platform.relay.persistence.entity.TenantNetworkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for tenant network allocations.
 */
@Repository
public interface TenantNetworkJpaRepository extends JpaRepository<TenantNetworkEntity, String> {

    /**
     * Allocations still holding their subnet (ACTIVE or RELEASING).
     */
    List<TenantNetworkEntity> findByStatusNot(NetworkStatus status);

    List<TenantNetworkEntity> findByStatus(NetworkStatus status);
}
