package com.platform.relay.persistence.repository;

import com.platform.relay.persistence.entity.TenantCredentialEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Spring Data JPA repository for tenant credentials.
 */
@Repository
public interface TenantCredentialJpaRepository extends JpaRepository<TenantCredentialEntity, String> {

    Optional<TenantCredentialEntity> findBySecretHash(String secretHash);

    /**
     * Assign a key only if the tenant has none yet.
     * Returns 0 when another request won the race.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TenantCredentialEntity t SET t.encryptionKey = :key, t.keyGeneratedAt = :now " +
           "WHERE t.id = :id AND t.encryptionKey IS NULL")
    int assignKeyIfAbsent(@Param("id") String id, @Param("key") String key, @Param("now") Instant now);

    @Query("SELECT t.encryptionKey FROM TenantCredentialEntity t WHERE t.id = :id")
    Optional<String> findEncryptionKeyById(@Param("id") String id);
}
