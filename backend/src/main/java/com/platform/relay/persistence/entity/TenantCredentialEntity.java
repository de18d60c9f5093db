package com.platform.relay.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * JPA entity for tenant credentials.
 * The bearer secret is stored only as a SHA-256 hex digest. The encryption key
 * stays null until the tenant's first authenticated request.
 */
@Entity
@Table(name = "tenant_credentials", indexes = {
    @Index(name = "idx_tenant_credentials_secret_hash", columnList = "secret_hash", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantCredentialEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "resource_name", nullable = false)
    private String resourceName;

    @Column(name = "secret_hash", length = 64, nullable = false, unique = true)
    private String secretHash;

    /**
     * 64 hex chars (256 bits).
     */
    @Column(name = "encryption_key", length = 64)
    private String encryptionKey;

    @Column(name = "key_generated_at")
    private Instant keyGeneratedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(nullable = false)
    private Long version;
}
