package com.platform.relay.keystore;

import com.platform.relay.observability.RelayMetrics;
import com.platform.relay.persistence.repository.TenantCredentialJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Generates a tenant's encryption key on first use.
 *
 * The key is written with a conditional update, so when two requests race only
 * one key is stored and both return it.
 */
@Slf4j
@Component
public class TenantKeyProvisioner {

    private static final int KEY_BYTES = 32;

    private final TenantCredentialJpaRepository repository;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final RelayMetrics metrics;

    public TenantKeyProvisioner(
            TenantCredentialJpaRepository repository,
            SecureRandom secureRandom,
            Clock clock,
            RelayMetrics metrics) {
        this.repository = repository;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Transactional
    public String ensureKey(String tenantId) {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        String candidate = HexFormat.of().formatHex(raw);

        int updated = repository.assignKeyIfAbsent(tenantId, candidate, Instant.now(clock));
        if (updated == 1) {
            log.info("Generated encryption key for tenant {}", tenantId);
            metrics.recordKeyGenerated();
            return candidate;
        }

        log.debug("Tenant {} already has a key, using the stored one", tenantId);
        return repository.findEncryptionKeyById(tenantId)
            .orElseThrow(() -> new IllegalStateException("Tenant " + tenantId + " has no encryption key after assignment"));
    }
}
