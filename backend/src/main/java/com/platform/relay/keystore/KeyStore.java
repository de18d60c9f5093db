package com.platform.relay.keystore;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.AuthenticationException;
import com.platform.relay.observability.RelayMetrics;
import com.platform.relay.persistence.entity.TenantCredentialEntity;
import com.platform.relay.persistence.repository.TenantCredentialJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves bearer secrets to tenant keys.
 *
 * Results are cached per secret hash for a fixed window from the first lookup.
 * Reads inside the window never touch the database and do not extend it.
 */
@Slf4j
@Service
public class KeyStore {

    private final TenantCredentialJpaRepository repository;
    private final TenantKeyProvisioner provisioner;
    private final RelayMetrics metrics;
    private final Clock clock;
    private final Duration ttl;

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    public KeyStore(
            TenantCredentialJpaRepository repository,
            TenantKeyProvisioner provisioner,
            RelayMetrics metrics,
            Clock clock,
            RelayProperties properties) {
        this.repository = repository;
        this.provisioner = provisioner;
        this.metrics = metrics;
        this.clock = clock;
        this.ttl = properties.getKeystore().getCacheTtl();
    }

    public TenantKey resolve(String secret) {
        if (secret == null || secret.isBlank()) {
            throw AuthenticationException.missing();
        }

        String secretHash = SecretHasher.hash(secret);
        Instant now = Instant.now(clock);

        CacheEntry cached = cache.get(secretHash);
        if (cached != null && !cached.isExpired(now, ttl)) {
            metrics.recordKeyCacheHit();
            return cached.tenantKey();
        }

        metrics.recordKeyCacheMiss();
        TenantCredentialEntity credential = repository.findBySecretHash(secretHash)
            .orElseThrow(AuthenticationException::invalid);

        String encryptionKey = credential.getEncryptionKey();
        if (encryptionKey == null || encryptionKey.isEmpty()) {
            encryptionKey = provisioner.ensureKey(credential.getId());
        }

        TenantKey tenantKey = new TenantKey(credential.getId(), credential.getResourceName(), encryptionKey);
        cache.put(secretHash, new CacheEntry(tenantKey, now));
        log.debug("Cached key for tenant {}", tenantKey.tenantId());
        return tenantKey;
    }

    /**
     * Drop every cached entry of a tenant, e.g. after its secret was rotated.
     */
    public int invalidateTenant(String tenantId) {
        int before = cache.size();
        cache.values().removeIf(entry -> entry.tenantKey().tenantId().equals(tenantId));
        int removed = before - cache.size();
        log.info("Invalidated {} cached key(s) for tenant {}", removed, tenantId);
        return removed;
    }

    @Scheduled(fixedDelayString = "${relay.keystore.sweep-interval:PT60S}")
    public void purgeExpired() {
        Instant now = Instant.now(clock);
        int before = cache.size();
        cache.values().removeIf(entry -> entry.isExpired(now, ttl));
        int purged = before - cache.size();
        if (purged > 0) {
            log.debug("Purged {} expired key cache entries", purged);
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    record CacheEntry(TenantKey tenantKey, Instant insertedAt) {

        boolean isExpired(Instant now, Duration ttl) {
            return !now.isBefore(insertedAt.plus(ttl));
        }
    }
}
