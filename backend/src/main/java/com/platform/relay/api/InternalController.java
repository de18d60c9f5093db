package com.platform.relay.api;

import com.platform.relay.agent.AgentRegistry;
import com.platform.relay.agent.AgentSummary;
import com.platform.relay.core.CircuitBreakerManager;
import com.platform.relay.error.ResourceNotFoundException;
import com.platform.relay.keystore.KeyStore;
import com.platform.relay.network.NetworkAllocation;
import com.platform.relay.network.NetworkAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Provisioning API for the platform backend. Guarded by the internal token filter.
 */
@Slf4j
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
public class InternalController {

    private final NetworkAllocator networkAllocator;
    private final KeyStore keyStore;
    private final AgentRegistry registry;
    private final CircuitBreakerManager circuitBreakerManager;

    @PostMapping("/tenants/{tenantId}/network")
    public NetworkAllocation allocateNetwork(@PathVariable String tenantId) {
        return networkAllocator.allocate(tenantId);
    }

    @PostMapping("/tenants/{tenantId}/network/relay")
    public NetworkAllocation attachRelay(@PathVariable String tenantId) {
        return networkAllocator.attachRelay(tenantId);
    }

    @DeleteMapping("/tenants/{tenantId}/network")
    public ResponseEntity<Void> releaseNetwork(@PathVariable String tenantId) {
        networkAllocator.release(tenantId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tenants/{tenantId}/network")
    public NetworkAllocation getNetwork(@PathVariable String tenantId) {
        return networkAllocator.find(tenantId)
            .orElseThrow(() -> ResourceNotFoundException.network(tenantId));
    }

    /**
     * Drop a tenant's cached key so the next request reloads it from the database.
     */
    @DeleteMapping("/tenants/{tenantId}/credentials/cache")
    public Map<String, Object> invalidateCredentials(@PathVariable String tenantId) {
        int evicted = keyStore.invalidateTenant(tenantId);
        log.info("Evicted {} cached key(s) for tenant {}", evicted, tenantId);
        return Map.of("success", true, "evicted", evicted);
    }

    @GetMapping("/agents")
    public List<AgentSummary> listAgents() {
        return registry.list();
    }

    @GetMapping("/circuit-breakers")
    public Map<String, CircuitBreakerManager.CircuitBreakerStatus> circuitBreakers() {
        return circuitBreakerManager.getAllStates();
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    public Map<String, CircuitBreakerManager.CircuitBreakerStatus> resetCircuitBreaker(@PathVariable String name) {
        circuitBreakerManager.reset(name);
        return circuitBreakerManager.getAllStates();
    }
}
