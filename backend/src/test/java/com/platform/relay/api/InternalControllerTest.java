package com.platform.relay.api;

import com.platform.relay.agent.AgentRegistry;
import com.platform.relay.core.CircuitBreakerManager;
import com.platform.relay.error.GlobalExceptionHandler;
import com.platform.relay.error.NetworkProvisioningException;
import com.platform.relay.keystore.KeyStore;
import com.platform.relay.network.NetworkAllocation;
import com.platform.relay.network.NetworkAllocator;
import com.platform.relay.network.NetworkStatus;
import com.platform.relay.observability.RelayMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InternalControllerTest {

    private NetworkAllocator networkAllocator;
    private KeyStore keyStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        networkAllocator = mock(NetworkAllocator.class);
        keyStore = mock(KeyStore.class);
        RelayMetrics metrics = new RelayMetrics(new SimpleMeterRegistry());
        CircuitBreakerManager circuitBreakers = new CircuitBreakerManager(CircuitBreakerRegistry.ofDefaults(), metrics);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new InternalController(networkAllocator, keyStore, mock(AgentRegistry.class), circuitBreakers))
            .setControllerAdvice(new GlobalExceptionHandler(metrics))
            .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json().build()))
            .build();
    }

    @Test
    void allocationIsReturned() throws Exception {
        when(networkAllocator.allocate("tenant-1")).thenReturn(new NetworkAllocation("tenant-1", "10.64.9.0/24",
            "10.64.9.1", new NetworkAllocation.Addresses("10.64.9.3", "10.64.9.2", "10.64.9.4"), "relay-tenant-tenant-1-net", "net-1",
            NetworkStatus.ACTIVE, false, Instant.parse("2026-05-01T08:00:00Z")));

        mockMvc.perform(post("/internal/tenants/tenant-1/network"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subnetCIDR").value("10.64.9.0/24"))
            .andExpect(jsonPath("$.gatewayAddress").value("10.64.9.1"))
            .andExpect(jsonPath("$.addresses.vm").value("10.64.9.3"))
            .andExpect(jsonPath("$.addresses.fileShare").value("10.64.9.2"))
            .andExpect(jsonPath("$.addresses.relay").value("10.64.9.4"))
            .andExpect(jsonPath("$.subnet").doesNotExist())
            .andExpect(jsonPath("$.vmAddress").doesNotExist())
            .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void exhaustedPoolIsServiceUnavailable() throws Exception {
        when(networkAllocator.allocate("tenant-1")).thenThrow(NetworkProvisioningException.poolExhausted("tenant-1", 2));

        mockMvc.perform(post("/internal/tenants/tenant-1/network"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value("RL-501"));
    }

    @Test
    void missingNetworkIsNotFound() throws Exception {
        when(networkAllocator.find("tenant-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/internal/tenants/tenant-1/network"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("RL-302"));
    }

    @Test
    void releaseReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/internal/tenants/tenant-1/network"))
            .andExpect(status().isNoContent());

        verify(networkAllocator).release("tenant-1");
    }

    @Test
    void failedReleaseIsReported() throws Exception {
        doThrow(new NetworkProvisioningException("tenant-1", "remove failed", new IllegalStateException("busy")))
            .when(networkAllocator).release("tenant-1");

        mockMvc.perform(delete("/internal/tenants/tenant-1/network"))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void credentialCacheCanBeFlushed() throws Exception {
        when(keyStore.invalidateTenant("tenant-1")).thenReturn(1);

        mockMvc.perform(delete("/internal/tenants/tenant-1/credentials/cache"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.evicted").value(1));
    }

    @Test
    void unknownCircuitBreakerIsNotFound() throws Exception {
        mockMvc.perform(post("/internal/circuit-breakers/kafka/reset"))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/internal/circuit-breakers/docker/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.docker.state").value("CLOSED"));
    }
}
