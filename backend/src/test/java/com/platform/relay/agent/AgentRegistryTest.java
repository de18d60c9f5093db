package com.platform.relay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.relay.error.AgentOwnershipException;
import com.platform.relay.observability.RelayMetrics;
import com.platform.relay.security.SecurityAuditLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> disconnected = new ArrayList<>();
    private Clock clock;
    private SimpleMeterRegistry meterRegistry;
    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        meterRegistry = new SimpleMeterRegistry();
        registry = new AgentRegistry(new AgentMessageCodec(mapper), clock,
            new RelayMetrics(meterRegistry), new SecurityAuditLogger());
        registry.addDisconnectListener((agentId, connectionId, reason) ->
            disconnected.add(agentId + "/" + connectionId + "/" + reason));
    }

    @Test
    void registerGreetsAgent() throws Exception {
        RecordingAgentConnection connection = new RecordingAgentConnection("c1");

        registry.register("agent-1", "tenant-a", connection, new AgentMetadata("vm-1", "windows", "2.0"));

        JsonNode welcome = mapper.readTree(connection.sent().get(0));
        assertThat(welcome.path("type").asText()).isEqualTo("welcome");
        assertThat(welcome.path("agentId").asText()).isEqualTo("agent-1");
        assertThat(welcome.path("timestamp").asText()).isEqualTo(T0.toString());
        assertThat(registry.isConnected("agent-1")).isTrue();
        assertThat(meterRegistry.get("relay.agents.connected").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void reconnectReplacesAndClosesPreviousConnection() {
        RecordingAgentConnection first = new RecordingAgentConnection("c1");
        RecordingAgentConnection second = new RecordingAgentConnection("c2");

        registry.register("agent-1", "tenant-a", first, null);
        registry.register("agent-1", "tenant-a", second, null);

        assertThat(first.isOpen()).isFalse();
        assertThat(registry.get("agent-1")).get()
            .extracting(AgentRecord::getConnection)
            .isSameAs(second);
        assertThat(disconnected).containsExactly("agent-1/c1/replaced");
        assertThat(registry.connectedCount()).isEqualTo(1);
    }

    @Test
    void closeOfSupersededConnectionKeepsReplacement() {
        RecordingAgentConnection first = new RecordingAgentConnection("c1");
        RecordingAgentConnection second = new RecordingAgentConnection("c2");
        registry.register("agent-1", "tenant-a", first, null);
        registry.register("agent-1", "tenant-a", second, null);
        disconnected.clear();

        boolean removed = registry.connectionClosed("agent-1", first, "closed");

        assertThat(removed).isFalse();
        assertThat(registry.isConnected("agent-1")).isTrue();
        assertThat(disconnected).isEmpty();
    }

    @Test
    void liveAgentIdCannotBeClaimedByAnotherTenant() {
        RecordingAgentConnection owner = new RecordingAgentConnection("c1");
        registry.register("agent-1", "tenant-a", owner, null);

        assertThatThrownBy(() ->
            registry.register("agent-1", "tenant-b", new RecordingAgentConnection("c2"), null))
            .isInstanceOf(AgentOwnershipException.class);

        assertThat(owner.isOpen()).isTrue();
        assertThat(registry.getForTenant("agent-1", "tenant-a")).isPresent();
        assertThat(registry.getForTenant("agent-1", "tenant-b")).isEmpty();
    }

    @Test
    void failedWelcomeLeavesAgentUnregistered() {
        RecordingAgentConnection connection = new RecordingAgentConnection("c1");
        connection.failSends();

        registry.register("agent-1", "tenant-a", connection, null);

        assertThat(registry.get("agent-1")).isEmpty();
        assertThat(disconnected).containsExactly("agent-1/c1/welcome failed");
    }

    @Test
    void listIsScopedToTenant() {
        registry.register("agent-1", "tenant-a", new RecordingAgentConnection("c1"), null);
        registry.register("agent-2", "tenant-b", new RecordingAgentConnection("c2"), null);
        registry.register("agent-3", "tenant-a", new RecordingAgentConnection("c3"), null);

        assertThat(registry.list("tenant-a")).extracting(AgentSummary::agentId)
            .containsExactlyInAnyOrder("agent-1", "agent-3");
        assertThat(registry.list()).hasSize(3);
    }

    @Test
    void statusUpdatesAreMerged() {
        registry.register("agent-1", "tenant-a", new RecordingAgentConnection("c1"), null);

        registry.updateStatus("agent-1", Map.of("cpu", 10, "disk", "ok"));
        registry.updateStatus("agent-1", Map.of("cpu", 55));

        assertThat(registry.get("agent-1").orElseThrow().toSummary().status())
            .containsEntry("cpu", 55)
            .containsEntry("disk", "ok");
    }

    @Test
    void silentAgentsAreEvicted() {
        RecordingAgentConnection quiet = new RecordingAgentConnection("c1");
        registry.register("agent-1", "tenant-a", quiet, null);
        registry.register("agent-2", "tenant-a", new RecordingAgentConnection("c2"), null);

        when(clock.instant()).thenReturn(T0.plusSeconds(100));
        registry.touch("agent-2");
        when(clock.instant()).thenReturn(T0.plusSeconds(150));

        int evicted = registry.evictStale(Duration.ofSeconds(120));

        assertThat(evicted).isEqualTo(1);
        assertThat(quiet.isOpen()).isFalse();
        assertThat(registry.get("agent-1")).isEmpty();
        assertThat(registry.isConnected("agent-2")).isTrue();
    }

    @Test
    void closeAllRemovesEveryAgent() {
        RecordingAgentConnection one = new RecordingAgentConnection("c1");
        RecordingAgentConnection two = new RecordingAgentConnection("c2");
        registry.register("agent-1", "tenant-a", one, null);
        registry.register("agent-2", "tenant-b", two, null);

        registry.closeAll("shutdown");

        assertThat(registry.connectedCount()).isZero();
        assertThat(one.closeReason()).isEqualTo("shutdown");
        assertThat(two.isOpen()).isFalse();
    }
}
