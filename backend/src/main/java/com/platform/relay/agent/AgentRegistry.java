package com.platform.relay.agent;

import com.platform.relay.error.AgentOwnershipException;
import com.platform.relay.observability.RelayMetrics;
import com.platform.relay.security.SecurityAuditLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live agent connections keyed by agent id.
 *
 * At most one record per agent. A reconnect replaces the record and closes the
 * superseded connection; close events of a superseded connection never remove
 * its replacement. Every removal notifies the disconnect listeners with the
 * id of the connection that went away.
 */
@Slf4j
@Service
public class AgentRegistry {

    private final Map<String, AgentRecord> agents = new ConcurrentHashMap<>();
    private final List<AgentDisconnectListener> listeners = new CopyOnWriteArrayList<>();

    private final AgentMessageCodec codec;
    private final Clock clock;
    private final RelayMetrics metrics;
    private final SecurityAuditLogger auditLogger;

    public AgentRegistry(AgentMessageCodec codec, Clock clock, RelayMetrics metrics, SecurityAuditLogger auditLogger) {
        this.codec = codec;
        this.clock = clock;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        metrics.registerGauge("relay.agents.connected", agents::size);
    }

    public void addDisconnectListener(AgentDisconnectListener listener) {
        listeners.add(listener);
    }

    /**
     * Register a freshly authenticated connection and greet the agent.
     *
     * @throws AgentOwnershipException if the agent id is live under another tenant
     */
    public AgentRecord register(String agentId, String tenantId, AgentConnection connection, AgentMetadata metadata) {
        Instant now = Instant.now(clock);
        AgentRecord record = new AgentRecord(agentId, tenantId, connection,
            metadata == null ? AgentMetadata.unknown() : metadata, now);

        AgentRecord[] replaced = new AgentRecord[1];
        AgentRecord current = agents.compute(agentId, (id, existing) -> {
            if (existing != null && existing.isConnected() && !existing.getTenantId().equals(tenantId)) {
                return existing;
            }
            replaced[0] = existing;
            return record;
        });

        if (current != record) {
            log.warn("Rejected agent {} for tenant {}: id is live under tenant {}",
                agentId, tenantId, current.getTenantId());
            throw new AgentOwnershipException(agentId);
        }

        AgentRecord previous = replaced[0];
        if (previous != null && !previous.getConnection().id().equals(connection.id())) {
            log.info("Agent {} reconnected, replacing connection {}", agentId, previous.getConnection().id());
            notifyListeners(previous, "replaced");
            previous.getConnection().close("replaced by new connection");
        }

        log.info("Agent connected: {} (tenant={}, hostname={}, platform={})",
            agentId, tenantId, record.getMetadata().hostname(), record.getMetadata().platform());
        auditLogger.logAgentConnected(agentId, tenantId, record.getMetadata().hostname());
        metrics.recordAgentConnected();

        try {
            connection.send(codec.encodeWelcome(agentId, now));
        } catch (IOException e) {
            log.warn("Failed to send welcome to agent {}: {}", agentId, e.getMessage());
            remove(record, "welcome failed");
        }
        return record;
    }

    /**
     * Remove the agent's current record whatever connection it holds.
     */
    public boolean unregister(String agentId, String reason) {
        AgentRecord record = agents.get(agentId);
        return record != null && remove(record, reason);
    }

    /**
     * Transport-level close or error. Only removes the record if it still
     * belongs to this connection.
     */
    public boolean connectionClosed(String agentId, AgentConnection connection, String reason) {
        AgentRecord record = agents.get(agentId);
        if (record == null || !record.getConnection().id().equals(connection.id())) {
            log.debug("Ignoring close of superseded connection {} for agent {}", connection.id(), agentId);
            return false;
        }
        return remove(record, reason);
    }

    public Optional<AgentRecord> get(String agentId) {
        return Optional.ofNullable(agentId).map(agents::get);
    }

    /**
     * The agent's record if it is connected and owned by the tenant.
     */
    public Optional<AgentRecord> getForTenant(String agentId, String tenantId) {
        return get(agentId)
            .filter(record -> record.getTenantId().equals(tenantId))
            .filter(AgentRecord::isConnected);
    }

    public List<AgentSummary> list() {
        return agents.values().stream()
            .sorted(Comparator.comparing(AgentRecord::getConnectedAt))
            .map(AgentRecord::toSummary)
            .toList();
    }

    public List<AgentSummary> list(String tenantId) {
        return agents.values().stream()
            .filter(record -> record.getTenantId().equals(tenantId))
            .sorted(Comparator.comparing(AgentRecord::getConnectedAt))
            .map(AgentRecord::toSummary)
            .toList();
    }

    public void touch(String agentId) {
        AgentRecord record = agents.get(agentId);
        if (record != null) {
            record.touch(Instant.now(clock));
            log.trace("Heartbeat from agent {}", agentId);
        }
    }

    public void updateStatus(String agentId, Map<String, Object> status) {
        AgentRecord record = agents.get(agentId);
        if (record != null) {
            record.mergeStatus(status);
            log.info("Agent {} status updated", agentId);
        }
    }

    public boolean isConnected(String agentId) {
        AgentRecord record = agents.get(agentId);
        return record != null && record.isConnected();
    }

    public int connectedCount() {
        return agents.size();
    }

    /**
     * Close and remove every agent silent for longer than {@code staleAfter}.
     */
    public int evictStale(Duration staleAfter) {
        Instant cutoff = Instant.now(clock).minus(staleAfter);
        int evicted = 0;
        for (AgentRecord record : agents.values()) {
            if (record.getLastSeenAt().isBefore(cutoff) && remove(record, "stale")) {
                evicted++;
            }
        }
        return evicted;
    }

    public void closeAll(String reason) {
        for (AgentRecord record : agents.values()) {
            remove(record, reason);
        }
    }

    private boolean remove(AgentRecord record, String reason) {
        if (!agents.remove(record.getAgentId(), record)) {
            return false;
        }

        log.info("Agent disconnected: {} ({})", record.getAgentId(), reason);
        notifyListeners(record, reason);
        if (record.getConnection().isOpen()) {
            record.getConnection().close(reason);
        }
        auditLogger.logAgentDisconnected(record.getAgentId(), record.getTenantId(), reason);
        metrics.recordAgentDisconnected(reason);
        return true;
    }

    private void notifyListeners(AgentRecord record, String reason) {
        for (AgentDisconnectListener listener : listeners) {
            try {
                listener.onAgentDisconnected(record.getAgentId(), record.getConnection().id(), reason);
            } catch (RuntimeException e) {
                log.error("Disconnect listener failed for agent {}", record.getAgentId(), e);
            }
        }
    }
}
