package com.platform.relay.agent;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Registry entry for a connected agent. Identity fields are fixed; last-seen time
 * and the reported status change while the connection lives.
 */
@Getter
public class AgentRecord {

    private final String agentId;
    private final String tenantId;
    private final AgentConnection connection;
    private final AgentMetadata metadata;
    private final Instant connectedAt;

    private volatile Instant lastSeenAt;
    private volatile Map<String, Object> status = Map.of();

    AgentRecord(String agentId, String tenantId, AgentConnection connection, AgentMetadata metadata, Instant connectedAt) {
        this.agentId = agentId;
        this.tenantId = tenantId;
        this.connection = connection;
        this.metadata = metadata;
        this.connectedAt = connectedAt;
        this.lastSeenAt = connectedAt;
    }

    void touch(Instant now) {
        this.lastSeenAt = now;
    }

    /**
     * Merge a status report into the current status (later keys win).
     */
    synchronized void mergeStatus(Map<String, Object> update) {
        Map<String, Object> merged = new HashMap<>(status);
        merged.putAll(update);
        this.status = Collections.unmodifiableMap(merged);
    }

    public boolean isConnected() {
        return connection.isOpen();
    }

    public AgentSummary toSummary() {
        return new AgentSummary(
            agentId,
            tenantId,
            metadata.hostname(),
            metadata.platform(),
            metadata.executorVersion(),
            connectedAt,
            lastSeenAt,
            isConnected(),
            status);
    }
}
