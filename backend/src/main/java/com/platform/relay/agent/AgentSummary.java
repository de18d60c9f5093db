package com.platform.relay.agent;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of an agent for API responses.
 */
public record AgentSummary(
    String agentId,
    String tenantId,
    String hostname,
    String platform,
    String executorVersion,
    Instant connectedAt,
    Instant lastSeen,
    boolean connected,
    Map<String, Object> status
) {
}
