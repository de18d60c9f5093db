package com.platform.relay.agent;

/**
 * Notified when a specific connection of an agent leaves the registry.
 */
@FunctionalInterface
public interface AgentDisconnectListener {

    void onAgentDisconnected(String agentId, String connectionId, String reason);
}
